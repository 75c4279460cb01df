package com.spending.fraud.detection;

/**
 * A fraud detection rule. Rules read the dataset through the context, may record
 * relationship edges, and raise alerts through the context's alert engine.
 */
public interface DetectionRule {

    /**
     * Registry name, e.g. {@code contract_splitting}.
     */
    String name();

    String displayName();

    /**
     * Runs the rule.
     *
     * @return number of alerts created (duplicates excluded)
     */
    int detect(DetectionContext context) throws Exception;

    /**
     * Rules that read {@link DetectionContext#graph()} return true so the graph is built
     * before any rule of the run starts, from the relationships recorded by earlier runs.
     */
    default boolean requiresGraph() {
        return false;
    }
}
