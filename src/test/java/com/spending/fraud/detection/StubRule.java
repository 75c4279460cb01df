package com.spending.fraud.detection;

/**
 * Rule double whose behaviour is supplied as a lambda.
 */
class StubRule implements DetectionRule {

    @FunctionalInterface
    interface Body {
        int run(DetectionContext context) throws Exception;
    }

    private final String name;
    private final Body body;
    private final boolean requiresGraph;

    StubRule(String name, Body body) {
        this(name, body, false);
    }

    StubRule(String name, Body body, boolean requiresGraph) {
        this.name = name;
        this.body = body;
        this.requiresGraph = requiresGraph;
    }

    static StubRule returning(String name, int alerts) {
        return new StubRule(name, context -> alerts);
    }

    static StubRule throwing(String name, Exception error) {
        return new StubRule(name, context -> {
            throw error;
        });
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String displayName() {
        return "Stub " + name;
    }

    @Override
    public int detect(DetectionContext context) throws Exception {
        return body.run(context);
    }

    @Override
    public boolean requiresGraph() {
        return requiresGraph;
    }
}
