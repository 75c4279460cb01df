package com.spending.fraud.graph;

/**
 * A node whose degree lies at least z standard deviations above the mean of its kind.
 */
public record DegreeOutlier(NodeId node, int degree, double mean, double stddev) {

    public double zScore() {
        return stddev == 0.0 ? 0.0 : (degree - mean) / stddev;
    }
}
