package com.knowledgeengine.clustering;

import lombok.Builder;

/**
 * Tunables of a {@link ClusteringEngine}.
 *
 * @param assignmentThreshold minimum boosted score for joining an existing cluster
 * @param nameBoost added to the score when the suggested name equals the cluster name
 * @param maxConcepts representative concepts kept per cluster at creation
 */
@Builder
public record ClusteringSettings(double assignmentThreshold, double nameBoost, int maxConcepts) {

    public static final double DEFAULT_ASSIGNMENT_THRESHOLD = 0.5;
    public static final double DEFAULT_NAME_BOOST = 0.2;
    public static final int DEFAULT_MAX_CONCEPTS = 5;

    public ClusteringSettings {
        if (Double.isNaN(assignmentThreshold) || assignmentThreshold < 0) {
            throw new IllegalArgumentException("Assignment threshold must be non-negative");
        }
        if (Double.isNaN(nameBoost) || nameBoost < 0) {
            throw new IllegalArgumentException("Name boost must be non-negative");
        }
        if (maxConcepts < 1) {
            throw new IllegalArgumentException("Max concepts must be at least 1");
        }
    }

    public static ClusteringSettings defaults() {
        return new ClusteringSettings(DEFAULT_ASSIGNMENT_THRESHOLD, DEFAULT_NAME_BOOST, DEFAULT_MAX_CONCEPTS);
    }
}
