package com.knowledgeengine.index.vector;

public class VectorSimilarity {

    /**
     * Вычислить косинусное сходство между разреженными векторами.
     * Weights are non-negative, so the result is clamped into [0, 1] against rounding drift.
     */
    public double cosineSimilarity(SparseVector vector1, SparseVector vector2) {
        double normA = vector1.norm();
        double normB = vector2.norm();

        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }

        double similarity = vector1.dot(vector2) / (normA * normB);
        return Math.max(0.0, Math.min(1.0, similarity));
    }
}
