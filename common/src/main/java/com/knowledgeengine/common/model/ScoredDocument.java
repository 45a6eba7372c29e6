package com.knowledgeengine.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;

/**
 * A document id paired with its cosine similarity to a query.
 */
public record ScoredDocument(
    @Min(0)
    @JsonProperty("documentId")
    long documentId,

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @JsonProperty("score")
    double score
) {
    @JsonCreator
    public ScoredDocument {
        if (documentId < 0) {
            throw new IllegalArgumentException("Document id cannot be negative");
        }
        if (Double.isNaN(score) || score < 0 || score > 1) {
            throw new IllegalArgumentException("Score must be between 0 and 1");
        }
    }
}
