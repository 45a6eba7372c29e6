package com.knowledgeengine.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;

import java.util.List;

/**
 * A document together with the documents that are near-duplicates of it.
 * Duplicates are ordered by descending similarity to the primary document.
 */
@Builder
public record DuplicateGroup(
    @Min(0)
    @JsonProperty("primaryDocumentId")
    long primaryDocumentId,

    @NotEmpty
    @JsonProperty("duplicates")
    List<ScoredDocument> duplicates
) {
    @JsonCreator
    public DuplicateGroup {
        if (duplicates == null || duplicates.isEmpty()) {
            throw new IllegalArgumentException("Duplicate group must contain at least one duplicate");
        }
        duplicates = List.copyOf(duplicates);
    }

    /**
     * Primary document plus its duplicates
     */
    @JsonProperty("groupSize")
    public int groupSize() {
        return duplicates.size() + 1;
    }
}
