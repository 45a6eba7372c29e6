package com.knowledgeengine.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;

import java.util.List;

/**
 * Immutable snapshot of a cluster of topically related documents.
 * Concepts are the normalized names used for matching, most relevant first.
 */
@Builder
public record ClusterInfo(
    @Min(0)
    @JsonProperty("id")
    int id,

    @NotBlank
    @Size(max = 255)
    @JsonProperty("name")
    String name,

    @NotNull
    @JsonProperty("concepts")
    List<String> concepts,

    @NotNull
    @JsonProperty("documentIds")
    List<Long> documentIds,

    @JsonProperty("skillLevel")
    String skillLevel
) {
    @JsonCreator
    public ClusterInfo {
        concepts = concepts == null ? List.of() : List.copyOf(concepts);
        documentIds = documentIds == null ? List.of() : List.copyOf(documentIds);
    }

    /**
     * Number of documents currently assigned
     */
    @JsonProperty("documentCount")
    public int documentCount() {
        return documentIds.size();
    }

    @JsonIgnore
    public boolean contains(long documentId) {
        return documentIds.contains(documentId);
    }
}
