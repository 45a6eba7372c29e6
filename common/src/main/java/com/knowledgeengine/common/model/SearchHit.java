package com.knowledgeengine.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

/**
 * Search result handed to callers: the scored document plus a short text snippet.
 */
@Builder
public record SearchHit(
    @JsonProperty("documentId")
    long documentId,

    @JsonProperty("score")
    double score,

    @NotNull
    @JsonProperty("snippet")
    String snippet
) {
    @JsonCreator
    public SearchHit {
        if (snippet == null) {
            throw new IllegalArgumentException("Snippet cannot be null");
        }
    }

    /**
     * Creates a hit from an index result and the document text
     */
    public static SearchHit of(ScoredDocument scored, String text, int snippetLength) {
        return new SearchHit(scored.documentId(), scored.score(), snippet(text, snippetLength));
    }

    /**
     * First {@code length} characters of the text, with "..." appended when cut
     */
    public static String snippet(String text, int length) {
        if (text == null) {
            return "";
        }
        if (text.length() <= length) {
            return text;
        }
        // не разрезаем суррогатную пару
        int end = length > 0 && Character.isHighSurrogate(text.charAt(length - 1)) ? length - 1 : length;
        return text.substring(0, end) + "...";
    }
}
