package com.knowledgeengine.main.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One document handed over by the ingestion pipeline: its text and the concepts
 * extracted from it, most relevant first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestRequest {

    private long documentId;

    private String text;

    private List<String> concepts;

    /** Topic name proposed by concept extraction, may be null */
    private String suggestedName;

    private String skillLevel;
}
