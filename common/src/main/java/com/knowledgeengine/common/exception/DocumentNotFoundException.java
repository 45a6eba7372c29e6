package com.knowledgeengine.common.exception;

import lombok.Getter;

@Getter
public class DocumentNotFoundException extends KnowledgeEngineException {

    private final long documentId;

    public DocumentNotFoundException(long documentId) {
        super("Document not found: " + documentId);
        this.documentId = documentId;
    }
}
