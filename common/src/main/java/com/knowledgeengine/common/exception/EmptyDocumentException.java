package com.knowledgeengine.common.exception;

/** Документ не содержит ни одного токена после нормализации */
public class EmptyDocumentException extends KnowledgeEngineException {

    public EmptyDocumentException(long documentId) {
        super("Document " + documentId + " has no indexable tokens");
    }
}
