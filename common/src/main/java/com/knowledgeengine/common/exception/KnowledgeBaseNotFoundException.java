package com.knowledgeengine.common.exception;

public class KnowledgeBaseNotFoundException extends KnowledgeEngineException {

    public KnowledgeBaseNotFoundException(String knowledgeBaseId) {
        super("Knowledge base not found: " + knowledgeBaseId);
    }
}
