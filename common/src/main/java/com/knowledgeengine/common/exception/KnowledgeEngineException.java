package com.knowledgeengine.common.exception;

/**
 * Base class for caller-misuse errors raised by the engine.
 * None of these are transient, so none are retried internally.
 */
public class KnowledgeEngineException extends RuntimeException {

    public KnowledgeEngineException(String message) {
        super(message);
    }

    public KnowledgeEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
