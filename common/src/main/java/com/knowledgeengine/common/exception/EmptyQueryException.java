package com.knowledgeengine.common.exception;

/** Запрос пуст после нормализации, а фильтр по id не задан */
public class EmptyQueryException extends KnowledgeEngineException {

    public EmptyQueryException() {
        super("Query has no searchable tokens");
    }
}
