package com.knowledgeengine.index;

import com.knowledgeengine.common.model.ScoredDocument;
import com.knowledgeengine.index.rebuild.RebuildMode;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Интерфейс для операций с текстовым индексом сходства.
 * Реализации не потокобезопасны: вызывающий код держит один write lock
 * на все изменения и read lock на поиск.
 */
public interface VectorIndex {

    /**
     * Добавить документ в индекс
     * @param documentId неотрицательный ID, ещё не присутствующий в индексе
     * @param text исходный текст документа
     */
    void add(long documentId, String text);

    /**
     * Добавить пачку документов с одной перестройкой словаря
     * @param documentIds ID документов
     * @param texts тексты, в том же порядке
     */
    void addBatch(List<Long> documentIds, List<String> texts);

    /**
     * Удалить документ. Словарь не перестраивается.
     * @param documentId ID документа
     */
    void remove(long documentId);

    /**
     * Заменить текст документа, сохраняя его позицию
     * @param documentId ID документа
     * @param text новый текст
     */
    void update(long documentId, String text);

    /**
     * Поиск k наиболее похожих документов
     * @param query текст запроса
     * @param topK количество результатов, не меньше 1
     * @param allowedIds допустимые ID или null, если ограничения нет
     * @return результаты по убыванию сходства, при равенстве по возрастанию ID
     */
    List<ScoredDocument> search(String query, int topK, Set<Long> allowedIds);

    default List<ScoredDocument> search(String query, int topK) {
        return search(query, topK, null);
    }

    /**
     * Документы, похожие на уже проиндексированный (сам документ исключается)
     */
    List<ScoredDocument> findSimilar(long documentId, int topK);

    boolean contains(long documentId);

    Optional<String> text(long documentId);

    /** ID документов в порядке вставки */
    List<Long> documentIds();

    /** Количество документов */
    int size();

    /** Количество терминов в текущем словаре */
    int vocabularySize();

    RebuildMode mode();

    /** Принудительно перестроить словарь и все строки матрицы */
    void rebuild();

    void clear();
}
