package com.knowledgeengine.index;

import com.google.common.base.Stopwatch;
import com.knowledgeengine.common.exception.DocumentNotFoundException;
import com.knowledgeengine.common.exception.EmptyDocumentException;
import com.knowledgeengine.common.exception.EmptyQueryException;
import com.knowledgeengine.common.model.ScoredDocument;
import com.knowledgeengine.common.similarity.Ranking;
import com.knowledgeengine.index.analysis.TextAnalyzer;
import com.knowledgeengine.index.rebuild.RebuildMode;
import com.knowledgeengine.index.rebuild.RebuildPolicy;
import com.knowledgeengine.index.vector.SparseVector;
import com.knowledgeengine.index.vector.VectorSimilarity;
import com.knowledgeengine.index.vector.Vocabulary;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory TF-IDF index over raw document text.
 *
 * <p>Between rebuilds new or updated documents are projected through the existing
 * vocabulary, so terms first seen after the last rebuild are not searchable until the
 * next one. A rebuild happens on the first document, on every batch, and once
 * {@link IndexSettings#rebuildThreshold()} mutations have accumulated.
 *
 * <p>Not thread-safe.
 */
@Slf4j
public class TfIdfVectorIndex implements VectorIndex {

    private final TextAnalyzer analyzer;
    private final VectorSimilarity vectorSimilarity;
    private final RebuildPolicy rebuildPolicy;

    /** ID → исходный текст, в порядке вставки */
    private final Map<Long, String> corpus = new LinkedHashMap<>();

    /** Строка i матрицы принадлежит документу idOrder[i] */
    private List<Long> idOrder = new ArrayList<>();
    private List<SparseVector> matrix = new ArrayList<>();
    private Vocabulary vocabulary = Vocabulary.empty();

    public TfIdfVectorIndex(IndexSettings settings) {
        this(settings, new TextAnalyzer(), new VectorSimilarity());
    }

    public TfIdfVectorIndex(IndexSettings settings, TextAnalyzer analyzer, VectorSimilarity vectorSimilarity) {
        this.analyzer = analyzer;
        this.vectorSimilarity = vectorSimilarity;
        this.rebuildPolicy = new RebuildPolicy(settings.rebuildThreshold());
        log.debug("Initialized TF-IDF index with rebuildThreshold={}", settings.rebuildThreshold());
    }

    @Override
    public void add(long documentId, String text) {
        requireValidId(documentId);
        if (corpus.containsKey(documentId)) {
            throw new IllegalArgumentException("Document " + documentId + " is already indexed");
        }
        List<String> tokens = tokenizeDocument(documentId, text);

        boolean corpusWasEmpty = corpus.isEmpty();
        corpus.put(documentId, text);
        rebuildPolicy.recordMutation();

        if (rebuildPolicy.shouldRebuild(corpusWasEmpty)) {
            rebuildInternal();
        } else {
            idOrder.add(documentId);
            matrix.add(vocabulary.vectorize(tokens));
            log.debug("ADD (incremental): document {} projected onto {} terms, pending mutations={}",
                    documentId, vocabulary.size(), rebuildPolicy.getMutationsSinceRebuild());
        }
    }

    @Override
    public void addBatch(List<Long> documentIds, List<String> texts) {
        if (documentIds.size() != texts.size()) {
            throw new IllegalArgumentException(String.format(
                    "Batch size mismatch: %d ids, %d texts", documentIds.size(), texts.size()));
        }
        if (documentIds.isEmpty()) {
            log.debug("Empty batch, nothing to index");
            return;
        }

        // validate everything before touching the corpus
        Set<Long> seen = new HashSet<>();
        for (int i = 0; i < documentIds.size(); i++) {
            Long documentId = documentIds.get(i);
            if (documentId == null) {
                throw new IllegalArgumentException("Document id cannot be null");
            }
            requireValidId(documentId);
            if (corpus.containsKey(documentId) || !seen.add(documentId)) {
                throw new IllegalArgumentException("Document " + documentId + " is already indexed");
            }
            tokenizeDocument(documentId, texts.get(i));
        }

        for (int i = 0; i < documentIds.size(); i++) {
            corpus.put(documentIds.get(i), texts.get(i));
        }
        log.info("ADD BATCH: {} documents, corpus size now {}", documentIds.size(), corpus.size());
        rebuildInternal();
    }

    @Override
    public void remove(long documentId) {
        if (corpus.remove(documentId) == null) {
            throw new DocumentNotFoundException(documentId);
        }
        int row = idOrder.indexOf(documentId);
        idOrder.remove(row);
        matrix.remove(row);
        rebuildPolicy.recordMutation();
        log.debug("Removed document {} (row {}), vocabulary left as is", documentId, row);
    }

    @Override
    public void update(long documentId, String text) {
        if (!corpus.containsKey(documentId)) {
            throw new DocumentNotFoundException(documentId);
        }
        List<String> tokens = tokenizeDocument(documentId, text);

        // put on an existing key keeps its insertion slot
        corpus.put(documentId, text);
        rebuildPolicy.recordMutation();

        if (rebuildPolicy.shouldRebuild(false)) {
            rebuildInternal();
        } else {
            int row = idOrder.indexOf(documentId);
            matrix.set(row, vocabulary.vectorize(tokens));
            log.debug("UPDATE (incremental): document {} re-projected in row {}", documentId, row);
        }
    }

    @Override
    public List<ScoredDocument> search(String query, int topK, Set<Long> allowedIds) {
        requireValidTopK(topK);
        if (allowedIds != null && allowedIds.isEmpty()) {
            return List.of();
        }

        List<String> tokens = analyzer.tokenize(query);
        if (tokens.isEmpty()) {
            throw new EmptyQueryException();
        }
        if (matrix.isEmpty()) {
            log.debug("Index is empty, returning no results");
            return List.of();
        }

        SparseVector queryVector = vocabulary.vectorize(tokens);
        List<ScoredDocument> candidates = new ArrayList<>();
        for (int row = 0; row < matrix.size(); row++) {
            Long documentId = idOrder.get(row);
            if (allowedIds != null && !allowedIds.contains(documentId)) {
                continue;
            }
            double score = vectorSimilarity.cosineSimilarity(queryVector, matrix.get(row));
            candidates.add(new ScoredDocument(documentId, score));
        }

        List<ScoredDocument> results = Ranking.topK(candidates, topK);
        log.debug("Search over {} rows ({} candidates) returned {} results",
                matrix.size(), candidates.size(), results.size());
        return results;
    }

    @Override
    public List<ScoredDocument> findSimilar(long documentId, int topK) {
        requireValidTopK(topK);
        int sourceRow = idOrder.indexOf(documentId);
        if (sourceRow < 0) {
            throw new DocumentNotFoundException(documentId);
        }

        SparseVector source = matrix.get(sourceRow);
        List<ScoredDocument> candidates = new ArrayList<>(matrix.size());
        for (int row = 0; row < matrix.size(); row++) {
            if (row == sourceRow) {
                continue;
            }
            double score = vectorSimilarity.cosineSimilarity(source, matrix.get(row));
            candidates.add(new ScoredDocument(idOrder.get(row), score));
        }
        return Ranking.topK(candidates, topK);
    }

    @Override
    public boolean contains(long documentId) {
        return corpus.containsKey(documentId);
    }

    @Override
    public Optional<String> text(long documentId) {
        return Optional.ofNullable(corpus.get(documentId));
    }

    @Override
    public List<Long> documentIds() {
        return List.copyOf(corpus.keySet());
    }

    @Override
    public int size() {
        return corpus.size();
    }

    @Override
    public int vocabularySize() {
        return vocabulary.size();
    }

    @Override
    public RebuildMode mode() {
        return rebuildPolicy.getMode();
    }

    @Override
    public void rebuild() {
        rebuildInternal();
    }

    @Override
    public void clear() {
        corpus.clear();
        idOrder = new ArrayList<>();
        matrix = new ArrayList<>();
        vocabulary = Vocabulary.empty();
        rebuildPolicy.rebuilt();
        log.info("Cleared TF-IDF index");
    }

    /** Строка матрицы для документа (для тестов и диагностики) */
    Optional<SparseVector> row(long documentId) {
        int row = idOrder.indexOf(documentId);
        return row < 0 ? Optional.empty() : Optional.of(matrix.get(row));
    }

    /** Порядок строк матрицы */
    List<Long> rowOrder() {
        return List.copyOf(idOrder);
    }

    /**
     * Re-derives the vocabulary from the whole corpus and reprojects every row.
     * New state is assembled aside and swapped in at the end.
     */
    private void rebuildInternal() {
        Stopwatch stopwatch = Stopwatch.createStarted();

        List<Long> newIdOrder = new ArrayList<>(corpus.size());
        List<List<String>> tokenized = new ArrayList<>(corpus.size());
        for (Map.Entry<Long, String> entry : corpus.entrySet()) {
            newIdOrder.add(entry.getKey());
            tokenized.add(analyzer.tokenize(entry.getValue()));
        }

        Vocabulary newVocabulary = Vocabulary.build(tokenized);
        List<SparseVector> newMatrix = new ArrayList<>(tokenized.size());
        for (List<String> tokens : tokenized) {
            newMatrix.add(newVocabulary.vectorize(tokens));
        }

        vocabulary = newVocabulary;
        idOrder = newIdOrder;
        matrix = newMatrix;
        rebuildPolicy.rebuilt();

        log.info("Rebuilt TF-IDF index: {} documents, {} terms in {}",
                newIdOrder.size(), newVocabulary.size(), stopwatch.stop());
    }

    private List<String> tokenizeDocument(long documentId, String text) {
        if (text == null) {
            throw new IllegalArgumentException("Text of document " + documentId + " cannot be null");
        }
        List<String> tokens = analyzer.tokenize(text);
        if (tokens.isEmpty()) {
            throw new EmptyDocumentException(documentId);
        }
        return tokens;
    }

    private static void requireValidId(long documentId) {
        if (documentId < 0) {
            throw new IllegalArgumentException("Document id cannot be negative: " + documentId);
        }
    }

    private static void requireValidTopK(int topK) {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be at least 1, got " + topK);
        }
    }
}
