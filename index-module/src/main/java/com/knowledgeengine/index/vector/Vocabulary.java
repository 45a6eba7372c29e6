package com.knowledgeengine.index.vector;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Term to column mapping with per-column inverse document frequency.
 * Columns follow sorted term order, so two builds over the same corpus are identical.
 * Immutable once built.
 */
public final class Vocabulary {

    private static final Vocabulary EMPTY = new Vocabulary(Map.of(), new double[0]);

    private final Map<String, Integer> columns;
    private final double[] idf;

    private Vocabulary(Map<String, Integer> columns, double[] idf) {
        this.columns = columns;
        this.idf = idf;
    }

    public static Vocabulary empty() {
        return EMPTY;
    }

    /**
     * Builds the vocabulary from tokenized documents.
     * Uses smoothed IDF: {@code ln((1 + n) / (1 + df)) + 1}.
     */
    public static Vocabulary build(Collection<List<String>> documents) {
        if (documents.isEmpty()) {
            return EMPTY;
        }

        Map<String, Integer> documentFrequency = new TreeMap<>();
        for (List<String> tokens : documents) {
            Set<String> distinct = new HashSet<>(tokens);
            for (String term : distinct) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
        }

        int n = documents.size();
        Map<String, Integer> columns = new HashMap<>(documentFrequency.size() * 2);
        double[] idf = new double[documentFrequency.size()];
        int column = 0;
        for (Map.Entry<String, Integer> entry : documentFrequency.entrySet()) {
            columns.put(entry.getKey(), column);
            idf[column] = Math.log((1.0 + n) / (1.0 + entry.getValue())) + 1.0;
            column++;
        }
        return new Vocabulary(columns, idf);
    }

    public int size() {
        return idf.length;
    }

    /** Колонка термина или -1 */
    public int column(String term) {
        return columns.getOrDefault(term, -1);
    }

    public double idf(int column) {
        return idf[column];
    }

    /** Термины в порядке колонок */
    public List<String> terms() {
        return List.copyOf(new TreeSet<>(columns.keySet()));
    }

    /**
     * Projects tokens onto this vocabulary as an L2-normalized TF-IDF vector.
     * Unknown terms are dropped.
     */
    public SparseVector vectorize(List<String> tokens) {
        TreeMap<Integer, Integer> termCounts = new TreeMap<>();
        for (String token : tokens) {
            Integer column = columns.get(token);
            if (column != null) {
                termCounts.merge(column, 1, Integer::sum);
            }
        }
        if (termCounts.isEmpty()) {
            return SparseVector.empty();
        }

        int[] indices = new int[termCounts.size()];
        double[] weights = new double[termCounts.size()];
        int i = 0;
        for (Map.Entry<Integer, Integer> entry : termCounts.entrySet()) {
            indices[i] = entry.getKey();
            weights[i] = entry.getValue() * idf[entry.getKey()];
            i++;
        }
        return new SparseVector(indices, weights).normalized();
    }
}
