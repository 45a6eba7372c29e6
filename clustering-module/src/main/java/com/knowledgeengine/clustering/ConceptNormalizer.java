package com.knowledgeengine.clustering;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Brings concept names and cluster names to the form used for set comparison:
 * NFKC, trimmed, lower-cased. "Docker", " docker " and "ＤＯＣＫＥＲ" are the same concept.
 */
public final class ConceptNormalizer {

    private ConceptNormalizer() {
    }

    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return Normalizer.normalize(value, Normalizer.Form.NFKC).strip().toLowerCase(Locale.ROOT);
    }

    /**
     * Normalizes every concept, dropping blanks and later duplicates.
     * The caller's order (most relevant first) is preserved.
     */
    public static List<String> normalizeAll(Collection<String> concepts) {
        if (concepts == null || concepts.isEmpty()) {
            return List.of();
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String concept : concepts) {
            String normalized = normalize(concept);
            if (!normalized.isEmpty()) {
                distinct.add(normalized);
            }
        }
        return new ArrayList<>(distinct);
    }
}
