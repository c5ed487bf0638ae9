package com.exframe.pattern;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A single matchable signature. The value is stored normalized, so evaluation
 * only depends on the normalized query.
 */
public record PatternMatcher(MatchKind kind, String value) {
    public static final int NO_MATCH = -1;

    public PatternMatcher {
        Objects.requireNonNull(kind, "kind");
        value = QueryNormalizer.normalize(value);
    }

    public static PatternMatcher substring(String value) {
        return new PatternMatcher(MatchKind.SUBSTRING, value);
    }

    /**
     * Length of the matched text for an already normalized query, or
     * {@link #NO_MATCH}. An empty matcher never matches.
     */
    public int matchLength(String normalizedQuery) {
        if (value.isEmpty()) {
            return NO_MATCH;
        }
        return switch (kind) {
            case SUBSTRING -> normalizedQuery.contains(value) ? value.length() : NO_MATCH;
            case EXACT -> normalizedQuery.equals(value) ? value.length() : NO_MATCH;
            case ALL_WORDS -> allWordsPresent(normalizedQuery) ? value.length() : NO_MATCH;
        };
    }

    private boolean allWordsPresent(String normalizedQuery) {
        Set<String> queryWords = new HashSet<>(Arrays.asList(normalizedQuery.split("[^\\p{L}\\p{N}]+")));
        return Arrays.stream(value.split("[^\\p{L}\\p{N}]+"))
                .filter(word -> !word.isEmpty())
                .allMatch(queryWords::contains);
    }
}
