package com.exframe.pattern;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only set of a domain's patterns. Among all matching matchers the one with
 * the longest matched text wins; equal lengths go to the lowest pattern id.
 * Lookups never mutate the store, so a single instance is shared by concurrent
 * queries.
 */
public final class PatternStore {
    private final Map<String, PatternEntry> entries;

    public PatternStore(List<PatternEntry> patterns) {
        Map<String, PatternEntry> byId = new LinkedHashMap<>();
        patterns.stream()
                .sorted(Comparator.comparing(PatternEntry::id))
                .forEach(entry -> {
                    if (byId.putIfAbsent(entry.id(), entry) != null) {
                        throw new IllegalArgumentException("Duplicate pattern id: " + entry.id());
                    }
                });
        this.entries = Collections.unmodifiableMap(byId);
    }

    public static PatternStore empty() {
        return new PatternStore(List.of());
    }

    public Optional<PatternMatch> lookup(String queryText) {
        String normalized = QueryNormalizer.normalize(queryText);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        PatternMatch best = null;
        for (PatternEntry entry : entries.values()) {
            for (PatternMatcher matcher : entry.matchers()) {
                int length = matcher.matchLength(normalized);
                if (length == PatternMatcher.NO_MATCH) {
                    continue;
                }
                // entries iterate in id order, so only a strictly longer match replaces the current one
                if (best == null || length > best.matchedLength()) {
                    best = new PatternMatch(entry.id(), entry.answer(), matcher, length);
                }
            }
        }
        return Optional.ofNullable(best);
    }

    public Optional<PatternEntry> get(String patternId) {
        return Optional.ofNullable(entries.get(patternId));
    }

    public Collection<PatternEntry> entries() {
        return entries.values();
    }

    public int size() {
        return entries.size();
    }
}
