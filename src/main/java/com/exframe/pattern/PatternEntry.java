package com.exframe.pattern;

import java.util.List;

public record PatternEntry(
        String id,
        String name,
        String problem,
        String answer,
        List<PatternMatcher> matchers,
        long usageCount) {

    public PatternEntry {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Pattern id must not be blank");
        }
        name = name == null ? "" : name;
        problem = problem == null ? "" : problem;
        answer = answer == null ? "" : answer;
        matchers = matchers == null ? List.of() : List.copyOf(matchers);
    }
}
