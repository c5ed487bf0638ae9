package com.exframe.query;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

public record QueryResult(
        String domainId,
        String persona,
        String answer,
        String reasoning,
        SourceUsed sourceUsed,
        String patternId,
        List<String> loadedDocuments,
        List<String> truncatedDocuments,
        boolean searchPatternsEnabled,
        boolean showThinking,
        boolean searchDegraded,
        List<QueryState> statesVisited,
        Duration elapsed) {

    public QueryResult {
        loadedDocuments = List.copyOf(loadedDocuments);
        truncatedDocuments = List.copyOf(truncatedDocuments);
        statesVisited = List.copyOf(statesVisited);
    }

    public Optional<String> reasoningText() {
        return Optional.ofNullable(reasoning);
    }

    public boolean patternHit() {
        return sourceUsed == SourceUsed.PATTERN;
    }

    public boolean reached(QueryState state) {
        return statesVisited.contains(state);
    }
}
