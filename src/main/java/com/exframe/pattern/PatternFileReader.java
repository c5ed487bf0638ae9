package com.exframe.pattern;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads {@code patterns.json}: either {@code {"patterns": [...]}} or a bare array.
 * Each entry needs an {@code id}; {@code solution} is the canned answer,
 * {@code triggers} are substring matchers and {@code matchers} carry explicit types.
 */
public class PatternFileReader {
    private final ObjectMapper mapper = new ObjectMapper();

    public PatternStore read(Path patternsFile) throws IOException {
        if (!Files.exists(patternsFile) || Files.size(patternsFile) == 0L) {
            return PatternStore.empty();
        }
        JsonNode root = mapper.readTree(patternsFile.toFile());
        JsonNode array = root.isArray() ? root : root.path("patterns");
        if (!array.isArray()) {
            throw new IOException("Unexpected patterns format in " + patternsFile);
        }
        List<PatternEntry> entries = new ArrayList<>();
        for (JsonNode node : array) {
            entries.add(toEntry(node, patternsFile));
        }
        return new PatternStore(entries);
    }

    private PatternEntry toEntry(JsonNode node, Path source) throws IOException {
        String id = node.path("id").asText("");
        if (id.isBlank()) {
            throw new IOException("Pattern without id in " + source);
        }
        List<PatternMatcher> matchers = new ArrayList<>();
        for (JsonNode trigger : node.path("triggers")) {
            matchers.add(PatternMatcher.substring(trigger.asText()));
        }
        for (JsonNode matcher : node.path("matchers")) {
            try {
                matchers.add(new PatternMatcher(
                        MatchKind.fromKey(matcher.path("type").asText(null)),
                        matcher.path("value").asText("")));
            } catch (IllegalArgumentException e) {
                throw new IOException("Pattern " + id + " in " + source + ": " + e.getMessage(), e);
            }
        }
        return new PatternEntry(
                id,
                node.path("name").asText(""),
                node.path("problem").asText(""),
                node.path("solution").asText(""),
                matchers,
                node.path("usage_count").asLong(0L));
    }
}
