package com.exframe.library;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Rules read from a line-oriented document. Blank lines and lines starting with
 * {@code #} are ignored; every other line, trimmed, is one substring rule.
 */
public record ExclusionRules(List<String> rules) {
    public ExclusionRules {
        rules = List.copyOf(rules);
    }

    public static ExclusionRules none() {
        return new ExclusionRules(List.of());
    }

    public static ExclusionRules parse(List<String> lines) {
        List<String> parsed = new ArrayList<>();
        for (String line : lines) {
            String trimmed = line == null ? "" : line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            parsed.add(trimmed);
        }
        return new ExclusionRules(parsed);
    }

    public static ExclusionRules load(Path document) throws IOException {
        if (!Files.exists(document)) {
            return none();
        }
        return parse(Files.readAllLines(document, StandardCharsets.UTF_8));
    }

    public ExclusionRules merge(List<String> additional) {
        LinkedHashSet<String> merged = new LinkedHashSet<>(rules);
        for (String rule : additional) {
            if (rule != null && !rule.isBlank()) {
                merged.add(rule.strip());
            }
        }
        return new ExclusionRules(new ArrayList<>(merged));
    }

    public ExclusionFilter toFilter() {
        return new ExclusionFilter(rules);
    }
}
