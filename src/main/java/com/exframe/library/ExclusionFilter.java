package com.exframe.library;

import java.util.List;

/**
 * Substring block-list over library paths. A candidate is excluded when any rule
 * occurs in its relative path or in its final segment. Rules are case-sensitive.
 */
public class ExclusionFilter {
    private final List<String> rules;

    public ExclusionFilter(List<String> rules) {
        this.rules = List.copyOf(rules);
    }

    public boolean isExcluded(String path) {
        return isExcluded(path, rules);
    }

    public List<String> rules() {
        return rules;
    }

    public static boolean isExcluded(String path, List<String> rules) {
        if (path == null || path.isBlank()) {
            return true;
        }
        String normalized = path.replace('\\', '/');
        String fileName = fileName(normalized);
        for (String rule : rules) {
            if (rule == null) {
                continue;
            }
            if (path.contains(rule) || normalized.contains(rule) || fileName.contains(rule)) {
                return true;
            }
        }
        return false;
    }

    private static String fileName(String normalizedPath) {
        String trimmed = normalizedPath.endsWith("/")
                ? normalizedPath.substring(0, normalizedPath.length() - 1)
                : normalizedPath;
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }
}
