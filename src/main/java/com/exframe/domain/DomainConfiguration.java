package com.exframe.domain;

import java.nio.file.Path;

import com.exframe.pattern.PatternStore;

/**
 * Immutable snapshot of one domain. Edits replace the snapshot in the registry,
 * so a query in flight keeps reading the version it started with.
 */
public record DomainConfiguration(
        String domainId,
        String persona,
        Path libraryBasePath,
        boolean enablePatternOverride,
        PatternStore patterns) {

    public DomainConfiguration {
        if (domainId == null || domainId.isBlank()) {
            throw new IllegalArgumentException("domainId must not be blank");
        }
        patterns = patterns == null ? PatternStore.empty() : patterns;
    }
}
