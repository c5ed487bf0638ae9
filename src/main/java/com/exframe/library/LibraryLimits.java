package com.exframe.library;

import java.time.Duration;
import java.util.List;

public record LibraryLimits(
        int maxDocuments,
        int maxCharsPerDocument,
        int maxFilesScanned,
        Duration loadTimeout,
        String exclusionFileName,
        List<String> exclusionRules,
        List<String> includeExtensions) {

    public static final int DEFAULT_MAX_DOCUMENTS = 50;
    public static final int DEFAULT_MAX_CHARS_PER_DOCUMENT = 50_000;
    public static final int DEFAULT_MAX_FILES_SCANNED = 10_000;
    public static final Duration DEFAULT_LOAD_TIMEOUT = Duration.ofSeconds(10);
    public static final String DEFAULT_EXCLUSION_FILE_NAME = "ignored.md";

    public LibraryLimits {
        if (maxDocuments < 0 || maxCharsPerDocument < 0) {
            throw new IllegalArgumentException("Library caps must not be negative");
        }
        if (maxFilesScanned <= 0) {
            throw new IllegalArgumentException("maxFilesScanned must be positive");
        }
        if (loadTimeout == null || loadTimeout.isNegative() || loadTimeout.isZero()) {
            throw new IllegalArgumentException("loadTimeout must be positive");
        }
        exclusionFileName = exclusionFileName == null || exclusionFileName.isBlank()
                ? DEFAULT_EXCLUSION_FILE_NAME
                : exclusionFileName;
        exclusionRules = exclusionRules == null ? List.of() : List.copyOf(exclusionRules);
        includeExtensions = includeExtensions == null ? List.of() : List.copyOf(includeExtensions);
    }

    public static LibraryLimits defaults() {
        return new LibraryLimits(
                DEFAULT_MAX_DOCUMENTS,
                DEFAULT_MAX_CHARS_PER_DOCUMENT,
                DEFAULT_MAX_FILES_SCANNED,
                DEFAULT_LOAD_TIMEOUT,
                DEFAULT_EXCLUSION_FILE_NAME,
                List.of(),
                List.of());
    }

    public LibraryLimits withCaps(int documents, int charsPerDocument) {
        return new LibraryLimits(documents, charsPerDocument, maxFilesScanned, loadTimeout,
                exclusionFileName, exclusionRules, includeExtensions);
    }

    public LibraryLimits withExclusionRules(List<String> rules) {
        return new LibraryLimits(maxDocuments, maxCharsPerDocument, maxFilesScanned, loadTimeout,
                exclusionFileName, rules, includeExtensions);
    }

    public LibraryLimits withScanCeiling(int filesScanned, Duration timeout) {
        return new LibraryLimits(maxDocuments, maxCharsPerDocument, filesScanned, timeout,
                exclusionFileName, exclusionRules, includeExtensions);
    }

    public LibraryLimits withIncludeExtensions(List<String> extensions) {
        return new LibraryLimits(maxDocuments, maxCharsPerDocument, maxFilesScanned, loadTimeout,
                exclusionFileName, exclusionRules, extensions);
    }
}
