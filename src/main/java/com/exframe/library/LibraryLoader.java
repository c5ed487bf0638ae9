package com.exframe.library;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a bounded, filtered prefix of a local document library.
 *
 * <p>Files are visited depth-first with directory entries sorted by name, so two
 * loads over an unchanged tree return the same identifiers in the same order.
 * Excluded files are never opened. Once {@code maxDocuments} files have been
 * accepted the walk stops without touching the remaining entries.
 */
public class LibraryLoader {
    private static final Logger log = LoggerFactory.getLogger(LibraryLoader.class);
    private static final int READ_BUFFER_CHARS = 8192;

    private final LibraryLimits limits;
    private final LongSupplier nanoClock;

    public LibraryLoader(LibraryLimits limits) {
        this(limits, System::nanoTime);
    }

    LibraryLoader(LibraryLimits limits, LongSupplier nanoClock) {
        this.limits = limits;
        this.nanoClock = nanoClock;
    }

    public LibraryLimits limits() {
        return limits;
    }

    public List<LibraryDocument> load(Path basePath) throws LibraryPathException {
        return load(basePath, limits.maxDocuments(), limits.maxCharsPerDocument());
    }

    public List<LibraryDocument> load(Path basePath, int maxDocuments, int maxCharsPerDocument)
            throws LibraryPathException {
        if (basePath == null) {
            throw new LibraryPathException(Path.of(""), "Library base path is not set");
        }
        if (!Files.isDirectory(basePath) || !Files.isReadable(basePath)) {
            throw new LibraryPathException(basePath, "Library base path does not exist or is not a readable directory");
        }
        Path realBase;
        try {
            realBase = basePath.toRealPath();
        } catch (IOException e) {
            throw new LibraryPathException(basePath, "Library base path cannot be resolved", e);
        }

        ExclusionFilter filter = loadRules(realBase).toFilter();
        Walk walk = new Walk(realBase, filter, maxDocuments, maxCharsPerDocument,
                nanoClock.getAsLong() + limits.loadTimeout().toNanos());
        if (maxDocuments > 0) {
            walk.visitDirectory(realBase, true);
        }
        log.debug("library.loaded base={} accepted={} scanned={} excluded={}",
                realBase, walk.documents.size(), walk.scanned, walk.excluded);
        return List.copyOf(walk.documents);
    }

    ExclusionRules loadRules(Path realBase) throws LibraryPathException {
        Path ruleDocument = realBase.resolve(limits.exclusionFileName());
        try {
            return ExclusionRules.load(ruleDocument).merge(limits.exclusionRules());
        } catch (IOException e) {
            throw new LibraryPathException(ruleDocument, "Exclusion rule document exists but cannot be read", e);
        }
    }

    private boolean included(String fileName) {
        if (limits.includeExtensions().isEmpty()) {
            return true;
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        return limits.includeExtensions().stream()
                .map(extension -> extension.toLowerCase(Locale.ROOT))
                .anyMatch(lower::endsWith);
    }

    static LibraryDocument readPrefix(String identifier, Path file, int maxChars) throws IOException {
        StringBuilder builder = new StringBuilder();
        char[] buffer = new char[READ_BUFFER_CHARS];
        try (Reader reader = new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8)) {
            int remaining = maxChars + 1;
            while (remaining > 0) {
                int read = reader.read(buffer, 0, Math.min(buffer.length, remaining));
                if (read == -1) {
                    break;
                }
                builder.append(buffer, 0, read);
                remaining -= read;
            }
        }
        boolean truncated = builder.length() > maxChars;
        if (truncated) {
            int end = maxChars;
            // never split a surrogate pair
            if (end > 0 && Character.isHighSurrogate(builder.charAt(end - 1))) {
                end--;
            }
            builder.setLength(end);
        }
        return new LibraryDocument(identifier, builder.toString(), truncated);
    }

    private final class Walk {
        private final Path realBase;
        private final ExclusionFilter filter;
        private final int maxDocuments;
        private final int maxCharsPerDocument;
        private final long deadlineNanos;
        private final List<LibraryDocument> documents = new ArrayList<>();
        private int scanned;
        private int excluded;

        private Walk(Path realBase, ExclusionFilter filter, int maxDocuments, int maxCharsPerDocument,
                long deadlineNanos) {
            this.realBase = realBase;
            this.filter = filter;
            this.maxDocuments = maxDocuments;
            this.maxCharsPerDocument = maxCharsPerDocument;
            this.deadlineNanos = deadlineNanos;
        }

        private boolean full() {
            return documents.size() >= maxDocuments;
        }

        private void visitDirectory(Path directory, boolean root) throws LibraryPathException {
            List<Path> entries = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
                for (Path entry : stream) {
                    entries.add(entry);
                    checkCeilings(scanned + entries.size());
                }
            } catch (LibraryLoadTimeoutException e) {
                throw e;
            } catch (IOException e) {
                if (root) {
                    throw new LibraryPathException(directory, "Library base path is not readable", e);
                }
                log.warn("library.skip unreadable directory under {}", realBase);
                return;
            }
            entries.sort(Comparator.comparing(entry -> entry.getFileName().toString()));

            for (Path entry : entries) {
                if (full()) {
                    return;
                }
                checkpoint();
                scanned++;
                String relative = relative(entry);

                if (Files.isSymbolicLink(entry)) {
                    visitLink(entry, relative);
                } else if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    if (filter.isExcluded(relative)) {
                        excluded++;
                        log.debug("library.exclude directory={}", relative);
                        continue;
                    }
                    visitDirectory(entry, false);
                } else if (Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)) {
                    visitFile(entry, relative);
                }
            }
        }

        private void visitLink(Path link, String relative) {
            Path target;
            try {
                target = link.toRealPath();
            } catch (IOException e) {
                excluded++;
                log.debug("library.exclude unresolvable={}", relative);
                return;
            }
            if (Files.isDirectory(target) || !target.startsWith(realBase)) {
                excluded++;
                log.debug("library.exclude link={}", relative);
                return;
            }
            visitFile(link, relative);
        }

        private void visitFile(Path file, String relative) {
            if (relative.equals(limits.exclusionFileName())) {
                return;
            }
            if (filter.isExcluded(relative)) {
                excluded++;
                log.debug("library.exclude file={}", relative);
                return;
            }
            if (!included(file.getFileName().toString())) {
                return;
            }
            try {
                LibraryDocument document = readPrefix(relative, file, maxCharsPerDocument);
                if (document.truncated()) {
                    log.debug("library.truncate file={} maxChars={}", relative, maxCharsPerDocument);
                }
                documents.add(document);
            } catch (IOException e) {
                log.warn("library.skip unreadable file={} cause={}", relative, e.getClass().getSimpleName());
            }
        }

        private void checkpoint() throws LibraryLoadTimeoutException {
            checkCeilings(scanned + 1);
        }

        /** Fails once {@code entriesSeen} passes the scan ceiling or the deadline has passed. */
        private void checkCeilings(int entriesSeen) throws LibraryLoadTimeoutException {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Library load abandoned under " + realBase);
            }
            if (entriesSeen > limits.maxFilesScanned()) {
                throw new LibraryLoadTimeoutException(realBase,
                        "Library scan exceeded " + limits.maxFilesScanned() + " entries");
            }
            if (nanoClock.getAsLong() - deadlineNanos > 0) {
                throw new LibraryLoadTimeoutException(realBase,
                        "Library scan exceeded " + limits.loadTimeout().toMillis() + " ms");
            }
        }

        private String relative(Path entry) {
            return realBase.relativize(entry).toString().replace('\\', '/');
        }
    }
}
