package com.exframe.pattern;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Hit counters kept apart from {@link PatternStore} so lookups stay read-only.
 * Counts accumulate in memory and are merged into a JSON file on {@link #flush(Path)}.
 */
public class PatternUsageRecorder {
    private final Map<String, Map<String, LongAdder>> hits = new ConcurrentHashMap<>();
    private final ObjectMapper mapper = new ObjectMapper();

    public void recordHit(String domainId, String patternId) {
        hits.computeIfAbsent(domainId, unused -> new ConcurrentHashMap<>())
                .computeIfAbsent(patternId, unused -> new LongAdder())
                .increment();
    }

    public long hits(String domainId, String patternId) {
        LongAdder adder = hits.getOrDefault(domainId, Map.of()).get(patternId);
        return adder == null ? 0L : adder.sum();
    }

    public Map<String, Map<String, Long>> snapshot() {
        Map<String, Map<String, Long>> snapshot = new TreeMap<>();
        hits.forEach((domainId, counters) -> {
            Map<String, Long> counts = new TreeMap<>();
            counters.forEach((patternId, adder) -> counts.put(patternId, adder.sum()));
            snapshot.put(domainId, counts);
        });
        return snapshot;
    }

    public Map<String, Map<String, Long>> load(Path path) throws IOException {
        if (!Files.exists(path) || Files.size(path) == 0L) {
            return new TreeMap<>();
        }
        return mapper.readValue(path.toFile(), new TypeReference<TreeMap<String, Map<String, Long>>>() {
        });
    }

    public synchronized Map<String, Map<String, Long>> flush(Path path) throws IOException {
        Map<String, Map<String, Long>> merged = load(path);
        Map<LongAdder, Long> written = new IdentityHashMap<>();
        hits.forEach((domainId, counters) -> counters.forEach((patternId, adder) -> {
            long delta = adder.sum();
            if (delta > 0) {
                written.put(adder, delta);
                merged.computeIfAbsent(domainId, unused -> new TreeMap<>()).merge(patternId, delta, Long::sum);
            }
        }));
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), merged);
        // hits recorded during the write stay in memory for the next flush
        written.forEach((adder, delta) -> adder.add(-delta));
        return merged;
    }
}
