package com.exframe.domain;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.exframe.exception.ConfigurationException;
import com.exframe.pattern.PatternFileReader;
import com.exframe.pattern.PatternStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Populates a registry from {@code <root>/<id>/domain.json} and
 * {@code <root>/<id>/patterns.json}. A relative {@code library_base_path} is
 * resolved against the domain's own directory.
 */
public class DomainDirectoryLoader {
    private static final Logger log = LoggerFactory.getLogger(DomainDirectoryLoader.class);
    static final String DEFAULT_PERSONA = "librarian";

    private final ObjectMapper mapper = new ObjectMapper();
    private final PatternFileReader patternReader = new PatternFileReader();

    public LoadReport loadInto(InMemoryDomainRegistry registry, Path domainsRoot) throws IOException {
        if (!Files.isDirectory(domainsRoot)) {
            throw new IOException("Domains root does not exist or is not a directory: " + domainsRoot);
        }
        List<Path> directories = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(domainsRoot, Files::isDirectory)) {
            stream.forEach(directories::add);
        }
        directories.sort(null);

        List<String> loaded = new ArrayList<>();
        Map<String, String> rejected = new LinkedHashMap<>();
        for (Path directory : directories) {
            Path domainFile = directory.resolve("domain.json");
            if (!Files.exists(domainFile)) {
                continue;
            }
            String fallbackId = directory.getFileName().toString();
            try {
                registry.register(read(directory, fallbackId));
                loaded.add(fallbackId);
            } catch (ConfigurationException e) {
                if (registry.rejection(fallbackId).isEmpty()) {
                    registry.reject(fallbackId, e);
                }
                rejected.put(fallbackId, e.getMessage());
            } catch (IOException e) {
                ConfigurationException failure = new ConfigurationException(fallbackId, "domain.json",
                        "Domain " + fallbackId + " could not be read: " + e.getMessage(), e);
                registry.reject(fallbackId, failure);
                rejected.put(fallbackId, failure.getMessage());
                log.warn("domain.rejected id={} reason={}", fallbackId, e.getMessage());
            }
        }
        log.info("domains.loaded root={} loaded={} rejected={}", domainsRoot, loaded.size(), rejected.size());
        return new LoadReport(loaded, rejected);
    }

    DomainConfiguration read(Path directory, String fallbackId) throws IOException {
        JsonNode root = mapper.readTree(directory.resolve("domain.json").toFile());
        String domainId = fallbackId;
        String declaredId = root.path("domain_id").asText(domainId);
        if (!declaredId.equals(domainId)) {
            log.warn("domain.id mismatch directory={} declared={}; using directory name", domainId, declaredId);
        }
        String persona = root.path("persona").asText(DEFAULT_PERSONA);
        boolean enablePatternOverride = root.path("enable_pattern_override").asBoolean(true);

        Path libraryBasePath = null;
        String rawPath = root.path("library_base_path").asText("");
        if (!rawPath.isBlank()) {
            Path configured = Path.of(rawPath);
            libraryBasePath = configured.isAbsolute() ? configured : directory.resolve(configured).normalize();
        }

        PatternStore patterns;
        try {
            patterns = patternReader.read(directory.resolve("patterns.json"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(domainId, "patterns", e.getMessage(), e);
        }
        return new DomainConfiguration(domainId, persona, libraryBasePath, enablePatternOverride, patterns);
    }

    public record LoadReport(List<String> loaded, Map<String, String> rejected) {
    }
}
