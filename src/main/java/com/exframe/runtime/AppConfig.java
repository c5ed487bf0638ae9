package com.exframe.runtime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.exframe.library.LibraryLimits;
import com.exframe.persona.DataSource;
import com.exframe.persona.Persona;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private String domainsRoot = "domains";
    private String patternUsagePath = ".exframe/pattern-usage.json";
    private LibraryConfig library = new LibraryConfig();
    private ModelConfig model = new ModelConfig();
    private SearchConfig search = new SearchConfig();
    private DispatchConfig dispatch = new DispatchConfig();
    private List<PersonaConfig> personas = new ArrayList<>();

    public String getDomainsRoot() {
        return domainsRoot;
    }

    public void setDomainsRoot(String domainsRoot) {
        this.domainsRoot = domainsRoot;
    }

    public String getPatternUsagePath() {
        return patternUsagePath;
    }

    public void setPatternUsagePath(String patternUsagePath) {
        this.patternUsagePath = patternUsagePath;
    }

    public LibraryConfig getLibrary() {
        return library;
    }

    public void setLibrary(LibraryConfig library) {
        this.library = library == null ? new LibraryConfig() : library;
    }

    public ModelConfig getModel() {
        return model;
    }

    public void setModel(ModelConfig model) {
        this.model = model == null ? new ModelConfig() : model;
    }

    public SearchConfig getSearch() {
        return search;
    }

    public void setSearch(SearchConfig search) {
        this.search = search == null ? new SearchConfig() : search;
    }

    public DispatchConfig getDispatch() {
        return dispatch;
    }

    public void setDispatch(DispatchConfig dispatch) {
        this.dispatch = dispatch == null ? new DispatchConfig() : dispatch;
    }

    public List<PersonaConfig> getPersonas() {
        return personas;
    }

    public void setPersonas(List<PersonaConfig> personas) {
        this.personas = personas == null ? new ArrayList<>() : personas;
    }

    public List<Persona> additionalPersonas() {
        return personas.stream()
                .map(row -> new Persona(row.getName(), DataSource.fromKey(row.getDataSource()), row.isRevealReasoning()))
                .toList();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LibraryConfig {
        private int maxDocuments = LibraryLimits.DEFAULT_MAX_DOCUMENTS;
        private int maxCharsPerDocument = LibraryLimits.DEFAULT_MAX_CHARS_PER_DOCUMENT;
        private int maxFilesScanned = LibraryLimits.DEFAULT_MAX_FILES_SCANNED;
        private long loadTimeoutMs = LibraryLimits.DEFAULT_LOAD_TIMEOUT.toMillis();
        private String exclusionFileName = LibraryLimits.DEFAULT_EXCLUSION_FILE_NAME;
        private List<String> exclusionRules = new ArrayList<>();
        private List<String> includeExtensions = new ArrayList<>();

        public int getMaxDocuments() {
            return maxDocuments;
        }

        public void setMaxDocuments(int maxDocuments) {
            this.maxDocuments = maxDocuments;
        }

        public int getMaxCharsPerDocument() {
            return maxCharsPerDocument;
        }

        public void setMaxCharsPerDocument(int maxCharsPerDocument) {
            this.maxCharsPerDocument = maxCharsPerDocument;
        }

        public int getMaxFilesScanned() {
            return maxFilesScanned;
        }

        public void setMaxFilesScanned(int maxFilesScanned) {
            this.maxFilesScanned = maxFilesScanned;
        }

        public long getLoadTimeoutMs() {
            return loadTimeoutMs;
        }

        public void setLoadTimeoutMs(long loadTimeoutMs) {
            this.loadTimeoutMs = loadTimeoutMs;
        }

        public String getExclusionFileName() {
            return exclusionFileName;
        }

        public void setExclusionFileName(String exclusionFileName) {
            this.exclusionFileName = exclusionFileName;
        }

        public List<String> getExclusionRules() {
            return exclusionRules;
        }

        public void setExclusionRules(List<String> exclusionRules) {
            this.exclusionRules = exclusionRules == null ? new ArrayList<>() : exclusionRules;
        }

        public List<String> getIncludeExtensions() {
            return includeExtensions;
        }

        public void setIncludeExtensions(List<String> includeExtensions) {
            this.includeExtensions = includeExtensions == null ? new ArrayList<>() : includeExtensions;
        }

        public LibraryLimits toLimits() {
            return new LibraryLimits(
                    maxDocuments,
                    maxCharsPerDocument,
                    maxFilesScanned,
                    Duration.ofMillis(loadTimeoutMs),
                    exclusionFileName,
                    exclusionRules,
                    includeExtensions);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelConfig {
        private String provider = "offline";
        private String baseUrl = "https://api.openai.com/v1";
        private String model = "glm-4.7";
        private String apiKeyEnv = "OPENAI_API_KEY";
        private double temperature = 0.7;
        private int maxTokens = 8192;
        private long timeoutMs = 180_000;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SearchConfig {
        private String endpoint = "";
        private long timeoutMs = 10_000;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DispatchConfig {
        private int workerThreads = 4;

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PersonaConfig {
        private String name;
        private String dataSource = "none";
        private boolean revealReasoning;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDataSource() {
            return dataSource;
        }

        public void setDataSource(String dataSource) {
            this.dataSource = dataSource;
        }

        public boolean isRevealReasoning() {
            return revealReasoning;
        }

        public void setRevealReasoning(boolean revealReasoning) {
            this.revealReasoning = revealReasoning;
        }
    }
}
