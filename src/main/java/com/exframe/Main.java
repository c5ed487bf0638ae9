package com.exframe;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.exframe.domain.DomainConfiguration;
import com.exframe.domain.DomainDirectoryLoader;
import com.exframe.domain.InMemoryDomainRegistry;
import com.exframe.exception.ConfigurationException;
import com.exframe.inference.ModelInvocationException;
import com.exframe.inference.ModelInvoker;
import com.exframe.inference.ModelInvokers;
import com.exframe.library.LibraryDocument;
import com.exframe.library.LibraryLoader;
import com.exframe.library.LibraryPathException;
import com.exframe.pattern.PatternEntry;
import com.exframe.pattern.PatternUsageRecorder;
import com.exframe.persona.PersonaCatalog;
import com.exframe.query.QueryDispatcher;
import com.exframe.query.QueryProcessor;
import com.exframe.query.QueryRequest;
import com.exframe.query.QueryResult;
import com.exframe.runtime.AppConfig;
import com.exframe.runtime.AppConfigLoader;
import com.exframe.search.InternetSearch;
import com.exframe.search.InternetSearches;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "exframe-router",
        mixinStandardHelpOptions = true,
        version = "exframe-router 0.1.0",
        description = "Routes domain-scoped questions through stored patterns, local libraries or web search.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE_ERROR = 2;
    static final int EXIT_CONFIGURATION_ERROR = 3;
    static final int EXIT_MODEL_FAILURE = 4;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "query")
    Mode mode;

    @Option(names = "--domains-root", description = "Directory holding <domain>/domain.json; overrides the config value")
    Path domainsRoot;

    @Option(names = { "-d", "--domain" }, description = "Domain id")
    String domainId;

    @Option(names = { "-q", "--query" }, description = "Query text used in query mode")
    String query;

    @Option(names = "--search-patterns", arity = "1", description = "Force pattern search on or off for this query (default: domain setting)")
    Boolean searchPatterns;

    @Option(names = "--show-thinking", arity = "1", description = "Force the reasoning trace on or off for this query (default: persona setting)")
    Boolean showThinking;

    private final OkHttpClient httpClient = new OkHttpClient();

    enum Mode {
        query,
        domains,
        patterns,
        library
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config;
        try {
            config = AppConfigLoader.load(Path.of(configPath));
        } catch (IOException e) {
            log.error("Unable to read config {}: {}", configPath, e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        }
        PersonaCatalog personas;
        try {
            personas = PersonaCatalog.withAdditional(config.additionalPersonas());
        } catch (ConfigurationException | IllegalArgumentException e) {
            log.error("Invalid persona configuration: {}", e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        }

        Path root = domainsRoot != null ? domainsRoot : Path.of(config.getDomainsRoot());
        InMemoryDomainRegistry registry = new InMemoryDomainRegistry(personas);
        DomainDirectoryLoader.LoadReport report;
        try {
            report = new DomainDirectoryLoader().loadInto(registry, root);
        } catch (IOException e) {
            log.error("Unable to load domains from {}: {}", root, e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        }
        log.info("Starting exframe-router in {} mode domainsRoot={} loaded={} rejected={}",
                mode, root, report.loaded().size(), report.rejected().size());

        LibraryLoader libraryLoader;
        try {
            libraryLoader = new LibraryLoader(config.getLibrary().toLimits());
        } catch (IllegalArgumentException e) {
            log.error("Invalid library configuration: {}", e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        }
        return switch (mode) {
            case domains -> listDomains(registry, report);
            case patterns -> listPatterns(registry);
            case library -> previewLibrary(registry, libraryLoader);
            case query -> runQuery(config, registry, personas, libraryLoader);
        };
    }

    private int runQuery(AppConfig config, InMemoryDomainRegistry registry, PersonaCatalog personas,
            LibraryLoader libraryLoader) throws InterruptedException {
        if (domainId == null || domainId.isBlank() || query == null || query.isBlank()) {
            log.error("--domain and --query are required in query mode");
            return EXIT_USAGE_ERROR;
        }
        PatternUsageRecorder usageRecorder = new PatternUsageRecorder();
        QueryDispatcher dispatcher;
        try {
            QueryProcessor processor = new QueryProcessor(
                    registry,
                    personas,
                    libraryLoader,
                    createInternetSearch(config),
                    createModelInvoker(config),
                    usageRecorder);
            dispatcher = new QueryDispatcher(processor, config.getDispatch().getWorkerThreads());
        } catch (IllegalArgumentException e) {
            log.error("Invalid model, search or dispatch configuration: {}", e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        }
        Duration timeout = Duration.ofMillis(config.getLibrary().getLoadTimeoutMs() + config.getModel().getTimeoutMs());

        QueryResult result;
        try (dispatcher) {
            result = dispatcher.execute(new QueryRequest(query, domainId, searchPatterns, showThinking), timeout);
        } catch (ExecutionException e) {
            return exitCodeFor(e.getCause());
        } catch (TimeoutException | CancellationException e) {
            log.error("Query for domain {} did not complete within {} ms", domainId, timeout.toMillis());
            return EXIT_MODEL_FAILURE;
        }

        printResult(result);
        flushUsage(usageRecorder, Path.of(config.getPatternUsagePath()));
        return EXIT_OK;
    }

    private int exitCodeFor(Throwable failure) {
        if (failure instanceof ConfigurationException configurationException) {
            log.error("Configuration error domain={} field={}: {}",
                    configurationException.domainId(), configurationException.field(), failure.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        }
        if (failure instanceof ModelInvocationException) {
            log.error("Model invocation failed: {}", failure.getMessage());
            return EXIT_MODEL_FAILURE;
        }
        log.error("Query failed", failure);
        return EXIT_MODEL_FAILURE;
    }

    private static void printResult(QueryResult result) {
        result.reasoningText().ifPresent(reasoning -> System.out.println("thinking> " + reasoning));
        System.out.println("answer> " + result.answer());
        System.out.printf("source=%s pattern=%s documents=%s elapsedMs=%d%n",
                result.sourceUsed().key(),
                result.patternId() == null ? "none" : result.patternId(),
                result.loadedDocuments(),
                result.elapsed().toMillis());
    }

    private void flushUsage(PatternUsageRecorder usageRecorder, Path usagePath) {
        if (usageRecorder.snapshot().isEmpty()) {
            return;
        }
        try {
            usageRecorder.flush(usagePath);
        } catch (IOException e) {
            log.warn("Unable to persist pattern usage to {}", usagePath, e);
        }
    }

    private int listDomains(InMemoryDomainRegistry registry, DomainDirectoryLoader.LoadReport report) {
        for (String id : registry.domainIds()) {
            DomainConfiguration domain = registry.getDomain(id);
            System.out.printf("%s persona=%s patternOverride=%s patterns=%d library=%s%n",
                    id,
                    domain.persona(),
                    domain.enablePatternOverride(),
                    domain.patterns().size(),
                    domain.libraryBasePath() == null ? "-" : domain.libraryBasePath());
        }
        report.rejected().forEach((id, reason) -> System.out.printf("%s REJECTED %s%n", id, reason));
        return EXIT_OK;
    }

    private int listPatterns(InMemoryDomainRegistry registry) {
        if (domainId == null || domainId.isBlank()) {
            log.error("--domain is required in patterns mode");
            return EXIT_USAGE_ERROR;
        }
        DomainConfiguration domain;
        try {
            domain = registry.getDomain(domainId);
        } catch (ConfigurationException e) {
            log.error("{}", e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        }
        for (PatternEntry entry : domain.patterns().entries()) {
            String matchers = entry.matchers().stream()
                    .map(matcher -> matcher.kind().name().toLowerCase(Locale.ROOT) + ":" + matcher.value())
                    .collect(Collectors.joining(", "));
            System.out.printf("%s %s [%s]%n", entry.id(), entry.name(), matchers);
        }
        return EXIT_OK;
    }

    private int previewLibrary(InMemoryDomainRegistry registry, LibraryLoader libraryLoader) {
        if (domainId == null || domainId.isBlank()) {
            log.error("--domain is required in library mode");
            return EXIT_USAGE_ERROR;
        }
        try {
            DomainConfiguration domain = registry.getDomain(domainId);
            List<LibraryDocument> documents = libraryLoader.load(domain.libraryBasePath());
            for (LibraryDocument document : documents) {
                System.out.printf("%s chars=%d%s%n",
                        document.identifier(),
                        document.content().length(),
                        document.truncated() ? " truncated" : "");
            }
            return EXIT_OK;
        } catch (ConfigurationException | LibraryPathException e) {
            log.error("{}", e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        }
    }

    ModelInvoker createModelInvoker(AppConfig config) {
        return ModelInvokers.fromEnvironment(config.getModel(), httpClient);
    }

    InternetSearch createInternetSearch(AppConfig config) {
        return InternetSearches.fromConfig(config.getSearch(), httpClient);
    }
}
