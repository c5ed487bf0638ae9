package com.exframe.query;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.exframe.domain.DomainConfiguration;
import com.exframe.domain.DomainRegistry;
import com.exframe.exception.ConfigurationException;
import com.exframe.inference.ModelInvoker;
import com.exframe.inference.ModelReply;
import com.exframe.library.LibraryDocument;
import com.exframe.library.LibraryLoader;
import com.exframe.library.LibraryPathException;
import com.exframe.pattern.PatternMatch;
import com.exframe.pattern.PatternUsageRecorder;
import com.exframe.persona.DataSource;
import com.exframe.persona.Persona;
import com.exframe.persona.PersonaCatalog;
import com.exframe.search.InternetSearch;
import com.exframe.search.SearchUnavailableException;

/**
 * Routes a single query: a pattern answer when pattern search is on and a
 * pattern matches, otherwise the persona's data source followed by the model.
 *
 * <p>Holds no per-query state. Domain snapshots, pattern stores and the persona
 * catalog are read-only here, so one instance serves concurrent queries.
 */
public class QueryProcessor {
    private static final Logger log = LoggerFactory.getLogger(QueryProcessor.class);

    private final DomainRegistry domains;
    private final PersonaCatalog personas;
    private final LibraryLoader libraryLoader;
    private final InternetSearch internetSearch;
    private final ModelInvoker modelInvoker;
    private final PatternUsageRecorder usageRecorder;

    public QueryProcessor(DomainRegistry domains,
            PersonaCatalog personas,
            LibraryLoader libraryLoader,
            InternetSearch internetSearch,
            ModelInvoker modelInvoker,
            PatternUsageRecorder usageRecorder) {
        this.domains = domains;
        this.personas = personas;
        this.libraryLoader = libraryLoader;
        this.internetSearch = internetSearch;
        this.modelInvoker = modelInvoker;
        this.usageRecorder = usageRecorder;
    }

    public QueryResult process(QueryRequest request) {
        long started = System.nanoTime();
        List<QueryState> states = new ArrayList<>();
        states.add(QueryState.START);

        DomainConfiguration domain = domains.getDomain(request.domainId());
        Persona persona = resolvePersona(domain);
        boolean searchPatterns = request.searchPatterns() != null
                ? request.searchPatterns()
                : domain.enablePatternOverride();
        boolean showThinking = request.showThinking() != null
                ? request.showThinking()
                : persona.revealReasoningDefault();

        if (searchPatterns) {
            states.add(QueryState.PATTERN_CHECK);
            Optional<PatternMatch> match = domain.patterns().lookup(request.query());
            if (match.isPresent()) {
                states.add(QueryState.PATTERN_HIT);
                states.add(QueryState.DONE);
                PatternMatch hit = match.get();
                usageRecorder.recordHit(domain.domainId(), hit.patternId());
                String reasoning = showThinking
                        ? "Pattern " + hit.patternId() + " matched " + hit.matcher().kind().name().toLowerCase(Locale.ROOT)
                                + " '" + hit.matcher().value() + "'; answer returned without model invocation. "
                                + trace(states, SourceUsed.PATTERN, List.of())
                        : null;
                QueryResult result = new QueryResult(domain.domainId(), persona.name(), hit.answer(), reasoning,
                        SourceUsed.PATTERN, hit.patternId(), List.of(), List.of(), true, showThinking, false,
                        states, elapsedSince(started));
                logRouted(result);
                return result;
            }
        }

        states.add(QueryState.FALLBACK);
        states.add(QueryState.DATA_SOURCE_DISPATCH);
        Retrieval retrieval = retrieve(domain, persona, request.query());

        ModelReply reply = modelInvoker.invoke(request.query(), retrieval.context(), showThinking);
        states.add(QueryState.DONE);
        SourceUsed source = SourceUsed.of(persona.dataSource());
        String reasoning = null;
        if (showThinking) {
            reasoning = reply.reasoningText().orElse(trace(states, source, retrieval.documentIds()));
        }
        QueryResult result = new QueryResult(domain.domainId(), persona.name(), reply.answer(), reasoning,
                source, null, retrieval.documentIds(), retrieval.truncatedIds(), searchPatterns, showThinking,
                retrieval.degraded(), states, elapsedSince(started));
        logRouted(result);
        return result;
    }

    private Persona resolvePersona(DomainConfiguration domain) {
        Persona persona;
        try {
            persona = personas.get(domain.persona());
        } catch (ConfigurationException e) {
            throw new ConfigurationException(domain.domainId(), "persona", e.getMessage(), e);
        }
        if (persona.dataSource() == DataSource.LIBRARY && domain.libraryBasePath() == null) {
            throw new ConfigurationException(domain.domainId(), "library_base_path",
                    "Persona " + persona.name() + " requires library_base_path for domain " + domain.domainId());
        }
        return persona;
    }

    private Retrieval retrieve(DomainConfiguration domain, Persona persona, String query) {
        return switch (persona.dataSource()) {
            case NONE -> Retrieval.empty(false);
            case LIBRARY -> loadLibrary(domain);
            case INTERNET -> searchInternet(domain, query);
        };
    }

    private Retrieval loadLibrary(DomainConfiguration domain) {
        List<LibraryDocument> documents;
        try {
            documents = libraryLoader.load(domain.libraryBasePath());
        } catch (LibraryPathException e) {
            throw new ConfigurationException(domain.domainId(), "library_base_path",
                    "Library for domain " + domain.domainId() + " is misconfigured: " + e.getMessage(), e);
        }
        if (documents.isEmpty()) {
            log.info("query.library empty domain={} base={}", domain.domainId(), domain.libraryBasePath());
        }
        return new Retrieval(
                ContextAssembler.library(documents),
                documents.stream().map(LibraryDocument::identifier).toList(),
                documents.stream().filter(LibraryDocument::truncated).map(LibraryDocument::identifier).toList(),
                false);
    }

    private Retrieval searchInternet(DomainConfiguration domain, String query) {
        try {
            return new Retrieval(internetSearch.search(query), List.of(), List.of(), false);
        } catch (SearchUnavailableException e) {
            log.warn("query.search degraded domain={} reason={}", domain.domainId(), e.getMessage());
            return Retrieval.empty(true);
        }
    }

    private static String trace(List<QueryState> states, SourceUsed source, List<String> documents) {
        return "Route " + states.stream().map(Enum::name).collect(Collectors.joining(" > "))
                + "; source=" + source.key()
                + (documents.isEmpty() ? "" : "; documents=" + documents);
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    private static void logRouted(QueryResult result) {
        log.info("query.routed domain={} persona={} source={} patternId={} documents={} degraded={} elapsedMs={}",
                result.domainId(),
                result.persona(),
                result.sourceUsed().key(),
                result.patternId() == null ? "none" : result.patternId(),
                result.loadedDocuments().size(),
                result.searchDegraded(),
                result.elapsed().toMillis());
    }

    private record Retrieval(String context, List<String> documentIds, List<String> truncatedIds, boolean degraded) {
        static Retrieval empty(boolean degraded) {
            return new Retrieval("", List.of(), List.of(), degraded);
        }
    }
}
