package com.exframe;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.exframe.inference.ModelInvocationException;
import com.exframe.inference.ModelInvoker;
import com.exframe.runtime.AppConfig;
import com.exframe.search.HttpInternetSearch;
import com.exframe.search.InternetSearch;
import com.exframe.search.UnavailableInternetSearch;

import okhttp3.OkHttpClient;
import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private Path configPath;
    private Path usagePath;

    @BeforeEach
    void setUp() throws Exception {
        originalOut = System.out;
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));

        Path domains = Files.createDirectories(tempDir.resolve("domains"));
        Path geo = Files.createDirectories(domains.resolve("geo"));
        Files.writeString(geo.resolve("domain.json"), "{\"persona\": \"poet\"}");
        Files.writeString(geo.resolve("patterns.json"), """
                {"patterns": [{"id": "p1", "name": "French capital", "solution": "Paris", "triggers": ["capital of France"]}]}
                """);
        Path docs = Files.createDirectories(domains.resolve("docs"));
        Files.createDirectories(docs.resolve("library"));
        Files.writeString(docs.resolve("library/notes.md"), "The archive is kept in the basement.");
        Files.writeString(docs.resolve("domain.json"), "{\"persona\": \"librarian\", \"library_base_path\": \"library\"}");
        Path broken = Files.createDirectories(domains.resolve("broken"));
        Files.writeString(broken.resolve("domain.json"),
                "{\"persona\": \"librarian\", \"library_base_path\": \"does-not-exist\"}");

        usagePath = tempDir.resolve("state/pattern-usage.json");
        configPath = Files.writeString(tempDir.resolve("app.yml"), """
                domainsRoot: %s
                patternUsagePath: %s
                model:
                  provider: offline
                """.formatted(
                        domains.toString().replace('\\', '/'),
                        usagePath.toString().replace('\\', '/')));
    }

    @AfterEach
    void restoreOut() {
        System.setOut(originalOut);
    }

    @Test
    void shouldAnswerFromPatternAndPersistUsage() throws Exception {
        int exitCode = run(new TestMain(), "--domain", "geo", "--query", "What is the capital of France?");

        assertEquals(Main.EXIT_OK, exitCode);
        assertTrue(output().contains("answer> Paris"));
        assertTrue(output().contains("source=pattern pattern=p1"));
        assertTrue(Files.readString(usagePath).contains("\"p1\" : 1"));
    }

    @Test
    void shouldAnswerFromLibraryWithReasoning() {
        int exitCode = run(new TestMain(), "--domain", "docs", "--query", "Where is the archive kept?");

        assertEquals(Main.EXIT_OK, exitCode);
        assertTrue(output().contains("thinking> "));
        assertTrue(output().contains("Grounded evidence: The archive is kept in the basement."));
        assertTrue(output().contains("documents=[notes.md]"));
        assertFalse(Files.exists(usagePath));
    }

    @Test
    void shouldHideReasoningWhenTurnedOff() {
        int exitCode = run(new TestMain(), "--domain", "docs", "--query", "Where is the archive kept?",
                "--show-thinking", "false");

        assertEquals(Main.EXIT_OK, exitCode);
        assertFalse(output().contains("thinking> "));
    }

    @Test
    void shouldRequireQueryText() {
        assertEquals(Main.EXIT_USAGE_ERROR, run(new TestMain(), "--domain", "geo"));
    }

    @Test
    void shouldReportConfigurationErrorForUnknownDomain() {
        assertEquals(Main.EXIT_CONFIGURATION_ERROR, run(new TestMain(), "--domain", "nope", "--query", "hello"));
    }

    @Test
    void shouldReportConfigurationErrorForRejectedDomain() {
        assertEquals(Main.EXIT_CONFIGURATION_ERROR, run(new TestMain(), "--domain", "broken", "--query", "hello"));
    }

    @Test
    void shouldReportConfigurationErrorForMissingDomainsRoot() {
        int exitCode = run(new TestMain(), "--domains-root", tempDir.resolve("missing").toString(),
                "--domain", "geo", "--query", "hello");

        assertEquals(Main.EXIT_CONFIGURATION_ERROR, exitCode);
    }

    @Test
    void shouldReportModelFailure() {
        Main main = new TestMain() {
            @Override
            ModelInvoker createModelInvoker(AppConfig config) {
                return (query, context, showThinking) -> {
                    throw new ModelInvocationException("model offline");
                };
            }
        };

        assertEquals(Main.EXIT_MODEL_FAILURE, run(main, "--domain", "docs", "--query", "anything"));
    }

    @Test
    void shouldReportConfigurationErrorForMalformedConfig() throws Exception {
        Path broken = Files.writeString(tempDir.resolve("broken.yml"), "library: [unclosed\n");

        assertEquals(Main.EXIT_CONFIGURATION_ERROR,
                new CommandLine(new TestMain()).execute("--config", broken.toString(), "--domain", "geo", "--query", "hi"));
    }

    @Test
    void shouldReportConfigurationErrorForInvalidLibraryLimits() throws Exception {
        configPath = writeConfig("""
                library:
                  loadTimeoutMs: 0
                """);

        assertEquals(Main.EXIT_CONFIGURATION_ERROR, run(new TestMain(), "--domain", "geo", "--query", "hi"));
    }

    @Test
    void shouldReportConfigurationErrorForUnknownModelProvider() throws Exception {
        configPath = writeConfig("""
                model:
                  provider: bogus
                """);

        assertEquals(Main.EXIT_CONFIGURATION_ERROR, run(new TestMain(), "--domain", "geo", "--query", "hi"));
    }

    @Test
    void shouldReportConfigurationErrorForMalformedSearchEndpoint() throws Exception {
        configPath = writeConfig("""
                search:
                  endpoint: "not a url"
                """);
        Main main = new Main() {
            @Override
            InternetSearch createInternetSearch(AppConfig config) {
                return new HttpInternetSearch(new OkHttpClient(), config.getSearch().getEndpoint());
            }
        };

        assertEquals(Main.EXIT_CONFIGURATION_ERROR, run(main, "--domain", "geo", "--query", "hi"));
    }

    @Test
    void shouldReportConfigurationErrorForInvalidWorkerCount() throws Exception {
        configPath = writeConfig("""
                dispatch:
                  workerThreads: 0
                """);

        assertEquals(Main.EXIT_CONFIGURATION_ERROR, run(new TestMain(), "--domain", "geo", "--query", "hi"));
    }

    @Test
    void shouldListDomainsAndRejections() {
        int exitCode = run(new TestMain(), "--mode", "domains");

        assertEquals(Main.EXIT_OK, exitCode);
        assertTrue(output().contains("geo persona=poet patternOverride=true patterns=1"));
        assertTrue(output().contains("broken REJECTED"));
    }

    @Test
    void shouldListPatterns() {
        int exitCode = run(new TestMain(), "--mode", "patterns", "--domain", "geo");

        assertEquals(Main.EXIT_OK, exitCode);
        assertTrue(output().contains("p1 French capital [substring:capital of france]"));
    }

    @Test
    void shouldPreviewLibrary() {
        int exitCode = run(new TestMain(), "--mode", "library", "--domain", "docs");

        assertEquals(Main.EXIT_OK, exitCode);
        assertTrue(output().contains("notes.md chars=36"));
    }

    @Test
    void shouldRejectUnknownMode() {
        assertEquals(Main.EXIT_USAGE_ERROR, run(new TestMain(), "--mode", "benchmark"));
    }

    private Path writeConfig(String sections) throws Exception {
        return Files.writeString(tempDir.resolve("override.yml"), """
                domainsRoot: %s
                patternUsagePath: %s
                """.formatted(
                        tempDir.resolve("domains").toString().replace('\\', '/'),
                        usagePath.toString().replace('\\', '/')) + sections);
    }

    private int run(Main main, String... args) {
        String[] withConfig = new String[args.length + 2];
        withConfig[0] = "--config";
        withConfig[1] = configPath.toString();
        System.arraycopy(args, 0, withConfig, 2, args.length);
        return new CommandLine(main).execute(withConfig);
    }

    private String output() {
        return captured.toString(StandardCharsets.UTF_8);
    }

    private static class TestMain extends Main {
        @Override
        InternetSearch createInternetSearch(AppConfig config) {
            return new UnavailableInternetSearch();
        }
    }
}
