package me.golemcore.logwhisper.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.logwhisper.domain.model.BlockType;
import me.golemcore.logwhisper.domain.model.ErrorKind;
import me.golemcore.logwhisper.domain.model.ParseRequest;
import me.golemcore.logwhisper.domain.model.ParseResponse;
import me.golemcore.logwhisper.infrastructure.concurrent.PriorityWorkerPool;
import me.golemcore.logwhisper.infrastructure.config.LogWhisperProperties;
import me.golemcore.logwhisper.plugin.builtin.BuiltinPluginCatalog;
import me.golemcore.logwhisper.plugin.context.PluginRegistryService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogParseServiceTest {

    private static final String SAMPLE = "2024-01-15 10:30:45.100 INFO Application started\n"
            + "2024-01-15 10:30:45.200 DEBUG ==>  Preparing: SELECT name FROM users WHERE id = ?\n"
            + "2024-01-15 10:30:45.300 DEBUG ==> Parameters: 7(Long)\n"
            + "2024-01-15 10:30:45.400 ERROR Lookup failed\n"
            + "java.lang.IllegalStateException: gone\n"
            + "\tat com.example.Repo.find(Repo.java:12)\n";

    @TempDir
    Path tempDir;

    private LogWhisperProperties properties;
    private PriorityWorkerPool workerPool;
    private ParseResultCache resultCache;
    private LogParseService parseService;

    @BeforeEach
    void setUp() {
        properties = new LogWhisperProperties();
        Clock clock = Clock.systemUTC();
        PluginRegistryService registry = new PluginRegistryService(
                new BuiltinPluginCatalog(clock, new ObjectMapper()), properties);
        workerPool = new PriorityWorkerPool(properties);
        resultCache = new ParseResultCache(properties);
        parseService = new LogParseService(
                new LineSegmenter(properties),
                new LogFileReader(properties),
                new RenderOrchestrationService(registry),
                registry,
                resultCache,
                workerPool,
                properties);
    }

    @AfterEach
    void tearDown() {
        workerPool.shutdown();
    }

    // ===== Inline content =====

    @Test
    void shouldParseInlineContent() {
        ParseResponse response = parseService.parse(ParseRequest.ofContent(SAMPLE));

        assertTrue(response.isSuccess());
        assertFalse(response.isCached());
        assertEquals(4, response.getResults().size());
        assertEquals("SELECT name FROM users WHERE id = 7",
                response.getResults().get(2).getBlocks().get(0).getContent());
        assertEquals(BlockType.ERROR, response.getResults().get(3).getBlocks().get(0).getBlockType());
        assertEquals(6, response.getStats().getTotalLines());
        assertEquals(1, response.getStats().getErrorCount());
    }

    @Test
    void shouldReturnCachedResultForSameContent() {
        parseService.parse(ParseRequest.ofContent(SAMPLE));

        ParseResponse second = parseService.parse(ParseRequest.ofContent(SAMPLE));

        assertTrue(second.isSuccess());
        assertTrue(second.isCached());
        assertEquals(1, parseService.getParseCount());
    }

    @Test
    void shouldCacheSeparatelyPerPlugin() {
        parseService.parse(ParseRequest.ofContent(SAMPLE));

        ParseResponse pinned = parseService.parse(ParseRequest.builder().content(SAMPLE).pluginName("raw").build());

        assertFalse(pinned.isCached());
        assertTrue(pinned.getResults().stream().allMatch(result -> "raw".equals(result.getRenderedBy())));
    }

    @Test
    void shouldParseSameContentOnceUnderConcurrentRequests() throws Exception {
        ExecutorService callers = Executors.newFixedThreadPool(4);
        try {
            List<CompletableFuture<ParseResponse>> responses = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                responses.add(CompletableFuture.supplyAsync(
                        () -> parseService.parse(ParseRequest.ofContent(SAMPLE)), callers));
            }
            for (CompletableFuture<ParseResponse> response : responses) {
                assertTrue(response.get(10, TimeUnit.SECONDS).isSuccess());
            }
        } finally {
            callers.shutdownNow();
        }

        assertEquals(1, parseService.getParseCount());
    }

    // ===== Request validation =====

    @Test
    void shouldRejectEmptyRequest() {
        ParseResponse response = parseService.parse(ParseRequest.builder().build());

        assertFalse(response.isSuccess());
        assertEquals(ErrorKind.INPUT, response.getErrorKind());
        assertTrue(response.getResults().isEmpty());
        assertEquals(0, response.getStats().getTotalEntries());
    }

    @Test
    void shouldRejectContentTogetherWithFile() {
        ParseResponse response = parseService.parse(ParseRequest.builder()
                .content("x")
                .filePath("/tmp/app.log")
                .build());

        assertEquals(ErrorKind.INPUT, response.getErrorKind());
        assertEquals("Provide either content or a file path, not both", response.getErrorMessage());
    }

    @Test
    void shouldRejectUnknownPlugin() {
        ParseResponse response = parseService.parse(ParseRequest.builder().content("x").pluginName("xml").build());

        assertEquals(ErrorKind.INPUT, response.getErrorKind());
        assertEquals("Unknown plugin: xml", response.getErrorMessage());
    }

    @Test
    void shouldTreatBlankPluginNameAsAuto() {
        ParseResponse response = parseService.parse(ParseRequest.builder().content(SAMPLE).pluginName(" ").build());

        assertTrue(response.isSuccess());
        assertEquals("sql", response.getResults().get(2).getRenderedBy());
    }

    // ===== Files =====

    @Test
    void shouldParseFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("app.log"), SAMPLE);

        ParseResponse response = parseService.parse(ParseRequest.ofFile(file.toString()));

        assertTrue(response.isSuccess());
        assertEquals(4, response.getResults().size());
    }

    @Test
    void shouldReparseChangedFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("app.log"), SAMPLE);
        Files.setLastModifiedTime(file, FileTime.fromMillis(1_000_000L));
        parseService.parse(ParseRequest.ofFile(file.toString()));

        Files.writeString(file, SAMPLE + "2024-01-15 10:30:46.000 INFO done\n");
        Files.setLastModifiedTime(file, FileTime.fromMillis(2_000_000L));
        ParseResponse response = parseService.parse(ParseRequest.ofFile(file.toString()));

        assertFalse(response.isCached());
        assertEquals(5, response.getResults().size());
        assertEquals(2, parseService.getParseCount());
        assertEquals(1, resultCache.size());
    }

    @Test
    void shouldReportUnsupportedFileAsInputError() throws IOException {
        Path file = Files.writeString(tempDir.resolve("app.bin"), SAMPLE);

        ParseResponse response = parseService.parse(ParseRequest.ofFile(file.toString()));

        assertEquals(ErrorKind.INPUT, response.getErrorKind());
        assertTrue(response.getErrorMessage().contains("Unsupported file type"));
    }

    @Test
    void shouldReportFileTooLargeForWholeParse() throws IOException {
        properties.getFiles().setMaxWholeParseSize(10);
        Path file = Files.writeString(tempDir.resolve("app.log"), SAMPLE);

        ParseResponse response = parseService.parse(ParseRequest.ofFile(file.toString()));

        assertEquals(ErrorKind.INPUT, response.getErrorKind());
        assertTrue(response.getErrorMessage().contains("open it in chunks instead"));
    }
}
