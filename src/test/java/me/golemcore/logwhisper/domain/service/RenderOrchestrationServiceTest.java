package me.golemcore.logwhisper.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.logwhisper.domain.model.BlockType;
import me.golemcore.logwhisper.domain.model.LogEntry;
import me.golemcore.logwhisper.domain.model.LogLevel;
import me.golemcore.logwhisper.domain.model.ParseResult;
import me.golemcore.logwhisper.domain.model.ParseResultSet;
import me.golemcore.logwhisper.domain.model.PluginNotFoundException;
import me.golemcore.logwhisper.infrastructure.config.LogWhisperProperties;
import me.golemcore.logwhisper.plugin.api.RenderContext;
import me.golemcore.logwhisper.plugin.builtin.BuiltinPluginCatalog;
import me.golemcore.logwhisper.plugin.context.PluginRegistryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RenderOrchestrationServiceTest {

    private LineSegmenter segmenter;
    private PluginRegistryService registry;
    private RenderOrchestrationService service;

    @BeforeEach
    void setUp() {
        LogWhisperProperties properties = new LogWhisperProperties();
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        registry = new PluginRegistryService(new BuiltinPluginCatalog(clock, new ObjectMapper()), properties);
        segmenter = new LineSegmenter(properties);
        service = new RenderOrchestrationService(registry);
    }

    @Test
    void shouldRenderMixedLogInLineOrder() {
        String text = "2024-01-15 10:30:45.100 INFO Application started\n"
                + "2024-01-15 10:30:45.200 DEBUG ==>  Preparing: SELECT * FROM users WHERE id = ?\n"
                + "2024-01-15 10:30:45.300 DEBUG ==> Parameters: 42(Long)\n"
                + "2024-01-15 10:30:45.400 INFO Payload {\"ok\": true}\n"
                + "2024-01-15 10:30:45.500 ERROR Connection refused\n";

        ParseResultSet resultSet = service.renderAll("inline", "scope", segmenter.segment(text), "auto");
        List<ParseResult> results = resultSet.getResults();

        assertEquals(5, results.size());
        assertEquals("raw", results.get(0).getRenderedBy());
        assertEquals("sql", results.get(1).getRenderedBy());
        assertTrue(results.get(1).getBlocks().isEmpty());
        assertEquals("SELECT * FROM users WHERE id = 42", results.get(2).getBlocks().get(0).getContent());
        assertEquals(BlockType.JSON, results.get(3).getBlocks().get(0).getBlockType());
        assertEquals(BlockType.ERROR, results.get(4).getBlocks().get(0).getBlockType());
        assertTrue(results.get(4).isError());
        for (int i = 0; i < results.size(); i++) {
            assertEquals(i + 1, results.get(i).getEntry().getLineNumber());
        }
    }

    @Test
    void shouldAggregateStatistics() {
        String text = "2024-01-15 10:30:45 INFO one\n"
                + "2024-01-15 10:30:46 WARN slow response\n"
                + "2024-01-15 10:30:47 ERROR boom\n"
                + "\tat x.Y.z(Y.java:1)\n";

        ParseResultSet resultSet = service.renderAll("inline", "scope", segmenter.segment(text), null);

        assertEquals(3, resultSet.getStats().getTotalEntries());
        assertEquals(4, resultSet.getStats().getTotalLines());
        assertEquals(1, resultSet.getStats().getErrorCount());
        assertEquals(1, resultSet.getStats().getWarningCount());
        assertEquals(1, resultSet.getStats().getLevelCounts().get(LogLevel.ERROR));
        assertEquals(3, resultSet.getStats().getBlockCount());
        assertEquals("auto", resultSet.getPluginName());
    }

    @Test
    void shouldPinEveryEntryToRequestedPlugin() {
        List<LogEntry> entries = segmenter.segment("INFO plain\nINFO {\"a\":1}\n");

        List<ParseResult> results = service.render("scope", entries, "json");

        assertEquals("raw", results.get(0).getRenderedBy());
        assertEquals("json", results.get(1).getRenderedBy());
    }

    @Test
    void shouldRejectUnknownPluginBeforeRendering() {
        List<LogEntry> entries = segmenter.segment("INFO plain\n");

        assertThrows(PluginNotFoundException.class, () -> service.render("scope", entries, "xml"));
    }

    @Test
    void shouldIsolateRendererFailureToOneEntry() {
        PluginRegistryService failing = mock(PluginRegistryService.class);
        LogEntry bad = entry(1, "bad");
        LogEntry good = entry(2, "good");
        when(failing.dispatch(argThat(e -> e != null && e.getLineNumber() == 1), any(RenderContext.class)))
                .thenThrow(new IllegalStateException("renderer exploded"));
        when(failing.dispatch(argThat(e -> e != null && e.getLineNumber() == 2), any(RenderContext.class)))
                .thenReturn(new PluginRegistryService.Dispatch("raw", List.of()));
        RenderOrchestrationService isolated = new RenderOrchestrationService(failing);

        List<ParseResult> results = isolated.render("scope", List.of(bad, good), "auto");

        assertEquals(2, results.size());
        assertEquals(BlockType.ERROR, results.get(0).getBlocks().get(0).getBlockType());
        assertEquals("Render failed", results.get(0).getBlocks().get(0).getTitle());
        assertEquals("IllegalStateException: renderer exploded", results.get(0).getBlocks().get(0).getContent());
        assertEquals("raw", results.get(1).getRenderedBy());
        assertFalse(results.get(1).isError());
        verify(failing).endScope(any(RenderContext.class));
    }

    private static LogEntry entry(int line, String content) {
        return LogEntry.builder()
                .lineNumber(line)
                .lineEnd(line)
                .level(LogLevel.INFO)
                .content(content)
                .rawLine(content + "\n")
                .build();
    }
}
