package me.golemcore.logwhisper.domain.service;

import me.golemcore.logwhisper.domain.model.LogEntry;
import me.golemcore.logwhisper.domain.model.LogLevel;
import me.golemcore.logwhisper.infrastructure.config.LogWhisperProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LineSegmenterTest {

    private LogWhisperProperties properties;
    private LineSegmenter segmenter;

    @BeforeEach
    void setUp() {
        properties = new LogWhisperProperties();
        segmenter = new LineSegmenter(properties);
    }

    // ===== Line splitting =====

    @Test
    void shouldReturnNoEntriesForEmptyInput() {
        assertTrue(segmenter.segment("").isEmpty());
        assertTrue(segmenter.segment((String) null).isEmpty());
    }

    @Test
    void shouldKeepAllTerminatorStylesWhenSplitting() {
        List<String> lines = LineSegmenter.splitLines("a\nb\r\nc\rd");

        assertEquals(List.of("a\n", "b\r\n", "c\r", "d"), lines);
    }

    @Test
    void shouldNumberLinesFromOne() {
        List<LogEntry> entries = segmenter.segment("first\n\nthird\n");

        assertEquals(3, entries.size());
        assertEquals(1, entries.get(0).getLineNumber());
        assertEquals(2, entries.get(1).getLineNumber());
        assertEquals("", entries.get(1).getContent());
        assertEquals(3, entries.get(2).getLineNumber());
    }

    @Test
    void shouldReproduceInputFromRawLines() {
        String text = "2024-01-15 10:30:45.123 ERROR Boom\r\n"
                + "java.lang.IllegalStateException: bad\r\n"
                + "\tat com.example.Foo.bar(Foo.java:10)\r\n"
                + "\r\n"
                + "plain line without terminator";

        String rebuilt = segmenter.segment(text).stream()
                .map(LogEntry::getRawLine)
                .collect(Collectors.joining());

        assertEquals(text, rebuilt);
    }

    // ===== Level detection =====

    @ParameterizedTest
    @CsvSource({
            "2024-01-15 10:30:45 INFO Application started, INFO",
            "2024-01-15 10:30:45 [WARN] Disk almost full, WARN",
            "2024-01-15 10:30:45 WARNING Disk almost full, WARN",
            "TRACE entering method, DEBUG",
            "FATAL out of memory, ERROR",
            "something failed badly, ERROR",
            "just a line, UNKNOWN"
    })
    void shouldDetectLevel(String line, LogLevel expected) {
        assertEquals(expected, LineSegmenter.detectLevel(line));
    }

    @Test
    void shouldPreferStrongestUppercaseToken() {
        assertEquals(LogLevel.ERROR, LineSegmenter.detectLevel("INFO retry loop reported ERROR"));
    }

    @Test
    void shouldPreferUppercaseTokenOverKeywordsInMessage() {
        assertEquals(LogLevel.INFO, LineSegmenter.detectLevel("INFO no error occurred"));
    }

    // ===== Timestamp detection =====

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "2024-01-15 10:30:45.123 INFO x|2024-01-15T10:30:45.123",
            "2024-01-15 10:30:45,123 INFO x|2024-01-15T10:30:45.123",
            "2024-01-15T10:30:45.123 INFO x|2024-01-15T10:30:45.123",
            "2024-01-15T10:30:45 INFO x|2024-01-15T10:30:45",
            "2024-01-15 10:30:45 INFO x|2024-01-15T10:30:45",
            "[2024/01/15 10:30:45] INFO x|2024-01-15T10:30:45"
    })
    void shouldDetectTimestampFormats(String line, String expected) {
        assertEquals(LocalDateTime.parse(expected), LineSegmenter.detectTimestamp(line).orElseThrow());
    }

    @Test
    void shouldLeaveTimestampEmptyWhenAbsent() {
        assertTrue(LineSegmenter.detectTimestamp("no time here").isEmpty());
    }

    @Test
    void shouldLeaveTimestampEmptyWhenDateIsInvalid() {
        assertTrue(LineSegmenter.detectTimestamp("2024-13-45 10:30:45 INFO x").isEmpty());
    }

    // ===== Continuations =====

    @Test
    void shouldFoldStackTraceIntoPreviousEntry() {
        String text = "2024-01-15 10:30:45.123 ERROR Request failed\n"
                + "java.lang.NullPointerException: value\n"
                + "\tat com.example.Service.run(Service.java:42)\n"
                + "\t... 3 more\n"
                + "Caused by: java.io.IOException: closed\n"
                + "2024-01-15 10:30:46.000 INFO Recovered\n";

        List<LogEntry> entries = segmenter.segment(text);

        assertEquals(2, entries.size());
        LogEntry error = entries.get(0);
        assertEquals(1, error.getLineNumber());
        assertEquals(5, error.getLineEnd());
        assertEquals(5, error.getPhysicalLineCount());
        assertEquals(LogLevel.ERROR, error.getLevel());
        assertEquals(LocalDateTime.parse("2024-01-15T10:30:45.123"), error.getTimestamp());
        assertTrue(error.getContent().contains("Caused by: java.io.IOException: closed"));
        assertEquals(6, entries.get(1).getLineNumber());
        assertEquals(LogLevel.INFO, entries.get(1).getLevel());
    }

    @Test
    void shouldNotFoldAcrossBlankLines() {
        List<LogEntry> entries = segmenter.segment("2024-01-15 10:30:45 INFO a\n\n    indented\n");

        assertEquals(3, entries.size());
        assertEquals("", entries.get(1).getContent());
        assertEquals("    indented", entries.get(2).getContent());
    }

    @Test
    void shouldKeepEveryLineSeparateWhenMergingDisabled() {
        properties.getParser().setMergeContinuations(false);

        List<LogEntry> entries = segmenter.segment("2024-01-15 10:30:45 ERROR a\n\tat x.y(Z.java:1)\n");

        assertEquals(2, entries.size());
        assertEquals(2, entries.get(1).getLineNumber());
    }

    @Test
    void shouldTreatLinesWithoutSignatureAsSeparateWhenPreviousHadNone() {
        List<LogEntry> entries = segmenter.segment("plain one\nplain two\n");

        assertEquals(2, entries.size());
    }

    @Test
    void shouldRecognizeEntrySignature() {
        assertTrue(LineSegmenter.hasEntrySignature("2024-01-15 10:30:45 something"));
        assertTrue(LineSegmenter.hasEntrySignature("[2024-01-15 10:30:45] something"));
        assertTrue(LineSegmenter.hasEntrySignature("main WARN something"));
        assertFalse(LineSegmenter.hasEntrySignature("no signature here"));
        assertFalse(LineSegmenter.isContinuation("   ", true));
    }

    // ===== Mid-file segmentation =====

    @Test
    void shouldNumberLinesFromGivenStartWhenSegmentingStream() {
        List<LogEntry> entries = segmenter.segment(Stream.of("INFO a\n", "INFO b\n"), 201);

        assertEquals(2, entries.size());
        assertEquals(201, entries.get(0).getLineNumber());
        assertEquals(202, entries.get(1).getLineNumber());
        assertNull(entries.get(0).getTimestamp());
    }
}
