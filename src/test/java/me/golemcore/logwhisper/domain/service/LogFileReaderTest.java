package me.golemcore.logwhisper.domain.service;

import me.golemcore.logwhisper.domain.model.FileFingerprint;
import me.golemcore.logwhisper.domain.model.LogInputException;
import me.golemcore.logwhisper.infrastructure.config.LogWhisperProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogFileReaderTest {

    @TempDir
    Path tempDir;

    private LogWhisperProperties properties;
    private LogFileReader reader;

    @BeforeEach
    void setUp() {
        properties = new LogWhisperProperties();
        reader = new LogFileReader(properties);
    }

    // ===== Validation =====

    @Test
    void shouldRejectBlankPath() {
        LogInputException ex = assertThrows(LogInputException.class, () -> reader.validate(" "));
        assertEquals("File path is required", ex.getMessage());
    }

    @Test
    void shouldRejectMissingFile() {
        String missing = tempDir.resolve("missing.log").toString();

        LogInputException ex = assertThrows(LogInputException.class, () -> reader.validate(missing));
        assertTrue(ex.getMessage().startsWith("File not found"));
    }

    @Test
    void shouldRejectDirectory() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("logs.log"));

        LogInputException ex = assertThrows(LogInputException.class, () -> reader.validate(dir.toString()));
        assertTrue(ex.getMessage().startsWith("Not a file"));
    }

    @Test
    void shouldRejectUnsupportedExtension() throws IOException {
        Path file = write("app.exe", "x");

        LogInputException ex = assertThrows(LogInputException.class, () -> reader.validate(file.toString()));
        assertTrue(ex.getMessage().contains("Unsupported file type 'exe'"));
    }

    @Test
    void shouldAcceptSupportedExtensionCaseInsensitively() throws IOException {
        Path file = write("APP.LOG", "x");

        assertEquals(file.toAbsolutePath().normalize(), reader.validate(file.toString()));
    }

    @Test
    void shouldRejectFileAboveSizeCeiling() throws IOException {
        properties.getFiles().setMaxFileSize(4);
        Path file = write("big.log", "12345");

        LogInputException ex = assertThrows(LogInputException.class, () -> reader.validate(file.toString()));
        assertTrue(ex.getMessage().startsWith("File too large"));
    }

    @Test
    void shouldRejectWholeParseAboveCeiling() throws IOException {
        properties.getFiles().setMaxWholeParseSize(4);
        Path file = write("big.log", "12345");

        LogInputException ex = assertThrows(LogInputException.class, () -> reader.readContent(file));
        assertTrue(ex.getMessage().contains("open it in chunks instead"));
    }

    // ===== Fingerprints =====

    @Test
    void shouldChangeFingerprintWhenFileIsModified() throws IOException {
        Path file = write("app.log", "one\n");
        Files.setLastModifiedTime(file, FileTime.fromMillis(1_000_000L));
        FileFingerprint before = reader.fingerprint(file);

        Files.writeString(file, "one\ntwo\n");
        Files.setLastModifiedTime(file, FileTime.fromMillis(2_000_000L));
        FileFingerprint after = reader.fingerprint(file);

        assertNotEquals(before, after);
        assertEquals(8, after.size());
        assertFalse(after.isInline());
    }

    @Test
    void shouldFingerprintContentByDigest() {
        FileFingerprint first = LogFileReader.fingerprintContent("hello");
        FileFingerprint second = LogFileReader.fingerprintContent("hello");
        FileFingerprint other = LogFileReader.fingerprintContent("hellO");

        assertEquals(first, second);
        assertNotEquals(first, other);
        assertTrue(first.isInline());
        assertEquals(64, first.contentHash().length());
    }

    // ===== Line index =====

    @Test
    void shouldCountLinesWithMixedTerminators() throws IOException {
        Path file = write("mixed.log", "a\nb\r\nc\rd");

        LogFileReader.LineIndex index = reader.indexLines(file, 2);

        assertEquals(4, index.totalLines());
        assertArrayEquals(new long[] { 0L, 5L }, index.offsets());
    }

    @Test
    void shouldCountEmptyFileAsZeroLines() throws IOException {
        Path file = write("empty.log", "");

        assertEquals(0, reader.indexLines(file, 10).totalLines());
    }

    @Test
    void shouldReadLineRangeFromIndexedOffset() throws IOException {
        StringBuilder content = new StringBuilder();
        for (int i = 1; i <= 25; i++) {
            content.append("line ").append(i).append('\n');
        }
        Path file = write("range.log", content.toString());
        LogFileReader.LineIndex index = reader.indexLines(file, 10);

        List<String> lines = reader.readLines(file, index, 12, 14);

        assertEquals(List.of("line 12\n", "line 13\n", "line 14\n"), lines);
    }

    @Test
    void shouldKeepTerminatorsAndDecodeUtf8WhenReadingLines() throws IOException {
        Path file = write("utf.log", "héllo\r\nwörld\rend");
        LogFileReader.LineIndex index = reader.indexLines(file, 1);

        List<String> lines = reader.readLines(file, index, 1, 3);

        assertEquals(List.of("héllo\r\n", "wörld\r", "end"), lines);
    }

    @Test
    void shouldRejectRangeOutsideFile() throws IOException {
        Path file = write("short.log", "a\nb\n");
        LogFileReader.LineIndex index = reader.indexLines(file, 10);

        assertThrows(IllegalArgumentException.class, () -> reader.readLines(file, index, 2, 3));
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }
}
