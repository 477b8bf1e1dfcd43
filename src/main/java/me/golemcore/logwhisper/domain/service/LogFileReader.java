package me.golemcore.logwhisper.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.logwhisper.domain.model.FileFingerprint;
import me.golemcore.logwhisper.domain.model.LogInputException;
import me.golemcore.logwhisper.infrastructure.config.LogWhisperProperties;
import org.springframework.stereotype.Service;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

/**
 * File access for log sources: validation, fingerprints, line indexing and
 * line-range reads.
 *
 * <p>
 * Line indexing streams the file once and keeps only a sparse index of byte
 * offsets, one per {@code interval} lines, so that a line range can be read by
 * seeking to the nearest indexed line. Content is decoded as UTF-8; malformed
 * input is replaced, never rejected.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LogFileReader {

    private static final int BUFFER_SIZE = 64 * 1024;

    private final LogWhisperProperties properties;

    /**
     * Sparse line index of a file.
     *
     * @param totalLines
     *            number of physical lines
     * @param interval
     *            lines between indexed offsets
     * @param offsets
     *            element {@code k} is the byte offset of line
     *            {@code k * interval + 1}
     */
    public record LineIndex(int totalLines, int interval, long[] offsets) {
    }

    /**
     * Resolves and validates a file path.
     *
     * @throws LogInputException
     *             if the path is missing, not a readable regular file, has an
     *             unsupported extension or exceeds the size ceiling
     */
    public Path validate(String filePath) {
        if (filePath == null || filePath.isBlank()) {
            throw new LogInputException("File path is required");
        }
        Path path;
        try {
            path = Path.of(filePath).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new LogInputException("Invalid file path: " + filePath, e);
        }
        if (!Files.exists(path)) {
            throw new LogInputException("File not found: " + filePath);
        }
        if (!Files.isRegularFile(path)) {
            throw new LogInputException("Not a file: " + filePath);
        }
        if (!Files.isReadable(path)) {
            throw new LogInputException("File is not readable: " + filePath);
        }
        String extension = extensionOf(path);
        List<String> supported = properties.getFiles().getSupportedExtensions();
        if (supported.stream().noneMatch(ext -> ext.equalsIgnoreCase(extension))) {
            throw new LogInputException("Unsupported file type '" + extension + "', expected one of " + supported);
        }
        long size = sizeOf(path);
        long maxSize = properties.getFiles().getMaxFileSize();
        if (size > maxSize) {
            throw new LogInputException("File too large: " + size + " bytes (max " + maxSize + ")");
        }
        return path;
    }

    public FileFingerprint fingerprint(Path path) {
        try {
            return FileFingerprint.ofFile(path.toString(),
                    Files.getLastModifiedTime(path).toMillis(),
                    Files.size(path));
        } catch (IOException e) {
            throw new LogInputException("Failed to stat file: " + path, e);
        }
    }

    public static FileFingerprint fingerprintContent(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return FileFingerprint.ofContent(HexFormat.of().formatHex(hash), content.length());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Reads a whole file for a complete parse.
     *
     * @throws LogInputException
     *             if the file is larger than the whole-parse ceiling
     */
    public String readContent(Path path) {
        long size = sizeOf(path);
        long maxSize = properties.getFiles().getMaxWholeParseSize();
        if (size > maxSize) {
            throw new LogInputException("File too large for a whole parse: " + size
                    + " bytes (max " + maxSize + "), open it in chunks instead");
        }
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LogInputException("Failed to read file: " + path, e);
        }
    }

    /**
     * Counts the lines of a file and records the offset of every
     * {@code interval}-th line. {@code \n}, {@code \r\n} and {@code \r} end a
     * line.
     */
    public LineIndex indexLines(Path path, int interval) {
        long started = System.nanoTime();
        long[] offsets = new long[16];
        int indexed = 0;
        int lines = 0;
        long offset = 0;
        boolean atLineStart = true;
        boolean pendingCr = false;
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = Files.newInputStream(path)) {
            int read;
            while ((read = in.read(buffer)) > 0) {
                for (int i = 0; i < read; i++, offset++) {
                    byte b = buffer[i];
                    if (pendingCr) {
                        pendingCr = false;
                        if (b == '\n') {
                            continue;
                        }
                    }
                    if (atLineStart) {
                        if (lines % interval == 0) {
                            if (indexed == offsets.length) {
                                offsets = Arrays.copyOf(offsets, offsets.length * 2);
                            }
                            offsets[indexed++] = offset;
                        }
                        lines++;
                        atLineStart = false;
                    }
                    if (b == '\n') {
                        atLineStart = true;
                    } else if (b == '\r') {
                        atLineStart = true;
                        pendingCr = true;
                    }
                }
            }
        } catch (IOException e) {
            throw new LogInputException("Failed to read file: " + path, e);
        }
        log.debug("[Files] Indexed {} lines of {} in {} ms", lines, path,
                (System.nanoTime() - started) / 1_000_000);
        return new LineIndex(lines, interval, Arrays.copyOf(offsets, indexed));
    }

    /**
     * Reads physical lines {@code startLine..endLine} (1-based, inclusive) with
     * their terminators.
     */
    public List<String> readLines(Path path, LineIndex index, int startLine, int endLine) {
        if (startLine < 1 || endLine < startLine || endLine > index.totalLines()) {
            throw new IllegalArgumentException("Line range " + startLine + ".." + endLine
                    + " outside 1.." + index.totalLines());
        }
        int slot = (startLine - 1) / index.interval();
        int skip = (startLine - 1) - slot * index.interval();
        int wanted = endLine - startLine + 1;
        List<String> lines = new ArrayList<>(wanted);
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            channel.position(index.offsets()[slot]);
            InputStream in = new BufferedInputStream(Channels.newInputStream(channel), BUFFER_SIZE);
            LineCursor cursor = new LineCursor(in);
            for (int i = 0; i < skip; i++) {
                if (cursor.next() == null) {
                    return lines;
                }
            }
            while (lines.size() < wanted) {
                String line = cursor.next();
                if (line == null) {
                    break;
                }
                lines.add(line);
            }
        } catch (IOException e) {
            throw new LogInputException("Failed to read file: " + path, e);
        }
        return lines;
    }

    private static long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw new LogInputException("Failed to stat file: " + path, e);
        }
    }

    private static String extensionOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    /**
     * Reads raw lines from a byte stream, splitting after {@code \n},
     * {@code \r\n} or {@code \r}.
     */
    private static final class LineCursor {

        private final InputStream in;
        private final ByteArrayOutputStream line = new ByteArrayOutputStream(256);
        private int lookahead = -2;

        LineCursor(InputStream in) {
            this.in = in;
        }

        String next() throws IOException {
            line.reset();
            while (true) {
                int b = read();
                if (b < 0) {
                    return line.size() > 0 ? decode() : null;
                }
                line.write(b);
                if (b == '\n') {
                    return decode();
                }
                if (b == '\r') {
                    int following = read();
                    if (following == '\n') {
                        line.write(following);
                    } else {
                        lookahead = following;
                    }
                    return decode();
                }
            }
        }

        private int read() throws IOException {
            if (lookahead != -2) {
                int b = lookahead;
                lookahead = -2;
                return b;
            }
            return in.read();
        }

        private String decode() {
            return line.toString(StandardCharsets.UTF_8);
        }
    }
}
