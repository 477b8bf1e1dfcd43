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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.logwhisper.domain.model.LogEntry;
import me.golemcore.logwhisper.domain.model.LogLevel;
import me.golemcore.logwhisper.infrastructure.config.LogWhisperProperties;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Splits log text into entries.
 *
 * <p>
 * Every physical line gets a 1-based line number. Lines that continue the
 * previous entry (stack frames, indented lines, {@code Caused by:}, or lines
 * without a timestamp or level following a line that had one) are folded into
 * it. Line terminators are kept in {@link LogEntry#getRawLine()}, so the raw
 * lines of all entries concatenate back to the input.
 */
@Service
@Slf4j
public class LineSegmenter {

    private static final int SIGNATURE_HEAD_LENGTH = 64;

    private static final Pattern UPPERCASE_LEVEL = Pattern.compile(
            "\\b(TRACE|DEBUG|INFO|WARN|WARNING|ERROR|FATAL)\\b");
    private static final Pattern ANY_CASE_LEVEL = Pattern.compile(
            "\\b(TRACE|DEBUG|INFO|WARN|WARNING|ERROR|FATAL)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTINUATION_PREFIX = Pattern.compile(
            "^(at |\\.\\.\\. \\d+ more|Caused by:|Suppressed:)");

    private static final List<TimestampFormat> TIMESTAMP_FORMATS = List.of(
            new TimestampFormat("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}\\.\\d{3}", "yyyy-MM-dd HH:mm:ss.SSS"),
            new TimestampFormat("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2},\\d{3}", "yyyy-MM-dd HH:mm:ss,SSS"),
            new TimestampFormat("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}\\.\\d{3}", "yyyy-MM-dd'T'HH:mm:ss.SSS"),
            new TimestampFormat("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}", "yyyy-MM-dd'T'HH:mm:ss"),
            new TimestampFormat("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}", "yyyy-MM-dd HH:mm:ss"),
            new TimestampFormat("\\d{4}/\\d{2}/\\d{2} \\d{2}:\\d{2}:\\d{2}", "yyyy/MM/dd HH:mm:ss"));

    private final LogWhisperProperties properties;

    public LineSegmenter(LogWhisperProperties properties) {
        this.properties = properties;
    }

    public List<LogEntry> segment(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return segment(splitLines(text).stream(), 1);
    }

    /**
     * Segments raw lines (terminators included) read from the middle of a file.
     *
     * @param firstLineNumber
     *            line number of the first element
     */
    public List<LogEntry> segment(Stream<String> rawLines, int firstLineNumber) {
        Accumulator accumulator = new Accumulator(firstLineNumber,
                properties.getParser().isMergeContinuations());
        rawLines.forEachOrdered(accumulator::accept);
        return accumulator.finish();
    }

    /**
     * Splits text after each {@code \n}, {@code \r\n} or {@code \r}, keeping
     * the terminators.
     */
    public static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int length = text.length();
        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                lines.add(text.substring(start, i + 1));
                start = i + 1;
            } else if (c == '\r') {
                int end = i + 1 < length && text.charAt(i + 1) == '\n' ? i + 2 : i + 1;
                lines.add(text.substring(start, end));
                start = end;
                i = end - 1;
            }
        }
        if (start < length) {
            lines.add(text.substring(start));
        }
        return lines;
    }

    static String stripTerminator(String rawLine) {
        int end = rawLine.length();
        if (end > 0 && rawLine.charAt(end - 1) == '\n') {
            end--;
        }
        if (end > 0 && rawLine.charAt(end - 1) == '\r') {
            end--;
        }
        return rawLine.substring(0, end);
    }

    static LogLevel detectLevel(String line) {
        LogLevel level = strongestToken(UPPERCASE_LEVEL.matcher(line));
        if (level != LogLevel.UNKNOWN) {
            return level;
        }
        level = strongestToken(ANY_CASE_LEVEL.matcher(line));
        if (level != LogLevel.UNKNOWN) {
            return level;
        }
        String lower = line.toLowerCase(Locale.ROOT);
        if (lower.contains("error") || lower.contains("exception") || lower.contains("failed")
                || lower.contains("fatal")) {
            return LogLevel.ERROR;
        }
        if (lower.contains("warn")) {
            return LogLevel.WARN;
        }
        if (lower.contains("info")) {
            return LogLevel.INFO;
        }
        if (lower.contains("debug") || lower.contains("trace")) {
            return LogLevel.DEBUG;
        }
        return LogLevel.UNKNOWN;
    }

    static Optional<LocalDateTime> detectTimestamp(String line) {
        for (TimestampFormat format : TIMESTAMP_FORMATS) {
            Matcher matcher = format.pattern().matcher(line);
            if (!matcher.find()) {
                continue;
            }
            try {
                return Optional.of(LocalDateTime.parse(matcher.group(), format.formatter()));
            } catch (DateTimeParseException e) {
                log.trace("[Segmenter] Unparseable timestamp '{}': {}", matcher.group(), e.getMessage());
            }
        }
        return Optional.empty();
    }

    static boolean hasEntrySignature(String line) {
        String head = line.startsWith("[") ? line.substring(1) : line;
        for (TimestampFormat format : TIMESTAMP_FORMATS) {
            if (format.pattern().matcher(head).lookingAt()) {
                return true;
            }
        }
        String prefix = line.length() > SIGNATURE_HEAD_LENGTH ? line.substring(0, SIGNATURE_HEAD_LENGTH) : line;
        return UPPERCASE_LEVEL.matcher(prefix).find();
    }

    static boolean isContinuation(String line, boolean previousHasSignature) {
        if (line.isBlank()) {
            return false;
        }
        if (Character.isWhitespace(line.charAt(0)) || CONTINUATION_PREFIX.matcher(line).lookingAt()) {
            return true;
        }
        return previousHasSignature && !hasEntrySignature(line);
    }

    private static LogLevel strongestToken(Matcher matcher) {
        LogLevel strongest = LogLevel.UNKNOWN;
        while (matcher.find()) {
            LogLevel level = LogLevel.fromToken(matcher.group(1));
            if (level.outranks(strongest)) {
                strongest = level;
            }
        }
        return strongest;
    }

    private record TimestampFormat(Pattern pattern, DateTimeFormatter formatter) {

        TimestampFormat(String regex, String formatterPattern) {
            this(Pattern.compile(regex), DateTimeFormatter.ofPattern(formatterPattern, Locale.ROOT));
        }
    }

    /**
     * Builds entries line by line, holding the entry still open for
     * continuation lines.
     */
    private static final class Accumulator {

        private final List<LogEntry> entries = new ArrayList<>();
        private final boolean mergeContinuations;
        private int nextLineNumber;

        private int openLineNumber;
        private int openLineEnd;
        private String openFirstLine;
        private StringBuilder openContent;
        private StringBuilder openRaw;
        private boolean openHasSignature;

        Accumulator(int firstLineNumber, boolean mergeContinuations) {
            this.nextLineNumber = firstLineNumber;
            this.mergeContinuations = mergeContinuations;
        }

        void accept(String rawLine) {
            int lineNumber = nextLineNumber++;
            String line = stripTerminator(rawLine);
            boolean canContinue = mergeContinuations && openContent != null && !openFirstLine.isBlank();
            if (canContinue && isContinuation(line, openHasSignature)) {
                openContent.append('\n').append(line);
                openRaw.append(rawLine);
                openLineEnd = lineNumber;
                return;
            }
            close();
            openLineNumber = lineNumber;
            openLineEnd = lineNumber;
            openFirstLine = line;
            openContent = new StringBuilder(line);
            openRaw = new StringBuilder(rawLine);
            openHasSignature = hasEntrySignature(line);
        }

        List<LogEntry> finish() {
            close();
            return entries;
        }

        private void close() {
            if (openContent == null) {
                return;
            }
            entries.add(LogEntry.builder()
                    .lineNumber(openLineNumber)
                    .lineEnd(openLineEnd)
                    .timestamp(detectTimestamp(openFirstLine).orElse(null))
                    .level(detectLevel(openFirstLine))
                    .content(openContent.toString())
                    .rawLine(openRaw.toString())
                    .build());
            openContent = null;
            openRaw = null;
        }
    }
}
