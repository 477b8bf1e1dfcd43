package me.golemcore.logwhisper.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * One logical log record, possibly folded from several physical lines (a
 * message followed by its stack trace, for example).
 *
 * <p>
 * Entries are created once by the segmenter and never mutated afterwards.
 * {@code rawLine} holds the exact original text of every physical line of the
 * entry including line terminators, so concatenating the raw lines of all
 * entries of a file reproduces the file.
 */
@Value
@Builder(toBuilder = true)
public class LogEntry {

    int lineNumber;
    int lineEnd;
    LocalDateTime timestamp;
    LogLevel level;
    String content;
    String rawLine;

    public int getPhysicalLineCount() {
        return lineEnd - lineNumber + 1;
    }

    /**
     * Error classification used by the viewer. Mislabelled lines are caught by
     * the content keywords.
     */
    public boolean isError() {
        if (level == LogLevel.ERROR) {
            return true;
        }
        String lower = lowerContent();
        return lower.contains("exception") || lower.contains("error") || lower.contains("failed");
    }

    public boolean isWarning() {
        return level == LogLevel.WARN || lowerContent().contains("warn");
    }

    private String lowerContent() {
        return content != null ? content.toLowerCase(Locale.ROOT) : "";
    }
}
