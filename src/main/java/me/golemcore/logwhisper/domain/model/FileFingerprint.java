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

/**
 * Content-derived key used to memoize parse results. File sources are keyed by
 * absolute path, modification time and size; inline content by its SHA-256
 * digest.
 *
 * @param source
 *            absolute file path, or {@code inline} for request content
 * @param lastModifiedMillis
 *            file modification time, {@code 0} for inline content
 * @param size
 *            file size in bytes or content length in chars
 * @param contentHash
 *            hex SHA-256 digest for inline content, {@code null} for files
 */
public record FileFingerprint(
        String source,
        long lastModifiedMillis,
        long size,
        String contentHash
) {
    public static final String INLINE_SOURCE = "inline";

    public static FileFingerprint ofFile(String absolutePath, long lastModifiedMillis, long size) {
        return new FileFingerprint(absolutePath, lastModifiedMillis, size, null);
    }

    public static FileFingerprint ofContent(String contentHash, long length) {
        return new FileFingerprint(INLINE_SOURCE, 0L, length, contentHash);
    }

    public boolean isInline() {
        return contentHash != null;
    }

    /**
     * Short, stable text form used for scope identifiers and logging.
     */
    public String asKey() {
        if (isInline()) {
            return INLINE_SOURCE + ":" + contentHash.substring(0, Math.min(16, contentHash.length()));
        }
        return source + "@" + lastModifiedMillis + ":" + size;
    }
}
