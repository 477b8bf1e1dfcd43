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

import java.util.Locale;

/**
 * Severity of a log entry. Declaration order is the detection priority used by
 * the segmenter: {@link #ERROR} beats {@link #WARN}, which beats {@link #INFO},
 * which beats {@link #DEBUG}.
 */
public enum LogLevel {

    ERROR,

    WARN,

    INFO,

    DEBUG,

    UNKNOWN;

    /**
     * Maps a level token as printed by common logging frameworks. TRACE folds
     * into DEBUG and FATAL into ERROR.
     */
    public static LogLevel fromToken(String token) {
        if (token == null) {
            return UNKNOWN;
        }
        return switch (token.trim().toLowerCase(Locale.ROOT)) {
        case "error", "fatal", "severe" -> ERROR;
        case "warn", "warning" -> WARN;
        case "info" -> INFO;
        case "debug", "trace", "fine" -> DEBUG;
        default -> UNKNOWN;
        };
    }

    public boolean outranks(LogLevel other) {
        return other == null || this.ordinal() < other.ordinal();
    }
}
