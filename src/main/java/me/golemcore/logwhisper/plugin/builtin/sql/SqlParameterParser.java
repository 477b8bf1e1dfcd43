package me.golemcore.logwhisper.plugin.builtin.sql;

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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits the text of a parameters line into values.
 *
 * <p>
 * Commas split values only at top level: inside a single- or double-quoted
 * literal they are part of the value, and {@code ''} inside a single-quoted
 * literal is an escaped quote. A quote opens a literal only as the first
 * non-blank character of a value. MyBatis prints strings unquoted, so
 * {@code O'Brien(String)} is one plain value. A trailing {@code (Type)} on a
 * value is taken as its type hint.
 */
public final class SqlParameterParser {

    private static final Pattern TYPE_HINT = Pattern.compile("(?s)^(.*)\\(([A-Za-z_][\\w.$]*)\\)$");

    private SqlParameterParser() {
    }

    public static List<SqlParameter> parse(String text) {
        List<SqlParameter> parameters = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return parameters;
        }
        for (String part : splitTopLevel(text)) {
            parameters.add(toParameter(part.trim()));
        }
        return parameters;
    }

    static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        int length = text.length();
        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                current.append(c);
                if (c == quote) {
                    if (quote == '\'' && i + 1 < length && text.charAt(i + 1) == '\'') {
                        current.append('\'');
                        i++;
                    } else {
                        quote = 0;
                    }
                }
            } else if ((c == '\'' || c == '"') && current.toString().isBlank()) {
                quote = c;
                current.append(c);
            } else if (c == ',') {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        parts.add(current.toString());
        return parts;
    }

    private static SqlParameter toParameter(String part) {
        Matcher matcher = TYPE_HINT.matcher(part);
        if (matcher.matches() && !isQuoted(part)) {
            return new SqlParameter(matcher.group(1), matcher.group(2));
        }
        return new SqlParameter(part, null);
    }

    private static boolean isQuoted(String part) {
        return part.length() >= 2 && part.charAt(0) == '\'' && part.charAt(part.length() - 1) == '\'';
    }
}
