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

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Produces display markup for an SQL statement. Keywords are upper-cased and
 * wrapped in {@code <span class="sql-keyword">}; everything else is HTML
 * escaped. Quoted literals and identifiers are never touched.
 */
public final class SqlKeywordHighlighter {

    static final String OPEN_TAG = "<span class=\"sql-keyword\">";
    static final String CLOSE_TAG = "</span>";

    private static final List<String> KEYWORDS = List.of(
            "SELECT", "DISTINCT", "FROM", "WHERE", "AND", "OR", "NOT", "IN", "IS", "NULL", "LIKE", "BETWEEN",
            "EXISTS", "AS", "ON", "JOIN", "INNER JOIN", "LEFT JOIN", "RIGHT JOIN", "FULL JOIN", "CROSS JOIN",
            "LEFT OUTER JOIN", "RIGHT OUTER JOIN", "ORDER BY", "GROUP BY", "HAVING", "LIMIT", "OFFSET", "ASC",
            "DESC", "UNION", "UNION ALL", "INSERT INTO", "INSERT", "INTO", "VALUES", "UPDATE", "SET",
            "DELETE FROM", "DELETE", "CASE", "WHEN", "THEN", "ELSE", "END", "CREATE", "TABLE", "ALTER", "DROP",
            "INDEX", "PRIMARY KEY", "FOREIGN KEY", "DEFAULT", "RETURNING", "ON DUPLICATE KEY UPDATE", "WITH",
            "FOR UPDATE");

    private static final Pattern KEYWORD_PATTERN = Pattern.compile(
            "\\b(" + KEYWORDS.stream()
                    .sorted(Comparator.comparingInt(String::length).reversed())
                    .map(keyword -> keyword.replace(" ", "\\s+"))
                    .collect(Collectors.joining("|")) + ")\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private SqlKeywordHighlighter() {
    }

    public static String highlight(String sql) {
        StringBuilder out = new StringBuilder(sql.length() + 64);
        int length = sql.length();
        int segmentStart = 0;
        int i = 0;
        while (i < length) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"' || c == '`') {
                appendKeywords(out, sql.substring(segmentStart, i));
                int end = quotedEnd(sql, i);
                out.append(escape(sql.substring(i, end)));
                i = end;
                segmentStart = end;
            } else {
                i++;
            }
        }
        appendKeywords(out, sql.substring(segmentStart));
        return out.toString();
    }

    public static String escape(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
            case '<' -> out.append("&lt;");
            case '>' -> out.append("&gt;");
            case '&' -> out.append("&amp;");
            default -> out.append(c);
            }
        }
        return out.toString();
    }

    private static void appendKeywords(StringBuilder out, String segment) {
        Matcher matcher = KEYWORD_PATTERN.matcher(segment);
        int last = 0;
        while (matcher.find()) {
            out.append(escape(segment.substring(last, matcher.start())));
            String keyword = WHITESPACE.matcher(matcher.group()).replaceAll(" ").toUpperCase(Locale.ROOT);
            out.append(OPEN_TAG).append(keyword).append(CLOSE_TAG);
            last = matcher.end();
        }
        out.append(escape(segment.substring(last)));
    }

    /**
     * Index just past the literal opened at {@code start}; the end of the text
     * for an unterminated literal.
     */
    static int quotedEnd(String sql, int start) {
        char quote = sql.charAt(start);
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (quote == '\'' && i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }
}
