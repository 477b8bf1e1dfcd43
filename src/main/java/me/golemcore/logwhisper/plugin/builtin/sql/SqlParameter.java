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

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One bound value of a prepared statement as printed in a parameters line.
 *
 * @param value
 *            the value text with the type hint removed
 * @param typeHint
 *            simple Java type name from a trailing {@code (Type)}, or
 *            {@code null} when the value carried none
 */
public record SqlParameter(String value, String typeHint) {

    private static final Set<String> BARE_TYPES = Set.of(
            "Byte", "Short", "Integer", "Long", "Float", "Double", "BigDecimal", "BigInteger",
            "Boolean", "AtomicInteger", "AtomicLong", "int", "long", "short", "byte", "float", "double",
            "boolean");

    private static final Pattern NUMERIC = Pattern.compile("[-+]?\\d+(\\.\\d+)?([eE][-+]?\\d+)?");

    public boolean hasTypeHint() {
        return typeHint != null;
    }

    /**
     * Formats the value as an SQL literal: numbers and booleans bare,
     * {@code null} as {@code NULL}, everything else single-quoted with
     * embedded quotes doubled.
     */
    public String toSqlLiteral() {
        String trimmed = value.trim();
        if ("null".equalsIgnoreCase(trimmed)) {
            return "NULL";
        }
        if (isSingleQuoted(trimmed)) {
            return trimmed;
        }
        if (isDoubleQuoted(trimmed)) {
            return quote(trimmed.substring(1, trimmed.length() - 1));
        }
        if (hasTypeHint()) {
            if (isBareType() && isBareLiteral(trimmed)) {
                return trimmed;
            }
            return quote(value);
        }
        if (isBareLiteral(trimmed)) {
            return trimmed;
        }
        return quote(trimmed);
    }

    private boolean isBareType() {
        String simpleName = typeHint.substring(typeHint.lastIndexOf('.') + 1);
        return BARE_TYPES.contains(simpleName);
    }

    private static boolean isBareLiteral(String text) {
        if (NUMERIC.matcher(text).matches()) {
            return true;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return "true".equals(lower) || "false".equals(lower);
    }

    private static boolean isSingleQuoted(String text) {
        return text.length() >= 2 && text.charAt(0) == '\'' && text.charAt(text.length() - 1) == '\'';
    }

    private static boolean isDoubleQuoted(String text) {
        return text.length() >= 2 && text.charAt(0) == '"' && text.charAt(text.length() - 1) == '"';
    }

    private static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }
}
