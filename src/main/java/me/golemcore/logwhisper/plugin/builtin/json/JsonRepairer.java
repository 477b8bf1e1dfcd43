package me.golemcore.logwhisper.plugin.builtin.json;

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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Single-pass repair of common defects in logged JSON. The fixes run once in a
 * fixed order:
 * <ol>
 * <li>missing comma between concatenated objects (the result is wrapped in an
 * array)</li>
 * <li>unquoted object keys</li>
 * <li>missing closing brackets, appended in nesting order</li>
 * <li>invalid escape sequences inside strings</li>
 * </ol>
 * All fixes are quote-aware: text inside string literals is only touched by the
 * escape fix.
 */
public final class JsonRepairer {

    static final String FIX_JOIN_OBJECTS = "joined objects";
    static final String FIX_QUOTE_KEYS = "quoted keys";
    static final String FIX_CLOSE_BRACKETS = "closed brackets";
    static final String FIX_ESCAPES = "fixed escapes";

    private JsonRepairer() {
    }

    /**
     * @param text
     *            the repaired text
     * @param fixes
     *            names of the fixes that changed something, in application order
     */
    public record Repair(String text, List<String> fixes) {

        public boolean changed() {
            return !fixes.isEmpty();
        }
    }

    public static Repair repair(String fragment) {
        List<String> fixes = new ArrayList<>();
        String text = fragment;

        String joined = joinAdjacentObjects(text);
        if (!joined.equals(text)) {
            text = "[" + joined + "]";
            fixes.add(FIX_JOIN_OBJECTS);
        }
        String quoted = quoteBareKeys(text);
        if (!quoted.equals(text)) {
            text = quoted;
            fixes.add(FIX_QUOTE_KEYS);
        }
        String closed = closeBrackets(text);
        if (!closed.equals(text)) {
            text = closed;
            fixes.add(FIX_CLOSE_BRACKETS);
        }
        String escaped = fixEscapes(text);
        if (!escaped.equals(text)) {
            text = escaped;
            fixes.add(FIX_ESCAPES);
        }
        return new Repair(text, List.copyOf(fixes));
    }

    static String joinAdjacentObjects(String text) {
        StringBuilder out = new StringBuilder(text.length() + 8);
        StringScanner scanner = new StringScanner();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            out.append(c);
            if (scanner.step(c) || c != '}') {
                continue;
            }
            int next = i + 1;
            while (next < text.length() && Character.isWhitespace(text.charAt(next))) {
                next++;
            }
            if (next < text.length() && text.charAt(next) == '{') {
                out.append(',');
            }
        }
        return out.toString();
    }

    static String quoteBareKeys(String text) {
        StringBuilder out = new StringBuilder(text.length() + 16);
        StringScanner scanner = new StringScanner();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            out.append(c);
            i++;
            if (scanner.step(c) || (c != '{' && c != ',')) {
                continue;
            }
            int keyStart = i;
            while (keyStart < text.length() && Character.isWhitespace(text.charAt(keyStart))) {
                keyStart++;
            }
            int keyEnd = keyStart;
            while (keyEnd < text.length() && isKeyChar(text.charAt(keyEnd), keyEnd == keyStart)) {
                keyEnd++;
            }
            if (keyEnd == keyStart) {
                continue;
            }
            int colon = keyEnd;
            while (colon < text.length() && Character.isWhitespace(text.charAt(colon))) {
                colon++;
            }
            if (colon < text.length() && text.charAt(colon) == ':') {
                out.append(text, i, keyStart)
                        .append('"').append(text, keyStart, keyEnd).append('"');
                i = keyEnd;
            }
        }
        return out.toString();
    }

    static String closeBrackets(String text) {
        Deque<Character> open = new ArrayDeque<>();
        StringScanner scanner = new StringScanner();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (scanner.step(c)) {
                continue;
            }
            if (c == '{' || c == '[') {
                open.push(c);
            } else if ((c == '}' || c == ']') && !open.isEmpty()
                    && open.peek() == (c == '}' ? '{' : '[')) {
                open.pop();
            }
        }
        if (open.isEmpty()) {
            return text;
        }
        StringBuilder out = new StringBuilder(text);
        while (!open.isEmpty()) {
            out.append(open.pop() == '{' ? '}' : ']');
        }
        return out.toString();
    }

    static String fixEscapes(String text) {
        StringBuilder out = new StringBuilder(text.length() + 8);
        boolean inString = false;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (!inString) {
                inString = c == '"';
                out.append(c);
                i++;
                continue;
            }
            if (c == '"') {
                inString = false;
                out.append(c);
                i++;
            } else if (c == '\\') {
                if (isValidEscape(text, i)) {
                    out.append(text, i, i + 2);
                    i += 2;
                } else {
                    out.append("\\\\");
                    i++;
                }
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static boolean isValidEscape(String text, int backslash) {
        if (backslash + 1 >= text.length()) {
            return false;
        }
        char next = text.charAt(backslash + 1);
        if ("\"\\/bfnrt".indexOf(next) >= 0) {
            return true;
        }
        if (next != 'u' || backslash + 6 > text.length()) {
            return false;
        }
        for (int k = backslash + 2; k < backslash + 6; k++) {
            if (Character.digit(text.charAt(k), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    private static boolean isKeyChar(char c, boolean first) {
        if (first) {
            return Character.isLetter(c) || c == '_' || c == '$';
        }
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '-';
    }

    /**
     * Tracks whether the scan position is inside a double-quoted string.
     */
    private static final class StringScanner {

        private boolean inString;
        private boolean escaped;

        /**
         * Feeds one character.
         *
         * @return {@code true} if the character belongs to a string literal,
         *         including its quotes
         */
        boolean step(char c) {
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                return true;
            }
            if (c == '"') {
                inString = true;
                return true;
            }
            return false;
        }
    }
}
