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

import java.util.ArrayList;
import java.util.List;

/**
 * Finds JSON object candidates in free text by brace balancing.
 *
 * <p>
 * Braces inside double-quoted strings are not counted. A candidate ends where
 * the depth returns to zero, unless the next non-blank character opens another
 * object: concatenated objects such as <code>{"a":1}{"b":2}</code> stay in one
 * candidate. A candidate still open at the end of the text runs to the end.
 */
public final class JsonFragmentExtractor {

    private JsonFragmentExtractor() {
    }

    public static List<JsonFragment> extract(String content, int maxCandidates) {
        List<JsonFragment> fragments = new ArrayList<>();
        if (content == null) {
            return fragments;
        }
        int from = 0;
        while (fragments.size() < maxCandidates) {
            int start = content.indexOf('{', from);
            if (start < 0) {
                break;
            }
            JsonFragment fragment = scan(content, start);
            fragments.add(fragment);
            from = fragment.end();
        }
        return fragments;
    }

    private static JsonFragment scan(String content, int start) {
        int length = content.length();
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < length; i++) {
            char c = content.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    int next = skipWhitespace(content, i + 1);
                    if (next < length && content.charAt(next) == '{') {
                        i = next - 1;
                        continue;
                    }
                    return new JsonFragment(content.substring(start, i + 1), start, i + 1, true);
                }
            }
        }
        return new JsonFragment(content.substring(start), start, length, false);
    }

    private static int skipWhitespace(String content, int from) {
        int i = from;
        while (i < content.length() && Character.isWhitespace(content.charAt(i))) {
            i++;
        }
        return i;
    }
}
