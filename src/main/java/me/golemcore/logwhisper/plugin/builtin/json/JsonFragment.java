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

/**
 * A brace-delimited candidate found in entry content.
 *
 * @param text
 *            the candidate text
 * @param start
 *            offset of the opening brace in the content
 * @param end
 *            offset just past the candidate
 * @param closed
 *            {@code false} if the content ended before the braces balanced
 */
public record JsonFragment(String text, int start, int end, boolean closed) {
}
