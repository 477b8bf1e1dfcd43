package me.golemcore.logwhisper.plugin.builtin.highlight;

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

import me.golemcore.logwhisper.domain.model.BlockType;
import me.golemcore.logwhisper.domain.model.LogEntry;
import me.golemcore.logwhisper.domain.model.RenderedBlock;
import me.golemcore.logwhisper.plugin.api.RenderContext;
import me.golemcore.logwhisper.plugin.builtin.AbstractRendererPlugin;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flags entries that mention failures or warnings. Error patterns win over
 * warning patterns; the first matching term becomes the block title.
 *
 * <p>
 * Registered after the SQL and JSON renderers so that structured content is
 * rendered by them even when it mentions an error.
 */
public class ErrorHighlighterRenderer extends AbstractRendererPlugin {

    public static final String NAME = "error-highlighter";
    public static final int PRIORITY = 50;

    static final String KEY_INCLUDE_WARNINGS = "includeWarnings";

    private static final List<Pattern> ERROR_PATTERNS = List.of(
            Pattern.compile("\\b(error|exception|failed|failure|fatal)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(500|timeout|null|undefined)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(crash|abort|panic)\\b", Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> WARNING_PATTERNS = List.of(
            Pattern.compile("\\b(warn|warning|deprecated)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(404|not found|missing)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(slow|retry)\\b", Pattern.CASE_INSENSITIVE));

    public ErrorHighlighterRenderer() {
        super(NAME, "Highlights error and warning entries", PRIORITY, Map.of(KEY_INCLUDE_WARNINGS, true));
    }

    @Override
    public boolean matches(LogEntry entry) {
        String content = entry.getContent();
        if (content == null || content.isEmpty()) {
            return false;
        }
        return firstMatch(ERROR_PATTERNS, content).isPresent()
                || (booleanSetting(KEY_INCLUDE_WARNINGS) && firstMatch(WARNING_PATTERNS, content).isPresent());
    }

    @Override
    public List<RenderedBlock> render(LogEntry entry, RenderContext context) {
        String content = entry.getContent();
        Optional<String> error = firstMatch(ERROR_PATTERNS, content);
        if (error.isPresent()) {
            return List.of(block(context, entry, BlockType.ERROR, "Error: " + error.get(), content, content, 0.9));
        }
        Optional<String> warning = firstMatch(WARNING_PATTERNS, content);
        if (warning.isPresent() && booleanSetting(KEY_INCLUDE_WARNINGS)) {
            return List.of(
                    block(context, entry, BlockType.WARNING, "Warning: " + warning.get(), content, content, 0.8));
        }
        return List.of();
    }

    @Override
    protected void validateSettings(Map<String, Object> candidate) {
        readBoolean(candidate, KEY_INCLUDE_WARNINGS);
    }

    private static Optional<String> firstMatch(List<Pattern> patterns, String content) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(content);
            if (matcher.find()) {
                return Optional.of(matcher.group());
            }
        }
        return Optional.empty();
    }
}
