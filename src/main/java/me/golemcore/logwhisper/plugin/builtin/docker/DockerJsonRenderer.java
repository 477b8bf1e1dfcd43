package me.golemcore.logwhisper.plugin.builtin.docker;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.logwhisper.domain.model.BlockType;
import me.golemcore.logwhisper.domain.model.LogEntry;
import me.golemcore.logwhisper.domain.model.LogLevel;
import me.golemcore.logwhisper.domain.model.RenderedBlock;
import me.golemcore.logwhisper.plugin.api.RenderContext;
import me.golemcore.logwhisper.plugin.builtin.AbstractRendererPlugin;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Unwraps lines written by Docker's {@code json-file} logging driver, e.g.
 * {@code {"log":"Server started\n","stream":"stdout","time":"2024-01-15T10:30:45.123Z"}}.
 *
 * <p>
 * The block content is the inner message without its trailing newline. The
 * stream, time and the level inferred from the message are reported as block
 * attributes. Lines that are not a JSON object with a textual {@code log} field
 * are left to the other renderers.
 */
@Slf4j
public class DockerJsonRenderer extends AbstractRendererPlugin {

    public static final String NAME = "docker-json";
    public static final int PRIORITY = 15;

    public static final String ATTR_STREAM = "stream";
    public static final String ATTR_TIME = "time";
    public static final String ATTR_LEVEL = "level";

    static final String KEY_SHOW_TIME = "showTime";

    private static final Pattern LEVEL_WORD = Pattern.compile(
            "(?i)\\b(fatal|error|err|warning|warn|info|debug|trace)\\b");

    private final ObjectMapper objectMapper;

    public DockerJsonRenderer(ObjectMapper objectMapper) {
        super(NAME, "Unwraps Docker json-file log lines into their message", PRIORITY,
                Map.of(KEY_SHOW_TIME, true));
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean matches(LogEntry entry) {
        return unwrap(entry).isPresent();
    }

    @Override
    public List<RenderedBlock> render(LogEntry entry, RenderContext context) {
        Optional<DockerLine> unwrapped = unwrap(entry);
        if (unwrapped.isEmpty()) {
            return List.of();
        }
        DockerLine line = unwrapped.get();
        LogLevel level = inferLevel(line.message());

        StringBuilder formatted = new StringBuilder();
        if (line.time() != null && booleanSetting(KEY_SHOW_TIME)) {
            formatted.append(line.time()).append(' ');
        }
        if (line.stream() != null) {
            formatted.append('[').append(line.stream()).append("] ");
        }
        formatted.append(line.message());

        String title = line.stream() != null ? "Docker " + line.stream() : "Docker";
        RenderedBlock block = block(context, entry, blockType(level), title, line.message(),
                formatted.toString(), 1.0);
        Map<String, String> attributes = block.getMetadata().getAttributes();
        if (line.stream() != null) {
            attributes.put(ATTR_STREAM, line.stream());
        }
        if (line.time() != null) {
            attributes.put(ATTR_TIME, line.time());
        }
        attributes.put(ATTR_LEVEL, level.name());
        return List.of(block);
    }

    @Override
    protected void validateSettings(Map<String, Object> candidate) {
        readBoolean(candidate, KEY_SHOW_TIME);
    }

    /**
     * Strongest level word in the message; {@code err} counts as ERROR.
     */
    static LogLevel inferLevel(String message) {
        LogLevel strongest = LogLevel.UNKNOWN;
        Matcher matcher = LEVEL_WORD.matcher(message);
        while (matcher.find()) {
            String token = matcher.group(1).toLowerCase(Locale.ROOT);
            LogLevel level = "err".equals(token) ? LogLevel.ERROR : LogLevel.fromToken(token);
            if (level.outranks(strongest)) {
                strongest = level;
            }
        }
        return strongest;
    }

    private static BlockType blockType(LogLevel level) {
        return switch (level) {
        case ERROR -> BlockType.ERROR;
        case WARN -> BlockType.WARNING;
        default -> BlockType.INFO;
        };
    }

    private Optional<DockerLine> unwrap(LogEntry entry) {
        String content = entry.getContent();
        if (content == null) {
            return Optional.empty();
        }
        String trimmed = content.trim();
        if (!trimmed.startsWith("{") || !trimmed.contains("\"log\"")) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            log.trace("[Docker] Line {} is not a JSON object: {}", entry.getLineNumber(), e.getOriginalMessage());
            return Optional.empty();
        }
        if (node == null || !node.isObject() || !node.path("log").isTextual()) {
            return Optional.empty();
        }
        String message = stripTrailingNewlines(node.get("log").asText());
        return Optional.of(new DockerLine(message, textOrNull(node, "stream"), textOrNull(node, "time")));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static String stripTrailingNewlines(String text) {
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return text.substring(0, end);
    }

    private record DockerLine(String message, String stream, String time) {
    }
}
