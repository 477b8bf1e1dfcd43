package me.golemcore.logwhisper.plugin.builtin;

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

import me.golemcore.logwhisper.domain.model.BlockMetadata;
import me.golemcore.logwhisper.domain.model.BlockType;
import me.golemcore.logwhisper.domain.model.LogEntry;
import me.golemcore.logwhisper.domain.model.PluginConfigurationException;
import me.golemcore.logwhisper.domain.model.RenderedBlock;
import me.golemcore.logwhisper.plugin.api.PluginDescriptor;
import me.golemcore.logwhisper.plugin.api.RenderContext;
import me.golemcore.logwhisper.plugin.api.RendererPlugin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class of the built-in renderers: descriptor, configuration storage with
 * typed accessors, and block construction helpers.
 *
 * <p>
 * The configuration is an immutable map swapped atomically on apply, so a
 * render running concurrently with an update sees either the old or the new
 * payload, never a mix.
 */
public abstract class AbstractRendererPlugin implements RendererPlugin {

    private static final String DEFAULT_PLUGIN_VERSION = "1.0.0";

    private final PluginDescriptor pluginDescriptor;
    private final Map<String, Object> defaults;
    private volatile Map<String, Object> settings;

    protected AbstractRendererPlugin(String name, String description, int defaultPriority,
            Map<String, Object> defaults) {
        this.pluginDescriptor = new PluginDescriptor(name, description, DEFAULT_PLUGIN_VERSION, defaultPriority);
        this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
        this.settings = this.defaults;
    }

    @Override
    public PluginDescriptor descriptor() {
        return pluginDescriptor;
    }

    @Override
    public Map<String, Object> configuration() {
        return settings;
    }

    @Override
    public void validateConfiguration(Map<String, Object> configuration) {
        if (configuration == null) {
            return;
        }
        for (String key : configuration.keySet()) {
            if (!defaults.containsKey(key)) {
                throw new PluginConfigurationException(name(), "unknown key '" + key + "'");
            }
        }
        validateSettings(merge(configuration));
    }

    @Override
    public void applyConfiguration(Map<String, Object> configuration) {
        if (configuration == null || configuration.isEmpty()) {
            return;
        }
        settings = merge(configuration);
    }

    /**
     * Validates the complete settings map that would result from an update.
     * Implementations read values through the static accessors, which throw on
     * malformed input.
     */
    protected void validateSettings(Map<String, Object> candidate) {
    }

    protected int intSetting(String key) {
        return readInt(settings, key, Integer.MIN_VALUE);
    }

    protected long longSetting(String key) {
        return readLong(settings, key, Long.MIN_VALUE);
    }

    protected boolean booleanSetting(String key) {
        return readBoolean(settings, key);
    }

    protected int readInt(Map<String, Object> source, String key, int min) {
        long value = readLong(source, key, min);
        if (value > Integer.MAX_VALUE) {
            throw new PluginConfigurationException(name(), key + " is too large");
        }
        return (int) value;
    }

    protected long readLong(Map<String, Object> source, String key, long min) {
        Object raw = source.get(key);
        long value;
        if (raw instanceof Number number) {
            value = number.longValue();
        } else if (raw instanceof String text) {
            try {
                value = Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                throw new PluginConfigurationException(name(), key + " must be a number, got '" + text + "'");
            }
        } else {
            throw new PluginConfigurationException(name(), key + " must be a number");
        }
        if (value < min) {
            throw new PluginConfigurationException(name(), key + " must be >= " + min);
        }
        return value;
    }

    protected boolean readBoolean(Map<String, Object> source, String key) {
        Object raw = source.get(key);
        if (raw instanceof Boolean flag) {
            return flag;
        }
        if (raw instanceof String text) {
            if ("true".equalsIgnoreCase(text.trim())) {
                return true;
            }
            if ("false".equalsIgnoreCase(text.trim())) {
                return false;
            }
        }
        throw new PluginConfigurationException(name(), key + " must be true or false");
    }

    protected RenderedBlock block(RenderContext context, LogEntry entry, BlockType type, String title,
            String content, String formattedContent, double confidence) {
        return block(context, entry.getLineNumber(), entry.getLineEnd(), type, title, content, formattedContent,
                confidence);
    }

    protected RenderedBlock block(RenderContext context, int lineStart, int lineEnd, BlockType type, String title,
            String content, String formattedContent, double confidence) {
        return RenderedBlock.builder()
                .id(context.nextBlockId(name(), lineStart))
                .blockType(type)
                .title(title)
                .content(content)
                .formattedContent(formattedContent)
                .copyable(true)
                .metadata(BlockMetadata.builder()
                        .lineStart(lineStart)
                        .lineEnd(lineEnd)
                        .charStart(0)
                        .charEnd(content != null ? content.length() : 0)
                        .confidence(BlockMetadata.clampConfidence(confidence))
                        .build())
                .build();
    }

    private Map<String, Object> merge(Map<String, Object> update) {
        Map<String, Object> merged = new LinkedHashMap<>(settings);
        merged.putAll(update);
        return Collections.unmodifiableMap(merged);
    }
}
