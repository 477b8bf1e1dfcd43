package me.golemcore.logwhisper.plugin.api;

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

import me.golemcore.logwhisper.domain.model.LogEntry;
import me.golemcore.logwhisper.domain.model.PluginConfigurationException;
import me.golemcore.logwhisper.domain.model.RenderedBlock;

import java.util.List;
import java.util.Map;

/**
 * Capability contract of a renderer plugin: a match predicate, a renderer and
 * metadata accessors.
 *
 * <p>
 * The registry tries enabled plugins in priority order and lets the first one
 * whose {@link #matches(LogEntry)} returns {@code true} render the entry.
 * Implementations must be safe for concurrent calls from different render
 * scopes.
 */
public interface RendererPlugin {

    PluginDescriptor descriptor();

    default String name() {
        return descriptor().name();
    }

    boolean matches(LogEntry entry);

    /**
     * Renders an entry this plugin matched. May return an empty list when the
     * entry only feeds plugin state.
     */
    List<RenderedBlock> render(LogEntry entry, RenderContext context);

    /**
     * Current configuration payload, as reported by registry introspection.
     */
    default Map<String, Object> configuration() {
        return Map.of();
    }

    /**
     * Checks a configuration payload without applying it.
     *
     * @throws PluginConfigurationException
     *             if the payload is invalid
     */
    default void validateConfiguration(Map<String, Object> configuration) {
        if (configuration != null && !configuration.isEmpty()) {
            throw new PluginConfigurationException(name(), "plugin accepts no configuration");
        }
    }

    /**
     * Applies a payload that passed {@link #validateConfiguration(Map)}.
     */
    default void applyConfiguration(Map<String, Object> configuration) {
    }

    /**
     * Called once a render pass is over so that per-scope state can be dropped.
     */
    default void endScope(RenderContext context) {
    }
}
