package me.golemcore.logwhisper.plugin.context;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.logwhisper.domain.model.LogEntry;
import me.golemcore.logwhisper.domain.model.PluginCapability;
import me.golemcore.logwhisper.domain.model.PluginNotFoundException;
import me.golemcore.logwhisper.domain.model.PluginUpdate;
import me.golemcore.logwhisper.domain.model.RenderedBlock;
import me.golemcore.logwhisper.infrastructure.config.LogWhisperProperties;
import me.golemcore.logwhisper.plugin.api.RenderContext;
import me.golemcore.logwhisper.plugin.api.RendererPlugin;
import me.golemcore.logwhisper.plugin.builtin.BuiltinPluginCatalog;
import me.golemcore.logwhisper.plugin.builtin.raw.RawRenderer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Priority-ordered registry of renderer plugins and entry dispatch.
 *
 * <p>
 * Plugins are tried in ascending priority, ties broken by registration order;
 * the first enabled plugin whose predicate matches renders the entry. Entries
 * nobody matches are rendered by the raw fallback, even when the raw plugin is
 * disabled.
 *
 * <p>
 * Dispatch reads an immutable snapshot of the ordered enabled plugins, taken
 * under the read lock. Updates rebuild the snapshot under the write lock. The
 * lock is never held while a plugin renders.
 */
@Component
@Slf4j
public class PluginRegistryService {

    private static final Comparator<PluginSlot> SLOT_ORDER = Comparator
            .comparingInt(PluginSlot::getPriority)
            .thenComparingInt(PluginSlot::getRegistrationOrder);

    private final BuiltinPluginCatalog builtinPluginCatalog;
    private final LogWhisperProperties properties;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(false);

    private volatile boolean initialized;
    private Map<String, PluginSlot> slotsByName = Map.of();
    private List<RendererPlugin> dispatchOrder = List.of();
    private RendererPlugin fallback;

    public PluginRegistryService(BuiltinPluginCatalog builtinPluginCatalog, LogWhisperProperties properties) {
        this.builtinPluginCatalog = builtinPluginCatalog;
        this.properties = properties;
    }

    public void ensureInitialized() {
        if (initialized) {
            return;
        }
        lock.writeLock().lock();
        try {
            if (initialized) {
                return;
            }
            initializeInternal();
            initialized = true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Renders an entry with the first matching enabled plugin.
     */
    public Dispatch dispatch(LogEntry entry, RenderContext context) {
        for (RendererPlugin plugin : snapshot()) {
            if (plugin.matches(entry)) {
                return new Dispatch(plugin.name(), plugin.render(entry, context));
            }
        }
        return renderFallback(entry, context);
    }

    /**
     * Renders an entry with the named plugin, falling back to raw when its
     * predicate does not match. The plugin is used even when disabled.
     *
     * @throws PluginNotFoundException
     *             if no plugin has that name
     */
    public Dispatch dispatchWith(LogEntry entry, String pluginName, RenderContext context) {
        RendererPlugin plugin = requirePlugin(pluginName);
        if (plugin.matches(entry)) {
            return new Dispatch(plugin.name(), plugin.render(entry, context));
        }
        return renderFallback(entry, context);
    }

    /**
     * Lets every plugin release the state it kept for a finished render pass.
     */
    public void endScope(RenderContext context) {
        for (PluginSlot slot : slots()) {
            slot.plugin().endScope(context);
        }
    }

    public RendererPlugin requirePlugin(String pluginName) {
        ensureInitialized();
        lock.readLock().lock();
        try {
            PluginSlot slot = slotsByName.get(pluginName);
            if (slot == null) {
                throw new PluginNotFoundException(pluginName);
            }
            return slot.plugin();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<PluginCapability> listPlugins() {
        return slots().stream()
                .sorted(SLOT_ORDER)
                .map(PluginSlot::toCapability)
                .toList();
    }

    /**
     * Applies an enablement and/or configuration change. The configuration is
     * validated by the plugin first; a rejected payload leaves the plugin
     * unchanged.
     *
     * @throws PluginNotFoundException
     *             if no plugin has that name
     */
    public PluginCapability updatePlugin(PluginUpdate update) {
        ensureInitialized();
        lock.writeLock().lock();
        try {
            PluginSlot slot = slotsByName.get(update.getName());
            if (slot == null) {
                throw new PluginNotFoundException(update.getName());
            }
            if (update.getConfiguration() != null) {
                slot.plugin().validateConfiguration(update.getConfiguration());
                slot.plugin().applyConfiguration(update.getConfiguration());
            }
            if (update.getEnabled() != null) {
                slot.setEnabled(update.getEnabled());
            }
            rebuildDispatchOrder();
            log.info("[Registry] Updated plugin {} (enabled={}, configuration={})",
                    slot.plugin().name(), slot.isEnabled(), slot.plugin().configuration());
            return slot.toCapability();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Dispatch renderFallback(LogEntry entry, RenderContext context) {
        RendererPlugin raw = fallback;
        return new Dispatch(raw.name(), raw.render(entry, context));
    }

    private List<RendererPlugin> snapshot() {
        ensureInitialized();
        lock.readLock().lock();
        try {
            return dispatchOrder;
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<PluginSlot> slots() {
        ensureInitialized();
        lock.readLock().lock();
        try {
            return List.copyOf(slotsByName.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    private void initializeInternal() {
        List<RendererPlugin> loadedPlugins = builtinPluginCatalog.createPlugins();
        Map<String, PluginSlot> slotMap = new LinkedHashMap<>();

        int registrationOrder = 0;
        for (RendererPlugin plugin : loadedPlugins) {
            String name = plugin.name();
            if (slotMap.containsKey(name)) {
                throw new IllegalStateException("Duplicate plugin name: " + name);
            }
            PluginSlot slot = new PluginSlot(plugin, plugin.descriptor().defaultPriority(), registrationOrder++);
            applyProperties(slot, properties.getPlugins().get(name));
            slotMap.put(name, slot);
            log.debug("[Registry] Registered plugin {} (priority={}, enabled={})",
                    name, slot.getPriority(), slot.isEnabled());
        }

        PluginSlot rawSlot = slotMap.get(RawRenderer.NAME);
        if (rawSlot == null) {
            throw new IllegalStateException("Raw fallback plugin is not registered");
        }
        this.fallback = rawSlot.plugin();
        this.slotsByName = Collections.unmodifiableMap(slotMap);
        rebuildDispatchOrder();

        log.info("[Registry] Loaded {} plugins", slotsByName.size());
        log.info("[Registry] Dispatch order: {}", dispatchOrder.stream().map(RendererPlugin::name).toList());
    }

    private void applyProperties(PluginSlot slot, LogWhisperProperties.PluginProperties pluginProperties) {
        if (pluginProperties == null) {
            return;
        }
        if (pluginProperties.getEnabled() != null) {
            slot.setEnabled(pluginProperties.getEnabled());
        }
        if (pluginProperties.getPriority() != null) {
            slot.setPriority(pluginProperties.getPriority());
        }
        Map<String, Object> config = pluginProperties.getConfig();
        if (config != null && !config.isEmpty()) {
            slot.plugin().validateConfiguration(config);
            slot.plugin().applyConfiguration(config);
        }
    }

    private void rebuildDispatchOrder() {
        List<RendererPlugin> ordered = new ArrayList<>();
        slotsByName.values().stream()
                .filter(PluginSlot::isEnabled)
                .sorted(SLOT_ORDER)
                .forEach(slot -> ordered.add(slot.plugin()));
        this.dispatchOrder = List.copyOf(ordered);
    }

    /**
     * Outcome of one dispatch: the plugin that rendered and its blocks.
     */
    public record Dispatch(String pluginName, List<RenderedBlock> blocks) {
    }

    private static final class PluginSlot {

        private final RendererPlugin plugin;
        private final int registrationOrder;
        private volatile int priority;
        private volatile boolean enabled = true;

        PluginSlot(RendererPlugin plugin, int priority, int registrationOrder) {
            this.plugin = plugin;
            this.priority = priority;
            this.registrationOrder = registrationOrder;
        }

        RendererPlugin plugin() {
            return plugin;
        }

        int getPriority() {
            return priority;
        }

        void setPriority(int priority) {
            this.priority = priority;
        }

        int getRegistrationOrder() {
            return registrationOrder;
        }

        boolean isEnabled() {
            return enabled;
        }

        void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        PluginCapability toCapability() {
            return PluginCapability.builder()
                    .name(plugin.name())
                    .description(plugin.descriptor().description())
                    .version(plugin.descriptor().version())
                    .priority(priority)
                    .enabled(enabled)
                    .configuration(plugin.configuration())
                    .build();
        }
    }
}
