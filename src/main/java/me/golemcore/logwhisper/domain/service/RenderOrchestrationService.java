package me.golemcore.logwhisper.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.logwhisper.domain.model.LogEntry;
import me.golemcore.logwhisper.domain.model.ParseRequest;
import me.golemcore.logwhisper.domain.model.ParseResult;
import me.golemcore.logwhisper.domain.model.ParseResultSet;
import me.golemcore.logwhisper.domain.model.ParseStats;
import me.golemcore.logwhisper.domain.model.RenderedBlock;
import me.golemcore.logwhisper.plugin.api.RenderContext;
import me.golemcore.logwhisper.plugin.context.PluginRegistryService;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the entries of one scope through the plugin registry.
 *
 * <p>
 * Entries are dispatched one at a time in the given (ascending) order, which
 * the SQL correlation relies on. A plugin that throws on an entry produces one
 * ERROR block for that entry; the remaining entries are still rendered.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RenderOrchestrationService {

    static final String FAILURE_BLOCK_PREFIX = "render-error";

    private final PluginRegistryService pluginRegistry;

    /**
     * Renders a scope and aggregates its statistics.
     *
     * @param pluginName
     *            {@code auto}/{@code null} for registry dispatch, otherwise the
     *            plugin every entry is pinned to
     */
    public ParseResultSet renderAll(String source, String scopeId, List<LogEntry> entries, String pluginName) {
        long started = System.nanoTime();
        List<ParseResult> results = render(scopeId, entries, pluginName);
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;
        ParseStats stats = ParseStats.from(results, elapsedMillis);
        log.debug("[Render] {}: {} entries, {} blocks in {} ms", scopeId, stats.getTotalEntries(),
                stats.getBlockCount(), elapsedMillis);
        return ParseResultSet.builder()
                .source(source)
                .pluginName(ParseRequest.normalizePluginName(pluginName))
                .results(results)
                .stats(stats)
                .build();
    }

    public List<ParseResult> render(String scopeId, List<LogEntry> entries, String pluginName) {
        String normalized = ParseRequest.normalizePluginName(pluginName);
        String pinnedPlugin = ParseRequest.AUTO.equals(normalized) ? null : normalized;
        if (pinnedPlugin != null) {
            pluginRegistry.requirePlugin(pinnedPlugin);
        }
        RenderContext context = new RenderContext(scopeId);
        List<ParseResult> results = new ArrayList<>(entries.size());
        try {
            for (LogEntry entry : entries) {
                results.add(renderEntry(entry, context, pinnedPlugin));
            }
        } finally {
            pluginRegistry.endScope(context);
        }
        return results;
    }

    private ParseResult renderEntry(LogEntry entry, RenderContext context, String pinnedPlugin) {
        long started = System.nanoTime();
        String renderedBy;
        List<RenderedBlock> blocks;
        try {
            PluginRegistryService.Dispatch dispatch = pinnedPlugin != null
                    ? pluginRegistry.dispatchWith(entry, pinnedPlugin, context)
                    : pluginRegistry.dispatch(entry, context);
            renderedBy = dispatch.pluginName();
            blocks = new ArrayList<>(dispatch.blocks());
        } catch (RuntimeException e) {
            log.warn("[Render] Renderer failed on line {} of {}: {}", entry.getLineNumber(),
                    context.getScopeId(), e.getMessage());
            renderedBy = FAILURE_BLOCK_PREFIX;
            blocks = new ArrayList<>(List.of(RenderedBlock.error(
                    context.nextBlockId(FAILURE_BLOCK_PREFIX, entry.getLineNumber()),
                    entry,
                    "Render failed",
                    e.getClass().getSimpleName() + ": " + e.getMessage())));
        }
        return ParseResult.builder()
                .entry(entry)
                .blocks(blocks)
                .renderedBy(renderedBy)
                .error(entry.isError())
                .warning(entry.isWarning())
                .renderTimeMicros((System.nanoTime() - started) / 1_000)
                .build();
    }
}
