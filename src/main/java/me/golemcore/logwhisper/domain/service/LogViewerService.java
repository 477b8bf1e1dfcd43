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
import me.golemcore.logwhisper.domain.model.CacheDiagnostics;
import me.golemcore.logwhisper.domain.model.ChunkInfo;
import me.golemcore.logwhisper.domain.model.ChunkLayout;
import me.golemcore.logwhisper.domain.model.ChunkLoadRequest;
import me.golemcore.logwhisper.domain.model.ChunkLoadResponse;
import me.golemcore.logwhisper.domain.model.EvictionResult;
import me.golemcore.logwhisper.domain.model.ParseRequest;
import me.golemcore.logwhisper.domain.model.ParseResponse;
import me.golemcore.logwhisper.domain.model.PluginCapability;
import me.golemcore.logwhisper.domain.model.PluginUpdate;
import me.golemcore.logwhisper.plugin.context.PluginRegistryService;
import me.golemcore.logwhisper.port.inbound.LogViewerPort;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Facade implementing {@link LogViewerPort} on top of the parse, chunk and
 * registry services.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LogViewerService implements LogViewerPort {

    private final LogParseService parseService;
    private final ChunkManagerService chunkManager;
    private final PluginRegistryService pluginRegistry;
    private final ChunkCache chunkCache;
    private final ParseResultCache resultCache;

    @Override
    public ParseResponse parse(ParseRequest request) {
        return parseService.parse(request);
    }

    @Override
    public ChunkLayout openFile(String filePath) {
        return chunkManager.openFile(filePath);
    }

    @Override
    public ChunkLoadResponse loadChunks(ChunkLoadRequest request) {
        return chunkManager.loadChunks(request);
    }

    @Override
    public List<ChunkInfo> setVisibleChunks(String filePath, List<Integer> chunkIndices) {
        return chunkManager.setVisibleChunks(filePath, chunkIndices);
    }

    @Override
    public List<PluginCapability> listPlugins() {
        return pluginRegistry.listPlugins();
    }

    @Override
    public PluginCapability updatePlugin(PluginUpdate update) {
        return pluginRegistry.updatePlugin(update);
    }

    @Override
    public EvictionResult evictAll() {
        int chunks = chunkManager.evictAll();
        int results = resultCache.evictAll();
        log.info("[Cache] Forced eviction: {} chunks, {} results", chunks, results);
        return new EvictionResult(chunks, results);
    }

    @Override
    public CacheDiagnostics diagnostics() {
        return CacheDiagnostics.builder()
                .memoryEstimateBytes(chunkCache.memoryBytes())
                .residentChunks(chunkCache.size())
                .maxResidentChunks(chunkCache.maxResidentChunks())
                .pinnedChunks(chunkCache.pinnedCount())
                .cachedResults(resultCache.size())
                .maxCachedResults(resultCache.maxSize())
                .parseCount(parseService.getParseCount())
                .chunkLoadCount(chunkManager.getChunkLoadCount())
                .chunkEvictionCount(chunkCache.getEvictionCount())
                .resultEvictionCount(resultCache.getEvictionCount())
                .cacheHitCount(resultCache.getHitCount())
                .build();
    }
}
