package me.golemcore.logwhisper.port.inbound;

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

import java.util.List;

/**
 * Inbound port of the log viewer: everything a hosting shell (desktop UI, REST
 * adapter) can ask of the parsing core.
 */
public interface LogViewerPort {

    /**
     * Parses inline content or a whole file. Failures are reported in the
     * response.
     */
    ParseResponse parse(ParseRequest request);

    /**
     * Validates a file and partitions it into chunks without rendering.
     */
    ChunkLayout openFile(String filePath);

    /**
     * Loads and renders chunks of a file, reporting per-chunk failures.
     */
    ChunkLoadResponse loadChunks(ChunkLoadRequest request);

    /**
     * Pins the chunks in view and cancels queued loads of chunks out of view.
     */
    List<ChunkInfo> setVisibleChunks(String filePath, List<Integer> chunkIndices);

    List<PluginCapability> listPlugins();

    /**
     * Enables/disables a plugin or replaces its configuration, effective on
     * the next dispatch.
     */
    PluginCapability updatePlugin(PluginUpdate update);

    /**
     * Drops cached chunks (except visible ones) and cached parse results.
     */
    EvictionResult evictAll();

    CacheDiagnostics diagnostics();
}
