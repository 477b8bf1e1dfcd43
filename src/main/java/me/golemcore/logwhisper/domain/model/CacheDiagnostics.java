package me.golemcore.logwhisper.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of cache occupancy and cumulative counters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheDiagnostics {

    private long memoryEstimateBytes;
    private int residentChunks;
    private int maxResidentChunks;
    private int pinnedChunks;
    private int cachedResults;
    private int maxCachedResults;
    private long parseCount;
    private long chunkLoadCount;
    private long chunkEvictionCount;
    private long resultEvictionCount;
    private long cacheHitCount;
}
