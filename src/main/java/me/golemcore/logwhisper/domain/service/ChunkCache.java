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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.logwhisper.domain.model.ChunkInfo;
import me.golemcore.logwhisper.domain.model.FileFingerprint;
import me.golemcore.logwhisper.domain.model.ParseResult;
import me.golemcore.logwhisper.infrastructure.config.LogWhisperProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Bounded store of rendered chunks with least-recently-used eviction. The map
 * is kept in recency order, eldest first.
 *
 * <p>
 * Chunks are stored whole, so readers never observe a partially rendered
 * chunk. A chunk is identified by file fingerprint, index and the plugin it was
 * rendered with. Pins apply to a chunk position regardless of plugin. Pinned
 * chunks (the ones currently visible) are never evicted; when every resident
 * chunk is pinned the cache may exceed its bound until pins are released.
 */
@Component
@Slf4j
public class ChunkCache {

    private final LogWhisperProperties properties;
    private final Clock clock;

    private final Object lock = new Object();
    private final LinkedHashMap<ChunkKey, CachedChunk> chunks = new LinkedHashMap<>();
    private final Set<ChunkSlot> pinned = new HashSet<>();

    private final AtomicLong insertCount = new AtomicLong();
    private final AtomicLong evictionCount = new AtomicLong();

    public ChunkCache(LogWhisperProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    record ChunkSlot(FileFingerprint fingerprint, int index) {
    }

    record ChunkKey(ChunkSlot slot, String pluginName) {

        ChunkKey(FileFingerprint fingerprint, int index, String pluginName) {
            this(new ChunkSlot(fingerprint, index), pluginName);
        }

        String source() {
            return slot.fingerprint().source();
        }
    }

    private static final class CachedChunk {

        private final List<ParseResult> results;
        private final long memoryBytes;
        private Instant lastAccess;

        CachedChunk(List<ParseResult> results, long memoryBytes, Instant lastAccess) {
            this.results = results;
            this.memoryBytes = memoryBytes;
            this.lastAccess = lastAccess;
        }
    }

    public Optional<List<ParseResult>> get(FileFingerprint fingerprint, int index, String pluginName) {
        synchronized (lock) {
            CachedChunk chunk = touch(new ChunkKey(fingerprint, index, pluginName));
            return chunk != null ? Optional.of(chunk.results) : Optional.empty();
        }
    }

    /**
     * Stores a rendered chunk. A chunk that is already resident is kept and only
     * marked as accessed.
     *
     * @return {@code true} if the chunk was inserted
     */
    public boolean put(FileFingerprint fingerprint, int index, String pluginName, List<ParseResult> results) {
        ChunkKey key = new ChunkKey(fingerprint, index, pluginName);
        List<ParseResult> frozen = List.copyOf(results);
        long memoryBytes = 0;
        for (ParseResult result : frozen) {
            memoryBytes += result.estimateMemoryBytes();
        }
        synchronized (lock) {
            if (touch(key) != null) {
                return false;
            }
            chunks.put(key, new CachedChunk(frozen, memoryBytes, clock.instant()));
            insertCount.incrementAndGet();
            evictOverflow();
            return true;
        }
    }

    /**
     * Replaces the pinned chunks of a file.
     */
    public void pin(FileFingerprint fingerprint, Collection<Integer> indices) {
        synchronized (lock) {
            pinned.removeIf(slot -> slot.fingerprint().source().equals(fingerprint.source()));
            for (Integer index : indices) {
                pinned.add(new ChunkSlot(fingerprint, index));
            }
            evictOverflow();
        }
    }

    /**
     * Drops chunks and pins of the file that belong to an older fingerprint.
     *
     * @return number of chunks dropped
     */
    public int evictStale(FileFingerprint current) {
        synchronized (lock) {
            int removed = removeMatching(key -> key.source().equals(current.source())
                    && !key.slot().fingerprint().equals(current), true);
            pinned.removeIf(slot -> slot.fingerprint().source().equals(current.source())
                    && !slot.fingerprint().equals(current));
            if (removed > 0) {
                log.info("[Chunks] {} changed, dropped {} stale chunks", current.source(), removed);
            }
            return removed;
        }
    }

    /**
     * Drops every chunk that is not pinned.
     *
     * @return number of chunks dropped
     */
    public int evictAll() {
        synchronized (lock) {
            return removeMatching(key -> true, false);
        }
    }

    /**
     * Fills the runtime fields of a chunk descriptor.
     */
    public ChunkInfo describe(FileFingerprint fingerprint, ChunkInfo chunk, String pluginName) {
        ChunkKey key = new ChunkKey(fingerprint, chunk.getIndex(), pluginName);
        synchronized (lock) {
            CachedChunk cached = chunks.get(key);
            return chunk.toBuilder()
                    .loaded(cached != null)
                    .pinned(pinned.contains(key.slot()))
                    .lastAccess(cached != null ? cached.lastAccess : null)
                    .memoryBytes(cached != null ? cached.memoryBytes : 0)
                    .build();
        }
    }

    public boolean contains(FileFingerprint fingerprint, int index, String pluginName) {
        synchronized (lock) {
            return chunks.containsKey(new ChunkKey(fingerprint, index, pluginName));
        }
    }

    public boolean isPinned(FileFingerprint fingerprint, int index) {
        synchronized (lock) {
            return pinned.contains(new ChunkSlot(fingerprint, index));
        }
    }

    public int size() {
        synchronized (lock) {
            return chunks.size();
        }
    }

    public int pinnedCount() {
        synchronized (lock) {
            int count = 0;
            for (ChunkKey key : chunks.keySet()) {
                if (pinned.contains(key.slot())) {
                    count++;
                }
            }
            return count;
        }
    }

    public long memoryBytes() {
        synchronized (lock) {
            long total = 0;
            for (CachedChunk chunk : chunks.values()) {
                total += chunk.memoryBytes;
            }
            return total;
        }
    }

    public int maxResidentChunks() {
        return Math.max(1, properties.getChunks().getMaxResidentChunks());
    }

    public long getInsertCount() {
        return insertCount.get();
    }

    public long getEvictionCount() {
        return evictionCount.get();
    }

    /**
     * Moves a resident chunk to the most recently used end.
     */
    private CachedChunk touch(ChunkKey key) {
        CachedChunk chunk = chunks.remove(key);
        if (chunk == null) {
            return null;
        }
        chunk.lastAccess = clock.instant();
        chunks.put(key, chunk);
        return chunk;
    }

    private void evictOverflow() {
        int bound = maxResidentChunks();
        Iterator<Map.Entry<ChunkKey, CachedChunk>> eldest = chunks.entrySet().iterator();
        while (chunks.size() > bound && eldest.hasNext()) {
            ChunkKey key = eldest.next().getKey();
            if (pinned.contains(key.slot())) {
                continue;
            }
            eldest.remove();
            evictionCount.incrementAndGet();
            log.debug("[Chunks] Evicted chunk {} of {}", key.slot().index(), key.source());
        }
    }

    private int removeMatching(Predicate<ChunkKey> filter, boolean includePinned) {
        int removed = 0;
        Iterator<ChunkKey> keys = chunks.keySet().iterator();
        while (keys.hasNext()) {
            ChunkKey key = keys.next();
            if (filter.test(key) && (includePinned || !pinned.contains(key.slot()))) {
                keys.remove();
                removed++;
            }
        }
        evictionCount.addAndGet(removed);
        return removed;
    }
}
