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
import me.golemcore.logwhisper.domain.model.FileFingerprint;
import me.golemcore.logwhisper.domain.model.ParseResultSet;
import me.golemcore.logwhisper.infrastructure.config.LogWhisperProperties;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Memoizes whole-source parse results by content fingerprint and plugin name.
 *
 * <p>
 * The first request for a key starts the parse; concurrent requests for the
 * same key join its future, so a source is parsed once no matter how many
 * callers ask. Failed parses are dropped so the next request retries. A new
 * fingerprint for a file path invalidates the results of the previous one.
 * Completed results are bounded and evicted least recently used first.
 */
@Component
@Slf4j
public class ParseResultCache {

    private final LogWhisperProperties properties;
    private final Map<CacheKey, CompletableFuture<ParseResultSet>> results = new ConcurrentHashMap<>();
    private final Map<String, FileFingerprint> currentFingerprints = new ConcurrentHashMap<>();
    private final LinkedHashMap<CacheKey, Boolean> recency = new LinkedHashMap<>(16, 0.75f, true);

    private final AtomicLong hitCount = new AtomicLong();
    private final AtomicLong missCount = new AtomicLong();
    private final AtomicLong evictionCount = new AtomicLong();

    public ParseResultCache(LogWhisperProperties properties) {
        this.properties = properties;
    }

    record CacheKey(FileFingerprint fingerprint, String pluginName) {
    }

    /**
     * A parse result and whether it was served by an earlier or concurrent
     * computation.
     */
    public record Lookup(ParseResultSet resultSet, boolean cached) {
    }

    /**
     * Returns the memoized result for the key, or starts {@code loader} if there
     * is none. {@code loader} must only schedule the work and return its future.
     */
    public CompletableFuture<Lookup> getOrCompute(FileFingerprint fingerprint, String pluginName,
            Supplier<CompletableFuture<ParseResultSet>> loader) {
        if (!properties.getCache().isEnabled()) {
            missCount.incrementAndGet();
            return loader.get().thenApply(resultSet -> new Lookup(resultSet, false));
        }
        if (!fingerprint.isInline()) {
            invalidateStale(fingerprint);
        }

        CacheKey key = new CacheKey(fingerprint, pluginName);
        boolean[] started = new boolean[1];
        CompletableFuture<ParseResultSet> future = results.computeIfAbsent(key, k -> {
            started[0] = true;
            return loader.get();
        });

        if (!started[0]) {
            hitCount.incrementAndGet();
            touch(key);
            log.debug("[Cache] Hit for {} ({})", fingerprint.asKey(), pluginName);
            return future.thenApply(resultSet -> new Lookup(resultSet, true));
        }

        missCount.incrementAndGet();
        future.whenComplete((resultSet, error) -> {
            if (error != null) {
                results.remove(key, future);
                log.debug("[Cache] Not caching failed parse of {}: {}", fingerprint.asKey(), error.getMessage());
            } else {
                admit(key);
            }
        });
        return future.thenApply(resultSet -> new Lookup(resultSet, false));
    }

    public int evictAll() {
        int evicted;
        synchronized (recency) {
            evicted = results.size();
            results.clear();
            recency.clear();
        }
        currentFingerprints.clear();
        evictionCount.addAndGet(evicted);
        log.info("[Cache] Evicted {} parse results", evicted);
        return evicted;
    }

    public int size() {
        return results.size();
    }

    public int maxSize() {
        return Math.max(1, properties.getCache().getMaxCachedResults());
    }

    public long getHitCount() {
        return hitCount.get();
    }

    public long getMissCount() {
        return missCount.get();
    }

    public long getEvictionCount() {
        return evictionCount.get();
    }

    private void invalidateStale(FileFingerprint fingerprint) {
        FileFingerprint previous = currentFingerprints.put(fingerprint.source(), fingerprint);
        if (previous == null || previous.equals(fingerprint)) {
            return;
        }
        int removed = 0;
        synchronized (recency) {
            Iterator<CacheKey> keys = results.keySet().iterator();
            while (keys.hasNext()) {
                CacheKey key = keys.next();
                if (key.fingerprint().equals(previous)) {
                    keys.remove();
                    recency.remove(key);
                    removed++;
                }
            }
        }
        evictionCount.addAndGet(removed);
        log.info("[Cache] {} changed, dropped {} stale results", fingerprint.source(), removed);
    }

    private void touch(CacheKey key) {
        synchronized (recency) {
            recency.get(key);
        }
    }

    private void admit(CacheKey key) {
        int bound = maxSize();
        synchronized (recency) {
            if (!results.containsKey(key)) {
                log.warn("[Cache] Result for {} was evicted while in flight", key.fingerprint().asKey());
                return;
            }
            recency.put(key, Boolean.TRUE);
            Iterator<CacheKey> eldest = recency.keySet().iterator();
            while (recency.size() > bound && eldest.hasNext()) {
                CacheKey victim = eldest.next();
                eldest.remove();
                results.remove(victim);
                evictionCount.incrementAndGet();
                log.debug("[Cache] Evicted {} ({})", victim.fingerprint().asKey(), victim.pluginName());
            }
        }
    }
}
