package me.golemcore.logwhisper.domain.service;

import me.golemcore.logwhisper.domain.model.FileFingerprint;
import me.golemcore.logwhisper.domain.model.ParseResultSet;
import me.golemcore.logwhisper.domain.model.ParseStats;
import me.golemcore.logwhisper.infrastructure.config.LogWhisperProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParseResultCacheTest {

    private static final String AUTO = "auto";

    private LogWhisperProperties properties;
    private ParseResultCache cache;
    private AtomicInteger loads;

    @BeforeEach
    void setUp() {
        properties = new LogWhisperProperties();
        cache = new ParseResultCache(properties);
        loads = new AtomicInteger();
    }

    // ===== Memoization =====

    @Test
    void shouldServeSecondRequestFromCache() {
        FileFingerprint fingerprint = FileFingerprint.ofFile("/logs/app.log", 1000L, 10L);

        ParseResultCache.Lookup first = cache.getOrCompute(fingerprint, AUTO, loader("a")).join();
        ParseResultCache.Lookup second = cache.getOrCompute(fingerprint, AUTO, loader("b")).join();

        assertFalse(first.cached());
        assertTrue(second.cached());
        assertSame(first.resultSet(), second.resultSet());
        assertEquals(1, loads.get());
        assertEquals(1, cache.getHitCount());
        assertEquals(1, cache.getMissCount());
    }

    @Test
    void shouldKeySeparatelyByPlugin() {
        FileFingerprint fingerprint = FileFingerprint.ofFile("/logs/app.log", 1000L, 10L);

        cache.getOrCompute(fingerprint, AUTO, loader("a")).join();
        cache.getOrCompute(fingerprint, "json", loader("b")).join();

        assertEquals(2, loads.get());
        assertEquals(2, cache.size());
    }

    @Test
    void shouldShareInFlightComputation() {
        FileFingerprint fingerprint = LogFileReader.fingerprintContent("content");
        CompletableFuture<ParseResultSet> pending = new CompletableFuture<>();

        CompletableFuture<ParseResultCache.Lookup> first = cache.getOrCompute(fingerprint, AUTO, () -> {
            loads.incrementAndGet();
            return pending;
        });
        CompletableFuture<ParseResultCache.Lookup> second = cache.getOrCompute(fingerprint, AUTO, loader("x"));
        pending.complete(resultSet("shared"));

        assertEquals("shared", first.join().resultSet().getSource());
        assertEquals("shared", second.join().resultSet().getSource());
        assertEquals(1, loads.get());
    }

    @Test
    void shouldRetryAfterFailedComputation() {
        FileFingerprint fingerprint = LogFileReader.fingerprintContent("content");

        CompletableFuture<ParseResultCache.Lookup> failed = cache.getOrCompute(fingerprint, AUTO,
                () -> CompletableFuture.failedFuture(new IllegalStateException("boom")));
        assertThrows(CompletionException.class, failed::join);

        ParseResultCache.Lookup retried = cache.getOrCompute(fingerprint, AUTO, loader("ok")).join();
        assertFalse(retried.cached());
        assertEquals("ok", retried.resultSet().getSource());
    }

    // ===== Invalidation =====

    @Test
    void shouldDropResultsOfPreviousFingerprintWhenFileChanges() {
        FileFingerprint before = FileFingerprint.ofFile("/logs/app.log", 1000L, 10L);
        FileFingerprint after = FileFingerprint.ofFile("/logs/app.log", 2000L, 20L);
        cache.getOrCompute(before, AUTO, loader("old")).join();

        ParseResultCache.Lookup lookup = cache.getOrCompute(after, AUTO, loader("new")).join();

        assertFalse(lookup.cached());
        assertEquals("new", lookup.resultSet().getSource());
        assertEquals(1, cache.size());
        assertEquals(1, cache.getEvictionCount());
    }

    @Test
    void shouldEvictLeastRecentlyUsedResult() {
        properties.getCache().setMaxCachedResults(2);
        FileFingerprint a = LogFileReader.fingerprintContent("a");
        FileFingerprint b = LogFileReader.fingerprintContent("b");
        FileFingerprint c = LogFileReader.fingerprintContent("c");
        cache.getOrCompute(a, AUTO, loader("a")).join();
        cache.getOrCompute(b, AUTO, loader("b")).join();
        cache.getOrCompute(a, AUTO, loader("a2")).join();

        cache.getOrCompute(c, AUTO, loader("c")).join();

        assertEquals(2, cache.size());
        assertTrue(cache.getOrCompute(a, AUTO, loader("a3")).join().cached());
        assertFalse(cache.getOrCompute(b, AUTO, loader("b2")).join().cached());
    }

    @Test
    void shouldEvictEverythingOnDemand() {
        cache.getOrCompute(LogFileReader.fingerprintContent("a"), AUTO, loader("a")).join();
        cache.getOrCompute(LogFileReader.fingerprintContent("b"), AUTO, loader("b")).join();

        assertEquals(2, cache.evictAll());
        assertEquals(0, cache.size());
    }

    @Test
    void shouldBypassCacheWhenDisabled() {
        properties.getCache().setEnabled(false);
        FileFingerprint fingerprint = LogFileReader.fingerprintContent("a");

        cache.getOrCompute(fingerprint, AUTO, loader("a")).join();
        ParseResultCache.Lookup second = cache.getOrCompute(fingerprint, AUTO, loader("b")).join();

        assertFalse(second.cached());
        assertEquals(2, loads.get());
        assertEquals(0, cache.size());
    }

    private Supplier<CompletableFuture<ParseResultSet>> loader(String source) {
        return () -> {
            loads.incrementAndGet();
            return CompletableFuture.completedFuture(resultSet(source));
        };
    }

    private static ParseResultSet resultSet(String source) {
        return ParseResultSet.builder()
                .source(source)
                .pluginName(AUTO)
                .results(List.of())
                .stats(ParseStats.empty())
                .build();
    }
}
