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
import me.golemcore.logwhisper.domain.model.ChunkLayout;
import me.golemcore.logwhisper.domain.model.ChunkLoadRequest;
import me.golemcore.logwhisper.domain.model.ChunkLoadResponse;
import me.golemcore.logwhisper.domain.model.ChunkPriority;
import me.golemcore.logwhisper.domain.model.FileFingerprint;
import me.golemcore.logwhisper.domain.model.LogEntry;
import me.golemcore.logwhisper.domain.model.LogInputException;
import me.golemcore.logwhisper.domain.model.ParseRequest;
import me.golemcore.logwhisper.domain.model.ParseResult;
import me.golemcore.logwhisper.infrastructure.concurrent.PriorityWorkerPool;
import me.golemcore.logwhisper.infrastructure.config.LogWhisperProperties;
import me.golemcore.logwhisper.plugin.context.PluginRegistryService;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * On-demand loading of large files in fixed-size line chunks.
 *
 * <p>
 * Opening a file only counts its lines. Chunks are read, segmented and rendered
 * when requested, on the priority worker pool, and kept in the
 * {@link ChunkCache}. Concurrent requests for the same chunk share one load,
 * unless a request has a higher priority than the load in flight, in which case
 * a new load is queued ahead of it.
 *
 * <p>
 * Each chunk is its own render scope: entries are segmented within the chunk,
 * and SQL statements are not correlated across chunk boundaries.
 */
@Service
@Slf4j
public class ChunkManagerService {

    private static final int LARGE_FILE_LINES = 100_000;
    private static final int MEDIUM_FILE_LINES = 10_000;

    private final LogFileReader fileReader;
    private final LineSegmenter segmenter;
    private final RenderOrchestrationService orchestration;
    private final PluginRegistryService pluginRegistry;
    private final ChunkCache chunkCache;
    private final PriorityWorkerPool workerPool;
    private final LogWhisperProperties properties;

    private final Map<Path, OpenFile> openFiles = new ConcurrentHashMap<>();
    private final Map<LoadKey, InFlightLoad> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong chunkLoadCount = new AtomicLong();

    public ChunkManagerService(LogFileReader fileReader, LineSegmenter segmenter,
            RenderOrchestrationService orchestration, PluginRegistryService pluginRegistry, ChunkCache chunkCache,
            PriorityWorkerPool workerPool, LogWhisperProperties properties) {
        this.fileReader = fileReader;
        this.segmenter = segmenter;
        this.orchestration = orchestration;
        this.pluginRegistry = pluginRegistry;
        this.chunkCache = chunkCache;
        this.workerPool = workerPool;
        this.properties = properties;
    }

    private record LoadKey(FileFingerprint fingerprint, int index, String pluginName) {
    }

    private record InFlightLoad(CompletableFuture<List<ParseResult>> future, ChunkPriority priority) {
    }

    private static final class OpenFile {

        private final Path path;
        private final ChunkLayout layout;
        private final LogFileReader.LineIndex lineIndex;
        private final AtomicLong visibilityGeneration = new AtomicLong();
        private volatile Set<Integer> visible = Set.of();

        OpenFile(Path path, ChunkLayout layout, LogFileReader.LineIndex lineIndex) {
            this.path = path;
            this.layout = layout;
            this.lineIndex = lineIndex;
        }

        FileFingerprint fingerprint() {
            return layout.getFingerprint();
        }
    }

    /**
     * Validates a file and partitions it into chunks. Reopening an unchanged
     * file returns the existing layout; a changed file is re-partitioned and its
     * cached chunks are dropped.
     */
    public ChunkLayout openFile(String filePath) {
        return open(filePath).layout;
    }

    /**
     * Loads chunks and reports each one as loaded or failed. Chunks that loaded
     * are returned even when others failed.
     */
    public ChunkLoadResponse loadChunks(ChunkLoadRequest request) {
        if (request.getChunkIndices() == null || request.getChunkIndices().isEmpty()) {
            throw new LogInputException("At least one chunk index is required");
        }
        String pluginName = ParseRequest.normalizePluginName(request.getPluginName());
        if (!ParseRequest.AUTO.equals(pluginName)) {
            pluginRegistry.requirePlugin(pluginName);
        }
        ChunkPriority priority = request.getPriority() != null ? request.getPriority() : ChunkPriority.NORMAL;
        OpenFile file = open(request.getFilePath());
        int chunkCount = file.layout.getChunkCount();

        Map<Integer, String> errors = new LinkedHashMap<>();
        Map<Integer, CompletableFuture<List<ParseResult>>> pending = new LinkedHashMap<>();
        for (Integer index : new LinkedHashSet<>(request.getChunkIndices())) {
            if (index == null) {
                throw new LogInputException("Chunk indices must not be null");
            }
            if (!file.layout.contains(index)) {
                errors.put(index, "Chunk index out of range, file has " + chunkCount + " chunks");
                continue;
            }
            pending.put(index, load(file, index, priority, pluginName));
        }

        Map<Integer, List<ParseResult>> chunks = new LinkedHashMap<>();
        long deadline = System.nanoTime() + properties.getWorkers().getRequestTimeout().toNanos();
        for (Map.Entry<Integer, CompletableFuture<List<ParseResult>>> entry : pending.entrySet()) {
            int index = entry.getKey();
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                chunks.put(index, entry.getValue().get(remaining, TimeUnit.NANOSECONDS));
            } catch (CancellationException e) {
                errors.put(index, "Load cancelled, chunk is no longer visible");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof CancellationException) {
                    errors.put(index, "Load cancelled, chunk is no longer visible");
                } else {
                    log.warn("[Chunks] Failed to load chunk {} of {}: {}", index, file.path, cause.getMessage());
                    errors.put(index, cause.getMessage());
                }
            } catch (TimeoutException e) {
                errors.put(index, "Timed out waiting for chunk");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                errors.put(index, "Interrupted while waiting for chunk");
            }
        }
        return ChunkLoadResponse.builder()
                .chunks(chunks)
                .errors(errors)
                .memoryBytes(chunkCache.memoryBytes())
                .build();
    }

    /**
     * Marks the chunks in view. They are pinned in the cache, queued loads of
     * other chunks become stale unless they are {@link ChunkPriority#IMMEDIATE},
     * and the chunks after the view are preloaded.
     */
    public List<ChunkInfo> setVisibleChunks(String filePath, List<Integer> indices) {
        OpenFile file = open(filePath);
        Set<Integer> visible = new LinkedHashSet<>();
        if (indices != null) {
            for (Integer index : indices) {
                if (index != null && file.layout.contains(index)) {
                    visible.add(index);
                }
            }
        }
        file.visible = Set.copyOf(visible);
        file.visibilityGeneration.incrementAndGet();
        chunkCache.pin(file.fingerprint(), visible);
        log.debug("[Chunks] Visible chunks of {}: {}", file.path, visible);

        if (!visible.isEmpty()) {
            int last = visible.stream().mapToInt(Integer::intValue).max().orElse(0);
            preload(file, last + 1);
        }
        return describe(file, ParseRequest.AUTO);
    }

    /**
     * Queues the chunks following {@code startChunk} at
     * {@link ChunkPriority#LOW}.
     *
     * @return indices of the chunks queued
     */
    public List<Integer> preloadChunks(String filePath, int startChunk) {
        return preload(open(filePath), startChunk);
    }

    public List<ChunkInfo> getChunkStatus(String filePath) {
        return describe(open(filePath), ParseRequest.AUTO);
    }

    public int evictAll() {
        int evicted = chunkCache.evictAll();
        log.info("[Chunks] Evicted {} chunks", evicted);
        return evicted;
    }

    public long getChunkLoadCount() {
        return chunkLoadCount.get();
    }

    int chunkSizeFor(int totalLines) {
        LogWhisperProperties.ChunksProperties chunks = properties.getChunks();
        int size = chunks.getChunkSize();
        if (chunks.isAdaptive()) {
            if (totalLines > LARGE_FILE_LINES) {
                size = totalLines / 1000;
            } else if (totalLines > MEDIUM_FILE_LINES) {
                size = totalLines / 100;
            }
        }
        return Math.max(chunks.getMinChunkSize(), Math.min(chunks.getMaxChunkSize(), size));
    }

    private OpenFile open(String filePath) {
        Path path = fileReader.validate(filePath);
        FileFingerprint fingerprint = fileReader.fingerprint(path);
        OpenFile existing = openFiles.get(path);
        if (existing != null && existing.fingerprint().equals(fingerprint)) {
            return existing;
        }
        int interval = Math.max(1, properties.getChunks().getMinChunkSize());
        LogFileReader.LineIndex lineIndex = fileReader.indexLines(path, interval);
        ChunkLayout layout = ChunkLayout.builder()
                .fingerprint(fingerprint)
                .totalLines(lineIndex.totalLines())
                .chunkSize(chunkSizeFor(lineIndex.totalLines()))
                .offsetInterval(lineIndex.interval())
                .lineOffsets(lineIndex.offsets())
                .build();
        OpenFile opened = new OpenFile(path, layout, lineIndex);
        openFiles.put(path, opened);
        chunkCache.evictStale(fingerprint);
        log.info("[Chunks] Opened {}: {} lines in {} chunks of {} lines", path, layout.getTotalLines(),
                layout.getChunkCount(), layout.getChunkSize());
        return opened;
    }

    private List<Integer> preload(OpenFile file, int startChunk) {
        List<Integer> queued = new ArrayList<>();
        int count = properties.getChunks().getPreloadCount();
        for (int index = Math.max(0, startChunk); index < startChunk + count; index++) {
            if (!file.layout.contains(index)) {
                break;
            }
            if (chunkCache.contains(file.fingerprint(), index, ParseRequest.AUTO)) {
                continue;
            }
            int chunk = index;
            load(file, index, ChunkPriority.LOW, ParseRequest.AUTO).whenComplete((results, error) -> {
                if (error != null) {
                    log.debug("[Chunks] Preload of chunk {} of {} did not complete: {}", chunk, file.path,
                            error.getMessage());
                }
            });
            queued.add(index);
        }
        return queued;
    }

    private CompletableFuture<List<ParseResult>> load(OpenFile file, int index, ChunkPriority priority,
            String pluginName) {
        FileFingerprint fingerprint = file.fingerprint();
        Optional<List<ParseResult>> cached = chunkCache.get(fingerprint, index, pluginName);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(cached.get());
        }
        LoadKey key = new LoadKey(fingerprint, index, pluginName);
        CompletableFuture<List<ParseResult>> created = new CompletableFuture<>();
        InFlightLoad candidate = new InFlightLoad(created, priority);
        InFlightLoad winner = inFlight.compute(key, (k, current) -> {
            if (current != null && !current.future().isDone() && !priority.isHigherThan(current.priority())) {
                return current;
            }
            return candidate;
        });
        if (winner != candidate) {
            return winner.future();
        }
        long generation = file.visibilityGeneration.get();
        workerPool.submit(priority,
                () -> renderChunk(file, key),
                () -> isStillWanted(file, key, priority, generation))
                .whenComplete((results, error) -> {
                    inFlight.remove(key, candidate);
                    if (error != null) {
                        created.completeExceptionally(error);
                    } else {
                        created.complete(results);
                    }
                });
        return created;
    }

    private boolean isStillWanted(OpenFile file, LoadKey key, ChunkPriority priority, long generation) {
        if (chunkCache.contains(key.fingerprint(), key.index(), key.pluginName())) {
            return true;
        }
        if (priority == ChunkPriority.IMMEDIATE || file.visibilityGeneration.get() == generation) {
            return true;
        }
        return file.visible.contains(key.index());
    }

    private List<ParseResult> renderChunk(OpenFile file, LoadKey key) {
        Optional<List<ParseResult>> cached = chunkCache.get(key.fingerprint(), key.index(), key.pluginName());
        if (cached.isPresent()) {
            return cached.get();
        }
        if (!fileReader.fingerprint(file.path).equals(key.fingerprint())) {
            throw new LogInputException("File changed since it was opened, reopen it: " + file.path);
        }
        int startLine = file.layout.startLine(key.index());
        int endLine = file.layout.endLine(key.index());
        List<String> lines = fileReader.readLines(file.path, file.lineIndex, startLine, endLine);
        List<LogEntry> entries = segmenter.segment(lines.stream(), startLine);
        String scopeId = key.fingerprint().asKey() + "#chunk-" + key.index() + "/" + key.pluginName();
        List<ParseResult> results = orchestration.render(scopeId, entries, key.pluginName());
        chunkCache.put(key.fingerprint(), key.index(), key.pluginName(), results);
        chunkLoadCount.incrementAndGet();
        log.debug("[Chunks] Loaded chunk {} of {} (lines {}-{}, {} entries)", key.index(), file.path,
                startLine, endLine, results.size());
        return results;
    }

    private List<ChunkInfo> describe(OpenFile file, String pluginName) {
        List<ChunkInfo> described = new ArrayList<>();
        for (ChunkInfo chunk : file.layout.describeChunks()) {
            described.add(chunkCache.describe(file.fingerprint(), chunk, pluginName));
        }
        return described;
    }
}
