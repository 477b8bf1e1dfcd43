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
import me.golemcore.logwhisper.domain.model.ChunkPriority;
import me.golemcore.logwhisper.domain.model.ErrorKind;
import me.golemcore.logwhisper.domain.model.FileFingerprint;
import me.golemcore.logwhisper.domain.model.LogEntry;
import me.golemcore.logwhisper.domain.model.LogInputException;
import me.golemcore.logwhisper.domain.model.LogWhisperException;
import me.golemcore.logwhisper.domain.model.ParseRequest;
import me.golemcore.logwhisper.domain.model.ParseResponse;
import me.golemcore.logwhisper.domain.model.ParseResultSet;
import me.golemcore.logwhisper.infrastructure.concurrent.PriorityWorkerPool;
import me.golemcore.logwhisper.infrastructure.config.LogWhisperProperties;
import me.golemcore.logwhisper.plugin.context.PluginRegistryService;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Whole-source parsing of inline content or a file.
 *
 * <p>
 * Parses run on the worker pool and are memoized in the
 * {@link ParseResultCache}: asking again for an unchanged source returns the
 * earlier result, and concurrent requests for the same source share a single
 * parse. Failures are reported in the response, never thrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LogParseService {

    private final LineSegmenter segmenter;
    private final LogFileReader fileReader;
    private final RenderOrchestrationService orchestration;
    private final PluginRegistryService pluginRegistry;
    private final ParseResultCache resultCache;
    private final PriorityWorkerPool workerPool;
    private final LogWhisperProperties properties;

    private final AtomicLong parseCount = new AtomicLong();

    public ParseResponse parse(ParseRequest request) {
        try {
            ParseResultCache.Lookup lookup = await(submit(request));
            return ParseResponse.success(lookup.resultSet(), lookup.cached());
        } catch (LogWhisperException e) {
            log.info("[Parse] Rejected request: {}", e.getMessage());
            return ParseResponse.failure(e.getKind(), e.getMessage());
        } catch (TimeoutException e) {
            log.warn("[Parse] Timed out after {}", properties.getWorkers().getRequestTimeout());
            return ParseResponse.failure(ErrorKind.INTERNAL, "Parse timed out");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ParseResponse.failure(ErrorKind.INTERNAL, "Parse interrupted");
        } catch (RuntimeException e) {
            log.error("[Parse] Unexpected failure", e);
            return ParseResponse.failure(ErrorKind.INTERNAL, e.getMessage());
        }
    }

    /**
     * Starts (or joins) the parse of a request. Request validation errors are
     * thrown immediately.
     */
    public CompletableFuture<ParseResultCache.Lookup> submit(ParseRequest request) {
        if (request == null) {
            throw new LogInputException("Empty request");
        }
        boolean hasContent = request.getContent() != null && !request.getContent().isEmpty();
        boolean hasFile = request.getFilePath() != null && !request.getFilePath().isBlank();
        if (hasContent == hasFile) {
            throw new LogInputException(hasContent
                    ? "Provide either content or a file path, not both"
                    : "Empty request: provide content or a file path");
        }
        String pluginName = ParseRequest.normalizePluginName(request.getPluginName());
        if (!ParseRequest.AUTO.equals(pluginName)) {
            pluginRegistry.requirePlugin(pluginName);
        }

        if (hasContent) {
            String content = request.getContent();
            FileFingerprint fingerprint = LogFileReader.fingerprintContent(content);
            return resultCache.getOrCompute(fingerprint, pluginName,
                    onPool(() -> parseText(FileFingerprint.INLINE_SOURCE, content, fingerprint, pluginName)));
        }
        Path path = fileReader.validate(request.getFilePath());
        FileFingerprint fingerprint = fileReader.fingerprint(path);
        return resultCache.getOrCompute(fingerprint, pluginName,
                onPool(() -> parseText(path.toString(), fileReader.readContent(path), fingerprint, pluginName)));
    }

    public long getParseCount() {
        return parseCount.get();
    }

    private Supplier<CompletableFuture<ParseResultSet>> onPool(Supplier<ParseResultSet> work) {
        return () -> workerPool.submit(ChunkPriority.HIGH, work);
    }

    private ParseResultSet parseText(String source, String text, FileFingerprint fingerprint, String pluginName) {
        List<LogEntry> entries = segmenter.segment(text);
        ParseResultSet resultSet = orchestration.renderAll(source, fingerprint.asKey() + "/" + pluginName, entries,
                pluginName);
        parseCount.incrementAndGet();
        log.info("[Parse] Parsed {}: {} entries, {} blocks in {} ms", source,
                resultSet.getStats().getTotalEntries(), resultSet.getStats().getBlockCount(),
                resultSet.getStats().getElapsedMillis());
        return resultSet;
    }

    private ParseResultCache.Lookup await(CompletableFuture<ParseResultCache.Lookup> future)
            throws TimeoutException, InterruptedException {
        try {
            return future.get(properties.getWorkers().getRequestTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Parse failed", cause);
        }
    }
}
