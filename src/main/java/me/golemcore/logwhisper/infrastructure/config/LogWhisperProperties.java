package me.golemcore.logwhisper.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code logwhisper.*} prefix:
 * <ul>
 * <li>{@link ParserProperties} - segmentation switches</li>
 * <li>{@link FilesProperties} - accepted extensions and size ceiling</li>
 * <li>{@link ChunksProperties} - chunk sizing and resident chunk bound</li>
 * <li>{@link CacheProperties} - whole-file result cache bound</li>
 * <li>{@link WorkersProperties} - worker pool sizing</li>
 * <li>{@link PluginProperties} - per-plugin enablement, priority and
 * configuration</li>
 * </ul>
 *
 * <p>
 * Persisted user settings (enabled plugins, chunk size, memory ceiling) are
 * supplied through these properties by the hosting shell.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "logwhisper")
@Data
public class LogWhisperProperties {

    private ParserProperties parser = new ParserProperties();
    private FilesProperties files = new FilesProperties();
    private ChunksProperties chunks = new ChunksProperties();
    private CacheProperties cache = new CacheProperties();
    private WorkersProperties workers = new WorkersProperties();
    private Map<String, PluginProperties> plugins = new HashMap<>();

    @Data
    public static class ParserProperties {
        /** Fold stack traces and other continuation lines into the previous entry. */
        private boolean mergeContinuations = true;
    }

    @Data
    public static class FilesProperties {
        private List<String> supportedExtensions = new ArrayList<>(List.of("log", "txt", "out", "json"));
        /** Files larger than this are rejected. Default: 2 GiB. */
        private long maxFileSize = 2L * 1024 * 1024 * 1024;
        /** Whole-file parse reads the complete content; larger files must be browsed by chunks. */
        private long maxWholeParseSize = 256L * 1024 * 1024;
    }

    // ==================== CHUNKS ====================

    @Data
    public static class ChunksProperties {
        private int chunkSize = 200;
        private int minChunkSize = 50;
        private int maxChunkSize = 1000;
        private boolean adaptive = true;
        private int maxResidentChunks = 50;
        private int preloadCount = 5;
    }

    // ==================== CACHE ====================

    @Data
    public static class CacheProperties {
        private boolean enabled = true;
        private int maxCachedResults = 16;
    }

    // ==================== WORKERS ====================

    @Data
    public static class WorkersProperties {
        private int poolSize = Math.max(2, Runtime.getRuntime().availableProcessors());
        private Duration requestTimeout = Duration.ofMinutes(5);
    }

    // ==================== PLUGINS ====================

    @Data
    public static class PluginProperties {
        private Boolean enabled;
        private Integer priority;
        private Map<String, Object> config = new LinkedHashMap<>();
    }
}
