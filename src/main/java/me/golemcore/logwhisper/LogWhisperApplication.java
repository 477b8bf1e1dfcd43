package me.golemcore.logwhisper;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for LogWhisper.
 *
 * <p>
 * LogWhisper is the parsing core of a log viewer built with Spring Boot 3.4.2.
 * It splits raw log text into entries, passes each entry through a
 * priority-ordered chain of renderer plugins and serves the results in chunks
 * so that multi-gigabyte files stay browsable.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Line Segmentation</b> - level and timestamp detection, stack traces
 * folded into their entry</li>
 * <li><b>SQL Correlation</b> - MyBatis-style {@code Preparing:} /
 * {@code Parameters:} pairs rebuilt into executable statements</li>
 * <li><b>JSON Repair</b> - embedded fragments pretty-printed, broken ones
 * repaired step by step</li>
 * <li><b>Error Highlighting</b> - error and warning keywords surfaced as
 * blocks</li>
 * <li><b>Chunked Loading</b> - prioritized background loading, LRU chunk
 * cache with pinned visible chunks</li>
 * <li><b>Result Cache</b> - whole-file results memoized by file
 * fingerprint</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → REST controllers, LogViewerPort
 * Domain Layer       → LineSegmenter, RenderOrchestration, ChunkManager, caches
 * Plugin Layer       → PluginRegistry, built-in renderer plugins
 * Infrastructure     → PriorityWorkerPool, configuration
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code logwhisper.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class LogWhisperApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogWhisperApplication.class, args);
    }

}
