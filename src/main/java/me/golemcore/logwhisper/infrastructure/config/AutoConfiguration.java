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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.logwhisper.domain.model.PluginCapability;
import me.golemcore.logwhisper.plugin.context.PluginRegistryService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration of shared infrastructure beans and startup logging.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the {@link Clock} used by time-based plugin state and cache
 * bookkeeping</li>
 * <li>Provides the {@link ObjectMapper} shared by the JSON renderer and the
 * web layer</li>
 * <li>Initializes the plugin registry eagerly and logs the dispatch
 * order</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final LogWhisperProperties properties;
    private final PluginRegistryService pluginRegistryService;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("LogWhisper v{} starting...", version);
        log.info("Chunk size: {} (adaptive: {}), resident chunks: {}",
                properties.getChunks().getChunkSize(),
                properties.getChunks().isAdaptive(),
                properties.getChunks().getMaxResidentChunks());
        log.info("Worker pool size: {}", properties.getWorkers().getPoolSize());

        pluginRegistryService.ensureInitialized();
        for (PluginCapability plugin : pluginRegistryService.listPlugins()) {
            log.info("Renderer plugin: {} v{} (priority {}, {})", plugin.getName(), plugin.getVersion(),
                    plugin.getPriority(), plugin.isEnabled() ? "enabled" : "disabled");
        }
    }
}
