package me.golemcore.logwhisper.plugin.builtin;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.logwhisper.plugin.api.RendererPlugin;
import me.golemcore.logwhisper.plugin.builtin.docker.DockerJsonRenderer;
import me.golemcore.logwhisper.plugin.builtin.highlight.ErrorHighlighterRenderer;
import me.golemcore.logwhisper.plugin.builtin.json.JsonRepairRenderer;
import me.golemcore.logwhisper.plugin.builtin.raw.RawRenderer;
import me.golemcore.logwhisper.plugin.builtin.sql.SqlCorrelationRenderer;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Built-in renderer bundle, in registration order.
 */
@Component
public class BuiltinPluginCatalog {

    private final Clock clock;
    private final ObjectMapper objectMapper;

    public BuiltinPluginCatalog(Clock clock, ObjectMapper objectMapper) {
        this.clock = clock;
        this.objectMapper = objectMapper;
    }

    public List<RendererPlugin> createPlugins() {
        return List.of(
                new SqlCorrelationRenderer(clock),
                new DockerJsonRenderer(objectMapper),
                new JsonRepairRenderer(objectMapper),
                new ErrorHighlighterRenderer(),
                new RawRenderer());
    }
}
