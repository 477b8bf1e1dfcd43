package me.golemcore.logwhisper.plugin.api;

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

/**
 * Static metadata of a renderer plugin.
 *
 * @param name
 *            stable plugin name, unique within the registry
 * @param description
 *            human readable summary shown in plugin settings
 * @param version
 *            plugin version
 * @param defaultPriority
 *            dispatch priority used unless overridden by configuration; lower
 *            values are tried first
 */
public record PluginDescriptor(
        String name,
        String description,
        String version,
        int defaultPriority
) {
}
