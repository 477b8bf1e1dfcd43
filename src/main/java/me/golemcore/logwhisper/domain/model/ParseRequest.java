package me.golemcore.logwhisper.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to parse either inline content or a file. {@code pluginName} is
 * {@code auto} (or blank) for full registry dispatch, or the name of one plugin
 * that every entry is pinned to.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParseRequest {

    public static final String AUTO = "auto";

    private String content;
    private String filePath;
    @Builder.Default
    private String pluginName = AUTO;

    /**
     * Maps blank and any-case {@code auto} to {@link #AUTO}, trims other names.
     */
    public static String normalizePluginName(String pluginName) {
        if (pluginName == null || pluginName.isBlank() || AUTO.equalsIgnoreCase(pluginName.trim())) {
            return AUTO;
        }
        return pluginName.trim();
    }

    public static ParseRequest ofContent(String content) {
        return ParseRequest.builder().content(content).build();
    }

    public static ParseRequest ofFile(String filePath) {
        return ParseRequest.builder().filePath(filePath).build();
    }
}
