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
 * One unit of enriched output derived from a log entry by a renderer plugin.
 *
 * <p>
 * {@code content} is the plain, copyable text (an executable SQL statement, a
 * JSON document); {@code formattedContent} is what the viewer displays and may
 * carry highlighting markup.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RenderedBlock {

    private String id;
    private BlockType blockType;
    private String title;
    private String content;
    private String formattedContent;
    @Builder.Default
    private boolean copyable = true;
    private BlockMetadata metadata;

    public double getConfidence() {
        return metadata != null ? metadata.getConfidence() : 0.0;
    }

    /**
     * Builds an error block for the given entry.
     */
    public static RenderedBlock error(String id, LogEntry entry, String title, String message) {
        return RenderedBlock.builder()
                .id(id)
                .blockType(BlockType.ERROR)
                .title(title)
                .content(message)
                .formattedContent(message)
                .copyable(true)
                .metadata(BlockMetadata.builder()
                        .lineStart(entry.getLineNumber())
                        .lineEnd(entry.getLineEnd())
                        .charStart(0)
                        .charEnd(entry.getContent() != null ? entry.getContent().length() : 0)
                        .confidence(0.0)
                        .build())
                .build();
    }
}
