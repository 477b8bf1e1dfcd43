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

import java.util.ArrayList;
import java.util.List;

/**
 * A log entry together with the blocks rendered for it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParseResult {

    private LogEntry entry;
    @Builder.Default
    private List<RenderedBlock> blocks = new ArrayList<>();
    private String renderedBy;
    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isError()
    private boolean error;
    private boolean warning;
    private long renderTimeMicros;

    public int getBlockCount() {
        return blocks != null ? blocks.size() : 0;
    }

    public double getAverageConfidence() {
        if (blocks == null || blocks.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (RenderedBlock block : blocks) {
            sum += block.getConfidence();
        }
        return sum / blocks.size();
    }

    /**
     * Rough heap footprint used for chunk memory accounting.
     */
    public long estimateMemoryBytes() {
        long bytes = 64;
        if (entry != null) {
            bytes += 2L * length(entry.getContent()) + 2L * length(entry.getRawLine());
        }
        if (blocks != null) {
            for (RenderedBlock block : blocks) {
                bytes += 96 + 2L * (length(block.getContent()) + length(block.getFormattedContent())
                        + length(block.getTitle()));
            }
        }
        return bytes;
    }

    private static int length(String value) {
        return value != null ? value.length() : 0;
    }
}
