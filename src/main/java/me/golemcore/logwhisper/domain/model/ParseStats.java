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

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate statistics of a render pass.
 *
 * <p>
 * Contains:
 * <ul>
 * <li>Entry and physical line totals</li>
 * <li>Per-level entry counts</li>
 * <li>Error and warning counts (level or content keywords)</li>
 * <li>Block total and average confidence over all blocks</li>
 * <li>Elapsed wall-clock time</li>
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParseStats {

    private int totalEntries;
    private int totalLines;
    private Map<LogLevel, Integer> levelCounts;
    private int errorCount;
    private int warningCount;
    private int blockCount;
    private double averageConfidence;
    private long elapsedMillis;

    public static ParseStats empty() {
        return from(List.of(), 0L);
    }

    public static ParseStats from(List<ParseResult> results, long elapsedMillis) {
        Map<LogLevel, Integer> levels = new EnumMap<>(LogLevel.class);
        for (LogLevel level : LogLevel.values()) {
            levels.put(level, 0);
        }
        int lines = 0;
        int errors = 0;
        int warnings = 0;
        int blocks = 0;
        double confidenceSum = 0.0;
        for (ParseResult result : results) {
            LogEntry entry = result.getEntry();
            levels.merge(entry.getLevel(), 1, Integer::sum);
            lines += entry.getPhysicalLineCount();
            if (result.isError()) {
                errors++;
            }
            if (result.isWarning()) {
                warnings++;
            }
            for (RenderedBlock block : result.getBlocks()) {
                blocks++;
                confidenceSum += block.getConfidence();
            }
        }
        return ParseStats.builder()
                .totalEntries(results.size())
                .totalLines(lines)
                .levelCounts(levels)
                .errorCount(errors)
                .warningCount(warnings)
                .blockCount(blocks)
                .averageConfidence(blocks > 0 ? confidenceSum / blocks : 0.0)
                .elapsedMillis(elapsedMillis)
                .build();
    }
}
