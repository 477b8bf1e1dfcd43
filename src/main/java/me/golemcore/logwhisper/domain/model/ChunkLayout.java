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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Partition of a file into chunks, computed at file-open from line counting
 * only. {@code lineOffsets} is a sparse byte-offset index: element {@code k}
 * is the offset of line {@code k * offsetInterval + 1}.
 */
@Value
@Builder
public class ChunkLayout {

    FileFingerprint fingerprint;
    int totalLines;
    int chunkSize;
    int offsetInterval;
    @JsonIgnore
    long[] lineOffsets;

    public int getChunkCount() {
        if (totalLines == 0) {
            return 0;
        }
        return (totalLines + chunkSize - 1) / chunkSize;
    }

    public boolean contains(int index) {
        return index >= 0 && index < getChunkCount();
    }

    public int startLine(int index) {
        return index * chunkSize + 1;
    }

    public int endLine(int index) {
        return Math.min((index + 1) * chunkSize, totalLines);
    }

    public List<ChunkInfo> describeChunks() {
        int count = getChunkCount();
        List<ChunkInfo> chunks = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            chunks.add(ChunkInfo.builder()
                    .index(i)
                    .startLine(startLine(i))
                    .endLine(endLine(i))
                    .build());
        }
        return Collections.unmodifiableList(chunks);
    }
}
