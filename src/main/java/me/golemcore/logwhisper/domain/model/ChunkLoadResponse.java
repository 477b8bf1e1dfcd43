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

import java.util.List;
import java.util.Map;

/**
 * Per-chunk outcome of a chunk load. A chunk appears either in {@code chunks}
 * or in {@code errors}; chunks that loaded stay usable when others failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkLoadResponse {

    private Map<Integer, List<ParseResult>> chunks;
    private Map<Integer, String> errors;
    private long memoryBytes;

    public boolean isSuccess() {
        return errors == null || errors.isEmpty();
    }
}
