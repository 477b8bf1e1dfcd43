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

/**
 * Outcome of a parse request. On failure {@code results} is empty and
 * {@code errorMessage}/{@code errorKind} describe the problem.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParseResponse {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private List<ParseResult> results;
    private ParseStats stats;
    private boolean cached;
    private String errorMessage;
    private ErrorKind errorKind;

    public static ParseResponse success(ParseResultSet resultSet, boolean cached) {
        return ParseResponse.builder()
                .success(true)
                .results(resultSet.getResults())
                .stats(resultSet.getStats())
                .cached(cached)
                .build();
    }

    public static ParseResponse failure(ErrorKind kind, String message) {
        return ParseResponse.builder()
                .success(false)
                .results(List.of())
                .stats(ParseStats.empty())
                .errorKind(kind)
                .errorMessage(message)
                .build();
    }
}
