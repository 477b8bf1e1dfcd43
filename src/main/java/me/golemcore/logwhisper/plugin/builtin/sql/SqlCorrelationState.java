package me.golemcore.logwhisper.plugin.builtin.sql;

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

import java.time.Instant;

/**
 * Correlation state of one render scope. Either idle or awaiting the
 * parameters of a pending statement. Callers synchronize on the instance.
 */
final class SqlCorrelationState {

    private String pendingSql;
    private int pendingLine;
    private Instant pendingSince;
    private int lastLine;

    boolean isAwaitingParameters() {
        return pendingSql != null;
    }

    void await(String sql, int lineNumber, Instant now) {
        this.pendingSql = sql;
        this.pendingLine = lineNumber;
        this.pendingSince = now;
    }

    void reset() {
        pendingSql = null;
        pendingLine = 0;
        pendingSince = null;
    }

    /**
     * Records the line number of the entry being fed.
     *
     * @return {@code false} if the entry does not come after the last one seen
     */
    boolean advanceTo(int lineNumber) {
        boolean inOrder = lineNumber > lastLine;
        lastLine = lineNumber;
        return inOrder;
    }

    String getPendingSql() {
        return pendingSql;
    }

    int getPendingLine() {
        return pendingLine;
    }

    Instant getPendingSince() {
        return pendingSince;
    }
}
