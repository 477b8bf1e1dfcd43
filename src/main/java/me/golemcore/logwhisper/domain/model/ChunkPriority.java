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

/**
 * Scheduling priority of a chunk load. Higher ranks are taken from the worker
 * queue first.
 */
public enum ChunkPriority {

    /** Background preloading ahead of the viewport. */
    LOW(0),

    NORMAL(1),

    HIGH(2),

    /** The region the user is looking at right now. */
    IMMEDIATE(3);

    private final int rank;

    ChunkPriority(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public boolean isHigherThan(ChunkPriority other) {
        return other == null || rank > other.rank;
    }
}
