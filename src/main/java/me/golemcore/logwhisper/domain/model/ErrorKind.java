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
 * Classification of failures surfaced to callers.
 */
public enum ErrorKind {

    /**
     * Unreadable file, unsupported extension, size ceiling exceeded or an
     * invalid request. Aborts the whole request.
     */
    INPUT,

    /**
     * A plugin failed on one entry. Isolated into an error block.
     */
    PARSE,

    /**
     * JSON repair sequence exhausted. Surfaced as an error block.
     */
    REPAIR,

    /**
     * Invalid plugin configuration payload. Rejected, prior configuration kept.
     */
    CONFIG,

    /**
     * Cache race or failed insert. Logged and recomputed.
     */
    CACHE,

    /**
     * Unexpected failure.
     */
    INTERNAL
}
