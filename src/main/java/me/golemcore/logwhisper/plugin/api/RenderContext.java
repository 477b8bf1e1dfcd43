package me.golemcore.logwhisper.plugin.api;

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

import java.util.concurrent.atomic.AtomicInteger;

/**
 * State shared by all dispatches of one render pass.
 *
 * <p>
 * A render pass covers one scope (a whole file, a chunk of a file or inline
 * content). Entries of a scope are dispatched in ascending line order, which
 * stateful plugins rely on. Block ids are unique within the pass.
 */
public final class RenderContext {

    private final String scopeId;
    private final AtomicInteger blockSequence = new AtomicInteger();

    public RenderContext(String scopeId) {
        this.scopeId = scopeId;
    }

    public String getScopeId() {
        return scopeId;
    }

    public String nextBlockId(String prefix, int lineNumber) {
        return prefix + "-" + lineNumber + "-" + blockSequence.incrementAndGet();
    }

    @Override
    public String toString() {
        return "RenderContext[" + scopeId + "]";
    }
}
