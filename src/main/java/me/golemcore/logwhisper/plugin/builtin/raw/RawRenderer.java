package me.golemcore.logwhisper.plugin.builtin.raw;

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

import me.golemcore.logwhisper.domain.model.BlockType;
import me.golemcore.logwhisper.domain.model.LogEntry;
import me.golemcore.logwhisper.domain.model.RenderedBlock;
import me.golemcore.logwhisper.plugin.api.RenderContext;
import me.golemcore.logwhisper.plugin.builtin.AbstractRendererPlugin;

import java.util.List;
import java.util.Map;

/**
 * Fallback renderer: one RAW block carrying the entry content unchanged.
 * Matches every entry.
 */
public class RawRenderer extends AbstractRendererPlugin {

    public static final String NAME = "raw";
    public static final int PRIORITY = 1000;

    public RawRenderer() {
        super(NAME, "Plain text fallback, keeps the entry as logged", PRIORITY, Map.of());
    }

    @Override
    public boolean matches(LogEntry entry) {
        return true;
    }

    @Override
    public List<RenderedBlock> render(LogEntry entry, RenderContext context) {
        String title = entry.getLineEnd() > entry.getLineNumber()
                ? "Lines " + entry.getLineNumber() + "-" + entry.getLineEnd()
                : "Line " + entry.getLineNumber();
        return List.of(block(context, entry, BlockType.RAW, title, entry.getContent(), entry.getContent(), 1.0));
    }
}
