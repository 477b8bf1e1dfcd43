package me.golemcore.logwhisper.plugin.builtin.json;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.logwhisper.domain.model.BlockType;
import me.golemcore.logwhisper.domain.model.LogEntry;
import me.golemcore.logwhisper.domain.model.RenderedBlock;
import me.golemcore.logwhisper.plugin.api.RenderContext;
import me.golemcore.logwhisper.plugin.builtin.AbstractRendererPlugin;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pretty prints JSON embedded in log entries, repairing common defects.
 *
 * <p>
 * Each candidate found by {@link JsonFragmentExtractor} is parsed strictly
 * first and rendered with confidence 1.0 when valid. Otherwise
 * {@link JsonRepairer} runs once; a candidate that parses after repair renders
 * with confidence 0.8, one that still fails renders as an ERROR block with the
 * parser's reason and the original fragment.
 */
@Slf4j
public class JsonRepairRenderer extends AbstractRendererPlugin {

    public static final String NAME = "json";
    public static final int PRIORITY = 20;

    static final String KEY_MAX_CANDIDATES = "maxCandidates";
    static final String KEY_REPAIR_ENABLED = "repairEnabled";

    static final double DIRECT_CONFIDENCE = 1.0;
    static final double REPAIRED_CONFIDENCE = 0.8;

    private final ObjectReader strictReader;
    private final ObjectWriter compactWriter;
    private final ObjectWriter prettyWriter;

    public JsonRepairRenderer(ObjectMapper objectMapper) {
        super(NAME, "Pretty prints embedded JSON and repairs malformed fragments", PRIORITY,
                Map.of(KEY_MAX_CANDIDATES, 8, KEY_REPAIR_ENABLED, true));
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.compactWriter = objectMapper.writer();
        this.prettyWriter = objectMapper.writerWithDefaultPrettyPrinter();
    }

    @Override
    public boolean matches(LogEntry entry) {
        return entry.getContent() != null && entry.getContent().indexOf('{') >= 0;
    }

    @Override
    public List<RenderedBlock> render(LogEntry entry, RenderContext context) {
        List<JsonFragment> fragments = JsonFragmentExtractor.extract(entry.getContent(),
                intSetting(KEY_MAX_CANDIDATES));
        List<RenderedBlock> blocks = new ArrayList<>(fragments.size());
        for (JsonFragment fragment : fragments) {
            RenderedBlock block = renderFragment(entry, context, fragment);
            block.getMetadata().setCharStart(fragment.start());
            block.getMetadata().setCharEnd(fragment.end());
            blocks.add(block);
        }
        return blocks;
    }

    @Override
    protected void validateSettings(Map<String, Object> candidate) {
        readInt(candidate, KEY_MAX_CANDIDATES, 1);
        readBoolean(candidate, KEY_REPAIR_ENABLED);
    }

    private RenderedBlock renderFragment(LogEntry entry, RenderContext context, JsonFragment fragment) {
        String reason;
        try {
            JsonNode node = strictReader.readTree(fragment.text());
            return jsonBlock(entry, context, node, "JSON", DIRECT_CONFIDENCE);
        } catch (JsonProcessingException e) {
            reason = e.getOriginalMessage();
        }
        if (!booleanSetting(KEY_REPAIR_ENABLED)) {
            return failureBlock(entry, context, fragment, reason);
        }

        JsonRepairer.Repair repair = JsonRepairer.repair(fragment.text());
        if (!repair.changed()) {
            log.debug("[Json] No applicable repair for fragment at line {}", entry.getLineNumber());
            return failureBlock(entry, context, fragment, reason);
        }
        try {
            JsonNode node = strictReader.readTree(repair.text());
            log.debug("[Json] Repaired fragment at line {}: {}", entry.getLineNumber(), repair.fixes());
            return jsonBlock(entry, context, node, "JSON (repaired: " + String.join(", ", repair.fixes()) + ")",
                    REPAIRED_CONFIDENCE);
        } catch (JsonProcessingException e) {
            log.debug("[Json] Repair failed at line {}: {}", entry.getLineNumber(), e.getOriginalMessage());
            return failureBlock(entry, context, fragment, e.getOriginalMessage());
        }
    }

    private RenderedBlock jsonBlock(LogEntry entry, RenderContext context, JsonNode node, String title,
            double confidence) throws JsonProcessingException {
        String compact = compactWriter.writeValueAsString(node);
        String pretty = prettyWriter.writeValueAsString(node);
        return block(context, entry, BlockType.JSON, title, compact, pretty, confidence);
    }

    private RenderedBlock failureBlock(LogEntry entry, RenderContext context, JsonFragment fragment,
            String reason) {
        String message = "Invalid JSON: " + reason + "\n" + fragment.text();
        return block(context, entry, BlockType.ERROR, "JSON repair failed", message, message, 0.0);
    }
}
