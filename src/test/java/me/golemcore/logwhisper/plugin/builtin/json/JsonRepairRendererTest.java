package me.golemcore.logwhisper.plugin.builtin.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.logwhisper.domain.model.BlockType;
import me.golemcore.logwhisper.domain.model.LogEntry;
import me.golemcore.logwhisper.domain.model.LogLevel;
import me.golemcore.logwhisper.domain.model.RenderedBlock;
import me.golemcore.logwhisper.plugin.api.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonRepairRendererTest {

    private JsonRepairRenderer renderer;
    private RenderContext context;

    @BeforeEach
    void setUp() {
        renderer = new JsonRepairRenderer(new ObjectMapper());
        context = new RenderContext("scope");
    }

    @Test
    void shouldMatchOnlyContentWithBraces() {
        assertTrue(renderer.matches(entry("payload {\"a\":1}")));
        assertFalse(renderer.matches(entry("no json here")));
    }

    @Test
    void shouldRenderValidJsonWithFullConfidence() {
        List<RenderedBlock> blocks = renderer.render(entry("Response: {\"user\": {\"id\": 1}}"), context);

        assertEquals(1, blocks.size());
        RenderedBlock block = blocks.get(0);
        assertEquals(BlockType.JSON, block.getBlockType());
        assertEquals("JSON", block.getTitle());
        assertEquals("{\"user\":{\"id\":1}}", block.getContent());
        assertTrue(block.getFormattedContent().contains("\n"));
        assertEquals(1.0, block.getConfidence());
        assertEquals(10, block.getMetadata().getCharStart());
        assertEquals(29, block.getMetadata().getCharEnd());
    }

    @Test
    void shouldRenderRepairedJsonWithReducedConfidence() {
        List<RenderedBlock> blocks = renderer.render(entry("Config: {timeout: 30, retries: 3"), context);

        RenderedBlock block = blocks.get(0);
        assertEquals(BlockType.JSON, block.getBlockType());
        assertEquals("JSON (repaired: quoted keys, closed brackets)", block.getTitle());
        assertEquals("{\"timeout\":30,\"retries\":3}", block.getContent());
        assertEquals(0.8, block.getConfidence());
    }

    @Test
    void shouldRenderErrorBlockWhenRepairFails() {
        List<RenderedBlock> blocks = renderer.render(entry("Broken: {\"a\": 1,,}"), context);

        RenderedBlock block = blocks.get(0);
        assertEquals(BlockType.ERROR, block.getBlockType());
        assertEquals("JSON repair failed", block.getTitle());
        assertTrue(block.getContent().startsWith("Invalid JSON: "));
        assertTrue(block.getContent().endsWith("\n{\"a\": 1,,}"));
        assertEquals(0.0, block.getConfidence());
    }

    @Test
    void shouldSkipRepairWhenDisabled() {
        renderer.applyConfiguration(Map.of("repairEnabled", false));

        List<RenderedBlock> blocks = renderer.render(entry("Config: {timeout: 30}"), context);

        assertEquals(BlockType.ERROR, blocks.get(0).getBlockType());
    }

    @Test
    void shouldRenderOneBlockPerFragment() {
        List<RenderedBlock> blocks = renderer.render(entry("in {\"a\":1} out {\"b\":2} done"), context);

        assertEquals(2, blocks.size());
        assertTrue(blocks.get(0).getId().startsWith("json-7-"));
        assertEquals("{\"b\":2}", blocks.get(1).getContent());
    }

    private static LogEntry entry(String content) {
        return LogEntry.builder()
                .lineNumber(7)
                .lineEnd(7)
                .level(LogLevel.INFO)
                .content(content)
                .rawLine(content + "\n")
                .build();
    }
}
