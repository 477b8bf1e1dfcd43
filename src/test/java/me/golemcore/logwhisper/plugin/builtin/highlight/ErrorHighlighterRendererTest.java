package me.golemcore.logwhisper.plugin.builtin.highlight;

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

class ErrorHighlighterRendererTest {

    private ErrorHighlighterRenderer renderer;
    private RenderContext context;

    @BeforeEach
    void setUp() {
        renderer = new ErrorHighlighterRenderer();
        context = new RenderContext("scope");
    }

    @Test
    void shouldRenderErrorBlockForErrorTerms() {
        List<RenderedBlock> blocks = renderer.render(entry("Connection timeout after 30s"), context);

        assertEquals(1, blocks.size());
        assertEquals(BlockType.ERROR, blocks.get(0).getBlockType());
        assertEquals("Error: timeout", blocks.get(0).getTitle());
        assertEquals(0.9, blocks.get(0).getConfidence());
        assertEquals("Connection timeout after 30s", blocks.get(0).getContent());
    }

    @Test
    void shouldPreferErrorOverWarningTerms() {
        List<RenderedBlock> blocks = renderer.render(entry("Deprecated call FAILED"), context);

        assertEquals("Error: FAILED", blocks.get(0).getTitle());
    }

    @Test
    void shouldRenderWarningBlockForWarningTerms() {
        List<RenderedBlock> blocks = renderer.render(entry("User profile not found, using defaults"), context);

        assertEquals(BlockType.WARNING, blocks.get(0).getBlockType());
        assertEquals("Warning: not found", blocks.get(0).getTitle());
        assertEquals(0.8, blocks.get(0).getConfidence());
    }

    @Test
    void shouldNotMatchTermsInsideWords() {
        assertFalse(renderer.matches(entry("errorless terror")));
        assertFalse(renderer.matches(entry("")));
    }

    @Test
    void shouldIgnoreWarningsWhenDisabled() {
        renderer.applyConfiguration(Map.of("includeWarnings", false));

        assertFalse(renderer.matches(entry("slow query detected")));
        assertTrue(renderer.matches(entry("fatal: disk gone")));
    }

    private static LogEntry entry(String content) {
        return LogEntry.builder()
                .lineNumber(3)
                .lineEnd(3)
                .level(LogLevel.UNKNOWN)
                .content(content)
                .rawLine(content + "\n")
                .build();
    }
}
