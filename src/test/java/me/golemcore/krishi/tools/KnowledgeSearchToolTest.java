package me.golemcore.krishi.tools;

import me.golemcore.krishi.KnowledgeCoreFixture;
import me.golemcore.krishi.domain.model.KnowledgeSnippet;
import me.golemcore.krishi.domain.model.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KnowledgeSearchToolTest {

    private KnowledgeCoreFixture fixture;
    private KnowledgeSearchTool tool;

    @BeforeEach
    void setUp() {
        fixture = KnowledgeCoreFixture.indexed();
        tool = new KnowledgeSearchTool(fixture.engine, fixture.properties);
    }

    @Test
    void shouldReturnMatchingPassages() {
        fixture.vectorStore.ingest("Drip irrigation saves water in sugarcane", Map.of(), "drip");
        fixture.vectorStore.ingest("Mulching keeps soil moist", Map.of(), "mulch");

        ToolResult result = tool.execute(Map.of("question", "drip irrigation sugarcane", "limit", 1)).join();

        assertTrue(result.isSuccess());
        assertEquals("Drip irrigation saves water in sugarcane", result.getOutput());
        @SuppressWarnings("unchecked")
        List<KnowledgeSnippet> snippets = (List<KnowledgeSnippet>) result.getData();
        assertEquals(1, snippets.size());
    }

    @Test
    void shouldSayWhenNothingFound() {
        ToolResult result = tool.execute(Map.of("question", "anything")).join();

        assertEquals("No relevant knowledge found.", result.getOutput());
    }

    @Test
    void shouldUseDefaultLimitWhenLimitIsZero() {
        for (int i = 0; i < 7; i++) {
            fixture.vectorStore.ingest("Irrigation note " + i, Map.of(), "note-" + i);
        }

        ToolResult result = tool.execute(Map.of("question", "irrigation", "limit", 0)).join();

        assertTrue(result.isSuccess());
        assertEquals(5, snippets(result).size());
    }

    @Test
    void shouldCapLimitAtConfiguredMaximum() {
        fixture.properties.getVector().setMaxTopK(2);
        for (int i = 0; i < 4; i++) {
            fixture.vectorStore.ingest("Fertilizer note " + i, Map.of(), "note-" + i);
        }

        ToolResult result = tool.execute(Map.of("question", "fertilizer", "limit", 10)).join();

        assertEquals(2, snippets(result).size());
    }

    @Test
    void shouldRequireQuestion() {
        assertEquals("Question is required", tool.execute(Map.of("limit", 2)).join().getError());
    }

    @SuppressWarnings("unchecked")
    private static List<KnowledgeSnippet> snippets(ToolResult result) {
        return (List<KnowledgeSnippet>) result.getData();
    }
}
