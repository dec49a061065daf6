package me.golemcore.krishi.tools;

import me.golemcore.krishi.KnowledgeCoreFixture;
import me.golemcore.krishi.domain.model.SchemeLookupResult;
import me.golemcore.krishi.domain.model.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GovernmentSchemeToolTest {

    private KnowledgeCoreFixture fixture;
    private GovernmentSchemeTool tool;

    @BeforeEach
    void setUp() {
        fixture = KnowledgeCoreFixture.indexed();
        tool = new GovernmentSchemeTool(fixture.engine);
    }

    @Test
    void shouldRequireNoArguments() {
        assertEquals(List.of(), tool.getDefinition().getInputSchema().get("required"));
    }

    @Test
    void shouldListMatchingSchemes() {
        fixture.vectorStore.ingest("Kisan Credit Card\nShort term credit for farmers.",
                Map.of("category", "government_scheme", "benefits", "Loans at 4% interest"), "kcc");

        ToolResult result = tool.execute(Map.of("farmer_type", "small", "state", "Punjab")).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().contains("- Kisan Credit Card: Loans at 4% interest"));
        assertTrue(result.getOutput().contains("Krishi Vigyan Kendra"));
        SchemeLookupResult data = (SchemeLookupResult) result.getData();
        assertEquals("government scheme for small farmers in Punjab", data.query());
    }

    @Test
    void shouldStillPointToResourcesWhenNothingMatches() {
        ToolResult result = tool.execute(null).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().startsWith("No matching schemes found."));
        assertTrue(result.getOutput().contains("pmkisan.gov.in"));
    }
}
