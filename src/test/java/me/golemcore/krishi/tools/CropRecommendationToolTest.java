package me.golemcore.krishi.tools;

import me.golemcore.krishi.KnowledgeCoreFixture;
import me.golemcore.krishi.domain.model.CropRecommendations;
import me.golemcore.krishi.domain.model.EntityType;
import me.golemcore.krishi.domain.model.RecommendationBasis;
import me.golemcore.krishi.domain.model.RelationshipType;
import me.golemcore.krishi.domain.model.ToolFailureKind;
import me.golemcore.krishi.domain.model.ToolResult;
import me.golemcore.krishi.domain.service.RelationshipGraphService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CropRecommendationToolTest {

    private KnowledgeCoreFixture fixture;
    private CropRecommendationTool tool;

    @BeforeEach
    void setUp() {
        fixture = KnowledgeCoreFixture.indexed();
        tool = new CropRecommendationTool(fixture.engine);
    }

    @Test
    void shouldListGraphRecommendations() {
        RelationshipGraphService graph = fixture.graph;
        String soybean = graph.createNode(EntityType.CROP, "Soybean");
        graph.createEdge(graph.createNode(EntityType.LOCATION, "Indore"), RelationshipType.SUITABLE_FOR, soybean);

        ToolResult result = tool.execute(Map.of("district", "Indore", "soil_type", "black")).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().startsWith("Recommended crops for Indore:"));
        assertTrue(result.getOutput().contains("Soybean"));
        assertTrue(result.getOutput().contains("Suitable for Indore region"));
        CropRecommendations data = (CropRecommendations) result.getData();
        assertEquals("black", data.getSoilType());
        assertEquals(RecommendationBasis.GRAPH, data.getBasis());
    }

    @Test
    void shouldFlagGeneralSuggestions() {
        ToolResult result = tool.execute(Map.of("district", "Nowhere")).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().contains("general suggestions"));
        assertTrue(result.getOutput().contains("Wheat"));
    }

    @Test
    void shouldRequireDistrict() {
        ToolResult result = tool.execute(Map.of("season", "rabi")).join();

        assertEquals(ToolFailureKind.INVALID_ARGUMENT, result.getFailureKind());
        assertEquals("District is required", result.getError());
    }
}
