package me.golemcore.krishi.tools;

import me.golemcore.krishi.KnowledgeCoreFixture;
import me.golemcore.krishi.domain.model.EntityType;
import me.golemcore.krishi.domain.model.RelationshipType;
import me.golemcore.krishi.domain.model.ToolResult;
import me.golemcore.krishi.domain.service.RelationshipGraphService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DiseaseTreatmentToolTest {

    private KnowledgeCoreFixture fixture;
    private DiseaseTreatmentTool tool;

    @BeforeEach
    void setUp() {
        fixture = KnowledgeCoreFixture.indexed();
        tool = new DiseaseTreatmentTool(fixture.engine);
    }

    @Test
    void shouldListTreatments() {
        RelationshipGraphService graph = fixture.graph;
        String tomato = graph.createNode(EntityType.CROP, "Tomato");
        String blight = graph.createNode(EntityType.DISEASE, "Early Blight");
        String wilt = graph.createNode(EntityType.DISEASE, "Fusarium Wilt");
        graph.createEdge(tomato, RelationshipType.SUSCEPTIBLE_TO, blight);
        graph.createEdge(tomato, RelationshipType.SUSCEPTIBLE_TO, wilt);
        graph.createEdge(blight, RelationshipType.TREATED_WITH, graph.createNode(EntityType.TREATMENT, "Mancozeb"));

        ToolResult result = tool.execute(Map.of("crop", "tomato")).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().contains("- Early Blight: Mancozeb"));
        assertTrue(result.getOutput().contains("- Fusarium Wilt: no treatment recorded"));
    }

    @Test
    void shouldReportNoKnownDiseases() {
        ToolResult result = tool.execute(Map.of("crop", "Millet")).join();

        assertTrue(result.isSuccess());
        assertEquals("No known diseases recorded for Millet.", result.getOutput());
    }
}
