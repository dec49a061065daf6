package me.golemcore.krishi;

import me.golemcore.krishi.domain.graph.EdgeStore;
import me.golemcore.krishi.domain.graph.IndexedEdgeStore;
import me.golemcore.krishi.domain.model.EntityType;
import me.golemcore.krishi.domain.model.RelationshipType;
import me.golemcore.krishi.domain.model.ToolResult;
import me.golemcore.krishi.domain.service.AgentToolDispatcher;
import me.golemcore.krishi.domain.service.RelationshipGraphService;
import me.golemcore.krishi.port.outbound.EmbeddingPort;
import me.golemcore.krishi.tools.CropInformationTool;
import me.golemcore.krishi.tools.CropRecommendationTool;
import me.golemcore.krishi.tools.DiseaseTreatmentTool;
import me.golemcore.krishi.tools.GovernmentSchemeTool;
import me.golemcore.krishi.tools.KnowledgeSearchTool;
import me.golemcore.krishi.tools.MarketPriceTool;
import me.golemcore.krishi.tools.WeatherForecastTool;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class KnowledgeCoreContextTest {

    @Autowired
    private AgentToolDispatcher dispatcher;

    @Autowired
    private RelationshipGraphService graph;

    @Autowired
    private EmbeddingPort embeddingPort;

    @Autowired
    private EdgeStore edgeStore;

    @Test
    void shouldWireDeterministicStackAndIndexedEdges() {
        assertEquals(64, embeddingPort.getDimension());
        assertEquals(IndexedEdgeStore.MODE, edgeStore.mode());
    }

    @Test
    void shouldRegisterAllTools() {
        assertEquals(List.of(CropInformationTool.NAME, CropRecommendationTool.NAME, GovernmentSchemeTool.NAME,
                DiseaseTreatmentTool.NAME, WeatherForecastTool.NAME, MarketPriceTool.NAME, KnowledgeSearchTool.NAME)
                .stream().sorted().toList(), List.copyOf(dispatcher.getToolNames()));
        assertEquals(7, dispatcher.getToolDefinitions().size());
    }

    @Test
    void shouldAnswerToolCallsEndToEnd() {
        String rice = graph.createNode(EntityType.CROP, "Context Rice");
        graph.createEdge(rice, RelationshipType.SUSCEPTIBLE_TO, graph.createNode(EntityType.DISEASE, "Context Blast"));

        ToolResult treatments = dispatcher.execute(DiseaseTreatmentTool.NAME, Map.of("crop", "Context Rice"));
        ToolResult weather = dispatcher.execute(WeatherForecastTool.NAME, Map.of("district", "Pune", "days", 3));

        assertTrue(treatments.isSuccess());
        assertTrue(treatments.getOutput().contains("Context Blast"));
        assertTrue(weather.isSuccess());
    }
}
