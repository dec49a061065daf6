package me.golemcore.krishi.tools;

import me.golemcore.krishi.KnowledgeCoreFixture;
import me.golemcore.krishi.domain.model.CropInformation;
import me.golemcore.krishi.domain.model.EntityType;
import me.golemcore.krishi.domain.model.RelationshipType;
import me.golemcore.krishi.domain.model.ToolFailureKind;
import me.golemcore.krishi.domain.model.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CropInformationToolTest {

    private KnowledgeCoreFixture fixture;
    private CropInformationTool tool;

    @BeforeEach
    void setUp() {
        fixture = KnowledgeCoreFixture.dualWrite();
        tool = new CropInformationTool(fixture.engine);
    }

    @Test
    void shouldDescribeCropNeighbourhood() {
        String cotton = fixture.graph.createNode(EntityType.CROP, "Cotton");
        fixture.graph.createEdge(cotton, RelationshipType.AFFECTED_BY,
                fixture.graph.createNode(EntityType.PEST, "Pink Bollworm"));
        fixture.vectorStore.ingest("Cotton prefers black soil", Map.of("category", "crop_info"), "cotton-soil");

        ToolResult result = tool.execute(Map.of("crop", "Cotton")).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().contains("affected_by: Pink Bollworm"));
        assertTrue(result.getOutput().contains("- Cotton prefers black soil"));
        assertEquals("crop:cotton", ((CropInformation) result.getData()).cropId());
    }

    @Test
    void shouldHandleUnknownCrop() {
        ToolResult result = tool.execute(Map.of("crop", "Dragon Fruit")).join();

        assertTrue(result.isSuccess());
        CropInformation information = (CropInformation) result.getData();
        assertTrue(information.relationships().entity().isEmpty());
    }

    @Test
    void shouldRequireCrop() {
        assertEquals(ToolFailureKind.INVALID_ARGUMENT, tool.execute(Map.of()).join().getFailureKind());
    }
}
