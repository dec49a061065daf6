package me.golemcore.krishi.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RelationshipEdgeTest {

    @Test
    void shouldSwapEndpointsForTwin() {
        RelationshipEdge edge = RelationshipEdge.builder()
                .sourceNodeId("disease:blast")
                .relationshipType(RelationshipType.TREATED_WITH.getValue())
                .targetNodeId("treatment:tricyclazole")
                .properties(Map.of("dose", "0.6 g/l"))
                .confidence(0.8)
                .build();

        RelationshipEdge twin = edge.reversed();

        assertEquals("treatment:tricyclazole", twin.getSourceNodeId());
        assertEquals("reverse:treated_with", twin.getRelationshipType());
        assertEquals("disease:blast", twin.getTargetNodeId());
        assertTrue(twin.isReverse());
        assertEquals(0.8, twin.getConfidence());
        assertEquals("0.6 g/l", twin.getProperties().get("dose"));
        assertEquals(edge, twin.reversed());
    }

    @Test
    void shouldStripReversePrefix() {
        assertEquals("grows_in", RelationshipType.baseOf("reverse:grows_in"));
        assertEquals("grows_in", RelationshipType.baseOf("grows_in"));
        assertEquals("reverse:grows_in", RelationshipType.GROWS_IN.reverse());
    }

    @Test
    void shouldParseEntityTypeLeniently() {
        assertEquals(EntityType.MARKET_FACTOR, EntityType.fromValue(" Market_Factor "));
        assertThrows(IllegalArgumentException.class, () -> EntityType.fromValue("planet"));
    }
}
