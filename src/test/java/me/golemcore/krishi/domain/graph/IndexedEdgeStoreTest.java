package me.golemcore.krishi.domain.graph;

import me.golemcore.krishi.adapter.outbound.records.InMemoryRecordStoreAdapter;
import me.golemcore.krishi.domain.model.RelationshipEdge;
import me.golemcore.krishi.infrastructure.config.AutoConfiguration;
import me.golemcore.krishi.port.outbound.RecordStorePort;
import me.golemcore.krishi.port.outbound.StoredRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class IndexedEdgeStoreTest {

    private InMemoryRecordStoreAdapter recordStore;
    private IndexedEdgeStore edgeStore;

    @BeforeEach
    void setUp() {
        recordStore = new InMemoryRecordStoreAdapter();
        edgeStore = new IndexedEdgeStore(recordStore, new GraphRecordCodec(AutoConfiguration.objectMapper()));
    }

    private static RelationshipEdge edge(String source, String type, String target) {
        return RelationshipEdge.builder().sourceNodeId(source).relationshipType(type).targetNodeId(target).build();
    }

    @Test
    void shouldStoreSingleRecordPerEdge() {
        edgeStore.write(edge("crop:rice", "grows_in", "location:punjab"));

        List<StoredRecord> records = recordStore.scan(GraphRecordCodec.TABLE).join();
        assertEquals(1, records.size());
        assertEquals("location:punjab", records.get(0).getIndexPartitionKey());
        assertEquals("grows_in#crop:rice", records.get(0).getIndexSortKey());
    }

    @Test
    void shouldMergeForwardAndIncomingInWriteOrder() {
        edgeStore.write(edge("location:pune", "suitable_for", "crop:rice"));
        edgeStore.write(edge("crop:rice", "grows_in", "location:punjab"));
        edgeStore.write(edge("soil:alluvial", "suitable_for", "crop:rice"));

        List<String> types = edgeStore.edgesOf("crop:rice", null).stream()
                .map(e -> e.getRelationshipType() + ">" + e.getTargetNodeId())
                .toList();

        assertEquals(List.of("reverse:suitable_for>location:pune", "grows_in>location:punjab",
                "reverse:suitable_for>soil:alluvial"), types);
    }

    @Test
    void shouldFilterIncomingByType() {
        edgeStore.write(edge("crop:rice", "grows_in", "location:punjab"));
        edgeStore.write(edge("crop:rice", "grows_inside", "location:punjab"));

        List<RelationshipEdge> reverse = edgeStore.edgesOf("location:punjab", "reverse:grows_in");

        assertEquals(1, reverse.size());
        assertEquals("reverse:grows_in", reverse.get(0).getRelationshipType());
    }

    @Test
    void shouldRequireSecondaryIndex() {
        RecordStorePort plain = mock(RecordStorePort.class);
        when(plain.supportsSecondaryIndex()).thenReturn(false);
        GraphRecordCodec codec = new GraphRecordCodec(AutoConfiguration.objectMapper());

        assertThrows(IllegalStateException.class, () -> new IndexedEdgeStore(plain, codec));
    }
}
