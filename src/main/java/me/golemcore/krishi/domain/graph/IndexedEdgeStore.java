package me.golemcore.krishi.domain.graph;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.krishi.domain.model.RelationshipEdge;
import me.golemcore.krishi.domain.model.RelationshipType;
import me.golemcore.krishi.domain.service.FutureSupport;
import me.golemcore.krishi.port.outbound.RecordQuery;
import me.golemcore.krishi.port.outbound.RecordStorePort;
import me.golemcore.krishi.port.outbound.StoredRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Stores each edge once and serves the reverse view from the backend's
 * secondary index on {@code (targetNodeId, relationshipType#sourceNodeId)}.
 * A single write can never leave the two directions out of step.
 */
@Slf4j
public class IndexedEdgeStore implements EdgeStore {

    public static final String MODE = "indexed";

    private final RecordStorePort recordStore;
    private final GraphRecordCodec codec;

    public IndexedEdgeStore(RecordStorePort recordStore, GraphRecordCodec codec) {
        if (!recordStore.supportsSecondaryIndex()) {
            throw new IllegalStateException("Indexed edge mode requires a record store with a secondary index");
        }
        this.recordStore = recordStore;
        this.codec = codec;
    }

    @Override
    public void write(RelationshipEdge edge) {
        StoredRecord record = codec.edgeRecord(edge).toBuilder()
                .indexPartitionKey(edge.getTargetNodeId())
                .indexSortKey(edge.getRelationshipType() + "#" + edge.getSourceNodeId())
                .build();
        FutureSupport.join(recordStore.put(GraphRecordCodec.TABLE, record), "write edge");
    }

    @Override
    public boolean delete(String sourceNodeId, String relationshipType, String targetNodeId) {
        return FutureSupport.join(recordStore.delete(GraphRecordCodec.TABLE, sourceNodeId,
                GraphRecordCodec.edgeSortKey(relationshipType, targetNodeId)), "delete edge");
    }

    @Override
    public List<RelationshipEdge> edgesOf(String nodeId, String relationshipType) {
        List<StoredRecord> forward = List.of();
        List<StoredRecord> incoming = List.of();
        if (relationshipType == null) {
            forward = queryForward(nodeId, null);
            incoming = queryIncoming(nodeId, "");
        } else if (RelationshipType.isReverse(relationshipType)) {
            incoming = queryIncoming(nodeId, RelationshipType.baseOf(relationshipType) + "#");
        } else {
            forward = queryForward(nodeId, relationshipType);
        }

        List<Entry> entries = new ArrayList<>(forward.size() + incoming.size());
        for (StoredRecord record : forward) {
            entries.add(new Entry(record.getSequence(), codec.readEdge(record)));
        }
        for (StoredRecord record : incoming) {
            entries.add(new Entry(record.getSequence(), codec.readEdge(record).reversed()));
        }
        entries.sort(Comparator.comparingLong(Entry::sequence));
        return entries.stream().map(Entry::edge).toList();
    }

    @Override
    public String mode() {
        return MODE;
    }

    private List<StoredRecord> queryForward(String nodeId, String relationshipType) {
        return FutureSupport.join(recordStore.query(GraphRecordCodec.TABLE, nodeId,
                RecordQuery.prefix(GraphRecordCodec.typePrefix(relationshipType))), "read edges");
    }

    private List<StoredRecord> queryIncoming(String nodeId, String indexSortPrefix) {
        return FutureSupport.join(recordStore.queryIndex(GraphRecordCodec.TABLE, nodeId, indexSortPrefix),
                "read incoming edges");
    }

    private record Entry(long sequence, RelationshipEdge edge) {
    }
}
