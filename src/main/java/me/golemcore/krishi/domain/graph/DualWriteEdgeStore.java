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
import me.golemcore.krishi.domain.exception.KnowledgeCoreException;
import me.golemcore.krishi.domain.model.ConsistencyWarning;
import me.golemcore.krishi.domain.model.RelationshipEdge;
import me.golemcore.krishi.domain.service.FutureSupport;
import me.golemcore.krishi.infrastructure.event.SpringEventBus;
import me.golemcore.krishi.port.outbound.RecordQuery;
import me.golemcore.krishi.port.outbound.RecordStorePort;
import me.golemcore.krishi.port.outbound.StoredRecord;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;

/**
 * Writes the forward edge and then a materialised reverse twin in the target's
 * partition. The two writes are not atomic: when the second one fails the
 * forward edge stays and an {@link ConsistencyWarning.Kind#ASYMMETRIC_EDGE}
 * warning is published instead of failing the call.
 */
@Slf4j
public class DualWriteEdgeStore implements EdgeStore {

    public static final String MODE = "dual-write";

    private final RecordStorePort recordStore;
    private final GraphRecordCodec codec;
    private final SpringEventBus eventBus;
    private final Clock clock;

    public DualWriteEdgeStore(RecordStorePort recordStore, GraphRecordCodec codec, SpringEventBus eventBus,
            Clock clock) {
        this.recordStore = recordStore;
        this.codec = codec;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    @Override
    public void write(RelationshipEdge edge) {
        FutureSupport.join(recordStore.put(GraphRecordCodec.TABLE, codec.edgeRecord(edge)), "write edge");
        RelationshipEdge twin = edge.reversed();
        try {
            FutureSupport.join(recordStore.put(GraphRecordCodec.TABLE, codec.edgeRecord(twin)),
                    "write reverse edge");
        } catch (KnowledgeCoreException e) {
            warn(edge, "reverse edge not written: " + e.getMessage());
        }
    }

    @Override
    public boolean delete(String sourceNodeId, String relationshipType, String targetNodeId) {
        boolean removed = FutureSupport.join(recordStore.delete(GraphRecordCodec.TABLE, sourceNodeId,
                GraphRecordCodec.edgeSortKey(relationshipType, targetNodeId)), "delete edge");
        RelationshipEdge probe = RelationshipEdge.builder()
                .sourceNodeId(sourceNodeId)
                .relationshipType(relationshipType)
                .targetNodeId(targetNodeId)
                .build();
        RelationshipEdge twin = probe.reversed();
        try {
            removed |= FutureSupport.join(recordStore.delete(GraphRecordCodec.TABLE, twin.getSourceNodeId(),
                    GraphRecordCodec.edgeSortKey(twin.getRelationshipType(), twin.getTargetNodeId())),
                    "delete reverse edge");
        } catch (KnowledgeCoreException e) {
            warn(probe, "reverse edge not deleted: " + e.getMessage());
        }
        return removed;
    }

    @Override
    public List<RelationshipEdge> edgesOf(String nodeId, String relationshipType) {
        List<StoredRecord> records = FutureSupport.join(recordStore.query(GraphRecordCodec.TABLE, nodeId,
                RecordQuery.prefix(GraphRecordCodec.typePrefix(relationshipType))), "read edges");
        return records.stream()
                .sorted(Comparator.comparingLong(StoredRecord::getSequence))
                .map(codec::readEdge)
                .toList();
    }

    @Override
    public String mode() {
        return MODE;
    }

    private void warn(RelationshipEdge edge, String detail) {
        String subject = edge.getSourceNodeId() + " -" + edge.getRelationshipType() + "-> " + edge.getTargetNodeId();
        log.warn("[Graph] Asymmetric edge {}: {}", subject, detail);
        eventBus.publish(new ConsistencyWarning(ConsistencyWarning.Kind.ASYMMETRIC_EDGE, subject, detail,
                clock.instant()));
    }
}
