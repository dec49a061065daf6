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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.krishi.domain.exception.ProviderException;
import me.golemcore.krishi.domain.exception.ValidationException;
import me.golemcore.krishi.domain.model.EntityNode;
import me.golemcore.krishi.domain.model.RelationshipEdge;
import me.golemcore.krishi.port.outbound.StoredRecord;
import org.springframework.stereotype.Component;

/**
 * Record layout of the knowledge graph table.
 *
 * <p>
 * Every node owns one partition keyed by its node id. The node itself sits
 * under {@value #NODE_SORT_KEY}, and its outgoing edges under
 * {@code edge#<relationshipType>#<targetNodeId>}.
 */
@Component
@RequiredArgsConstructor
public class GraphRecordCodec {

    public static final String TABLE = "knowledge_graph";
    public static final String NODE_SORT_KEY = "#node";
    static final String EDGE_PREFIX = "edge#";

    private final ObjectMapper objectMapper;

    public static String edgeSortKey(String relationshipType, String targetNodeId) {
        return typePrefix(relationshipType) + targetNodeId;
    }

    /**
     * Sort key prefix of all edges of one type, or of every edge when the type is
     * {@code null}.
     */
    public static String typePrefix(String relationshipType) {
        return relationshipType == null ? EDGE_PREFIX : EDGE_PREFIX + relationshipType + "#";
    }

    public StoredRecord nodeRecord(EntityNode node) {
        return StoredRecord.builder()
                .partitionKey(node.getNodeId())
                .sortKey(NODE_SORT_KEY)
                .payload(write(node))
                .build();
    }

    public StoredRecord edgeRecord(RelationshipEdge edge) {
        return StoredRecord.builder()
                .partitionKey(edge.getSourceNodeId())
                .sortKey(edgeSortKey(edge.getRelationshipType(), edge.getTargetNodeId()))
                .payload(write(edge))
                .build();
    }

    public EntityNode readNode(StoredRecord record) {
        return read(record, EntityNode.class);
    }

    public RelationshipEdge readEdge(StoredRecord record) {
        return read(record, RelationshipEdge.class);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Graph element is not serializable: " + e.getOriginalMessage());
        }
    }

    private <T> T read(StoredRecord record, Class<T> type) {
        try {
            return objectMapper.readValue(record.getPayload(), type);
        } catch (JsonProcessingException e) {
            throw new ProviderException("Corrupt graph record " + record.getPartitionKey() + "/"
                    + record.getSortKey(), e);
        }
    }
}
