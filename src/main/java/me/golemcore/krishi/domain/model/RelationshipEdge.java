package me.golemcore.krishi.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed, directed, confidence-scored link between two nodes. Edges are never
 * updated in place.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class RelationshipEdge {

    private String sourceNodeId;
    private String relationshipType;
    private String targetNodeId;

    @Builder.Default
    private Map<String, Object> properties = new LinkedHashMap<>();

    @Builder.Default
    private double confidence = 1.0;

    @Builder.Default
    private String source = EntityNode.DEFAULT_SOURCE;

    public boolean isReverse() {
        return RelationshipType.isReverse(relationshipType);
    }

    /**
     * Twin edge pointing the other way: {@code (B, "reverse:"+R, A)} for
     * {@code (A, R, B)}, and back again for a reverse edge.
     */
    public RelationshipEdge reversed() {
        String twinType = isReverse()
                ? RelationshipType.baseOf(relationshipType)
                : RelationshipType.REVERSE_PREFIX + relationshipType;
        return toBuilder()
                .sourceNodeId(targetNodeId)
                .targetNodeId(sourceNodeId)
                .relationshipType(twinType)
                .properties(properties != null ? new LinkedHashMap<>(properties) : new LinkedHashMap<>())
                .build();
    }
}
