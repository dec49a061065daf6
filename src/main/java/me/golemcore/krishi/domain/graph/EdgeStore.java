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

import me.golemcore.krishi.domain.model.RelationshipEdge;

import java.util.List;

/**
 * Persists directed edges so that each forward edge {@code (A, R, B)} can also
 * be read from {@code B} as {@code (B, "reverse:"+R, A)}.
 */
public interface EdgeStore {

    /**
     * Stores a forward edge. An edge with the same source, type and target is
     * replaced.
     */
    void write(RelationshipEdge edge);

    /**
     * Removes the forward edge and its reverse view.
     *
     * @return true when anything was removed
     */
    boolean delete(String sourceNodeId, String relationshipType, String targetNodeId);

    /**
     * Edges whose source is {@code nodeId}, in insertion order.
     *
     * @param relationshipType
     *            forward type, {@code reverse:}-prefixed type, or {@code null}
     *            for every edge including reverse views
     */
    List<RelationshipEdge> edgesOf(String nodeId, String relationshipType);

    /**
     * Configuration name of the strategy.
     */
    String mode();
}
