package me.golemcore.krishi.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.krishi.domain.exception.ValidationException;
import me.golemcore.krishi.domain.graph.EdgeStore;
import me.golemcore.krishi.domain.graph.GraphRecordCodec;
import me.golemcore.krishi.domain.model.ConsistencyWarning;
import me.golemcore.krishi.domain.model.CropRanking;
import me.golemcore.krishi.domain.model.EntityNode;
import me.golemcore.krishi.domain.model.EntityRelationships;
import me.golemcore.krishi.domain.model.EntityType;
import me.golemcore.krishi.domain.model.NodeIds;
import me.golemcore.krishi.domain.model.RankedCrop;
import me.golemcore.krishi.domain.model.RecommendationBasis;
import me.golemcore.krishi.domain.model.RelatedEntitySummary;
import me.golemcore.krishi.domain.model.RelationshipEdge;
import me.golemcore.krishi.domain.model.RelationshipType;
import me.golemcore.krishi.infrastructure.event.SpringEventBus;
import me.golemcore.krishi.port.outbound.RecordStorePort;
import me.golemcore.krishi.port.outbound.StoredRecord;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Typed entity graph of crops, diseases, pests, treatments, locations, seasons
 * and soils.
 *
 * <p>
 * Nodes are created once and never overwritten. Edges are stored through the
 * configured {@link EdgeStore}, so every forward edge {@code (A, R, B)} can be
 * read back from {@code B} as {@code reverse:R}.
 *
 * <p>
 * Crop ranking weights:
 * <ul>
 * <li>location match - 0.4</li>
 * <li>season match - 0.4</li>
 * <li>soil match - 0.2</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RelationshipGraphService {

    private static final int LOCATION_WEIGHT_TENTHS = 4;
    private static final int SEASON_WEIGHT_TENTHS = 4;
    private static final int SOIL_WEIGHT_TENTHS = 2;

    static final List<RankedCrop> FALLBACK_CROPS = List.of(
            new RankedCrop("crop:wheat", "Wheat", 0.9, List.of("Common crop for most regions")),
            new RankedCrop("crop:rice", "Rice", 0.8, List.of("Staple crop in many regions")),
            new RankedCrop("crop:maize", "Maize", 0.7, List.of("Versatile crop for various conditions")));

    private final RecordStorePort recordStore;
    private final EdgeStore edgeStore;
    private final GraphRecordCodec codec;
    private final SpringEventBus eventBus;
    private final Clock clock;

    // ==================== NODES ====================

    public String createNode(EntityType type, String name) {
        return createNode(type, name, null, null, null);
    }

    /**
     * Creates the node unless one with the same id already exists; an existing
     * node is left untouched.
     *
     * @return the node id, {@code type:slug(name)}
     */
    public String createNode(EntityType type, String name, Map<String, Object> properties, Double confidence,
            String source) {
        if (type == null) {
            throw new ValidationException("Entity type is required");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("Entity name must not be blank");
        }
        double effectiveConfidence = validateConfidence(confidence);

        String nodeId = NodeIds.nodeId(type, name);
        EntityNode node = EntityNode.builder()
                .nodeId(nodeId)
                .type(type)
                .name(name.trim())
                .properties(properties != null ? new LinkedHashMap<>(properties) : new LinkedHashMap<>())
                .confidence(effectiveConfidence)
                .source(source != null && !source.isBlank() ? source : EntityNode.DEFAULT_SOURCE)
                .build();

        boolean created = FutureSupport.join(recordStore.putIfAbsent(GraphRecordCodec.TABLE, codec.nodeRecord(node)),
                "create node");
        if (created) {
            log.debug("[Graph] Created node {}", nodeId);
        } else {
            log.debug("[Graph] Node {} already exists", nodeId);
        }
        return nodeId;
    }

    public Optional<EntityNode> getNode(String nodeId) {
        requireNodeId(nodeId);
        return FutureSupport.join(lookupNode(nodeId), "read node");
    }

    // ==================== EDGES ====================

    public RelationshipEdge createEdge(String sourceNodeId, RelationshipType type, String targetNodeId) {
        return createEdge(sourceNodeId, type.getValue(), targetNodeId, null, null, null);
    }

    /**
     * Stores the edge {@code source -type-> target}; its reverse twin becomes
     * visible from the target. Re-creating an edge replaces its properties.
     */
    public RelationshipEdge createEdge(String sourceNodeId, String relationshipType, String targetNodeId,
            Map<String, Object> properties, Double confidence, String provenance) {
        requireNodeId(sourceNodeId);
        requireNodeId(targetNodeId);
        validateForwardType(relationshipType);

        RelationshipEdge edge = RelationshipEdge.builder()
                .sourceNodeId(sourceNodeId)
                .relationshipType(relationshipType)
                .targetNodeId(targetNodeId)
                .properties(properties != null ? new LinkedHashMap<>(properties) : new LinkedHashMap<>())
                .confidence(validateConfidence(confidence))
                .source(provenance != null && !provenance.isBlank() ? provenance : EntityNode.DEFAULT_SOURCE)
                .build();
        edgeStore.write(edge);
        log.debug("[Graph] Created edge {} -{}-> {}", sourceNodeId, relationshipType, targetNodeId);
        return edge;
    }

    /**
     * Removes the edge in both directions.
     *
     * @return true when the edge existed
     */
    public boolean deleteEdge(String sourceNodeId, String relationshipType, String targetNodeId) {
        requireNodeId(sourceNodeId);
        requireNodeId(targetNodeId);
        validateForwardType(relationshipType);
        return edgeStore.delete(sourceNodeId, relationshipType, targetNodeId);
    }

    /**
     * @param relationshipType
     *            forward type, {@code reverse:}-prefixed type, or {@code null}
     *            for all
     */
    public List<RelationshipEdge> getEdges(String nodeId, String relationshipType) {
        requireNodeId(nodeId);
        return edgeStore.edgesOf(nodeId, relationshipType);
    }

    /**
     * Node ids one hop away along {@code type}, or against it when
     * {@code reverse} is set.
     */
    public List<String> traverse(String nodeId, String relationshipType, boolean reverse) {
        validateForwardType(relationshipType);
        String effectiveType = reverse ? RelationshipType.REVERSE_PREFIX + relationshipType : relationshipType;
        return getEdges(nodeId, effectiveType).stream()
                .map(RelationshipEdge::getTargetNodeId)
                .toList();
    }

    public List<String> traverse(String nodeId, RelationshipType type, boolean reverse) {
        return traverse(nodeId, type.getValue(), reverse);
    }

    // ==================== QUERIES ====================

    /**
     * The node and its neighbours grouped by relationship type. Targets that no
     * longer exist are skipped and reported as dangling.
     */
    public EntityRelationships getEntityWithRelationships(String nodeId) {
        Optional<EntityNode> entity = getNode(nodeId);
        if (entity.isEmpty()) {
            return EntityRelationships.missing();
        }

        List<RelationshipEdge> edges = edgeStore.edgesOf(nodeId, null);
        Map<String, Optional<EntityNode>> targets = loadNodes(edges.stream()
                .map(RelationshipEdge::getTargetNodeId)
                .toList());

        Map<String, List<RelatedEntitySummary>> grouped = new LinkedHashMap<>();
        for (RelationshipEdge edge : edges) {
            Optional<EntityNode> target = targets.get(edge.getTargetNodeId());
            if (target == null || target.isEmpty()) {
                reportDangling(edge);
                continue;
            }
            EntityNode node = target.get();
            grouped.computeIfAbsent(edge.getRelationshipType(), ignored -> new ArrayList<>())
                    .add(new RelatedEntitySummary(node.getNodeId(), node.getName(), node.getType(),
                            edge.getConfidence()));
        }
        return new EntityRelationships(entity, grouped);
    }

    /**
     * Ranks crops by how many of location, season and soil they match. Returns
     * the fixed fallback list, tagged {@link RecommendationBasis#DEFAULT_FALLBACK},
     * when no stored crop matches.
     */
    public CropRanking getRecommendedCrops(String location, String soilType, String season) {
        List<String> locationCrops = criterionCrops(EntityType.LOCATION, location, RelationshipType.SUITABLE_FOR,
                false);
        List<String> seasonCrops = criterionCrops(EntityType.SEASON, season, RelationshipType.GROWN_DURING, true);
        List<String> soilCrops = criterionCrops(EntityType.SOIL, soilType, RelationshipType.SUITABLE_FOR, false);

        Set<String> candidates = new LinkedHashSet<>();
        candidates.addAll(locationCrops);
        candidates.addAll(seasonCrops);
        candidates.addAll(soilCrops);

        Map<String, Optional<EntityNode>> nodes = loadNodes(List.copyOf(candidates));
        List<RankedCrop> ranked = new ArrayList<>();
        for (String cropId : candidates) {
            Optional<EntityNode> crop = nodes.get(cropId);
            if (crop == null || crop.isEmpty()) {
                continue;
            }
            int tenths = 0;
            List<String> reasons = new ArrayList<>();
            if (locationCrops.contains(cropId)) {
                tenths += LOCATION_WEIGHT_TENTHS;
                reasons.add("Suitable for " + location + " region");
            }
            if (seasonCrops.contains(cropId)) {
                tenths += SEASON_WEIGHT_TENTHS;
                reasons.add("Ideal for " + season + " season");
            }
            if (soilCrops.contains(cropId)) {
                tenths += SOIL_WEIGHT_TENTHS;
                reasons.add("Well-suited for " + soilType + " soil");
            }
            if (tenths > 0) {
                ranked.add(new RankedCrop(cropId, crop.get().getName(), tenths / 10.0, List.copyOf(reasons)));
            }
        }

        if (ranked.isEmpty()) {
            log.info("[Graph] No graph match for location={}, soil={}, season={}; using default crops", location,
                    soilType, season);
            return new CropRanking(FALLBACK_CROPS, RecommendationBasis.DEFAULT_FALLBACK);
        }
        ranked.sort(Comparator.comparingDouble(RankedCrop::suitabilityScore).reversed());
        return new CropRanking(List.copyOf(ranked), RecommendationBasis.GRAPH);
    }

    /**
     * Walks crop -susceptible_to-> disease -treated_with-> treatment.
     *
     * @return treatment names keyed by disease name, in edge order
     */
    public Map<String, List<String>> findDiseaseTreatments(String cropName) {
        if (cropName == null || cropName.isBlank()) {
            throw new ValidationException("Crop name must not be blank");
        }
        String cropId = NodeIds.nodeId(EntityType.CROP, cropName);
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (String diseaseId : traverse(cropId, RelationshipType.SUSCEPTIBLE_TO, false)) {
            Optional<EntityNode> disease = getNode(diseaseId);
            if (disease.isEmpty()) {
                continue;
            }
            List<String> treatmentIds = traverse(diseaseId, RelationshipType.TREATED_WITH, false);
            List<String> names = loadNodes(treatmentIds).values().stream()
                    .flatMap(Optional::stream)
                    .map(EntityNode::getName)
                    .toList();
            result.put(disease.get().getName(), names);
        }
        return result;
    }

    // ==================== HELPERS ====================

    private List<String> criterionCrops(EntityType type, String name, RelationshipType relationship,
            boolean reverse) {
        if (name == null || name.isBlank()) {
            return List.of();
        }
        return traverse(NodeIds.nodeId(type, name), relationship, reverse);
    }

    /**
     * Looks up the given node ids concurrently; the result keeps the first-seen
     * order of the ids.
     */
    private Map<String, Optional<EntityNode>> loadNodes(List<String> nodeIds) {
        Set<String> distinct = new LinkedHashSet<>(nodeIds);
        List<String> ordered = List.copyOf(distinct);
        List<CompletableFuture<Optional<EntityNode>>> lookups = ordered.stream()
                .map(this::lookupNode)
                .toList();
        List<Optional<EntityNode>> nodes = FutureSupport.joinAll(lookups, "read related nodes");
        Map<String, Optional<EntityNode>> result = new LinkedHashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            result.put(ordered.get(i), nodes.get(i));
        }
        return result;
    }

    private CompletableFuture<Optional<EntityNode>> lookupNode(String nodeId) {
        return recordStore.get(GraphRecordCodec.TABLE, nodeId, GraphRecordCodec.NODE_SORT_KEY)
                .thenApply(record -> record.map(codec::readNode));
    }

    private void reportDangling(RelationshipEdge edge) {
        String subject = edge.getSourceNodeId() + " -" + edge.getRelationshipType() + "-> " + edge.getTargetNodeId();
        eventBus.publish(new ConsistencyWarning(ConsistencyWarning.Kind.DANGLING_EDGE, subject,
                "target node " + edge.getTargetNodeId() + " does not exist", clock.instant()));
    }

    private static void requireNodeId(String nodeId) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new ValidationException("Node id must not be blank");
        }
    }

    private static void validateForwardType(String relationshipType) {
        if (relationshipType == null || relationshipType.isBlank()) {
            throw new ValidationException("Relationship type must not be blank");
        }
        if (RelationshipType.isReverse(relationshipType)) {
            throw new ValidationException("Reverse edges are derived and cannot be addressed directly: "
                    + relationshipType);
        }
        if (relationshipType.contains("#")) {
            throw new ValidationException("Relationship type must not contain '#': " + relationshipType);
        }
    }

    private static double validateConfidence(Double confidence) {
        if (confidence == null) {
            return 1.0;
        }
        if (confidence.isNaN() || confidence < 0.0 || confidence > 1.0) {
            throw new ValidationException("Confidence must be within [0, 1], got " + confidence);
        }
        return confidence;
    }
}
