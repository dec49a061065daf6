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

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An entity together with its neighbours grouped by relationship type. An
 * unknown entity yields an empty entity and no relationships.
 */
public record EntityRelationships(Optional<EntityNode> entity,
        Map<String, List<RelatedEntitySummary>> relationships) {

    public static EntityRelationships missing() {
        return new EntityRelationships(Optional.empty(), Map.of());
    }
}
