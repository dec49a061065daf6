package me.golemcore.krishi.domain.index;

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
import me.golemcore.krishi.domain.model.Deadline;
import me.golemcore.krishi.domain.model.KnowledgeItem;
import me.golemcore.krishi.domain.model.ScoredKnowledgeItem;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Exhaustive cosine scan over every candidate.
 */
@Component
@Slf4j
public class BruteForceVectorIndex implements VectorIndex {

    private static final String OPERATION = "vector search";

    @Override
    public List<ScoredKnowledgeItem> search(List<KnowledgeItem> candidates, float[] query,
            Predicate<KnowledgeItem> filter, int topK, Deadline deadline) {
        deadline.check(OPERATION);
        List<ScoredKnowledgeItem> scored = new ArrayList<>();
        for (KnowledgeItem item : candidates) {
            deadline.check(OPERATION);
            if (!filter.test(item)) {
                continue;
            }
            double similarity = VectorSimilarity.cosine(query, item.getEmbedding());
            scored.add(new ScoredKnowledgeItem(item, similarity));
        }

        // List.sort is stable, so equal scores keep insertion order
        scored.sort(Comparator.comparingDouble(ScoredKnowledgeItem::similarity).reversed());
        List<ScoredKnowledgeItem> result = scored.size() > topK ? scored.subList(0, topK) : scored;

        log.debug("[VectorStore] Scanned {} candidates, {} matched filter, returning {}",
                candidates.size(), scored.size(), result.size());
        return List.copyOf(result);
    }
}
