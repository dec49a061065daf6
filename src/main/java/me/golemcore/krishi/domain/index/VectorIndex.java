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

import me.golemcore.krishi.domain.model.Deadline;
import me.golemcore.krishi.domain.model.KnowledgeItem;
import me.golemcore.krishi.domain.model.ScoredKnowledgeItem;

import java.util.List;
import java.util.function.Predicate;

/**
 * Ranks stored knowledge items against a query vector.
 *
 * <p>
 * Implementations must return at most {@code topK} results sorted by
 * similarity descending, keep the candidates' order for equal scores, and
 * abort with
 * {@link me.golemcore.krishi.domain.exception.DeadlineExceededException} once
 * the deadline expires.
 */
public interface VectorIndex {

    /**
     * @param candidates
     *            items in insertion order
     * @param query
     *            query vector
     * @param filter
     *            applied before ranking
     * @param topK
     *            maximum number of results, positive
     * @param deadline
     *            scan budget
     */
    List<ScoredKnowledgeItem> search(List<KnowledgeItem> candidates, float[] query,
            Predicate<KnowledgeItem> filter, int topK, Deadline deadline);
}
