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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.krishi.domain.exception.ProviderException;
import me.golemcore.krishi.domain.exception.ValidationException;
import me.golemcore.krishi.domain.index.VectorIndex;
import me.golemcore.krishi.domain.model.Deadline;
import me.golemcore.krishi.domain.model.KnowledgeItem;
import me.golemcore.krishi.domain.model.ScoredKnowledgeItem;
import me.golemcore.krishi.infrastructure.config.KrishiProperties;
import me.golemcore.krishi.port.outbound.EmbeddingPort;
import me.golemcore.krishi.port.outbound.RecordStorePort;
import me.golemcore.krishi.port.outbound.StoredRecord;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Semantic store of knowledge text chunks.
 *
 * <p>
 * Items live in the {@value #TABLE} table of the record store, one partition
 * per id. Searches load the corpus in insertion order and hand it to the
 * configured {@link VectorIndex}.
 *
 * <p>
 * Metadata filters are exact-match conjunctions. Numbers compare by value, so
 * a filter of {@code 5} matches a stored {@code 5.0}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VectorStoreService {

    public static final String TABLE = "knowledge_items";
    static final String ITEM_SORT_KEY = "#item";
    static final String DATE_ADDED = "dateAdded";
    private static final String LOAD_OPERATION = "vector corpus load";

    private final RecordStorePort recordStore;
    private final EmbeddingPort embeddingPort;
    private final VectorIndex vectorIndex;
    private final KrishiProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Stores a text chunk with a precomputed embedding.
     *
     * @param id
     *            item id, a random UUID when {@code null}; an existing item with
     *            the same id is replaced
     * @return the item id
     */
    public String put(String text, float[] embedding, Map<String, Object> metadata, String id) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Knowledge text must not be blank");
        }
        validateVector(embedding);

        String itemId = id != null && !id.isBlank() ? id : UUID.randomUUID().toString();
        Map<String, Object> stamped = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        stamped.putIfAbsent(DATE_ADDED, clock.instant().toString());

        KnowledgeItem item = KnowledgeItem.builder()
                .id(itemId)
                .text(text)
                .embedding(embedding.clone())
                .metadata(stamped)
                .build();

        StoredRecord record = StoredRecord.builder()
                .partitionKey(itemId)
                .sortKey(ITEM_SORT_KEY)
                .payload(write(item))
                .build();
        FutureSupport.join(recordStore.put(TABLE, record), "store knowledge item");
        log.debug("[VectorStore] Stored item '{}' ({} metadata keys)", itemId, stamped.size());
        return itemId;
    }

    /**
     * Embeds the text through the provider and stores it.
     */
    public String ingest(String text, Map<String, Object> metadata, String id) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Knowledge text must not be blank");
        }
        float[] embedding = FutureSupport.join(embeddingPort.embed(text), "embed knowledge item");
        return put(text, embedding, metadata, id);
    }

    public Optional<KnowledgeItem> get(String id) {
        if (id == null || id.isBlank()) {
            throw new ValidationException("Item id must not be blank");
        }
        return FutureSupport.join(recordStore.get(TABLE, id, ITEM_SORT_KEY), "load knowledge item")
                .map(this::read);
    }

    /**
     * @return true when an item was removed
     */
    public boolean delete(String id) {
        if (id == null || id.isBlank()) {
            throw new ValidationException("Item id must not be blank");
        }
        boolean removed = FutureSupport.join(recordStore.delete(TABLE, id, ITEM_SORT_KEY), "delete knowledge item");
        if (removed) {
            log.debug("[VectorStore] Deleted item '{}'", id);
        }
        return removed;
    }

    public List<KnowledgeItem> search(float[] queryVector, Map<String, Object> filter, int topK) {
        return search(queryVector, filter, topK, defaultDeadline());
    }

    public List<KnowledgeItem> search(float[] queryVector, Map<String, Object> filter, int topK, Deadline deadline) {
        return searchScored(queryVector, filter, topK, deadline).stream()
                .map(ScoredKnowledgeItem::item)
                .toList();
    }

    public List<ScoredKnowledgeItem> searchScored(float[] queryVector, Map<String, Object> filter, int topK) {
        return searchScored(queryVector, filter, topK, defaultDeadline());
    }

    /**
     * Ranks the corpus by cosine similarity to the query. A topK larger than
     * the corpus returns every matching item.
     *
     * @throws ValidationException
     *             when topK is not positive or the query dimension differs from
     *             the stored vectors
     * @throws me.golemcore.krishi.domain.exception.DeadlineExceededException
     *             when the scan outlives the deadline
     */
    public List<ScoredKnowledgeItem> searchScored(float[] queryVector, Map<String, Object> filter, int topK,
            Deadline deadline) {
        validateVector(queryVector);
        if (topK <= 0) {
            throw new ValidationException("topK must be positive, got " + topK);
        }
        Deadline budget = deadline != null ? deadline : defaultDeadline();

        List<KnowledgeItem> corpus = loadCorpus(budget);
        List<ScoredKnowledgeItem> result = vectorIndex.search(corpus, queryVector, metadataFilter(filter), topK,
                budget);
        log.debug("[VectorStore] Search over {} items (filter={}, topK={}) returned {}", corpus.size(), filter,
                topK, result.size());
        return result;
    }

    /**
     * Embeds the query text and searches. Provider failures surface as
     * {@link ProviderException} and are not retried.
     */
    public List<KnowledgeItem> searchByText(String text, Map<String, Object> filter, int topK) {
        return searchScoredByText(text, filter, topK).stream()
                .map(ScoredKnowledgeItem::item)
                .toList();
    }

    public List<ScoredKnowledgeItem> searchScoredByText(String text, Map<String, Object> filter, int topK) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Search text must not be blank");
        }
        float[] query = FutureSupport.join(embeddingPort.embed(text), "embed search query");
        return searchScored(query, filter, topK);
    }

    public int size() {
        return FutureSupport.join(recordStore.scan(TABLE), "scan knowledge items").size();
    }

    private List<KnowledgeItem> loadCorpus(Deadline deadline) {
        deadline.check(LOAD_OPERATION);
        List<StoredRecord> records = FutureSupport.join(recordStore.scan(TABLE), "scan knowledge items");
        List<KnowledgeItem> items = new ArrayList<>(records.size());
        for (StoredRecord record : records) {
            deadline.check(LOAD_OPERATION);
            items.add(read(record));
        }
        return items;
    }

    private Deadline defaultDeadline() {
        return Deadline.after(properties.getVector().getScanTimeout());
    }

    private void validateVector(float[] vector) {
        if (vector == null || vector.length == 0) {
            throw new ValidationException("Embedding must not be empty");
        }
        int expected = embeddingPort.getDimension();
        if (expected > 0 && vector.length != expected) {
            throw new ValidationException(
                    "Embedding dimension mismatch: expected " + expected + ", got " + vector.length);
        }
    }

    static Predicate<KnowledgeItem> metadataFilter(Map<String, Object> filter) {
        if (filter == null || filter.isEmpty()) {
            return item -> true;
        }
        return item -> {
            Map<String, Object> metadata = item.getMetadata() != null ? item.getMetadata() : Map.of();
            for (Map.Entry<String, Object> condition : filter.entrySet()) {
                if (!metadata.containsKey(condition.getKey())
                        || !valueEquals(condition.getValue(), metadata.get(condition.getKey()))) {
                    return false;
                }
            }
            return true;
        };
    }

    private static boolean valueEquals(Object expected, Object actual) {
        if (expected instanceof Number e && actual instanceof Number a) {
            return Double.compare(e.doubleValue(), a.doubleValue()) == 0;
        }
        return Objects.equals(expected, actual);
    }

    private String write(KnowledgeItem item) {
        try {
            return objectMapper.writeValueAsString(item);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Knowledge item is not serializable: " + e.getOriginalMessage());
        }
    }

    private KnowledgeItem read(StoredRecord record) {
        try {
            return objectMapper.readValue(record.getPayload(), KnowledgeItem.class);
        } catch (JsonProcessingException e) {
            throw new ProviderException("Corrupt knowledge item '" + record.getPartitionKey() + "'", e);
        }
    }
}
