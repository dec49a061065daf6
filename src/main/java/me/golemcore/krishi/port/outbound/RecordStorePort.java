package me.golemcore.krishi.port.outbound;

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
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Backend-agnostic keyed store. Every table is addressed by a composite
 * {@code (partitionKey, sortKey)} key and supports point reads and writes plus
 * ordered range queries within a partition. Writes to different keys are
 * independent; no multi-record transaction is offered.
 *
 * <p>
 * Adapters map their native failures to
 * {@link me.golemcore.krishi.domain.exception.ProviderException}.
 */
public interface RecordStorePort {

    CompletableFuture<Optional<StoredRecord>> get(String table, String partitionKey, String sortKey);

    /**
     * Insert or overwrite the record at its key.
     */
    CompletableFuture<Void> put(String table, StoredRecord record);

    /**
     * Insert the record only when its key is free.
     *
     * @return true when the record was written, false when the key was taken
     */
    CompletableFuture<Boolean> putIfAbsent(String table, StoredRecord record);

    /**
     * @return true when a record was removed
     */
    CompletableFuture<Boolean> delete(String table, String partitionKey, String sortKey);

    /**
     * Records of one partition matching the query, ordered by sort key.
     */
    CompletableFuture<List<StoredRecord>> query(String table, String partitionKey, RecordQuery query);

    /**
     * Every record of the table in insertion order.
     */
    CompletableFuture<List<StoredRecord>> scan(String table);

    /**
     * Whether {@link #queryIndex} is served by a real secondary index.
     */
    boolean supportsSecondaryIndex();

    /**
     * Records whose secondary index partition equals {@code indexPartitionKey}
     * and whose index sort key starts with {@code indexSortPrefix}, in insertion
     * order.
     *
     * @throws UnsupportedOperationException
     *             when {@link #supportsSecondaryIndex()} is false
     */
    CompletableFuture<List<StoredRecord>> queryIndex(String table, String indexPartitionKey, String indexSortPrefix);

    /**
     * Physically remove records whose expiry is at or before {@code nowMillis}.
     *
     * @return number of removed records
     */
    CompletableFuture<Integer> purgeExpired(long nowMillis);
}
