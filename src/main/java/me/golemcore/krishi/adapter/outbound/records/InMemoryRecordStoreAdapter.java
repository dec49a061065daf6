package me.golemcore.krishi.adapter.outbound.records;

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

import me.golemcore.krishi.domain.exception.ProviderException;
import me.golemcore.krishi.port.outbound.RecordQuery;
import me.golemcore.krishi.port.outbound.RecordStorePort;
import me.golemcore.krishi.port.outbound.StoredRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Record store held in concurrent sorted maps. Partitions are ordered by sort
 * key, and a secondary index on {@code (indexPartitionKey, indexSortKey)} is
 * maintained alongside, so the adapter reports
 * {@link #supportsSecondaryIndex()} as true.
 *
 * <p>
 * Writes lock only the partition they touch. Readers iterate without locking
 * and may observe a write in progress on another key.
 */
@Component
@Slf4j
public class InMemoryRecordStoreAdapter implements RecordStorePort {

    private static final Comparator<StoredRecord> BY_SEQUENCE = Comparator.comparingLong(StoredRecord::getSequence);

    private final Map<String, Table> tables = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public CompletableFuture<Optional<StoredRecord>> get(String table, String partitionKey, String sortKey) {
        return call(() -> {
            NavigableMap<String, StoredRecord> partition = existingPartition(table, partitionKey);
            if (partition == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(partition.get(sortKey));
        });
    }

    @Override
    public CompletableFuture<Void> put(String table, StoredRecord record) {
        return call(() -> {
            validateKey(record);
            Table target = table(table);
            NavigableMap<String, StoredRecord> partition = target.partition(record.getPartitionKey());
            synchronized (partition) {
                StoredRecord existing = partition.get(record.getSortKey());
                long seq = existing != null ? existing.getSequence() : sequence.incrementAndGet();
                StoredRecord stored = record.toBuilder().sequence(seq).build();
                partition.put(record.getSortKey(), stored);
                target.unindex(existing);
                target.index(stored);
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Boolean> putIfAbsent(String table, StoredRecord record) {
        return call(() -> {
            validateKey(record);
            Table target = table(table);
            NavigableMap<String, StoredRecord> partition = target.partition(record.getPartitionKey());
            synchronized (partition) {
                if (partition.containsKey(record.getSortKey())) {
                    return false;
                }
                StoredRecord stored = record.toBuilder().sequence(sequence.incrementAndGet()).build();
                partition.put(record.getSortKey(), stored);
                target.index(stored);
                return true;
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> delete(String table, String partitionKey, String sortKey) {
        return call(() -> {
            Table target = existingTable(table);
            NavigableMap<String, StoredRecord> partition = target != null ? target.partitions.get(partitionKey) : null;
            if (partition == null) {
                return false;
            }
            synchronized (partition) {
                StoredRecord removed = partition.remove(sortKey);
                target.unindex(removed);
                return removed != null;
            }
        });
    }

    @Override
    public CompletableFuture<List<StoredRecord>> query(String table, String partitionKey, RecordQuery query) {
        return call(() -> {
            NavigableMap<String, StoredRecord> partition = existingPartition(table, partitionKey);
            if (partition == null) {
                return List.of();
            }
            RecordQuery effective = query != null ? query : RecordQuery.all();
            Collection<StoredRecord> ordered = effective.isDescending()
                    ? partition.descendingMap().values()
                    : partition.values();
            List<StoredRecord> result = new ArrayList<>();
            for (StoredRecord record : ordered) {
                if (!effective.matches(record.getSortKey())) {
                    continue;
                }
                result.add(record);
                if (effective.getLimit() > 0 && result.size() >= effective.getLimit()) {
                    break;
                }
            }
            return result;
        });
    }

    @Override
    public CompletableFuture<List<StoredRecord>> scan(String table) {
        return call(() -> {
            Table target = existingTable(table);
            if (target == null) {
                return List.of();
            }
            List<StoredRecord> result = new ArrayList<>();
            for (NavigableMap<String, StoredRecord> partition : target.partitions.values()) {
                result.addAll(partition.values());
            }
            result.sort(BY_SEQUENCE);
            return result;
        });
    }

    @Override
    public boolean supportsSecondaryIndex() {
        return true;
    }

    @Override
    public CompletableFuture<List<StoredRecord>> queryIndex(String table, String indexPartitionKey,
            String indexSortPrefix) {
        return call(() -> {
            Table target = existingTable(table);
            Set<RecordKey> keys = target != null ? target.index.get(indexPartitionKey) : null;
            if (keys == null) {
                return List.of();
            }
            String prefix = indexSortPrefix != null ? indexSortPrefix : "";
            List<StoredRecord> result = new ArrayList<>();
            for (RecordKey key : keys) {
                NavigableMap<String, StoredRecord> partition = target.partitions.get(key.partitionKey());
                StoredRecord record = partition != null ? partition.get(key.sortKey()) : null;
                if (record != null && record.getIndexSortKey() != null
                        && record.getIndexSortKey().startsWith(prefix)) {
                    result.add(record);
                }
            }
            result.sort(BY_SEQUENCE);
            return result;
        });
    }

    @Override
    public CompletableFuture<Integer> purgeExpired(long nowMillis) {
        return call(() -> {
            int removed = 0;
            for (Table target : tables.values()) {
                for (NavigableMap<String, StoredRecord> partition : target.partitions.values()) {
                    synchronized (partition) {
                        var iterator = partition.values().iterator();
                        while (iterator.hasNext()) {
                            StoredRecord record = iterator.next();
                            if (record.isExpired(nowMillis)) {
                                iterator.remove();
                                target.unindex(record);
                                removed++;
                            }
                        }
                    }
                }
            }
            return removed;
        });
    }

    /**
     * Names of the tables written to so far, for snapshots. Reads never
     * create a table.
     */
    public Set<String> tableNames() {
        return Set.copyOf(tables.keySet());
    }

    /**
     * Copy of a table's records in insertion order.
     */
    public List<StoredRecord> exportTable(String table) {
        return scan(table).join();
    }

    /**
     * Restores records with their original sequence numbers. Existing records
     * at the same keys are replaced.
     */
    public void importTable(String table, List<StoredRecord> records) {
        Table target = table(table);
        for (StoredRecord record : records) {
            validateKey(record);
            NavigableMap<String, StoredRecord> partition = target.partition(record.getPartitionKey());
            synchronized (partition) {
                StoredRecord previous = partition.put(record.getSortKey(), record);
                target.unindex(previous);
                target.index(record);
            }
            sequence.accumulateAndGet(record.getSequence(), Math::max);
        }
        log.info("[RecordStore] Imported {} records into '{}'", records.size(), table);
    }

    private Table table(String name) {
        Objects.requireNonNull(name, "table");
        return tables.computeIfAbsent(name, ignored -> new Table());
    }

    private Table existingTable(String name) {
        return tables.get(Objects.requireNonNull(name, "table"));
    }

    private NavigableMap<String, StoredRecord> existingPartition(String table, String partitionKey) {
        Table target = existingTable(table);
        return target != null ? target.partitions.get(partitionKey) : null;
    }

    private static void validateKey(StoredRecord record) {
        if (record == null || record.getPartitionKey() == null || record.getSortKey() == null) {
            throw new IllegalArgumentException("Record must have a partition key and a sort key");
        }
    }

    private static <T> CompletableFuture<T> call(Supplier<T> action) {
        try {
            return CompletableFuture.completedFuture(action.get());
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(new ProviderException("Record store failure", e));
        }
    }

    private record RecordKey(String partitionKey, String sortKey) {
    }

    private static final class Table {

        private final Map<String, NavigableMap<String, StoredRecord>> partitions = new ConcurrentHashMap<>();
        private final Map<String, Set<RecordKey>> index = new ConcurrentHashMap<>();

        NavigableMap<String, StoredRecord> partition(String partitionKey) {
            return partitions.computeIfAbsent(partitionKey, ignored -> new ConcurrentSkipListMap<>());
        }

        void index(StoredRecord record) {
            if (record == null || record.getIndexPartitionKey() == null) {
                return;
            }
            index.computeIfAbsent(record.getIndexPartitionKey(), ignored -> ConcurrentHashMap.newKeySet())
                    .add(new RecordKey(record.getPartitionKey(), record.getSortKey()));
        }

        void unindex(StoredRecord record) {
            if (record == null || record.getIndexPartitionKey() == null) {
                return;
            }
            Set<RecordKey> keys = index.get(record.getIndexPartitionKey());
            if (keys != null) {
                keys.remove(new RecordKey(record.getPartitionKey(), record.getSortKey()));
            }
        }
    }
}
