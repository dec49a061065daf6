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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row of a {@link RecordStorePort} table, addressed by the composite
 * {@code (partitionKey, sortKey)} key. The payload is an opaque JSON document.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class StoredRecord {

    private String partitionKey;
    private String sortKey;
    private String payload;

    /**
     * Optional secondary index key; only honoured by backends that report
     * {@link RecordStorePort#supportsSecondaryIndex()}.
     */
    private String indexPartitionKey;
    private String indexSortKey;

    /**
     * Epoch millis after which the record may be purged, or {@code null}.
     */
    private Long expiresAt;

    /**
     * Insertion sequence assigned by the store on first write and kept across
     * overwrites of the same key.
     */
    private long sequence;

    public boolean isExpired(long nowMillis) {
        return expiresAt != null && expiresAt <= nowMillis;
    }
}
