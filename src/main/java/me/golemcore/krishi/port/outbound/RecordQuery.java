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

import lombok.Builder;
import lombok.Value;

/**
 * Sort-key condition for a partition query. Bounds are inclusive and
 * compared lexicographically; a {@code null} bound is open.
 */
@Value
@Builder
public class RecordQuery {

    String from;
    String to;
    String prefix;
    boolean descending;

    /**
     * Maximum number of records, 0 for no limit.
     */
    int limit;

    public static RecordQuery all() {
        return RecordQuery.builder().build();
    }

    public static RecordQuery between(String from, String to) {
        return RecordQuery.builder().from(from).to(to).build();
    }

    public static RecordQuery prefix(String prefix) {
        return RecordQuery.builder().prefix(prefix).build();
    }

    public static RecordQuery last() {
        return RecordQuery.builder().descending(true).limit(1).build();
    }

    public boolean matches(String sortKey) {
        if (sortKey == null) {
            return false;
        }
        if (prefix != null && !sortKey.startsWith(prefix)) {
            return false;
        }
        if (from != null && sortKey.compareTo(from) < 0) {
            return false;
        }
        return to == null || sortKey.compareTo(to) <= 0;
    }
}
