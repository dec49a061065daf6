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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.krishi.domain.exception.KnowledgeCoreException;
import me.golemcore.krishi.domain.service.FutureSupport;
import me.golemcore.krishi.infrastructure.config.KrishiProperties;
import me.golemcore.krishi.port.outbound.StoragePort;
import me.golemcore.krishi.port.outbound.StoredRecord;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Persists the in-memory record store as one JSON file per table through
 * {@link StoragePort}, and restores it on startup. Does nothing unless
 * {@code krishi.storage.snapshot.enabled} is set.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RecordStoreSnapshotService {

    static final String MANIFEST = "tables.json";

    private static final TypeReference<List<StoredRecord>> RECORD_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> NAME_LIST = new TypeReference<>() {
    };

    private final InMemoryRecordStoreAdapter recordStore;
    private final StoragePort storagePort;
    private final KrishiProperties properties;
    private final ObjectMapper objectMapper;

    @PostConstruct
    public void restore() {
        if (!isEnabled()) {
            return;
        }
        String directory = directory();
        try {
            if (!FutureSupport.join(storagePort.exists(directory, MANIFEST), "check snapshot manifest")) {
                log.info("[Snapshot] No snapshot found in '{}', starting empty", directory);
                return;
            }
            String manifest = FutureSupport.join(storagePort.getText(directory, MANIFEST), "read snapshot manifest");
            for (String table : objectMapper.readValue(manifest, NAME_LIST)) {
                String content = FutureSupport.join(storagePort.getText(directory, fileName(table)),
                        "read snapshot table");
                if (content == null) {
                    log.warn("[Snapshot] Table '{}' listed in manifest but file is missing", table);
                    continue;
                }
                recordStore.importTable(table, objectMapper.readValue(content, RECORD_LIST));
            }
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt record store snapshot in " + directory, e);
        }
    }

    @Scheduled(fixedDelayString = "${krishi.storage.snapshot.interval:PT5M}", initialDelayString = "${krishi.storage.snapshot.interval:PT5M}")
    public void scheduledSave() {
        if (!isEnabled()) {
            return;
        }
        try {
            save();
        } catch (KnowledgeCoreException e) {
            log.warn("[Snapshot] Periodic save failed: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void saveOnShutdown() {
        if (isEnabled()) {
            save();
        }
    }

    /**
     * Writes every table and then the manifest, each file atomically.
     */
    public void save() {
        String directory = directory();
        boolean backup = properties.getStorage().getSnapshot().isBackup();
        Set<String> names = new TreeSet<>(recordStore.tableNames());
        try {
            for (String table : names) {
                String json = objectMapper.writeValueAsString(recordStore.exportTable(table));
                FutureSupport.join(storagePort.putTextAtomic(directory, fileName(table), json, backup),
                        "write snapshot table");
            }
            FutureSupport.join(storagePort.putTextAtomic(directory, MANIFEST,
                    objectMapper.writeValueAsString(List.copyOf(names)), backup), "write snapshot manifest");
            log.debug("[Snapshot] Saved {} tables", names.size());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize record store snapshot", e);
        }
    }

    private boolean isEnabled() {
        return properties.getStorage().getSnapshot().isEnabled();
    }

    private String directory() {
        return properties.getStorage().getDirectory();
    }

    static String fileName(String table) {
        return table + ".json";
    }
}
