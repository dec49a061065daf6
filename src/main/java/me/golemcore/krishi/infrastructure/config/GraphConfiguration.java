package me.golemcore.krishi.infrastructure.config;

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
import me.golemcore.krishi.domain.graph.DualWriteEdgeStore;
import me.golemcore.krishi.domain.graph.EdgeStore;
import me.golemcore.krishi.domain.graph.GraphRecordCodec;
import me.golemcore.krishi.domain.graph.IndexedEdgeStore;
import me.golemcore.krishi.infrastructure.event.SpringEventBus;
import me.golemcore.krishi.port.outbound.RecordStorePort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Locale;

/**
 * Chooses the edge persistence strategy from {@code krishi.graph.edge-mode}.
 *
 * <p>
 * {@code auto} picks the indexed store when the record store has a secondary
 * index and falls back to dual writes otherwise. {@code indexed} fails startup
 * on a backend without one.
 */
@Configuration
@Slf4j
public class GraphConfiguration {

    static final String AUTO = "auto";

    @Bean
    public EdgeStore edgeStore(KrishiProperties properties, RecordStorePort recordStore, GraphRecordCodec codec,
            SpringEventBus eventBus, Clock clock) {
        String configured = properties.getGraph().getEdgeMode();
        String mode = configured == null ? AUTO : configured.trim().toLowerCase(Locale.ROOT);
        EdgeStore store = switch (mode) {
        case AUTO -> recordStore.supportsSecondaryIndex()
                ? new IndexedEdgeStore(recordStore, codec)
                : new DualWriteEdgeStore(recordStore, codec, eventBus, clock);
        case IndexedEdgeStore.MODE -> new IndexedEdgeStore(recordStore, codec);
        case DualWriteEdgeStore.MODE -> new DualWriteEdgeStore(recordStore, codec, eventBus, clock);
        default -> throw new IllegalStateException("Unknown krishi.graph.edge-mode: " + configured);
        };
        log.info("[Graph] Edge store: {} (configured '{}')", store.mode(), configured);
        return store;
    }
}
