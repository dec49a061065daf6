package me.golemcore.krishi.domain.metrics;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.krishi.domain.exception.KnowledgeCoreException;
import me.golemcore.krishi.domain.service.FutureSupport;
import me.golemcore.krishi.port.outbound.RecordStorePort;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Periodically asks the record store to drop records past their expiry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RetentionSweeper {

    private final RecordStorePort recordStore;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${krishi.metrics.sweep-interval:PT1H}", initialDelayString = "${krishi.metrics.sweep-interval:PT1H}")
    public void scheduledSweep() {
        try {
            sweep();
        } catch (KnowledgeCoreException e) {
            log.warn("[Metrics] Retention sweep failed: {}", e.getMessage());
        }
    }

    /**
     * @return number of purged records
     */
    public int sweep() {
        int purged = FutureSupport.join(recordStore.purgeExpired(clock.millis()), "purge expired records");
        if (purged > 0) {
            log.info("[Metrics] Retention sweep purged {} expired records", purged);
        } else {
            log.debug("[Metrics] Retention sweep found nothing to purge");
        }
        return purged;
    }
}
