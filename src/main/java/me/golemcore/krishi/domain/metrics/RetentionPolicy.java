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
import me.golemcore.krishi.infrastructure.config.KrishiProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

/**
 * Maps a metric id to its retention period by the id's first segment
 * ({@code weather:...} or {@code market:...}).
 */
@Component
@RequiredArgsConstructor
public class RetentionPolicy {

    private final KrishiProperties properties;

    public Duration retentionFor(String metricId) {
        KrishiProperties.MetricsProperties metrics = properties.getMetrics();
        Map<String, Duration> retention = metrics.getRetention();
        if (metricId != null && retention != null) {
            int separator = metricId.indexOf(':');
            String prefix = separator >= 0 ? metricId.substring(0, separator) : metricId;
            Duration configured = retention.get(prefix);
            if (configured != null) {
                return configured;
            }
        }
        return metrics.getDefaultRetention();
    }

    /**
     * Expiry for a point written at {@code writtenAtMillis}.
     */
    public long expiryFor(String metricId, long writtenAtMillis) {
        long retentionMillis = retentionFor(metricId).toMillis();
        return retentionMillis > Long.MAX_VALUE - writtenAtMillis ? Long.MAX_VALUE
                : writtenAtMillis + retentionMillis;
    }
}
