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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "krishi")
@Data
public class KrishiProperties {

    private EmbeddingProperties embedding = new EmbeddingProperties();
    private StorageProperties storage = new StorageProperties();
    private VectorProperties vector = new VectorProperties();
    private GraphProperties graph = new GraphProperties();
    private MetricsProperties metrics = new MetricsProperties();
    private ToolsProperties tools = new ToolsProperties();

    // ==================== EMBEDDING ====================

    @Data
    public static class EmbeddingProperties {
        /**
         * {@code openai} or {@code deterministic}.
         */
        private String provider = "openai";
        private String apiKey;
        private String baseUrl;
        private String model = "text-embedding-3-small";
        private int dimension = 1536;
        private Duration timeout = Duration.ofSeconds(30);
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.krishi/workspace";
        private String directory = "records";
        private SnapshotProperties snapshot = new SnapshotProperties();
    }

    @Data
    public static class SnapshotProperties {
        private boolean enabled = false;
        private Duration interval = Duration.ofMinutes(5);
        private boolean backup = true;
    }

    // ==================== STORES ====================

    @Data
    public static class VectorProperties {
        private int defaultTopK = 5;
        private int maxTopK = 100;
        /**
         * Budget of a full-corpus similarity scan when the caller does not pass
         * a deadline.
         */
        private Duration scanTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class GraphProperties {
        /**
         * {@code auto}, {@code indexed} or {@code dual-write}.
         */
        private String edgeMode = "auto";
    }

    @Data
    public static class MetricsProperties {
        /**
         * Retention per top-level metric prefix ({@code weather},
         * {@code market}).
         */
        private Map<String, Duration> retention = new LinkedHashMap<>(Map.of(
                "weather", Duration.ofDays(365),
                "market", Duration.ofDays(730)));
        private Duration defaultRetention = Duration.ofDays(365);
        private Duration sweepInterval = Duration.ofHours(1);
        private Duration deleteTimeout = Duration.ofSeconds(30);
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private Duration timeout = Duration.ofSeconds(30);
    }
}
