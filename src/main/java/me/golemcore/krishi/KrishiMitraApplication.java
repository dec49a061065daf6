package me.golemcore.krishi;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the Krishi Mitra knowledge core.
 *
 * <p>
 * The knowledge core answers farmers' questions from three stores and exposes
 * the answers as agent tools.
 *
 * <h2>Components</h2>
 * <ul>
 * <li><b>Vector store</b> - semantic search over crop, practice and scheme
 * texts</li>
 * <li><b>Relationship graph</b> - crops, diseases, pests, treatments, regions,
 * seasons and soils</li>
 * <li><b>Metric series</b> - weather observations and forecasts, market
 * prices</li>
 * <li><b>Recommendation engine</b> - forecasts, crop rankings, price trends and
 * scheme lookups</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Tools          → AgentToolDispatcher, *Tool
 * Domain Layer   → RecommendationEngine, graph/vector/metric services
 * Infrastructure → record store, embedding and storage adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code krishi.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class KrishiMitraApplication {

    public static void main(String[] args) {
        SpringApplication.run(KrishiMitraApplication.class, args);
    }

}
