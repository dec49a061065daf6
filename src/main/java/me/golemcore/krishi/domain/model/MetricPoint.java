package me.golemcore.krishi.domain.model;

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

import java.util.Map;

/**
 * Single timestamped measurement of a metric series. {@code metricId} is a
 * colon-delimited hierarchy such as
 * {@code weather:temperature:high:<district>} or
 * {@code market:price:<crop>[:<market>]}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class MetricPoint {

    public static final String UNKNOWN_SOURCE = "unknown";

    private String metricId;
    private long timestamp;
    private double value;
    private MetricLocation location;

    @Builder.Default
    private String source = UNKNOWN_SOURCE;

    @Builder.Default
    private String unit = "";

    private Map<String, Object> metadata;

    /**
     * Epoch millis after which the backend may drop the point. Expired points
     * stay readable until the next sweep.
     */
    private Long expiry;
}
