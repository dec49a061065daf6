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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Price summary for one crop and market area. Change fields are absent when
 * the window holds no point old enough to serve as a baseline.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MarketPriceReport {

    private String crop;
    private String marketArea;
    private String metricId;
    private boolean dataAvailable;
    private Double currentPrice;
    private String unit;
    private Double weeklyChangePercent;
    private String weeklyChange;
    private Double monthlyChangePercent;
    private String monthlyChange;
    private PriceTrend trend;
    private String priceForecast;
    private List<String> marketingTips;
}
