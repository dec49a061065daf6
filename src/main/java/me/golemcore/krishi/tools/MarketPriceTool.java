package me.golemcore.krishi.tools;

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
import me.golemcore.krishi.domain.model.MarketPriceReport;
import me.golemcore.krishi.domain.model.ToolDefinition;
import me.golemcore.krishi.domain.model.ToolResult;
import me.golemcore.krishi.domain.service.RecommendationEngine;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Tool reporting recent market prices and marketing tips for a crop.
 */
@Component
@RequiredArgsConstructor
public class MarketPriceTool extends AbstractKnowledgeTool {

    public static final String NAME = "get_market_prices";

    private final RecommendationEngine engine;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Get the current market price, weekly and monthly change and price trend of a crop.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "crop", Map.of(
                                        "type", "string",
                                        "description", "Crop name (e.g., 'wheat', 'onion')"),
                                "market_area", Map.of(
                                        "type", "string",
                                        "description", "Market or mandi name, or 'all' for the aggregate price"),
                                "days", Map.of(
                                        "type", "integer",
                                        "description", "Price history window in days (1-365, default 30)")),
                        "required", List.of("crop")))
                .build();
    }

    @Override
    protected ToolResult run(ToolArguments arguments) {
        String crop = arguments.requireString("crop", "Crop is required");
        String marketArea = arguments.optionalString("market_area", RecommendationEngine.ALL);

        int days = arguments.optionalInt("days", RecommendationEngine.DEFAULT_PRICE_DAYS);

        MarketPriceReport report = engine.marketPrices(crop, days, marketArea);
        if (!report.isDataAvailable()) {
            return ToolResult.success("No recent price data for " + crop + " in market area " + marketArea + ".",
                    report);
        }
        StringBuilder output = new StringBuilder();
        output.append(String.format(Locale.ROOT, "Current price of %s: %.2f", crop, report.getCurrentPrice()));
        if (report.getUnit() != null) {
            output.append(' ').append(report.getUnit());
        }
        if (report.getWeeklyChange() != null) {
            output.append("\nWeekly change: ").append(report.getWeeklyChange());
        }
        if (report.getMonthlyChange() != null) {
            output.append("\nMonthly change: ").append(report.getMonthlyChange());
        }
        if (report.getTrend() != null) {
            output.append("\nTrend: ").append(report.getTrend().getValue());
        }
        return ToolResult.success(output.toString(), report);
    }
}
