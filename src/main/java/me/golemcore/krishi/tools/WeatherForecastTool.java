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
import me.golemcore.krishi.domain.model.ToolDefinition;
import me.golemcore.krishi.domain.model.ToolResult;
import me.golemcore.krishi.domain.model.WeatherForecast;
import me.golemcore.krishi.domain.service.RecommendationEngine;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Tool for the multi-day weather forecast of a district, with farming
 * advisories.
 */
@Component
@RequiredArgsConstructor
public class WeatherForecastTool extends AbstractKnowledgeTool {

    public static final String NAME = "get_weather_forecast";

    private final RecommendationEngine engine;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Get the weather forecast for a district in India, with agricultural implications.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "district", Map.of(
                                        "type", "string",
                                        "description", "District name (e.g., 'Pune', 'Nashik')"),
                                "days", Map.of(
                                        "type", "integer",
                                        "description", "Number of days to forecast (1-16, default 7)")),
                        "required", List.of("district")))
                .build();
    }

    @Override
    protected ToolResult run(ToolArguments arguments) {
        String district = arguments.requireString("district", "District is required");
        int days = arguments.optionalInt("days", RecommendationEngine.DEFAULT_FORECAST_DAYS);

        WeatherForecast forecast = engine.weatherForecast(district, days);
        WeatherForecast.Summary summary = forecast.getSummary();
        String output = String.format(Locale.ROOT, "Weather for %s over %d days: %.1f to %.1f °C, %.1f mm rain expected.%n%s",
                district, days, summary.getTemperature().min(), summary.getTemperature().max(),
                summary.getTotalRainfall(), String.join("\n", summary.getAgriculturalImplications()));
        return ToolResult.success(output, forecast);
    }
}
