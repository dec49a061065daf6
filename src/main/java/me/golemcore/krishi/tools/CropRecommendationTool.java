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
import me.golemcore.krishi.domain.model.CropRecommendations;
import me.golemcore.krishi.domain.model.RankedCrop;
import me.golemcore.krishi.domain.model.RecommendationBasis;
import me.golemcore.krishi.domain.model.ToolDefinition;
import me.golemcore.krishi.domain.model.ToolResult;
import me.golemcore.krishi.domain.service.RecommendationEngine;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Tool recommending crops for a district, soil type and season.
 */
@Component
@RequiredArgsConstructor
public class CropRecommendationTool extends AbstractKnowledgeTool {

    public static final String NAME = "get_crop_recommendations";

    private final RecommendationEngine engine;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Recommend crops suited to a district, soil type and season, "
                        + "with cultivation practices for the best matches.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "district", Map.of(
                                        "type", "string",
                                        "description", "District name"),
                                "soil_type", Map.of(
                                        "type", "string",
                                        "description", "Soil type (e.g., 'black', 'alluvial'). Defaults to 'medium'"),
                                "season", Map.of(
                                        "type", "string",
                                        "description", "Growing season (e.g., 'kharif', 'rabi'). Defaults to 'current'")),
                        "required", List.of("district")))
                .build();
    }

    @Override
    protected ToolResult run(ToolArguments arguments) {
        String district = arguments.requireString("district", "District is required");
        String soilType = arguments.optionalString("soil_type", RecommendationEngine.DEFAULT_SOIL_TYPE);
        String season = arguments.optionalString("season", RecommendationEngine.DEFAULT_SEASON);

        CropRecommendations recommendations = engine.cropRecommendations(district, soilType, season);
        StringBuilder output = new StringBuilder();
        output.append("Recommended crops for ").append(district);
        if (recommendations.getBasis() == RecommendationBasis.DEFAULT_FALLBACK) {
            output.append(" (general suggestions, no specific data for this area)");
        }
        output.append(':');
        for (RankedCrop crop : recommendations.getRecommendations()) {
            output.append("\n- ").append(crop.cropName())
                    .append(String.format(Locale.ROOT, " (%.1f): ", crop.suitabilityScore()))
                    .append(String.join("; ", crop.reasonsForRecommendation()));
        }
        return ToolResult.success(output.toString(), recommendations);
    }
}
