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
import me.golemcore.krishi.domain.model.CropInformation;
import me.golemcore.krishi.domain.model.RelatedEntitySummary;
import me.golemcore.krishi.domain.model.ToolDefinition;
import me.golemcore.krishi.domain.model.ToolResult;
import me.golemcore.krishi.domain.service.RecommendationEngine;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Tool describing a crop: its graph neighbourhood and reference texts.
 */
@Component
@RequiredArgsConstructor
public class CropInformationTool extends AbstractKnowledgeTool {

    public static final String NAME = "get_crop_information";

    private final RecommendationEngine engine;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Get details about a crop: diseases, pests, seasons, regions and reference notes.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "crop", Map.of(
                                        "type", "string",
                                        "description", "Crop name")),
                        "required", List.of("crop")))
                .build();
    }

    @Override
    protected ToolResult run(ToolArguments arguments) {
        String crop = arguments.requireString("crop", "Crop is required");
        CropInformation information = engine.cropInformation(crop);

        StringBuilder output = new StringBuilder("Information about ").append(crop).append(':');
        information.relationships().relationships().forEach((type, related) -> output
                .append("\n").append(type).append(": ")
                .append(String.join(", ", related.stream().map(RelatedEntitySummary::name).toList())));
        for (String detail : information.details()) {
            output.append("\n- ").append(detail);
        }
        return ToolResult.success(output.toString(), information);
    }
}
