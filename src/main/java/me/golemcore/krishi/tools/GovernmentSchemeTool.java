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
import me.golemcore.krishi.domain.model.GovernmentScheme;
import me.golemcore.krishi.domain.model.SchemeLookupResult;
import me.golemcore.krishi.domain.model.ToolDefinition;
import me.golemcore.krishi.domain.model.ToolResult;
import me.golemcore.krishi.domain.service.RecommendationEngine;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Tool searching government schemes relevant to a farmer.
 */
@Component
@RequiredArgsConstructor
public class GovernmentSchemeTool extends AbstractKnowledgeTool {

    public static final String NAME = "check_government_schemes";

    private final RecommendationEngine engine;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Find government schemes for farmers, optionally filtered by farmer type, crop and state.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "farmer_type", Map.of(
                                        "type", "string",
                                        "description", "Farmer category (e.g., 'small', 'marginal') or 'all'"),
                                "crop_type", Map.of(
                                        "type", "string",
                                        "description", "Crop grown, or 'all'"),
                                "state", Map.of(
                                        "type", "string",
                                        "description", "Indian state, or 'all'")),
                        "required", List.of()))
                .build();
    }

    @Override
    protected ToolResult run(ToolArguments arguments) {
        SchemeLookupResult result = engine.governmentSchemes(
                arguments.optionalString("farmer_type", RecommendationEngine.ALL),
                arguments.optionalString("crop_type", RecommendationEngine.ALL),
                arguments.optionalString("state", RecommendationEngine.ALL));

        StringBuilder output = new StringBuilder();
        if (result.schemes().isEmpty()) {
            output.append("No matching schemes found.");
        } else {
            output.append("Schemes found:");
            for (GovernmentScheme scheme : result.schemes()) {
                output.append("\n- ").append(scheme.name());
                if (!scheme.benefits().isEmpty()) {
                    output.append(": ").append(scheme.benefits());
                }
            }
        }
        for (String resource : result.additionalResources()) {
            output.append("\n* ").append(resource);
        }
        return ToolResult.success(output.toString(), result);
    }
}
