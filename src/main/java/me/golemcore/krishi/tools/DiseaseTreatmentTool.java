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
import me.golemcore.krishi.domain.service.RecommendationEngine;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Tool listing known diseases of a crop and their treatments.
 */
@Component
@RequiredArgsConstructor
public class DiseaseTreatmentTool extends AbstractKnowledgeTool {

    public static final String NAME = "find_disease_treatments";

    private final RecommendationEngine engine;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("List diseases a crop is susceptible to, with the known treatments for each.")
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
        Map<String, List<String>> treatments = engine.diseaseTreatments(crop);
        if (treatments.isEmpty()) {
            return ToolResult.success("No known diseases recorded for " + crop + ".", treatments);
        }
        StringBuilder output = new StringBuilder("Diseases of ").append(crop).append(':');
        treatments.forEach((disease, remedies) -> output.append("\n- ").append(disease).append(": ")
                .append(remedies.isEmpty() ? "no treatment recorded" : String.join(", ", remedies)));
        return ToolResult.success(output.toString(), treatments);
    }
}
