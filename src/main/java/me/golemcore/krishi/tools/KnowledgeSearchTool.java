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
import me.golemcore.krishi.domain.model.KnowledgeSnippet;
import me.golemcore.krishi.domain.model.ToolDefinition;
import me.golemcore.krishi.domain.model.ToolResult;
import me.golemcore.krishi.domain.service.RecommendationEngine;
import me.golemcore.krishi.infrastructure.config.KrishiProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Free-text semantic search over the agricultural knowledge base.
 */
@Component
@RequiredArgsConstructor
public class KnowledgeSearchTool extends AbstractKnowledgeTool {

    public static final String NAME = "search_agriculture_knowledge";

    private final RecommendationEngine engine;
    private final KrishiProperties properties;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Search the agricultural knowledge base for passages answering a farmer's question.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "question", Map.of(
                                        "type", "string",
                                        "description", "The question to answer"),
                                "limit", Map.of(
                                        "type", "integer",
                                        "description", "Maximum number of passages (default 5, at most 100)")),
                        "required", List.of("question")))
                .build();
    }

    @Override
    protected ToolResult run(ToolArguments arguments) {
        String question = arguments.requireString("question", "Question is required");
        int limit = passageLimit(arguments.optionalInt("limit", 0));

        List<KnowledgeSnippet> snippets = engine.searchKnowledge(question, limit);
        if (snippets.isEmpty()) {
            return ToolResult.success("No relevant knowledge found.", snippets);
        }
        StringBuilder output = new StringBuilder();
        for (KnowledgeSnippet snippet : snippets) {
            if (output.length() > 0) {
                output.append("\n\n");
            }
            output.append(snippet.text());
        }
        return ToolResult.success(output.toString(), snippets);
    }

    /**
     * Missing or non-positive limits use the configured default. Larger ones
     * are capped at {@code krishi.vector.max-top-k}.
     */
    private int passageLimit(int requested) {
        KrishiProperties.VectorProperties vector = properties.getVector();
        if (requested <= 0) {
            return vector.getDefaultTopK();
        }
        return Math.min(requested, vector.getMaxTopK());
    }
}
