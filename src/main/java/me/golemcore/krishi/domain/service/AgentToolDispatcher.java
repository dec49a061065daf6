package me.golemcore.krishi.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.krishi.domain.component.ToolComponent;
import me.golemcore.krishi.domain.model.ToolDefinition;
import me.golemcore.krishi.domain.model.ToolFailureKind;
import me.golemcore.krishi.domain.model.ToolResult;
import me.golemcore.krishi.infrastructure.config.KrishiProperties;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point of the dialogue layer: runs a tool by name and always answers
 * with a {@link ToolResult}.
 *
 * <p>
 * Unknown and disabled tools are denied by policy. Every call is bounded by
 * {@code krishi.tools.timeout}.
 */
@Service
@Slf4j
public class AgentToolDispatcher {

    private final Map<String, ToolComponent> toolRegistry = new ConcurrentHashMap<>();
    private final KrishiProperties properties;

    public AgentToolDispatcher(List<ToolComponent> tools, KrishiProperties properties) {
        this.properties = properties;
        for (ToolComponent tool : tools) {
            registerTool(tool);
        }
        log.info("[Tools] Registered {} tools: {}", toolRegistry.size(), new TreeMap<>(toolRegistry).keySet());
    }

    public void registerTool(ToolComponent tool) {
        toolRegistry.put(tool.getToolName(), tool);
    }

    public ToolComponent getTool(String name) {
        return name != null ? toolRegistry.get(name) : null;
    }

    /**
     * Definitions of the enabled tools, sorted by name, for function calling.
     */
    public List<ToolDefinition> getToolDefinitions() {
        return new TreeMap<>(toolRegistry).values().stream()
                .filter(ToolComponent::isEnabled)
                .map(ToolComponent::getDefinition)
                .toList();
    }

    public Collection<String> getToolNames() {
        return new TreeMap<>(toolRegistry).keySet();
    }

    public ToolResult execute(String toolName, Map<String, Object> arguments) {
        ToolComponent tool = getTool(toolName);
        if (tool == null) {
            String available = String.join(", ", getToolNames());
            return ToolResult.failure(ToolFailureKind.POLICY_DENIED,
                    "Unknown tool: " + toolName + ". Available tools: " + available);
        }
        if (!tool.isEnabled()) {
            return ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Tool is disabled: " + toolName);
        }

        long timeoutMillis = properties.getTools().getTimeout().toMillis();
        log.debug("[Tools] Executing {} with {}", toolName, arguments);
        CompletableFuture<ToolResult> future = null;
        try {
            future = tool.execute(arguments != null ? arguments : Map.of());
            ToolResult result = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
            if (result == null) {
                return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool " + toolName + " returned nothing");
            }
            if (!result.isSuccess()) {
                log.info("[Tools] {} failed ({}): {}", toolName, result.getFailureKind(), result.getError());
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Tools] {} timed out after {} ms", toolName, timeoutMillis);
            return ToolResult.failure(ToolFailureKind.TIMEOUT,
                    "Tool " + toolName + " timed out after " + timeoutMillis + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool " + toolName + " was interrupted");
        } catch (ExecutionException | RuntimeException e) {
            log.error("[Tools] Tool execution failed: {}", toolName, e);
            return ToolFailures.from(toolName, e);
        }
    }
}
