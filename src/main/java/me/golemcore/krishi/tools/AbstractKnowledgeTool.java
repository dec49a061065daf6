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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.krishi.domain.component.ToolComponent;
import me.golemcore.krishi.domain.exception.KnowledgeCoreException;
import me.golemcore.krishi.domain.model.ToolResult;
import me.golemcore.krishi.domain.service.ToolFailures;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Base for tools backed by the knowledge core. Runs {@link #run} off the
 * caller's thread and turns knowledge core errors into failed results.
 */
@Slf4j
public abstract class AbstractKnowledgeTool implements ToolComponent {

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return run(new ToolArguments(parameters));
            } catch (KnowledgeCoreException e) {
                log.debug("[Tools] {} failed: {}", getToolName(), e.getMessage());
                return ToolFailures.from(getToolName(), e);
            }
        });
    }

    protected abstract ToolResult run(ToolArguments arguments);
}
