package me.golemcore.streamchat.adapter.outbound.tool;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.streamchat.domain.component.ToolComponent;
import me.golemcore.streamchat.domain.model.ToolResult;
import me.golemcore.streamchat.domain.service.ToolRegistry;
import me.golemcore.streamchat.port.outbound.ToolExecutorPort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Executes tools looked up in the {@link ToolRegistry}. Unknown tools and
 * tool exceptions become failed results, so the model can react to them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RegistryToolExecutor implements ToolExecutorPort {

    private final ToolRegistry toolRegistry;

    @Override
    public CompletableFuture<ToolResult> execute(String toolId, Map<String, Object> parameters) {
        Optional<ToolComponent> tool = toolRegistry.find(toolId);
        if (tool.isEmpty()) {
            log.warn("[Tools] Model requested unknown tool: {}", toolId);
            return CompletableFuture.completedFuture(ToolResult.failure("Unknown tool: " + toolId));
        }

        log.debug("[Tools] Executing {} with {}", toolId, parameters);
        CompletableFuture<ToolResult> execution;
        try {
            execution = tool.get().execute(parameters != null ? parameters : Map.of());
        } catch (RuntimeException e) {
            log.warn("[Tools] Tool {} threw: {}", toolId, e.getMessage());
            return CompletableFuture.completedFuture(ToolResult.failure(describe(toolId, e)));
        }
        return execution.exceptionally(e -> {
            log.warn("[Tools] Tool {} failed: {}", toolId, e.getMessage());
            return ToolResult.failure(describe(toolId, e));
        });
    }

    private String describe(String toolId, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return "Tool " + toolId + " failed: " + message;
    }
}
