package me.golemcore.streamchat.port.outbound;

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

import me.golemcore.streamchat.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool execution boundary used by the request orchestrator. Safe to call
 * concurrently for unrelated requests.
 */
public interface ToolExecutorPort {

    /**
     * Runs a tool. The returned future is cancelled when the requesting turn is
     * cancelled.
     *
     * @param toolId
     *            tool name as requested by the model
     * @param parameters
     *            JSON object arguments
     */
    CompletableFuture<ToolResult> execute(String toolId, Map<String, Object> parameters);
}
