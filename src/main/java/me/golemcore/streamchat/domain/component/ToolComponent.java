package me.golemcore.streamchat.domain.component;

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

import me.golemcore.streamchat.domain.model.ToolDefinition;
import me.golemcore.streamchat.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A tool the model can invoke by name during a turn. Implementations must be
 * safe to execute concurrently for unrelated requests.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool definition with the JSON Schema of its parameters.
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool. Failures are reported as a failed {@link ToolResult}
     * rather than an exceptional future whenever possible.
     *
     * @param parameters
     *            the arguments supplied by the model
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters);

    default String getToolName() {
        return getDefinition().getName();
    }
}
