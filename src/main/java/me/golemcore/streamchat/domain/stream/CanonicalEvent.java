package me.golemcore.streamchat.domain.stream;

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

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Classification of a single parsed payload, before any stateful reaction.
 */
public sealed interface CanonicalEvent permits CanonicalEvent.TextDelta, CanonicalEvent.ThinkingStarted,
        CanonicalEvent.ThinkingDelta, CanonicalEvent.ThinkingFinished, CanonicalEvent.ToolCallRequested,
        CanonicalEvent.ToolCallFragment, CanonicalEvent.ToolCallsFinished, CanonicalEvent.Completed,
        CanonicalEvent.Failed, CanonicalEvent.Unrecognized {

    CanonicalEvent THINKING_STARTED = new ThinkingStarted();
    CanonicalEvent THINKING_FINISHED = new ThinkingFinished();
    CanonicalEvent TOOL_CALLS_FINISHED = new ToolCallsFinished();
    CanonicalEvent COMPLETED = new Completed();
    CanonicalEvent UNRECOGNIZED = new Unrecognized();

    record TextDelta(String text) implements CanonicalEvent {
    }

    record ThinkingStarted() implements CanonicalEvent {
    }

    record ThinkingDelta(String text) implements CanonicalEvent {
    }

    record ThinkingFinished() implements CanonicalEvent {
    }

    /**
     * A complete tool call. {@code arguments} is either a JSON object or a string
     * holding one.
     */
    record ToolCallRequested(String callId, String toolId, JsonNode arguments) implements CanonicalEvent {
    }

    /**
     * A piece of a tool call streamed in parts. Pieces with the same index belong
     * to the same call.
     */
    record ToolCallFragment(int index, String callId, String name, String argumentsFragment)
            implements CanonicalEvent {
    }

    /** The model has finished emitting tool calls for this response. */
    record ToolCallsFinished() implements CanonicalEvent {
    }

    record Completed() implements CanonicalEvent {
    }

    record Failed(String message) implements CanonicalEvent {
    }

    /** A payload no rule recognized. Ignored, never an error. */
    record Unrecognized() implements CanonicalEvent {
    }
}
