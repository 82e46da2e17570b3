package me.golemcore.streamchat.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A single message in a conversation. Besides plain user/assistant turns the
 * history also records tool invocations ({@code tool_call}) and their results
 * ({@code tool}), correlated through {@link ToolCall#getId()} and
 * {@link #toolCallId}.
 *
 * <p>
 * Reasoning output of the model is kept in {@link #thoughts} and never merged
 * into {@link #content}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_TOOL_CALL = "tool_call";
    public static final String ROLE_TOOL = "tool";

    private String id;
    private String role; // user, assistant, system, tool_call, tool
    private String content;
    private List<Attachment> attachments;
    private String model;
    private Instant timestamp;

    private ToolCall toolCall; // For tool_call messages
    private String toolCallId; // For tool response messages
    private String toolName;

    private String thoughts;
    private Double thinkingDurationSeconds;
    private ThoughtsStatus thoughtsStatus;

    private Map<String, Object> metadata;

    @JsonIgnore
    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    @JsonIgnore
    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    @JsonIgnore
    public boolean isToolCallMessage() {
        return ROLE_TOOL_CALL.equals(role);
    }

    /**
     * Checks if this is a tool result message.
     */
    @JsonIgnore
    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    @JsonIgnore
    public boolean hasAttachments() {
        return attachments != null && !attachments.isEmpty();
    }

    /**
     * A model-initiated tool invocation. {@code id} is the provider call id used
     * to correlate the tool response, {@code name} identifies the tool.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;

        /** Set when the streamed arguments could not be parsed as a JSON object. */
        @JsonIgnore
        private String argumentsError;

        @JsonIgnore
        public boolean hasArgumentsError() {
            return argumentsError != null;
        }
    }
}
