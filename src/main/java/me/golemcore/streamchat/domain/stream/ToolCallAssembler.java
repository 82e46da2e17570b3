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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.streamchat.domain.model.Message;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Collects the tool calls of one streamed response. Complete calls are kept as
 * they arrive; fragments are merged by index and turned into calls when the
 * model signals it is done or the stream ends.
 *
 * <p>
 * Not thread-safe: owned by a single request task.
 */
@Slf4j
public class ToolCallAssembler {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final List<Message.ToolCall> calls = new ArrayList<>();
    private final Map<Integer, Fragment> fragments = new TreeMap<>();

    public ToolCallAssembler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void add(CanonicalEvent.ToolCallRequested requested) {
        calls.add(toolCall(requested.callId(), requested.toolId(), requested.arguments()));
    }

    public void add(CanonicalEvent.ToolCallFragment fragment) {
        Fragment current = fragments.computeIfAbsent(fragment.index(), i -> new Fragment());
        if (fragment.callId() != null && !fragment.callId().isEmpty()) {
            current.callId = fragment.callId();
        }
        if (fragment.name() != null && !fragment.name().isEmpty()) {
            current.name = fragment.name();
        }
        if (fragment.argumentsFragment() != null) {
            current.arguments.append(fragment.argumentsFragment());
        }
    }

    /**
     * Turns accumulated fragments into calls.
     */
    public void finishFragments() {
        for (Map.Entry<Integer, Fragment> entry : fragments.entrySet()) {
            Fragment fragment = entry.getValue();
            if (fragment.name == null) {
                log.warn("[Stream] Dropping tool call fragment {} without a tool name", entry.getKey());
                continue;
            }
            String args = fragment.arguments.toString();
            calls.add(toolCall(fragment.callId, fragment.name,
                    args.isBlank() ? null : objectMapper.getNodeFactory().textNode(args)));
        }
        fragments.clear();
    }

    public boolean hasCalls() {
        return !calls.isEmpty() || !fragments.isEmpty();
    }

    /**
     * Returns every call collected so far, in arrival order, and resets.
     */
    public List<Message.ToolCall> drain() {
        finishFragments();
        List<Message.ToolCall> drained = new ArrayList<>(calls);
        calls.clear();
        return drained;
    }

    private Message.ToolCall toolCall(String callId, String name, JsonNode arguments) {
        Message.ToolCall.ToolCallBuilder builder = Message.ToolCall.builder()
                .id(callId != null && !callId.isEmpty() ? callId : "call_" + UUID.randomUUID())
                .name(name);
        try {
            builder.arguments(parseArguments(arguments));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            String reason = e instanceof JsonProcessingException jsonError
                    ? jsonError.getOriginalMessage()
                    : e.getMessage();
            log.warn("[Stream] Invalid arguments for tool {}: {}", name, reason);
            builder.arguments(Map.of()).argumentsError("Invalid tool arguments: " + reason);
        }
        return builder.build();
    }

    private Map<String, Object> parseArguments(JsonNode arguments) throws JsonProcessingException {
        if (arguments == null || arguments.isMissingNode() || arguments.isNull()) {
            return Map.of();
        }
        JsonNode node = arguments;
        if (arguments.isTextual()) {
            String text = arguments.asText();
            if (text.isBlank()) {
                return Map.of();
            }
            node = objectMapper.readTree(text);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("arguments are not a JSON object");
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    private static final class Fragment {
        private String callId;
        private String name;
        private final StringBuilder arguments = new StringBuilder();
    }
}
