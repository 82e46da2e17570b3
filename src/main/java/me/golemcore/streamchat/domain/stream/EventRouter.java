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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies parsed payloads into {@link CanonicalEvent}s using the dialect's
 * {@link PayloadMatcher}s.
 *
 * <p>
 * Classification is total and free of side effects. Every matching rule
 * contributes in declaration order, so one payload may yield several events (a
 * Gemini chunk carrying both text and a function call). A payload no rule
 * recognizes yields a single {@link CanonicalEvent.Unrecognized}.
 */
@Component
@Slf4j
public class EventRouter {

    private static final String DEFAULT_FAILURE = "Provider reported an error";

    public List<CanonicalEvent> classify(StreamDialect dialect, String eventType, JsonNode payload) {
        if (payload == null || dialect.getMatchers() == null) {
            return List.of(CanonicalEvent.UNRECOGNIZED);
        }

        List<CanonicalEvent> events = new ArrayList<>();
        for (PayloadMatcher matcher : dialect.getMatchers()) {
            if (matcher.getEventType() != null && !matcher.getEventType().equals(eventType)) {
                continue;
            }
            try {
                apply(matcher, payload, events);
            } catch (RuntimeException e) { // NOSONAR - a broken rule must not break the stream
                log.warn("[Stream] Matcher {} of dialect {} failed: {}", matcher.getKind(), dialect.getId(),
                        e.getMessage());
            }
        }

        if (events.isEmpty()) {
            return List.of(CanonicalEvent.UNRECOGNIZED);
        }
        return events;
    }

    private void apply(PayloadMatcher matcher, JsonNode payload, List<CanonicalEvent> out) {
        if (matcher.getEachElementOf() == null) {
            applyTo(matcher, payload, out);
            return;
        }
        JsonNode array = payload.at(matcher.getEachElementOf());
        if (!array.isArray()) {
            return;
        }
        for (JsonNode element : array) {
            applyTo(matcher, element, out);
        }
    }

    private void applyTo(PayloadMatcher matcher, JsonNode node, List<CanonicalEvent> out) {
        if (!matches(matcher, node)) {
            return;
        }
        CanonicalEvent event = build(matcher, node);
        if (event != null) {
            out.add(event);
        }
    }

    private boolean matches(PayloadMatcher matcher, JsonNode node) {
        if (matcher.getRequiredPointer() != null && !isPresent(node.at(matcher.getRequiredPointer()))) {
            return false;
        }
        if (matcher.getConditionPointer() == null) {
            return true;
        }
        JsonNode value = node.at(matcher.getConditionPointer());
        boolean equal = isPresent(value) && value.asText().equals(matcher.getConditionValue());
        return matcher.isConditionNegate() != equal;
    }

    private CanonicalEvent build(PayloadMatcher matcher, JsonNode node) {
        return switch (matcher.getKind()) {
        case TEXT_DELTA -> {
            String text = text(node, matcher.getTextPointer());
            yield text == null || text.isEmpty() ? null : new CanonicalEvent.TextDelta(text);
        }
        case THINKING_DELTA -> {
            String text = text(node, matcher.getTextPointer());
            yield text == null || text.isEmpty() ? null : new CanonicalEvent.ThinkingDelta(text);
        }
        case THINKING_STARTED -> CanonicalEvent.THINKING_STARTED;
        case THINKING_FINISHED -> CanonicalEvent.THINKING_FINISHED;
        case TOOL_CALL -> new CanonicalEvent.ToolCallRequested(
                text(node, matcher.getCallIdPointer()),
                text(node, matcher.getNamePointer()),
                matcher.getArgumentsPointer() != null ? node.at(matcher.getArgumentsPointer()) : null);
        case TOOL_CALL_FRAGMENT -> new CanonicalEvent.ToolCallFragment(
                index(node, matcher.getIndexPointer()),
                text(node, matcher.getCallIdPointer()),
                text(node, matcher.getNamePointer()),
                text(node, matcher.getArgumentsPointer()));
        case TOOL_CALLS_FINISHED -> CanonicalEvent.TOOL_CALLS_FINISHED;
        case COMPLETED -> CanonicalEvent.COMPLETED;
        case FAILED -> {
            String message = text(node, matcher.getTextPointer());
            if (message == null || message.isBlank()) {
                message = matcher.getDefaultText() != null ? matcher.getDefaultText() : DEFAULT_FAILURE;
            } else if (matcher.getFailurePrefix() != null) {
                message = matcher.getFailurePrefix() + message;
            }
            yield new CanonicalEvent.Failed(message);
        }
        };
    }

    private static String text(JsonNode node, String pointer) {
        if (pointer == null) {
            return null;
        }
        JsonNode value = node.at(pointer);
        if (!isPresent(value) || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private static int index(JsonNode node, String pointer) {
        if (pointer == null) {
            return 0;
        }
        JsonNode value = node.at(pointer);
        return value.canConvertToInt() ? value.asInt() : 0;
    }

    private static boolean isPresent(JsonNode value) {
        return value != null && !value.isMissingNode() && !value.isNull();
    }
}
