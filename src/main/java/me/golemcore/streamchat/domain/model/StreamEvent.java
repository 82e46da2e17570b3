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

import java.util.List;
import java.util.Map;

/**
 * Provider-agnostic events published while a request streams. Every event is
 * keyed by the request and the chat it belongs to.
 *
 * <p>
 * Within one request events arrive in wire order. Exactly one terminal event
 * ends a request: {@link Complete}, {@link Error}, or a {@link StatusChange} to
 * {@link RequestState#CANCELLED}.
 */
public sealed interface StreamEvent permits StreamEvent.PartialResponse, StreamEvent.ThinkingStarted,
        StreamEvent.ThinkingPartial, StreamEvent.ThinkingComplete, StreamEvent.ToolCallRequest,
        StreamEvent.MessagesAdded, StreamEvent.StatusChange, StreamEvent.Complete, StreamEvent.Error {

    String requestId();

    String chatId();

    default boolean isTerminal() {
        return false;
    }

    record PartialResponse(String requestId, String chatId, String text) implements StreamEvent {
    }

    record ThinkingStarted(String requestId, String chatId) implements StreamEvent {
    }

    record ThinkingPartial(String requestId, String chatId, String text) implements StreamEvent {
    }

    record ThinkingComplete(String requestId, String chatId, double durationSeconds, ThoughtsStatus status)
            implements StreamEvent {
    }

    record ToolCallRequest(String requestId, String chatId, String toolId, String callId,
            Map<String, Object> parameters) implements StreamEvent {
    }

    /**
     * Preceding text or tool messages were persisted; the visible buffer should
     * reset.
     */
    record MessagesAdded(String requestId, String chatId, List<String> messageIds) implements StreamEvent {
    }

    record StatusChange(String requestId, String chatId, RequestState status) implements StreamEvent {
        @Override
        public boolean isTerminal() {
            return status == RequestState.CANCELLED;
        }
    }

    record Complete(String requestId, String chatId, String fullText, String model) implements StreamEvent {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record Error(String requestId, String chatId, String message) implements StreamEvent {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }
}
