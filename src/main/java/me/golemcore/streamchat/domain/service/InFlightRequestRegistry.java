package me.golemcore.streamchat.domain.service;

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

import me.golemcore.streamchat.domain.model.StreamingRequest;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Requests that have not reached a terminal state, keyed by request id. Shared
 * between request tasks and external cancel/stop callers.
 */
@Component
public class InFlightRequestRegistry {

    private final Map<String, StreamingRequest> requests = new ConcurrentHashMap<>();

    /**
     * @return false if a request with the same id is already in flight
     */
    public boolean register(StreamingRequest request) {
        return requests.putIfAbsent(request.getRequestId(), request) == null;
    }

    public Optional<StreamingRequest> get(String requestId) {
        return Optional.ofNullable(requests.get(requestId));
    }

    /**
     * Removes the request only if it is still the registered instance.
     */
    public boolean remove(StreamingRequest request) {
        return requests.remove(request.getRequestId(), request);
    }

    public boolean isChatActive(String chatId) {
        return requests.values().stream().anyMatch(request -> request.getChatId().equals(chatId));
    }

    public Collection<StreamingRequest> getActive() {
        return List.copyOf(requests.values());
    }
}
