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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.streamchat.port.outbound.LineSource;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Turns a server-sent-event line stream into parsed JSON payloads.
 *
 * <p>
 * One implementation serves every provider; the differences (done sentinel,
 * type discriminator field, keepalive comments) come from the
 * {@link StreamDialect}. Rules per line:
 * <ul>
 * <li>blank lines are ignored</li>
 * <li>{@code :}-prefixed comments are ignored when the dialect skips
 * keepalives</li>
 * <li>{@code data: <marker>} or the bare marker ends the stream</li>
 * <li>{@code data:} payloads that are empty, the marker, or {@code {}} are
 * heartbeats</li>
 * <li>any other {@code data:} payload must be a JSON object; a bad one is
 * reported through {@link StreamEventHandler#onParseError} and skipped</li>
 * <li>lines without a {@code data:} prefix ({@code event:}, {@code id:}) are
 * ignored</li>
 * </ul>
 *
 * <p>
 * I/O failures of the source propagate to the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StreamWireParser {

    private static final String DATA_PREFIX = "data:";
    private static final String EMPTY_OBJECT = "{}";

    private final ObjectMapper objectMapper;

    public StreamResult parse(LineSource source, StreamDialect dialect, StreamEventHandler handler)
            throws IOException {
        String doneMarker = dialect.getDoneMarker();
        String line;
        while ((line = source.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            if (dialect.isSkipKeepalives() && line.startsWith(":")) {
                continue;
            }
            if (isDoneLine(line, doneMarker)) {
                handler.onStreamEnd();
                return StreamResult.SUCCESS;
            }
            if (!line.startsWith(DATA_PREFIX)) {
                continue;
            }

            String data = line.substring(DATA_PREFIX.length()).trim();
            if (data.isEmpty() || data.equals(doneMarker) || EMPTY_OBJECT.equals(data)) {
                continue;
            }

            JsonNode payload;
            try {
                payload = objectMapper.readTree(data);
            } catch (JsonProcessingException e) {
                handler.onParseError(data, e);
                continue;
            }
            if (payload == null || !payload.isObject()) {
                handler.onParseError(data, new IllegalArgumentException("Expected a JSON object"));
                continue;
            }

            StreamAction action = handler.onEvent(resolveEventType(dialect, payload), payload);
            if (action instanceof StreamAction.Stop) {
                handler.onStreamEnd();
                return StreamResult.SUCCESS;
            }
            if (action instanceof StreamAction.Error error) {
                log.debug("[Stream] Handler aborted stream of dialect {}: {}", dialect.getId(), error.message());
                return StreamResult.error(error.message());
            }
        }

        handler.onStreamEnd();
        return StreamResult.SUCCESS;
    }

    private boolean isDoneLine(String line, String doneMarker) {
        if (doneMarker == null || doneMarker.isEmpty()) {
            return false;
        }
        return line.equals("data: " + doneMarker) || line.equals(doneMarker);
    }

    private String resolveEventType(StreamDialect dialect, JsonNode payload) {
        String field = dialect.getEventTypeField();
        if (field == null || field.isEmpty()) {
            return null;
        }
        JsonNode value = payload.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
