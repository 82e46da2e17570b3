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
 * Callbacks invoked by {@link StreamWireParser} while it scans a stream.
 */
public interface StreamEventHandler {

    /**
     * Handles one parsed data payload.
     *
     * @param eventType
     *            value of the dialect's type field, or {@code null} when the
     *            dialect has none or the payload does not carry it
     * @param payload
     *            the JSON object
     * @return how the parser should continue
     */
    StreamAction onEvent(String eventType, JsonNode payload);

    /**
     * Called exactly once when the stream ends cleanly: on the done marker, on
     * {@link StreamAction#STOP}, or when the source is exhausted.
     */
    void onStreamEnd();

    /**
     * A data line that is not a JSON object. Never fatal.
     */
    void onParseError(String rawContent, Exception error);
}
