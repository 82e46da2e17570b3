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

/**
 * Terminal outcome of parsing one stream.
 */
public sealed interface StreamResult permits StreamResult.Success, StreamResult.Error {

    StreamResult SUCCESS = new Success();

    static StreamResult error(String message) {
        return new Error(message);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    record Success() implements StreamResult {
    }

    record Error(String message) implements StreamResult {
    }
}
