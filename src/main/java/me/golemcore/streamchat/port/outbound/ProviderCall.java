package me.golemcore.streamchat.port.outbound;

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

import me.golemcore.streamchat.domain.model.Message;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.function.Consumer;

/**
 * One provider endpoint ready to stream a turn. The orchestrator opens it once
 * per round, again after every tool result, with the current message list.
 */
public interface ProviderCall {

    /**
     * Id of the stream dialect the response is parsed with.
     */
    String getDialectId();

    /**
     * Model name recorded on saved assistant messages.
     */
    String getModel();

    /**
     * Sends the request and returns the response as a line stream.
     *
     * @param abortHandle
     *            receives a handle that aborts the exchange, before the call
     *            starts waiting for the response headers
     * @throws IOException
     *             if the request fails or is aborted before streaming starts
     */
    LineSource open(List<Message> messages, Consumer<Closeable> abortHandle) throws IOException;

    default LineSource open(List<Message> messages) throws IOException {
        return open(messages, handle -> {
        });
    }
}
