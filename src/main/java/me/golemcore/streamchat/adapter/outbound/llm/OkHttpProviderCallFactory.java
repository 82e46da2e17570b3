package me.golemcore.streamchat.adapter.outbound.llm;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.streamchat.domain.model.Message;
import me.golemcore.streamchat.port.outbound.ProviderCall;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Function;

/**
 * Creates {@link OkHttpProviderCall}s on the shared streaming client.
 */
@Component
public class OkHttpProviderCallFactory {

    private final OkHttpClient streamingClient;
    private final ObjectMapper objectMapper;

    public OkHttpProviderCallFactory(@Qualifier("streamingOkHttpClient") OkHttpClient streamingClient,
            ObjectMapper objectMapper) {
        this.streamingClient = streamingClient;
        this.objectMapper = objectMapper;
    }

    public ProviderCall create(String dialectId, String model, Function<List<Message>, Request> requestFactory) {
        return new OkHttpProviderCall(streamingClient, objectMapper, dialectId, model, requestFactory);
    }
}
