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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.streamchat.domain.model.Message;
import me.golemcore.streamchat.port.outbound.LineSource;
import me.golemcore.streamchat.port.outbound.ProviderCall;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Streams a provider response over OkHttp. Building the provider-specific
 * request is left to the supplied factory; this class only executes it and
 * exposes the body as lines.
 */
@Slf4j
public class OkHttpProviderCall implements ProviderCall {

    private static final int MAX_ERROR_BODY = 2000;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String dialectId;
    private final String model;
    private final Function<List<Message>, Request> requestFactory;

    public OkHttpProviderCall(OkHttpClient httpClient, ObjectMapper objectMapper, String dialectId, String model,
            Function<List<Message>, Request> requestFactory) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.dialectId = dialectId;
        this.model = model;
        this.requestFactory = requestFactory;
    }

    @Override
    public String getDialectId() {
        return dialectId;
    }

    @Override
    public String getModel() {
        return model;
    }

    @Override
    public LineSource open(List<Message> messages, Consumer<Closeable> abortHandle) throws IOException {
        Request request = requestFactory.apply(messages).newBuilder()
                .header("Accept", "text/event-stream")
                .build();
        Call call = httpClient.newCall(request);
        abortHandle.accept(call::cancel);
        log.debug("[Transport] Opening stream {} {} ({} messages)", request.method(), request.url(),
                messages.size());

        Response response = call.execute();
        if (!response.isSuccessful()) {
            try (response) {
                String body = readErrorBody(response.body());
                throw new ProviderHttpException(response.code(),
                        "HTTP " + response.code() + ": " + extractErrorMessage(body), body);
            }
        }
        if (response.body() == null) {
            response.close();
            throw new IOException("Empty response body from " + request.url());
        }
        return new OkHttpLineSource(call, response);
    }

    private String readErrorBody(ResponseBody body) throws IOException {
        if (body == null) {
            return "";
        }
        String text = body.string();
        return text.length() > MAX_ERROR_BODY ? text.substring(0, MAX_ERROR_BODY) : text;
    }

    private String extractErrorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "no response body";
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode message = root.at("/error/message");
            if (message.isTextual()) {
                return message.asText();
            }
            if (root.path("error").isTextual()) {
                return root.path("error").asText();
            }
        } catch (IOException e) { // NOSONAR - not JSON, fall back to raw text
            log.debug("[Transport] Error body is not JSON");
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }
}
