package me.golemcore.streamchat.infrastructure.http;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.streamchat.infrastructure.config.StreamChatProperties;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.concurrent.TimeUnit;

/**
 * OkHttp clients built from {@link StreamChatProperties.HttpProperties}.
 *
 * <p>
 * The streaming client shares the connection pool of the default one but
 * allows long pauses between chunks, since reasoning models may think for
 * minutes before the first token.
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    private final StreamChatProperties properties;

    @Bean
    @Primary
    public OkHttpClient okHttpClient() {
        StreamChatProperties.HttpProperties http = properties.getHttp();

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(
                        http.getMaxIdleConnections(),
                        http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                .retryOnConnectionFailure(true)
                .build();
    }

    @Bean
    public OkHttpClient streamingOkHttpClient(OkHttpClient okHttpClient) {
        return okHttpClient.newBuilder()
                .readTimeout(properties.getHttp().getStreamReadTimeout(), TimeUnit.MILLISECONDS)
                .build();
    }
}
