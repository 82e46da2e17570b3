package me.golemcore.streamchat.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties bound from application.properties under the
 * {@code chat.*} prefix.
 *
 * <ul>
 * <li>{@link StorageProperties} - workspace location and directory names</li>
 * <li>{@link HttpProperties} - timeouts and pooling of the streaming client</li>
 * <li>{@link TurnProperties} - tool round limits and timeouts</li>
 * <li>{@link EventsProperties} - stream event fan-out</li>
 * <li>{@link DialectsProperties} - where provider dialects are loaded from</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "chat")
@Data
public class StreamChatProperties {

    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private TurnProperties turn = new TurnProperties();
    private EventsProperties events = new EventsProperties();
    private DialectsProperties dialects = new DialectsProperties();

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private DirectoriesProperties directories = new DirectoriesProperties();
        private boolean backupConversations = true;
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/streamchat";
    }

    @Data
    public static class DirectoriesProperties {
        private String conversations = "conversations";
        private String dialects = "dialects";
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long streamReadTimeout = 300000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== TURN ====================

    @Data
    public static class TurnProperties {
        private int maxToolRounds = 25;
        private Duration toolTimeout = Duration.ofMinutes(5);
    }

    @Data
    public static class EventsProperties {
        private int historySize = 1000;
        private int retainedRequests = 100;
    }

    @Data
    public static class DialectsProperties {
        private String resource = "dialects.json";
        private String workspaceFile = "dialects.json";
    }
}
