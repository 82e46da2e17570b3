package me.golemcore.streamchat;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Streaming LLM chat client.
 *
 * <p>
 * Streams responses from several providers over server-sent events, runs the
 * tools the model calls in the middle of a turn, and keeps every conversation
 * as a branchable tree so any message can be edited or resent.
 *
 * <p>
 * Main parts:
 * <ul>
 * <li>{@code domain.stream} - SSE wire parser, dialect-driven event router</li>
 * <li>{@code domain.service.RequestOrchestrator} - per-request state machine
 * with tool round trips</li>
 * <li>{@code domain.service.BranchingStore} - the conversation tree</li>
 * <li>{@code adapter.outbound} - local JSON storage, OkHttp transport, tool
 * execution</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class StreamChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamChatApplication.class, args);
    }
}
