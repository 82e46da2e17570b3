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

import me.golemcore.streamchat.domain.model.Conversation;

import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for conversations. Loads and saves are atomic
 * read/replace operations: a reader never sees a partially written
 * conversation.
 */
public interface ConversationPort {

    Optional<Conversation> load(String chatId);

    void save(Conversation conversation);

    void delete(String chatId);

    List<String> listChatIds();
}
