package me.golemcore.streamchat.adapter.outbound.conversation;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.streamchat.domain.model.Conversation;
import me.golemcore.streamchat.infrastructure.config.StreamChatProperties;
import me.golemcore.streamchat.port.outbound.ConversationPort;
import me.golemcore.streamchat.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stores each conversation as one JSON document,
 * {@code conversations/<chatId>.json}, replaced atomically on every save.
 *
 * <p>
 * Loaded conversations are cached. Conversations are treated as values by the
 * branch operations (every change produces a new copy), so cached instances are
 * never modified in place.
 */
@Component
@Slf4j
public class JsonConversationRepository implements ConversationPort {

    private static final String EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final StreamChatProperties properties;
    private final Map<String, Conversation> cache = new ConcurrentHashMap<>();

    public JsonConversationRepository(StoragePort storagePort, ObjectMapper objectMapper,
            StreamChatProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public Optional<Conversation> load(String chatId) {
        Conversation cached = cache.get(chatId);
        if (cached != null) {
            return Optional.of(cached);
        }

        String json;
        try {
            json = storagePort.getText(directory(), fileName(chatId)).join();
        } catch (CompletionException e) {
            throw new IllegalStateException("Failed to read conversation " + chatId, e.getCause());
        }
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }

        try {
            Conversation conversation = objectMapper.readValue(json, Conversation.class);
            if (conversation.getChatId() == null) {
                conversation.setChatId(chatId);
            }
            cache.put(chatId, conversation);
            log.debug("[Conversation] Loaded {} ({} nodes)", chatId,
                    conversation.getNodes() != null ? conversation.getNodes().size() : 0);
            return Optional.of(conversation);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt conversation file for chat " + chatId, e);
        }
    }

    @Override
    public void save(Conversation conversation) {
        String chatId = conversation.getChatId();
        if (chatId == null || chatId.isBlank()) {
            throw new IllegalArgumentException("Conversation has no chat id");
        }
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(conversation);
            storagePort.putTextAtomic(directory(), fileName(chatId), json,
                    properties.getStorage().isBackupConversations()).join();
            cache.put(chatId, conversation);
            log.debug("[Conversation] Saved {}", chatId);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize conversation " + chatId, e);
        } catch (CompletionException e) {
            cache.remove(chatId);
            throw new IllegalStateException("Failed to save conversation " + chatId, e.getCause());
        }
    }

    @Override
    public void delete(String chatId) {
        cache.remove(chatId);
        try {
            storagePort.deleteObject(directory(), fileName(chatId)).join();
            log.info("[Conversation] Deleted {}", chatId);
        } catch (CompletionException e) {
            throw new IllegalStateException("Failed to delete conversation " + chatId, e.getCause());
        }
    }

    @Override
    public List<String> listChatIds() {
        return storagePort.listObjects(directory(), "").join().stream()
                .filter(path -> path.endsWith(EXTENSION) && !path.contains("/"))
                .map(path -> path.substring(0, path.length() - EXTENSION.length()))
                .toList();
    }

    private String directory() {
        return properties.getStorage().getDirectories().getConversations();
    }

    private String fileName(String chatId) {
        return chatId + EXTENSION;
    }
}
