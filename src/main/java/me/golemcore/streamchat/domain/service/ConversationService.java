package me.golemcore.streamchat.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.streamchat.domain.model.BranchInfo;
import me.golemcore.streamchat.domain.model.BranchResult;
import me.golemcore.streamchat.domain.model.Conversation;
import me.golemcore.streamchat.domain.model.Message;
import me.golemcore.streamchat.domain.model.NodeUpdate;
import me.golemcore.streamchat.port.outbound.ConversationPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Loads, changes and saves conversations.
 *
 * <p>
 * Every read-modify-write of a chat runs under that chat's lock. User-initiated
 * edits (edit, resend, switch, delete) are refused with
 * {@link BranchResult.ChatBusy} while a request for the chat is streaming.
 */
@Service
@Slf4j
public class ConversationService {

    private final ConversationPort conversationPort;
    private final BranchingStore branchingStore;
    private final InFlightRequestRegistry inFlightRequests;
    private final Clock clock;
    private final Map<String, Object> chatLocks = new ConcurrentHashMap<>();

    public ConversationService(ConversationPort conversationPort, BranchingStore branchingStore,
            InFlightRequestRegistry inFlightRequests, Clock clock) {
        this.conversationPort = conversationPort;
        this.branchingStore = branchingStore;
        this.inFlightRequests = inFlightRequests;
        this.clock = clock;
    }

    /**
     * Loads the conversation, migrating a legacy flat history on first access.
     * Unknown chats yield a new, unsaved conversation.
     */
    public Conversation getOrCreate(String chatId) {
        synchronized (lockFor(chatId)) {
            return loadOrCreate(chatId);
        }
    }

    public List<Message> getActiveMessages(String chatId) {
        return branchingStore.flatten(getOrCreate(chatId));
    }

    public List<String> listChatIds() {
        return conversationPort.listChatIds();
    }

    /**
     * Appends a message to the end of the active path and saves.
     */
    public BranchResult<NodeUpdate> appendMessage(String chatId, Message message) {
        return update(chatId, conversation -> branchingStore.appendMessage(conversation, message),
                NodeUpdate::conversation);
    }

    // ==================== USER OPERATIONS ====================

    /**
     * Creates a sibling of the message with new content and makes it active.
     */
    public BranchResult<NodeUpdate> editMessage(String chatId, String messageId, String newContent) {
        return branchFrom(chatId, messageId, original -> original.toBuilder()
                .id(UUID.randomUUID().toString())
                .content(newContent)
                .timestamp(clock.instant())
                .build());
    }

    /**
     * Creates a sibling with the same content, so the reply can be regenerated.
     */
    public BranchResult<NodeUpdate> resendMessage(String chatId, String messageId) {
        return branchFrom(chatId, messageId, original -> original.toBuilder()
                .id(UUID.randomUUID().toString())
                .timestamp(clock.instant())
                .build());
    }

    public BranchResult<NodeUpdate> createBranch(String chatId, String nodeId, Message message) {
        if (inFlightRequests.isChatActive(chatId)) {
            return new BranchResult.ChatBusy<>(chatId);
        }
        return update(chatId, conversation -> branchingStore.createBranch(conversation, nodeId, message),
                NodeUpdate::conversation);
    }

    public BranchResult<Conversation> switchVariant(String chatId, String nodeId, int variantIndex) {
        if (inFlightRequests.isChatActive(chatId)) {
            return new BranchResult.ChatBusy<>(chatId);
        }
        return update(chatId, conversation -> branchingStore.switchVariant(conversation, nodeId, variantIndex),
                Function.identity());
    }

    public BranchResult<Conversation> deleteMessage(String chatId, String messageId) {
        if (inFlightRequests.isChatActive(chatId)) {
            return new BranchResult.ChatBusy<>(chatId);
        }
        return update(chatId, conversation -> branchingStore.deleteMessage(conversation, messageId),
                Function.identity());
    }

    public BranchResult<BranchInfo> getBranchInfo(String chatId, String nodeId) {
        return branchingStore.getBranchInfo(getOrCreate(chatId), nodeId);
    }

    public Optional<String> findNode(String chatId, String messageId) {
        return branchingStore.findNode(getOrCreate(chatId), messageId);
    }

    public BranchResult<Void> deleteConversation(String chatId) {
        if (inFlightRequests.isChatActive(chatId)) {
            return new BranchResult.ChatBusy<>(chatId);
        }
        synchronized (lockFor(chatId)) {
            conversationPort.delete(chatId);
        }
        return BranchResult.success(null);
    }

    // ==================== INTERNALS ====================

    private BranchResult<NodeUpdate> branchFrom(String chatId, String messageId, Function<Message, Message> variant) {
        if (inFlightRequests.isChatActive(chatId)) {
            return new BranchResult.ChatBusy<>(chatId);
        }
        return update(chatId, conversation -> {
            Optional<String> nodeId = branchingStore.findNode(conversation, messageId);
            if (nodeId.isEmpty()) {
                return new BranchResult.NodeNotFound<>(messageId);
            }
            Message original = conversation.getNode(nodeId.get()).getActiveVariant().getMessage();
            return branchingStore.createBranch(conversation, nodeId.get(), variant.apply(original));
        }, NodeUpdate::conversation);
    }

    private <T> BranchResult<T> update(String chatId, Function<Conversation, BranchResult<T>> operation,
            Function<T, Conversation> changed) {
        synchronized (lockFor(chatId)) {
            Conversation conversation = loadOrCreate(chatId);
            BranchResult<T> result = operation.apply(conversation);
            if (result instanceof BranchResult.Success<T> success) {
                Conversation updated = changed.apply(success.value());
                updated.setUpdatedAt(clock.instant());
                conversationPort.save(updated);
            } else {
                log.debug("[Conversation] Operation on chat {} rejected: {}", chatId, result.describe());
            }
            return result;
        }
    }

    private Conversation loadOrCreate(String chatId) {
        Optional<Conversation> loaded = conversationPort.load(chatId);
        if (loaded.isEmpty()) {
            Instant now = clock.instant();
            return Conversation.builder().chatId(chatId).createdAt(now).updatedAt(now).build();
        }

        Conversation conversation = loaded.get();
        Conversation migrated = branchingStore.migrate(conversation);
        if (migrated != conversation) {
            conversationPort.save(migrated);
        }
        List<String> problems = branchingStore.verifyIntegrity(migrated);
        if (!problems.isEmpty()) {
            log.warn("[Conversation] Chat {} has structural problems: {}", chatId, problems);
        }
        return migrated;
    }

    private Object lockFor(String chatId) {
        return chatLocks.computeIfAbsent(chatId, id -> new Object());
    }
}
