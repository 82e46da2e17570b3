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
import me.golemcore.streamchat.domain.model.MessageNode;
import me.golemcore.streamchat.domain.model.MessageVariant;
import me.golemcore.streamchat.domain.model.NodeUpdate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Operations on the branching conversation tree.
 *
 * <p>
 * Every operation is copy-on-write: the input conversation is never modified,
 * so a failed operation leaves it exactly as it was. Structural problems are
 * returned as {@link BranchResult} values.
 *
 * <p>
 * The active path starts at the root and follows, at each node, the child of
 * the active variant. Flattening it yields the message list sent to a provider.
 */
@Service
@Slf4j
public class BranchingStore {

    private static final String MIGRATED_NODE_PREFIX = "node-";
    private static final String MIGRATED_MESSAGE_PREFIX = "msg-";

    // ==================== MIGRATION ====================

    /**
     * Builds a single-thread tree from a flat history. Node ids derive from
     * positions, so the result is deterministic.
     */
    public Conversation migrate(List<Message> flatHistory) {
        Map<String, MessageNode> nodes = new LinkedHashMap<>();
        List<Message> history = flatHistory != null ? flatHistory : List.of();

        for (int i = 0; i < history.size(); i++) {
            Message message = history.get(i);
            if (message.getId() == null || message.getId().isBlank()) {
                message = message.toBuilder().id(MIGRATED_MESSAGE_PREFIX + i).build();
            }
            String childId = i + 1 < history.size() ? MIGRATED_NODE_PREFIX + (i + 1) : null;
            MessageVariant variant = MessageVariant.builder().message(message).childNodeId(childId).build();
            List<MessageVariant> variants = new ArrayList<>();
            variants.add(variant);
            nodes.put(MIGRATED_NODE_PREFIX + i, MessageNode.builder()
                    .id(MIGRATED_NODE_PREFIX + i)
                    .variants(variants)
                    .activeVariantIndex(0)
                    .build());
        }

        return Conversation.builder()
                .rootNodeId(history.isEmpty() ? null : MIGRATED_NODE_PREFIX + 0)
                .nodes(nodes)
                .build();
    }

    /**
     * Migrates a conversation saved with a flat history. Conversations that
     * already have a node arena, or have nothing to migrate, are returned
     * unchanged.
     */
    public Conversation migrate(Conversation conversation) {
        if (conversation.isBranching()
                || conversation.getMessages() == null
                || conversation.getMessages().isEmpty()) {
            return conversation;
        }

        Conversation migrated = migrate(conversation.getMessages());
        log.info("[Branch] Migrated {} legacy messages of chat {}", conversation.getMessages().size(),
                conversation.getChatId());
        return conversation.toBuilder()
                .rootNodeId(migrated.getRootNodeId())
                .nodes(migrated.getNodes())
                .messages(null)
                .build();
    }

    // ==================== QUERIES ====================

    /**
     * Finds the node whose active variant carries the message. The active path
     * is searched first, then the nodes of inactive branches.
     */
    public Optional<String> findNode(Conversation conversation, String messageId) {
        if (messageId == null) {
            return Optional.empty();
        }
        for (String nodeId : activePath(conversation)) {
            if (carries(conversation.getNode(nodeId), messageId)) {
                return Optional.of(nodeId);
            }
        }
        for (MessageNode node : conversation.getNodes().values()) {
            if (carries(node, messageId)) {
                return Optional.of(node.getId());
            }
        }
        return Optional.empty();
    }

    private boolean carries(MessageNode node, String messageId) {
        MessageVariant active = node.getActiveVariant();
        Message message = active != null ? active.getMessage() : null;
        return message != null && messageId.equals(message.getId());
    }

    public BranchResult<BranchInfo> getBranchInfo(Conversation conversation, String nodeId) {
        MessageNode node = conversation.getNode(nodeId);
        if (node == null) {
            return new BranchResult.NodeNotFound<>(nodeId);
        }
        return BranchResult.success(new BranchInfo(nodeId, node.getActiveVariantIndex(), node.getVariants().size()));
    }

    /**
     * Node ids of the active path, root first. Stops at a dangling reference or
     * a cycle instead of failing.
     */
    public List<String> activePath(Conversation conversation) {
        List<String> path = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        String nodeId = conversation.getRootNodeId();
        while (nodeId != null) {
            MessageNode node = conversation.getNode(nodeId);
            if (node == null) {
                log.warn("[Branch] Active path of chat {} references missing node {}", conversation.getChatId(),
                        nodeId);
                break;
            }
            if (!visited.add(nodeId)) {
                log.warn("[Branch] Cycle at node {} in chat {}", nodeId, conversation.getChatId());
                break;
            }
            MessageVariant variant = node.getActiveVariant();
            if (variant == null) {
                log.warn("[Branch] Node {} has no active variant", nodeId);
                break;
            }
            path.add(nodeId);
            nodeId = variant.getChildNodeId();
        }
        return path;
    }

    /**
     * Messages of the active path in order: the exact context handed to a
     * provider.
     */
    public List<Message> flatten(Conversation conversation) {
        List<Message> messages = new ArrayList<>();
        for (String nodeId : activePath(conversation)) {
            messages.add(conversation.getNode(nodeId).getActiveVariant().getMessage());
        }
        return messages;
    }

    /**
     * Lists broken invariants; an empty list means the tree is sound.
     */
    public List<String> verifyIntegrity(Conversation conversation) {
        List<String> problems = new ArrayList<>();
        Map<String, MessageNode> nodes = conversation.getNodes() != null ? conversation.getNodes() : Map.of();
        String rootId = conversation.getRootNodeId();
        if (rootId != null && !nodes.containsKey(rootId)) {
            problems.add("root references missing node " + rootId);
        }

        Map<String, Integer> owners = new HashMap<>();
        for (MessageNode node : nodes.values()) {
            List<MessageVariant> variants = node.getVariants();
            if (variants == null || variants.isEmpty()) {
                problems.add("node " + node.getId() + " has no variants");
                continue;
            }
            if (node.getActiveVariantIndex() < 0 || node.getActiveVariantIndex() >= variants.size()) {
                problems.add("node " + node.getId() + " has active index " + node.getActiveVariantIndex()
                        + " of " + variants.size());
            }
            for (MessageVariant variant : variants) {
                String child = variant.getChildNodeId();
                if (child == null) {
                    continue;
                }
                if (!nodes.containsKey(child)) {
                    problems.add("node " + node.getId() + " references missing child " + child);
                }
                owners.merge(child, 1, Integer::sum);
            }
        }
        owners.forEach((child, count) -> {
            if (count > 1) {
                problems.add("node " + child + " is owned by " + count + " variants");
            }
        });
        if (rootId != null && owners.containsKey(rootId)) {
            problems.add("root node " + rootId + " is referenced as a child");
        }
        for (String nodeId : nodes.keySet()) {
            if (!nodeId.equals(rootId) && !owners.containsKey(nodeId)) {
                problems.add("node " + nodeId + " is unreachable");
            }
        }
        return problems;
    }

    // ==================== MUTATIONS ====================

    /**
     * Adds a new node holding {@code message} after the last node of the active
     * path (or as the root of an empty conversation).
     */
    public BranchResult<NodeUpdate> appendMessage(Conversation conversation, Message message) {
        if (message == null) {
            return new BranchResult.Error<>("Message is required");
        }
        Conversation updated = conversation.copy();
        List<String> path = activePath(updated);
        String nodeId = newNodeId();
        updated.getNodes().put(nodeId, singleVariantNode(nodeId, message));

        if (path.isEmpty()) {
            if (updated.getRootNodeId() != null && updated.getNode(updated.getRootNodeId()) != null) {
                return new BranchResult.Error<>("Active path is broken at the root of chat " + updated.getChatId());
            }
            updated.setRootNodeId(nodeId);
        } else {
            MessageNode leaf = updated.getNode(path.get(path.size() - 1));
            leaf.getActiveVariant().setChildNodeId(nodeId);
        }
        return BranchResult.success(new NodeUpdate(updated, nodeId));
    }

    /**
     * Adds {@code newMessage} as a new variant of the node and makes it active.
     * Existing variants and their subtrees are kept unchanged.
     */
    public BranchResult<NodeUpdate> createBranch(Conversation conversation, String nodeId, Message newMessage) {
        if (conversation.getNode(nodeId) == null) {
            return new BranchResult.NodeNotFound<>(nodeId);
        }
        if (newMessage == null) {
            return new BranchResult.Error<>("Message is required");
        }
        Conversation updated = conversation.copy();
        MessageNode node = updated.getNode(nodeId);
        node.getVariants().add(MessageVariant.builder().message(newMessage).build());
        node.setActiveVariantIndex(node.getVariants().size() - 1);
        log.debug("[Branch] Created variant {} at node {}", node.getActiveVariantIndex(), nodeId);
        return BranchResult.success(new NodeUpdate(updated, nodeId));
    }

    public BranchResult<Conversation> switchVariant(Conversation conversation, String nodeId, int variantIndex) {
        MessageNode node = conversation.getNode(nodeId);
        if (node == null) {
            return new BranchResult.NodeNotFound<>(nodeId);
        }
        int size = node.getVariants().size();
        if (variantIndex < 0 || variantIndex >= size) {
            return new BranchResult.IndexOutOfRange<>(nodeId, variantIndex, size);
        }
        Conversation updated = conversation.copy();
        updated.getNode(nodeId).setActiveVariantIndex(variantIndex);
        return BranchResult.success(updated);
    }

    /**
     * Removes the node carrying the message, re-linking its continuation to the
     * node's parent. Branch points cannot be deleted.
     */
    public BranchResult<Conversation> deleteMessage(Conversation conversation, String messageId) {
        Optional<String> found = findNode(conversation, messageId);
        if (found.isEmpty()) {
            return new BranchResult.NodeNotFound<>(messageId);
        }
        String nodeId = found.get();
        MessageNode node = conversation.getNode(nodeId);
        if (node.isBranchPoint()) {
            return new BranchResult.CannotDeleteBranchPoint<>(nodeId, node.getVariants().size());
        }

        Conversation updated = conversation.copy();
        String childId = node.getActiveVariant().getChildNodeId();
        if (nodeId.equals(updated.getRootNodeId())) {
            updated.setRootNodeId(childId);
        } else {
            MessageVariant parentVariant = findOwningVariant(updated, nodeId);
            if (parentVariant == null) {
                return new BranchResult.Error<>("Node " + nodeId + " has no parent");
            }
            parentVariant.setChildNodeId(childId);
        }
        updated.getNodes().remove(nodeId);
        log.debug("[Branch] Deleted message {} (node {})", messageId, nodeId);
        return BranchResult.success(updated);
    }

    private MessageVariant findOwningVariant(Conversation conversation, String childId) {
        for (MessageNode candidate : conversation.getNodes().values()) {
            for (MessageVariant variant : candidate.getVariants()) {
                if (childId.equals(variant.getChildNodeId())) {
                    return variant;
                }
            }
        }
        return null;
    }

    private MessageNode singleVariantNode(String nodeId, Message message) {
        List<MessageVariant> variants = new ArrayList<>();
        variants.add(MessageVariant.builder().message(message).build());
        return MessageNode.builder().id(nodeId).variants(variants).activeVariantIndex(0).build();
    }

    private String newNodeId() {
        return "node-" + UUID.randomUUID();
    }
}
