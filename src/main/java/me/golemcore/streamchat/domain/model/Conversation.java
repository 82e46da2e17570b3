package me.golemcore.streamchat.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A branchable conversation stored as an arena: a flat map of nodes that
 * reference their children by id. Following each node's active variant from
 * {@link #rootNodeId} yields the active path.
 *
 * <p>
 * {@link #messages} only exists for conversations saved before branching was
 * introduced. It is read once and migrated into the node arena.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Conversation {

    private String chatId;
    private String rootNodeId;

    @Builder.Default
    private Map<String, MessageNode> nodes = new LinkedHashMap<>();

    private String title;
    private String systemPrompt;
    private String groupId;
    private Instant createdAt;
    private Instant updatedAt;

    /** Legacy flat history. */
    private List<Message> messages;

    @JsonIgnore
    public boolean isBranching() {
        return rootNodeId != null || (nodes != null && !nodes.isEmpty());
    }

    @JsonIgnore
    public MessageNode getNode(String nodeId) {
        if (nodeId == null || nodes == null) {
            return null;
        }
        return nodes.get(nodeId);
    }

    /**
     * Deep copy of the node arena. Messages are shared, everything that branch
     * operations mutate is copied.
     */
    public Conversation copy() {
        Map<String, MessageNode> copiedNodes = new LinkedHashMap<>();
        if (nodes != null) {
            nodes.forEach((id, node) -> copiedNodes.put(id, node.copy()));
        }
        return toBuilder()
                .nodes(copiedNodes)
                .messages(messages != null ? new ArrayList<>(messages) : null)
                .build();
    }
}
