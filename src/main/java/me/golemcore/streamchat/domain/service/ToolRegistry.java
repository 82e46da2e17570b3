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
import me.golemcore.streamchat.domain.component.ToolComponent;
import me.golemcore.streamchat.domain.model.ToolDefinition;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tools available to the model, by name. Created once per process with the
 * tool beans found at startup; later changes go through
 * {@link #register(ToolComponent)} and {@link #unregister(String)} only.
 */
@Service
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools = new ConcurrentHashMap<>();

    public ToolRegistry(List<ToolComponent> toolComponents) {
        for (ToolComponent tool : toolComponents) {
            if (tool.isEnabled()) {
                register(tool);
            }
        }
        log.info("[Tools] Registered {} tools: {}", tools.size(), tools.keySet());
    }

    public void register(ToolComponent tool) {
        ToolComponent previous = tools.put(tool.getToolName(), tool);
        if (previous != null && previous != tool) {
            log.warn("[Tools] Tool {} replaced by {}", tool.getToolName(), tool.getClass().getSimpleName());
        }
    }

    public boolean unregister(String name) {
        boolean removed = tools.remove(name) != null;
        if (removed) {
            log.debug("[Tools] Unregistered {}", name);
        }
        return removed;
    }

    public Optional<ToolComponent> find(String name) {
        return Optional.ofNullable(name).map(tools::get);
    }

    /**
     * Definitions sorted by name, for advertising to a provider.
     */
    public List<ToolDefinition> getDefinitions() {
        return tools.values().stream()
                .map(ToolComponent::getDefinition)
                .sorted(Comparator.comparing(ToolDefinition::getName))
                .toList();
    }
}
