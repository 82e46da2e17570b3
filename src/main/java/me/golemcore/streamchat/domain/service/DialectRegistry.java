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

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.streamchat.domain.stream.PayloadMatcher;
import me.golemcore.streamchat.domain.stream.StreamDialect;
import me.golemcore.streamchat.infrastructure.config.StreamChatProperties;
import me.golemcore.streamchat.port.outbound.StoragePort;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Holds the provider dialects the wire parser and event router run with.
 *
 * <p>
 * Bundled definitions come from {@code classpath:dialects.json}. A file with
 * the same layout in the workspace {@code dialects/} directory overrides or
 * adds dialects by id, so a new OpenAI-compatible endpoint needs no code
 * change.
 */
@Service
@Slf4j
public class DialectRegistry {

    private final StoragePort storagePort;
    private final StreamChatProperties properties;
    private final ObjectMapper objectMapper;
    private final Map<String, StreamDialect> dialects = new ConcurrentHashMap<>();

    public DialectRegistry(StoragePort storagePort, StreamChatProperties properties, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        loadFromClasspath();
        loadFromWorkspace();
        log.info("[Dialects] Loaded {} dialects: {}", dialects.size(), dialects.keySet());
    }

    public StreamDialect get(String id) {
        StreamDialect dialect = dialects.get(id);
        if (dialect == null) {
            throw new IllegalArgumentException("Unknown stream dialect: " + id);
        }
        return dialect;
    }

    public Optional<StreamDialect> find(String id) {
        return Optional.ofNullable(id).map(dialects::get);
    }

    public Collection<StreamDialect> getAll() {
        return Collections.unmodifiableCollection(dialects.values());
    }

    /**
     * Adds or replaces a dialect after validating its matchers.
     */
    public void register(StreamDialect dialect) {
        validate(dialect);
        StreamDialect previous = dialects.put(dialect.getId(), dialect);
        if (previous != null) {
            log.debug("[Dialects] Replaced dialect: {}", dialect.getId());
        }
    }

    private void loadFromClasspath() {
        String resourceName = properties.getDialects().getResource();
        ClassPathResource resource = new ClassPathResource(resourceName);
        if (!resource.exists()) {
            log.warn("[Dialects] No {} on classpath", resourceName);
            return;
        }
        try (InputStream is = resource.getInputStream()) {
            String json = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            registerAll(objectMapper.readValue(json, DialectsConfig.class), "classpath");
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load bundled dialects from " + resourceName, e);
        }
    }

    private void loadFromWorkspace() {
        String directory = properties.getStorage().getDirectories().getDialects();
        String file = properties.getDialects().getWorkspaceFile();
        try {
            Boolean exists = storagePort.exists(directory, file).join();
            if (!Boolean.TRUE.equals(exists)) {
                return;
            }
            String json = storagePort.getText(directory, file).join();
            if (json != null && !json.isBlank()) {
                registerAll(objectMapper.readValue(json, DialectsConfig.class), "workspace");
            }
        } catch (IOException | RuntimeException e) { // NOSONAR
            log.warn("[Dialects] Failed to load workspace dialects: {}", e.getMessage());
        }
    }

    private void registerAll(DialectsConfig config, String origin) {
        if (config.getDialects() == null) {
            return;
        }
        for (StreamDialect dialect : config.getDialects()) {
            register(dialect);
            log.debug("[Dialects] Registered {} from {}", dialect.getId(), origin);
        }
    }

    private void validate(StreamDialect dialect) {
        if (dialect.getId() == null || dialect.getId().isBlank()) {
            throw new IllegalArgumentException("Dialect id is required");
        }
        if (dialect.getMatchers() == null) {
            dialect.setMatchers(new ArrayList<>());
        }
        for (PayloadMatcher matcher : dialect.getMatchers()) {
            if (matcher.getKind() == null) {
                throw new IllegalArgumentException("Matcher without kind in dialect " + dialect.getId());
            }
            Stream.of(matcher.getEachElementOf(), matcher.getRequiredPointer(), matcher.getConditionPointer(),
                    matcher.getTextPointer(), matcher.getCallIdPointer(), matcher.getNamePointer(),
                    matcher.getArgumentsPointer(), matcher.getIndexPointer())
                    .filter(pointer -> pointer != null)
                    .forEach(pointer -> compilePointer(dialect.getId(), pointer));
        }
    }

    private void compilePointer(String dialectId, String pointer) {
        try {
            JsonPointer.compile(pointer);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid JSON pointer '" + pointer + "' in dialect " + dialectId, e);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DialectsConfig {
        private List<StreamDialect> dialects = new ArrayList<>();
    }
}
