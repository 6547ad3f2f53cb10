package me.golemcore.replybot.adapter.outbound.memory;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.replybot.domain.model.UserMemory;
import me.golemcore.replybot.infrastructure.config.BotProperties;
import me.golemcore.replybot.port.outbound.UserMemoryPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * {@link UserMemoryPort} backed by a single JSON file of the form
 * {@code {"<username>": {username, messages: [...], firstSeen, lastSeen}}}.
 *
 * <p>
 * The file is owned by another process. It is re-read whenever its
 * modification time changes; a missing or unreadable file yields no memory.
 * Path configured via {@code bot.memory.file}.
 */
@Component
@Slf4j
public class JsonFileUserMemoryAdapter implements UserMemoryPort {

    private static final TypeReference<Map<String, UserMemory>> MEMORY_MAP_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;

    private Map<String, UserMemory> cache = Collections.emptyMap();
    private FileTime cachedModifiedTime;

    @Autowired
    public JsonFileUserMemoryAdapter(BotProperties properties, ObjectMapper objectMapper) {
        this(resolvePath(properties.getMemory().getFile()), objectMapper);
    }

    public JsonFileUserMemoryAdapter(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<UserMemory> findByUsername(String username) {
        if (username == null || username.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(load().get(username));
    }

    private synchronized Map<String, UserMemory> load() {
        if (!Files.isRegularFile(file)) {
            cache = Collections.emptyMap();
            cachedModifiedTime = null;
            return cache;
        }
        try {
            FileTime modified = Files.getLastModifiedTime(file);
            if (modified.equals(cachedModifiedTime)) {
                return cache;
            }
            Map<String, UserMemory> loaded = objectMapper.readValue(file.toFile(), MEMORY_MAP_TYPE);
            cache = loaded != null ? loaded : Collections.emptyMap();
            cachedModifiedTime = modified;
            log.debug("[UserMemory] Loaded {} entries from {}", cache.size(), file);
        } catch (IOException e) {
            log.warn("[UserMemory] Failed to read {}: {}", file, e.getMessage());
            cache = Collections.emptyMap();
            cachedModifiedTime = null;
        }
        return cache;
    }

    private static Path resolvePath(String configured) {
        return Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
    }
}
