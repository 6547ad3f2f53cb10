package me.golemcore.replybot.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Backend capable of producing a reply: a locally hosted model server or a
 * hosted third-party chat completions API.
 */
public enum AiProvider {

    LOCAL("local", "Local LLM Server"),
    HOSTED("hosted", "Hosted API");

    private final String id;
    private final String displayName;

    AiProvider(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolves a provider from its configuration id (case-insensitive).
     *
     * @throws IllegalArgumentException
     *             if the id names no known provider
     */
    @JsonCreator
    public static AiProvider fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("AI provider id is required");
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (AiProvider provider : values()) {
            if (provider.id.equals(normalized)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown AI provider: " + id);
    }
}
