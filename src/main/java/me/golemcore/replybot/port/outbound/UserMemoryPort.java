package me.golemcore.replybot.port.outbound;

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

import me.golemcore.replybot.domain.model.UserMemory;

import java.util.Optional;

/**
 * Read-only access to persisted notes about correspondents, keyed by
 * username.
 */
public interface UserMemoryPort {

    /**
     * Returns the memory for a user, or empty when none exists. Absence is not
     * an error.
     */
    Optional<UserMemory> findByUsername(String username);
}
