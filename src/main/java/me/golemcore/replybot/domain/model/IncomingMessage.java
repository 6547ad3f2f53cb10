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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A message received from a messaging surface. Conversation identity resolves
 * to {@code conversationId} when present, otherwise to {@code sender}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class IncomingMessage {

    private String messageId;
    private String sender;
    private String messageText;
    private long timestamp;
    private String conversationId;

    /**
     * Returns the key under which this message's history is grouped.
     */
    public String resolveConversationId() {
        if (conversationId != null && !conversationId.isBlank()) {
            return conversationId;
        }
        return sender;
    }
}
