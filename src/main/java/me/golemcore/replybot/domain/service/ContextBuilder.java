package me.golemcore.replybot.domain.service;

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
import me.golemcore.replybot.domain.model.ChatMessage;
import me.golemcore.replybot.domain.model.IncomingMessage;
import me.golemcore.replybot.domain.model.ReplyConfig;
import me.golemcore.replybot.domain.model.UserMemory;
import me.golemcore.replybot.port.outbound.UserMemoryPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps per-conversation message history and assembles the bounded context
 * sent to a provider.
 *
 * <p>
 * A context is always:
 * <ol>
 * <li>exactly one {@code system} message: the configured prompt, followed by
 * the formatted {@link UserMemory} of the user when one exists</li>
 * <li>when history is enabled, the last {@code maxContextMessages} stored
 * entries of the conversation, oldest first</li>
 * <li>the current message text as a {@code user} message, when supplied</li>
 * </ol>
 *
 * <p>
 * Storage is unbounded and append-only per conversation; the window is applied
 * at read time. Histories are sharded by conversation id, and each shard is
 * guarded by its own lock so readers never see a partial append.
 */
@Service
@Slf4j
public class ContextBuilder {

    private final UserMemoryPort userMemoryPort;
    private final UserMemoryFormatter memoryFormatter;
    private final Map<String, ConversationHistory> conversations = new ConcurrentHashMap<>();

    private volatile Settings settings;

    @Autowired
    public ContextBuilder(UserMemoryPort userMemoryPort, UserMemoryFormatter memoryFormatter,
            ReplyConfigService replyConfigService) {
        this(userMemoryPort, memoryFormatter, replyConfigService.getConfig().getAi());
    }

    public ContextBuilder(UserMemoryPort userMemoryPort, UserMemoryFormatter memoryFormatter,
            ReplyConfig.AiConfig config) {
        this.userMemoryPort = userMemoryPort;
        this.memoryFormatter = memoryFormatter;
        this.settings = Settings.from(config);
    }

    public List<ChatMessage> getContext(String conversationId, String userId) {
        return getContext(conversationId, userId, null);
    }

    public List<ChatMessage> getContext(String conversationId, String userId, String currentMessageText) {
        Settings current = settings;
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(buildSystemPrompt(current.systemPrompt(), userId)));

        if (current.historyEnabled()) {
            ConversationHistory history = conversations.get(conversationId);
            if (history != null) {
                for (StoredMessage stored : history.tail(current.maxMessages())) {
                    messages.add(new ChatMessage(stored.role(), stored.content()));
                }
            }
        }

        if (currentMessageText != null && !currentMessageText.isEmpty()) {
            messages.add(ChatMessage.user(currentMessageText));
        }
        return messages;
    }

    /**
     * Appends a message to the conversation's history as {@code assistant} when
     * {@code isBot}, otherwise as {@code user}.
     */
    public void addMessage(String conversationId, IncomingMessage message, boolean isBot) {
        ChatMessage.Role role = isBot ? ChatMessage.Role.ASSISTANT : ChatMessage.Role.USER;
        append(conversationId, List.of(new StoredMessage(role, message.getMessageText(), message.getTimestamp())));
    }

    /**
     * Appends a user message and the bot's answer as one step, so readers and
     * concurrent exchanges on the same conversation never see only half of it.
     */
    public void appendExchange(String conversationId, IncomingMessage userMessage, IncomingMessage botMessage) {
        append(conversationId, List.of(
                new StoredMessage(ChatMessage.Role.USER, userMessage.getMessageText(), userMessage.getTimestamp()),
                new StoredMessage(ChatMessage.Role.ASSISTANT, botMessage.getMessageText(),
                        botMessage.getTimestamp())));
    }

    private void append(String conversationId, List<StoredMessage> entries) {
        // compute runs under the map's bin lock, so a concurrent reset cannot drop the append
        conversations.compute(conversationId, (id, history) -> {
            ConversationHistory target = history != null ? history : new ConversationHistory();
            target.appendAll(entries);
            return target;
        });
    }

    public void resetContext(String conversationId) {
        conversations.remove(conversationId);
        log.debug("[ContextBuilder] Reset conversation {}", conversationId);
    }

    public int getMessageCount(String conversationId) {
        ConversationHistory history = conversations.get(conversationId);
        return history != null ? history.size() : 0;
    }

    public void clearAll() {
        conversations.clear();
    }

    public void setSystemPrompt(String prompt) {
        Settings current = settings;
        settings = new Settings(prompt, current.maxMessages(), current.historyEnabled());
    }

    public void setMaxMessages(int maxMessages) {
        Settings current = settings;
        settings = new Settings(current.systemPrompt(), Math.max(1, maxMessages), current.historyEnabled());
    }

    public void setContextEnabled(boolean enabled) {
        Settings current = settings;
        settings = new Settings(current.systemPrompt(), current.maxMessages(), enabled);
    }

    public void updateConfig(ReplyConfig.AiConfig config) {
        settings = Settings.from(config);
    }

    private String buildSystemPrompt(String prompt, String userId) {
        String base = prompt != null ? prompt : "";
        if (userId == null || userId.isBlank()) {
            return base;
        }
        Optional<UserMemory> memory = userMemoryPort.findByUsername(userId);
        return memory.map(m -> base + memoryFormatter.format(userId, m)).orElse(base);
    }

    private record Settings(String systemPrompt, int maxMessages, boolean historyEnabled) {

        static Settings from(ReplyConfig.AiConfig config) {
            return new Settings(config.getSystemPrompt(), Math.max(1, config.getMaxContextMessages()),
                    config.isContextHistoryEnabled());
        }
    }

    private record StoredMessage(ChatMessage.Role role, String content, long timestamp) {
    }

    private static final class ConversationHistory {

        private final List<StoredMessage> messages = new ArrayList<>();

        synchronized void appendAll(List<StoredMessage> entries) {
            messages.addAll(entries);
        }

        synchronized List<StoredMessage> tail(int limit) {
            int from = Math.max(0, messages.size() - limit);
            return new ArrayList<>(messages.subList(from, messages.size()));
        }

        synchronized int size() {
            return messages.size();
        }
    }
}
