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
import me.golemcore.replybot.domain.model.AiProvider;
import me.golemcore.replybot.domain.model.ChatMessage;
import me.golemcore.replybot.domain.model.ConnectionTestResult;
import me.golemcore.replybot.domain.model.IncomingMessage;
import me.golemcore.replybot.domain.model.ProviderStatus;
import me.golemcore.replybot.domain.model.ReplyConfig;
import me.golemcore.replybot.domain.model.ReplyConfigChangedEvent;
import me.golemcore.replybot.domain.model.ReplyRule;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether and how to answer an incoming message.
 *
 * <p>
 * Per message:
 * <ol>
 * <li>nothing happens while the engine is disabled</li>
 * <li>one random draw against {@code randomSkipProbability} may skip the
 * message</li>
 * <li>when AI is enabled and the active provider is configured, the provider
 * is asked with the assembled context; an empty answer means no reply, a
 * failure falls through to the rules</li>
 * <li>otherwise the first matching reply rule answers</li>
 * <li>the reply is cut to {@code maxReplyLength}</li>
 * </ol>
 * Only a successful AI reply writes to conversation history.
 */
@Service
@Slf4j
public class ReplyDecisionEngine {

    private static final String LOG_TAG = "ReplyEngine";
    private static final String BOT_SENDER = "bot";
    private static final int PREVIEW_LENGTH = 50;

    private final AiClient aiClient;
    private final ContextBuilder contextBuilder;
    private final ReplyRuleEvaluator ruleEvaluator;
    private final RandomSource randomSource;
    private final ActivityLogService activityLog;
    private final Clock clock;

    private volatile ReplyConfig config;

    @Autowired
    public ReplyDecisionEngine(AiClient aiClient, ContextBuilder contextBuilder, ReplyRuleEvaluator ruleEvaluator,
            RandomSource randomSource, ActivityLogService activityLog, Clock clock,
            ReplyConfigService replyConfigService) {
        this(aiClient, contextBuilder, ruleEvaluator, randomSource, activityLog, clock,
                replyConfigService.getConfig());
    }

    public ReplyDecisionEngine(AiClient aiClient, ContextBuilder contextBuilder, ReplyRuleEvaluator ruleEvaluator,
            RandomSource randomSource, ActivityLogService activityLog, Clock clock, ReplyConfig config) {
        this.aiClient = aiClient;
        this.contextBuilder = contextBuilder;
        this.ruleEvaluator = ruleEvaluator;
        this.randomSource = randomSource;
        this.activityLog = activityLog;
        this.clock = clock;
        this.config = config;
    }

    public Optional<String> decideReply(IncomingMessage message) {
        ReplyConfig current = config;
        if (!current.isEnabled()) {
            log.debug("[ReplyEngine] Engine disabled, ignoring message {}", message.getMessageId());
            return Optional.empty();
        }

        String text = message.getMessageText() != null ? message.getMessageText() : "";
        activityLog.log(LOG_TAG, "Evaluating message from " + message.getSender() + ": \"" + preview(text) + "\"");

        if (shouldSkip(current)) {
            activityLog.log(LOG_TAG, "Randomly skipping reply");
            return Optional.empty();
        }

        if (isAiAvailable(current)) {
            try {
                Optional<String> aiReply = decideWithAi(message, text, current);
                if (aiReply.isEmpty()) {
                    activityLog.log(LOG_TAG, "AI produced no reply");
                }
                return aiReply;
            } catch (Exception e) {
                log.warn("[ReplyEngine] AI reply failed, falling back to rules", e);
                activityLog.warn(LOG_TAG, "AI error: " + e.getMessage() + ", falling back to rules");
            }
        }

        return decideWithRules(text, current);
    }

    private Optional<String> decideWithAi(IncomingMessage message, String text, ReplyConfig current) {
        String conversationId = message.resolveConversationId();
        List<ChatMessage> context = contextBuilder.getContext(conversationId, message.getSender(), text);
        log.debug("[ReplyEngine] Built context with {} messages for {}", context.size(), conversationId);

        Optional<String> generated = aiClient.generateReply(context)
                .filter(reply -> !reply.isBlank());
        if (generated.isEmpty()) {
            return Optional.empty();
        }

        String reply = limitLength(generated.get(), current.getMaxReplyLength());
        long now = clock.millis();
        contextBuilder.appendExchange(conversationId, message, IncomingMessage.builder()
                .messageId(BOT_SENDER + "-" + now)
                .sender(BOT_SENDER)
                .messageText(reply)
                .timestamp(now)
                .conversationId(conversationId)
                .build());

        activityLog.log(LOG_TAG, "AI reply: \"" + preview(reply) + "\"");
        return Optional.of(reply);
    }

    private Optional<String> decideWithRules(String text, ReplyConfig current) {
        Optional<ReplyRule> rule = ruleEvaluator.evaluate(text, current.getReplyRules());
        if (rule.isEmpty() || rule.get().getReply() == null) {
            log.debug("[ReplyEngine] No rule matched");
            return Optional.empty();
        }
        String reply = limitLength(rule.get().getReply(), current.getMaxReplyLength());
        activityLog.log(LOG_TAG, "Rule matched \"" + rule.get().getMatch() + "\"");
        return Optional.of(reply);
    }

    private boolean shouldSkip(ReplyConfig current) {
        double probability = Math.min(1, Math.max(0, current.getRandomSkipProbability()));
        return randomSource.nextDouble() < probability;
    }

    private boolean isAiAvailable(ReplyConfig current) {
        ReplyConfig.AiConfig ai = current.getAi();
        if (ai == null || !ai.isEnabled()) {
            return false;
        }
        return AiClient.validateProviderConfig(ai, ai.getProvider()).valid();
    }

    static String limitLength(String reply, int maxLength) {
        if (maxLength > 0 && reply.length() > maxLength) {
            return reply.substring(0, maxLength);
        }
        return reply;
    }

    private static String preview(String text) {
        return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
    }

    @EventListener
    public void onConfigChanged(ReplyConfigChangedEvent event) {
        updateConfig(event.config());
    }

    public void updateConfig(ReplyConfig newConfig) {
        this.config = newConfig;
        ruleEvaluator.clearCache();
        aiClient.updateConfig(newConfig.getAi());
        contextBuilder.updateConfig(newConfig.getAi());
        log.debug("[ReplyEngine] Configuration applied");
    }

    public ReplyConfig getConfig() {
        return config;
    }

    public void resetConversation(String conversationId) {
        contextBuilder.resetContext(conversationId);
        activityLog.log(LOG_TAG, "Conversation reset: " + conversationId);
    }

    public ConnectionTestResult testConnection() {
        return aiClient.testConnection();
    }

    public boolean isConnected() {
        return aiClient.isConnected();
    }

    public ProviderStatus getProviderStatus() {
        return aiClient.getProviderStatus();
    }

    public AiProvider getCurrentProvider() {
        return aiClient.getCurrentProvider();
    }
}
