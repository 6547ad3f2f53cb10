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

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.replybot.domain.model.ReplyConfig;
import me.golemcore.replybot.domain.model.ReplyConfigChangedEvent;
import me.golemcore.replybot.domain.model.ReplyRule;
import me.golemcore.replybot.infrastructure.config.BotProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the live {@link ReplyConfig}. Seeded from {@link BotProperties} on first
 * access; every update is normalized, swapped in atomically and announced with
 * a {@link ReplyConfigChangedEvent}.
 *
 * <p>
 * Updates are serialized on the service: the swap and its event happen as one
 * step, so listeners receive changes in the order they were applied.
 */
@Service
@Slf4j
public class ReplyConfigService {

    private static final long MIN_REQUEST_TIMEOUT_MS = 1000;

    private final BotProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;

    private final AtomicReference<ReplyConfig> configRef = new AtomicReference<>();

    public ReplyConfigService(BotProperties properties, ApplicationEventPublisher eventPublisher,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        this.objectMapper = objectMapper;
    }

    public ReplyConfig getConfig() {
        ReplyConfig current = configRef.get();
        if (current == null) {
            synchronized (this) {
                current = configRef.get();
                if (current == null) {
                    current = normalize(seedFromProperties());
                    configRef.set(current);
                }
            }
        }
        return current;
    }

    /**
     * Replaces the whole configuration.
     */
    public synchronized ReplyConfig updateConfig(ReplyConfig newConfig) {
        ReplyConfig copy = newConfig.toBuilder().build();
        if (copy.getAi() != null) {
            copy.setAi(copy.getAi().toBuilder().build());
        }
        ReplyConfig normalized = normalize(copy);
        configRef.set(normalized);
        log.info("[ReplyConfig] Configuration updated (provider={}, ai={}, rules={})",
                normalized.getAi().getProvider().getId(), normalized.getAi().isEnabled(),
                normalized.getReplyRules().size());
        eventPublisher.publishEvent(new ReplyConfigChangedEvent(normalized));
        return normalized;
    }

    /**
     * Shallow-merges the given fields into a copy of the current AI settings and
     * applies the result. Absent fields keep their current value.
     *
     * @throws IllegalArgumentException
     *             if a field has the wrong type or an unknown value
     */
    public synchronized ReplyConfig mergeAiConfig(Map<String, Object> patch) {
        ReplyConfig current = getConfig();
        ReplyConfig.AiConfig ai = current.getAi().toBuilder().build();
        try {
            objectMapper.updateValue(ai, patch);
        } catch (JsonMappingException e) {
            throw new IllegalArgumentException("Invalid AI configuration: " + e.getOriginalMessage(), e);
        }
        return updateConfig(current.toBuilder().ai(ai).build());
    }

    ReplyConfig normalize(ReplyConfig config) {
        if (config.getReplyRules() == null) {
            config.setReplyRules(new ArrayList<>());
        } else {
            config.setReplyRules(new ArrayList<>(config.getReplyRules()));
        }
        if (config.getAi() == null) {
            config.setAi(new ReplyConfig.AiConfig());
        }
        double skip = config.getRandomSkipProbability();
        if (Double.isNaN(skip) || skip < 0 || skip > 1) {
            double clamped = Double.isNaN(skip) ? 0 : Math.min(1, Math.max(0, skip));
            log.warn("[ReplyConfig] randomSkipProbability {} out of range, using {}", skip, clamped);
            config.setRandomSkipProbability(clamped);
        }
        if (config.getMaxReplyLength() < 1) {
            config.setMaxReplyLength(new ReplyConfig().getMaxReplyLength());
        }
        config.setMaxRepliesPerMinute(Math.max(1, config.getMaxRepliesPerMinute()));
        config.setMaxRepliesPerHour(Math.max(1, config.getMaxRepliesPerHour()));

        ReplyConfig.AiConfig ai = config.getAi();
        if (ai.getProvider() == null) {
            ai.setProvider(new ReplyConfig.AiConfig().getProvider());
        }
        if (ai.getMaxContextMessages() < 1) {
            log.warn("[ReplyConfig] maxContextMessages {} below 1, using 1", ai.getMaxContextMessages());
            ai.setMaxContextMessages(1);
        }
        if (ai.getRequestTimeoutMs() < MIN_REQUEST_TIMEOUT_MS) {
            log.warn("[ReplyConfig] requestTimeoutMs {} below {}, using {}", ai.getRequestTimeoutMs(),
                    MIN_REQUEST_TIMEOUT_MS, MIN_REQUEST_TIMEOUT_MS);
            ai.setRequestTimeoutMs(MIN_REQUEST_TIMEOUT_MS);
        }
        ai.setMaxRetries(Math.max(1, ai.getMaxRetries()));
        if (ai.getHostedApiKey() == null) {
            ai.setHostedApiKey("");
        }
        return config;
    }

    private ReplyConfig seedFromProperties() {
        BotProperties.AiProperties aiProps = properties.getAi();
        BotProperties.ReplyProperties replyProps = properties.getReply();

        ReplyConfig.AiConfig ai = new ReplyConfig.AiConfig();
        ai.setEnabled(aiProps.isEnabled());
        ai.setProvider(aiProps.getProvider());
        ai.setLlmEndpoint(aiProps.getLlmEndpoint());
        ai.setLlmPort(aiProps.getLlmPort());
        ai.setModelName(aiProps.getModelName());
        ai.setHostedApiKey(aiProps.getHostedApiKey());
        ai.setHostedModel(aiProps.getHostedModel());
        ai.setHostedBaseUrl(aiProps.getHostedBaseUrl());
        ai.setRequestTimeoutMs(aiProps.getRequestTimeoutMs());
        if (aiProps.getSystemPrompt() != null && !aiProps.getSystemPrompt().isBlank()) {
            ai.setSystemPrompt(aiProps.getSystemPrompt());
        }

        List<ReplyRule> rules = replyProps.getRules() != null ? replyProps.getRules() : List.of();
        return ReplyConfig.builder()
                .enabled(replyProps.isEnabled())
                .replyRules(new ArrayList<>(rules))
                .randomSkipProbability(replyProps.getRandomSkipProbability())
                .maxReplyLength(replyProps.getMaxReplyLength())
                .maxRepliesPerMinute(replyProps.getMaxRepliesPerMinute())
                .maxRepliesPerHour(replyProps.getMaxRepliesPerHour())
                .ai(ai)
                .build();
    }
}
