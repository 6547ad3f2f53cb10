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
import me.golemcore.replybot.domain.model.ProviderStatus;
import me.golemcore.replybot.domain.model.ProviderValidation;
import me.golemcore.replybot.domain.model.ReplyConfig;
import me.golemcore.replybot.port.outbound.LlmPort;
import me.golemcore.replybot.ratelimit.ErrorTracker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Provider-agnostic facade over the registered {@link LlmPort}s.
 *
 * <p>
 * The active provider is read from the current {@link ReplyConfig.AiConfig} on
 * every call, so switching {@code provider} takes effect on the next request
 * without rebuilding any conversation state. Every provider keeps its own
 * {@link ErrorTracker}; an open circuit on one never affects the other.
 *
 * @see LlmPort
 */
@Service
@Slf4j
public class AiClient {

    private static final String LOG_TAG = "AiClient";
    private static final int MAX_PORT = 65535;
    private static final List<String> HOSTED_MODELS = List.of(
            "gpt-3.5-turbo",
            "gpt-3.5-turbo-16k",
            "gpt-4",
            "gpt-4-turbo-preview",
            "gpt-4o",
            "gpt-4o-mini");

    private final Map<AiProvider, LlmPort> providers = new EnumMap<>(AiProvider.class);
    private final ActivityLogService activityLog;
    private volatile ReplyConfig.AiConfig config;

    @Autowired
    public AiClient(List<LlmPort> llmPorts, ReplyConfigService replyConfigService, ActivityLogService activityLog) {
        this(llmPorts, replyConfigService.getConfig().getAi(), activityLog);
    }

    public AiClient(List<LlmPort> llmPorts, ReplyConfig.AiConfig config, ActivityLogService activityLog) {
        for (LlmPort port : llmPorts) {
            providers.put(port.getProvider(), port);
            log.debug("[AiClient] Registered provider: {}", port.getProvider().getId());
        }
        this.activityLog = activityLog;
        this.config = config;
    }

    public AiProvider getCurrentProvider() {
        return config.getProvider();
    }

    /**
     * Generates a reply with the active provider. Empty when AI is disabled or
     * the provider produced nothing.
     */
    public Optional<String> generateReply(List<ChatMessage> messages) {
        ReplyConfig.AiConfig current = config;
        if (!current.isEnabled()) {
            return Optional.empty();
        }
        LlmPort active = providers.get(current.getProvider());
        if (active == null) {
            activityLog.warn(LOG_TAG, "No adapter registered for provider " + current.getProvider().getId());
            return Optional.empty();
        }
        activityLog.log(LOG_TAG, "Using " + current.getProvider().getId() + " provider for reply generation");
        return active.generateReply(messages);
    }

    public ConnectionTestResult testConnection() {
        ReplyConfig.AiConfig current = config;
        LlmPort active = providers.get(current.getProvider());
        if (active == null) {
            return ConnectionTestResult.failed("Unknown AI provider");
        }
        activityLog.log(LOG_TAG, "Testing connection to " + current.getProvider().getId() + " provider");
        return active.testConnection();
    }

    public boolean isConnected() {
        ReplyConfig.AiConfig current = config;
        if (!current.isEnabled()) {
            return false;
        }
        LlmPort active = providers.get(current.getProvider());
        return active != null && active.isConnected();
    }

    /**
     * Replaces the configuration of this client and of every registered
     * provider.
     */
    public void updateConfig(ReplyConfig.AiConfig newConfig) {
        this.config = newConfig;
        for (LlmPort port : providers.values()) {
            port.updateConfig(newConfig);
        }
    }

    public ReplyConfig.AiConfig getConfig() {
        return config;
    }

    public ProviderStatus getProviderStatus() {
        ReplyConfig.AiConfig current = config;
        boolean connected = isConnected();
        String error = connected ? null : validateProviderConfig(current, current.getProvider()).error();
        return new ProviderStatus(current.getProvider(), connected, error);
    }

    /**
     * Error tracker of the active provider, if one is registered.
     */
    public Optional<ErrorTracker> getErrorTracker() {
        LlmPort active = providers.get(config.getProvider());
        return Optional.ofNullable(active).map(LlmPort::getErrorTracker);
    }

    public Optional<LlmPort> getAdapter(AiProvider provider) {
        return Optional.ofNullable(providers.get(provider));
    }

    /**
     * Checks that the settings required by {@code provider} are present.
     */
    public static ProviderValidation validateProviderConfig(ReplyConfig.AiConfig config, AiProvider provider) {
        if (provider == null) {
            return ProviderValidation.invalid("Unknown AI provider");
        }
        switch (provider) {
            case HOSTED:
                if (isBlank(config.getHostedApiKey())) {
                    return ProviderValidation.invalid("Hosted API key is required");
                }
                if (isBlank(config.getHostedModel())) {
                    return ProviderValidation.invalid("Hosted model is required");
                }
                return ProviderValidation.ok();
            case LOCAL:
                if (isBlank(config.getLlmEndpoint())) {
                    return ProviderValidation.invalid("Local LLM endpoint is required");
                }
                if (config.getLlmPort() < 1 || config.getLlmPort() > MAX_PORT) {
                    return ProviderValidation.invalid("Valid local LLM port is required");
                }
                return ProviderValidation.ok();
            default:
                return ProviderValidation.invalid("Unknown AI provider");
        }
    }

    public static List<String> getAvailableHostedModels() {
        return HOSTED_MODELS;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
