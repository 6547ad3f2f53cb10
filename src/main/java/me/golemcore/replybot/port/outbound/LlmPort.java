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

import me.golemcore.replybot.domain.model.AiProvider;
import me.golemcore.replybot.domain.model.ChatMessage;
import me.golemcore.replybot.domain.model.ConnectionTestResult;
import me.golemcore.replybot.domain.model.ReplyConfig;
import me.golemcore.replybot.ratelimit.ErrorTracker;

import java.util.List;
import java.util.Optional;

/**
 * Port for a language-model provider that turns a context into a reply.
 *
 * <p>
 * Provider-level failures (missing configuration, open circuit, timeout, HTTP
 * error, malformed payload, network error) never throw: they resolve to an
 * empty reply.
 */
public interface LlmPort {

    /**
     * Returns the provider this port talks to.
     */
    AiProvider getProvider();

    /**
     * Generates a reply for the given context. Performs at most one network
     * attempt, possibly after a backoff delay.
     *
     * @return the trimmed reply text, or empty when no reply was produced
     */
    Optional<String> generateReply(List<ChatMessage> messages);

    /**
     * Probes the provider with a short timeout. Independent of the production
     * path: never consults or changes backoff state.
     */
    ConnectionTestResult testConnection();

    /**
     * Checks if the provider is enabled and configured. No network probe.
     */
    boolean isConnected();

    /**
     * Replaces the configuration used by subsequent calls.
     */
    void updateConfig(ReplyConfig.AiConfig config);

    /**
     * Returns the backoff and circuit breaker state owned by this provider.
     */
    ErrorTracker getErrorTracker();
}
