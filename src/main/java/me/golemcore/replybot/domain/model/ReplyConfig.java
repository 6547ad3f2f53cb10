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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Reply configuration as delivered by the settings collaborator. Replaced
 * wholesale on every update; components observe the new value on their next
 * operation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReplyConfig {

    public static final String DEFAULT_SYSTEM_PROMPT = "You are a friendly person chatting casually. "
            + "Keep responses brief and natural. Match the tone of the conversation. "
            + "Don't be overly formal or use excessive punctuation.";

    /** Master switch for the whole reply pipeline. */
    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private List<ReplyRule> replyRules = new ArrayList<>();

    @Builder.Default
    private double randomSkipProbability = 0.15;

    @Builder.Default
    private int maxReplyLength = 500;

    @Builder.Default
    private int maxRepliesPerMinute = 5;

    @Builder.Default
    private int maxRepliesPerHour = 30;

    @Builder.Default
    private AiConfig ai = new AiConfig();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder(toBuilder = true)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AiConfig {

        @Builder.Default
        private boolean enabled = true;

        @Builder.Default
        private AiProvider provider = AiProvider.LOCAL;

        // local model server
        @Builder.Default
        private String llmEndpoint = "localhost";
        @Builder.Default
        private int llmPort = 8080;
        @Builder.Default
        private String modelName = "local-model";

        // hosted API
        @Builder.Default
        private String hostedApiKey = "";
        @Builder.Default
        private String hostedModel = "gpt-4o-mini";
        @Builder.Default
        private String hostedBaseUrl = "https://api.openai.com/v1";

        @Builder.Default
        private String systemPrompt = DEFAULT_SYSTEM_PROMPT;
        @Builder.Default
        private double temperature = 0.7;
        @Builder.Default
        private int maxTokens = 150;

        @Builder.Default
        private boolean contextHistoryEnabled = true;
        @Builder.Default
        private int maxContextMessages = 10;

        @Builder.Default
        private long requestTimeoutMs = 30000;

        // backoff and circuit breaker
        @Builder.Default
        private int maxRetries = 3;
        @Builder.Default
        private long retryBackoffMs = 1000;
        @Builder.Default
        private long maxBackoffMs = 60000;
        /**
         * When true, an open circuit closes again once
         * {@link #circuitRecoveryMs} has passed since the last error. Applies to
         * every provider.
         */
        @Builder.Default
        private boolean circuitAutoRecovery = true;
        @Builder.Default
        private long circuitRecoveryMs = 120000;

        /**
         * Consecutive errors after which the circuit opens.
         */
        public int maxConsecutiveErrors() {
            return Math.max(1, maxRetries * 3);
        }
    }
}
