package me.golemcore.replybot;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Reply bot service.
 *
 * <p>
 * Decides whether to answer incoming chat messages, either from a local or
 * hosted chat-completion model with per-conversation context, or from static
 * reply rules.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal layout (ports and adapters):
 *
 * <pre>
 * Inbound         → REST controllers, AutoReplyService
 * Domain          → ReplyDecisionEngine, AiClient, ContextBuilder
 * Outbound        → LocalLlmAdapter, HostedLlmAdapter, JsonFileUserMemoryAdapter
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * Bootstrap settings under {@code bot.*} in {@code application.yml}; the live
 * reply configuration is managed through {@code /api/config}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ReplyBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReplyBotApplication.class, args);
    }

}
