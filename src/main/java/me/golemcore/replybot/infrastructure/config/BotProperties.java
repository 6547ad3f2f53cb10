package me.golemcore.replybot.infrastructure.config;

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

import lombok.Data;
import me.golemcore.replybot.domain.model.AiProvider;
import me.golemcore.replybot.domain.model.ReplyRule;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Static bootstrap configuration bound from {@code application.yml}.
 *
 * <p>
 * Everything under {@code bot.*}:
 * <ul>
 * <li>{@link HttpProperties} - shared OkHttp client timeouts and pool</li>
 * <li>{@link AiProperties} - initial provider settings</li>
 * <li>{@link ReplyProperties} - initial reply rules and limits</li>
 * <li>{@link MemoryProperties} - user memory file</li>
 * <li>{@link ActivityProperties} - activity log buffer</li>
 * </ul>
 * The reply and AI sections only seed the live configuration held by
 * {@code ReplyConfigService}; later changes go through that service.
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private HttpProperties http = new HttpProperties();
    private AiProperties ai = new AiProperties();
    private ReplyProperties reply = new ReplyProperties();
    private MemoryProperties memory = new MemoryProperties();
    private ActivityProperties activity = new ActivityProperties();

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class AiProperties {
        private boolean enabled = true;
        private AiProvider provider = AiProvider.LOCAL;
        private String llmEndpoint = "localhost";
        private int llmPort = 8080;
        private String modelName = "local-model";
        private String hostedApiKey = "";
        private String hostedModel = "gpt-4o-mini";
        private String hostedBaseUrl = "https://api.openai.com/v1";
        private String systemPrompt;
        private long requestTimeoutMs = 30000;
    }

    @Data
    public static class ReplyProperties {
        private boolean enabled = true;
        private double randomSkipProbability = 0.15;
        private int maxReplyLength = 500;
        private int maxRepliesPerMinute = 5;
        private int maxRepliesPerHour = 30;
        private List<ReplyRule> rules = new ArrayList<>();
    }

    @Data
    public static class MemoryProperties {
        private String file = "${user.home}/.golemcore/replybot/user-memory.json";
    }

    @Data
    public static class ActivityProperties {
        private int maxEntries = 1000;
    }
}
