package me.golemcore.replybot.adapter.outbound.llm;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.replybot.domain.model.AiProvider;
import me.golemcore.replybot.domain.model.ReplyConfig;
import me.golemcore.replybot.domain.service.ActivityLogService;
import me.golemcore.replybot.domain.service.ReplyConfigService;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Adapter for a hosted chat completions API (OpenAI or a compatible proxy).
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code hostedBaseUrl} - API base, defaults to
 * {@code https://api.openai.com/v1}
 * <li>{@code hostedApiKey} - sent as a bearer token
 * <li>{@code hostedModel} - model identifier
 * </ul>
 *
 * <p>
 * Provider ID: {@code "hosted"}
 */
@Component
public class HostedLlmAdapter extends AbstractChatCompletionAdapter {

    static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    private static final String COMPLETIONS_PATH = "/chat/completions";
    private static final long PROBE_TIMEOUT_MS = 10000;

    @Autowired
    public HostedLlmAdapter(OkHttpClient okHttpClient, ObjectMapper objectMapper, ActivityLogService activityLog,
            ReplyConfigService replyConfigService, Clock clock) {
        this(okHttpClient, objectMapper, activityLog, replyConfigService.getConfig().getAi(), clock);
    }

    public HostedLlmAdapter(OkHttpClient okHttpClient, ObjectMapper objectMapper, ActivityLogService activityLog,
            ReplyConfig.AiConfig config, Clock clock) {
        super(okHttpClient, objectMapper, activityLog, config, clock);
    }

    @Override
    public AiProvider getProvider() {
        return AiProvider.HOSTED;
    }

    @Override
    protected String logTag() {
        return "HostedLlm";
    }

    @Override
    public String getEndpointUrl(ReplyConfig.AiConfig config) {
        String baseUrl = config.getHostedBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = DEFAULT_BASE_URL;
        }
        baseUrl = baseUrl.trim();
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return baseUrl + COMPLETIONS_PATH;
    }

    @Override
    protected String modelName(ReplyConfig.AiConfig config) {
        return config.getHostedModel();
    }

    @Override
    protected long probeTimeoutMs() {
        return PROBE_TIMEOUT_MS;
    }

    @Override
    protected void customizeRequest(Request.Builder builder, ReplyConfig.AiConfig config) {
        builder.header("Authorization", "Bearer " + config.getHostedApiKey().trim());
    }

    @Override
    protected String describeProbeFailure(int statusCode) {
        if (statusCode == 401) {
            return "Invalid API key";
        }
        return super.describeProbeFailure(statusCode);
    }
}
