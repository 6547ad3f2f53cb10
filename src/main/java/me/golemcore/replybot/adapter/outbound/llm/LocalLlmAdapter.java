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
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Adapter for a locally hosted OpenAI-compatible model server (llama.cpp
 * server, Ollama, LM Studio).
 *
 * <p>
 * Posts to {@code http://<llmEndpoint>:<llmPort>/v1/chat/completions}. The
 * endpoint may carry its own scheme ({@code https://gpu-box}). Requests enable
 * llama.cpp prompt caching, and a native {@code content} field is accepted
 * when the server does not wrap the reply in {@code choices}.
 *
 * <p>
 * Provider ID: {@code "local"}
 */
@Component
public class LocalLlmAdapter extends AbstractChatCompletionAdapter {

    private static final String COMPLETIONS_PATH = "/v1/chat/completions";
    private static final long PROBE_TIMEOUT_MS = 5000;

    @Autowired
    public LocalLlmAdapter(OkHttpClient okHttpClient, ObjectMapper objectMapper, ActivityLogService activityLog,
            ReplyConfigService replyConfigService, Clock clock) {
        this(okHttpClient, objectMapper, activityLog, replyConfigService.getConfig().getAi(), clock);
    }

    public LocalLlmAdapter(OkHttpClient okHttpClient, ObjectMapper objectMapper, ActivityLogService activityLog,
            ReplyConfig.AiConfig config, Clock clock) {
        super(okHttpClient, objectMapper, activityLog, config, clock);
    }

    @Override
    public AiProvider getProvider() {
        return AiProvider.LOCAL;
    }

    @Override
    protected String logTag() {
        return "LocalLlm";
    }

    @Override
    public String getEndpointUrl(ReplyConfig.AiConfig config) {
        String endpoint = config.getLlmEndpoint() != null ? config.getLlmEndpoint().trim() : "";
        while (endpoint.endsWith("/")) {
            endpoint = endpoint.substring(0, endpoint.length() - 1);
        }
        String base = endpoint.startsWith("http://") || endpoint.startsWith("https://")
                ? endpoint
                : "http://" + endpoint;
        return base + ":" + config.getLlmPort() + COMPLETIONS_PATH;
    }

    @Override
    protected String modelName(ReplyConfig.AiConfig config) {
        return config.getModelName();
    }

    @Override
    protected long probeTimeoutMs() {
        return PROBE_TIMEOUT_MS;
    }

    @Override
    protected void customizeBody(ChatCompletionRequest body, ReplyConfig.AiConfig config) {
        body.setCachePrompt(true);
    }

    @Override
    protected Optional<String> extractContent(ChatCompletionResponse response) {
        Optional<String> content = super.extractContent(response);
        if (content.isPresent() || response == null) {
            return content;
        }
        return Optional.ofNullable(response.getContent());
    }
}
