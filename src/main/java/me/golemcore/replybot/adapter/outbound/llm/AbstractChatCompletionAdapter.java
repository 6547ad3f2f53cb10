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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import me.golemcore.replybot.domain.model.ChatMessage;
import me.golemcore.replybot.domain.model.ConnectionTestResult;
import me.golemcore.replybot.domain.model.ProviderFailure;
import me.golemcore.replybot.domain.model.ProviderValidation;
import me.golemcore.replybot.domain.model.ReplyConfig;
import me.golemcore.replybot.domain.service.ActivityLogService;
import me.golemcore.replybot.domain.service.AiClient;
import me.golemcore.replybot.port.outbound.LlmPort;
import me.golemcore.replybot.ratelimit.ErrorTracker;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Shared request/response handling for OpenAI-compatible chat completion
 * providers.
 *
 * <p>
 * Each {@link #generateReply(List)} call performs at most one HTTP attempt:
 * <ol>
 * <li>skip when the provider is not configured (no tracker effect)</li>
 * <li>skip when the circuit is open</li>
 * <li>sleep for the current backoff delay</li>
 * <li>POST the request under a call timeout of {@code requestTimeoutMs}; OkHttp
 * cancels the call when the timeout fires</li>
 * <li>record success or error on this adapter's own {@link ErrorTracker}</li>
 * </ol>
 *
 * <p>
 * {@link #testConnection()} uses a separate short call timeout and never
 * touches the tracker.
 */
public abstract class AbstractChatCompletionAdapter implements LlmPort {

    protected static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String PROBE_MESSAGE = "Hi";
    private static final int PREVIEW_LENGTH = 50;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ActivityLogService activityLog;
    private final ErrorTracker errorTracker;

    private volatile ReplyConfig.AiConfig config;

    protected AbstractChatCompletionAdapter(OkHttpClient httpClient, ObjectMapper objectMapper,
            ActivityLogService activityLog, ReplyConfig.AiConfig config, Clock clock) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.activityLog = activityLog;
        this.config = config;
        this.errorTracker = new ErrorTracker(logTag(), ErrorTracker.Settings.from(config), clock);
    }

    /**
     * Tag used in log lines.
     */
    protected abstract String logTag();

    /**
     * Full URL of the chat completions endpoint.
     */
    public abstract String getEndpointUrl(ReplyConfig.AiConfig config);

    /**
     * Model identifier sent in the request and reported by probes.
     */
    protected abstract String modelName(ReplyConfig.AiConfig config);

    /**
     * Call timeout for {@link #testConnection()}.
     */
    protected abstract long probeTimeoutMs();

    /**
     * Adds provider-specific headers such as credentials.
     */
    protected void customizeRequest(Request.Builder builder, ReplyConfig.AiConfig config) {
    }

    /**
     * Adds provider-specific body fields.
     */
    protected void customizeBody(ChatCompletionRequest body, ReplyConfig.AiConfig config) {
    }

    /**
     * Error text reported by {@link #testConnection()} for a non-2xx status.
     */
    protected String describeProbeFailure(int statusCode) {
        return "HTTP " + statusCode;
    }

    /**
     * Extracts the reply text from a parsed response body.
     */
    protected Optional<String> extractContent(ChatCompletionResponse response) {
        if (response == null || response.getChoices() == null || response.getChoices().isEmpty()) {
            return Optional.empty();
        }
        ChatChoice choice = response.getChoices().get(0);
        if (choice == null || choice.getMessage() == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(choice.getMessage().getContent());
    }

    @Override
    public Optional<String> generateReply(List<ChatMessage> messages) {
        ReplyConfig.AiConfig current = config;

        ProviderValidation validation = AiClient.validateProviderConfig(current, getProvider());
        if (!validation.valid()) {
            activityLog.warn(logTag(), validation.error() + ", skipping request");
            return Optional.empty();
        }

        if (!errorTracker.shouldRetry()) {
            long recovery = errorTracker.getTimeUntilRecovery();
            String when = recovery >= 0
                    ? "Will auto-recover in " + Math.max(1, (recovery + 999) / 1000) + "s"
                    : "Reset required";
            activityLog.warn(logTag(), "Too many consecutive errors, skipping request. " + when);
            return Optional.empty();
        }

        long backoffDelay = errorTracker.getBackoffDelay();
        if (backoffDelay > 0) {
            activityLog.log(logTag(), "Waiting " + backoffDelay + "ms before retry (backoff)");
            try {
                sleepBeforeAttempt(backoffDelay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                activityLog.warn(logTag(), "Interrupted during backoff, skipping request");
                return Optional.empty();
            }
        }

        String url = getEndpointUrl(current);
        Request request;
        try {
            request = buildHttpRequest(url, messages, current);
        } catch (IllegalArgumentException e) {
            return fail(ProviderFailure.NOT_CONFIGURED, "Invalid endpoint URL: " + url);
        }
        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(current.getRequestTimeoutMs(), TimeUnit.MILLISECONDS)
                .build();

        activityLog.log(logTag(), "Sending request to " + url);
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String raw = body != null ? body.string() : "";

            if (!response.isSuccessful()) {
                return fail(ProviderFailure.HTTP_ERROR, "HTTP error: " + response.code());
            }

            ChatCompletionResponse parsed = objectMapper.readValue(raw, ChatCompletionResponse.class);
            Optional<String> content = extractContent(parsed)
                    .map(String::trim)
                    .filter(text -> !text.isEmpty());
            if (content.isEmpty()) {
                return fail(ProviderFailure.MALFORMED_RESPONSE, "No content in response");
            }

            String reply = content.get();
            activityLog.log(logTag(), "Got reply: " + preview(reply));
            errorTracker.recordSuccess();
            return content;
        } catch (InterruptedIOException e) {
            if (Thread.currentThread().isInterrupted()) {
                return interrupted("Request");
            }
            return fail(ProviderFailure.TIMEOUT, "Request timed out after " + current.getRequestTimeoutMs() + "ms");
        } catch (JsonProcessingException e) {
            return fail(ProviderFailure.MALFORMED_RESPONSE, "JSON parse error: " + e.getOriginalMessage());
        } catch (IOException e) {
            return fail(ProviderFailure.NETWORK_ERROR, "Request error: " + e.getMessage());
        } catch (Exception e) {
            // OkHttp rethrows InterruptedException undeclared when the caller is interrupted
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                return interrupted("Request");
            }
            throw e;
        }
    }

    @Override
    public ConnectionTestResult testConnection() {
        ReplyConfig.AiConfig current = config;
        ProviderValidation validation = AiClient.validateProviderConfig(current, getProvider());
        if (!validation.valid()) {
            return ConnectionTestResult.failed(validation.error());
        }

        String url = getEndpointUrl(current);
        activityLog.log(logTag(), "Testing connection to " + url);

        Request request;
        try {
            request = buildHttpRequest(url, List.of(ChatMessage.user(PROBE_MESSAGE)), current);
        } catch (IllegalArgumentException e) {
            return ConnectionTestResult.failed("Invalid endpoint URL: " + url);
        }
        OkHttpClient probeClient = httpClient.newBuilder()
                .callTimeout(probeTimeoutMs(), TimeUnit.MILLISECONDS)
                .build();

        try (Response response = probeClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                return ConnectionTestResult.failed(describeProbeFailure(response.code()));
            }
            ResponseBody body = response.body();
            String raw = body != null ? body.string() : "";
            ChatCompletionResponse parsed = objectMapper.readValue(raw, ChatCompletionResponse.class);
            if (extractContent(parsed).isEmpty()) {
                return ConnectionTestResult.failed("Invalid response format");
            }
            return ConnectionTestResult.ok(modelName(current));
        } catch (InterruptedIOException e) {
            if (Thread.currentThread().isInterrupted()) {
                interrupted("Connection test");
                return ConnectionTestResult.failed("Interrupted");
            }
            return ConnectionTestResult.failed("Connection timed out");
        } catch (JsonProcessingException e) {
            return ConnectionTestResult.failed("Invalid JSON response");
        } catch (IOException e) {
            return ConnectionTestResult.failed(e.getMessage() != null ? e.getMessage() : "Connection failed");
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                interrupted("Connection test");
                return ConnectionTestResult.failed("Interrupted");
            }
            throw e;
        }
    }

    @Override
    public boolean isConnected() {
        ReplyConfig.AiConfig current = config;
        return current.isEnabled() && AiClient.validateProviderConfig(current, getProvider()).valid();
    }

    @Override
    public void updateConfig(ReplyConfig.AiConfig newConfig) {
        this.config = newConfig;
        errorTracker.updateSettings(ErrorTracker.Settings.from(newConfig));
    }

    public ReplyConfig.AiConfig getConfig() {
        return config;
    }

    @Override
    public ErrorTracker getErrorTracker() {
        return errorTracker;
    }

    /**
     * Builds the JSON body {@code {model, messages, temperature, max_tokens,
     * ...}}.
     */
    public ChatCompletionRequest buildRequestBody(List<ChatMessage> messages, ReplyConfig.AiConfig config) {
        ChatCompletionRequest body = new ChatCompletionRequest();
        body.setModel(modelName(config));
        body.setMessages(List.copyOf(messages));
        body.setTemperature(config.getTemperature());
        body.setMaxTokens(config.getMaxTokens());
        body.setStream(false);
        customizeBody(body, config);
        return body;
    }

    protected void sleepBeforeAttempt(long delayMs) throws InterruptedException {
        Thread.sleep(delayMs);
    }

    private Request buildHttpRequest(String url, List<ChatMessage> messages, ReplyConfig.AiConfig current) {
        String json;
        try {
            json = objectMapper.writeValueAsString(buildRequestBody(messages, current));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize chat completion request", e);
        }
        Request.Builder builder = new Request.Builder()
                .url(url)
                .header("Content-Type", "application/json")
                .post(RequestBody.create(json, JSON));
        customizeRequest(builder, current);
        return builder.build();
    }

    private Optional<String> fail(ProviderFailure failure, String message) {
        activityLog.warn(logTag(), message);
        if (failure.countsAsError()) {
            errorTracker.recordError();
        }
        return Optional.empty();
    }

    private Optional<String> interrupted(String what) {
        activityLog.warn(logTag(), what + " interrupted");
        return Optional.empty();
    }

    private static String preview(String text) {
        return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
    }

    // API DTOs

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatCompletionRequest {
        private String model;
        private List<ChatMessage> messages;
        private Double temperature;
        @JsonProperty("max_tokens")
        private Integer maxTokens;
        private Boolean stream;
        @JsonProperty("cache_prompt")
        private Boolean cachePrompt;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatCompletionResponse {
        private String id;
        private String model;
        private List<ChatChoice> choices;
        /** llama.cpp native completion field. */
        private String content;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatChoice {
        private int index;
        private ApiMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiMessage {
        private String role;
        private String content;
    }
}
