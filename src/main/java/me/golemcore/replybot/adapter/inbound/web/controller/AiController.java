package me.golemcore.replybot.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.replybot.adapter.inbound.web.dto.AiStatusResponse;
import me.golemcore.replybot.domain.model.ConnectionTestResult;
import me.golemcore.replybot.domain.model.ProviderStatus;
import me.golemcore.replybot.domain.service.AiClient;
import me.golemcore.replybot.domain.service.AutoReplyService;
import me.golemcore.replybot.domain.service.ReplyDecisionEngine;
import me.golemcore.replybot.ratelimit.ErrorTracker;
import me.golemcore.replybot.ratelimit.RateLimiter;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Optional;

/**
 * Provider status and connectivity checks.
 */
@RestController
@RequestMapping("/api/ai")
@RequiredArgsConstructor
public class AiController {

    private final ReplyDecisionEngine decisionEngine;
    private final AiClient aiClient;
    private final AutoReplyService autoReplyService;

    @GetMapping("/status")
    public Mono<ResponseEntity<AiStatusResponse>> status() {
        ProviderStatus status = decisionEngine.getProviderStatus();
        Optional<ErrorTracker> tracker = aiClient.getErrorTracker();
        RateLimiter.Status rateLimit = autoReplyService.getRateLimitStatus();

        AiStatusResponse response = AiStatusResponse.builder()
                .provider(status.provider().getId())
                .displayName(status.provider().getDisplayName())
                .aiEnabled(aiClient.getConfig().isEnabled())
                .connected(status.connected())
                .error(status.error())
                .errorCount(tracker.map(ErrorTracker::getErrorCount).orElse(0))
                .timeUntilRecoveryMs(tracker.map(ErrorTracker::getTimeUntilRecovery).orElse(0L))
                .remainingRepliesPerMinute(rateLimit.remainingPerMinute())
                .remainingRepliesPerHour(rateLimit.remainingPerHour())
                .availableHostedModels(AiClient.getAvailableHostedModels())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    /**
     * Probe the active provider. Does not affect its circuit.
     */
    @PostMapping("/test-connection")
    public Mono<ResponseEntity<ConnectionTestResult>> testConnection() {
        return Mono.fromCallable(decisionEngine::testConnection)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
