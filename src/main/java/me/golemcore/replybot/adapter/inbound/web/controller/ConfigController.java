package me.golemcore.replybot.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.replybot.domain.model.ReplyConfig;
import me.golemcore.replybot.domain.service.ReplyConfigService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Live reply configuration. The hosted API key is never returned; sending the
 * mask back keeps the stored key.
 */
@RestController
@RequestMapping("/api/config")
@RequiredArgsConstructor
public class ConfigController {

    static final String MASKED_SECRET = "********";
    private static final String API_KEY_FIELD = "hostedApiKey";

    private final ReplyConfigService replyConfigService;

    @GetMapping
    public Mono<ResponseEntity<ReplyConfig>> getConfig() {
        return Mono.just(ResponseEntity.ok(masked(replyConfigService.getConfig())));
    }

    @PutMapping
    public Mono<ResponseEntity<ReplyConfig>> replaceConfig(@RequestBody ReplyConfig newConfig) {
        if (newConfig == null) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "Configuration body is required"));
        }
        if (newConfig.getAi() != null && MASKED_SECRET.equals(newConfig.getAi().getHostedApiKey())) {
            newConfig.getAi().setHostedApiKey(replyConfigService.getConfig().getAi().getHostedApiKey());
        }
        return Mono.just(ResponseEntity.ok(masked(replyConfigService.updateConfig(newConfig))));
    }

    /**
     * Change selected AI settings; fields not present in the body are kept.
     */
    @PatchMapping("/ai")
    public Mono<ResponseEntity<ReplyConfig>> patchAiConfig(@RequestBody Map<String, Object> patch) {
        if (MASKED_SECRET.equals(patch.get(API_KEY_FIELD))) {
            patch.remove(API_KEY_FIELD);
        }
        return Mono.just(ResponseEntity.ok(masked(replyConfigService.mergeAiConfig(patch))));
    }

    private static ReplyConfig masked(ReplyConfig config) {
        ReplyConfig.AiConfig ai = config.getAi().toBuilder().build();
        if (ai.getHostedApiKey() != null && !ai.getHostedApiKey().isEmpty()) {
            ai.setHostedApiKey(MASKED_SECRET);
        }
        return config.toBuilder().ai(ai).build();
    }
}
