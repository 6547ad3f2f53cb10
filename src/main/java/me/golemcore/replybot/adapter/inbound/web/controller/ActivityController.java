package me.golemcore.replybot.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.replybot.domain.model.ActivityEntry;
import me.golemcore.replybot.domain.service.ActivityLogService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Recent and live reply pipeline activity.
 */
@RestController
@RequestMapping("/api/activity")
@RequiredArgsConstructor
public class ActivityController {

    private static final int MAX_LIMIT = 1000;

    private final ActivityLogService activityLog;

    @GetMapping
    public Mono<ResponseEntity<List<ActivityEntry>>> recent(@RequestParam(defaultValue = "100") int limit) {
        int effective = Math.max(1, Math.min(limit, MAX_LIMIT));
        return Mono.just(ResponseEntity.ok(activityLog.getRecent(effective)));
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ActivityEntry>> stream() {
        return activityLog.stream()
                .map(entry -> ServerSentEvent.<ActivityEntry>builder()
                        .id(String.valueOf(entry.getSeq()))
                        .event("activity")
                        .data(entry)
                        .build());
    }
}
