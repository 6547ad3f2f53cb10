package me.golemcore.replybot.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.replybot.adapter.inbound.web.dto.ReplyResponse;
import me.golemcore.replybot.domain.model.IncomingMessage;
import me.golemcore.replybot.domain.service.AutoReplyService;
import me.golemcore.replybot.domain.service.ReplyDecisionEngine;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Inbound messages and conversation management.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ReplyController {

    private final AutoReplyService autoReplyService;
    private final ReplyDecisionEngine decisionEngine;

    /**
     * Decide a reply for one message. {@code 204} means no reply should be sent.
     */
    @PostMapping("/replies")
    public Mono<ResponseEntity<ReplyResponse>> reply(@RequestBody IncomingMessage message) {
        if (message.getSender() == null || message.getSender().isBlank()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "'sender' is required"));
        }
        if (message.getMessageText() == null) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "'messageText' is required"));
        }
        return Mono.fromCallable(() -> autoReplyService.handle(message)
                .map(reply -> ResponseEntity.ok(new ReplyResponse(reply)))
                .orElseGet(() -> ResponseEntity.noContent().build()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/conversations/{id}")
    public Mono<ResponseEntity<Void>> resetConversation(@PathVariable String id) {
        decisionEngine.resetConversation(id);
        return Mono.just(ResponseEntity.noContent().build());
    }
}
