package me.golemcore.replybot.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.replybot.domain.model.IncomingMessage;
import me.golemcore.replybot.domain.model.RateLimitResult;
import me.golemcore.replybot.ratelimit.RateLimiter;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for inbound messages: asks the {@link ReplyDecisionEngine} for a
 * reply and lets it through only while the reply rate limits allow.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AutoReplyService {

    private static final String LOG_TAG = "AutoReply";

    private final ReplyDecisionEngine decisionEngine;
    private final RateLimiter rateLimiter;
    private final ActivityLogService activityLog;

    public Optional<String> handle(IncomingMessage message) {
        Optional<String> reply = decisionEngine.decideReply(message);
        if (reply.isEmpty()) {
            return reply;
        }
        RateLimitResult limit = rateLimiter.tryConsumeReply();
        if (!limit.allowed()) {
            activityLog.warn(LOG_TAG, "Reply to " + message.getSender() + " dropped: " + limit.describe());
            return Optional.empty();
        }
        return reply;
    }

    public RateLimiter.Status getRateLimitStatus() {
        return rateLimiter.getStatus();
    }
}
