package me.golemcore.replybot.ratelimit;

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
import me.golemcore.replybot.domain.model.RateLimitResult;
import me.golemcore.replybot.domain.model.ReplyConfig;
import me.golemcore.replybot.domain.service.ReplyConfigService;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token bucket rate limiter for sent replies with two tiers:
 * {@code maxRepliesPerMinute} and {@code maxRepliesPerHour}.
 *
 * <p>
 * Buckets are read from the live {@link ReplyConfig} on every call and rebuilt
 * when the configured capacity changes. A reply must pass both tiers; a token
 * is only taken from the hour bucket once the minute bucket allowed it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReplyRateLimiter implements RateLimiter {

    private static final String MINUTE_KEY = "replies:minute";
    private static final String HOUR_KEY = "replies:hour";

    private final ReplyConfigService replyConfigService;

    private final Map<String, TokenBucket> buckets = new ConcurrentHashMap<>();

    @Override
    public synchronized RateLimitResult tryConsumeReply() {
        ReplyConfig config = replyConfigService.getConfig();

        TokenBucket minute = minuteBucket(config);
        if (!minute.tryConsume()) {
            log.info("[RateLimiter] Rate limit: {} replies per minute reached", config.getMaxRepliesPerMinute());
            return RateLimitResult.limited(RateLimitResult.Tier.MINUTE, minute.waitTimeMs());
        }

        TokenBucket hour = hourBucket(config);
        if (!hour.tryConsume()) {
            log.info("[RateLimiter] Rate limit: {} replies per hour reached", config.getMaxRepliesPerHour());
            return RateLimitResult.limited(RateLimitResult.Tier.HOUR, hour.waitTimeMs());
        }
        return RateLimitResult.permitted(Math.min(minute.availableTokens(), hour.availableTokens()));
    }

    @Override
    public Status getStatus() {
        ReplyConfig config = replyConfigService.getConfig();
        long perMinute = minuteBucket(config).availableTokens();
        long perHour = hourBucket(config).availableTokens();
        return new Status(perMinute, perHour, perMinute > 0 && perHour > 0);
    }

    @Override
    public void reset() {
        buckets.clear();
        log.info("[RateLimiter] Rate limiter reset");
    }

    private TokenBucket minuteBucket(ReplyConfig config) {
        return resolveBucket(MINUTE_KEY, config.getMaxRepliesPerMinute(), Duration.ofMinutes(1));
    }

    private TokenBucket hourBucket(ReplyConfig config) {
        return resolveBucket(HOUR_KEY, config.getMaxRepliesPerHour(), Duration.ofHours(1));
    }

    private TokenBucket resolveBucket(String key, int capacity, Duration refillPeriod) {
        long effectiveCapacity = Math.max(1, capacity);
        return buckets.compute(key, (bucketKey, existing) -> {
            if (existing == null || existing.getCapacity() != effectiveCapacity
                    || !existing.getRefillPeriod().equals(refillPeriod)) {
                return new TokenBucket(effectiveCapacity, refillPeriod);
            }
            return existing;
        });
    }
}
