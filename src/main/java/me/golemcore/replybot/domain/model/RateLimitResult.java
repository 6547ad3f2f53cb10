package me.golemcore.replybot.domain.model;

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

import java.time.Duration;

/**
 * Outcome of asking the reply rate limiter for permission to send.
 *
 * @param allowed
 *            whether the reply may be sent
 * @param remainingReplies
 *            replies left in the tightest tier after this one
 * @param retryAfter
 *            time until the limiting tier frees a slot; {@code null} when
 *            allowed
 * @param limitedBy
 *            the tier that refused the reply; {@code null} when allowed
 */
public record RateLimitResult(boolean allowed, long remainingReplies, Duration retryAfter, Tier limitedBy) {

    public enum Tier {
        MINUTE("per-minute"), HOUR("per-hour");

        private final String label;

        Tier(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public static RateLimitResult permitted(long remainingReplies) {
        return new RateLimitResult(true, remainingReplies, null, null);
    }

    public static RateLimitResult limited(Tier tier, long waitMs) {
        return new RateLimitResult(false, 0, Duration.ofMillis(Math.max(0, waitMs)), tier);
    }

    /**
     * Human-readable reason for a refusal, e.g.
     * {@code "per-hour reply limit reached, retry in 42s"}.
     */
    public String describe() {
        if (allowed) {
            return "allowed";
        }
        long seconds = Math.max(1, (retryAfter.toMillis() + 999) / 1000);
        return limitedBy.label() + " reply limit reached, retry in " + seconds + "s";
    }
}
