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

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Thread-safe token bucket.
 *
 * <p>
 * Starts full with {@code capacity} tokens and refills continuously so that a
 * full bucket's worth of tokens arrives every {@code refillPeriod}. Refill is
 * computed lazily on each call from the elapsed time of the supplied nano
 * clock.
 */
public class TokenBucket {

    private final long capacity;
    private final Duration refillPeriod;
    private final LongSupplier nanoClock;

    private long tokens;
    private long lastRefillNanos;

    public TokenBucket(long capacity, Duration refillPeriod) {
        this(capacity, refillPeriod, System::nanoTime);
    }

    public TokenBucket(long capacity, Duration refillPeriod, LongSupplier nanoClock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Bucket capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.refillPeriod = refillPeriod;
        this.nanoClock = nanoClock;
        this.tokens = capacity;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    /**
     * Try to take one token.
     */
    public synchronized boolean tryConsume() {
        refill();
        if (tokens > 0) {
            tokens--;
            return true;
        }
        return false;
    }

    /**
     * Milliseconds until the next token arrives; {@code 0} when one is
     * available.
     */
    public synchronized long waitTimeMs() {
        refill();
        if (tokens > 0) {
            return 0;
        }
        long nanosPerToken = refillPeriod.toNanos() / capacity;
        long elapsed = nanoClock.getAsLong() - lastRefillNanos;
        return Math.max(0, nanosPerToken - elapsed) / 1_000_000;
    }

    /**
     * Tokens currently available, after refill.
     */
    public synchronized long availableTokens() {
        refill();
        return tokens;
    }

    public long getCapacity() {
        return capacity;
    }

    public Duration getRefillPeriod() {
        return refillPeriod;
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsedNanos = now - lastRefillNanos;
        if (elapsedNanos <= 0) {
            return;
        }

        long tokensToAdd = (long) ((double) elapsedNanos * capacity / refillPeriod.toNanos());
        if (tokensToAdd > 0) {
            tokens = Math.min(capacity, tokens + tokensToAdd);
            lastRefillNanos = now;
        }
    }
}
