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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.replybot.domain.model.ReplyConfig;

import java.time.Clock;

/**
 * Consecutive-failure tracker for one provider instance, combining capped
 * exponential backoff with a circuit breaker.
 *
 * <p>
 * After {@code n} consecutive errors the backoff delay is
 * {@code min(baseDelayMs * 2^(n-1), maxDelayMs)}. Once {@code n} reaches
 * {@code maxErrors} the circuit opens and {@link #shouldRetry()} answers
 * {@code false}. With {@link Settings#autoRecovery()} enabled the circuit
 * closes by itself after {@code recoveryTimeMs} without new errors; otherwise
 * it stays open until {@link #recordSuccess()} or {@link #reset()}.
 *
 * <p>
 * All methods are synchronized on the tracker. Each provider owns its own
 * instance, so an open circuit on one provider never blocks another.
 */
@Slf4j
public class ErrorTracker {

    private final String name;
    private final Clock clock;
    private volatile Settings settings;

    private int consecutiveErrors;
    private long lastErrorTime;

    public ErrorTracker(String name, Settings settings, Clock clock) {
        this.name = name;
        this.settings = settings;
        this.clock = clock;
    }

    public synchronized void recordError() {
        consecutiveErrors++;
        lastErrorTime = clock.millis();
        log.info("[{}] Error recorded. Consecutive errors: {}", name, consecutiveErrors);
    }

    public synchronized void recordSuccess() {
        if (consecutiveErrors > 0) {
            log.info("[{}] Success recorded. Resetting error count from {}", name, consecutiveErrors);
        }
        consecutiveErrors = 0;
    }

    /**
     * Delay to wait before the next attempt; {@code 0} when there are no errors.
     */
    public synchronized long getBackoffDelay() {
        if (consecutiveErrors == 0) {
            return 0;
        }
        Settings current = settings;
        int shift = Math.min(consecutiveErrors - 1, 62);
        long base = current.baseDelayMs();
        long delay = base > (Long.MAX_VALUE >> shift) ? Long.MAX_VALUE : base << shift;
        return Math.min(delay, current.maxDelayMs());
    }

    /**
     * Whether a new attempt is allowed. With auto-recovery enabled an open
     * circuit whose last error is at least {@code recoveryTimeMs} old is reset
     * here.
     */
    public synchronized boolean shouldRetry() {
        Settings current = settings;
        if (consecutiveErrors > 0 && consecutiveErrors >= current.maxErrors() && current.autoRecovery()) {
            long sinceLastError = clock.millis() - lastErrorTime;
            if (sinceLastError >= current.recoveryTimeMs()) {
                log.info("[{}] Auto-recovery: {}ms since last error, resetting error count", name, sinceLastError);
                consecutiveErrors = 0;
                return true;
            }
        }
        return consecutiveErrors < current.maxErrors();
    }

    /**
     * Milliseconds until an open circuit closes by itself. {@code 0} when the
     * circuit is closed, {@code -1} when it is open and will not recover on its
     * own.
     */
    public synchronized long getTimeUntilRecovery() {
        Settings current = settings;
        if (consecutiveErrors < current.maxErrors()) {
            return 0;
        }
        if (!current.autoRecovery()) {
            return -1;
        }
        long sinceLastError = clock.millis() - lastErrorTime;
        return Math.max(0, current.recoveryTimeMs() - sinceLastError);
    }

    public synchronized int getErrorCount() {
        return consecutiveErrors;
    }

    public synchronized long getLastErrorTime() {
        return lastErrorTime;
    }

    public synchronized void reset() {
        consecutiveErrors = 0;
        lastErrorTime = 0;
    }

    /**
     * Applies new tuning without touching the current error state.
     */
    public void updateSettings(Settings newSettings) {
        this.settings = newSettings;
    }

    public Settings getSettings() {
        return settings;
    }

    /**
     * Backoff and circuit breaker tuning.
     *
     * @param baseDelayMs
     *            delay after the first error
     * @param maxDelayMs
     *            cap for the exponential delay
     * @param maxErrors
     *            consecutive errors that open the circuit
     * @param autoRecovery
     *            whether an open circuit closes after {@code recoveryTimeMs}
     * @param recoveryTimeMs
     *            quiet period required for auto-recovery
     */
    public record Settings(long baseDelayMs, long maxDelayMs, int maxErrors, boolean autoRecovery,
            long recoveryTimeMs) {

        public static Settings from(ReplyConfig.AiConfig config) {
            return new Settings(
                    Math.max(0, config.getRetryBackoffMs()),
                    Math.max(0, config.getMaxBackoffMs()),
                    config.maxConsecutiveErrors(),
                    config.isCircuitAutoRecovery(),
                    Math.max(0, config.getCircuitRecoveryMs()));
        }
    }
}
