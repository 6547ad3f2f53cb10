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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.replybot.domain.model.ActivityEntry;
import me.golemcore.replybot.infrastructure.config.BotProperties;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Observability side channel of the reply pipeline.
 *
 * <p>
 * Every entry is written to SLF4J, kept in a bounded ring buffer, emitted on a
 * live stream and handed to registered listeners. Credentials are redacted
 * before an entry leaves this service.
 */
@Service
@Slf4j
public class ActivityLogService {

    private static final Pattern BEARER_TOKEN_PATTERN = Pattern.compile("(?i)(Bearer\\s+)[A-Za-z0-9._\\-+/=]+");
    private static final Pattern API_KEY_PATTERN = Pattern.compile("(?i)((?:api[_-]?key|token)\\s*[:=]\\s*)([^\\s,;]+)");
    private static final Pattern OPENAI_KEY_PATTERN = Pattern.compile("sk-[A-Za-z0-9_\\-]{8,}");

    private final Object lock = new Object();
    private final Deque<ActivityEntry> ringBuffer;
    private final AtomicLong sequence = new AtomicLong(0);
    private final Sinks.Many<ActivityEntry> liveStream;
    private final List<Consumer<String>> listeners = new CopyOnWriteArrayList<>();
    private final int maxEntries;
    private final Clock clock;

    public ActivityLogService(BotProperties botProperties, Clock clock) {
        int configured = botProperties.getActivity().getMaxEntries();
        this.maxEntries = configured > 0 ? configured : 1000;
        this.ringBuffer = new ArrayDeque<>(this.maxEntries);
        this.liveStream = Sinks.many().multicast().directBestEffort();
        this.clock = clock;
    }

    public void log(String source, String message) {
        String sanitized = sanitize(message);
        log.info("[{}] {}", source, sanitized);
        append(source, sanitized);
    }

    public void warn(String source, String message) {
        String sanitized = sanitize(message);
        log.warn("[{}] {}", source, sanitized);
        append(source, sanitized);
    }

    /**
     * Registers a plain-text listener that receives {@code "[source] message"}
     * lines.
     */
    public void addListener(Consumer<String> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<String> listener) {
        listeners.remove(listener);
    }

    /**
     * Most recent entries, oldest first.
     */
    public List<ActivityEntry> getRecent(int limit) {
        synchronized (lock) {
            List<ActivityEntry> snapshot = new ArrayList<>(ringBuffer);
            int from = Math.max(0, snapshot.size() - Math.max(0, limit));
            return List.copyOf(snapshot.subList(from, snapshot.size()));
        }
    }

    public Flux<ActivityEntry> stream() {
        return liveStream.asFlux();
    }

    private void append(String source, String message) {
        ActivityEntry entry = ActivityEntry.builder()
                .seq(sequence.incrementAndGet())
                .timestamp(Instant.ofEpochMilli(clock.millis()).toString())
                .source(source)
                .message(message)
                .build();

        synchronized (lock) {
            if (ringBuffer.size() >= maxEntries) {
                ringBuffer.removeFirst();
            }
            ringBuffer.addLast(entry);
        }
        liveStream.tryEmitNext(entry);

        String line = "[" + source + "] " + message;
        for (Consumer<String> listener : listeners) {
            try {
                listener.accept(line);
            } catch (RuntimeException e) {
                log.warn("[ActivityLog] Listener failed: {}", e.getMessage());
            }
        }
    }

    static String sanitize(String input) {
        if (input == null || input.isBlank()) {
            return input;
        }
        String sanitized = BEARER_TOKEN_PATTERN.matcher(input).replaceAll("$1***");
        sanitized = API_KEY_PATTERN.matcher(sanitized).replaceAll("$1***");
        return OPENAI_KEY_PATTERN.matcher(sanitized).replaceAll("sk-***");
    }
}
