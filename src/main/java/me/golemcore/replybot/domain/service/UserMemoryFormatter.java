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
import me.golemcore.replybot.domain.model.UserMemory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link UserMemory} as a block appended to the system prompt.
 */
@Component
@RequiredArgsConstructor
public class UserMemoryFormatter {

    static final int RECENT_SNIPPETS = 5;
    static final int MAX_SNIPPET_LENGTH = 80;

    private final Clock clock;

    /**
     * Returns the formatted block, or an empty string when the memory holds no
     * messages.
     */
    public String format(String username, UserMemory memory) {
        if (memory == null || !memory.hasMessages()) {
            return "";
        }

        List<String> lines = new ArrayList<>();
        lines.add("\n--- Context about " + username + " ---");
        lines.add("First contact: " + toDate(memory.getFirstSeen()));
        lines.add("Last contact: " + toDate(memory.getLastSeen()));

        List<UserMemory.Snippet> snippets = memory.getMessages();
        long fromThem = snippets.stream().filter(s -> s.getFrom() == UserMemory.Direction.THEM).count();
        long fromMe = snippets.stream().filter(s -> s.getFrom() == UserMemory.Direction.ME).count();
        lines.add("Messages exchanged: " + fromThem + " from them, " + fromMe + " from you");

        lines.add("\nRecent conversation:");
        int from = Math.max(0, snippets.size() - RECENT_SNIPPETS);
        for (UserMemory.Snippet snippet : snippets.subList(from, snippets.size())) {
            String prefix = snippet.getFrom() == UserMemory.Direction.THEM ? username + ":" : "You:";
            lines.add("  " + prefix + " " + clip(snippet.getText()));
        }

        lines.add("--- End context ---\n");
        return String.join("\n", lines);
    }

    private LocalDate toDate(long epochMillis) {
        return LocalDate.ofInstant(Instant.ofEpochMilli(epochMillis), clock.getZone());
    }

    private static String clip(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > MAX_SNIPPET_LENGTH ? text.substring(0, MAX_SNIPPET_LENGTH) + "..." : text;
    }
}
