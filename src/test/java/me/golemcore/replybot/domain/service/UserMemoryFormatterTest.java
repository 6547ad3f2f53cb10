package me.golemcore.replybot.domain.service;

import me.golemcore.replybot.domain.model.UserMemory;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UserMemoryFormatterTest {

    private final UserMemoryFormatter formatter = new UserMemoryFormatter(
            Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC));

    private static UserMemory.Snippet snippet(String text, UserMemory.Direction from) {
        return UserMemory.Snippet.builder().text(text).from(from).build();
    }

    @Test
    void shouldReturnEmptyStringWithoutMessages() {
        assertEquals("", formatter.format("bob", UserMemory.builder().username("bob").build()));
        assertEquals("", formatter.format("bob", null));
    }

    @Test
    void shouldRenderHeaderCountsAndRecentMessages() {
        List<UserMemory.Snippet> snippets = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            snippets.add(snippet("msg " + i, i % 3 == 0 ? UserMemory.Direction.ME : UserMemory.Direction.THEM));
        }
        UserMemory memory = UserMemory.builder()
                .username("bob")
                .firstSeen(Instant.parse("2026-02-01T10:00:00Z").toEpochMilli())
                .lastSeen(Instant.parse("2026-02-20T10:00:00Z").toEpochMilli())
                .messages(snippets)
                .build();

        String text = formatter.format("bob", memory);

        assertEquals(String.join("\n",
                "",
                "--- Context about bob ---",
                "First contact: 2026-02-01",
                "Last contact: 2026-02-20",
                "Messages exchanged: 4 from them, 2 from you",
                "",
                "Recent conversation:",
                "  bob: msg 2",
                "  You: msg 3",
                "  bob: msg 4",
                "  bob: msg 5",
                "  You: msg 6",
                "--- End context ---",
                ""), text);
    }

    @Test
    void shouldClipLongMessages() {
        String longText = "x".repeat(120);
        UserMemory memory = UserMemory.builder()
                .messages(List.of(snippet(longText, UserMemory.Direction.THEM)))
                .build();

        String text = formatter.format("bob", memory);

        assertTrue(text.contains("  bob: " + "x".repeat(80) + "...\n"));
    }
}
