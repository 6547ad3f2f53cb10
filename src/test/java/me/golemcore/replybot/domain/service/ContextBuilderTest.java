package me.golemcore.replybot.domain.service;

import me.golemcore.replybot.domain.model.ChatMessage;
import me.golemcore.replybot.domain.model.IncomingMessage;
import me.golemcore.replybot.domain.model.ReplyConfig;
import me.golemcore.replybot.domain.model.UserMemory;
import me.golemcore.replybot.port.outbound.UserMemoryPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ContextBuilderTest {

    private static final String CONV = "conv-1";
    private static final String USER = "alice";
    private static final String PROMPT = "Be nice.";

    private UserMemoryPort userMemoryPort;
    private ContextBuilder contextBuilder;

    @BeforeEach
    void setUp() {
        userMemoryPort = mock(UserMemoryPort.class);
        when(userMemoryPort.findByUsername(anyString())).thenReturn(Optional.empty());
        UserMemoryFormatter formatter = new UserMemoryFormatter(
                Clock.fixed(Instant.parse("2026-01-10T12:00:00Z"), ZoneOffset.UTC));
        ReplyConfig.AiConfig config = ReplyConfig.AiConfig.builder()
                .systemPrompt(PROMPT)
                .maxContextMessages(3)
                .build();
        contextBuilder = new ContextBuilder(userMemoryPort, formatter, config);
    }

    private static IncomingMessage message(String text) {
        return IncomingMessage.builder().messageId(text).sender(USER).messageText(text).build();
    }

    @Test
    void shouldStartWithSingleSystemMessage() {
        List<ChatMessage> context = contextBuilder.getContext(CONV, USER);

        assertEquals(List.of(ChatMessage.system(PROMPT)), context);
    }

    @Test
    void shouldWindowHistoryToMostRecentEntries() {
        for (int i = 1; i <= 5; i++) {
            contextBuilder.addMessage(CONV, message("m" + i), i % 2 == 0);
        }

        List<ChatMessage> context = contextBuilder.getContext(CONV, USER);

        assertEquals(4, context.size());
        assertEquals(ChatMessage.Role.SYSTEM, context.get(0).role());
        assertEquals(ChatMessage.user("m3"), context.get(1));
        assertEquals(ChatMessage.assistant("m4"), context.get(2));
        assertEquals(ChatMessage.user("m5"), context.get(3));
        assertEquals(5, contextBuilder.getMessageCount(CONV));
    }

    @Test
    void shouldAppendCurrentMessageAsTrailingUserTurn() {
        contextBuilder.addMessage(CONV, message("earlier"), false);

        List<ChatMessage> context = contextBuilder.getContext(CONV, USER, "right now");

        assertEquals(3, context.size());
        assertEquals(ChatMessage.user("right now"), context.get(2));
    }

    @Test
    void shouldIsolateConversations() {
        contextBuilder.addMessage(CONV, message("private"), false);

        List<ChatMessage> other = contextBuilder.getContext("conv-2", USER);

        assertEquals(1, other.size());
        assertEquals(0, contextBuilder.getMessageCount("conv-2"));
    }

    @Test
    void shouldForgetHistoryOnReset() {
        contextBuilder.addMessage(CONV, message("one"), false);
        contextBuilder.addMessage(CONV, message("two"), true);

        contextBuilder.resetContext(CONV);

        assertEquals(1, contextBuilder.getContext(CONV, USER).size());
        assertEquals(0, contextBuilder.getMessageCount(CONV));
    }

    @Test
    void shouldOmitHistoryWhenDisabled() {
        contextBuilder.addMessage(CONV, message("stored"), false);
        contextBuilder.setContextEnabled(false);

        List<ChatMessage> context = contextBuilder.getContext(CONV, USER, "current");

        assertEquals(List.of(ChatMessage.system(PROMPT), ChatMessage.user("current")), context);
        assertEquals(1, contextBuilder.getMessageCount(CONV));
    }

    @Test
    void shouldApplyUpdatedWindowOnNextRead() {
        for (int i = 0; i < 5; i++) {
            contextBuilder.addMessage(CONV, message("m" + i), false);
        }

        contextBuilder.setMaxMessages(1);
        assertEquals(2, contextBuilder.getContext(CONV, USER).size());

        contextBuilder.setMaxMessages(0);
        assertEquals(2, contextBuilder.getContext(CONV, USER).size());

        contextBuilder.updateConfig(ReplyConfig.AiConfig.builder().systemPrompt("New prompt").build());
        List<ChatMessage> context = contextBuilder.getContext(CONV, USER);
        assertEquals(6, context.size());
        assertEquals("New prompt", context.get(0).content());
    }

    @Test
    void shouldAppendUserMemoryToSystemPrompt() {
        UserMemory memory = UserMemory.builder()
                .username(USER)
                .firstSeen(Instant.parse("2026-01-01T08:00:00Z").toEpochMilli())
                .lastSeen(Instant.parse("2026-01-09T08:00:00Z").toEpochMilli())
                .messages(List.of(UserMemory.Snippet.builder()
                        .text("see you tomorrow").from(UserMemory.Direction.THEM).build()))
                .build();
        when(userMemoryPort.findByUsername(USER)).thenReturn(Optional.of(memory));

        ChatMessage system = contextBuilder.getContext(CONV, USER).get(0);

        assertTrue(system.content().startsWith(PROMPT + "\n--- Context about alice ---"));
        assertTrue(system.content().contains("alice: see you tomorrow"));
    }

    @Test
    void shouldClearEveryConversation() {
        contextBuilder.addMessage(CONV, message("a"), false);
        contextBuilder.addMessage("conv-2", message("b"), false);

        contextBuilder.clearAll();

        assertEquals(0, contextBuilder.getMessageCount(CONV));
        assertEquals(0, contextBuilder.getMessageCount("conv-2"));
    }

    @Test
    void shouldKeepConcurrentConversationsIsolatedAndComplete() throws Exception {
        ContextBuilder wide = new ContextBuilder(userMemoryPort, new UserMemoryFormatter(Clock.systemUTC()),
                ReplyConfig.AiConfig.builder().maxContextMessages(1000).build());
        int conversations = 4;
        int perConversation = 200;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int c = 0; c < conversations; c++) {
                String conversationId = "conv-" + c;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perConversation; i++) {
                        wide.addMessage(conversationId, message(conversationId + ":" + i), false);
                    }
                    return null;
                }));
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perConversation; i++) {
                        for (ChatMessage entry : wide.getContext(conversationId, USER)) {
                            if (entry.role() == ChatMessage.Role.USER) {
                                assertTrue(entry.content().startsWith(conversationId + ":"));
                            }
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        for (int c = 0; c < conversations; c++) {
            String conversationId = "conv-" + c;
            assertEquals(perConversation, wide.getMessageCount(conversationId));
            List<ChatMessage> history = wide.getContext(conversationId, USER);
            for (int i = 0; i < perConversation; i++) {
                assertEquals(conversationId + ":" + i, history.get(i + 1).content());
            }
        }
    }

    @Test
    void shouldAppendExchangesWhole() throws Exception {
        ContextBuilder wide = new ContextBuilder(userMemoryPort, new UserMemoryFormatter(Clock.systemUTC()),
                ReplyConfig.AiConfig.builder().maxContextMessages(1000).build());
        int writers = 4;
        int exchanges = 50;
        ExecutorService executor = Executors.newFixedThreadPool(writers + 1);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int w = 0; w < writers; w++) {
                String prefix = "w" + w + "-";
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < exchanges; i++) {
                        wide.appendExchange(CONV, message(prefix + "q" + i), message(prefix + "a" + i));
                    }
                    return null;
                }));
            }
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < exchanges; i++) {
                    assertEquals(1, wide.getContext(CONV, USER).size() % 2);
                }
                return null;
            }));
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        List<ChatMessage> history = wide.getContext(CONV, USER);
        assertEquals(writers * exchanges * 2, history.size() - 1);
        for (int i = 1; i < history.size(); i += 2) {
            ChatMessage question = history.get(i);
            ChatMessage answer = history.get(i + 1);
            assertEquals(ChatMessage.Role.USER, question.role());
            assertEquals(ChatMessage.Role.ASSISTANT, answer.role());
            assertEquals(question.content().replace("-q", "-a"), answer.content());
        }
    }
}
