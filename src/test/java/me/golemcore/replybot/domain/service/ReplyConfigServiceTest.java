package me.golemcore.replybot.domain.service;

import me.golemcore.replybot.domain.model.AiProvider;
import me.golemcore.replybot.domain.model.ReplyConfig;
import me.golemcore.replybot.domain.model.ReplyConfigChangedEvent;
import me.golemcore.replybot.domain.model.ReplyRule;
import me.golemcore.replybot.infrastructure.config.AutoConfiguration;
import me.golemcore.replybot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ReplyConfigServiceTest {

    private BotProperties properties;
    private ApplicationEventPublisher eventPublisher;
    private ReplyConfigService service;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        eventPublisher = mock(ApplicationEventPublisher.class);
        service = new ReplyConfigService(properties, eventPublisher, AutoConfiguration.objectMapper());
    }

    @Test
    void shouldSeedFromBootstrapProperties() {
        properties.getAi().setProvider(AiProvider.HOSTED);
        properties.getAi().setHostedApiKey("key");
        properties.getAi().setSystemPrompt("Custom prompt");
        properties.getReply().setRandomSkipProbability(0.0);
        properties.getReply().setRules(List.of(ReplyRule.builder().match("hi").reply("Hello!").build()));

        ReplyConfig config = service.getConfig();

        assertEquals(AiProvider.HOSTED, config.getAi().getProvider());
        assertEquals("key", config.getAi().getHostedApiKey());
        assertEquals("Custom prompt", config.getAi().getSystemPrompt());
        assertEquals(0.0, config.getRandomSkipProbability());
        assertEquals(1, config.getReplyRules().size());
        assertSame(config, service.getConfig());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void shouldKeepDefaultPromptWhenNoneConfigured() {
        assertEquals(ReplyConfig.DEFAULT_SYSTEM_PROMPT, service.getConfig().getAi().getSystemPrompt());
        assertEquals(10, service.getConfig().getAi().getMaxContextMessages());
    }

    @Test
    void shouldPublishEventOnUpdate() {
        ReplyConfig updated = service.updateConfig(ReplyConfig.builder().maxReplyLength(42).build());

        ArgumentCaptor<ReplyConfigChangedEvent> captor = ArgumentCaptor.forClass(ReplyConfigChangedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertSame(updated, captor.getValue().config());
        assertEquals(42, service.getConfig().getMaxReplyLength());
    }

    @Test
    void shouldClampOutOfRangeValues() {
        ReplyConfig.AiConfig ai = ReplyConfig.AiConfig.builder()
                .maxContextMessages(0)
                .requestTimeoutMs(10)
                .maxRetries(0)
                .hostedApiKey(null)
                .build();
        ReplyConfig input = ReplyConfig.builder()
                .randomSkipProbability(1.7)
                .maxReplyLength(0)
                .maxRepliesPerMinute(-3)
                .replyRules(null)
                .ai(ai)
                .build();

        ReplyConfig normalized = service.updateConfig(input);

        assertEquals(1.0, normalized.getRandomSkipProbability());
        assertEquals(500, normalized.getMaxReplyLength());
        assertEquals(1, normalized.getMaxRepliesPerMinute());
        assertNotNull(normalized.getReplyRules());
        assertEquals(1, normalized.getAi().getMaxContextMessages());
        assertEquals(1000, normalized.getAi().getRequestTimeoutMs());
        assertEquals(1, normalized.getAi().getMaxRetries());
        assertEquals("", normalized.getAi().getHostedApiKey());
    }

    @Test
    void shouldMergePartialAiSettings() {
        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put("provider", "hosted");
        patch.put("hostedApiKey", "sk-new");
        patch.put("maxContextMessages", 4);

        ReplyConfig merged = service.mergeAiConfig(patch);

        assertEquals(AiProvider.HOSTED, merged.getAi().getProvider());
        assertEquals("sk-new", merged.getAi().getHostedApiKey());
        assertEquals(4, merged.getAi().getMaxContextMessages());
        assertEquals("localhost", merged.getAi().getLlmEndpoint());
        assertEquals(8080, merged.getAi().getLlmPort());
        verify(eventPublisher).publishEvent(any(ReplyConfigChangedEvent.class));
    }

    @Test
    void shouldNotMutatePreviousConfigOnMerge() {
        ReplyConfig before = service.getConfig();

        service.mergeAiConfig(Map.of("llmPort", 9000));

        assertEquals(8080, before.getAi().getLlmPort());
        assertEquals(9000, service.getConfig().getAi().getLlmPort());
    }

    @Test
    void shouldRejectUnknownProvider() {
        assertThrows(IllegalArgumentException.class, () -> service.mergeAiConfig(Map.of("provider", "carrier-pigeon")));
        assertEquals(AiProvider.LOCAL, service.getConfig().getAi().getProvider());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void shouldDeliverEventsInTheOrderUpdatesWereApplied() throws Exception {
        List<ReplyConfig> delivered = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch firstPublishing = new CountDownLatch(1);
        CountDownLatch secondSubmitted = new CountDownLatch(1);
        ReplyConfigService ordered = new ReplyConfigService(properties, event -> {
            ReplyConfig config = ((ReplyConfigChangedEvent) event).config();
            if (config.getMaxReplyLength() == 111) {
                firstPublishing.countDown();
                try {
                    // give the second update a chance to overtake this publish
                    secondSubmitted.await(1, TimeUnit.SECONDS);
                    Thread.sleep(100);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            delivered.add(config);
        }, AutoConfiguration.objectMapper());

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> first = executor.submit(
                    () -> ordered.updateConfig(ReplyConfig.builder().maxReplyLength(111).build()));
            assertTrue(firstPublishing.await(5, TimeUnit.SECONDS));
            Future<?> second = executor.submit(
                    () -> ordered.updateConfig(ReplyConfig.builder().maxReplyLength(222).build()));
            secondSubmitted.countDown();
            first.get(5, TimeUnit.SECONDS);
            second.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertEquals(List.of(111, 222), delivered.stream().map(ReplyConfig::getMaxReplyLength).toList());
        assertSame(ordered.getConfig(), delivered.get(delivered.size() - 1));
    }

    @Test
    void shouldNotLoseFieldsUnderConcurrentMerges() throws Exception {
        int merges = 50;
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> temperatures = executor.submit(() -> {
                for (int i = 1; i <= merges; i++) {
                    service.mergeAiConfig(Map.of("temperature", i / 100.0));
                }
            });
            Future<?> tokens = executor.submit(() -> {
                for (int i = 1; i <= merges; i++) {
                    service.mergeAiConfig(Map.of("maxTokens", i));
                }
            });
            temperatures.get(10, TimeUnit.SECONDS);
            tokens.get(10, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        ReplyConfig.AiConfig ai = service.getConfig().getAi();
        assertEquals(merges / 100.0, ai.getTemperature());
        assertEquals(merges, ai.getMaxTokens());
    }
}
