package me.golemcore.replybot.domain.service;

import me.golemcore.replybot.domain.model.AiProvider;
import me.golemcore.replybot.domain.model.ChatMessage;
import me.golemcore.replybot.domain.model.ConnectionTestResult;
import me.golemcore.replybot.domain.model.ProviderStatus;
import me.golemcore.replybot.domain.model.ProviderValidation;
import me.golemcore.replybot.domain.model.ReplyConfig;
import me.golemcore.replybot.infrastructure.config.BotProperties;
import me.golemcore.replybot.port.outbound.LlmPort;
import me.golemcore.replybot.ratelimit.ErrorTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AiClientTest {

    private static final List<ChatMessage> CONTEXT = List.of(ChatMessage.user("Hi"));

    private LlmPort localPort;
    private LlmPort hostedPort;
    private ReplyConfig.AiConfig config;
    private AiClient aiClient;

    @BeforeEach
    void setUp() {
        localPort = mock(LlmPort.class);
        when(localPort.getProvider()).thenReturn(AiProvider.LOCAL);
        hostedPort = mock(LlmPort.class);
        when(hostedPort.getProvider()).thenReturn(AiProvider.HOSTED);

        config = new ReplyConfig.AiConfig();
        aiClient = new AiClient(List.of(localPort, hostedPort), config,
                new ActivityLogService(new BotProperties(), Clock.systemUTC()));
    }

    @Test
    void shouldDelegateToActiveProvider() {
        when(localPort.generateReply(CONTEXT)).thenReturn(Optional.of("from local"));

        assertEquals(Optional.of("from local"), aiClient.generateReply(CONTEXT));
        verify(hostedPort, never()).generateReply(any());
    }

    @Test
    void shouldSwitchProviderOnConfigUpdate() {
        when(hostedPort.generateReply(CONTEXT)).thenReturn(Optional.of("from hosted"));
        ReplyConfig.AiConfig hosted = config.toBuilder().provider(AiProvider.HOSTED).hostedApiKey("k").build();

        aiClient.updateConfig(hosted);

        assertEquals(AiProvider.HOSTED, aiClient.getCurrentProvider());
        assertEquals(Optional.of("from hosted"), aiClient.generateReply(CONTEXT));
        verify(localPort).updateConfig(hosted);
        verify(hostedPort).updateConfig(hosted);
    }

    @Test
    void shouldReturnEmptyWhenDisabled() {
        aiClient.updateConfig(config.toBuilder().enabled(false).build());

        assertTrue(aiClient.generateReply(CONTEXT).isEmpty());
        assertFalse(aiClient.isConnected());
        verify(localPort, never()).generateReply(any());
    }

    @Test
    void shouldReturnEmptyWhenNoAdapterIsRegistered() {
        AiClient localOnly = new AiClient(List.of(localPort), config.toBuilder().provider(AiProvider.HOSTED).build(),
                new ActivityLogService(new BotProperties(), Clock.systemUTC()));

        assertTrue(localOnly.generateReply(CONTEXT).isEmpty());
        assertEquals("Unknown AI provider", localOnly.testConnection().error());
        assertTrue(localOnly.getErrorTracker().isEmpty());
    }

    @Test
    void shouldDelegateConnectionTest() {
        when(localPort.testConnection()).thenReturn(ConnectionTestResult.ok("local-model"));

        ConnectionTestResult result = aiClient.testConnection();

        assertTrue(result.success());
        assertEquals("local-model", result.modelName());
    }

    @Test
    void shouldReportValidationErrorInStatus() {
        when(hostedPort.isConnected()).thenReturn(false);
        aiClient.updateConfig(config.toBuilder().provider(AiProvider.HOSTED).hostedApiKey("").build());

        ProviderStatus status = aiClient.getProviderStatus();

        assertEquals(AiProvider.HOSTED, status.provider());
        assertFalse(status.connected());
        assertEquals("Hosted API key is required", status.error());
    }

    @Test
    void shouldReportConnectedStatusWithoutError() {
        when(localPort.isConnected()).thenReturn(true);

        ProviderStatus status = aiClient.getProviderStatus();

        assertTrue(status.connected());
        assertNull(status.error());
    }

    @Test
    void shouldExposeTrackerOfActiveProvider() {
        ErrorTracker tracker = new ErrorTracker("local", ErrorTracker.Settings.from(config), Clock.systemUTC());
        when(localPort.getErrorTracker()).thenReturn(tracker);

        assertSame(tracker, aiClient.getErrorTracker().orElseThrow());
    }

    @Test
    void shouldValidateProviderSettings() {
        ReplyConfig.AiConfig valid = new ReplyConfig.AiConfig();
        assertTrue(AiClient.validateProviderConfig(valid, AiProvider.LOCAL).valid());

        ProviderValidation noEndpoint = AiClient.validateProviderConfig(
                valid.toBuilder().llmEndpoint(" ").build(), AiProvider.LOCAL);
        assertEquals("Local LLM endpoint is required", noEndpoint.error());

        ProviderValidation badPort = AiClient.validateProviderConfig(
                valid.toBuilder().llmPort(0).build(), AiProvider.LOCAL);
        assertEquals("Valid local LLM port is required", badPort.error());
        assertFalse(AiClient.validateProviderConfig(valid.toBuilder().llmPort(65536).build(), AiProvider.LOCAL)
                .valid());

        assertEquals("Hosted API key is required",
                AiClient.validateProviderConfig(valid, AiProvider.HOSTED).error());
        assertEquals("Hosted model is required", AiClient.validateProviderConfig(
                valid.toBuilder().hostedApiKey("k").hostedModel("").build(), AiProvider.HOSTED).error());
        assertTrue(AiClient.validateProviderConfig(valid.toBuilder().hostedApiKey("k").build(), AiProvider.HOSTED)
                .valid());
        assertEquals("Unknown AI provider", AiClient.validateProviderConfig(valid, null).error());
    }

    @Test
    void shouldListHostedModels() {
        List<String> models = AiClient.getAvailableHostedModels();

        assertTrue(models.contains("gpt-4o-mini"));
        assertThrows(UnsupportedOperationException.class, () -> models.add("other"));
    }
}
