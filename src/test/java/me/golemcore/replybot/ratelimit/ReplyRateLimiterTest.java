package me.golemcore.replybot.ratelimit;

import me.golemcore.replybot.domain.model.RateLimitResult;
import me.golemcore.replybot.domain.model.ReplyConfig;
import me.golemcore.replybot.domain.service.ReplyConfigService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ReplyRateLimiterTest {

    private ReplyConfigService replyConfigService;
    private ReplyRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        replyConfigService = mock(ReplyConfigService.class);
        when(replyConfigService.getConfig()).thenReturn(ReplyConfig.builder()
                .maxRepliesPerMinute(2)
                .maxRepliesPerHour(30)
                .build());
        rateLimiter = new ReplyRateLimiter(replyConfigService);
    }

    @Test
    void shouldDenyAfterPerMinuteLimit() {
        assertTrue(rateLimiter.tryConsumeReply().allowed());
        RateLimitResult second = rateLimiter.tryConsumeReply();
        assertTrue(second.allowed());
        assertEquals(0, second.remainingReplies());

        RateLimitResult third = rateLimiter.tryConsumeReply();
        assertFalse(third.allowed());
        assertEquals(RateLimitResult.Tier.MINUTE, third.limitedBy());
        assertNotNull(third.retryAfter());
        assertTrue(third.describe().startsWith("per-minute reply limit reached"));
    }

    @Test
    void shouldNotSpendHourTokenWhenMinuteDenies() {
        rateLimiter.tryConsumeReply();
        rateLimiter.tryConsumeReply();
        rateLimiter.tryConsumeReply();

        RateLimiter.Status status = rateLimiter.getStatus();
        assertEquals(0, status.remainingPerMinute());
        assertEquals(28, status.remainingPerHour());
        assertFalse(status.canReply());
    }

    @Test
    void shouldDenyAfterPerHourLimit() {
        when(replyConfigService.getConfig()).thenReturn(ReplyConfig.builder()
                .maxRepliesPerMinute(10)
                .maxRepliesPerHour(1)
                .build());

        assertTrue(rateLimiter.tryConsumeReply().allowed());
        RateLimitResult denied = rateLimiter.tryConsumeReply();
        assertFalse(denied.allowed());
        assertEquals(RateLimitResult.Tier.HOUR, denied.limitedBy());
    }

    @Test
    void shouldRebuildBucketWhenCapacityChanges() {
        rateLimiter.tryConsumeReply();
        rateLimiter.tryConsumeReply();
        assertFalse(rateLimiter.getStatus().canReply());

        when(replyConfigService.getConfig()).thenReturn(ReplyConfig.builder()
                .maxRepliesPerMinute(5)
                .maxRepliesPerHour(30)
                .build());

        assertEquals(5, rateLimiter.getStatus().remainingPerMinute());
    }

    @Test
    void shouldRefillOnReset() {
        rateLimiter.tryConsumeReply();
        rateLimiter.tryConsumeReply();

        rateLimiter.reset();

        assertTrue(rateLimiter.getStatus().canReply());
        assertEquals(2, rateLimiter.getStatus().remainingPerMinute());
    }
}
