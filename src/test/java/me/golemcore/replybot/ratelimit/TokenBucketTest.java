package me.golemcore.replybot.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class TokenBucketTest {

    private final AtomicLong nanos = new AtomicLong(0);

    @Test
    void shouldAllowUpToCapacity() {
        TokenBucket bucket = new TokenBucket(3, Duration.ofMinutes(1), nanos::get);

        assertTrue(bucket.tryConsume());
        assertTrue(bucket.tryConsume());
        assertEquals(0, bucket.waitTimeMs());
        assertTrue(bucket.tryConsume());
        assertEquals(0, bucket.availableTokens());

        assertFalse(bucket.tryConsume());
        assertEquals(20000, bucket.waitTimeMs());
    }

    @Test
    void shouldRefillOverTime() {
        TokenBucket bucket = new TokenBucket(2, Duration.ofMinutes(1), nanos::get);
        bucket.tryConsume();
        bucket.tryConsume();
        assertEquals(0, bucket.availableTokens());

        nanos.addAndGet(TimeUnit.SECONDS.toNanos(30));
        assertEquals(1, bucket.availableTokens());

        nanos.addAndGet(TimeUnit.MINUTES.toNanos(10));
        assertEquals(2, bucket.availableTokens());
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new TokenBucket(0, Duration.ofMinutes(1)));
    }
}
