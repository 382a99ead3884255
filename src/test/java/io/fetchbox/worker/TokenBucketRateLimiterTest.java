package io.fetchbox.worker;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

final class TokenBucketRateLimiterTest {

    @Test
    void startsFullThenRefillsAtRate() {
        AtomicLong nanos = new AtomicLong(0L);
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(2.0d, nanos::get, n -> nanos.addAndGet(n));

        Assertions.assertTrue(limiter.tryAcquire());
        Assertions.assertTrue(limiter.tryAcquire());
        Assertions.assertFalse(limiter.tryAcquire());

        nanos.addAndGet(500_000_000L);
        Assertions.assertTrue(limiter.tryAcquire());
        Assertions.assertFalse(limiter.tryAcquire());

        nanos.addAndGet(10_000_000_000L);
        Assertions.assertTrue(limiter.tryAcquire());
        Assertions.assertTrue(limiter.tryAcquire());
        Assertions.assertFalse(limiter.tryAcquire());
    }

    @Test
    void acquireSleepsUntilTokenIsAvailable() throws Exception {
        AtomicLong nanos = new AtomicLong(0L);
        List<Long> sleeps = new ArrayList<>();
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(4.0d, nanos::get, n -> {
            sleeps.add(n);
            nanos.addAndGet(n);
        });

        for (int i = 0; i < 4; i++) {
            Assertions.assertEquals(0L, limiter.acquire());
        }
        long waited = limiter.acquire();
        Assertions.assertEquals(250_000_000L, waited);
        Assertions.assertEquals(List.of(250_000_000L), sleeps);
    }

    @Test
    void nonPositiveRateDisablesLimiting() throws Exception {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(0.0d, () -> 0L, n -> Assertions.fail("must not sleep"));
        Assertions.assertTrue(limiter.disabled());
        for (int i = 0; i < 1_000; i++) {
            Assertions.assertTrue(limiter.tryAcquire());
        }
        Assertions.assertEquals(0L, limiter.acquire());
    }
}
