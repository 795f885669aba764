package vantage.assist.cache;

import org.junit.jupiter.api.Test;
import vantage.assist.support.MutableClock;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ResponseCacheTest {
    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");

    @Test
    void shouldHitForQuestionsThatNormalizeAlike() {
        ResponseCache cache = new ResponseCache(Duration.ofMinutes(5), 10, clock);
        cache.set("whois", "", "What is   WHOIS?", "answer");

        assertEquals(Optional.of("answer"), cache.get("whois", "", "  what is whois?\n"));
    }

    @Test
    void shouldScopeEntriesByToolAndContext() {
        ResponseCache cache = new ResponseCache(Duration.ofMinutes(5), 10, clock);
        cache.set("whois", "whois|example.com|", "explain this", "answer");

        assertTrue(cache.get("whois", "dns_records|example.com|", "explain this").isEmpty());
        assertTrue(cache.get(null, "whois|example.com|", "explain this").isEmpty());
        assertTrue(cache.get("whois", "whois|example.com|", "explain this").isPresent());
    }

    @Test
    void shouldExpireLazilyAfterTtl() {
        ResponseCache cache = new ResponseCache(Duration.ofSeconds(30), 10, clock);
        cache.set("dns_records", "", "mx?", "answer");

        clock.advance(Duration.ofSeconds(30));
        assertTrue(cache.get("dns_records", "", "mx?").isPresent(), "entry exactly at ttl is still valid");

        clock.advance(Duration.ofMillis(1));
        assertTrue(cache.get("dns_records", "", "mx?").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void shouldEvictOldestWhenOverCapacity() {
        ResponseCache cache = new ResponseCache(Duration.ofMinutes(5), 2, clock);
        cache.set(null, "", "first", "1");
        clock.advance(Duration.ofSeconds(1));
        cache.set(null, "", "second", "2");
        clock.advance(Duration.ofSeconds(1));
        cache.set(null, "", "third", "3");

        assertEquals(2, cache.size());
        assertEquals(1, cache.evictions());
        assertTrue(cache.get(null, "", "first").isEmpty());
        assertEquals(Optional.of("2"), cache.get(null, "", "second"));
        assertEquals(Optional.of("3"), cache.get(null, "", "third"));
    }

    @Test
    void shouldKeepJustInsertedEntryEvenIfOldest() {
        ResponseCache cache = new ResponseCache(Duration.ofMinutes(5), 2, clock);
        cache.set(null, "", "a", "A");
        clock.advance(Duration.ofSeconds(1));
        cache.set(null, "", "b", "B");
        clock.advance(Duration.ofSeconds(-10));
        cache.set(null, "", "c", "C");

        assertEquals(2, cache.size());
        assertTrue(cache.get(null, "", "a").isEmpty());
        assertEquals(Optional.of("C"), cache.get(null, "", "c"));
    }

    @Test
    void shouldRefreshTimestampOnOverwrite() {
        ResponseCache cache = new ResponseCache(Duration.ofSeconds(10), 2, clock);
        cache.set(null, "", "a", "old");
        clock.advance(Duration.ofSeconds(8));
        cache.set(null, "", "A", "new");
        clock.advance(Duration.ofSeconds(8));

        assertEquals(Optional.of("new"), cache.get(null, "", "a"));
        assertEquals(1, cache.size());
    }

    @Test
    void shouldIgnoreBlankAnswers() {
        ResponseCache cache = new ResponseCache(Duration.ofSeconds(10), 2, clock);
        cache.set(null, "", "a", "  ");
        assertEquals(0, cache.size());
    }

    @Test
    void shouldHoldCapacityUnderConcurrentWriters() throws Exception {
        ResponseCache cache = new ResponseCache(Duration.ofMinutes(5), 50, clock);
        int threads = 8;
        int perThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int writer = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        cache.set(null, "", "w" + writer + "-q" + i, "answer " + i);
                        cache.get(null, "", "w" + writer + "-q" + (i / 2));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(50, cache.size());
        assertEquals(threads * perThread - 50, cache.evictions());
    }

    @Test
    void shouldRejectNonPositiveLimits() {
        assertThrows(IllegalArgumentException.class, () -> new ResponseCache(Duration.ofSeconds(10), 0, clock));
        assertThrows(IllegalArgumentException.class, () -> new ResponseCache(Duration.ZERO, 10, clock));
    }
}
