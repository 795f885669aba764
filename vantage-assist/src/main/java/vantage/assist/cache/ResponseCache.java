package vantage.assist.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Entries expire lazily on read. An insert past {@code maxEntries} evicts the
 * oldest entry other than the one just written.
 */
public class ResponseCache {
    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;
    private final Object lock = new Object();
    private final Map<CacheKey, Entry> entries = new LinkedHashMap<>();

    private long evictions;

    public ResponseCache(Duration ttl, int maxEntries, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("cache ttl must be > 0");
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("cache maxEntries must be > 0");
        }
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    public Optional<String> get(String tool, String contextFingerprint, String question) {
        return get(CacheKey.of(tool, contextFingerprint, question));
    }

    public Optional<String> get(CacheKey key) {
        Instant now = clock.instant();
        synchronized (lock) {
            Entry entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (Duration.between(entry.createdAt(), now).compareTo(ttl) > 0) {
                entries.remove(key);
                log.debug("Cache entry expired tool={} age_ms={}",
                        key.tool(), Duration.between(entry.createdAt(), now).toMillis());
                return Optional.empty();
            }
            return Optional.of(entry.text());
        }
    }

    public void set(String tool, String contextFingerprint, String question, String text) {
        set(CacheKey.of(tool, contextFingerprint, question), text);
    }

    public void set(CacheKey key, String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        Instant now = clock.instant();
        synchronized (lock) {
            entries.remove(key);
            entries.put(key, new Entry(text, now));
            if (entries.size() > maxEntries) {
                evictOldestExcept(key);
            }
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public long evictions() {
        synchronized (lock) {
            return evictions;
        }
    }

    // caller holds lock
    private void evictOldestExcept(CacheKey keep) {
        CacheKey oldest = null;
        Instant oldestAt = null;
        for (Map.Entry<CacheKey, Entry> e : entries.entrySet()) {
            if (e.getKey().equals(keep)) {
                continue;
            }
            Instant createdAt = e.getValue().createdAt();
            if (oldestAt == null || createdAt.isBefore(oldestAt)) {
                oldest = e.getKey();
                oldestAt = createdAt;
            }
        }
        if (oldest != null) {
            entries.remove(oldest);
            evictions++;
            log.debug("Cache full ({} entries), evicted oldest tool={} created_at={}",
                    maxEntries, oldest.tool(), oldestAt);
        }
    }

    private record Entry(String text, Instant createdAt) {}
}
