package vantage.assist.history;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import vantage.assist.orchestrator.AssistantContext;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-session list of the most recent exchanges, newest first. Sessions idle
 * past {@code idleTimeout} are dropped, as are the coldest ones once more than
 * {@code maxSessions} exist.
 */
public class RecentHistory {
    private final int maxEntries;
    private final Cache<String, Deque<HistoryEntry>> sessions;

    public RecentHistory(int maxEntries, long maxSessions, Duration idleTimeout) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0");
        }
        if (maxSessions <= 0) {
            throw new IllegalArgumentException("maxSessions must be > 0");
        }
        this.maxEntries = maxEntries;
        this.sessions = Caffeine.newBuilder()
                .maximumSize(maxSessions)
                .expireAfterAccess(idleTimeout)
                .executor(Runnable::run)
                .build();
    }

    public void record(String sessionId, HistoryEntry entry) {
        sessions.asMap().compute(sessionId, (id, entries) -> {
            Deque<HistoryEntry> list = entries == null ? new ArrayDeque<>() : entries;
            list.addFirst(entry);
            while (list.size() > maxEntries) {
                list.removeLast();
            }
            return list;
        });
    }

    public List<HistoryEntry> recent(String sessionId) {
        AtomicReference<List<HistoryEntry>> snapshot = new AtomicReference<>(List.of());
        sessions.asMap().computeIfPresent(sessionId, (id, entries) -> {
            snapshot.set(List.copyOf(entries));
            return entries;
        });
        return snapshot.get();
    }

    public Optional<AssistantContext> latestContext(String sessionId) {
        for (HistoryEntry entry : recent(sessionId)) {
            if (entry.context() != null && !entry.context().isEmpty()) {
                return Optional.of(entry.context());
            }
        }
        return Optional.empty();
    }

    public long sessionCount() {
        sessions.cleanUp();
        return sessions.estimatedSize();
    }
}
