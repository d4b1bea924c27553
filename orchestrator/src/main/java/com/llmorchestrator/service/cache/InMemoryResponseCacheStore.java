package com.llmorchestrator.service.cache;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Expired entries are dropped on read and when the size bound is hit.
 */
@Slf4j
public class InMemoryResponseCacheStore implements ResponseCacheStore {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final int maxSize;
    private final Clock clock;

    public InMemoryResponseCacheStore(int maxSize) {
        this(maxSize, Clock.systemUTC());
    }

    public InMemoryResponseCacheStore(int maxSize, Clock clock) {
        this.maxSize = Math.max(1, maxSize);
        this.clock = clock;
    }

    @Override
    public Mono<String> get(String key) {
        return Mono.fromSupplier(() -> {
            Entry entry = entries.get(key);
            if (entry == null) {
                return null;
            }
            if (entry.isExpired(clock.instant())) {
                entries.remove(key, entry);
                return null;
            }
            return entry.value;
        });
    }

    @Override
    public Mono<Void> put(String key, String value, Duration ttl) {
        return Mono.fromRunnable(() -> {
            if (entries.size() >= maxSize && !entries.containsKey(key)) {
                makeRoom();
            }
            entries.put(key, new Entry(value, clock.instant().plus(ttl)));
        });
    }

    @Override
    public Mono<Long> evictByPrefix(String prefix) {
        return Mono.fromSupplier(() -> {
            long before = entries.size();
            entries.keySet().removeIf(key -> key.startsWith(prefix));
            return before - entries.size();
        });
    }

    public int size() {
        return entries.size();
    }

    private void makeRoom() {
        Instant now = clock.instant();
        entries.entrySet().removeIf(e -> e.getValue().isExpired(now));
        while (entries.size() >= maxSize) {
            entries.entrySet().stream()
                    .min(Comparator.comparing(e -> e.getValue().expiresAt))
                    .ifPresent(e -> entries.remove(e.getKey(), e.getValue()));
        }
        log.debug("Response cache at capacity ({}), evicted soonest-expiring entries", maxSize);
    }

    private static final class Entry {
        private final String value;
        private final Instant expiresAt;

        private Entry(String value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
