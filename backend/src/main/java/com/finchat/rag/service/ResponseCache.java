package com.finchat.rag.service;

import com.finchat.rag.model.CacheEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Handler results keyed by normalized query text, each valid for its own TTL.
 * One lock guards every read and write; the oldest insertion is evicted past {@code maxEntries}.
 * {@link #getOrCompute} runs at most one load per key at a time; concurrent callers for that key
 * wait for it and share its result.
 */
@Component
@Slf4j
public class ResponseCache {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CacheEntry> entries = new LinkedHashMap<>();
    private final Map<String, CompletableFuture<Map<String, Object>>> inFlight = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration defaultTtl;
    private final int maxEntries;

    public ResponseCache(Clock clock,
                         @Value("${rag.cache.ttl-seconds:300}") long defaultTtlSeconds,
                         @Value("${rag.cache.max-entries:1000}") int maxEntries) {
        this.clock = clock;
        this.defaultTtl = Duration.ofSeconds(defaultTtlSeconds);
        this.maxEntries = maxEntries;
    }

    /**
     * Fresh entry for {@code key}; an expired entry is removed and reported as a miss.
     */
    public Optional<Map<String, Object>> get(String key) {
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isExpired(clock.instant())) {
                entries.remove(key);
                log.debug("Cache entry expired for '{}'", key);
                return Optional.empty();
            }
            return Optional.of(entry.getValue());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fresh entry for {@code key}, otherwise the loader's result. Only a non-empty result is stored;
     * a null, an empty map or an exception from the loader leaves the key uncached and is passed on
     * to every caller waiting on that load.
     *
     * @param ttl entry lifetime, {@code rag.cache.ttl-seconds} when null
     */
    public Map<String, Object> getOrCompute(String key, Duration ttl, Supplier<Map<String, Object>> loader) {
        Optional<Map<String, Object>> cached = get(key);
        if (cached.isPresent()) {
            log.debug("Cache hit for '{}'", key);
            return cached.get();
        }

        CompletableFuture<Map<String, Object>> load = new CompletableFuture<>();
        CompletableFuture<Map<String, Object>> running = inFlight.putIfAbsent(key, load);
        if (running != null) {
            log.debug("Waiting for in-flight load of '{}'", key);
            return await(running);
        }

        try {
            // a load for this key may have finished between the miss and the registration
            Optional<Map<String, Object>> fresh = get(key);
            if (fresh.isPresent()) {
                load.complete(fresh.get());
                return fresh.get();
            }
            Map<String, Object> value = loader.get();
            if (value != null && !value.isEmpty()) {
                put(key, value, ttl);
            }
            load.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            load.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, load);
        }
    }

    private static Map<String, Object> await(CompletableFuture<Map<String, Object>> load) {
        try {
            return load.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    public void put(String key, Map<String, Object> value, Duration ttl) {
        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        Instant now = clock.instant();
        lock.lock();
        try {
            entries.remove(key);
            entries.put(key, new CacheEntry(Collections.unmodifiableMap(new LinkedHashMap<>(value)), now, effectiveTtl));
            while (entries.size() > maxEntries) {
                String oldest = entries.keySet().iterator().next();
                entries.remove(oldest);
            }
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }
}
