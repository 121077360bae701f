package com.pipedesk.drive.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.pipedesk.drive.exception.ValidationException;
import com.pipedesk.drive.util.JsonUtil;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Best-effort key to JSON cache with a TTL per entry. Every failure is logged and treated as a
 * miss, callers never depend on the cache for correctness.
 */
@Slf4j
@Service
public class JsonCacheService {

    private static final long FAILURE_LOG_INTERVAL_MILLIS = 60_000L;

    // <key, json + ttl>, expired entries are evicted by caffeine
    private final Cache<String, CacheEntry> cache;

    private final AtomicLong lastFailureLoggedAt = new AtomicLong(0L);

    private final long defaultTtlSec;

    private volatile boolean enabled;

    @Autowired
    public JsonCacheService(
            @Value("${pipedesk.drive.cache.enabled:true}") boolean enabled,
            @Value("${pipedesk.drive.cache.default-ttl-sec:180}") long defaultTtlSec,
            @Value("${pipedesk.drive.cache.max-entries:10000}") long maxEntries) {
        this.enabled = enabled;
        this.defaultTtlSec = defaultTtlSec;
        this.cache = Caffeine.newBuilder()
                .maximumSize(Math.max(1L, maxEntries))
                .expireAfter(new CacheEntryExpiry())
                .build();
    }

    public <T> T get(String key, Class<T> clazz) {
        if (!this.enabled || StringUtils.isBlank(key)) {
            return null;
        }
        try {
            CacheEntry entry = this.cache.getIfPresent(key);
            return ObjectUtils.isEmpty(entry) ? null : JsonUtil.deserialize(entry.getJson(), clazz);
        } catch (RuntimeException e) {
            this.logFailure("cache GET failed for key '%s'".formatted(key), e);
            return null;
        }
    }

    public <T> List<T> getList(String key, Class<T> elementType) {
        if (!this.enabled || StringUtils.isBlank(key)) {
            return null;
        }
        try {
            CacheEntry entry = this.cache.getIfPresent(key);
            return ObjectUtils.isEmpty(entry) ? null : JsonUtil.deserToList(entry.getJson(), elementType);
        } catch (RuntimeException e) {
            this.logFailure("cache GET failed for key '%s'".formatted(key), e);
            return null;
        }
    }

    public boolean set(String key, Object value) {
        return this.set(key, value, null);
    }

    public boolean set(String key, Object value, Duration ttl) {
        if (!this.enabled) {
            return false;
        }
        if (StringUtils.isBlank(key)) {
            throw new ValidationException("cache set failed. key is blank");
        }
        try {
            Duration effectiveTtl = ObjectUtils.isEmpty(ttl) ? Duration.ofSeconds(this.defaultTtlSec) : ttl;
            String json = JsonUtil.serializeToString(value);
            this.cache.put(key, new CacheEntry(json, effectiveTtl.toNanos()));
            return true;
        } catch (RuntimeException e) {
            this.logFailure("cache SET failed for key '%s'".formatted(key), e);
            return false;
        }
    }

    /**
     * Removes one key, or every key starting with the given prefix when it ends with {@code *}.
     *
     * @return the number of removed entries
     */
    public int invalidate(String keyOrPrefix) {
        if (StringUtils.isBlank(keyOrPrefix)) {
            return 0;
        }
        if (!keyOrPrefix.endsWith("*")) {
            return this.cache.asMap().remove(keyOrPrefix) == null ? 0 : 1;
        }
        String prefix = StringUtils.removeEnd(keyOrPrefix, "*");
        int removed = 0;
        for (String key : this.cache.asMap().keySet()) {
            if (key.startsWith(prefix) && this.cache.asMap().remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    public void flushAll() {
        this.cache.invalidateAll();
    }

    /**
     * Number of entries held after pending evictions ran.
     */
    public long size() {
        this.cache.cleanUp();
        return this.cache.estimatedSize();
    }

    public boolean isEnabled() {
        return this.enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
        if (!enabled) {
            this.cache.invalidateAll();
        }
    }

    // at most one warning a minute, a broken cache must not flood the log
    private void logFailure(String message, Exception e) {
        long now = System.currentTimeMillis();
        long last = this.lastFailureLoggedAt.get();
        if (now - last > FAILURE_LOG_INTERVAL_MILLIS && this.lastFailureLoggedAt.compareAndSet(last, now)) {
            log.warn(message, e);
        }
    }

    @Getter
    @AllArgsConstructor
    private static class CacheEntry {

        private final String json;

        private final long ttlNanos;
    }

    private static class CacheEntryExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry value, long currentTime) {
            return value.getTtlNanos();
        }

        // an overwrite restarts the clock with the new entry's ttl
        @Override
        public long expireAfterUpdate(String key, CacheEntry value, long currentTime, long currentDuration) {
            return value.getTtlNanos();
        }

        @Override
        public long expireAfterRead(String key, CacheEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
