package com.albumsocial.common.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;

/**
 * 进程内实现，基于 Caffeine 的逐条过期。用于 Redis 不可用时的降级，以及单机/测试环境。
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private record Entry(String value, long ttlNanos) {
    }

    private final Cache<String, Entry> cache;

    public InMemoryKeyValueStore(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    InMemoryKeyValueStore(long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(Math.max(1, maximumSize))
                .ticker(ticker)
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(String key, Entry value, long currentTime) {
                        return value.ttlNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
                        return value.ttlNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    @Override
    public String get(String key) {
        if (key == null) {
            return null;
        }
        Entry e = cache.getIfPresent(key);
        return e == null ? null : e.value();
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (key == null || value == null) {
            return;
        }
        cache.put(key, new Entry(value, toNanos(ttl)));
    }

    @Override
    public boolean delete(String key) {
        if (key == null) {
            return false;
        }
        return cache.asMap().remove(key) != null;
    }

    @Override
    public boolean exists(String key) {
        return get(key) != null;
    }

    @Override
    public long increment(String key, Duration ttl) {
        long ttlNanos = toNanos(ttl);
        Entry updated = cache.asMap().compute(key, (k, old) -> {
            long base = 0;
            if (old != null) {
                try {
                    base = Long.parseLong(old.value().trim());
                } catch (NumberFormatException e) {
                    throw new IllegalStateException("value is not an integer: key=" + k, e);
                }
            }
            return new Entry(Long.toString(base + 1), ttlNanos);
        });
        return Long.parseLong(updated.value());
    }

    private static long toNanos(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return Long.MAX_VALUE;
        }
        return ttl.toNanos();
    }
}
