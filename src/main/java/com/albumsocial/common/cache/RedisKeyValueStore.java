package com.albumsocial.common.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Redis 实现。
 *
 * <p>Redis 出错后进入 fail-fast 窗口：窗口内所有读写直接走进程内 fallback，避免每次调用都卡在连接超时上。
 * 窗口结束后重新尝试 Redis。降级期间写入 fallback 的数据不会回灌 Redis。</p>
 */
@Slf4j
public class RedisKeyValueStore implements KeyValueStore {

    private final StringRedisTemplate redis;
    private final KeyValueStore fallback;
    private final long failFastMillis;
    private final AtomicLong unavailableUntilMs = new AtomicLong(0);

    public RedisKeyValueStore(StringRedisTemplate redis, KeyValueStore fallback, long failFastMillis) {
        this.redis = redis;
        this.fallback = fallback;
        this.failFastMillis = Math.max(0, failFastMillis);
    }

    @Override
    public String get(String key) {
        if (key == null || key.isBlank()) {
            return null;
        }
        if (shouldFailFast()) {
            return fallback.get(key);
        }
        try {
            return redis.opsForValue().get(key);
        } catch (RuntimeException e) {
            markDown("get", key, e);
            return fallback.get(key);
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (key == null || key.isBlank() || value == null) {
            return;
        }
        if (shouldFailFast()) {
            fallback.set(key, value, ttl);
            return;
        }
        try {
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                redis.opsForValue().set(key, value);
            } else {
                redis.opsForValue().set(key, value, ttl);
            }
        } catch (RuntimeException e) {
            markDown("set", key, e);
            fallback.set(key, value, ttl);
        }
    }

    @Override
    public boolean delete(String key) {
        if (key == null || key.isBlank()) {
            return false;
        }
        // 降级期间可能写进了 fallback，两边都删
        boolean local = fallback.delete(key);
        if (shouldFailFast()) {
            return local;
        }
        try {
            return Boolean.TRUE.equals(redis.delete(key)) || local;
        } catch (RuntimeException e) {
            markDown("delete", key, e);
            return local;
        }
    }

    @Override
    public boolean exists(String key) {
        if (key == null || key.isBlank()) {
            return false;
        }
        if (shouldFailFast()) {
            return fallback.exists(key);
        }
        try {
            return Boolean.TRUE.equals(redis.hasKey(key));
        } catch (RuntimeException e) {
            markDown("exists", key, e);
            return fallback.exists(key);
        }
    }

    @Override
    public long increment(String key, Duration ttl) {
        if (shouldFailFast()) {
            return fallback.increment(key, ttl);
        }
        try {
            Long v = redis.opsForValue().increment(key);
            if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
                redis.expire(key, ttl);
            }
            return v == null ? 0 : v;
        } catch (RuntimeException e) {
            markDown("increment", key, e);
            return fallback.increment(key, ttl);
        }
    }

    boolean isFailingFast() {
        return shouldFailFast();
    }

    private boolean shouldFailFast() {
        return System.currentTimeMillis() < unavailableUntilMs.get();
    }

    private void markDown(String op, String key, RuntimeException e) {
        log.warn("redis {} failed, fall back to in-memory store for {}ms: key={}, err={}", op, failFastMillis, key, e.toString());
        long until = System.currentTimeMillis() + failFastMillis;
        while (true) {
            long prev = unavailableUntilMs.get();
            if (prev >= until) {
                return;
            }
            if (unavailableUntilMs.compareAndSet(prev, until)) {
                return;
            }
        }
    }
}
