package com.albumsocial.common.cache;

import java.time.Duration;

/**
 * 会话/缓存用的键值存储。Redis 与进程内实现语义一致：
 * ttl 为 null 或非正数表示不过期；过期后 get 返回 null、exists 返回 false。
 */
public interface KeyValueStore {

    String get(String key);

    void set(String key, String value, Duration ttl);

    boolean delete(String key);

    boolean exists(String key);

    /**
     * 原子自增并刷新 ttl，key 不存在时从 0 开始。
     */
    long increment(String key, Duration ttl);
}
