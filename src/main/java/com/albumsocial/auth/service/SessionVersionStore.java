package com.albumsocial.auth.service;

import com.albumsocial.common.cache.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 每个用户一个会话版本号。token 里的 sv 与当前版本不一致即视为失效，
 * 所以 bump 一次就能让该用户所有已签发的 accessToken 失效。
 */
@Slf4j
@Component
public class SessionVersionStore {

    private static final String KEY_PREFIX = "albumsocial:auth:sv:";
    private static final Duration DEFAULT_TTL = Duration.ofDays(90);

    private final KeyValueStore store;

    public SessionVersionStore(KeyValueStore store) {
        this.store = store;
    }

    public long bump(long userId) {
        if (userId <= 0) {
            return 0;
        }
        return store.increment(key(userId), DEFAULT_TTL);
    }

    /**
     * 注销账号时调用。失败直接抛出，由调用方决定是否容忍。
     *
     * <p>Redis 不可用时 bump 只落在本进程的兜底存储里，Redis 恢复后旧 sv 会重新有效；
     * 注销场景下用户行已删除，旧 token 只剩读接口可用。</p>
     */
    public void invalidateAll(long userId) {
        long v = bump(userId);
        log.info("sessions invalidated: userId={}, sv={}", userId, v);
    }

    public long current(long userId) {
        if (userId <= 0) {
            return 0;
        }
        String raw = store.get(key(userId));
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("corrupted sessionVersion, treat as 0: userId={}, raw={}", userId, raw);
            return 0;
        }
    }

    public boolean isValid(long userId, long tokenSv) {
        if (userId <= 0) {
            return false;
        }
        return current(userId) == tokenSv;
    }

    private String key(long userId) {
        return KEY_PREFIX + userId;
    }
}
