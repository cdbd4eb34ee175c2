package com.albumsocial.domain.cache;

import com.albumsocial.common.cache.CacheProperties;
import com.albumsocial.common.cache.JsonCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 用户关注的人的 id 集合（只存 id）。feed 每次请求都要用，走缓存；关注关系变化时失效。
 */
@Slf4j
@Component
public class FollowingIdsCache {

    private static final String KEY_PREFIX = "albumsocial:cache:following:ids:";

    private final CacheProperties props;
    private final JsonCache cache;

    public FollowingIdsCache(CacheProperties props, JsonCache cache) {
        this.props = props;
        this.cache = cache;
    }

    /**
     * @return null 表示未命中（或缓存关闭），空集合表示确实没有关注任何人
     */
    public Set<Long> get(long userId) {
        if (!props.isEnabled() || userId <= 0) {
            return null;
        }
        Value v = cache.get(key(userId), Value.class);
        if (v == null) {
            return null;
        }
        if (v.ids == null || v.ids.isEmpty()) {
            return Set.of();
        }
        Set<Long> out = new HashSet<>();
        for (Long id : v.ids) {
            if (id != null && id > 0) {
                out.add(id);
            }
        }
        return out;
    }

    public void put(long userId, Collection<Long> followingIds) {
        if (!props.isEnabled() || userId <= 0 || followingIds == null) {
            return;
        }
        List<Long> ids = new ArrayList<>();
        for (Long id : followingIds) {
            if (id != null && id > 0) {
                ids.add(id);
            }
        }
        cache.set(key(userId), new Value(ids.stream().distinct().toList()),
                Duration.ofSeconds(Math.max(1, props.getFollowingIdsTtlSeconds())));
    }

    public void evict(long userId) {
        if (!props.isEnabled() || userId <= 0) {
            return;
        }
        cache.delete(key(userId));
    }

    /**
     * 在事务内调用时推迟到提交之后再失效，避免并发读在提交前把旧集合重新写回缓存。
     */
    public void evictAfterCommit(Collection<Long> userIds) {
        if (userIds == null || userIds.isEmpty()) {
            return;
        }
        List<Long> snapshot = List.copyOf(userIds);
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            snapshot.forEach(this::evict);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                snapshot.forEach(FollowingIdsCache.this::evict);
            }
        });
        log.debug("following ids eviction scheduled after commit: userIds={}", snapshot);
    }

    private String key(long userId) {
        return KEY_PREFIX + userId;
    }

    public static class Value {
        public List<Long> ids;

        public Value() {
        }

        public Value(List<Long> ids) {
            this.ids = ids;
        }
    }
}
