package com.albumsocial.common.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "albumsocial.cache")
public class CacheProperties {

    /** 关闭后 FollowingIdsCache 等读穿缓存全部直连数据库；会话存储不受影响。 */
    private boolean enabled = true;

    /** auto：启动时 ping Redis，不通则用进程内存储；redis：强制 Redis；memory：强制进程内。 */
    private String store = "auto";

    private long followingIdsTtlSeconds = 1800;

    private long memoryMaximumSize = 100_000;

    private long redisFailFastMillis = 10_000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public long getFollowingIdsTtlSeconds() {
        return followingIdsTtlSeconds;
    }

    public void setFollowingIdsTtlSeconds(long followingIdsTtlSeconds) {
        this.followingIdsTtlSeconds = followingIdsTtlSeconds;
    }

    public long getMemoryMaximumSize() {
        return memoryMaximumSize;
    }

    public void setMemoryMaximumSize(long memoryMaximumSize) {
        this.memoryMaximumSize = memoryMaximumSize;
    }

    public long getRedisFailFastMillis() {
        return redisFailFastMillis;
    }

    public void setRedisFailFastMillis(long redisFailFastMillis) {
        this.redisFailFastMillis = redisFailFastMillis;
    }
}
