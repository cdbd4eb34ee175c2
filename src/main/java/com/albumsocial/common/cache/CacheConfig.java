package com.albumsocial.common.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Locale;

/**
 * 启动时选定 KeyValueStore 实现，之后作为普通 bean 注入，不再切换。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(CacheProperties.class)
public class CacheConfig {

    @Bean
    public KeyValueStore keyValueStore(CacheProperties props, ObjectProvider<StringRedisTemplate> redisProvider) {
        return createKeyValueStore(props, redisProvider.getIfAvailable());
    }

    static KeyValueStore createKeyValueStore(CacheProperties props, StringRedisTemplate redis) {
        InMemoryKeyValueStore memory = new InMemoryKeyValueStore(props.getMemoryMaximumSize());
        String mode = props.getStore() == null ? "auto" : props.getStore().trim().toLowerCase(Locale.ROOT);
        switch (mode) {
            case "memory":
                log.info("KeyValueStore: in-memory (configured)");
                return memory;
            case "redis":
                if (redis == null) {
                    throw new IllegalStateException("albumsocial.cache.store=redis but no StringRedisTemplate is configured");
                }
                log.info("KeyValueStore: redis (configured)");
                return new RedisKeyValueStore(redis, memory, props.getRedisFailFastMillis());
            case "auto":
                if (redis != null && ping(redis)) {
                    log.info("KeyValueStore: redis (reachable)");
                    return new RedisKeyValueStore(redis, memory, props.getRedisFailFastMillis());
                }
                log.warn("KeyValueStore: redis unreachable, using in-memory store");
                return memory;
            default:
                throw new IllegalStateException("unknown albumsocial.cache.store: " + props.getStore());
        }
    }

    static boolean ping(StringRedisTemplate redis) {
        try (RedisConnection connection = redis.getRequiredConnectionFactory().getConnection()) {
            return connection.ping() != null;
        } catch (RuntimeException e) {
            log.debug("redis ping failed: err={}", e.toString());
            return false;
        }
    }
}
