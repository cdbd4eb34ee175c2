package com.albumsocial.common.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * KeyValueStore 之上的 JSON 读写。缓存读写失败一律当作未命中，不影响主流程。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonCache {

    private static final Duration DEFAULT_TTL = Duration.ofSeconds(60);

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;

    public <T> T get(String key, Class<T> type) {
        if (key == null || key.isBlank() || type == null) {
            return null;
        }
        try {
            String raw = store.get(key);
            if (raw == null || raw.isBlank()) {
                return null;
            }
            return objectMapper.readValue(raw, type);
        } catch (Exception e) {
            log.debug("json cache get failed: key={}, err={}", key, e.toString());
            return null;
        }
    }

    public void set(String key, Object value, Duration ttl) {
        if (key == null || key.isBlank() || value == null) {
            return;
        }
        Duration effective = ttl == null || ttl.toSeconds() <= 0 ? DEFAULT_TTL : ttl;
        try {
            store.set(key, objectMapper.writeValueAsString(value), effective);
        } catch (Exception e) {
            log.debug("json cache set failed: key={}, err={}", key, e.toString());
        }
    }

    public void delete(String key) {
        if (key == null || key.isBlank()) {
            return;
        }
        try {
            store.delete(key);
        } catch (Exception e) {
            log.debug("json cache delete failed: key={}, err={}", key, e.toString());
        }
    }
}
