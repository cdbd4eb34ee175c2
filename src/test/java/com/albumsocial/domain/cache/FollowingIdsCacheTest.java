package com.albumsocial.domain.cache;

import com.albumsocial.common.cache.CacheProperties;
import com.albumsocial.common.cache.InMemoryKeyValueStore;
import com.albumsocial.common.cache.JsonCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class FollowingIdsCacheTest {

    @Test
    void get_ShouldReturnNull_WhenCacheDisabled() {
        CacheProperties props = new CacheProperties();
        props.setEnabled(false);
        JsonCache jsonCache = mock(JsonCache.class);
        FollowingIdsCache cache = new FollowingIdsCache(props, jsonCache);

        assertNull(cache.get(1));
        cache.put(1, List.of(2L));
        verifyNoInteractions(jsonCache);
    }

    @Test
    void get_ShouldReturnEmptySet_WhenCachedEmpty() {
        JsonCache jsonCache = mock(JsonCache.class);
        when(jsonCache.get(anyString(), any())).thenReturn(new FollowingIdsCache.Value(List.of()));

        FollowingIdsCache cache = new FollowingIdsCache(new CacheProperties(), jsonCache);
        assertEquals(Set.of(), cache.get(100));
    }

    @Test
    void get_ShouldDropInvalidIds() {
        JsonCache jsonCache = mock(JsonCache.class);
        when(jsonCache.get(anyString(), any())).thenReturn(new FollowingIdsCache.Value(List.of(1L, 2L, 2L, -1L, 0L)));

        FollowingIdsCache cache = new FollowingIdsCache(new CacheProperties(), jsonCache);
        assertEquals(Set.of(1L, 2L), cache.get(100));
    }

    @Test
    void putGetEvict_OverInMemoryStore() {
        JsonCache jsonCache = new JsonCache(new InMemoryKeyValueStore(100), new ObjectMapper());
        FollowingIdsCache cache = new FollowingIdsCache(new CacheProperties(), jsonCache);

        cache.put(5, List.of(3L, 4L, 4L));
        assertEquals(Set.of(3L, 4L), cache.get(5));

        cache.evictAfterCommit(List.of(5L));
        assertNull(cache.get(5));
    }
}
