package com.albumsocial.common.cache;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryKeyValueStoreTest {

    private final AtomicLong nanos = new AtomicLong(0);
    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore(1000, nanos::get);

    @Test
    void setGetDeleteExists() {
        store.set("k", "v", Duration.ofSeconds(10));
        assertThat(store.get("k")).isEqualTo("v");
        assertThat(store.exists("k")).isTrue();

        assertThat(store.delete("k")).isTrue();
        assertThat(store.get("k")).isNull();
        assertThat(store.exists("k")).isFalse();
        assertThat(store.delete("k")).isFalse();
    }

    @Test
    void entry_ShouldExpireAfterTtl() {
        store.set("k", "v", Duration.ofSeconds(10));

        nanos.addAndGet(Duration.ofSeconds(9).toNanos());
        assertThat(store.get("k")).isEqualTo("v");

        nanos.addAndGet(Duration.ofSeconds(2).toNanos());
        assertThat(store.get("k")).isNull();
        assertThat(store.exists("k")).isFalse();
    }

    @Test
    void nullTtl_ShouldNeverExpire() {
        store.set("k", "v", null);
        nanos.addAndGet(Duration.ofDays(365).toNanos());
        assertThat(store.get("k")).isEqualTo("v");
    }

    @Test
    void increment_ShouldStartFromZeroAndRestartAfterExpiry() {
        assertThat(store.increment("c", Duration.ofSeconds(5))).isEqualTo(1);
        assertThat(store.increment("c", Duration.ofSeconds(5))).isEqualTo(2);
        assertThat(store.get("c")).isEqualTo("2");

        nanos.addAndGet(Duration.ofSeconds(6).toNanos());
        assertThat(store.increment("c", Duration.ofSeconds(5))).isEqualTo(1);
    }

    @Test
    void increment_ShouldRejectNonNumericValue() {
        store.set("c", "abc", null);
        assertThatThrownBy(() -> store.increment("c", null)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void nullKeyOrValue_ShouldBeIgnored() {
        store.set(null, "v", null);
        store.set("k", null, null);
        assertThat(store.get(null)).isNull();
        assertThat(store.exists("k")).isFalse();
    }
}
