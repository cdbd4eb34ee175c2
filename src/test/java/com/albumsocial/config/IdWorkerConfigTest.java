package com.albumsocial.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IdWorkerConfigTest {

    @Test
    void explicitWorkerId_ShouldWin() {
        long[] ids = new IdWorkerConfig(1, 7, "api-3").resolveIds();
        assertThat(ids).containsExactly(7L, 1L);
    }

    @Test
    void workerId_ShouldBeDerivedFromInstanceSuffix() {
        long[] ids = new IdWorkerConfig(2, -1, "api-3").resolveIds();
        assertThat(ids).containsExactly(2L, 2L);
    }

    @Test
    void noWorkerIdAndNoNumericInstance_ShouldKeepDefault() {
        assertThat(new IdWorkerConfig(1, -1, "").resolveIds()).isNull();
        assertThat(new IdWorkerConfig(1, -1, "api").resolveIds()).isNull();
    }

    @Test
    void idsOutOfRange_ShouldWrapIntoFiveBits() {
        long[] ids = new IdWorkerConfig(33, 40, null).resolveIds();
        assertThat(ids).containsExactly(8L, 1L);
    }
}
