package com.albumsocial.domain.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OwnershipTest {

    @Test
    void nullColumn_ShouldMapToAnonymized() {
        Ownership o = Ownership.of(null);
        assertThat(o.isAnonymized()).isTrue();
        assertThat(o.owner()).isEmpty();
        assertThat(o.isOwnedBy(1)).isFalse();
    }

    @Test
    void owned_ShouldOnlyMatchItsOwner() {
        Ownership o = Ownership.of(7L);
        assertThat(o.state()).isEqualTo(Ownership.State.OWNED);
        assertThat(o.isOwnedBy(7)).isTrue();
        assertThat(o.isOwnedBy(8)).isFalse();
        assertThat(o.owner()).contains(7L);
    }

    @Test
    void inconsistentStates_ShouldBeRejected() {
        assertThatThrownBy(() -> new Ownership(Ownership.State.OWNED, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Ownership(Ownership.State.ANONYMIZED, 3L)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Ownership.owned(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
