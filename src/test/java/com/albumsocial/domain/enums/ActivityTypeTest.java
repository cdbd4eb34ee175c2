package com.albumsocial.domain.enums;

import com.albumsocial.common.error.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActivityTypeTest {

    @Test
    void parse_ShouldAcceptExactCodes() {
        assertThat(ActivityType.parse("rating")).isEqualTo(ActivityType.RATING);
        assertThat(ActivityType.parse("review")).isEqualTo(ActivityType.REVIEW);
    }

    @Test
    void parse_ShouldRejectAnythingElse() {
        for (String bad : new String[]{null, "", "Rating", "follow", " review"}) {
            assertThatThrownBy(() -> ActivityType.parse(bad))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Activity type must be either \"rating\" or \"review\"");
        }
    }
}
