package com.albumsocial.domain.controller;

import com.albumsocial.common.api.Result;
import com.albumsocial.domain.service.ActivityFeedService;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FeedControllerTest {

    @Test
    void summary_ShouldTakeExistenceFromService() {
        ActivityFeedService feedService = mock(ActivityFeedService.class);
        when(feedService.getUserActivityCount(5L)).thenReturn(3L);
        when(feedService.hasUserActivities(5L)).thenReturn(true);

        Result<FeedController.ActivitySummaryResponse> r = new FeedController(feedService).summary(5L);

        assertThat(r.ok()).isTrue();
        assertThat(r.data().count()).isEqualTo(3L);
        assertThat(r.data().hasActivities()).isTrue();
        verify(feedService).hasUserActivities(5L);
    }

    @Test
    void summary_NoActivities_ShouldReportEmpty() {
        ActivityFeedService feedService = mock(ActivityFeedService.class);

        Result<FeedController.ActivitySummaryResponse> r = new FeedController(feedService).summary(6L);

        assertThat(r.data().count()).isZero();
        assertThat(r.data().hasActivities()).isFalse();
    }
}
