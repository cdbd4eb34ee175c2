package com.albumsocial.domain.service;

import com.albumsocial.domain.dto.ActivityDto;
import com.albumsocial.domain.dto.FeedPage;

import java.util.List;

public interface ActivityFeedService {

    /**
     * 关注的人的动态。没有关注任何人时直接返回空列表，不查动态表。
     */
    List<ActivityDto> getFeed(long userId, int limit, int offset);

    FeedPage getFeedWithPagination(long userId, int page, int limit);

    List<ActivityDto> getUserFeed(long userId, int limit, int offset);

    FeedPage getUserActivitiesWithPagination(long userId, int page, int limit);

    List<ActivityDto> getRecentActivities(int limit, int offset);

    List<ActivityDto> getActivitiesByType(String type, int limit, int offset);

    long getUserActivityCount(long userId);

    boolean hasUserActivities(long userId);
}
