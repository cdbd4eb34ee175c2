package com.albumsocial.domain.service;

import com.albumsocial.domain.dto.FollowDto;
import com.albumsocial.domain.dto.UserProfileDto;
import com.albumsocial.domain.dto.UserProfileWithStats;

import java.util.List;
import java.util.Map;
import java.util.Set;

public interface FollowService {

    FollowDto follow(long followerId, long followeeId);

    void unfollow(long followerId, long followeeId);

    boolean isFollowing(long followerId, long followeeId);

    /**
     * 批量判断 followerId 是否关注了 ids 中的每个人。
     */
    Map<Long, Boolean> isFollowingMultiple(long followerId, List<Long> ids);

    List<UserProfileDto> getFollowers(long userId);

    List<UserProfileDto> getFollowing(long userId);

    long getFollowerCount(long userId);

    long getFollowingCount(long userId);

    List<UserProfileDto> getMutualFollows(long userId);

    List<UserProfileDto> getFollowSuggestions(long userId, int limit);

    UserProfileWithStats getUserProfileWithStats(long userId);

    /**
     * 关注的人的 id 集合，优先读缓存。feed 用。
     */
    Set<Long> followingIdSet(long userId);
}
