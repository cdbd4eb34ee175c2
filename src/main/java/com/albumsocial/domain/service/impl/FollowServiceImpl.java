package com.albumsocial.domain.service.impl;

import com.albumsocial.common.error.AlreadyFollowingException;
import com.albumsocial.common.error.NotFollowingException;
import com.albumsocial.common.error.NotFoundException;
import com.albumsocial.common.error.SelfFollowException;
import com.albumsocial.common.page.PageQuery;
import com.albumsocial.common.time.DbTime;
import com.albumsocial.domain.cache.FollowingIdsCache;
import com.albumsocial.domain.dto.FollowDto;
import com.albumsocial.domain.dto.UserProfileDto;
import com.albumsocial.domain.dto.UserProfileWithStats;
import com.albumsocial.domain.entity.FollowEntity;
import com.albumsocial.domain.entity.UserEntity;
import com.albumsocial.domain.mapper.FollowMapper;
import com.albumsocial.domain.mapper.UserMapper;
import com.albumsocial.domain.service.FollowService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
public class FollowServiceImpl implements FollowService {

    private final FollowMapper followMapper;
    private final UserMapper userMapper;
    private final FollowingIdsCache followingIdsCache;

    public FollowServiceImpl(FollowMapper followMapper, UserMapper userMapper, FollowingIdsCache followingIdsCache) {
        this.followMapper = followMapper;
        this.userMapper = userMapper;
        this.followingIdsCache = followingIdsCache;
    }

    /**
     * 重复关注由 (follower_id, followee_id) 唯一键兜底：并发的两次 follow 只有一次插入成功。
     */
    @Transactional
    @Override
    public FollowDto follow(long followerId, long followeeId) {
        if (followerId == followeeId) {
            throw new SelfFollowException();
        }
        requireUser(followerId);
        requireUser(followeeId);

        FollowEntity edge = FollowEntity.builder()
                .followerId(followerId)
                .followeeId(followeeId)
                .createdAt(DbTime.now())
                .build();
        try {
            followMapper.insert(edge);
        } catch (DuplicateKeyException e) {
            throw new AlreadyFollowingException();
        }
        followingIdsCache.evictAfterCommit(List.of(followerId));
        log.debug("follow: followerId={}, followeeId={}", followerId, followeeId);
        return FollowDto.from(edge);
    }

    @Transactional
    @Override
    public void unfollow(long followerId, long followeeId) {
        int deleted = followMapper.deleteEdge(followerId, followeeId);
        if (deleted == 0) {
            throw new NotFollowingException();
        }
        followingIdsCache.evictAfterCommit(List.of(followerId));
        log.debug("unfollow: followerId={}, followeeId={}", followerId, followeeId);
    }

    @Override
    public boolean isFollowing(long followerId, long followeeId) {
        if (followerId == followeeId || followerId <= 0 || followeeId <= 0) {
            return false;
        }
        return followMapper.countEdge(followerId, followeeId) > 0;
    }

    @Override
    public Map<Long, Boolean> isFollowingMultiple(long followerId, List<Long> ids) {
        Map<Long, Boolean> out = new LinkedHashMap<>();
        if (ids == null || ids.isEmpty()) {
            return out;
        }
        List<Long> candidates = ids.stream()
                .filter(id -> id != null && id > 0 && id != followerId)
                .distinct()
                .toList();
        Set<Long> followed = candidates.isEmpty()
                ? Set.of()
                : new HashSet<>(followMapper.selectFollowedAmong(followerId, candidates));
        for (Long id : ids) {
            if (id != null) {
                out.put(id, followed.contains(id));
            }
        }
        return out;
    }

    @Override
    public List<UserProfileDto> getFollowers(long userId) {
        requireUser(userId);
        return toProfiles(followMapper.selectFollowers(userId));
    }

    @Override
    public List<UserProfileDto> getFollowing(long userId) {
        requireUser(userId);
        return toProfiles(followMapper.selectFollowing(userId));
    }

    @Override
    public long getFollowerCount(long userId) {
        return followMapper.countFollowers(userId);
    }

    @Override
    public long getFollowingCount(long userId) {
        return followMapper.countFollowing(userId);
    }

    @Override
    public List<UserProfileDto> getMutualFollows(long userId) {
        requireUser(userId);
        return toProfiles(followMapper.selectMutual(userId));
    }

    @Override
    public List<UserProfileDto> getFollowSuggestions(long userId, int limit) {
        PageQuery.checkLimit(limit);
        requireUser(userId);
        return toProfiles(userMapper.selectFollowSuggestions(userId, limit));
    }

    @Override
    public UserProfileWithStats getUserProfileWithStats(long userId) {
        UserEntity u = userId <= 0 ? null : userMapper.selectById(userId);
        if (u == null) {
            throw NotFoundException.user();
        }
        return new UserProfileWithStats(UserProfileDto.from(u),
                followMapper.countFollowers(userId),
                followMapper.countFollowing(userId));
    }

    @Override
    public Set<Long> followingIdSet(long userId) {
        if (userId <= 0) {
            return Set.of();
        }
        Set<Long> cached = followingIdsCache.get(userId);
        if (cached != null) {
            return cached;
        }
        List<Long> ids = followMapper.selectFollowingIds(userId);
        Set<Long> out = ids == null ? Set.of() : new HashSet<>(ids);
        followingIdsCache.put(userId, out);
        return out;
    }

    private void requireUser(long userId) {
        if (userId <= 0 || userMapper.countById(userId) == 0) {
            throw NotFoundException.user();
        }
    }

    private static List<UserProfileDto> toProfiles(List<UserEntity> users) {
        if (users == null || users.isEmpty()) {
            return List.of();
        }
        return users.stream().map(UserProfileDto::from).toList();
    }
}
