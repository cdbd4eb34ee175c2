package com.albumsocial.domain.service.impl;

import com.albumsocial.common.page.PageQuery;
import com.albumsocial.common.page.Pagination;
import com.albumsocial.domain.dto.ActivityDto;
import com.albumsocial.domain.dto.ActivityPayload;
import com.albumsocial.domain.dto.AlbumDto;
import com.albumsocial.domain.dto.FeedPage;
import com.albumsocial.domain.dto.UserProfileDto;
import com.albumsocial.domain.entity.ActivityEntity;
import com.albumsocial.domain.entity.AlbumEntity;
import com.albumsocial.domain.entity.UserEntity;
import com.albumsocial.domain.enums.ActivityType;
import com.albumsocial.domain.mapper.ActivityMapper;
import com.albumsocial.domain.mapper.AlbumMapper;
import com.albumsocial.domain.mapper.UserMapper;
import com.albumsocial.domain.service.ActivityFeedService;
import com.albumsocial.domain.service.FollowService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

@Slf4j
@Service
public class ActivityFeedServiceImpl implements ActivityFeedService {

    private final FollowService followService;
    private final ActivityMapper activityMapper;
    private final UserMapper userMapper;
    private final AlbumMapper albumMapper;
    private final ObjectMapper objectMapper;

    public ActivityFeedServiceImpl(
            FollowService followService,
            ActivityMapper activityMapper,
            UserMapper userMapper,
            AlbumMapper albumMapper,
            ObjectMapper objectMapper
    ) {
        this.followService = followService;
        this.activityMapper = activityMapper;
        this.userMapper = userMapper;
        this.albumMapper = albumMapper;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ActivityDto> getFeed(long userId, int limit, int offset) {
        PageQuery q = PageQuery.of(limit, offset);
        List<Long> followees = followees(userId);
        if (followees.isEmpty()) {
            return List.of();
        }
        return toDtos(activityMapper.selectByUserIds(followees, q.limit(), q.offset()));
    }

    @Override
    public FeedPage getFeedWithPagination(long userId, int page, int limit) {
        PageQuery q = PageQuery.ofPage(page, limit);
        List<Long> followees = followees(userId);
        if (followees.isEmpty()) {
            return new FeedPage(List.of(), Pagination.empty(q));
        }
        long total = activityMapper.countByUserIds(followees);
        List<ActivityEntity> rows = total == 0
                ? List.of()
                : activityMapper.selectByUserIds(followees, q.limit(), q.offset());
        return new FeedPage(toDtos(rows), Pagination.of(q, total));
    }

    @Override
    public List<ActivityDto> getUserFeed(long userId, int limit, int offset) {
        PageQuery q = PageQuery.of(limit, offset);
        return toDtos(activityMapper.selectByUser(userId, q.limit(), q.offset()));
    }

    @Override
    public FeedPage getUserActivitiesWithPagination(long userId, int page, int limit) {
        PageQuery q = PageQuery.ofPage(page, limit);
        long total = activityMapper.countByUser(userId);
        List<ActivityEntity> rows = total == 0
                ? List.of()
                : activityMapper.selectByUser(userId, q.limit(), q.offset());
        return new FeedPage(toDtos(rows), Pagination.of(q, total));
    }

    @Override
    public List<ActivityDto> getRecentActivities(int limit, int offset) {
        PageQuery q = PageQuery.of(limit, offset);
        return toDtos(activityMapper.selectRecent(null, q.limit(), q.offset()));
    }

    @Override
    public List<ActivityDto> getActivitiesByType(String type, int limit, int offset) {
        ActivityType t = ActivityType.parse(type);
        PageQuery q = PageQuery.of(limit, offset);
        return toDtos(activityMapper.selectRecent(t.code(), q.limit(), q.offset()));
    }

    @Override
    public long getUserActivityCount(long userId) {
        return activityMapper.countByUser(userId);
    }

    @Override
    public boolean hasUserActivities(long userId) {
        return getUserActivityCount(userId) > 0;
    }

    private List<Long> followees(long userId) {
        Set<Long> ids = followService.followingIdSet(userId);
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        // 排序只为让 SQL 文本稳定
        List<Long> out = new ArrayList<>(ids);
        out.sort(null);
        return out;
    }

    private List<ActivityDto> toDtos(List<ActivityEntity> rows) {
        if (rows == null || rows.isEmpty()) {
            return List.of();
        }
        Map<Long, UserProfileDto> actors = loadActors(rows);
        Map<Long, AlbumDto> albums = loadAlbums(rows);

        List<ActivityDto> out = new ArrayList<>(rows.size());
        for (ActivityEntity a : rows) {
            out.add(new ActivityDto(
                    a.getId(),
                    a.getType(),
                    a.ownership(),
                    a.ownership().owner().map(actors::get).orElse(null),
                    a.getAlbumId(),
                    albums.get(a.getAlbumId()),
                    parsePayload(a),
                    a.getCreatedAt()
            ));
        }
        return out;
    }

    private Map<Long, UserProfileDto> loadActors(List<ActivityEntity> rows) {
        List<Long> ids = rows.stream().map(ActivityEntity::getUserId).filter(Objects::nonNull).distinct().toList();
        Map<Long, UserProfileDto> out = new HashMap<>();
        if (ids.isEmpty()) {
            return out;
        }
        List<UserEntity> users = userMapper.selectBatchIds(ids);
        if (users != null) {
            for (UserEntity u : users) {
                out.put(u.getId(), UserProfileDto.from(u));
            }
        }
        return out;
    }

    private Map<Long, AlbumDto> loadAlbums(List<ActivityEntity> rows) {
        List<Long> ids = rows.stream().map(ActivityEntity::getAlbumId).filter(Objects::nonNull).distinct().toList();
        Map<Long, AlbumDto> out = new HashMap<>();
        if (ids.isEmpty()) {
            return out;
        }
        List<AlbumEntity> albums = albumMapper.selectBatchIds(ids);
        if (albums != null) {
            for (AlbumEntity al : albums) {
                out.put(al.getId(), AlbumDto.from(al));
            }
        }
        return out;
    }

    private ActivityPayload parsePayload(ActivityEntity a) {
        if (a.getPayload() == null || a.getPayload().isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(a.getPayload(), ActivityPayload.class);
        } catch (JsonProcessingException e) {
            log.warn("bad activity payload, render without it: activityId={}, err={}", a.getId(), e.toString());
            return null;
        }
    }
}
