package com.albumsocial.domain.dto;

import com.albumsocial.domain.entity.FollowEntity;

import java.time.LocalDateTime;

public record FollowDto(Long id, Long followerId, Long followeeId, LocalDateTime createdAt) {

    public static FollowDto from(FollowEntity e) {
        return new FollowDto(e.getId(), e.getFollowerId(), e.getFolloweeId(), e.getCreatedAt());
    }
}
