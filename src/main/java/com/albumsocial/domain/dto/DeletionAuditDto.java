package com.albumsocial.domain.dto;

import com.albumsocial.domain.entity.AccountDeletionAuditEntity;

import java.time.LocalDateTime;

public record DeletionAuditDto(
        Long id,
        Long userId,
        LocalDateTime deletedAt,
        int ratingsCount,
        int reviewsCount,
        int followsCount
) {

    public static DeletionAuditDto from(AccountDeletionAuditEntity e) {
        return new DeletionAuditDto(e.getId(), e.getUserId(), e.getDeletedAt(),
                e.getRatingsCount(), e.getReviewsCount(), e.getFollowsCount());
    }
}
