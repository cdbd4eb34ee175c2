package com.albumsocial.domain.dto;

import com.albumsocial.domain.entity.ReviewEntity;
import com.albumsocial.domain.model.Ownership;

import java.time.LocalDateTime;

public record ReviewDto(
        Long id,
        Ownership ownership,
        Long albumId,
        String content,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {

    public static ReviewDto from(ReviewEntity e) {
        return new ReviewDto(e.getId(), e.ownership(), e.getAlbumId(), e.getContent(), e.getCreatedAt(), e.getUpdatedAt());
    }
}
