package com.albumsocial.domain.dto;

import com.albumsocial.domain.entity.RatingEntity;
import com.albumsocial.domain.model.Ownership;

import java.time.LocalDateTime;

public record RatingDto(
        Long id,
        Ownership ownership,
        Long albumId,
        int rating,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {

    public static RatingDto from(RatingEntity e) {
        return new RatingDto(e.getId(), e.ownership(), e.getAlbumId(), e.getRating(), e.getCreatedAt(), e.getUpdatedAt());
    }
}
