package com.albumsocial.domain.dto;

import com.albumsocial.domain.model.Ownership;

import java.time.LocalDateTime;

/**
 * @param actor 发起人资料；已匿名化时为 null
 * @param album 专辑摘要；目录里查不到时为 null
 */
public record ActivityDto(
        Long id,
        String type,
        Ownership ownership,
        UserProfileDto actor,
        Long albumId,
        AlbumDto album,
        ActivityPayload payload,
        LocalDateTime createdAt
) {
}
