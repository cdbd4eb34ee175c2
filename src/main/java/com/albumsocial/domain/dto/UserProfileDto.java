package com.albumsocial.domain.dto;

import com.albumsocial.domain.entity.UserEntity;

import java.time.LocalDateTime;

/**
 * 对外公开的用户资料，不含邮箱和凭证。
 */
public record UserProfileDto(
        Long id,
        String username,
        String displayName,
        String bio,
        String avatarUrl,
        LocalDateTime createdAt
) {

    public static UserProfileDto from(UserEntity u) {
        if (u == null) {
            return null;
        }
        return new UserProfileDto(u.getId(), u.getUsername(), u.getDisplayName(), u.getBio(), u.getAvatarUrl(), u.getCreatedAt());
    }
}
