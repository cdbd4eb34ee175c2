package com.albumsocial.domain.dto;

public record UserProfileWithStats(UserProfileDto user, long followerCount, long followingCount) {
}
