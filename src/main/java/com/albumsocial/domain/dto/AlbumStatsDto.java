package com.albumsocial.domain.dto;

public record AlbumStatsDto(Long albumId, double averageRating, long ratingCount, long reviewCount) {
}
