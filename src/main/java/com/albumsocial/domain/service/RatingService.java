package com.albumsocial.domain.service;

import com.albumsocial.domain.dto.AlbumStatsDto;
import com.albumsocial.domain.dto.RatingDto;

import java.util.List;
import java.util.Optional;

public interface RatingService {

    /**
     * 没有则新建，有则原地更新（id、createdAt 不变，updatedAt 前进）。
     *
     * @param rating 必须是 1-5 的整数，4.0 这类整值浮点数也接受
     */
    RatingDto upsert(long userId, long albumId, Number rating);

    /**
     * 严格新建，已存在时报冲突。
     */
    RatingDto create(long userId, long albumId, Number rating);

    Optional<RatingDto> findByUserAndAlbum(long userId, long albumId);

    Optional<RatingDto> findById(long ratingId);

    List<RatingDto> findByUser(long userId);

    List<RatingDto> findByAlbum(long albumId);

    double getAverage(long albumId);

    long getCount(long albumId);

    AlbumStatsDto getStats(long albumId);

    void delete(long userId, long albumId);

    void deleteById(long requesterId, long ratingId);
}
