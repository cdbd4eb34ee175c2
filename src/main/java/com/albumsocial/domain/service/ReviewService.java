package com.albumsocial.domain.service;

import com.albumsocial.domain.dto.ReviewDto;

import java.util.List;
import java.util.Optional;

public interface ReviewService {

    ReviewDto upsert(long userId, long albumId, String content);

    ReviewDto create(long userId, long albumId, String content);

    /**
     * 只有作者本人可以修改。
     */
    ReviewDto updateContent(long userId, long reviewId, String content);

    Optional<ReviewDto> findByUserAndAlbum(long userId, long albumId);

    Optional<ReviewDto> findById(long reviewId);

    List<ReviewDto> findByUser(long userId);

    List<ReviewDto> findByAlbum(long albumId);

    long getReviewCount(long albumId);

    boolean hasUserReviewed(long userId, long albumId);

    void delete(long userId, long albumId);

    void deleteById(long requesterId, long reviewId);
}
