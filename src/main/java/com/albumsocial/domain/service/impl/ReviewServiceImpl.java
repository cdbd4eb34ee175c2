package com.albumsocial.domain.service.impl;

import com.albumsocial.common.error.ConflictException;
import com.albumsocial.common.error.ForbiddenException;
import com.albumsocial.common.error.NotFoundException;
import com.albumsocial.common.error.ValidationException;
import com.albumsocial.common.time.DbTime;
import com.albumsocial.domain.catalog.AlbumCatalog;
import com.albumsocial.domain.dto.ActivityPayload;
import com.albumsocial.domain.dto.ReviewDto;
import com.albumsocial.domain.entity.ReviewEntity;
import com.albumsocial.domain.enums.ActivityType;
import com.albumsocial.domain.mapper.ReviewMapper;
import com.albumsocial.domain.mapper.UserMapper;
import com.albumsocial.domain.service.ActivityLogService;
import com.albumsocial.domain.service.ReviewService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class ReviewServiceImpl implements ReviewService {

    static final int MAX_CONTENT_LENGTH = 5000;

    private final ReviewMapper reviewMapper;
    private final UserMapper userMapper;
    private final AlbumCatalog albumCatalog;
    private final ActivityLogService activityLogService;

    public ReviewServiceImpl(
            ReviewMapper reviewMapper,
            UserMapper userMapper,
            AlbumCatalog albumCatalog,
            ActivityLogService activityLogService
    ) {
        this.reviewMapper = reviewMapper;
        this.userMapper = userMapper;
        this.albumCatalog = albumCatalog;
        this.activityLogService = activityLogService;
    }

    /**
     * 与评分 upsert 相同的锁与冲突处理，同样依赖 READ COMMITTED。
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    @Override
    public ReviewDto upsert(long userId, long albumId, String content) {
        String text = validateContent(content);
        requireReferences(userId, albumId);

        ReviewEntity existing = reviewMapper.selectByUserAndAlbumForUpdate(userId, albumId);
        if (existing == null) {
            ReviewEntity created = newReview(userId, albumId, text);
            try {
                reviewMapper.insert(created);
            } catch (DuplicateKeyException e) {
                existing = reviewMapper.selectByUserAndAlbumForUpdate(userId, albumId);
                if (existing == null) {
                    throw e;
                }
                log.debug("review upsert lost insert race, updating: userId={}, albumId={}", userId, albumId);
                return update(existing, text);
            }
            appendEvent(created, created.getCreatedAt());
            return ReviewDto.from(created);
        }
        return update(existing, text);
    }

    @Transactional
    @Override
    public ReviewDto create(long userId, long albumId, String content) {
        String text = validateContent(content);
        requireReferences(userId, albumId);

        ReviewEntity created = newReview(userId, albumId, text);
        try {
            reviewMapper.insert(created);
        } catch (DuplicateKeyException e) {
            throw new ConflictException("User has already reviewed this album");
        }
        appendEvent(created, created.getCreatedAt());
        return ReviewDto.from(created);
    }

    @Transactional
    @Override
    public ReviewDto updateContent(long userId, long reviewId, String content) {
        String text = validateContent(content);

        ReviewEntity existing = reviewMapper.selectByIdForUpdate(reviewId);
        if (existing == null) {
            throw new NotFoundException("Review not found");
        }
        if (!existing.ownership().isOwnedBy(userId)) {
            throw new ForbiddenException("You can only edit your own review");
        }
        return update(existing, text);
    }

    @Override
    public Optional<ReviewDto> findByUserAndAlbum(long userId, long albumId) {
        return Optional.ofNullable(reviewMapper.selectByUserAndAlbum(userId, albumId)).map(ReviewDto::from);
    }

    @Override
    public Optional<ReviewDto> findById(long reviewId) {
        return Optional.ofNullable(reviewMapper.selectById(reviewId)).map(ReviewDto::from);
    }

    @Override
    public List<ReviewDto> findByUser(long userId) {
        return reviewMapper.selectByUser(userId).stream().map(ReviewDto::from).toList();
    }

    @Override
    public List<ReviewDto> findByAlbum(long albumId) {
        return reviewMapper.selectByAlbum(albumId).stream().map(ReviewDto::from).toList();
    }

    @Override
    public long getReviewCount(long albumId) {
        return reviewMapper.countByAlbum(albumId);
    }

    @Override
    public boolean hasUserReviewed(long userId, long albumId) {
        return reviewMapper.selectByUserAndAlbum(userId, albumId) != null;
    }

    @Transactional
    @Override
    public void delete(long userId, long albumId) {
        if (reviewMapper.deleteByUserAndAlbum(userId, albumId) == 0) {
            throw new NotFoundException("Review not found");
        }
    }

    @Transactional
    @Override
    public void deleteById(long requesterId, long reviewId) {
        ReviewEntity r = reviewMapper.selectById(reviewId);
        if (r == null) {
            throw new NotFoundException("Review not found");
        }
        if (!r.ownership().isOwnedBy(requesterId)) {
            throw new ForbiddenException("You can only delete your own review");
        }
        reviewMapper.deleteById(reviewId);
    }

    /**
     * @return trim 之后的内容
     */
    static String validateContent(String content) {
        if (content == null) {
            throw new ValidationException("Review content is required");
        }
        String trimmed = content.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException("Review content cannot be empty or contain only whitespace");
        }
        if (trimmed.length() > MAX_CONTENT_LENGTH) {
            throw new ValidationException("Review content cannot exceed " + MAX_CONTENT_LENGTH + " characters");
        }
        return trimmed;
    }

    private ReviewDto update(ReviewEntity existing, String text) {
        LocalDateTime updatedAt = DbTime.nextUpdate(existing.getUpdatedAt());
        reviewMapper.updateContent(existing.getId(), text, updatedAt);
        existing.setContent(text);
        existing.setUpdatedAt(updatedAt);
        appendEvent(existing, updatedAt);
        return ReviewDto.from(existing);
    }

    private static ReviewEntity newReview(long userId, long albumId, String text) {
        LocalDateTime now = DbTime.now();
        return ReviewEntity.builder()
                .userId(userId)
                .albumId(albumId)
                .content(text)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private void appendEvent(ReviewEntity r, LocalDateTime at) {
        activityLogService.append(r.getUserId(), ActivityType.REVIEW, r.getAlbumId(), r.getId(),
                ActivityPayload.ofReview(r.getContent()), at);
    }

    private void requireReferences(long userId, long albumId) {
        if (userId <= 0 || userMapper.countById(userId) == 0) {
            throw NotFoundException.user();
        }
        if (!albumCatalog.itemExists(albumId)) {
            throw NotFoundException.album();
        }
    }
}
