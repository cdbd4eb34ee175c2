package com.albumsocial.domain.service.impl;

import com.albumsocial.common.error.ConflictException;
import com.albumsocial.common.error.ForbiddenException;
import com.albumsocial.common.error.NotFoundException;
import com.albumsocial.common.error.ValidationException;
import com.albumsocial.common.time.DbTime;
import com.albumsocial.domain.catalog.AlbumCatalog;
import com.albumsocial.domain.dto.ActivityPayload;
import com.albumsocial.domain.dto.AlbumStatsDto;
import com.albumsocial.domain.dto.RatingDto;
import com.albumsocial.domain.entity.RatingEntity;
import com.albumsocial.domain.enums.ActivityType;
import com.albumsocial.domain.mapper.RatingMapper;
import com.albumsocial.domain.mapper.ReviewMapper;
import com.albumsocial.domain.mapper.UserMapper;
import com.albumsocial.domain.model.RatingAggregate;
import com.albumsocial.domain.service.ActivityLogService;
import com.albumsocial.domain.service.RatingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class RatingServiceImpl implements RatingService {

    static final String INVALID_RATING = "Rating must be an integer between 1 and 5";

    private static final BigDecimal MIN = BigDecimal.ONE;
    private static final BigDecimal MAX = BigDecimal.valueOf(5);

    private final RatingMapper ratingMapper;
    private final ReviewMapper reviewMapper;
    private final UserMapper userMapper;
    private final AlbumCatalog albumCatalog;
    private final ActivityLogService activityLogService;

    public RatingServiceImpl(
            RatingMapper ratingMapper,
            ReviewMapper reviewMapper,
            UserMapper userMapper,
            AlbumCatalog albumCatalog,
            ActivityLogService activityLogService
    ) {
        this.ratingMapper = ratingMapper;
        this.reviewMapper = reviewMapper;
        this.userMapper = userMapper;
        this.albumCatalog = albumCatalog;
        this.activityLogService = activityLogService;
    }

    /**
     * 先锁自然键行：存在就更新；不存在就插入，插入撞唯一键说明并发插入已经提交，改为更新那一行。
     *
     * <p>READ COMMITTED：锁不存在的行时 InnoDB 不加间隙锁，并发首评退化为唯一键冲突而不是死锁。</p>
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    @Override
    public RatingDto upsert(long userId, long albumId, Number rating) {
        int value = validateRating(rating);
        requireReferences(userId, albumId);

        RatingEntity existing = ratingMapper.selectByUserAndAlbumForUpdate(userId, albumId);
        if (existing == null) {
            RatingEntity created = newRating(userId, albumId, value);
            try {
                ratingMapper.insert(created);
            } catch (DuplicateKeyException e) {
                existing = ratingMapper.selectByUserAndAlbumForUpdate(userId, albumId);
                if (existing == null) {
                    throw e;
                }
                log.debug("rating upsert lost insert race, updating: userId={}, albumId={}", userId, albumId);
                return update(existing, value);
            }
            appendEvent(created, created.getCreatedAt());
            return RatingDto.from(created);
        }
        return update(existing, value);
    }

    @Transactional
    @Override
    public RatingDto create(long userId, long albumId, Number rating) {
        int value = validateRating(rating);
        requireReferences(userId, albumId);

        RatingEntity created = newRating(userId, albumId, value);
        try {
            ratingMapper.insert(created);
        } catch (DuplicateKeyException e) {
            throw new ConflictException("User has already rated this album");
        }
        appendEvent(created, created.getCreatedAt());
        return RatingDto.from(created);
    }

    @Override
    public Optional<RatingDto> findByUserAndAlbum(long userId, long albumId) {
        return Optional.ofNullable(ratingMapper.selectByUserAndAlbum(userId, albumId)).map(RatingDto::from);
    }

    @Override
    public Optional<RatingDto> findById(long ratingId) {
        return Optional.ofNullable(ratingMapper.selectById(ratingId)).map(RatingDto::from);
    }

    @Override
    public List<RatingDto> findByUser(long userId) {
        return ratingMapper.selectByUser(userId).stream().map(RatingDto::from).toList();
    }

    @Override
    public List<RatingDto> findByAlbum(long albumId) {
        return ratingMapper.selectByAlbum(albumId).stream().map(RatingDto::from).toList();
    }

    /**
     * 全部评分行（含已匿名化）的均值，保留两位小数；没有评分时为 0。
     */
    @Override
    public double getAverage(long albumId) {
        return average(ratingMapper.selectAggregateByAlbum(albumId));
    }

    @Override
    public long getCount(long albumId) {
        return ratingMapper.countByAlbum(albumId);
    }

    @Override
    public AlbumStatsDto getStats(long albumId) {
        RatingAggregate agg = ratingMapper.selectAggregateByAlbum(albumId);
        return new AlbumStatsDto(albumId, average(agg), agg == null ? 0 : agg.count(),
                reviewMapper.countByAlbum(albumId));
    }

    @Transactional
    @Override
    public void delete(long userId, long albumId) {
        if (ratingMapper.deleteByUserAndAlbum(userId, albumId) == 0) {
            throw new NotFoundException("Rating not found");
        }
    }

    @Transactional
    @Override
    public void deleteById(long requesterId, long ratingId) {
        RatingEntity r = ratingMapper.selectById(ratingId);
        if (r == null) {
            throw new NotFoundException("Rating not found");
        }
        if (!r.ownership().isOwnedBy(requesterId)) {
            throw new ForbiddenException("You can only delete your own rating");
        }
        ratingMapper.deleteById(ratingId);
    }

    /**
     * 接受任意 Number，但必须是 1-5 的整数值：4 与 4.0 合法，4.5、NaN、null 都不合法。
     */
    static int validateRating(Number rating) {
        if (rating == null) {
            throw new ValidationException(INVALID_RATING);
        }
        BigDecimal v;
        try {
            v = new BigDecimal(rating.toString());
        } catch (NumberFormatException e) {
            throw new ValidationException(INVALID_RATING);
        }
        if (v.stripTrailingZeros().scale() > 0 || v.compareTo(MIN) < 0 || v.compareTo(MAX) > 0) {
            throw new ValidationException(INVALID_RATING);
        }
        return v.intValue();
    }

    private static double average(RatingAggregate agg) {
        if (agg == null || agg.count() == 0) {
            return 0;
        }
        return average(agg.sum(), agg.count());
    }

    static double average(long sum, long count) {
        return BigDecimal.valueOf(sum)
                .divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    private RatingDto update(RatingEntity existing, int value) {
        LocalDateTime updatedAt = DbTime.nextUpdate(existing.getUpdatedAt());
        ratingMapper.updateRating(existing.getId(), value, updatedAt);
        existing.setRating(value);
        existing.setUpdatedAt(updatedAt);
        appendEvent(existing, updatedAt);
        return RatingDto.from(existing);
    }

    private static RatingEntity newRating(long userId, long albumId, int value) {
        LocalDateTime now = DbTime.now();
        return RatingEntity.builder()
                .userId(userId)
                .albumId(albumId)
                .rating(value)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private void appendEvent(RatingEntity r, LocalDateTime at) {
        activityLogService.append(r.getUserId(), ActivityType.RATING, r.getAlbumId(), r.getId(),
                ActivityPayload.ofRating(r.getRating()), at);
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
