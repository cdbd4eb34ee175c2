package com.albumsocial.domain.service.impl;

import com.albumsocial.common.error.ConflictException;
import com.albumsocial.common.error.ForbiddenException;
import com.albumsocial.common.error.NotFoundException;
import com.albumsocial.common.error.ValidationException;
import com.albumsocial.domain.catalog.AlbumCatalog;
import com.albumsocial.domain.dto.ActivityPayload;
import com.albumsocial.domain.dto.RatingDto;
import com.albumsocial.domain.entity.RatingEntity;
import com.albumsocial.domain.enums.ActivityType;
import com.albumsocial.domain.mapper.RatingMapper;
import com.albumsocial.domain.mapper.ReviewMapper;
import com.albumsocial.domain.mapper.UserMapper;
import com.albumsocial.domain.model.RatingAggregate;
import com.albumsocial.domain.service.ActivityLogService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class RatingServiceImplTest {

    private RatingMapper ratingMapper;
    private ReviewMapper reviewMapper;
    private UserMapper userMapper;
    private AlbumCatalog albumCatalog;
    private ActivityLogService activityLog;
    private RatingServiceImpl service;

    @BeforeEach
    void setUp() {
        ratingMapper = mock(RatingMapper.class);
        reviewMapper = mock(ReviewMapper.class);
        userMapper = mock(UserMapper.class);
        albumCatalog = mock(AlbumCatalog.class);
        activityLog = mock(ActivityLogService.class);
        service = new RatingServiceImpl(ratingMapper, reviewMapper, userMapper, albumCatalog, activityLog);

        when(userMapper.countById(anyLong())).thenReturn(1L);
        when(albumCatalog.itemExists(anyLong())).thenReturn(true);
        when(ratingMapper.insert(any(RatingEntity.class))).thenAnswer(inv -> {
            inv.getArgument(0, RatingEntity.class).setId(500L);
            return 1;
        });
    }

    @Test
    void validateRating_ShouldAcceptOnlyIntegralOneToFive() {
        assertThat(RatingServiceImpl.validateRating(1)).isEqualTo(1);
        assertThat(RatingServiceImpl.validateRating(5L)).isEqualTo(5);
        assertThat(RatingServiceImpl.validateRating(4.0d)).isEqualTo(4);
        assertThat(RatingServiceImpl.validateRating(new BigDecimal("3.00"))).isEqualTo(3);

        for (Number bad : new Number[]{null, 0, 6, -1, 4.5d, Double.NaN, Double.POSITIVE_INFINITY, 1.0001f}) {
            assertThatThrownBy(() -> RatingServiceImpl.validateRating(bad))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Rating must be an integer between 1 and 5");
        }
    }

    @Test
    void upsert_InvalidRating_ShouldNotTouchStorage() {
        assertThatThrownBy(() -> service.upsert(1, 2, 4.5)).isInstanceOf(ValidationException.class);
        verifyNoInteractions(ratingMapper, userMapper, albumCatalog, activityLog);
    }

    @Test
    void upsert_UnknownAlbum_ShouldBeNotFound() {
        when(albumCatalog.itemExists(2L)).thenReturn(false);

        assertThatThrownBy(() -> service.upsert(1, 2, 4))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Album not found");
        verifyNoInteractions(ratingMapper, activityLog);
    }

    @Test
    void upsert_FirstRating_ShouldInsertAndAppendEvent() {
        when(ratingMapper.selectByUserAndAlbumForUpdate(1, 2)).thenReturn(null);

        RatingDto dto = service.upsert(1, 2, 4);

        assertThat(dto.id()).isEqualTo(500L);
        assertThat(dto.rating()).isEqualTo(4);
        assertThat(dto.ownership().isOwnedBy(1)).isTrue();
        assertThat(dto.createdAt()).isEqualTo(dto.updatedAt());
        verify(activityLog).append(eq(1L), eq(ActivityType.RATING), eq(2L), eq(500L),
                eq(ActivityPayload.ofRating(4)), eq(dto.createdAt()));
    }

    @Test
    void upsert_ExistingRow_ShouldUpdateInPlace() {
        LocalDateTime created = LocalDateTime.now().minusDays(1).truncatedTo(ChronoUnit.MILLIS);
        LocalDateTime lastUpdate = LocalDateTime.now().truncatedTo(ChronoUnit.MILLIS);
        RatingEntity existing = RatingEntity.builder()
                .id(77L).userId(1L).albumId(2L).rating(4).createdAt(created).updatedAt(lastUpdate).build();
        when(ratingMapper.selectByUserAndAlbumForUpdate(1, 2)).thenReturn(existing);

        RatingDto dto = service.upsert(1, 2, 4);

        assertThat(dto.id()).isEqualTo(77L);
        assertThat(dto.createdAt()).isEqualTo(created);
        assertThat(dto.updatedAt()).isAfter(lastUpdate);
        verify(ratingMapper).updateRating(77L, 4, dto.updatedAt());
        verify(ratingMapper, never()).insert(any(RatingEntity.class));
        verify(activityLog).append(eq(1L), eq(ActivityType.RATING), eq(2L), eq(77L),
                eq(ActivityPayload.ofRating(4)), eq(dto.updatedAt()));
    }

    @Test
    void upsert_LostInsertRace_ShouldUpdateWinnerRow() {
        RatingEntity winner = RatingEntity.builder()
                .id(88L).userId(1L).albumId(2L).rating(2)
                .createdAt(LocalDateTime.now().minusSeconds(1)).updatedAt(LocalDateTime.now().minusSeconds(1)).build();
        when(ratingMapper.selectByUserAndAlbumForUpdate(1, 2)).thenReturn(null, winner);
        doThrow(new DuplicateKeyException("uk_rating_user_album")).when(ratingMapper).insert(any(RatingEntity.class));

        RatingDto dto = service.upsert(1, 2, 5);

        assertThat(dto.id()).isEqualTo(88L);
        assertThat(dto.rating()).isEqualTo(5);
        verify(ratingMapper).updateRating(eq(88L), eq(5), any(LocalDateTime.class));
    }

    @Test
    void create_Existing_ShouldConflict() {
        doThrow(new DuplicateKeyException("dup")).when(ratingMapper).insert(any(RatingEntity.class));

        assertThatThrownBy(() -> service.create(1, 2, 3)).isInstanceOf(ConflictException.class);
        verifyNoInteractions(activityLog);
    }

    @Test
    void getAverage_ShouldRoundToTwoDecimals() {
        when(ratingMapper.selectAggregateByAlbum(2)).thenReturn(aggregate(3, 13));

        assertThat(service.getAverage(2)).isEqualTo(4.33);
    }

    @Test
    void getAverage_NoRatings_ShouldBeZero() {
        when(ratingMapper.selectAggregateByAlbum(2)).thenReturn(aggregate(0, 0));

        assertThat(service.getAverage(2)).isZero();
    }

    @Test
    void getAverage_ShouldReadCountAndSumInOneStatement() {
        when(ratingMapper.selectAggregateByAlbum(2)).thenReturn(aggregate(2, 9));

        service.getAverage(2);

        verify(ratingMapper).selectAggregateByAlbum(2);
        verify(ratingMapper, never()).countByAlbum(anyLong());
    }

    @Test
    void getStats_ShouldCombineRatingsAndReviews() {
        when(ratingMapper.selectAggregateByAlbum(2)).thenReturn(aggregate(2, 9));
        when(reviewMapper.countByAlbum(2)).thenReturn(1L);

        var stats = service.getStats(2);
        assertThat(stats.averageRating()).isEqualTo(4.5);
        assertThat(stats.ratingCount()).isEqualTo(2);
        assertThat(stats.reviewCount()).isEqualTo(1);
        verify(ratingMapper, never()).countByAlbum(anyLong());
    }

    @Test
    void upsert_ShouldRunReadCommitted() throws Exception {
        Transactional tx = RatingServiceImpl.class
                .getMethod("upsert", long.class, long.class, Number.class)
                .getAnnotation(Transactional.class);

        assertThat(tx).isNotNull();
        assertThat(tx.isolation()).isEqualTo(Isolation.READ_COMMITTED);
    }

    @Test
    void deleteById_OthersRating_ShouldBeForbidden() {
        when(ratingMapper.selectById(9L)).thenReturn(RatingEntity.builder().id(9L).userId(2L).albumId(3L).rating(1).build());

        assertThatThrownBy(() -> service.deleteById(1, 9)).isInstanceOf(ForbiddenException.class);
        verify(ratingMapper, never()).deleteById(9L);
    }

    @Test
    void delete_Missing_ShouldBeNotFound() {
        when(ratingMapper.deleteByUserAndAlbum(1, 2)).thenReturn(0);
        assertThatThrownBy(() -> service.delete(1, 2)).isInstanceOf(NotFoundException.class);
    }

    private static RatingAggregate aggregate(long count, long sum) {
        RatingAggregate agg = new RatingAggregate();
        agg.setRatingCount(count);
        agg.setRatingSum(sum);
        return agg;
    }
}
