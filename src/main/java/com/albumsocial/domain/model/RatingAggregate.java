package com.albumsocial.domain.model;

import lombok.Data;

/**
 * 同一条语句读出的条数与总分，保证均值与条数来自同一快照。
 */
@Data
public class RatingAggregate {

    private Long ratingCount;

    private Long ratingSum;

    public long count() {
        return ratingCount == null ? 0 : ratingCount;
    }

    public long sum() {
        return ratingSum == null ? 0 : ratingSum;
    }
}
