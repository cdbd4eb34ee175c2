package com.albumsocial.common.page;

/**
 * total 为精确条数；hasMore = page * limit < total。
 */
public record Pagination(int page, int limit, boolean hasMore, long total) {

    public static Pagination of(PageQuery query, long total) {
        boolean hasMore = (long) query.page() * query.limit() < total;
        return new Pagination(query.page(), query.limit(), hasMore, total);
    }

    public static Pagination empty(PageQuery query) {
        return new Pagination(query.page(), query.limit(), false, 0);
    }
}
