package com.albumsocial.common.page;

import com.albumsocial.common.error.ValidationException;

/**
 * 偏移分页参数。limit 超出 [1, 100] 直接报错，不做静默截断。
 */
public record PageQuery(int page, int limit, int offset) {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    /**
     * limit/offset 形式。page 按 offset/limit 反推，仅用于展示。
     */
    public static PageQuery of(int limit, int offset) {
        checkLimit(limit);
        if (offset < 0) {
            throw new ValidationException("offset must be greater than or equal to 0");
        }
        return new PageQuery(offset / limit + 1, limit, offset);
    }

    /**
     * (page, limit) 形式，offset = (page - 1) * limit。
     */
    public static PageQuery ofPage(int page, int limit) {
        if (page < 1) {
            throw new ValidationException("page must be greater than or equal to 1");
        }
        checkLimit(limit);
        long offset = (long) (page - 1) * limit;
        if (offset > Integer.MAX_VALUE) {
            throw new ValidationException("page is too large");
        }
        return new PageQuery(page, limit, (int) offset);
    }

    public static int checkLimit(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + MAX_LIMIT);
        }
        return limit;
    }
}
