package com.albumsocial.domain.enums;

import com.albumsocial.common.error.ValidationException;

/**
 * 动态类型。数据库存 code 字符串。
 */
public enum ActivityType {
    RATING("rating"),
    REVIEW("review");

    private final String code;

    ActivityType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * 严格匹配小写 code；其它任何值都是参数错误。
     */
    public static ActivityType parse(String code) {
        if (code != null) {
            for (ActivityType t : values()) {
                if (t.code.equals(code)) {
                    return t;
                }
            }
        }
        throw new ValidationException("Activity type must be either \"rating\" or \"review\"");
    }
}
