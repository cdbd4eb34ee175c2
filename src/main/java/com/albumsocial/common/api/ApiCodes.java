package com.albumsocial.common.api;

/**
 * 业务错误码。前三位与 HTTP 状态码对齐，后两位区分同一状态下的具体规则。
 */
public final class ApiCodes {

    private ApiCodes() {
    }

    public static final int OK = 0;

    /** 参数不合法（评分越界、评论为空、分页越界、未知类型） */
    public static final int BAD_REQUEST = 40000;

    /** 不能关注自己 */
    public static final int SELF_FOLLOW = 40001;

    public static final int UNAUTHORIZED = 40100;

    public static final int FORBIDDEN = 40300;

    public static final int NOT_FOUND = 40400;

    public static final int NOT_FOLLOWING = 40401;

    public static final int ACCOUNT_NOT_FOUND = 40402;

    /** 唯一键冲突 */
    public static final int CONFLICT = 40900;

    public static final int ALREADY_FOLLOWING = 40901;

    public static final int INTERNAL_ERROR = 50000;

    public static final int DELETION_FAILED = 50001;
}
