package com.albumsocial.auth.web;

import com.albumsocial.common.error.UnauthorizedException;

/**
 * 请求级别的当前用户。
 *
 * <p>由 AccessTokenInterceptor 写入，afterCompletion 清理，线程复用时不会串号。</p>
 */
public final class AuthContext {

    private static final ThreadLocal<Long> USER_ID = new ThreadLocal<>();

    private AuthContext() {
    }

    public static void setUserId(Long userId) {
        USER_ID.set(userId);
    }

    public static Long getUserId() {
        return USER_ID.get();
    }

    /**
     * 写接口用：未登录直接 401。
     */
    public static long requireUserId() {
        Long userId = USER_ID.get();
        if (userId == null) {
            throw new UnauthorizedException();
        }
        return userId;
    }

    public static void clear() {
        USER_ID.remove();
    }
}
