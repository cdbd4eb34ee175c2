package com.albumsocial.common.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 统一 HTTP 返回体。
 *
 * <ul>
 *   <li>ok：业务是否成功</li>
 *   <li>code：成功为 0，失败见 {@link ApiCodes}</li>
 *   <li>message：失败原因，调用方会按文案分支（例如 "already following"），改动需谨慎</li>
 *   <li>data：成功时的数据</li>
 *   <li>ts：服务端时间戳（毫秒）</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Result<T>(
        boolean ok,
        int code,
        String message,
        T data,
        long ts
) {

    public static <T> Result<T> ok(T data) {
        return new Result<>(true, ApiCodes.OK, "ok", data, System.currentTimeMillis());
    }

    /**
     * 无数据的成功响应；不能叫 ok()，record 已经生成了 boolean ok() 访问器。
     */
    public static <T> Result<T> okVoid() {
        return new Result<>(true, ApiCodes.OK, "ok", null, System.currentTimeMillis());
    }

    public static <T> Result<T> fail(int code, String message) {
        return new Result<>(false, code, message, null, System.currentTimeMillis());
    }
}
