package com.albumsocial.common.error;

import lombok.Getter;

/**
 * 业务异常基类。message 是对调用方可见的契约文案，code 见 {@link com.albumsocial.common.api.ApiCodes}。
 */
@Getter
public abstract class DomainException extends RuntimeException {

    private final int code;

    protected DomainException(int code, String message) {
        super(message);
        this.code = code;
    }

    protected DomainException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
