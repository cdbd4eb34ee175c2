package com.albumsocial.common.error;

import com.albumsocial.common.api.ApiCodes;

/**
 * 输入不合法。调用方修正输入即可，不做自动重试。
 */
public class ValidationException extends DomainException {

    public ValidationException(String message) {
        super(ApiCodes.BAD_REQUEST, message);
    }

    protected ValidationException(int code, String message) {
        super(code, message);
    }
}
