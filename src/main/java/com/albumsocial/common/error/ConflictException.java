package com.albumsocial.common.error;

import com.albumsocial.common.api.ApiCodes;

public class ConflictException extends DomainException {

    public ConflictException(String message) {
        super(ApiCodes.CONFLICT, message);
    }

    protected ConflictException(int code, String message) {
        super(code, message);
    }
}
