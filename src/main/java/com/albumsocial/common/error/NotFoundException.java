package com.albumsocial.common.error;

import com.albumsocial.common.api.ApiCodes;

public class NotFoundException extends DomainException {

    public NotFoundException(String message) {
        super(ApiCodes.NOT_FOUND, message);
    }

    protected NotFoundException(int code, String message) {
        super(code, message);
    }

    public static NotFoundException user() {
        return new NotFoundException("User not found");
    }

    public static NotFoundException album() {
        return new NotFoundException("Album not found");
    }
}
