package com.albumsocial.common.error;

import com.albumsocial.common.api.ApiCodes;

public class ForbiddenException extends DomainException {

    public ForbiddenException(String message) {
        super(ApiCodes.FORBIDDEN, message);
    }
}
