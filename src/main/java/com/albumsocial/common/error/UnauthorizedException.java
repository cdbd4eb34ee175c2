package com.albumsocial.common.error;

import com.albumsocial.common.api.ApiCodes;

public class UnauthorizedException extends DomainException {

    public UnauthorizedException() {
        super(ApiCodes.UNAUTHORIZED, "unauthorized");
    }
}
