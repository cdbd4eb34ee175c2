package com.albumsocial.common.error;

import com.albumsocial.common.api.ApiCodes;

public class SelfFollowException extends ValidationException {

    public static final String MESSAGE = "Users cannot follow themselves";

    public SelfFollowException() {
        super(ApiCodes.SELF_FOLLOW, MESSAGE);
    }
}
