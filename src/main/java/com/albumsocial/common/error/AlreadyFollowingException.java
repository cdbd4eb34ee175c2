package com.albumsocial.common.error;

import com.albumsocial.common.api.ApiCodes;

public class AlreadyFollowingException extends ConflictException {

    public static final String MESSAGE = "User is already following this user";

    public AlreadyFollowingException() {
        super(ApiCodes.ALREADY_FOLLOWING, MESSAGE);
    }
}
