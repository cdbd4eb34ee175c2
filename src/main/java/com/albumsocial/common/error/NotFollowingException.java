package com.albumsocial.common.error;

import com.albumsocial.common.api.ApiCodes;

public class NotFollowingException extends NotFoundException {

    public static final String MESSAGE = "User is not following this user";

    public NotFollowingException() {
        super(ApiCodes.NOT_FOLLOWING, MESSAGE);
    }
}
