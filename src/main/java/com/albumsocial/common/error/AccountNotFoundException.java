package com.albumsocial.common.error;

import com.albumsocial.common.api.ApiCodes;
import lombok.Getter;

@Getter
public class AccountNotFoundException extends NotFoundException {

    private final long userId;

    public AccountNotFoundException(long userId) {
        super(ApiCodes.ACCOUNT_NOT_FOUND, "Account not found");
        this.userId = userId;
    }
}
