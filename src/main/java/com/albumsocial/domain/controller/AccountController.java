package com.albumsocial.domain.controller;

import com.albumsocial.auth.web.AuthContext;
import com.albumsocial.common.api.Result;
import com.albumsocial.domain.dto.DeletionAuditDto;
import com.albumsocial.domain.service.AccountDeletionService;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/account")
public class AccountController {

    private final AccountDeletionService accountDeletionService;

    public AccountController(AccountDeletionService accountDeletionService) {
        this.accountDeletionService = accountDeletionService;
    }

    /**
     * 注销当前账号。成功后当前 token 随会话版本一起失效。
     */
    @DeleteMapping
    public Result<DeletionAuditDto> delete() {
        long me = AuthContext.requireUserId();
        return Result.ok(accountDeletionService.deleteAccount(me));
    }
}
