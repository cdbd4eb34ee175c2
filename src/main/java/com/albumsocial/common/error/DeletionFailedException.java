package com.albumsocial.common.error;

import com.albumsocial.common.api.ApiCodes;
import lombok.Getter;

/**
 * 注销流程中任一步骤失败。对外只暴露统一文案，原因保存在 cause 里供日志排查。
 */
@Getter
public class DeletionFailedException extends DomainException {

    private final long userId;

    public DeletionFailedException(long userId, Throwable cause) {
        super(ApiCodes.DELETION_FAILED, "Account deletion failed", cause);
        this.userId = userId;
    }
}
