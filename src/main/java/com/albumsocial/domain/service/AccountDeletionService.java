package com.albumsocial.domain.service;

import com.albumsocial.domain.dto.DeletionAuditDto;

public interface AccountDeletionService {

    /**
     * 注销账号：写审计、失效会话、匿名化评分/评论/动态、删除关注边、删除用户，整体原子。
     *
     * @throws com.albumsocial.common.error.AccountNotFoundException 用户不存在，没有任何改动落库
     * @throws com.albumsocial.common.error.DeletionFailedException  其它任何失败，已整体回滚
     */
    DeletionAuditDto deleteAccount(long userId);
}
