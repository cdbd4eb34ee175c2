package com.albumsocial.domain.mapper;

import com.albumsocial.domain.entity.AccountDeletionAuditEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;

public interface AccountDeletionAuditMapper extends BaseMapper<AccountDeletionAuditEntity> {
}
