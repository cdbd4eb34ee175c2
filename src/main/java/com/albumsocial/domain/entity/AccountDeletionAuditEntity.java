package com.albumsocial.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 账号注销审计。user_id 不建外键：用户行删除后审计记录仍需保留。
 */
@AllArgsConstructor
@NoArgsConstructor
@Builder
@Data
@TableName("t_account_deletion_audit")
public class AccountDeletionAuditEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long userId;

    private LocalDateTime deletedAt;

    private Integer ratingsCount;

    private Integer reviewsCount;

    private Integer followsCount;
}
