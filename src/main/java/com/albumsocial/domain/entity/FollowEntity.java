package com.albumsocial.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 有向关注边 follower -> followee，(follower_id, followee_id) 唯一。
 */
@AllArgsConstructor
@NoArgsConstructor
@Builder
@Data
@TableName("t_follow")
public class FollowEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long followerId;

    private Long followeeId;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;
}
