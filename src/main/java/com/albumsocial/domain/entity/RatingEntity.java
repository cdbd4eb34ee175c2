package com.albumsocial.domain.entity;

import com.albumsocial.domain.model.Ownership;
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

@AllArgsConstructor
@NoArgsConstructor
@Builder
@Data
@TableName("t_rating")
public class RatingEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    /** 账号注销后置空，业务代码请走 {@link #ownership()}。 */
    private Long userId;

    private Long albumId;

    /** 1-5 */
    private Integer rating;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;

    public Ownership ownership() {
        return Ownership.of(userId);
    }
}
