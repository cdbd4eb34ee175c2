package com.albumsocial.domain.entity;

import com.albumsocial.domain.enums.ActivityType;
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

/**
 * 动态日志。只追加；注销时 user_id 置空，其余字段不再变化。
 */
@AllArgsConstructor
@NoArgsConstructor
@Builder
@Data
@TableName("t_activity")
public class ActivityEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long userId;

    /** {@link ActivityType#code()}：rating / review */
    private String type;

    private Long albumId;

    /** 产生该事件的 t_rating / t_review 行 id；同一 (type, source_id) 在 feed 中只展示最新一条。 */
    private Long sourceId;

    /** JSON：{"rating":5} 或 {"content":"..."} */
    private String payload;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    public Ownership ownership() {
        return Ownership.of(userId);
    }
}
