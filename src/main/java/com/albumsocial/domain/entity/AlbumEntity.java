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
 * 专辑目录的本地镜像。元数据由外部目录同步写入，本服务只读。
 */
@AllArgsConstructor
@NoArgsConstructor
@Builder
@Data
@TableName("t_album")
public class AlbumEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private String title;

    private String artist;

    private String coverUrl;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;
}
