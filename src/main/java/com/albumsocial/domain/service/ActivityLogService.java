package com.albumsocial.domain.service;

import com.albumsocial.domain.dto.ActivityPayload;
import com.albumsocial.domain.entity.ActivityEntity;
import com.albumsocial.domain.enums.ActivityType;

import java.time.LocalDateTime;

/**
 * 动态日志的写入端。只在评分/评论写入的同一事务里调用。
 */
public interface ActivityLogService {

    ActivityEntity append(long userId, ActivityType type, long albumId, long sourceId,
                          ActivityPayload payload, LocalDateTime createdAt);

    int anonymizeByUser(long userId);
}
