package com.albumsocial.domain.service.impl;

import com.albumsocial.domain.dto.ActivityPayload;
import com.albumsocial.domain.entity.ActivityEntity;
import com.albumsocial.domain.enums.ActivityType;
import com.albumsocial.domain.mapper.ActivityMapper;
import com.albumsocial.domain.service.ActivityLogService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

@Slf4j
@Service
public class ActivityLogServiceImpl implements ActivityLogService {

    private final ActivityMapper activityMapper;
    private final ObjectMapper objectMapper;

    public ActivityLogServiceImpl(ActivityMapper activityMapper, ObjectMapper objectMapper) {
        this.activityMapper = activityMapper;
        this.objectMapper = objectMapper;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    @Override
    public ActivityEntity append(long userId, ActivityType type, long albumId, long sourceId,
                                 ActivityPayload payload, LocalDateTime createdAt) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("serialize activity payload failed", e);
        }
        ActivityEntity event = ActivityEntity.builder()
                .userId(userId)
                .type(type.code())
                .albumId(albumId)
                .sourceId(sourceId)
                .payload(json)
                .createdAt(createdAt)
                .build();
        activityMapper.insert(event);
        log.debug("activity appended: userId={}, type={}, albumId={}, sourceId={}", userId, type.code(), albumId, sourceId);
        return event;
    }

    @Transactional
    @Override
    public int anonymizeByUser(long userId) {
        return activityMapper.anonymizeByUser(userId);
    }
}
