package com.albumsocial.domain.service;

import com.albumsocial.domain.dto.UserProfileDto;

import java.util.List;

public interface UserService {

    /**
     * 身份服务注册成功后调用。credentialHash 原样保存。
     */
    UserProfileDto create(String username, String email, String credentialHash, String displayName);

    UserProfileDto getProfile(long userId);

    /**
     * null 字段保持不变。
     */
    UserProfileDto updateProfile(long userId, String displayName, String bio, String avatarUrl);

    List<UserProfileDto> search(String keyword, int limit);

    boolean exists(long userId);
}
