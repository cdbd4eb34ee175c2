package com.albumsocial.domain.service.impl;

import com.albumsocial.common.error.ConflictException;
import com.albumsocial.common.error.NotFoundException;
import com.albumsocial.common.error.ValidationException;
import com.albumsocial.common.page.PageQuery;
import com.albumsocial.common.time.DbTime;
import com.albumsocial.domain.dto.UserProfileDto;
import com.albumsocial.domain.entity.UserEntity;
import com.albumsocial.domain.mapper.UserMapper;
import com.albumsocial.domain.service.UserService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
public class UserServiceImpl implements UserService {

    private static final int USERNAME_MAX = 64;
    private static final int EMAIL_MAX = 255;
    private static final int DISPLAY_NAME_MAX = 100;
    private static final int BIO_MAX = 500;
    private static final int AVATAR_URL_MAX = 512;

    private final UserMapper userMapper;

    public UserServiceImpl(UserMapper userMapper) {
        this.userMapper = userMapper;
    }

    @Transactional
    @Override
    public UserProfileDto create(String username, String email, String credentialHash, String displayName) {
        String u = requireText(username, "Username", USERNAME_MAX);
        String e = requireText(email, "Email", EMAIL_MAX);
        if (!e.contains("@")) {
            throw new ValidationException("Email is invalid");
        }
        if (credentialHash == null || credentialHash.isBlank()) {
            throw new ValidationException("Credential hash is required");
        }
        String name = optionalText(displayName, "Display name", DISPLAY_NAME_MAX);

        if (userMapper.countByUsername(u) > 0) {
            throw new ConflictException("Username already exists");
        }
        if (userMapper.countByEmail(e) > 0) {
            throw new ConflictException("Email already exists");
        }

        LocalDateTime now = DbTime.now();
        UserEntity entity = UserEntity.builder()
                .username(u)
                .email(e)
                .credentialHash(credentialHash)
                .displayName(name == null ? u : name)
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            userMapper.insert(entity);
        } catch (DuplicateKeyException dup) {
            // 并发注册同名/同邮箱
            throw new ConflictException("Username or email already exists");
        }
        log.info("user created: userId={}, username={}", entity.getId(), u);
        return UserProfileDto.from(entity);
    }

    @Override
    public UserProfileDto getProfile(long userId) {
        UserEntity u = userId <= 0 ? null : userMapper.selectById(userId);
        if (u == null) {
            throw NotFoundException.user();
        }
        return UserProfileDto.from(u);
    }

    @Transactional
    @Override
    public UserProfileDto updateProfile(long userId, String displayName, String bio, String avatarUrl) {
        UserEntity patch = new UserEntity();
        patch.setId(userId);
        patch.setDisplayName(optionalText(displayName, "Display name", DISPLAY_NAME_MAX));
        patch.setBio(bio == null ? null : checkLength(bio.trim(), "Bio", BIO_MAX));
        patch.setAvatarUrl(optionalText(avatarUrl, "Avatar URL", AVATAR_URL_MAX));

        if (userId <= 0 || userMapper.countById(userId) == 0) {
            throw NotFoundException.user();
        }
        if (patch.getDisplayName() != null || patch.getBio() != null || patch.getAvatarUrl() != null) {
            patch.setUpdatedAt(DbTime.now());
            userMapper.updateById(patch);
        }
        return UserProfileDto.from(userMapper.selectById(userId));
    }

    @Override
    public List<UserProfileDto> search(String keyword, int limit) {
        PageQuery.checkLimit(limit);
        if (keyword == null || keyword.isBlank()) {
            return List.of();
        }
        String escaped = keyword.trim()
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return userMapper.searchByKeyword(escaped, limit).stream()
                .map(UserProfileDto::from)
                .toList();
    }

    @Override
    public boolean exists(long userId) {
        return userId > 0 && userMapper.countById(userId) > 0;
    }

    private static String requireText(String raw, String field, int max) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        return checkLength(raw.trim(), field, max);
    }

    private static String optionalText(String raw, String field, int max) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return checkLength(raw.trim(), field, max);
    }

    private static String checkLength(String value, String field, int max) {
        if (value.length() > max) {
            throw new ValidationException(field + " cannot exceed " + max + " characters");
        }
        return value;
    }
}
