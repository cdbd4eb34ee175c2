package com.albumsocial.auth.service;

/**
 * 已验签的 accessToken 中本服务关心的部分。
 */
public record AccessClaims(long userId, long sessionVersion) {
}
