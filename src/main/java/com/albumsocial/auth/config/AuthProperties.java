package com.albumsocial.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param issuer           身份服务签发 token 时写入的 iss，不一致直接拒绝
 * @param jwtSecret        HS256 共享密钥，至少 32 字节
 * @param clockSkewSeconds 校验 exp/nbf 时容忍的时钟偏差
 */
@ConfigurationProperties(prefix = "albumsocial.auth")
public record AuthProperties(
        String issuer,
        String jwtSecret,
        long clockSkewSeconds
) {
}
