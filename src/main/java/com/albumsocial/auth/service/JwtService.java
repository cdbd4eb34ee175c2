package com.albumsocial.auth.service;

import com.albumsocial.auth.config.AuthProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;

/**
 * accessToken 校验。token 由身份服务签发，本服务只验签并读出 uid 与 sv。
 */
@Service
public class JwtService {

    public static final String CLAIM_USER_ID = "uid";
    public static final String CLAIM_TOKEN_TYPE = "typ";
    public static final String CLAIM_SESSION_VERSION = "sv";

    public static final String TOKEN_TYPE_ACCESS = "access";

    private final JwtParser parser;

    public JwtService(AuthProperties props) {
        this.parser = Jwts.parser()
                .verifyWith(Keys.hmacShaKeyFor(props.jwtSecret().getBytes(StandardCharsets.UTF_8)))
                .requireIssuer(props.issuer())
                .clockSkewSeconds(Math.max(0, props.clockSkewSeconds()))
                .build();
    }

    /**
     * 校验签名、issuer、有效期与 typ。
     *
     * @throws JwtException token 无效或缺少 uid
     */
    public AccessClaims verify(String token) {
        Claims claims = parser.parseSignedClaims(token).getPayload();
        String typ = claims.get(CLAIM_TOKEN_TYPE, String.class);
        if (!TOKEN_TYPE_ACCESS.equals(typ)) {
            throw new JwtException("token_type_not_access");
        }
        Number uid = claims.get(CLAIM_USER_ID, Number.class);
        if (uid == null || uid.longValue() <= 0) {
            throw new JwtException("missing_uid");
        }
        Number sv = claims.get(CLAIM_SESSION_VERSION, Number.class);
        return new AccessClaims(uid.longValue(), sv == null ? 0 : sv.longValue());
    }
}
