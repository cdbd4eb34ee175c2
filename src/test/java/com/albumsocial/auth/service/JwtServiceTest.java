package com.albumsocial.auth.service;

import com.albumsocial.auth.config.AuthProperties;
import io.jsonwebtoken.JwtException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtServiceTest {

    private static final String SECRET = "change-me-please-change-me-please-change-me";
    private static final AuthProperties PROPS = new AuthProperties("album-social", SECRET, 0);

    private final JwtService jwt = new JwtService(PROPS);

    @Test
    void verify_ShouldReadUserIdAndSessionVersion() {
        AccessClaims claims = jwt.verify(AccessTokens.issue(PROPS, 123L, 7L));

        assertThat(claims.userId()).isEqualTo(123L);
        assertThat(claims.sessionVersion()).isEqualTo(7L);
    }

    @Test
    void verify_ShouldRejectForeignIssuer() {
        String token = AccessTokens.issue(new AuthProperties("someone-else", SECRET, 0), 1L, 0L);

        assertThatThrownBy(() -> jwt.verify(token)).isInstanceOf(JwtException.class);
    }

    @Test
    void verify_ShouldRejectNonAccessType() {
        String token = AccessTokens.issue(PROPS, 1L, 0L, "refresh", Duration.ofMinutes(5));

        assertThatThrownBy(() -> jwt.verify(token))
                .isInstanceOf(JwtException.class)
                .hasMessage("token_type_not_access");
    }

    @Test
    void verify_ShouldRejectMissingUserId() {
        String token = AccessTokens.issue(PROPS, null, 0L, JwtService.TOKEN_TYPE_ACCESS, Duration.ofMinutes(5));

        assertThatThrownBy(() -> jwt.verify(token))
                .isInstanceOf(JwtException.class)
                .hasMessage("missing_uid");
    }

    @Test
    void verify_ExpiredToken_ShouldBeRejectedUnlessWithinSkew() {
        String token = AccessTokens.issue(PROPS, 1L, 0L, JwtService.TOKEN_TYPE_ACCESS, Duration.ofSeconds(-5));

        assertThatThrownBy(() -> jwt.verify(token)).isInstanceOf(JwtException.class);
        JwtService lenient = new JwtService(new AuthProperties("album-social", SECRET, 60));
        assertThat(lenient.verify(token).userId()).isEqualTo(1L);
    }
}
