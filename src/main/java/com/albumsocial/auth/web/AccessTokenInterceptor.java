package com.albumsocial.auth.web;

import com.albumsocial.auth.service.AccessClaims;
import com.albumsocial.auth.service.JwtService;
import com.albumsocial.auth.service.SessionVersionStore;
import com.albumsocial.common.api.ApiCodes;
import com.albumsocial.common.api.Result;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.JwtException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;

/**
 * 轻量鉴权拦截器。
 * <ul>
 *   <li>没有 Authorization 头：放行，匿名访问公开读接口；写接口在 controller 里 requireUserId</li>
 *   <li>带 Bearer token：解析并校验会话版本，把 userId 放进 request attribute 与 AuthContext</li>
 *   <li>token 无效或会话已失效：直接返回 401 JSON</li>
 * </ul>
 */
@Slf4j
@Component
public class AccessTokenInterceptor implements HandlerInterceptor {

    public static final String REQ_ATTR_USER_ID = "X-Auth-UserId";

    private final JwtService jwtService;
    private final ObjectMapper objectMapper;
    private final SessionVersionStore sessionVersionStore;

    public AccessTokenInterceptor(JwtService jwtService, ObjectMapper objectMapper, SessionVersionStore sessionVersionStore) {
        this.jwtService = jwtService;
        this.objectMapper = objectMapper;
        this.sessionVersionStore = sessionVersionStore;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String header = request.getHeader("Authorization");
        if (header == null || !header.startsWith("Bearer ")) {
            return true;
        }

        String token = header.substring("Bearer ".length()).trim();
        AccessClaims claims;
        try {
            claims = jwtService.verify(token);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("invalid access token: path={}, err={}", request.getRequestURI(), e.toString());
            writeUnauthorized(request, response, "unauthorized");
            return false;
        }
        long userId = claims.userId();
        if (!sessionVersionStore.isValid(userId, claims.sessionVersion())) {
            writeUnauthorized(request, response, "session_invalid");
            return false;
        }
        request.setAttribute(REQ_ATTR_USER_ID, userId);
        AuthContext.setUserId(userId);
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        AuthContext.clear();
    }

    private void writeUnauthorized(HttpServletRequest request, HttpServletResponse response, String message) {
        response.setStatus(401);
        response.setCharacterEncoding("UTF-8");
        response.setContentType("application/json;charset=UTF-8");
        try {
            response.getWriter().write(objectMapper.writeValueAsString(Result.fail(ApiCodes.UNAUTHORIZED, message)));
        } catch (IOException writeErr) {
            log.debug("write unauthorized response failed: path={}, err={}", request.getRequestURI(), writeErr.toString());
        }
    }
}
