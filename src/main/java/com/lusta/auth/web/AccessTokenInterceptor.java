package com.lusta.auth.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lusta.auth.service.AuthService;
import com.lusta.common.api.ApiCodes;
import com.lusta.common.api.AuthFailureException;
import com.lusta.common.api.Result;
import com.lusta.domain.dto.Identity;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * 轻量鉴权拦截器：
 * <ul>
 *   <li>没有 Authorization 头：放行，由需要登录的接口自行返回 401</li>
 *   <li>带了 Bearer token：解析出 userId 放到 AuthContext</li>
 *   <li>token 无效：直接 401，统一 Result JSON</li>
 * </ul>
 */
@Slf4j
@Component
public class AccessTokenInterceptor implements HandlerInterceptor {

    private final AuthService authService;
    private final ObjectMapper objectMapper;

    public AccessTokenInterceptor(AuthService authService, ObjectMapper objectMapper) {
        this.authService = authService;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String header = request.getHeader("Authorization");
        if (header == null || !header.startsWith("Bearer ")) {
            return true;
        }

        String token = header.substring("Bearer ".length()).trim();
        try {
            Identity identity = authService.verifyAccessToken(token);
            AuthContext.setUserId(identity.userId());
            return true;
        } catch (AuthFailureException e) {
            response.setStatus(401);
            response.setCharacterEncoding("UTF-8");
            response.setContentType("application/json;charset=UTF-8");
            try {
                String json = objectMapper.writeValueAsString(Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized"));
                response.getWriter().write(json);
            } catch (Exception writeErr) {
                log.debug("write unauthorized response failed: path={}, err={}", request.getRequestURI(), writeErr.toString());
            }
            return false;
        }
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        AuthContext.clear();
    }
}
