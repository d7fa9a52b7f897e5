package com.lusta.auth.web;

import com.lusta.common.api.AuthFailureException;

/**
 * 请求级别的当前用户。
 *
 * <p>由 AccessTokenInterceptor 在 preHandle 写入、afterCompletion 清理，线程复用时不会串号。</p>
 */
public final class AuthContext {

    private static final ThreadLocal<Long> USER_ID = new ThreadLocal<>();

    private AuthContext() {
    }

    public static void setUserId(Long userId) {
        USER_ID.set(userId);
    }

    /**
     * 需要登录的接口用：未登录抛 {@link AuthFailureException}，由全局异常处理转成 401。
     */
    public static long requireUserId() {
        Long userId = USER_ID.get();
        if (userId == null) {
            throw new AuthFailureException("unauthorized");
        }
        return userId;
    }

    public static void clear() {
        USER_ID.remove();
    }
}
