package com.lusta.common.api;

/**
 * 凭证校验失败：用户名不存在、密码错误，或连接携带的 token 无法解析出身份。
 */
public class AuthFailureException extends RuntimeException {

    public AuthFailureException(String message) {
        super(message);
    }

    public AuthFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
