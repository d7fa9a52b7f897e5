package com.lusta.common.api;

/**
 * 统一错误码：前三位跟随 HTTP 状态码，便于排查。
 */
public final class ApiCodes {

    private ApiCodes() {
    }

    /** 参数不合法 / 业务校验失败 */
    public static final int BAD_REQUEST = 40000;

    /** 未登录 / token 无效 / 用户名密码错误 */
    public static final int UNAUTHORIZED = 40100;

    /** 资源不存在（用户、路由） */
    public static final int NOT_FOUND = 40400;

    /** 唯一性冲突（重复注册） */
    public static final int CONFLICT = 40900;

    /** 服务端未预期异常 */
    public static final int INTERNAL_ERROR = 50000;
}
