package com.lusta.common.api;

/**
 * 唯一性冲突，目前只用于重复注册同名用户。抛出时不应产生任何写入。
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
