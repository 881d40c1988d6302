package com.vyb.api.exception;

/**
 * 持久化配置非法或无法解析
 */
public class ConfigValidationException extends VybException {

    public ConfigValidationException(String message) {
        super(message);
    }

    public ConfigValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
