package com.vyb.api.exception;

/**
 * 组件运行时基础异常
 *
 * @author vyb
 */
public class VybException extends RuntimeException {

    public VybException(String message) {
        super(message);
    }

    public VybException(String message, Throwable cause) {
        super(message, cause);
    }
}
