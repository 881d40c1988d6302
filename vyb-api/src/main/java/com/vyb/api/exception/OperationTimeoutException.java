package com.vyb.api.exception;

import java.time.Duration;

/**
 * 有界超时到期
 * 底层操作可能仍在执行，调用方应把超时的卸载视为“未确认”
 */
public class OperationTimeoutException extends VybException {

    public OperationTimeoutException(String operation, String name, Duration timeout) {
        super(operation + " " + name + ": timed out after " + timeout.toMillis() + "ms");
    }
}
