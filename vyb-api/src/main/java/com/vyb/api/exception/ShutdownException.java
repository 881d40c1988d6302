package com.vyb.api.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 关闭过程中收集到的全部错误
 * 关闭不会因单个组件失败而中断，失败原因按关闭顺序汇总于此
 */
public class ShutdownException extends VybException {

    private final Map<String, String> failures;

    public ShutdownException(Map<String, Throwable> errors) {
        super(buildMessage(errors));
        Map<String, String> messages = new LinkedHashMap<>();
        errors.forEach((name, error) -> {
            messages.put(name, String.valueOf(error.getMessage()));
            addSuppressed(error);
        });
        this.failures = Collections.unmodifiableMap(messages);
    }

    public Map<String, String> getFailures() {
        return failures;
    }

    private static String buildMessage(Map<String, Throwable> errors) {
        StringBuilder sb = new StringBuilder("shutdown errors:");
        errors.forEach((name, error) -> sb.append(" [").append(name).append(": ")
                .append(error.getMessage()).append(']'));
        return sb.toString();
    }
}
