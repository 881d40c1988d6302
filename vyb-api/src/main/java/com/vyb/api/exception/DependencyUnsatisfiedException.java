package com.vyb.api.exception;

/**
 * 依赖未满足：依赖不存在，或未处于运行且健康状态
 */
public class DependencyUnsatisfiedException extends VybException {

    public DependencyUnsatisfiedException(String message) {
        super(message);
    }
}
