package com.vyb.api.exception;

/**
 * 按名称查找失败
 */
public class NotFoundException extends VybException {

    public NotFoundException(String kind, String name) {
        super(kind + " '" + name + "' not found");
    }

    public NotFoundException(String message) {
        super(message);
    }
}
