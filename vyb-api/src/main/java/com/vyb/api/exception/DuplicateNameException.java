package com.vyb.api.exception;

/**
 * 名称重复（组件、插件或定时任务）
 */
public class DuplicateNameException extends VybException {

    public DuplicateNameException(String kind, String name) {
        super(kind + " '" + name + "' already registered");
    }
}
