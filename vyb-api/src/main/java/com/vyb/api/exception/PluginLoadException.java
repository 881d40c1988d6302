package com.vyb.api.exception;

/**
 * 插件加载失败（打开、入口解析、签名校验、工厂执行、层级不匹配）
 */
public class PluginLoadException extends VybException {

    public PluginLoadException(String pluginName, String reason) {
        super("plugin " + pluginName + ": " + reason);
    }

    public PluginLoadException(String pluginName, String reason, Throwable cause) {
        super("plugin " + pluginName + ": " + reason, cause);
    }
}
