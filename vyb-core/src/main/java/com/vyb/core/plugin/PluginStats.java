package com.vyb.core.plugin;

/**
 * 插件注册表统计
 */
public record PluginStats(int totalPlugins, int loadedCount, int activeCount, int errorCount) {
}
