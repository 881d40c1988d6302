package com.vyb.core.plugin;

import java.time.Duration;

/**
 * 插件管理器统计
 *
 * @param activeHandles 保留的取消句柄数
 */
public record ManagerStats(PluginStats pluginStats,
                           boolean autoDiscovery,
                           boolean autoLoad,
                           Duration discoveryInterval,
                           int activeHandles) {
}
