package com.vyb.runtime;

import com.vyb.core.plugin.ManagerStats;

/**
 * 插件系统整体统计
 */
public record PluginSystemStats(boolean enabled,
                                ManagerStats managerStats,
                                int builtinCount,
                                int externalCount,
                                int componentCount) {
}
