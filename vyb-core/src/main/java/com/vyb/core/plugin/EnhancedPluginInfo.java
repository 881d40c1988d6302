package com.vyb.core.plugin;

import java.util.Map;

/**
 * 带健康探测与依赖状态的插件信息
 *
 * @param healthStatus     healthy / unhealthy / unknown（未加载）
 * @param dependencyStatus 依赖名 -> 状态标签，未发现的依赖为 missing
 */
public record EnhancedPluginInfo(PluginInfo pluginInfo,
                                 String healthStatus,
                                 String healthError,
                                 Map<String, String> dependencyStatus) {

    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";
    public static final String UNKNOWN = "unknown";
    public static final String MISSING = "missing";

    public boolean isHealthy() {
        return HEALTHY.equals(healthStatus);
    }
}
