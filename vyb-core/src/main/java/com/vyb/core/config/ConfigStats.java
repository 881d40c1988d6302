package com.vyb.core.config;

import java.nio.file.Path;

/**
 * 配置存储统计
 */
public record ConfigStats(int totalConfigs, int enabledConfigs, Path configDir) {
}
