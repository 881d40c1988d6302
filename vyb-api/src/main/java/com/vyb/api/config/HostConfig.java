package com.vyb.api.config;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 宿主配置
 * 由宿主构造后注入，插件只读，运行时内部从不自行创建
 */
@Getter
@Builder
public class HostConfig {

    /**
     * 宿主主目录（用户级插件目录和配置目录的基准）
     */
    @Builder.Default
    private final Path homeDir = Paths.get(System.getProperty("user.home"), ".vyb");

    /**
     * 已开启的特性开关
     */
    @Singular
    private final Set<String> features;

    /**
     * 任意键值配置
     */
    @Singular
    private final Map<String, String> properties;

    public static HostConfig defaults() {
        return HostConfig.builder().build();
    }

    public boolean isFeatureEnabled(String feature) {
        return features.contains(feature);
    }

    public Optional<String> getProperty(String key) {
        return Optional.ofNullable(properties.get(key));
    }
}
