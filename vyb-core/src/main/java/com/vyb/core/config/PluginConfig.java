package com.vyb.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.vyb.api.component.ComponentMetadata;
import com.vyb.api.component.ComponentType;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单个插件的持久化配置，每个插件一份 JSON 文档
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PluginConfig {

    private String name;

    private ComponentMetadata metadata;

    private Map<String, Object> settings = new LinkedHashMap<>();

    private AdvancedPluginConfig advanced = new AdvancedPluginConfig();

    private Instant updatedAt;

    /**
     * 保守默认值：网络关闭，文件系统仅开放少量安全路径
     */
    public static PluginConfig defaults(String name) {
        PluginConfig config = new PluginConfig();
        config.setName(name);
        config.setMetadata(new ComponentMetadata(name, ComponentType.EXTENSION));
        return config;
    }

    @JsonIgnore
    public boolean isEnabled() {
        return metadata == null || metadata.isEnabled();
    }
}
