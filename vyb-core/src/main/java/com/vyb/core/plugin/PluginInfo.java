package com.vyb.core.plugin;

import com.vyb.api.component.Component;
import com.vyb.api.component.ComponentMetadata;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * 插件登记信息
 * 注册表内部持有可变实例，对外只发放 {@link #copy()} 快照
 */
@Getter
@Setter
public class PluginInfo {

    public static final String BUILTIN = "builtin";

    private ComponentMetadata metadata;

    /**
     * 插件文件路径，内置插件为 {@link #BUILTIN}
     */
    private String filePath;

    private PluginManifest manifest;

    private Instant loadTime;
    private Instant lastUsed;
    private long usageCount;

    private PluginStatus status = PluginStatus.UNLOADED;

    /**
     * 最近一次加载失败原因
     */
    private String lastError;

    // 加载后才存在
    private Component component;
    private ClassLoader classLoader;

    public PluginInfo(ComponentMetadata metadata, String filePath) {
        this.metadata = metadata;
        this.filePath = filePath;
    }

    public String getName() {
        return metadata.getName();
    }

    public boolean isBuiltin() {
        return BUILTIN.equals(filePath);
    }

    synchronized void touch() {
        lastUsed = Instant.now();
        usageCount++;
    }

    public synchronized PluginInfo copy() {
        PluginInfo copy = new PluginInfo(metadata.copy(), filePath);
        copy.manifest = this.manifest;
        copy.loadTime = this.loadTime;
        copy.lastUsed = this.lastUsed;
        copy.usageCount = this.usageCount;
        copy.status = this.status;
        copy.lastError = this.lastError;
        copy.component = this.component;
        copy.classLoader = this.classLoader;
        return copy;
    }

    @Override
    public String toString() {
        return String.format("PluginInfo{name='%s', status=%s, file='%s'}", getName(), status, filePath);
    }
}
