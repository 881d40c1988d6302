package com.vyb.core.plugin;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 插件清单
 * 对应插件旁的 {@code <name>.json} 或 Jar 内的 {@code plugin.yml}
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class PluginManifest {

    public static final String DEFAULT_VERSION = "1.0.0";

    private String name;
    private String version;
    private String description;
    private String author;
    private String license;

    /**
     * 入口类全限定名，为空时按 ServiceLoader 约定查找 ComponentFactory
     */
    @JsonProperty("entry_point")
    @JsonAlias("entryPoint")
    private String entryPoint;

    private String type = "extension";

    private List<String> dependencies = new ArrayList<>();

    @JsonAlias("config")
    private Map<String, Object> settings = new HashMap<>();

    private List<String> permissions = new ArrayList<>();

    @JsonProperty("min_version")
    @JsonAlias("minVersion")
    private String minVersion;

    @JsonProperty("max_version")
    @JsonAlias("maxVersion")
    private String maxVersion;

    /**
     * 以文件名合成默认清单
     */
    public static PluginManifest synthesize(String baseName) {
        PluginManifest manifest = new PluginManifest();
        manifest.setName(baseName);
        manifest.setVersion(DEFAULT_VERSION);
        manifest.setDescription("Plugin " + baseName);
        return manifest;
    }

    /**
     * 补齐缺省值
     */
    public PluginManifest normalize(String baseName) {
        if (name == null || name.isBlank()) {
            name = baseName;
        }
        if (version == null || version.isBlank()) {
            version = DEFAULT_VERSION;
        }
        if (dependencies == null) {
            dependencies = new ArrayList<>();
        }
        if (settings == null) {
            settings = new HashMap<>();
        }
        if (permissions == null) {
            permissions = new ArrayList<>();
        }
        return this;
    }

    @Override
    public String toString() {
        return String.format("PluginManifest{name='%s', version='%s', type='%s'}", name, version, type);
    }
}
