package com.vyb.core.loader;

import com.vyb.core.plugin.PluginManifest;

import java.nio.file.Path;

/**
 * 一次扫描发现的插件文件及其清单
 */
public record DiscoveredPlugin(PluginManifest manifest, Path file) {
}
