package com.vyb.core.spi;

import java.io.File;

/**
 * 插件类加载器工厂 SPI
 * 返回的加载器即插件的“模块句柄”，卸载时若实现了 Closeable 会被关闭
 */
public interface PluginLoaderFactory {
    ClassLoader create(String pluginName, File sourceFile, ClassLoader parent);
}
