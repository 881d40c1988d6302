package com.vyb.core.classloader;

import com.vyb.api.exception.PluginLoadException;
import com.vyb.core.spi.PluginLoaderFactory;

import java.io.File;
import java.net.MalformedURLException;
import java.net.URL;

public class DefaultPluginLoaderFactory implements PluginLoaderFactory {
    @Override
    public ClassLoader create(String pluginName, File sourceFile, ClassLoader parent) {
        try {
            // 默认实现：每个插件一个 Child-First 加载器
            return new PluginClassLoader(pluginName, new URL[]{sourceFile.toURI().toURL()}, parent);
        } catch (MalformedURLException e) {
            throw new PluginLoadException(pluginName, "cannot open " + sourceFile + ": " + e.getMessage(), e);
        }
    }
}
