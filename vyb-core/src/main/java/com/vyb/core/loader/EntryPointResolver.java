package com.vyb.core.loader;

import com.vyb.api.exception.PluginLoadException;
import com.vyb.api.plugin.ComponentFactory;
import com.vyb.core.classloader.PluginClassLoader;
import com.vyb.core.plugin.PluginManifest;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 入口解析器
 * <p>
 * 在插件自身的类路径中定位唯一的 {@link ComponentFactory}：
 * 清单 entryPoint 优先，否则读取插件 Jar 内的 ServiceLoader 注册文件（不含宿主类路径）。
 * 找不到、找到多个、类型不符都视为加载失败。
 */
@Slf4j
public final class EntryPointResolver {

    public static final String SERVICE_FILE = "META-INF/services/" + ComponentFactory.class.getName();

    private EntryPointResolver() {
    }

    public static ComponentFactory resolve(String pluginName, PluginManifest manifest, ClassLoader classLoader) {
        String className = manifest.getEntryPoint();
        if (className == null || className.isBlank()) {
            className = lookupServiceEntry(pluginName, classLoader);
        }
        log.debug("[{}] Resolved entry point {}", pluginName, className);
        return instantiate(pluginName, className.trim(), classLoader);
    }

    private static String lookupServiceEntry(String pluginName, ClassLoader classLoader) {
        List<URL> serviceFiles;
        try {
            serviceFiles = classLoader instanceof PluginClassLoader
                    ? ((PluginClassLoader) classLoader).findLocalResources(SERVICE_FILE)
                    : Collections.list(classLoader.getResources(SERVICE_FILE));
        } catch (IOException e) {
            throw new PluginLoadException(pluginName, "cannot read " + SERVICE_FILE + ": " + e.getMessage(), e);
        }

        Set<String> providers = new LinkedHashSet<>();
        for (URL url : serviceFiles) {
            providers.addAll(readProviders(pluginName, url));
        }

        if (providers.isEmpty()) {
            throw new PluginLoadException(pluginName,
                    "entry point " + ComponentFactory.class.getSimpleName() + " not found");
        }
        if (providers.size() > 1) {
            throw new PluginLoadException(pluginName, "expected exactly one entry point, found " + providers);
        }
        return providers.iterator().next();
    }

    private static List<String> readProviders(String pluginName, URL url) {
        List<String> providers = new ArrayList<>();
        try (InputStream in = url.openStream();
             BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                int comment = line.indexOf('#');
                if (comment >= 0) {
                    line = line.substring(0, comment);
                }
                line = line.trim();
                if (!line.isEmpty()) {
                    providers.add(line);
                }
            }
        } catch (IOException e) {
            throw new PluginLoadException(pluginName, "cannot read " + url + ": " + e.getMessage(), e);
        }
        return providers;
    }

    private static ComponentFactory instantiate(String pluginName, String className, ClassLoader classLoader) {
        Class<?> type;
        try {
            type = Class.forName(className, true, classLoader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new PluginLoadException(pluginName, "entry point class " + className + " cannot be loaded", e);
        }

        // 签名校验：必须实现 (Logger, HostConfig) -> Component 契约
        if (!ComponentFactory.class.isAssignableFrom(type)) {
            throw new PluginLoadException(pluginName,
                    "invalid entry point signature: " + className + " does not implement "
                            + ComponentFactory.class.getName());
        }
        if (Modifier.isAbstract(type.getModifiers())) {
            throw new PluginLoadException(pluginName, "entry point " + className + " is abstract");
        }

        try {
            Constructor<?> constructor = type.getDeclaredConstructor();
            return (ComponentFactory) constructor.newInstance();
        } catch (NoSuchMethodException e) {
            throw new PluginLoadException(pluginName, "entry point " + className + " has no no-arg constructor", e);
        } catch (ReflectiveOperationException e) {
            throw new PluginLoadException(pluginName, "cannot instantiate entry point " + className, e);
        }
    }
}
