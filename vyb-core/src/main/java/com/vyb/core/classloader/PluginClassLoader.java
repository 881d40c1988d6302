package com.vyb.core.classloader;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 插件类加载器
 * <p>
 * 插件 Jar 内的类与资源优先（Child-First），但组件契约、日志门面和 JDK
 * 必须由宿主加载，否则工厂返回的组件无法被宿主识别为 {@code Component}。
 * 关闭后拒绝继续加载类。
 */
@Slf4j
public class PluginClassLoader extends URLClassLoader {

    // 只能由宿主提供的包前缀
    private static final Set<String> HOST_PACKAGES = Set.of(
            "java.", "javax.", "jdk.", "sun.", "com.sun.",
            "com.vyb.api.",
            "org.slf4j.",
            "ch.qos.logback.");

    static {
        ClassLoader.registerAsParallelCapable();
    }

    @Getter
    private final String pluginName;

    private volatile boolean closed;

    public PluginClassLoader(String pluginName, URL[] urls, ClassLoader parent) {
        super(urls, parent);
        this.pluginName = pluginName;
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        if (closed) {
            throw new IllegalStateException("class loader of plugin " + pluginName + " is closed");
        }
        synchronized (getClassLoadingLock(name)) {
            Class<?> type = findLoadedClass(name);
            if (type == null) {
                type = isHostClass(name) ? loadFromHostFirst(name) : loadFromPluginFirst(name);
            }
            if (resolve) {
                resolveClass(type);
            }
            return type;
        }
    }

    @Override
    public URL getResource(String name) {
        if (closed) {
            return null;
        }
        URL local = findResource(name);
        return local != null ? local : super.getResource(name);
    }

    /**
     * 本地资源在前，父加载器资源在后，去重
     */
    @Override
    public Enumeration<URL> getResources(String name) throws IOException {
        Set<URL> merged = new LinkedHashSet<>(Collections.list(findResources(name)));
        ClassLoader parent = getParent();
        if (parent != null) {
            merged.addAll(Collections.list(parent.getResources(name)));
        }
        return Collections.enumeration(merged);
    }

    /**
     * 只在插件自身的 URL 中查找资源（不含父加载器）
     */
    public List<URL> findLocalResources(String name) throws IOException {
        if (closed) {
            throw new IOException("class loader of plugin " + pluginName + " is closed");
        }
        return Collections.list(findResources(name));
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        super.close();
        log.debug("[{}] Class loader closed", pluginName);
    }

    public boolean isClosed() {
        return closed;
    }

    private Class<?> loadFromHostFirst(String name) throws ClassNotFoundException {
        try {
            return getParent().loadClass(name);
        } catch (ClassNotFoundException e) {
            // 宿主缺失时允许插件自带
            return findClass(name);
        }
    }

    private Class<?> loadFromPluginFirst(String name) throws ClassNotFoundException {
        try {
            return findClass(name);
        } catch (ClassNotFoundException e) {
            return super.loadClass(name, false);
        }
    }

    private static boolean isHostClass(String name) {
        for (String prefix : HOST_PACKAGES) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
