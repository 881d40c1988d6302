package com.vyb.core.plugin;

import com.vyb.api.component.Bridge;
import com.vyb.api.component.Component;
import com.vyb.api.component.ComponentMetadata;
import com.vyb.api.component.ComponentType;
import com.vyb.api.component.Extension;
import com.vyb.api.config.HostConfig;
import com.vyb.api.exception.NotFoundException;
import com.vyb.api.exception.PluginLoadException;
import com.vyb.api.exception.VybException;
import com.vyb.api.plugin.ComponentFactory;
import com.vyb.core.loader.DiscoveredPlugin;
import com.vyb.core.loader.EntryPointResolver;
import com.vyb.core.loader.PluginDiscoveryService;
import com.vyb.core.registry.ComponentRegistry;
import com.vyb.core.spi.PluginLoaderFactory;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 插件注册表
 * <p>
 * 职责：
 * 1. 在搜索路径中发现插件文件并登记 {@link PluginInfo}
 * 2. 动态加载：独立类加载器 -> 解析入口 -> 调用工厂 -> 按层级转交组件注册表
 * 3. 卸载：关闭组件、注销、释放类加载器
 * <p>
 * 并发模型：一把读写锁保护插件表与搜索路径。打开 Jar、调用工厂、关闭组件等
 * 可能阻塞的操作都在锁外执行，插件先置为 LOADING 以阻止并发加载。
 */
@Slf4j
public class PluginRegistry {

    public static final String PLUGIN_LOGGER_PREFIX = "vyb.plugin.";

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, PluginInfo> plugins = new LinkedHashMap<>();
    private final List<Path> discoveryPaths = new ArrayList<>();

    // 内置组件实例，卸载后可重新登记
    private final Map<String, Component> builtins = new HashMap<>();

    private final ComponentRegistry componentRegistry;
    private final HostConfig hostConfig;
    private final PluginDiscoveryService discoveryService;
    private final PluginLoaderFactory loaderFactory;
    private final ClassLoader parentClassLoader;

    public PluginRegistry(ComponentRegistry componentRegistry,
                          HostConfig hostConfig,
                          PluginDiscoveryService discoveryService,
                          PluginLoaderFactory loaderFactory,
                          Collection<Path> searchPaths) {
        this.componentRegistry = componentRegistry;
        this.hostConfig = hostConfig;
        this.discoveryService = discoveryService;
        this.loaderFactory = loaderFactory;
        this.parentClassLoader = PluginRegistry.class.getClassLoader();
        for (Path path : searchPaths) {
            addDiscoveryPath(path);
        }
    }

    // ==================== 发现 ====================

    /**
     * 扫描全部搜索路径，登记新发现的插件
     *
     * @return 新登记的插件数，已知名称不计入
     */
    public int discoverPlugins() {
        List<Path> roots = getDiscoveryPaths();

        // 扫描在锁外进行
        List<DiscoveredPlugin> found = new ArrayList<>();
        for (Path root : roots) {
            try {
                found.addAll(discoveryService.scan(root));
            } catch (IOException e) {
                log.warn("Failed to scan plugin root {}: {}", root, e.getMessage());
            }
        }

        int added = 0;
        lock.writeLock().lock();
        try {
            for (DiscoveredPlugin candidate : found) {
                PluginManifest manifest = candidate.manifest();
                String name = manifest.getName();
                if (plugins.containsKey(name)) {
                    continue;
                }
                PluginInfo info = new PluginInfo(toMetadata(manifest), candidate.file().toAbsolutePath().toString());
                info.setManifest(manifest);
                plugins.put(name, info);
                added++;
                log.info("[{}] Discovered plugin v{} ({}) at {}",
                        name, manifest.getVersion(), info.getMetadata().getType().label(), info.getFilePath());
            }
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Plugin discovery finished: roots={}, new={}, total={}", roots.size(), added, size());
        return added;
    }

    /**
     * 登记宿主提供的内置组件，视为已加载
     */
    public void registerBuiltin(ComponentMetadata metadata, Component component) {
        String name = metadata.getName();
        if (!name.equals(component.getName())) {
            throw new PluginLoadException(name, "component reports name '" + component.getName() + "'");
        }
        lock.writeLock().lock();
        try {
            if (plugins.containsKey(name)) {
                throw new PluginLoadException(name, "already registered");
            }
            registerComponent(metadata.getType(), component);

            PluginInfo info = new PluginInfo(metadata.copy(), PluginInfo.BUILTIN);
            info.setComponent(component);
            info.setLoadTime(Instant.now());
            info.setStatus(PluginStatus.LOADED);
            plugins.put(name, info);
            builtins.put(name, component);
            log.info("[{}] Registered built-in {} component", name, metadata.getType().label());
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ==================== 加载 / 卸载 ====================

    /**
     * 加载插件并转交组件注册表
     *
     * @throws NotFoundException   插件未被发现
     * @throws PluginLoadException 打开、入口解析、工厂执行或层级校验失败
     */
    public void loadPlugin(String name) {
        PluginInfo info;
        lock.writeLock().lock();
        try {
            info = require(name);
            PluginStatus status = info.getStatus();
            if (status.isLoaded()) {
                log.debug("[{}] Plugin already loaded", name);
                return;
            }
            if (status == PluginStatus.LOADING) {
                throw new PluginLoadException(name, "load already in progress");
            }
            if (status == PluginStatus.DISABLED) {
                throw new PluginLoadException(name, "plugin is disabled");
            }
            transition(info, PluginStatus.LOADING);
            info.setLastError(null);
        } finally {
            lock.writeLock().unlock();
        }

        log.info("[{}] Loading plugin from {}", name, info.getFilePath());

        ClassLoader classLoader = null;
        Component component;
        try {
            if (info.isBuiltin()) {
                component = builtinComponent(name);
            } else {
                classLoader = loaderFactory.create(name, new File(info.getFilePath()), parentClassLoader);
                ComponentFactory factory = EntryPointResolver.resolve(name, info.getManifest(), classLoader);
                component = invokeFactory(name, factory, classLoader);
            }
            verifyComponent(name, info.getMetadata().getType(), component);
        } catch (RuntimeException e) {
            abortLoad(info, classLoader, e);
            throw e instanceof VybException ? e : new PluginLoadException(name, String.valueOf(e.getMessage()), e);
        } catch (Error e) {
            // 插件代码抛出的 Error 同样不能让状态停在 LOADING
            abortLoad(info, classLoader, e);
            throw e;
        }

        lock.writeLock().lock();
        try {
            try {
                registerComponent(info.getMetadata().getType(), component);
            } catch (RuntimeException e) {
                abortLoad(info, classLoader, e);
                throw new PluginLoadException(name, "component registration failed: " + e.getMessage(), e);
            }
            info.setComponent(component);
            info.setClassLoader(classLoader);
            info.setLoadTime(Instant.now());
            transition(info, PluginStatus.LOADED);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[{}] Plugin loaded", name);
    }

    /**
     * 卸载插件
     * <p>
     * 组件关闭失败只记录日志，插件总能回到 UNLOADED。
     * UNLOADED 与 DISABLED 状态下为空操作。
     */
    public void unloadPlugin(String name) {
        Detached detached;
        lock.writeLock().lock();
        try {
            PluginInfo info = require(name);
            PluginStatus status = info.getStatus();
            if (status == PluginStatus.UNLOADED || status == PluginStatus.DISABLED) {
                return;
            }
            if (status == PluginStatus.LOADING) {
                throw new VybException("plugin " + name + ": cannot unload while loading");
            }
            detached = detach(info);
            transition(info, PluginStatus.UNLOADED);
        } finally {
            lock.writeLock().unlock();
        }

        release(name, detached);
        log.info("[{}] Plugin unloaded", name);
    }

    /**
     * 禁用插件，已加载时先卸载
     */
    public void disablePlugin(String name) {
        Detached detached = null;
        lock.writeLock().lock();
        try {
            PluginInfo info = require(name);
            PluginStatus status = info.getStatus();
            if (status == PluginStatus.DISABLED) {
                return;
            }
            if (status == PluginStatus.LOADING) {
                throw new VybException("plugin " + name + ": cannot disable while loading");
            }
            if (status.isLoaded()) {
                detached = detach(info);
            }
            transition(info, PluginStatus.DISABLED);
            info.getMetadata().setEnabled(false);
        } finally {
            lock.writeLock().unlock();
        }

        if (detached != null) {
            release(name, detached);
        }
        log.info("[{}] Plugin disabled", name);
    }

    /**
     * 重新启用：DISABLED -> UNLOADED，其余状态只刷新启用标记
     */
    public void enablePlugin(String name) {
        lock.writeLock().lock();
        try {
            PluginInfo info = require(name);
            info.getMetadata().setEnabled(true);
            if (info.getStatus() == PluginStatus.DISABLED) {
                transition(info, PluginStatus.UNLOADED);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[{}] Plugin enabled", name);
    }

    /**
     * 初始化与健康检查通过后由管理器调用：LOADED -> ACTIVE
     */
    public void markActive(String name) {
        lock.writeLock().lock();
        try {
            PluginInfo info = require(name);
            if (info.getStatus() == PluginStatus.ACTIVE) {
                return;
            }
            transition(info, PluginStatus.ACTIVE);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ==================== 查询 ====================

    /**
     * 获取插件快照，同时记录一次使用
     */
    public PluginInfo getPlugin(String name) {
        lock.readLock().lock();
        try {
            PluginInfo info = require(name);
            info.touch();
            return info.copy();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 查询状态，不计入使用次数
     */
    public Optional<PluginStatus> findStatus(String name) {
        lock.readLock().lock();
        try {
            PluginInfo info = plugins.get(name);
            return info != null ? Optional.of(info.getStatus()) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String name) {
        lock.readLock().lock();
        try {
            return plugins.containsKey(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, PluginInfo> listPlugins() {
        lock.readLock().lock();
        try {
            Map<String, PluginInfo> result = new LinkedHashMap<>();
            plugins.forEach((name, info) -> result.put(name, info.copy()));
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public PluginStats getStats() {
        lock.readLock().lock();
        try {
            int loaded = 0;
            int active = 0;
            int error = 0;
            for (PluginInfo info : plugins.values()) {
                switch (info.getStatus()) {
                    case LOADED:
                        loaded++;
                        break;
                    case ACTIVE:
                        active++;
                        break;
                    case ERROR:
                        error++;
                        break;
                    default:
                        break;
                }
            }
            return new PluginStats(plugins.size(), loaded, active, error);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== 搜索路径 ====================

    public void addDiscoveryPath(Path path) {
        Path normalized = path.normalize();
        lock.writeLock().lock();
        try {
            if (!discoveryPaths.contains(normalized)) {
                discoveryPaths.add(normalized);
                log.debug("Added plugin discovery path {}", normalized);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void removeDiscoveryPath(Path path) {
        lock.writeLock().lock();
        try {
            if (discoveryPaths.remove(path.normalize())) {
                log.debug("Removed plugin discovery path {}", path);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<Path> getDiscoveryPaths() {
        lock.readLock().lock();
        try {
            return List.copyOf(discoveryPaths);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== 内部方法 ====================

    private int size() {
        lock.readLock().lock();
        try {
            return plugins.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private PluginInfo require(String name) {
        PluginInfo info = plugins.get(name);
        if (info == null) {
            throw new NotFoundException("plugin", name);
        }
        return info;
    }

    private void transition(PluginInfo info, PluginStatus target) {
        PluginStatus current = info.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "plugin " + info.getName() + ": illegal status transition " + current + " -> " + target);
        }
        info.setStatus(target);
        log.debug("[{}] Status {} -> {}", info.getName(), current, target);
    }

    private Component builtinComponent(String name) {
        lock.readLock().lock();
        try {
            Component component = builtins.get(name);
            if (component == null) {
                throw new PluginLoadException(name, "built-in component missing");
            }
            return component;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 以插件类加载器为上下文调用工厂
     */
    private Component invokeFactory(String name, ComponentFactory factory, ClassLoader classLoader) {
        Logger pluginLogger = LoggerFactory.getLogger(PLUGIN_LOGGER_PREFIX + name);
        Thread thread = Thread.currentThread();
        ClassLoader previous = thread.getContextClassLoader();
        thread.setContextClassLoader(classLoader);
        try {
            Component component = factory.create(pluginLogger, hostConfig);
            if (component == null) {
                throw new PluginLoadException(name, "factory returned no component");
            }
            return component;
        } catch (VybException e) {
            throw e;
        } catch (Exception | LinkageError e) {
            throw new PluginLoadException(name, "factory error: " + e.getMessage(), e);
        } finally {
            thread.setContextClassLoader(previous);
        }
    }

    private void verifyComponent(String name, ComponentType type, Component component) {
        if (!name.equals(component.getName())) {
            throw new PluginLoadException(name,
                    "component name '" + component.getName() + "' does not match plugin name");
        }
        if (!type.isSatisfiedBy(component)) {
            throw new PluginLoadException(name,
                    "declared type " + type.label() + " but component does not implement "
                            + (type == ComponentType.BRIDGE ? Bridge.class : Extension.class).getSimpleName());
        }
    }

    private void registerComponent(ComponentType type, Component component) {
        switch (type) {
            case CORE:
                componentRegistry.registerCore(component);
                break;
            case BRIDGE:
                componentRegistry.registerBridge((Bridge) component);
                break;
            default:
                componentRegistry.registerExtension((Extension) component);
                break;
        }
    }

    private void abortLoad(PluginInfo info, ClassLoader classLoader, Throwable cause) {
        closeClassLoader(info.getName(), classLoader);
        lock.writeLock().lock();
        try {
            info.setLastError(cause.getMessage());
            transition(info, PluginStatus.ERROR);
        } finally {
            lock.writeLock().unlock();
        }
        log.error("[{}] Plugin load failed: {}", info.getName(), cause.getMessage());
    }

    /**
     * 摘下组件与类加载器并注销组件（调用方持有写锁）
     */
    private Detached detach(PluginInfo info) {
        Component component = info.getComponent();
        ClassLoader classLoader = info.getClassLoader();
        if (component != null) {
            componentRegistry.unregister(info.getName());
        }
        info.setComponent(null);
        info.setClassLoader(null);
        return new Detached(component, classLoader);
    }

    private void release(String name, Detached detached) {
        if (detached.component() != null) {
            try {
                detached.component().shutdown();
            } catch (Exception e) {
                log.warn("[{}] Plugin shutdown failed: {}", name, e.getMessage(), e);
            }
        }
        closeClassLoader(name, detached.classLoader());
    }

    private void closeClassLoader(String name, ClassLoader classLoader) {
        if (classLoader instanceof Closeable) {
            try {
                ((Closeable) classLoader).close();
            } catch (IOException e) {
                log.warn("[{}] Failed to close plugin class loader: {}", name, e.getMessage());
            }
        }
    }

    static ComponentMetadata toMetadata(PluginManifest manifest) {
        ComponentMetadata metadata = new ComponentMetadata(manifest.getName(), ComponentType.parse(manifest.getType()));
        metadata.setVersion(manifest.getVersion());
        metadata.setDescription(manifest.getDescription());
        metadata.setDependencies(new ArrayList<>(manifest.getDependencies()));
        return metadata;
    }

    private record Detached(Component component, ClassLoader classLoader) {
    }
}
