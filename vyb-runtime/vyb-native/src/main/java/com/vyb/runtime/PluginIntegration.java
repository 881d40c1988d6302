package com.vyb.runtime;

import com.vyb.api.component.Component;
import com.vyb.api.component.ComponentMetadata;
import com.vyb.api.config.HostConfig;
import com.vyb.api.exception.PluginLoadException;
import com.vyb.api.exception.VybException;
import com.vyb.core.plugin.EnhancedPluginInfo;
import com.vyb.core.plugin.PluginInfo;
import com.vyb.core.plugin.PluginManager;
import com.vyb.core.registry.ModuleManager;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 插件系统与宿主的集成层
 * <p>
 * 初始化顺序：管理器初始化 -> 登记内置组件 -> 追加搜索路径 -> 执行一次发现。
 * 关闭后所有插件操作都会被拒绝。
 */
@Slf4j
public class PluginIntegration {

    @Getter
    private final PluginManager manager;

    private final ModuleManager moduleManager;
    private final HostConfig hostConfig;
    private final List<BuiltinPlugin> builtins;
    private final List<Path> extraPaths;

    private final AtomicBoolean enabled = new AtomicBoolean(true);

    public PluginIntegration(PluginManager manager,
                             HostConfig hostConfig,
                             List<BuiltinPlugin> builtins,
                             List<Path> extraPaths) {
        this.manager = manager;
        this.moduleManager = manager.getModuleManager();
        this.hostConfig = hostConfig;
        this.builtins = new ArrayList<>(builtins);
        this.extraPaths = new ArrayList<>(extraPaths);
    }

    public void initialize() {
        log.info("Initializing plugin integration");

        manager.initialize();

        registerBuiltinPlugins();

        extraPaths.forEach(manager.getRegistry()::addDiscoveryPath);

        try {
            manager.getRegistry().discoverPlugins();
        } catch (RuntimeException e) {
            log.warn("Plugin discovery failed: {}", e.getMessage());
        }

        log.info("Plugin integration initialized: builtins={}, discoveryPaths={}",
                builtins.size(), manager.getRegistry().getDiscoveryPaths().size());
    }

    /**
     * 关闭管理器后再关闭所有仍登记的组件
     */
    public void shutdown() {
        if (!enabled.compareAndSet(true, false)) {
            return;
        }
        log.info("Shutting down plugin integration");
        manager.shutdown();
        moduleManager.shutdownAll();
        log.info("Plugin integration shut down");
    }

    // ==================== 插件操作 ====================

    public void loadPlugin(String name) {
        ensureEnabled();
        manager.loadPluginSafe(name);
    }

    public void unloadPlugin(String name) {
        ensureEnabled();
        manager.unloadPluginSafe(name);
    }

    public void enablePlugin(String name) {
        ensureEnabled();
        manager.enablePlugin(name);
    }

    public void disablePlugin(String name) {
        ensureEnabled();
        manager.disablePlugin(name);
    }

    public void restartPlugin(String name) {
        ensureEnabled();
        manager.restartPlugin(name);
    }

    public int discoverPlugins() {
        ensureEnabled();
        return manager.getRegistry().discoverPlugins();
    }

    public Map<String, PluginInfo> listPlugins() {
        return manager.getRegistry().listPlugins();
    }

    public EnhancedPluginInfo getPluginInfo(String name) {
        return manager.getPluginInfo(name);
    }

    public boolean isEnabled() {
        return enabled.get();
    }

    public PluginSystemStats getStats() {
        int builtin = 0;
        int external = 0;
        for (PluginInfo info : listPlugins().values()) {
            if (info.isBuiltin()) {
                builtin++;
            } else {
                external++;
            }
        }
        return new PluginSystemStats(enabled.get(), manager.getStats(), builtin, external,
                moduleManager.listComponents().size());
    }

    public PluginCommand createCommand() {
        return new PluginCommand(this);
    }

    // ==================== 内部方法 ====================

    private void registerBuiltinPlugins() {
        for (BuiltinPlugin builtin : builtins) {
            try {
                registerBuiltinPlugin(builtin);
            } catch (RuntimeException e) {
                log.warn("[{}] Failed to register built-in plugin: {}", builtin.name(), e.getMessage());
            }
        }
    }

    private void registerBuiltinPlugin(BuiltinPlugin builtin) {
        Component component;
        try {
            component = builtin.factory().create(LoggerFactory.getLogger("vyb.builtin." + builtin.name()), hostConfig);
        } catch (Exception e) {
            throw new PluginLoadException(builtin.name(), "factory error: " + e.getMessage(), e);
        }
        if (component == null) {
            throw new PluginLoadException(builtin.name(), "factory returned no component");
        }
        if (!builtin.type().isSatisfiedBy(component)) {
            throw new PluginLoadException(builtin.name(),
                    "declared type " + builtin.type().label() + " does not match component");
        }

        ComponentMetadata metadata = new ComponentMetadata(builtin.name(), builtin.type());
        metadata.setDescription(builtin.description());
        manager.getRegistry().registerBuiltin(metadata, component);
    }

    private void ensureEnabled() {
        if (!enabled.get()) {
            throw new VybException("plugin system is disabled");
        }
    }
}
