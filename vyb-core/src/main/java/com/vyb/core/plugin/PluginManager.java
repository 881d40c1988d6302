package com.vyb.core.plugin;

import com.vyb.api.component.Component;
import com.vyb.api.exception.NotFoundException;
import com.vyb.api.exception.OperationTimeoutException;
import com.vyb.api.exception.VybException;
import com.vyb.core.config.PluginConfig;
import com.vyb.core.config.PluginConfigStore;
import com.vyb.core.config.RuntimeConfig;
import com.vyb.core.registry.ModuleManager;
import com.vyb.core.scheduler.PluginScheduler;
import com.vyb.core.security.PluginSecurity;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 插件管理器
 * <p>
 * 职责：在 {@link PluginRegistry} 之上串起安全校验、持久化配置与调度：
 * 1. 每次加载先过安全门，拒绝即不触达注册表
 * 2. 加载、卸载、重启都在有界超时内执行，按插件名保留取消句柄
 * 3. 启用/禁用写入配置存储，并按 autoLoad 决定是否顺带加载/卸载
 * <p>
 * 超时只让调用方返回，底层操作可能仍在执行；超时的卸载应视为未确认。
 */
@Slf4j
public class PluginManager {

    public static final String AUTO_DISCOVERY_TASK = "auto_discovery";

    private final RuntimeConfig config;

    @Getter
    private final PluginRegistry registry;

    @Getter
    private final ModuleManager moduleManager;

    @Getter
    private final PluginSecurity security;

    @Getter
    private final PluginConfigStore configStore;

    @Getter
    private final PluginScheduler scheduler;

    // 按插件名保留的取消句柄
    private final Map<String, Future<?>> handles = new ConcurrentHashMap<>();

    private final ThreadPoolExecutor executor;

    public PluginManager(RuntimeConfig config,
                         PluginRegistry registry,
                         ModuleManager moduleManager,
                         PluginSecurity security,
                         PluginConfigStore configStore,
                         PluginScheduler scheduler) {
        this.config = config;
        this.registry = registry;
        this.moduleManager = moduleManager;
        this.security = security;
        this.configStore = configStore;
        this.scheduler = scheduler;

        AtomicInteger counter = new AtomicInteger();
        int threads = Math.max(1, config.getMaxConcurrent());
        this.executor = new ThreadPoolExecutor(
                threads,
                threads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                r -> {
                    Thread thread = new Thread(r, "vyb-plugin-op-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    thread.setUncaughtExceptionHandler((t, e) ->
                            log.error("Plugin operation thread {} died: {}", t.getName(), e.getMessage(), e));
                    return thread;
                });
        this.executor.allowCoreThreadTimeOut(true);
    }

    // ==================== 生命周期 ====================

    /**
     * 初始化：配置存储 -> 安全门 -> 首次发现 -> 自动加载 -> 调度器 -> 周期发现
     */
    public void initialize() {
        log.info("Initializing plugin manager");

        try {
            configStore.initialize();
        } catch (IOException e) {
            throw new VybException("failed to initialize plugin config store: " + e.getMessage(), e);
        }

        security.initialize(config);

        if (config.isAutoDiscovery()) {
            try {
                registry.discoverPlugins();
            } catch (RuntimeException e) {
                log.warn("Initial plugin discovery failed: {}", e.getMessage(), e);
            }
        }

        if (config.isAutoLoad()) {
            loadEnabledPlugins();
        }

        scheduler.start();

        Duration interval = config.getDiscoveryInterval();
        if (config.isAutoDiscovery() && interval != null && !interval.isZero() && !interval.isNegative()) {
            scheduler.scheduleRepeating(AUTO_DISCOVERY_TASK, interval, () -> registry.discoverPlugins());
        }

        log.info("Plugin manager initialized: autoDiscovery={}, autoLoad={}",
                config.isAutoDiscovery(), config.isAutoLoad());
    }

    /**
     * 关闭：取消全部句柄 -> 停止调度器 -> 逐个限时卸载，单个卸载失败或超时只记录
     * <p>
     * 卸载超时的插件不会阻塞后续插件，其工作线程在最后随执行器一起被中断。
     */
    public void shutdown() {
        if (executor.isShutdown()) {
            log.debug("Plugin manager already shut down");
            return;
        }
        log.info("Shutting down plugin manager");

        handles.values().forEach(future -> future.cancel(true));
        handles.clear();

        scheduler.stop();

        for (String name : registry.listPlugins().keySet()) {
            try {
                runWithTimeout("unload", name, config.getOperationTimeout(), false, () -> registry.unloadPlugin(name));
            } catch (OperationTimeoutException e) {
                log.warn("[{}] Unload timed out during shutdown, continuing", name);
            } catch (RuntimeException e) {
                log.warn("[{}] Failed to unload plugin during shutdown: {}", name, e.getMessage());
            }
        }

        executor.shutdownNow();
        log.info("Plugin manager shut down");
    }

    /**
     * 加载所有持久化配置为启用的插件
     *
     * @return 成功加载的数量
     */
    public int loadEnabledPlugins() {
        Map<String, PluginInfo> plugins = registry.listPlugins();
        int loaded = 0;
        for (PluginInfo info : plugins.values()) {
            String name = info.getName();
            if (info.getStatus() == PluginStatus.DISABLED || !info.getMetadata().isEnabled()) {
                continue;
            }
            try {
                if (!configStore.isEnabled(name)) {
                    continue;
                }
                loadPluginSafe(name);
                loaded++;
            } catch (RuntimeException e) {
                log.warn("[{}] Failed to load enabled plugin: {}", name, e.getMessage());
            }
        }
        log.info("Loaded enabled plugins: loaded={}, total={}", loaded, plugins.size());
        return loaded;
    }

    // ==================== 安全操作 ====================

    /**
     * 安全校验后加载，并完成初始化与健康检查；初始化失败时回滚卸载
     */
    public void loadPluginSafe(String name) {
        security.validatePlugin(name);

        PluginInfo info = registry.getPlugin(name);
        if (!info.isBuiltin()) {
            security.validatePluginFile(Paths.get(info.getFilePath()));
        }

        runWithTimeout("load", name, config.getOperationTimeout(), true, () -> {
            registry.loadPlugin(name);
            try {
                initializeLoadedPlugin(name);
            } catch (RuntimeException e) {
                rollback(name);
                throw e;
            }
        });
        log.info("[{}] Plugin loaded safely", name);
    }

    public void unloadPluginSafe(String name) {
        Future<?> handle = handles.remove(name);
        if (handle != null && !handle.isDone()) {
            log.info("[{}] Cancelling in-flight plugin operation", name);
            handle.cancel(true);
        }

        runWithTimeout("unload", name, config.getOperationTimeout(), false, () -> registry.unloadPlugin(name));
        log.info("[{}] Plugin unloaded safely", name);
    }

    /**
     * 卸载 -> 短暂等待 -> 加载；卸载失败则不再加载
     */
    public void restartPlugin(String name) {
        log.info("[{}] Restarting plugin", name);
        try {
            unloadPluginSafe(name);
        } catch (RuntimeException e) {
            throw new VybException("failed to restart plugin " + name + ": unload failed: " + e.getMessage(), e);
        }

        try {
            Thread.sleep(config.getRestartDelay().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VybException("failed to restart plugin " + name + ": interrupted", e);
        }

        try {
            loadPluginSafe(name);
        } catch (RuntimeException e) {
            throw new VybException("failed to restart plugin " + name + ": load failed: " + e.getMessage(), e);
        }
        log.info("[{}] Plugin restarted", name);
    }

    public void enablePlugin(String name) {
        PluginInfo info = registry.getPlugin(name);
        if (info.getStatus() != PluginStatus.DISABLED && configStore.isEnabled(name)) {
            return;
        }

        registry.enablePlugin(name);
        persistEnabled(info, true);

        if (config.isAutoLoad()) {
            loadPluginSafe(name);
        }
        log.info("[{}] Plugin enabled", name);
    }

    public void disablePlugin(String name) {
        PluginInfo info = registry.getPlugin(name);
        if (info.getStatus() == PluginStatus.DISABLED) {
            return;
        }

        if (info.getStatus().isLoaded()) {
            unloadPluginSafe(name);
        }
        registry.disablePlugin(name);
        persistEnabled(info, false);
        log.info("[{}] Plugin disabled", name);
    }

    // ==================== 查询 ====================

    /**
     * 插件信息 + 有界健康探测 + 依赖状态
     */
    public EnhancedPluginInfo getPluginInfo(String name) {
        PluginInfo info = registry.getPlugin(name);

        String healthStatus = EnhancedPluginInfo.UNKNOWN;
        String healthError = null;
        Component component = info.getComponent();
        if (component != null) {
            try {
                probeHealth(name, component);
                healthStatus = EnhancedPluginInfo.HEALTHY;
            } catch (RuntimeException e) {
                healthStatus = EnhancedPluginInfo.UNHEALTHY;
                healthError = e.getMessage();
            }
        }

        Map<String, String> dependencyStatus = new LinkedHashMap<>();
        List<String> dependencies = info.getMetadata().getDependencies();
        if (dependencies != null) {
            for (String dep : dependencies) {
                dependencyStatus.put(dep, registry.findStatus(dep)
                        .map(PluginStatus::label)
                        .orElse(EnhancedPluginInfo.MISSING));
            }
        }

        return new EnhancedPluginInfo(info, healthStatus, healthError, dependencyStatus);
    }

    public Map<String, EnhancedPluginInfo> listPluginsDetailed() {
        Map<String, EnhancedPluginInfo> result = new LinkedHashMap<>();
        for (String name : registry.listPlugins().keySet()) {
            try {
                result.put(name, getPluginInfo(name));
            } catch (NotFoundException e) {
                log.debug("[{}] Plugin vanished while listing", name);
            }
        }
        return result;
    }

    public ManagerStats getStats() {
        return new ManagerStats(
                registry.getStats(),
                config.isAutoDiscovery(),
                config.isAutoLoad(),
                config.getDiscoveryInterval(),
                handles.size());
    }

    // ==================== 内部方法 ====================

    private void initializeLoadedPlugin(String name) {
        PluginInfo info = registry.getPlugin(name);
        Component component = info.getComponent();
        if (component == null) {
            throw new VybException("plugin " + name + ": component missing after load");
        }

        moduleManager.start(name);

        try {
            component.health();
        } catch (Exception e) {
            throw new VybException("plugin " + name + ": health check failed: " + e.getMessage(), e);
        }

        registry.markActive(name);
    }

    private void rollback(String name) {
        try {
            registry.unloadPlugin(name);
        } catch (RuntimeException e) {
            log.warn("[{}] Rollback unload failed: {}", name, e.getMessage());
        }
    }

    private void probeHealth(String name, Component component) {
        Future<?> future = executor.submit(() -> {
            component.health();
            return null;
        });
        await("health", name, config.getHealthTimeout(), future);
    }

    private void persistEnabled(PluginInfo info, boolean enabled) {
        PluginConfig pluginConfig = configStore.getPluginConfig(info.getName());
        pluginConfig.setMetadata(info.getMetadata().copy());
        pluginConfig.getMetadata().setEnabled(enabled);
        configStore.savePluginConfig(pluginConfig);
    }

    /**
     * 在工作线程中执行并限时等待
     *
     * @param retain 成功后是否保留取消句柄
     */
    private void runWithTimeout(String operation, String name, Duration timeout, boolean retain, Runnable action) {
        Future<?> future = executor.submit(action);
        if (retain) {
            handles.put(name, future);
        }
        try {
            await(operation, name, timeout, future);
        } catch (OperationTimeoutException e) {
            // 句柄保留，后续卸载可强制取消
            throw e;
        } catch (RuntimeException e) {
            handles.remove(name, future);
            throw e;
        }
    }

    private static void await(String operation, String name, Duration timeout, Future<?> future) {
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[{}] {} timed out after {}ms", name, operation, timeout.toMillis());
            throw new OperationTimeoutException(operation, name, timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new VybException(operation + " " + name + ": " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VybException(operation + " " + name + ": interrupted", e);
        }
    }
}
