package com.vyb.runtime;

import com.vyb.api.config.HostConfig;
import com.vyb.core.classloader.DefaultPluginLoaderFactory;
import com.vyb.core.config.PluginConfigStore;
import com.vyb.core.config.RuntimeConfig;
import com.vyb.core.config.RuntimeConfigLoader;
import com.vyb.core.loader.PluginDiscoveryService;
import com.vyb.core.plugin.PluginManager;
import com.vyb.core.plugin.PluginRegistry;
import com.vyb.core.registry.DefaultModuleManager;
import com.vyb.core.scheduler.PluginScheduler;
import com.vyb.core.security.PluginSecurity;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;

/**
 * Vyb Native 启动器
 * 宿主应用通过此类一键装配并启动组件运行时
 */
@Slf4j
public final class NativeVyb {

    private static PluginIntegration INSTANCE;
    private static Thread SHUTDOWN_HOOK;

    private NativeVyb() {
    }

    /**
     * 使用工作目录下的 vyb-runtime.yml（不存在则默认配置）启动
     */
    public static PluginIntegration start(List<BuiltinPlugin> builtins) {
        RuntimeConfig config = RuntimeConfigLoader.load(Paths.get(RuntimeConfigLoader.DEFAULT_FILE));
        return start(config, HostConfig.defaults(), builtins);
    }

    public static synchronized PluginIntegration start(RuntimeConfig config, HostConfig host,
                                                       List<BuiltinPlugin> builtins) {
        if (INSTANCE != null) {
            log.warn("Vyb runtime is already started.");
            return INSTANCE;
        }

        long start = System.currentTimeMillis();
        log.info("Starting Vyb component runtime...");

        DefaultModuleManager moduleManager = new DefaultModuleManager();
        PluginSecurity security = new PluginSecurity(config.toSecurityPolicy());

        PluginRegistry registry = new PluginRegistry(
                moduleManager,
                host,
                new PluginDiscoveryService(security.getPolicy().getAllowedExtensions()),
                new DefaultPluginLoaderFactory(),
                config.getSearchPaths());

        PluginManager manager = new PluginManager(
                config,
                registry,
                moduleManager,
                security,
                new PluginConfigStore(config.getConfigDir()),
                new PluginScheduler());

        PluginIntegration integration = new PluginIntegration(manager, host, builtins, Collections.emptyList());
        integration.initialize();

        SHUTDOWN_HOOK = new Thread(() -> {
            log.info("Vyb runtime shutting down...");
            try {
                integration.shutdown();
            } catch (RuntimeException e) {
                log.error("Vyb runtime shutdown finished with errors: {}", e.getMessage());
            }
        }, "vyb-shutdown");
        Runtime.getRuntime().addShutdownHook(SHUTDOWN_HOOK);

        INSTANCE = integration;
        log.info("Vyb runtime started in {} ms", System.currentTimeMillis() - start);
        return integration;
    }

    /**
     * 主动关闭并注销关闭钩子
     */
    public static synchronized void stop() {
        if (INSTANCE == null) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(SHUTDOWN_HOOK);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, hook stays registered");
        }
        try {
            INSTANCE.shutdown();
        } finally {
            INSTANCE = null;
            SHUTDOWN_HOOK = null;
        }
    }

    public static synchronized PluginIntegration current() {
        if (INSTANCE == null) {
            throw new IllegalStateException("Vyb runtime not started");
        }
        return INSTANCE;
    }
}
