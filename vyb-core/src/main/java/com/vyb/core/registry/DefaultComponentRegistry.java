package com.vyb.core.registry;

import com.vyb.api.component.Bridge;
import com.vyb.api.component.Component;
import com.vyb.api.component.ComponentStatus;
import com.vyb.api.component.Extension;
import com.vyb.api.exception.DependencyCycleException;
import com.vyb.api.exception.DependencyUnsatisfiedException;
import com.vyb.api.exception.DuplicateNameException;
import com.vyb.api.exception.NotFoundException;
import com.vyb.api.exception.ShutdownException;
import com.vyb.api.exception.VybException;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 组件注册表默认实现
 * <p>
 * 并发模型：一把读写锁保护全部表。注册/注销/状态变更持有写锁，查询持有读锁。
 * Core 与 Bridge 按注册顺序启动，Extension 按优先级稳定排序。
 */
@Slf4j
public class DefaultComponentRegistry implements ComponentRegistry {

    protected final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, Component> cores = new LinkedHashMap<>();
    private final Map<String, Extension> extensions = new LinkedHashMap<>();
    private final Map<String, Bridge> bridges = new LinkedHashMap<>();
    protected final Map<String, ComponentStatus> statuses = new HashMap<>();

    @Override
    public void registerCore(Component component) {
        lock.writeLock().lock();
        try {
            String name = component.getName();
            ensureUnique("core component", name);
            cores.put(name, component);
            statuses.put(name, ComponentStatus.registered(name));
            log.debug("[{}] Registered core component", name);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void registerExtension(Extension extension) {
        lock.writeLock().lock();
        try {
            String name = extension.getName();
            ensureUnique("extension", name);

            // 拒绝形成依赖环的扩展
            Map<String, List<String>> edges = new HashMap<>();
            extensions.forEach((n, ext) -> edges.put(n, dependenciesOf(ext)));
            DependencyGraph.findCycle(name, dependenciesOf(extension), edges).ifPresent(cycle -> {
                throw new DependencyCycleException(name, cycle);
            });

            extensions.put(name, extension);
            statuses.put(name, ComponentStatus.registered(name));
            log.debug("[{}] Registered extension, priority={}, dependencies={}",
                    name, extension.getPriority(), dependenciesOf(extension));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void registerBridge(Bridge bridge) {
        lock.writeLock().lock();
        try {
            String name = bridge.getName();
            ensureUnique("bridge component", name);
            bridges.put(name, bridge);
            statuses.put(name, ComponentStatus.registered(name));
            log.debug("[{}] Registered bridge, connectsTo={}", name, bridge.getConnectsTo());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Component unregister(String name) {
        lock.writeLock().lock();
        try {
            Component removed = cores.remove(name);
            if (removed == null) {
                removed = extensions.remove(name);
            }
            if (removed == null) {
                removed = bridges.remove(name);
            }
            if (removed != null) {
                statuses.remove(name);
                log.debug("[{}] Unregistered component", name);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Component getComponent(String name) {
        lock.readLock().lock();
        try {
            return lookup(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Map<String, Component> listComponents() {
        lock.readLock().lock();
        try {
            Map<String, Component> result = new LinkedHashMap<>(cores);
            result.putAll(bridges);
            result.putAll(extensions);
            return Collections.unmodifiableMap(result);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void initializeAll() {
        lock.writeLock().lock();
        try {
            // 1. Core
            for (Map.Entry<String, Component> entry : cores.entrySet()) {
                startOrFail("core component", entry.getKey(), entry.getValue());
            }

            // 2. Bridge
            for (Map.Entry<String, Bridge> entry : bridges.entrySet()) {
                startOrFail("bridge component", entry.getKey(), entry.getValue());
            }

            // 3. Extension 按优先级
            for (Extension ext : sortedExtensions()) {
                String name = ext.getName();
                if (!ext.isEnabled()) {
                    log.info("[{}] Extension disabled, skipping", name);
                    continue;
                }
                checkDependencies(name, dependenciesOf(ext));
                startOrFail("extension", name, ext);
            }
            log.info("All components initialized: core={}, bridge={}, extension={}",
                    cores.size(), bridges.size(), extensions.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void shutdownAll() {
        lock.writeLock().lock();
        try {
            List<Component> order = startOrder();
            Collections.reverse(order);

            Map<String, Throwable> errors = new LinkedHashMap<>();
            for (Component component : order) {
                String name = component.getName();
                try {
                    shutdownComponent(name, component);
                } catch (Exception e) {
                    log.warn("[{}] Shutdown failed: {}", name, e.getMessage(), e);
                    errors.put(name, e);
                }
            }

            if (!errors.isEmpty()) {
                throw new ShutdownException(errors);
            }
            log.info("All components shut down");
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ==================== 供子类使用（调用方须持有写锁） ====================

    /**
     * 初始化单个组件并刷新状态
     */
    protected void initializeComponent(String name, Component component) throws Exception {
        Instant now = Instant.now();
        ComponentStatus status = statuses.getOrDefault(name, ComponentStatus.registered(name));
        try {
            component.initialize();
        } catch (Exception e) {
            statuses.put(name, status.failedToStart(now, String.valueOf(e.getMessage())));
            throw e;
        }
        statuses.put(name, status.started(now));
        log.info("[{}] Component initialized", name);
    }

    /**
     * 关闭单个组件并刷新状态
     */
    protected void shutdownComponent(String name, Component component) throws Exception {
        ComponentStatus status = statuses.getOrDefault(name, ComponentStatus.registered(name));
        try {
            component.shutdown();
        } catch (Exception e) {
            statuses.put(name, status.failedToStop(String.valueOf(e.getMessage())));
            throw e;
        }
        statuses.put(name, status.stopped());
        log.debug("[{}] Component shut down", name);
    }

    /**
     * 依赖必须已登记且处于运行并健康
     */
    protected void checkDependencies(String name, List<String> dependencies) {
        for (String dep : dependencies) {
            ComponentStatus status = statuses.get(dep);
            if (status == null) {
                throw new DependencyUnsatisfiedException(
                        "extension '" + name + "' dependency check failed: dependency '" + dep + "' not found");
            }
            if (!status.isRunningAndHealthy()) {
                throw new DependencyUnsatisfiedException(
                        "extension '" + name + "' dependency check failed: dependency '" + dep
                                + "' is not running or unhealthy");
            }
        }
    }

    protected Component lookup(String name) {
        Component component = cores.get(name);
        if (component == null) {
            component = extensions.get(name);
        }
        if (component == null) {
            component = bridges.get(name);
        }
        if (component == null) {
            throw new NotFoundException("component", name);
        }
        return component;
    }

    protected Map<String, Component> cores() {
        return cores;
    }

    protected Map<String, Extension> extensions() {
        return extensions;
    }

    protected Map<String, Bridge> bridges() {
        return bridges;
    }

    protected static List<String> dependenciesOf(Extension extension) {
        List<String> deps = extension.getDependencies();
        return deps != null ? deps : Collections.emptyList();
    }

    // ==================== 内部方法 ====================

    private void startOrFail(String kind, String name, Component component) {
        try {
            initializeComponent(name, component);
        } catch (Exception e) {
            log.error("[{}] Failed to initialize {}", name, kind, e);
            throw new VybException("failed to initialize " + kind + " '" + name + "': " + e.getMessage(), e);
        }
    }

    private List<Extension> sortedExtensions() {
        List<Extension> sorted = new ArrayList<>(extensions.values());
        sorted.sort(Comparator.comparingInt(Extension::getPriority));
        return sorted;
    }

    private List<Component> startOrder() {
        List<Component> order = new ArrayList<>(cores.values());
        order.addAll(bridges.values());
        order.addAll(sortedExtensions());
        return order;
    }

    private void ensureUnique(String kind, String name) {
        if (cores.containsKey(name) || extensions.containsKey(name) || bridges.containsKey(name)) {
            throw new DuplicateNameException(kind, name);
        }
    }
}
