package com.vyb.core.registry;

import com.vyb.api.component.Bridge;
import com.vyb.api.component.Component;
import com.vyb.api.component.ComponentMetadata;
import com.vyb.api.component.ComponentStatus;
import com.vyb.api.component.ComponentType;
import com.vyb.api.component.Extension;
import com.vyb.api.exception.VybException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 模块管理器默认实现
 * 在注册表之上提供单组件的启动、停止、重启与展示元数据
 */
@Slf4j
public class DefaultModuleManager extends DefaultComponentRegistry implements ModuleManager {

    private static final String DEFAULT_VERSION = "1.0.0";

    @Override
    public void start(String name) {
        lock.writeLock().lock();
        try {
            Component component = lookup(name);
            if (component instanceof Extension) {
                checkDependencies(name, dependenciesOf((Extension) component));
            }
            initializeComponent(name, component);
        } catch (VybException e) {
            throw e;
        } catch (Exception e) {
            throw new VybException("failed to start component '" + name + "': " + e.getMessage(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void stop(String name) {
        lock.writeLock().lock();
        try {
            Component component = lookup(name);
            shutdownComponent(name, component);
        } catch (VybException e) {
            throw e;
        } catch (Exception e) {
            throw new VybException("failed to stop component '" + name + "': " + e.getMessage(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void restart(String name) {
        log.info("[{}] Restarting component", name);
        try {
            stop(name);
        } catch (VybException e) {
            throw new VybException("failed to restart component '" + name + "': " + e.getMessage(), e);
        }
        start(name);
    }

    @Override
    public ComponentStatus getStatus(String name) {
        lock.readLock().lock();
        try {
            ComponentStatus status = statuses.get(name);
            return status != null ? status : ComponentStatus.notFound(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void loadModule(String name) {
        start(name);
    }

    @Override
    public void unloadModule(String name) {
        stop(name);
    }

    @Override
    public void reloadModule(String name) {
        restart(name);
    }

    @Override
    public List<ComponentMetadata> listModules() {
        lock.readLock().lock();
        try {
            List<ComponentMetadata> modules = new ArrayList<>();
            for (String name : cores().keySet()) {
                ComponentMetadata meta = metadata(name, ComponentType.CORE);
                meta.setOptional(false);
                modules.add(meta);
            }
            for (Map.Entry<String, Extension> entry : extensions().entrySet()) {
                ComponentMetadata meta = metadata(entry.getKey(), ComponentType.EXTENSION);
                meta.setDependencies(new ArrayList<>(dependenciesOf(entry.getValue())));
                meta.setOptional(true);
                modules.add(meta);
            }
            for (Map.Entry<String, Bridge> entry : bridges().entrySet()) {
                ComponentMetadata meta = metadata(entry.getKey(), ComponentType.BRIDGE);
                meta.setOptional(!entry.getValue().isRequired());
                modules.add(meta);
            }
            return modules;
        } finally {
            lock.readLock().unlock();
        }
    }

    private ComponentMetadata metadata(String name, ComponentType type) {
        ComponentMetadata meta = new ComponentMetadata(name, type);
        meta.setVersion(DEFAULT_VERSION);
        ComponentStatus status = statuses.get(name);
        meta.setEnabled(status != null && status.running());
        return meta;
    }
}
