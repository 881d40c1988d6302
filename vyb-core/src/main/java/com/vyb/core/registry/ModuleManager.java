package com.vyb.core.registry;

import com.vyb.api.component.ComponentMetadata;
import com.vyb.api.component.ComponentStatus;

import java.util.List;

/**
 * 模块管理器：注册表 + 单组件生命周期
 */
public interface ModuleManager extends ComponentRegistry {

    void start(String name);

    void stop(String name);

    /**
     * 先 stop 后 start，stop 失败则不再 start
     */
    void restart(String name);

    ComponentStatus getStatus(String name);

    void loadModule(String name);

    void unloadModule(String name);

    void reloadModule(String name);

    List<ComponentMetadata> listModules();
}
