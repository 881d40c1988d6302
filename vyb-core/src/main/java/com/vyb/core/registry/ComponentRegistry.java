package com.vyb.core.registry;

import com.vyb.api.component.Bridge;
import com.vyb.api.component.Component;
import com.vyb.api.component.Extension;

import java.util.Map;

/**
 * 组件注册表
 * 负责三层组件的登记以及按依赖顺序的启动与关闭
 */
public interface ComponentRegistry {

    void registerCore(Component component);

    void registerExtension(Extension extension);

    void registerBridge(Bridge bridge);

    /**
     * 移除组件及其状态记录（不调用 shutdown）
     *
     * @return 被移除的组件，不存在时返回 null
     */
    Component unregister(String name);

    /**
     * 跨三层查找组件
     *
     * @throws com.vyb.api.exception.NotFoundException 不存在
     */
    Component getComponent(String name);

    Map<String, Component> listComponents();

    /**
     * 启动顺序：Core -> Bridge -> Extension（按优先级升序）
     * 任一失败立即中止，已启动的组件不回滚
     */
    void initializeAll();

    /**
     * 按启动顺序的逆序关闭全部组件，汇总所有错误
     *
     * @throws com.vyb.api.exception.ShutdownException 至少一个组件关闭失败
     */
    void shutdownAll();
}
