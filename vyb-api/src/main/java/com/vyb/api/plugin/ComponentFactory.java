package com.vyb.api.plugin;

import com.vyb.api.component.Component;
import com.vyb.api.config.HostConfig;
import org.slf4j.Logger;

/**
 * 插件入口契约
 * <p>
 * 每个插件 Jar 必须且只能通过 {@code META-INF/services/com.vyb.api.plugin.ComponentFactory}
 * 暴露一个实现（或在清单 entryPoint 中指定实现类）。宿主以 (logger, config) 调用它，
 * 返回的组件按清单声明的层级注册。
 * </p>
 * 内置组件也通过同一契约注册，注册后调用方无需区分来源。
 *
 * @author vyb
 */
@FunctionalInterface
public interface ComponentFactory {

    /**
     * 创建组件
     *
     * @param logger 宿主注入的日志器
     * @param config 宿主配置
     * @return 组件实例，不允许为 null
     * @throws Exception 创建失败
     */
    Component create(Logger logger, HostConfig config) throws Exception;
}
