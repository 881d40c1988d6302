package com.vyb.api.component;

/**
 * 核心组件接口
 * 所有组件（Core / Extension / Bridge）的最小契约，名称在进程内唯一
 *
 * @author vyb
 */
public interface Component {

    /**
     * 组件唯一名称
     */
    String getName();

    /**
     * 初始化组件
     *
     * @throws Exception 初始化失败
     */
    void initialize() throws Exception;

    /**
     * 关闭组件，释放资源
     *
     * @throws Exception 关闭失败
     */
    void shutdown() throws Exception;

    /**
     * 健康检查，不抛异常即视为健康
     *
     * @throws Exception 组件不健康
     */
    void health() throws Exception;
}
