package com.vyb.api.component;

import java.time.Instant;

/**
 * 组件运行状态快照
 * 由注册表在启动/停止时整体替换，调用方拿到的始终是不可变副本
 *
 * @param startTime 最近一次启动尝试的时间，未启动过为 null
 * @param error     最近一次失败原因，成功后清空
 */
public record ComponentStatus(String name, boolean running, boolean healthy, Instant startTime, String error) {

    public static ComponentStatus registered(String name) {
        return new ComponentStatus(name, false, false, null, null);
    }

    public static ComponentStatus notFound(String name) {
        return new ComponentStatus(name, false, false, null, "component not found");
    }

    public boolean isRunningAndHealthy() {
        return running && healthy;
    }

    public ComponentStatus started(Instant at) {
        return new ComponentStatus(name, true, true, at, null);
    }

    public ComponentStatus failedToStart(Instant at, String reason) {
        return new ComponentStatus(name, running, healthy, at, reason);
    }

    public ComponentStatus stopped() {
        return new ComponentStatus(name, false, false, startTime, null);
    }

    public ComponentStatus failedToStop(String reason) {
        return new ComponentStatus(name, running, false, startTime, reason);
    }
}
