package com.vyb.core.scheduler;

/**
 * 调度器统计
 */
public record SchedulerStats(int totalTasks, int enabledTasks, long totalRuns, long totalErrors, boolean running) {
}
