package com.vyb.core.scheduler;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;

/**
 * 调度任务
 * 由调度器在任务表锁内修改；对外只发放不含任务体的 {@link #copy()} 快照
 */
@Getter
@Setter(AccessLevel.PACKAGE)
public class ScheduledTask {

    private final String name;
    private final Duration interval;
    private final boolean oneTime;

    @Getter(AccessLevel.PACKAGE)
    private final TaskBody body;

    private Instant nextRun;
    private Instant lastRun;
    private long runCount;
    private long errorCount;
    private String lastError;
    private boolean enabled = true;

    @Getter(AccessLevel.PACKAGE)
    private boolean inFlight;

    ScheduledTask(String name, Duration interval, boolean oneTime, TaskBody body, Instant nextRun) {
        this.name = name;
        this.interval = interval;
        this.oneTime = oneTime;
        this.body = body;
        this.nextRun = nextRun;
    }

    boolean isDue(Instant now) {
        return enabled && !inFlight && !nextRun.isAfter(now);
    }

    ScheduledTask copy() {
        ScheduledTask copy = new ScheduledTask(name, interval, oneTime, null, nextRun);
        copy.lastRun = lastRun;
        copy.runCount = runCount;
        copy.errorCount = errorCount;
        copy.lastError = lastError;
        copy.enabled = enabled;
        copy.inFlight = inFlight;
        return copy;
    }

    @Override
    public String toString() {
        return String.format("ScheduledTask{name='%s', interval=%s, oneTime=%s, enabled=%s, runs=%d, errors=%d}",
                name, interval, oneTime, enabled, runCount, errorCount);
    }
}
