package com.vyb.core.scheduler;

import com.vyb.api.exception.DuplicateNameException;
import com.vyb.api.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 插件后台任务调度器
 * <p>
 * 单个驱动线程按固定节拍扫描任务表，到期任务交给工作线程池独立执行，
 * 慢任务不会拖慢其他任务。任务体在锁外运行，异常只记录到任务上。
 * 上一次执行尚未结束的任务不会被再次启动。
 */
@Slf4j
public class PluginScheduler {

    public static final Duration DEFAULT_TICK = Duration.ofSeconds(1);

    private static final long STOP_TIMEOUT_SECONDS = 5;

    private final Duration tick;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, ScheduledTask> tasks = new LinkedHashMap<>();

    // 受 this 监视器保护
    private ScheduledExecutorService driver;
    private ExecutorService workers;

    public PluginScheduler() {
        this(DEFAULT_TICK);
    }

    /**
     * 测试用：缩短节拍
     */
    PluginScheduler(Duration tick) {
        this.tick = tick;
    }

    // ==================== 任务管理 ====================

    /**
     * 注册一次性任务，延迟 {@code delay} 后执行一次，执行后自动禁用
     */
    public void scheduleOnce(String name, Duration delay, TaskBody body) {
        addTask(new ScheduledTask(name, delay, true, body, Instant.now().plus(delay)));
    }

    /**
     * 注册周期任务，首次执行在一个周期之后
     */
    public void scheduleRepeating(String name, Duration interval, TaskBody body) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("task " + name + ": interval must be positive");
        }
        addTask(new ScheduledTask(name, interval, false, body, Instant.now().plus(interval)));
    }

    public void enableTask(String name) {
        lock.writeLock().lock();
        try {
            ScheduledTask task = require(name);
            task.setEnabled(true);
            if (!task.isOneTime()) {
                task.setNextRun(Instant.now().plus(task.getInterval()));
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("[{}] Task enabled", name);
    }

    public void disableTask(String name) {
        lock.writeLock().lock();
        try {
            require(name).setEnabled(false);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("[{}] Task disabled", name);
    }

    public void removeTask(String name) {
        lock.writeLock().lock();
        try {
            require(name);
            tasks.remove(name);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("[{}] Task removed", name);
    }

    public ScheduledTask getTask(String name) {
        lock.readLock().lock();
        try {
            return require(name).copy();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ScheduledTask> listTasks() {
        lock.readLock().lock();
        try {
            List<ScheduledTask> result = new ArrayList<>(tasks.size());
            tasks.values().forEach(task -> result.add(task.copy()));
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public SchedulerStats getStats() {
        boolean running = isRunning();
        lock.readLock().lock();
        try {
            int enabled = 0;
            long runs = 0;
            long errors = 0;
            for (ScheduledTask task : tasks.values()) {
                if (task.isEnabled()) {
                    enabled++;
                }
                runs += task.getRunCount();
                errors += task.getErrorCount();
            }
            return new SchedulerStats(tasks.size(), enabled, runs, errors, running);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== 生命周期 ====================

    public synchronized void start() {
        if (driver != null) {
            return;
        }
        workers = Executors.newCachedThreadPool(daemonFactory("vyb-scheduler-worker-"));
        driver = Executors.newSingleThreadScheduledExecutor(daemonFactory("vyb-scheduler-driver-"));
        driver.scheduleAtFixedRate(this::runDueTasks, tick.toMillis(), tick.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Plugin scheduler started, tick={}ms", tick.toMillis());
    }

    /**
     * 停止驱动并等待在途任务，重复调用无副作用
     */
    public synchronized void stop() {
        if (driver == null) {
            return;
        }
        driver.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Scheduler workers did not finish in {}s, interrupting", STOP_TIMEOUT_SECONDS);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        driver = null;
        workers = null;
        log.info("Plugin scheduler stopped");
    }

    public synchronized boolean isRunning() {
        return driver != null;
    }

    // ==================== 内部方法 ====================

    private void addTask(ScheduledTask task) {
        lock.writeLock().lock();
        try {
            if (tasks.containsKey(task.getName())) {
                throw new DuplicateNameException("task", task.getName());
            }
            tasks.put(task.getName(), task);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("[{}] Task scheduled, interval={}, oneTime={}", task.getName(), task.getInterval(), task.isOneTime());
    }

    private ScheduledTask require(String name) {
        ScheduledTask task = tasks.get(name);
        if (task == null) {
            throw new NotFoundException("task", name);
        }
        return task;
    }

    /**
     * 驱动线程每个节拍调用一次
     */
    void runDueTasks() {
        ExecutorService pool;
        synchronized (this) {
            pool = workers;
        }
        if (pool == null) {
            return;
        }

        List<ScheduledTask> due = new ArrayList<>();
        Instant now = Instant.now();
        lock.writeLock().lock();
        try {
            for (ScheduledTask task : tasks.values()) {
                if (task.isDue(now)) {
                    task.setInFlight(true);
                    due.add(task);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        for (ScheduledTask task : due) {
            try {
                pool.execute(() -> execute(task));
            } catch (RejectedExecutionException e) {
                log.debug("[{}] Scheduler stopping, task not started", task.getName());
                clearInFlight(task);
            }
        }
    }

    private void execute(ScheduledTask task) {
        Throwable failure = null;
        try {
            task.getBody().run();
        } catch (Throwable e) {
            // 任务体来自插件代码，Error 同样记为一次失败，否则任务会永远停在执行中
            failure = e;
        }

        Instant finished = Instant.now();
        lock.writeLock().lock();
        try {
            task.setInFlight(false);
            task.setLastRun(finished);
            task.setRunCount(task.getRunCount() + 1);
            if (failure != null) {
                task.setErrorCount(task.getErrorCount() + 1);
                task.setLastError(String.valueOf(failure.getMessage()));
            }
            if (task.isOneTime()) {
                task.setEnabled(false);
            } else {
                task.setNextRun(finished.plus(task.getInterval()));
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (failure != null) {
            log.warn("[{}] Scheduled task failed: {}", task.getName(), failure.getMessage(), failure);
        } else {
            log.debug("[{}] Scheduled task completed", task.getName());
        }
    }

    private void clearInFlight(ScheduledTask task) {
        lock.writeLock().lock();
        try {
            task.setInFlight(false);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((t, e) ->
                    log.error("Scheduler thread {} died: {}", t.getName(), e.getMessage(), e));
            return thread;
        };
    }
}
