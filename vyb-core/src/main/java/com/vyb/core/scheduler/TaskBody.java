package com.vyb.core.scheduler;

/**
 * 任务体，抛出的异常会被记录为任务错误
 */
@FunctionalInterface
public interface TaskBody {

    void run() throws Exception;
}
