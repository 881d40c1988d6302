package com.vyb.sample;

import com.vyb.api.component.Extension;
import com.vyb.api.config.HostConfig;
import org.slf4j.Logger;

import java.util.List;

/**
 * 示例扩展组件：按宿主配置的问候语打招呼
 */
public class GreeterExtension implements Extension {

    public static final String NAME = "sample-greeter";

    private final Logger logger;
    private final String greeting;

    private volatile boolean started;

    public GreeterExtension(Logger logger, HostConfig config) {
        this.logger = logger;
        this.greeting = config.getProperty("greeting").orElse("Hello");
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void initialize() {
        started = true;
        logger.info("Greeter started with greeting '{}'", greeting);
    }

    @Override
    public void shutdown() {
        started = false;
        logger.info("Greeter stopped");
    }

    @Override
    public void health() {
        if (!started) {
            throw new IllegalStateException("greeter is not started");
        }
    }

    @Override
    public List<String> getDependencies() {
        return List.of();
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public int getPriority() {
        return 100;
    }

    public String greet(String who) {
        if (!started) {
            throw new IllegalStateException("greeter is not started");
        }
        return greeting + ", " + who + "!";
    }
}
