package com.vyb.api.exception;

import java.util.List;

/**
 * 扩展之间的依赖构成环
 */
public class DependencyCycleException extends DependencyUnsatisfiedException {

    private final List<String> cycle;

    public DependencyCycleException(String name, List<String> cycle) {
        super("extension '" + name + "' introduces a dependency cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
