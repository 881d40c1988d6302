package com.vyb.core.registry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 扩展依赖环检测
 * 只沿着“已登记的扩展”之间的边搜索，Core/Bridge 不可能参与环
 */
final class DependencyGraph {

    private DependencyGraph() {
    }

    /**
     * 假设 candidate 以 candidateDeps 加入后，查找经过 candidate 的环
     *
     * @param edges 已登记扩展的依赖表
     * @return 环路径（首尾相同），无环时为空
     */
    static Optional<List<String>> findCycle(String candidate, List<String> candidateDeps,
                                            Map<String, List<String>> edges) {
        Deque<String> path = new ArrayDeque<>();
        path.addLast(candidate);
        Set<String> visited = new HashSet<>();
        for (String dep : candidateDeps) {
            List<String> cycle = walk(candidate, dep, edges, path, visited);
            if (cycle != null) {
                return Optional.of(cycle);
            }
        }
        return Optional.empty();
    }

    private static List<String> walk(String target, String current, Map<String, List<String>> edges,
                                     Deque<String> path, Set<String> visited) {
        if (current.equals(target)) {
            List<String> cycle = new ArrayList<>(path);
            cycle.add(target);
            return cycle;
        }
        if (!visited.add(current)) {
            return null;
        }
        List<String> next = edges.getOrDefault(current, Collections.emptyList());
        path.addLast(current);
        for (String dep : next) {
            List<String> cycle = walk(target, dep, edges, path, visited);
            if (cycle != null) {
                return cycle;
            }
        }
        path.removeLast();
        return null;
    }
}
