package com.vtb.supplychain.graph;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Трассировка влияния уязвимого пакета: все пути от корней графа до пакета с заданным именем.
 * Повторный вход в цепочку предков и пути длиннее maxDepth не продолжаются.
 */
@Slf4j
public final class DependencyPathTracer {

    public static final int DEFAULT_MAX_PATHS = 1000;

    private DependencyPathTracer() {}

    public static List<List<String>> trace(DependencyGraph graph, String packageName, int maxDepth) {
        return trace(graph, packageName, maxDepth, DEFAULT_MAX_PATHS);
    }

    public static List<List<String>> trace(DependencyGraph graph, String packageName, int maxDepth, int maxPaths) {
        List<List<String>> paths = new ArrayList<>();
        if (graph == null || packageName == null || packageName.isBlank()) {
            return paths;
        }
        for (GraphNode root : graph.getRoots()) {
            collect(root, packageName.trim(), maxDepth, maxPaths, paths);
        }
        if (paths.size() >= maxPaths) {
            log.warn("Трассировка {} остановлена на лимите {} путей", packageName, maxPaths);
        }
        log.debug("Найдено {} путей до пакета '{}'", paths.size(), packageName);
        return paths;
    }

    private static void collect(GraphNode root,
                                String target,
                                int maxDepth,
                                int maxPaths,
                                List<List<String>> paths) {
        if (paths.size() >= maxPaths) {
            return;
        }
        Deque<Iterator<GraphNode>> stack = new ArrayDeque<>();
        List<String> path = new ArrayList<>();
        Set<String> onPath = new HashSet<>();
        enter(root, target, path, onPath, stack, maxDepth, paths);

        while (!stack.isEmpty() && paths.size() < maxPaths) {
            Iterator<GraphNode> children = stack.peek();
            if (!children.hasNext()) {
                stack.pop();
                onPath.remove(path.remove(path.size() - 1));
                continue;
            }
            enter(children.next(), target, path, onPath, stack, maxDepth, paths);
        }
    }

    private static void enter(GraphNode node,
                              String target,
                              List<String> path,
                              Set<String> onPath,
                              Deque<Iterator<GraphNode>> stack,
                              int maxDepth,
                              List<List<String>> paths) {
        String identity = node.identity();
        if (onPath.contains(identity) || path.size() > maxDepth) {
            return;
        }
        path.add(identity);
        onPath.add(identity);
        if (node.getName().equals(target)) {
            paths.add(List.copyOf(path));
        }
        stack.push(node.getDependencies().values().iterator());
    }
}
