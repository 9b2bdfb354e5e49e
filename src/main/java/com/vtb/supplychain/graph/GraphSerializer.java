package com.vtb.supplychain.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Преобразует граф в ограниченное дерево для вывода.
 *
 * Множество посещенных идентичностей относится к текущему пути: узел входит в него
 * при спуске и покидает при возврате, поэтому соседние ветки не видят историю друг друга
 * и пакет, достижимый двумя независимыми путями, выводится полностью в обоих местах.
 * Обрезается только повторный вход в собственную цепочку предков и пути длиннее maxDepth.
 * Обход итеративный, глубина дерева ограничена только maxDepth.
 */
public final class GraphSerializer {

    public static final int DEFAULT_MAX_DEPTH = 10;

    private GraphSerializer() {}

    public static List<SerializedNode> serialize(DependencyGraph graph, int maxDepth) {
        requireValidDepth(maxDepth);
        List<SerializedNode> trees = new ArrayList<>();
        if (graph == null) {
            return trees;
        }
        for (GraphNode root : graph.getRoots()) {
            trees.add(serializeTree(root, maxDepth));
        }
        return trees;
    }

    public static SerializedNode serialize(GraphNode node, int maxDepth) {
        requireValidDepth(maxDepth);
        if (node == null) {
            throw new IllegalArgumentException("Узел графа не может быть null");
        }
        return serializeTree(node, maxDepth);
    }

    private static SerializedNode serializeTree(GraphNode root, int maxDepth) {
        Deque<Frame> stack = new ArrayDeque<>();
        Set<String> onPath = new HashSet<>();
        SerializedNode tree = enter(root, 0, maxDepth, onPath, stack);

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (!frame.children.hasNext()) {
                stack.pop();
                onPath.remove(frame.identity);
                continue;
            }
            Map.Entry<String, GraphNode> dependency = frame.children.next();
            SerializedNode child = enter(dependency.getValue(), frame.pathDepth + 1, maxDepth, onPath, stack);
            frame.serialized.getDependencies().put(dependency.getKey(), child);
        }
        return tree;
    }

    /**
     * Терминальный узел возвращается сразу, иначе узел кладется на стек
     * и его зависимости заполняются позже.
     */
    private static SerializedNode enter(GraphNode node, int pathDepth, int maxDepth,
                                        Set<String> onPath, Deque<Frame> stack) {
        String identity = node.identity();
        boolean circular = onPath.contains(identity);
        if (circular || pathDepth >= maxDepth) {
            return terminal(node, circular);
        }

        SerializedNode serialized = SerializedNode.builder()
            .name(node.getName())
            .version(node.getVersion())
            .ecosystem(node.getEcosystem())
            .depth(node.getDepth())
            .build();
        onPath.add(identity);
        stack.push(new Frame(identity, serialized, node.getDependencies().entrySet().iterator(), pathDepth));
        return serialized;
    }

    private static SerializedNode terminal(GraphNode node, boolean circular) {
        return SerializedNode.builder()
            .name(node.getName())
            .version(node.getVersion())
            .ecosystem(node.getEcosystem())
            .depth(node.getDepth())
            .circularReference(circular)
            .depthLimited(!circular)
            .build();
    }

    private static void requireValidDepth(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth не может быть отрицательным: " + maxDepth);
        }
    }

    private static final class Frame {
        private final String identity;
        private final SerializedNode serialized;
        private final Iterator<Map.Entry<String, GraphNode>> children;
        private final int pathDepth;

        private Frame(String identity,
                      SerializedNode serialized,
                      Iterator<Map.Entry<String, GraphNode>> children,
                      int pathDepth) {
            this.identity = identity;
            this.serialized = serialized;
            this.children = children;
            this.pathDepth = pathDepth;
        }
    }
}
