package com.vtb.supplychain.graph;

import com.vtb.supplychain.models.Ecosystem;
import com.vtb.supplychain.models.PackageIdentity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Строит {@link DependencyGraph} из плоского списка ребер резолвера.
 *
 * Ребра могут образовывать циклы. Узлы создаются лениво при обходе в глубину от корней
 * в порядке вставки ребер: первый раз встреченный пакет получает глубину родителя + 1,
 * повторные встречи только добавляют ссылку. Цикл фиксируется, когда ребро ведет в узел
 * из текущего стека обхода; ссылка при этом сохраняется, граф остается без потерь.
 */
@Slf4j
public class GraphBuilder {

    private final DepthPolicy depthPolicy;

    public GraphBuilder() {
        this(DepthPolicy.FIRST_SEEN);
    }

    public GraphBuilder(DepthPolicy depthPolicy) {
        this.depthPolicy = depthPolicy != null ? depthPolicy : DepthPolicy.FIRST_SEEN;
    }

    public DependencyGraph build(Iterable<DependencyEdge> edges) {
        if (edges == null) {
            return DependencyGraph.empty();
        }

        EdgeIndex index = indexEdges(edges);
        if (index.malformed > 0) {
            log.warn("Пропущено {} некорректных ребер (нет родителя или имени пакета)", index.malformed);
        }

        Map<String, GraphNode> arena = new LinkedHashMap<>();
        List<GraphNode> roots = new ArrayList<>();
        List<CircularDependency> cycles = new ArrayList<>();
        Set<String> completed = new HashSet<>();

        for (String parent : index.parents.keySet()) {
            if (!index.childIdentities.contains(parent)) {
                GraphNode root = materialize(arena, index, parent, 0);
                roots.add(root);
                traverse(root, arena, index, completed, cycles);
            }
        }
        // компоненты, состоящие только из циклов, корней не имеют
        for (String parent : index.parents.keySet()) {
            if (!arena.containsKey(parent)) {
                GraphNode root = materialize(arena, index, parent, 0);
                roots.add(root);
                log.debug("Пакет {} выбран корнем компоненты без входных точек", parent);
                traverse(root, arena, index, completed, cycles);
            }
        }

        if (depthPolicy == DepthPolicy.SHALLOWEST) {
            assignShallowestDepths(roots);
        }

        List<VersionConflict> conflicts = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : index.versionsByName.entrySet()) {
            if (entry.getValue().size() > 1) {
                conflicts.add(new VersionConflict(entry.getKey(), new ArrayList<>(entry.getValue())));
                log.debug("Конфликт версий для '{}': {}", entry.getKey(), entry.getValue());
            }
        }

        DependencyGraph graph = new DependencyGraph(roots, arena, cycles, conflicts, index.malformed, depthPolicy);
        log.info("Граф зависимостей построен: {} пакетов, {} циклов, {} конфликтов версий",
            graph.packageCount(), graph.circularDependencyCount(), graph.versionConflictCount());
        return graph;
    }

    private EdgeIndex indexEdges(Iterable<DependencyEdge> edges) {
        EdgeIndex index = new EdgeIndex();
        Set<String> seenEdges = new HashSet<>();
        for (DependencyEdge edge : edges) {
            if (edge == null || edge.isMalformed()) {
                index.malformed++;
                continue;
            }
            String[] parentParts = splitIdentity(edge.parentIdentity().trim());
            String parentIdentity = PackageIdentity.identityOf(parentParts[0], parentParts[1]);
            String childName = edge.childName().trim();
            String childVersion = PackageIdentity.normalizeVersion(edge.childVersion());
            String childIdentity = PackageIdentity.identityOf(childName, childVersion);
            Ecosystem ecosystem = edge.ecosystem() != null ? edge.ecosystem() : Ecosystem.OTHER;

            index.register(parentIdentity, parentParts[0], parentParts[1], ecosystem);
            index.register(childIdentity, childName, childVersion, ecosystem);
            index.parents.putIfAbsent(parentIdentity, Boolean.TRUE);
            index.childIdentities.add(childIdentity);

            if (!seenEdges.add(parentIdentity + " -> " + childIdentity)) {
                continue;
            }
            index.adjacency.computeIfAbsent(parentIdentity, key -> new ArrayList<>()).add(childIdentity);
        }
        return index;
    }

    /**
     * Итеративный обход в глубину: стек кадров заменяет рекурсию,
     * чтобы длинные цепочки зависимостей не переполняли стек потока.
     */
    private void traverse(GraphNode start,
                          Map<String, GraphNode> arena,
                          EdgeIndex index,
                          Set<String> completed,
                          List<CircularDependency> cycles) {
        if (completed.contains(start.identity())) {
            return;
        }
        Deque<Frame> stack = new ArrayDeque<>();
        List<String> path = new ArrayList<>();
        Set<String> onPath = new HashSet<>();

        stack.push(new Frame(start, index.adjacency.getOrDefault(start.identity(), List.of())));
        path.add(start.identity());
        onPath.add(start.identity());

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.next >= frame.children.size()) {
                stack.pop();
                String done = path.remove(path.size() - 1);
                onPath.remove(done);
                completed.add(done);
                continue;
            }
            String childIdentity = frame.children.get(frame.next++);
            GraphNode child = arena.get(childIdentity);
            if (child == null) {
                child = materialize(arena, index, childIdentity, frame.node.getDepth() + 1);
            }
            if (!frame.node.link(child)) {
                log.debug("{} уже зависит от другой версии {}, ссылка на {} не добавлена",
                    frame.node.identity(), child.getName(), childIdentity);
            }

            if (onPath.contains(childIdentity)) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(childIdentity), path.size()));
                cycle.add(childIdentity);
                cycles.add(new CircularDependency(cycle));
                log.debug("Обнаружен цикл: {}", String.join(" -> ", cycle));
            } else if (!completed.contains(childIdentity)) {
                stack.push(new Frame(child, index.adjacency.getOrDefault(childIdentity, List.of())));
                path.add(childIdentity);
                onPath.add(childIdentity);
            }
        }
    }

    private GraphNode materialize(Map<String, GraphNode> arena, EdgeIndex index, String identity, int depth) {
        PackageMeta meta = index.meta.get(identity);
        GraphNode node = new GraphNode(meta.name(), meta.version(), meta.ecosystem(), depth);
        arena.put(identity, node);
        return node;
    }

    private void assignShallowestDepths(List<GraphNode> roots) {
        Map<GraphNode, Integer> distances = new HashMap<>();
        Deque<GraphNode> queue = new ArrayDeque<>();
        for (GraphNode root : roots) {
            distances.put(root, 0);
            queue.add(root);
        }
        while (!queue.isEmpty()) {
            GraphNode node = queue.poll();
            int distance = distances.get(node);
            node.setDepth(distance);
            for (GraphNode child : node.getDependencies().values()) {
                if (!distances.containsKey(child)) {
                    distances.put(child, distance + 1);
                    queue.add(child);
                }
            }
        }
    }

    /**
     * Разбор "name@version" по последнему '@', не являющемуся первым символом:
     * scoped npm пакеты вида "@types/node@20.1.0" разбираются корректно.
     */
    static String[] splitIdentity(String identity) {
        int at = identity.lastIndexOf('@');
        if (at <= 0) {
            return new String[] {identity, PackageIdentity.UNKNOWN_VERSION};
        }
        String name = identity.substring(0, at);
        String version = PackageIdentity.normalizeVersion(identity.substring(at + 1));
        return new String[] {name, version};
    }

    private static final class EdgeIndex {
        final Map<String, Boolean> parents = new LinkedHashMap<>();
        final Set<String> childIdentities = new HashSet<>();
        final Map<String, List<String>> adjacency = new HashMap<>();
        final Map<String, PackageMeta> meta = new HashMap<>();
        final Map<String, Set<String>> versionsByName = new LinkedHashMap<>();
        int malformed = 0;

        void register(String identity, String name, String version, Ecosystem ecosystem) {
            meta.putIfAbsent(identity, new PackageMeta(name, version, ecosystem));
            versionsByName.computeIfAbsent(name, key -> new LinkedHashSet<>()).add(version);
        }
    }

    private static final class Frame {
        final GraphNode node;
        final List<String> children;
        int next = 0;

        Frame(GraphNode node, List<String> children) {
            this.node = node;
            this.children = children;
        }
    }

    private record PackageMeta(String name, String version, Ecosystem ecosystem) {
    }
}
