package com.vtb.supplychain.graph;

import com.vtb.supplychain.models.DependencyGraphSummary;
import com.vtb.supplychain.models.Ecosystem;
import com.vtb.supplychain.models.PackageIdentity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Граф зависимостей проекта. Создается {@link GraphBuilder}, после сборки только читается,
 * поэтому может одновременно использоваться несколькими исполнителями этапов.
 */
public final class DependencyGraph {

    private final List<GraphNode> roots;
    private final Map<String, GraphNode> nodes;
    private final List<CircularDependency> circularDependencies;
    private final List<VersionConflict> versionConflicts;
    private final int malformedEdgeCount;
    private final DepthPolicy depthPolicy;

    DependencyGraph(List<GraphNode> roots,
                    Map<String, GraphNode> nodes,
                    List<CircularDependency> circularDependencies,
                    List<VersionConflict> versionConflicts,
                    int malformedEdgeCount,
                    DepthPolicy depthPolicy) {
        this.roots = List.copyOf(roots);
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.circularDependencies = List.copyOf(circularDependencies);
        this.versionConflicts = List.copyOf(versionConflicts);
        this.malformedEdgeCount = malformedEdgeCount;
        this.depthPolicy = depthPolicy;
    }

    public static DependencyGraph empty() {
        return new DependencyGraph(List.of(), Map.of(), List.of(), List.of(), 0, DepthPolicy.FIRST_SEEN);
    }

    public List<GraphNode> getRoots() {
        return roots;
    }

    public GraphNode getNode(String identity) {
        return nodes.get(identity);
    }

    public Collection<GraphNode> nodes() {
        return nodes.values();
    }

    public List<CircularDependency> getCircularDependencies() {
        return circularDependencies;
    }

    public List<VersionConflict> getVersionConflicts() {
        return versionConflicts;
    }

    public int getMalformedEdgeCount() {
        return malformedEdgeCount;
    }

    public DepthPolicy getDepthPolicy() {
        return depthPolicy;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public int packageCount() {
        return nodes.size();
    }

    public int circularDependencyCount() {
        return circularDependencies.size();
    }

    public int versionConflictCount() {
        return versionConflicts.size();
    }

    /**
     * Плоский список пакетов графа в порядке обнаружения.
     */
    public List<PackageIdentity> packages() {
        List<PackageIdentity> packages = new ArrayList<>(nodes.size());
        for (GraphNode node : nodes.values()) {
            packages.add(node.toPackageIdentity());
        }
        return packages;
    }

    /**
     * Самая частая экосистема среди узлов; OTHER для пустого графа.
     */
    public Ecosystem dominantEcosystem() {
        Map<Ecosystem, Integer> counts = new EnumMap<>(Ecosystem.class);
        for (GraphNode node : nodes.values()) {
            if (node.getEcosystem() != Ecosystem.OTHER) {
                counts.merge(node.getEcosystem(), 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
            .max(Map.Entry.comparingByValue())
            .map(Map.Entry::getKey)
            .orElse(Ecosystem.OTHER);
    }

    public DependencyGraphSummary summary() {
        return DependencyGraphSummary.builder()
            .packageCount(packageCount())
            .circularDependencyCount(circularDependencyCount())
            .versionConflictCount(versionConflictCount())
            .malformedEdgeCount(malformedEdgeCount)
            .build();
    }
}
