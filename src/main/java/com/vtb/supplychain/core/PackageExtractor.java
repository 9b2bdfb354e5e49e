package com.vtb.supplychain.core;

import com.vtb.supplychain.graph.DependencyGraph;
import com.vtb.supplychain.graph.GraphNode;
import com.vtb.supplychain.models.Ecosystem;
import com.vtb.supplychain.models.Finding;
import com.vtb.supplychain.models.PackageIdentity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Собирает единый набор пакетов из пересекающихся источников.
 *
 * Порядок приоритета метаданных: исходные находки, узлы графа, плоский список пакетов графа,
 * преобладающая экосистема графа. Источник с меньшим приоритетом только дополняет
 * отсутствующие поля. Пакет с неизвестной версией отбрасывается, если то же имя
 * встречается с известной версией.
 */
@Slf4j
public class PackageExtractor {

    public Set<PackageIdentity> extract(List<Finding> initialFindings, DependencyGraph graph) {
        Map<String, PackageIdentity> packages = new LinkedHashMap<>();

        if (initialFindings != null) {
            for (Finding finding : initialFindings) {
                if (finding == null || finding.getPackageName() == null || finding.getPackageName().isBlank()) {
                    continue;
                }
                add(packages, new PackageIdentity(
                    finding.getPackageName(), finding.getPackageVersion(), Ecosystem.OTHER, null));
            }
        }

        if (graph != null) {
            for (GraphNode node : reachableNodes(graph)) {
                add(packages, node.toPackageIdentity());
            }
            for (GraphNode node : graph.nodes()) {
                add(packages, node.toPackageIdentity());
            }
            for (PackageIdentity pkg : graph.packages()) {
                add(packages, pkg);
            }
        }

        dropUnknownVersions(packages);

        Ecosystem defaultEcosystem = graph != null ? graph.dominantEcosystem() : Ecosystem.OTHER;
        Set<PackageIdentity> result = new LinkedHashSet<>();
        for (PackageIdentity pkg : packages.values()) {
            if (pkg.getEcosystem() == Ecosystem.OTHER && defaultEcosystem != Ecosystem.OTHER) {
                pkg = pkg.withEcosystem(defaultEcosystem);
            }
            result.add(pkg);
        }
        log.debug("Извлечено {} пакетов", result.size());
        return result;
    }

    private void add(Map<String, PackageIdentity> packages, PackageIdentity candidate) {
        PackageIdentity existing = packages.get(candidate.identity());
        if (existing == null) {
            packages.put(candidate.identity(), candidate);
            return;
        }
        PackageIdentity merged = existing;
        if (merged.getEcosystem() == Ecosystem.OTHER && candidate.getEcosystem() != Ecosystem.OTHER) {
            merged = merged.withEcosystem(candidate.getEcosystem());
        }
        if (merged.getDepth() == null && candidate.getDepth() != null) {
            merged = merged.withDepth(candidate.getDepth());
        }
        packages.put(candidate.identity(), merged);
    }

    private void dropUnknownVersions(Map<String, PackageIdentity> packages) {
        Set<String> namesWithKnownVersion = new HashSet<>();
        for (PackageIdentity pkg : packages.values()) {
            if (pkg.isVersionKnown()) {
                namesWithKnownVersion.add(pkg.getName());
            }
        }
        packages.values().removeIf(pkg -> !pkg.isVersionKnown() && namesWithKnownVersion.contains(pkg.getName()));
    }

    /**
     * Узлы, достижимые от корней, в порядке обхода в ширину.
     */
    private Collection<GraphNode> reachableNodes(DependencyGraph graph) {
        Set<String> seen = new HashSet<>();
        Map<String, GraphNode> ordered = new LinkedHashMap<>();
        Deque<GraphNode> queue = new ArrayDeque<>(graph.getRoots());
        while (!queue.isEmpty()) {
            GraphNode node = queue.poll();
            if (!seen.add(node.identity())) {
                continue;
            }
            ordered.put(node.identity(), node);
            queue.addAll(node.getDependencies().values());
        }
        return ordered.values();
    }
}
