package com.vtb.supplychain.graph;

import com.vtb.supplychain.models.Ecosystem;
import com.vtb.supplychain.models.PackageIdentity;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Узел графа: одна пара name@version. Зависимости - ссылки на узлы той же арены,
 * поэтому equals/hashCode не переопределяются (граф может быть цикличным).
 */
@Getter
public class GraphNode {

    private final String name;
    private final String version;
    private final Ecosystem ecosystem;
    private int depth;
    private final Map<String, GraphNode> dependencies = new LinkedHashMap<>();

    GraphNode(String name, String version, Ecosystem ecosystem, int depth) {
        this.name = name;
        this.version = PackageIdentity.normalizeVersion(version);
        this.ecosystem = ecosystem != null ? ecosystem : Ecosystem.OTHER;
        this.depth = depth;
    }

    public String identity() {
        return PackageIdentity.identityOf(name, version);
    }

    public Map<String, GraphNode> getDependencies() {
        return Collections.unmodifiableMap(dependencies);
    }

    public PackageIdentity toPackageIdentity() {
        return new PackageIdentity(name, version, ecosystem, depth);
    }

    /**
     * @return false, если у узла уже есть зависимость с таким именем
     */
    boolean link(GraphNode child) {
        return dependencies.putIfAbsent(child.getName(), child) == null;
    }

    void setDepth(int depth) {
        this.depth = depth;
    }

    @Override
    public String toString() {
        return identity() + " (depth " + depth + ", deps " + dependencies.size() + ")";
    }
}
