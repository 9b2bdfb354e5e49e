package com.vtb.supplychain.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.vtb.supplychain.models.Ecosystem;
import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Узел ограниченного дерева для внешнего вывода. В отличие от {@link GraphNode},
 * дерево ацикличное: повторный вход в собственную цепочку предков превращается
 * в терминальный узел с {@code circular_reference = true}.
 */
@Data
@Builder
@JsonPropertyOrder({"name", "version", "ecosystem", "depth", "dependencies", "circular_reference", "depth_limited"})
public class SerializedNode {

    @JsonProperty("name")
    private String name;

    @JsonProperty("version")
    private String version;

    @JsonProperty("ecosystem")
    private Ecosystem ecosystem;

    @JsonProperty("depth")
    private int depth;

    @Builder.Default
    @ToString.Exclude
    @JsonProperty("dependencies")
    private Map<String, SerializedNode> dependencies = new LinkedHashMap<>();

    @JsonProperty("circular_reference")
    private boolean circularReference;

    @JsonProperty("depth_limited")
    private boolean depthLimited;

    @JsonIgnore
    public boolean isTerminal() {
        return circularReference || depthLimited;
    }

    /**
     * Количество узлов в поддереве, включая этот.
     */
    public int countNodes() {
        int count = 0;
        Deque<SerializedNode> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            SerializedNode node = pending.pop();
            count++;
            for (SerializedNode child : node.dependencies.values()) {
                pending.push(child);
            }
        }
        return count;
    }
}
