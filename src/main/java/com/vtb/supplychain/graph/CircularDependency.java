package com.vtb.supplychain.graph;

import com.vtb.supplychain.models.Severity;
import lombok.Value;

import java.util.List;

/**
 * Цикл в графе: цепочка идентичностей, замыкающаяся на первой.
 */
@Value
public class CircularDependency {
    List<String> cycle;
    Severity severity;

    public CircularDependency(List<String> cycle) {
        this.cycle = List.copyOf(cycle);
        this.severity = Severity.MEDIUM;
    }

    public String describe() {
        return "Циклическая зависимость: " + String.join(" -> ", cycle);
    }
}
