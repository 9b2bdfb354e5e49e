package com.vtb.supplychain.models;

import lombok.Builder;
import lombok.Value;

/**
 * Сводка графа для отчета: только счетчики, без самого дерева.
 */
@Value
@Builder
public class DependencyGraphSummary {
    int packageCount;
    int circularDependencyCount;
    int versionConflictCount;
    int malformedEdgeCount;

    public static DependencyGraphSummary empty() {
        return DependencyGraphSummary.builder().build();
    }
}
