package com.vtb.supplychain.pipeline;

import com.vtb.supplychain.graph.DependencyGraph;
import com.vtb.supplychain.models.Finding;
import com.vtb.supplychain.models.PackageIdentity;
import com.vtb.supplychain.models.StageResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Вход этапа. Находки и результаты предыдущих этапов передаются снимком:
 * изменения исполнителя не влияют на состояние оркестратора.
 */
@Value
@Builder
public class StageInput {
    Set<PackageIdentity> packages;
    List<Finding> findings;
    DependencyGraph graph;
    List<StageResult> previousResults;

    public StageResult previousResult(String stageName) {
        return previousResults.stream()
            .filter(result -> stageName.equals(result.getStageName()))
            .findFirst()
            .orElse(null);
    }
}
