package com.vtb.supplychain.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Итог одного этапа конвейера.
 */
@Data
@Builder(toBuilder = true)
public class StageResult {

    private String stageName;
    private StageStatus status;
    @Builder.Default
    private long durationMs = 0;
    @Builder.Default
    private List<Finding> producedFindings = new ArrayList<>();
    private String error;
    private SkipReason skipReason;
    @Builder.Default
    private int attempts = 0;
    @Builder.Default
    private boolean fallbackUsed = false;

    /**
     * Глубокая копия вместе с находками этапа.
     */
    public StageResult copy() {
        List<Finding> findingsCopy = new ArrayList<>();
        if (producedFindings != null) {
            for (Finding finding : producedFindings) {
                findingsCopy.add(finding.copy());
            }
        }
        return toBuilder().producedFindings(findingsCopy).build();
    }

    public boolean isSuccess() {
        return status == StageStatus.SUCCESS;
    }

    public boolean isPredicateSkip() {
        return status == StageStatus.SKIPPED && skipReason == SkipReason.PREDICATE;
    }

    public boolean isBudgetSkip() {
        return status == StageStatus.SKIPPED && skipReason == SkipReason.BUDGET_EXHAUSTED;
    }
}
