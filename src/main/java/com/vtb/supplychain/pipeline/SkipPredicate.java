package com.vtb.supplychain.pipeline;

import com.vtb.supplychain.models.Finding;

import java.util.List;

/**
 * Условие пропуска этапа, вычисляемое по находкам всех завершенных этапов перед его запуском.
 */
@FunctionalInterface
public interface SkipPredicate {

    boolean shouldSkip(List<Finding> accumulatedFindings);
}
