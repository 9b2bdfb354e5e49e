package com.vtb.supplychain.pipeline;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Описание этапа конвейера: имя, условие пропуска, таймаут, политика повтора,
 * минимальный бюджет и исполнитель.
 */
@Value
@Builder
public class StageDescriptor {

    public static final int MAX_RETRIES = 1;

    String name;
    @Builder.Default
    SkipPredicate skipPredicate = StagePredicates.never();
    Duration timeout;
    @Builder.Default
    int retries = 1;
    @Builder.Default
    Duration retryDelay = Duration.ofMillis(500);
    @Builder.Default
    Duration minimumBudget = Duration.ZERO;
    StageExecutor executor;
    @Builder.Default
    boolean synthesis = false;

    /**
     * Число повторов после первой неудачной попытки: не больше одного.
     */
    public int effectiveRetries() {
        return Math.max(0, Math.min(retries, MAX_RETRIES));
    }
}
