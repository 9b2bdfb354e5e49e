package com.vtb.supplychain.models;

/**
 * Причина пропуска этапа.
 */
public enum SkipReason {
    /** Условие пропуска сработало по накопленным находкам. */
    PREDICATE,
    /** Остатка глобального бюджета не хватает на минимальное время этапа. */
    BUDGET_EXHAUSTED
}
