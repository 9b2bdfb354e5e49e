package com.vtb.supplychain.graph;

/**
 * Как назначается глубина пакету, достижимому на разных расстояниях от корня.
 */
public enum DepthPolicy {
    /** Глубина фиксируется при первом обходе и больше не пересчитывается. */
    FIRST_SEEN,
    /** Минимальное расстояние от любого корня. */
    SHALLOWEST
}
