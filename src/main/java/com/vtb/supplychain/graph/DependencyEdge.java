package com.vtb.supplychain.graph;

import com.vtb.supplychain.models.Ecosystem;

/**
 * Ребро от внешнего резолвера: родитель (name@version) зависит от childName@childVersion.
 */
public record DependencyEdge(String parentIdentity, String childName, String childVersion, Ecosystem ecosystem) {

    public static DependencyEdge of(String parentIdentity, String childName, String childVersion) {
        return new DependencyEdge(parentIdentity, childName, childVersion, Ecosystem.OTHER);
    }

    public boolean isMalformed() {
        return parentIdentity == null || parentIdentity.isBlank()
            || childName == null || childName.isBlank();
    }
}
