package com.vtb.supplychain.models;

import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * Пакет, идентифицируемый парой name@version.
 * Экосистема и глубина - метаданные, в равенстве не участвуют.
 */
@Value
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PackageIdentity {

    public static final String UNKNOWN_VERSION = "unknown";

    @EqualsAndHashCode.Include
    String name;
    @EqualsAndHashCode.Include
    String version;
    Ecosystem ecosystem;
    Integer depth;

    public PackageIdentity(String name, String version, Ecosystem ecosystem, Integer depth) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Имя пакета не может быть пустым");
        }
        this.name = name.trim();
        this.version = normalizeVersion(version);
        this.ecosystem = ecosystem != null ? ecosystem : Ecosystem.OTHER;
        this.depth = depth;
    }

    public static PackageIdentity of(String name, String version, Ecosystem ecosystem) {
        return new PackageIdentity(name, version, ecosystem, null);
    }

    public String identity() {
        return identityOf(name, version);
    }

    public boolean isVersionKnown() {
        return !UNKNOWN_VERSION.equals(version);
    }

    public PackageIdentity withEcosystem(Ecosystem newEcosystem) {
        return new PackageIdentity(name, version, newEcosystem, depth);
    }

    public PackageIdentity withDepth(Integer newDepth) {
        return new PackageIdentity(name, version, ecosystem, newDepth);
    }

    public static String identityOf(String name, String version) {
        return (name != null ? name.trim() : null) + "@" + normalizeVersion(version);
    }

    public static String normalizeVersion(String version) {
        if (version == null || version.isBlank()) {
            return UNKNOWN_VERSION;
        }
        return version.trim();
    }

    @Override
    public String toString() {
        return identity();
    }
}
