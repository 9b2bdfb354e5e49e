package com.vtb.supplychain.models;

import java.util.Locale;

public enum Ecosystem {
    NPM,
    PYPI,
    OTHER;

    public static Ecosystem fromString(String value) {
        if (value == null) {
            return OTHER;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "npm" -> NPM;
            case "pypi", "pip", "python" -> PYPI;
            default -> OTHER;
        };
    }
}
