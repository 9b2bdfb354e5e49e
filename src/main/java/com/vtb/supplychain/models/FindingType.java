package com.vtb.supplychain.models;

import java.util.Locale;

/**
 * Тип находки. {@link #wireName()} совпадает с форматом внешних отчетов.
 */
public enum FindingType {
    VULNERABILITY,
    MALICIOUS_PACKAGE,
    MALICIOUS_SCRIPT,
    LOW_REPUTATION,
    SUPPLY_CHAIN_RISK;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
