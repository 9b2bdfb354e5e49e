package com.vtb.supplychain.models;

public enum DetectionMethod {
    RULE_BASED,
    AGENT
}
