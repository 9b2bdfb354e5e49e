package com.vtb.supplychain.models;

public enum StageStatus {
    SUCCESS,
    FAILED,
    SKIPPED,
    TIMED_OUT
}
