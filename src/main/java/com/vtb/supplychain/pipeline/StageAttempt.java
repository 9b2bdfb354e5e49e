package com.vtb.supplychain.pipeline;

/**
 * Исход одной попытки выполнения этапа.
 */
final class StageAttempt {

    enum Kind {
        SUCCESS,
        TIMEOUT,
        ERROR,
        INVALID
    }

    private final Kind kind;
    private final StageOutput output;
    private final String error;

    private StageAttempt(Kind kind, StageOutput output, String error) {
        this.kind = kind;
        this.output = output;
        this.error = error;
    }

    static StageAttempt success(StageOutput output) {
        return new StageAttempt(Kind.SUCCESS, output, null);
    }

    static StageAttempt timeout(String error) {
        return new StageAttempt(Kind.TIMEOUT, null, error);
    }

    static StageAttempt error(String error) {
        return new StageAttempt(Kind.ERROR, null, error);
    }

    static StageAttempt invalid(String error) {
        return new StageAttempt(Kind.INVALID, null, error);
    }

    Kind kind() {
        return kind;
    }

    StageOutput output() {
        return output;
    }

    String error() {
        return error;
    }

    boolean isRetryable() {
        return kind == Kind.ERROR || kind == Kind.TIMEOUT;
    }
}
