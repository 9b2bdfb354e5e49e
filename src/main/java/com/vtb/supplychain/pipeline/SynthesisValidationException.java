package com.vtb.supplychain.pipeline;

/**
 * Результат синтеза не прошел структурную проверку.
 */
public class SynthesisValidationException extends Exception {

    public SynthesisValidationException(String message) {
        super(message);
    }
}
