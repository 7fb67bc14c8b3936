package com.roundabout.core.agent;

/**
 * Outcome of a closure attempt in EMERGE.
 */
public record EmergenceResult(boolean success, String detail) {

    public static EmergenceResult success(String result) {
        return new EmergenceResult(true, result);
    }

    public static EmergenceResult failure(String error) {
        return new EmergenceResult(false, error);
    }
}
