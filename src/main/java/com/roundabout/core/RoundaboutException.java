package com.roundabout.core;

/**
 * Root of the unchecked exceptions raised by agents and the governor.
 */
public class RoundaboutException extends RuntimeException {

    public RoundaboutException(String message) {
        super(message);
    }

    public RoundaboutException(String message, Throwable cause) {
        super(message, cause);
    }
}
