package com.defipoints.platform.exception;

/**
 * Malformed event payload or query parameter.
 */
public class InvalidRequestException extends LeaderboardException {
    public InvalidRequestException(String message) {
        super(message, "INVALID_REQUEST");
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, "INVALID_REQUEST", cause);
    }
}
