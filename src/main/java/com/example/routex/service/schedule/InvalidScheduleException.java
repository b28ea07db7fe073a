package com.example.routex.service.schedule;

/**
 * A trigger spec that cannot be parsed. Reported to whoever supplied it; nothing is persisted.
 */
public class InvalidScheduleException extends RuntimeException {

    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
