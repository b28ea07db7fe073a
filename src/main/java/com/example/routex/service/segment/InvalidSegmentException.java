package com.example.routex.service.segment;

public class InvalidSegmentException extends RuntimeException {

    public InvalidSegmentException(String message) {
        super(message);
    }

    public InvalidSegmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
