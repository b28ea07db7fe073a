package com.example.routex.model;

public enum DeliveryStatus {
    QUEUED,
    SENT,
    FAILED;

    public boolean isTerminal() {
        return this != QUEUED;
    }
}
