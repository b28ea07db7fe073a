package com.example.routex.model;

import java.util.Arrays;
import java.util.Optional;

public enum TriggerKind {
    CRON("cron"),
    INTERVAL("interval");

    private final String tag;

    TriggerKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Optional<TriggerKind> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        String normalized = tag.trim().toLowerCase();
        return Arrays.stream(values()).filter(k -> k.tag.equals(normalized)).findFirst();
    }
}
