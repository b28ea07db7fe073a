package com.example.routex.bot.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Telegram ids allowed to use admin commands, from {@code app.admin.ids} (comma separated).
 */
@Service
@Slf4j
public class AdminRegistry {

    private final Set<Long> adminIds;

    public AdminRegistry(@Value("${app.admin.ids:}") String adminIds) {
        this.adminIds = parse(adminIds);
        if (this.adminIds.isEmpty()) {
            log.warn("No admin ids configured, admin commands are disabled");
        } else {
            log.info("{} admin id(s) configured", this.adminIds.size());
        }
    }

    public boolean isAdmin(Long telegramId) {
        return telegramId != null && adminIds.contains(telegramId);
    }

    static Set<Long> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Set.of();
        }
        try {
            return Arrays.stream(raw.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .map(Long::valueOf)
                    .collect(Collectors.toUnmodifiableSet());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("app.admin.ids must be a comma separated list of Telegram ids, got '" + raw + "'", e);
        }
    }
}
