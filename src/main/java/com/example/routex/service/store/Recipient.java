package com.example.routex.service.store;

import com.example.routex.model.Subscriber;

import java.time.LocalDateTime;

/**
 * Read-only view of a subscriber, as seen by the delivery engine.
 *
 * @param id         Internal subscriber id, used as the recipient id of deliveries.
 * @param chatId     Telegram chat id the transport sends to.
 * @param username   Display name, may be {@code null}.
 * @param messageKey Last issued key, may be {@code null}.
 */
public record Recipient(long id, long chatId, String username, String messageKey,
                        boolean subscribed, boolean donor, LocalDateTime lastActivityAt) {

    public static Recipient of(Subscriber subscriber) {
        return new Recipient(subscriber.getId(), subscriber.getTelegramId(), subscriber.getUsername(),
                subscriber.getMessageKey(), subscriber.isSubscribed(), subscriber.isDonor(),
                subscriber.getLastActivityAt());
    }

    public String displayNameOr(String fallback) {
        return username != null && !username.isBlank() ? username : fallback;
    }
}
