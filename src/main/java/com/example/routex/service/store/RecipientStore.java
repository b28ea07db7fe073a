package com.example.routex.service.store;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Narrow access to the recipient storage. Every list is returned in store iteration order (by id).
 */
public interface RecipientStore {

    List<Recipient> findSubscribed();

    List<Recipient> findSubscribedWithoutKey();

    /** Subscribed recipients whose last activity is unknown or strictly before {@code cutoff} (UTC). */
    List<Recipient> findSubscribedInactiveSince(LocalDateTime cutoff);

    List<Recipient> findSubscribedDonors();

    /**
     * All recipients, subscribed or not, matching a raw SQL predicate over the {@code subscribers} table.
     * The predicate must have been validated by the caller.
     */
    List<Recipient> findMatching(String predicate);

    Optional<Recipient> getById(long recipientId);

    void setSubscribed(long recipientId, boolean subscribed);

    void touchActivity(long recipientId);
}
