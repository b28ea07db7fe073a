package com.example.routex.service.store;

import com.example.routex.model.Subscriber;
import com.example.routex.repository.SubscriberRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Service
@Slf4j
public class JpaRecipientStore implements RecipientStore {

    private final SubscriberRepository subscriberRepository;
    private final Clock clock;

    @PersistenceContext
    private EntityManager entityManager;

    public JpaRecipientStore(SubscriberRepository subscriberRepository, Clock clock) {
        this.subscriberRepository = subscriberRepository;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Recipient> findSubscribed() {
        return toRecipients(subscriberRepository.findBySubscribedTrueOrderByIdAsc());
    }

    @Override
    @Transactional(readOnly = true)
    public List<Recipient> findSubscribedWithoutKey() {
        return toRecipients(subscriberRepository.findBySubscribedTrueAndMessageKeyIsNullOrderByIdAsc());
    }

    @Override
    @Transactional(readOnly = true)
    public List<Recipient> findSubscribedInactiveSince(LocalDateTime cutoff) {
        return toRecipients(subscriberRepository.findSubscribedInactiveSince(cutoff));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Recipient> findSubscribedDonors() {
        return toRecipients(subscriberRepository.findBySubscribedTrueAndDonorTrueOrderByIdAsc());
    }

    @Override
    @Transactional(readOnly = true)
    @SuppressWarnings("unchecked")
    public List<Recipient> findMatching(String predicate) {
        log.info("Resolving custom filter segment: {}", predicate);
        List<Subscriber> rows = entityManager
                .createNativeQuery("SELECT * FROM subscribers WHERE (" + predicate + ") ORDER BY id ASC", Subscriber.class)
                .getResultList();
        return toRecipients(rows);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Recipient> getById(long recipientId) {
        return subscriberRepository.findById(recipientId).map(Recipient::of);
    }

    @Override
    @Transactional
    public void setSubscribed(long recipientId, boolean subscribed) {
        subscriberRepository.findById(recipientId).ifPresentOrElse(subscriber -> {
            subscriber.setSubscribed(subscribed);
            subscriberRepository.save(subscriber);
        }, () -> log.warn("Cannot change subscription of unknown recipient {}", recipientId));
    }

    @Override
    @Transactional
    public void touchActivity(long recipientId) {
        subscriberRepository.findById(recipientId).ifPresent(subscriber -> {
            subscriber.setLastActivityAt(LocalDateTime.now(clock));
            subscriberRepository.save(subscriber);
        });
    }

    private List<Recipient> toRecipients(List<Subscriber> subscribers) {
        return subscribers.stream().map(Recipient::of).toList();
    }
}
