package com.example.routex.service;

import com.example.routex.model.Subscriber;
import com.example.routex.repository.SubscriberRepository;
import com.example.routex.service.audit.AuditRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class SubscriberService {

    private final SubscriberRepository subscriberRepository;
    private final AuditRecorder auditRecorder;
    private final Clock clock;

    public record SubscriberTotals(long total, long subscribed, long unsubscribed, long donors) {
    }

    /**
     * Finds or creates the subscriber for a chat, refreshing its username and activity timestamp.
     */
    @Transactional
    public Subscriber registerActivity(Long telegramId, String username) {
        Subscriber subscriber = subscriberRepository.findByTelegramId(telegramId)
                .orElseGet(() -> {
                    log.info("Registering new subscriber for telegram ID {}", telegramId);
                    return new Subscriber(telegramId, username);
                });
        if (username != null) {
            subscriber.setUsername(username);
        }
        subscriber.setLastActivityAt(LocalDateTime.now(clock));
        return subscriberRepository.save(subscriber);
    }

    /**
     * @return the updated subscriber, or empty if the chat never talked to the bot.
     */
    @Transactional
    public Optional<Subscriber> setSubscription(Long telegramId, boolean subscribed) {
        Optional<Subscriber> updated = subscriberRepository.findByTelegramId(telegramId).map(subscriber -> {
            subscriber.setSubscribed(subscribed);
            return subscriberRepository.save(subscriber);
        });
        updated.ifPresent(subscriber -> auditRecorder.log(telegramId,
                subscribed ? AuditRecorder.USER_OPT_IN : AuditRecorder.USER_OPT_OUT,
                Map.of("subscriber_id", subscriber.getId())));
        return updated;
    }

    @Transactional
    public Optional<Subscriber> markDonor(Long telegramId) {
        return subscriberRepository.findByTelegramId(telegramId).map(subscriber -> {
            subscriber.setDonor(true);
            return subscriberRepository.save(subscriber);
        });
    }

    @Transactional(readOnly = true)
    public SubscriberTotals totals() {
        return new SubscriberTotals(
                subscriberRepository.count(),
                subscriberRepository.countBySubscribedTrue(),
                subscriberRepository.countBySubscribedFalse(),
                subscriberRepository.countByDonorTrue());
    }
}
