package com.example.routex.service.delivery;

import com.example.routex.model.DeliveryStatus;
import com.example.routex.model.segment.Segment;
import com.example.routex.service.audit.AuditRecorder;
import com.example.routex.service.segment.SegmentResolver;
import com.example.routex.service.store.Recipient;
import com.example.routex.service.store.RecipientStore;
import com.example.routex.service.store.ScheduleStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sends a message template to every recipient of a segment.
 * <p>
 * Recipients are processed in fixed-size batches, strictly one after another, with a pause between
 * batches. Each send gets its own delivery row; rate-limited sends are retried on the same row.
 * A single recipient's failure never aborts the run.
 */
@Service
@Slf4j
public class DeliveryExecutor {

    public static final Duration DEDUP_WINDOW = Duration.ofHours(24);
    public static final int MAX_SEND_ATTEMPTS = 3;
    public static final String RETRY_LIMIT_EXCEEDED = "Retry limit exceeded";

    private static final Duration MIN_BATCH_DELAY = Duration.ofMillis(100);

    private final SegmentResolver segmentResolver;
    private final ScheduleStore scheduleStore;
    private final RecipientStore recipientStore;
    private final MessageTransport transport;
    private final TemplateRenderer templateRenderer;
    private final AuditRecorder auditRecorder;
    private final Sleeper sleeper;
    private final int batchSize;
    private final Duration batchDelay;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public DeliveryExecutor(SegmentResolver segmentResolver,
                            ScheduleStore scheduleStore,
                            RecipientStore recipientStore,
                            MessageTransport transport,
                            TemplateRenderer templateRenderer,
                            AuditRecorder auditRecorder,
                            Sleeper sleeper,
                            @Value("${app.broadcast.batch-size:30}") int batchSize,
                            @Value("${app.broadcast.batch-delay-ms:1500}") long batchDelayMillis) {
        this.segmentResolver = segmentResolver;
        this.scheduleStore = scheduleStore;
        this.recipientStore = recipientStore;
        this.transport = transport;
        this.templateRenderer = templateRenderer;
        this.auditRecorder = auditRecorder;
        this.sleeper = sleeper;
        this.batchSize = Math.max(1, batchSize);
        Duration requestedDelay = Duration.ofMillis(batchDelayMillis);
        this.batchDelay = requestedDelay.compareTo(MIN_BATCH_DELAY) < 0 ? MIN_BATCH_DELAY : requestedDelay;
        log.info("DeliveryExecutor initialized: batchSize={}, batchDelay={}ms", this.batchSize, this.batchDelay.toMillis());
    }

    /**
     * @param template   message text with {@code {username}} / {@code {key}} placeholders
     * @param scheduleId owning schedule, enables the dedup window; {@code null} for an ad-hoc broadcast
     */
    public DeliveryReport run(String template, Segment segment, Long scheduleId) {
        List<Recipient> recipients = segmentResolver.resolve(segment);
        if (recipients.isEmpty()) {
            log.info("Segment '{}' has no recipients, nothing to deliver", segment.tag());
            return DeliveryReport.EMPTY;
        }

        List<List<Recipient>> batches = partition(recipients, batchSize);
        log.info("Delivering to {} recipients of segment '{}' in {} batches (schedule {})",
                recipients.size(), segment.tag(), batches.size(), scheduleId);

        int queued = 0;
        int sent = 0;
        int failed = 0;
        for (int batchIndex = 0; batchIndex < batches.size(); batchIndex++) {
            for (Recipient recipient : batches.get(batchIndex)) {
                Long deliveryId = null;
                try {
                    if (scheduleId != null && scheduleStore.hasRecentDelivery(scheduleId, recipient.id(), DEDUP_WINDOW)) {
                        log.debug("Recipient {} already got schedule {} within {}, skipping", recipient.id(), scheduleId, DEDUP_WINDOW);
                        continue;
                    }
                    deliveryId = scheduleStore.enqueueDelivery(scheduleId, recipient.id());
                    queued++;
                    String text = templateRenderer.renderOrRaw(template, placeholders(recipient));
                    if (deliver(deliveryId, recipient, text)) {
                        sent++;
                    } else {
                        failed++;
                    }
                } catch (DataAccessException | TransactionException e) {
                    log.error("Store write failed for recipient {} (delivery {}): {}", recipient.id(), deliveryId, e.getMessage(), e);
                    if (deliveryId != null) {
                        failed++;
                    }
                }
            }

            boolean lastBatch = batchIndex == batches.size() - 1;
            if (lastBatch) {
                break;
            }
            if (stopRequested.get()) {
                log.warn("Stop requested, abandoning {} remaining batches (schedule {})", batches.size() - batchIndex - 1, scheduleId);
                break;
            }
            if (!pause(batchDelay)) {
                log.warn("Interrupted between batches, abandoning the rest of the run (schedule {})", scheduleId);
                break;
            }
        }

        DeliveryReport report = new DeliveryReport(queued, sent, failed);
        log.info("Delivery finished for schedule {}: {}", scheduleId, report);
        return report;
    }

    /**
     * Asks running deliveries to stop once their current batch is done.
     */
    public void requestStop() {
        stopRequested.set(true);
    }

    // Returns true when the delivery ended up SENT
    private boolean deliver(long deliveryId, Recipient recipient, String text) {
        for (int attempt = 1; ; attempt++) {
            SendOutcome outcome;
            try {
                outcome = transport.send(recipient.chatId(), text);
            } catch (RuntimeException e) {
                log.error("Unexpected broadcast error for chat {}", recipient.chatId(), e);
                outcome = SendOutcome.transientFailure(e.getClass().getSimpleName() + ": " + e.getMessage());
            }

            if (outcome instanceof SendOutcome.Delivered) {
                scheduleStore.updateDelivery(deliveryId, DeliveryStatus.SENT, null);
                try {
                    recipientStore.touchActivity(recipient.id());
                } catch (DataAccessException | TransactionException e) {
                    log.warn("Delivery {} was sent but activity of recipient {} was not updated: {}",
                            deliveryId, recipient.id(), e.getMessage());
                }
                return true;
            }
            if (outcome instanceof SendOutcome.RateLimited rateLimited) {
                if (attempt >= MAX_SEND_ATTEMPTS) {
                    log.warn("Chat {} still rate limited after {} attempts, giving up", recipient.chatId(), attempt);
                    scheduleStore.updateDelivery(deliveryId, DeliveryStatus.FAILED, RETRY_LIMIT_EXCEEDED);
                    return false;
                }
                log.warn("Flood wait of {}s for chat {} (attempt {}/{})",
                        rateLimited.retryAfterSeconds(), recipient.chatId(), attempt, MAX_SEND_ATTEMPTS);
                if (!pause(Duration.ofSeconds(Math.max(0, rateLimited.retryAfterSeconds())))) {
                    scheduleStore.updateDelivery(deliveryId, DeliveryStatus.FAILED, "Interrupted during rate-limit backoff");
                    return false;
                }
                continue;
            }
            if (outcome instanceof SendOutcome.PermanentFailure permanent) {
                log.info("Chat {} is unreachable ({}), unsubscribing recipient {}", recipient.chatId(), permanent.reason(), recipient.id());
                scheduleStore.updateDelivery(deliveryId, DeliveryStatus.FAILED, permanent.reason());
                recipientStore.setSubscribed(recipient.id(), false);
                auditRecorder.log(null, AuditRecorder.DELIVERY_PERMANENT_FAILURE, Map.of(
                        "recipient_id", recipient.id(),
                        "delivery_id", deliveryId,
                        "reason", String.valueOf(permanent.reason())));
                return false;
            }
            SendOutcome.TransientFailure transientFailure = (SendOutcome.TransientFailure) outcome;
            log.error("Failed to send broadcast to chat {}: {}", recipient.chatId(), transientFailure.reason());
            scheduleStore.updateDelivery(deliveryId, DeliveryStatus.FAILED, transientFailure.reason());
            return false;
        }
    }

    private Map<String, String> placeholders(Recipient recipient) {
        return Map.of(
                "username", recipient.displayNameOr("friend #" + recipient.chatId()),
                "key", recipient.messageKey() != null ? recipient.messageKey() : "—");
    }

    private boolean pause(Duration duration) {
        try {
            sleeper.sleep(duration);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> batches = new ArrayList<>();
        for (int from = 0; from < items.size(); from += size) {
            batches.add(items.subList(from, Math.min(items.size(), from + size)));
        }
        return batches;
    }
}
