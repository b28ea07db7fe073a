package com.example.routex.service.segment;

import com.example.routex.model.segment.Segment;
import com.example.routex.service.store.Recipient;
import com.example.routex.service.store.RecipientStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Turns a segment descriptor into the ordered list of recipients it targets.
 * Every variant except {@link Segment.CustomFilter} is restricted to subscribed recipients.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SegmentResolver {

    private static final List<String> COMMENT_MARKERS = List.of("--", "/*");

    private final RecipientStore recipientStore;
    private final Clock clock;

    public List<Recipient> resolve(Segment segment) {
        if (segment instanceof Segment.AllSubscribed) {
            return recipientStore.findSubscribed();
        }
        if (segment instanceof Segment.NoKey) {
            return recipientStore.findSubscribedWithoutKey();
        }
        if (segment instanceof Segment.InactiveFor inactive) {
            LocalDateTime cutoff = LocalDateTime.now(clock).minus(inactive.inactivity());
            return recipientStore.findSubscribedInactiveSince(cutoff);
        }
        if (segment instanceof Segment.Donors) {
            return recipientStore.findSubscribedDonors();
        }
        if (segment instanceof Segment.CustomFilter filter) {
            validateFilter(filter.expression());
            return recipientStore.findMatching(filter.expression().trim());
        }
        if (segment instanceof Segment.Unknown unknown) {
            log.warn("Unknown segment tag '{}', falling back to {}", unknown.tag(), Segment.TAG_ALL_SUBSCRIBED);
            return recipientStore.findSubscribed();
        }
        throw new IllegalStateException("Unhandled segment variant " + segment);
    }

    /**
     * Checks a segment without querying the store, so it can be rejected before it is persisted.
     */
    public void validate(Segment segment) {
        if (segment == null) {
            throw new InvalidSegmentException("Segment is required");
        }
        if (segment instanceof Segment.CustomFilter filter) {
            validateFilter(filter.expression());
        }
    }

    private void validateFilter(String expression) {
        if (!StringUtils.hasText(expression)) {
            throw new InvalidSegmentException("custom_filter segment needs a non-empty expression");
        }
        for (String marker : COMMENT_MARKERS) {
            if (expression.contains(marker)) {
                throw new InvalidSegmentException("custom_filter expression must not contain '" + marker + "'");
            }
        }
    }
}
