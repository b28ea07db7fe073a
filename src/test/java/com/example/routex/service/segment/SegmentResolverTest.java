package com.example.routex.service.segment;

import com.example.routex.model.segment.Segment;
import com.example.routex.service.store.Recipient;
import com.example.routex.service.store.RecipientStore;
import com.example.routex.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SegmentResolverTest {

    @Mock
    private RecipientStore recipientStore;

    private SegmentResolver resolver;

    private final Recipient alice = new Recipient(1, 101, "alice", null, true, false, null);

    @BeforeEach
    void setUp() {
        resolver = new SegmentResolver(recipientStore, new MutableClock(Instant.parse("2024-05-01T12:00:00Z")));
    }

    @Test
    void resolve_allSubscribed() {
        when(recipientStore.findSubscribed()).thenReturn(List.of(alice));

        assertThat(resolver.resolve(new Segment.AllSubscribed())).containsExactly(alice);
    }

    @Test
    void resolve_noKeyAndDonorsUseTheirQueries() {
        when(recipientStore.findSubscribedWithoutKey()).thenReturn(List.of(alice));
        when(recipientStore.findSubscribedDonors()).thenReturn(List.of());

        assertThat(resolver.resolve(new Segment.NoKey())).containsExactly(alice);
        assertThat(resolver.resolve(new Segment.Donors())).isEmpty();
    }

    @Test
    void resolve_inactiveForComputesCutoffFromClock() {
        when(recipientStore.findSubscribedInactiveSince(LocalDateTime.parse("2024-04-17T12:00:00"))).thenReturn(List.of(alice));

        assertThat(resolver.resolve(new Segment.InactiveFor(Duration.ofDays(14)))).containsExactly(alice);
    }

    @Test
    void resolve_customFilterPassesTrimmedExpression() {
        when(recipientStore.findMatching("is_donor = true")).thenReturn(List.of(alice));

        assertThat(resolver.resolve(new Segment.CustomFilter("  is_donor = true "))).containsExactly(alice);
        verify(recipientStore, never()).findSubscribed();
    }

    @Test
    void resolve_customFilterWithCommentMarkerIsRejectedBeforeAnyQuery() {
        assertThatThrownBy(() -> resolver.resolve(new Segment.CustomFilter("1=1 -- drop")))
                .isInstanceOf(InvalidSegmentException.class)
                .hasMessageContaining("--");
        assertThatThrownBy(() -> resolver.resolve(new Segment.CustomFilter("1=1 /* x */")))
                .isInstanceOf(InvalidSegmentException.class);

        verifyNoInteractions(recipientStore);
    }

    @Test
    void resolve_emptyCustomFilterIsRejected() {
        assertThatThrownBy(() -> resolver.resolve(new Segment.CustomFilter("   ")))
                .isInstanceOf(InvalidSegmentException.class);

        verifyNoInteractions(recipientStore);
    }

    // A typo'd tag broadcasts to every subscriber instead of nobody
    @Test
    void resolve_unknownTagFallsBackToAllSubscribed() {
        when(recipientStore.findSubscribed()).thenReturn(List.of(alice));

        assertThat(resolver.resolve(new Segment.Unknown("al_subscribed"))).containsExactly(alice);
    }

    @Test
    void validate_rejectsMissingSegment() {
        assertThatThrownBy(() -> resolver.validate(null)).isInstanceOf(InvalidSegmentException.class);
    }
}
