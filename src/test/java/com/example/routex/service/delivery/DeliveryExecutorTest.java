package com.example.routex.service.delivery;

import com.example.routex.model.DeliveryStatus;
import com.example.routex.model.segment.Segment;
import com.example.routex.service.audit.AuditRecorder;
import com.example.routex.service.segment.SegmentResolver;
import com.example.routex.service.store.Recipient;
import com.example.routex.service.store.RecipientStore;
import com.example.routex.service.store.ScheduleStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeliveryExecutorTest {

    private static final Segment ALL = new Segment.AllSubscribed();

    @Mock
    private SegmentResolver segmentResolver;
    @Mock
    private ScheduleStore scheduleStore;
    @Mock
    private RecipientStore recipientStore;
    @Mock
    private MessageTransport transport;
    @Mock
    private AuditRecorder auditRecorder;

    private final List<Duration> sleeps = new ArrayList<>();
    private final AtomicLong deliveryIds = new AtomicLong();

    @BeforeEach
    void setUp() {
        lenient().when(scheduleStore.enqueueDelivery(any(), anyLong())).thenAnswer(inv -> deliveryIds.incrementAndGet());
    }

    private DeliveryExecutor executor(int batchSize, long delayMillis) {
        return new DeliveryExecutor(segmentResolver, scheduleStore, recipientStore, transport,
                new TemplateRenderer(), auditRecorder, sleeps::add, batchSize, delayMillis);
    }

    private static Recipient recipient(long id) {
        return new Recipient(id, 1000 + id, "user" + id, "key-" + id, true, false, null);
    }

    private static List<Recipient> recipients(int count) {
        return LongStream.rangeClosed(1, count).mapToObj(DeliveryExecutorTest::recipient).collect(Collectors.toList());
    }

    @Test
    void run_emptySegmentReturnsZeroCountsAndWritesNothing() {
        when(segmentResolver.resolve(ALL)).thenReturn(List.of());

        DeliveryReport report = executor(30, 1500).run("Hello", ALL, 1L);

        assertThat(report).isEqualTo(DeliveryReport.EMPTY);
        verifyNoInteractions(scheduleStore, transport, recipientStore);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void run_fiveRecipientsInBatchesOfTwo_pausesBetweenBatchesOnly() {
        when(segmentResolver.resolve(ALL)).thenReturn(recipients(5));
        when(transport.send(anyLong(), anyString())).thenReturn(SendOutcome.delivered());

        DeliveryReport report = executor(2, 1000).run("Hi {username}", ALL, 3L);

        assertThat(report).isEqualTo(new DeliveryReport(5, 5, 0));
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(1));
        verify(scheduleStore, times(5)).enqueueDelivery(eq(3L), anyLong());
        verify(scheduleStore, times(5)).updateDelivery(anyLong(), eq(DeliveryStatus.SENT), isNull());
        verify(recipientStore, times(5)).touchActivity(anyLong());
        verify(transport).send(1001L, "Hi user1");
    }

    @Test
    void run_recipientsInOrderWithEnqueueBeforeSend() {
        when(segmentResolver.resolve(ALL)).thenReturn(recipients(2));
        when(transport.send(anyLong(), anyString())).thenReturn(SendOutcome.delivered());

        executor(30, 100).run("Hi", ALL, null);

        InOrder inOrder = inOrder(scheduleStore, transport);
        inOrder.verify(scheduleStore).enqueueDelivery(null, 1L);
        inOrder.verify(transport).send(1001L, "Hi");
        inOrder.verify(scheduleStore).updateDelivery(1L, DeliveryStatus.SENT, null);
        inOrder.verify(scheduleStore).enqueueDelivery(null, 2L);
        inOrder.verify(transport).send(1002L, "Hi");
    }

    @Test
    void run_batchDelayBelowMinimumIsRaised() {
        when(segmentResolver.resolve(ALL)).thenReturn(recipients(2));
        when(transport.send(anyLong(), anyString())).thenReturn(SendOutcome.delivered());

        executor(0, 5).run("Hi", ALL, null);

        // batch size 0 is raised to 1, delay to 100ms
        assertThat(sleeps).containsExactly(Duration.ofMillis(100));
    }

    @Test
    void run_skipsRecipientsAlreadyNotifiedWithinDedupWindow() {
        when(segmentResolver.resolve(ALL)).thenReturn(recipients(2));
        when(scheduleStore.hasRecentDelivery(7L, 1L, DeliveryExecutor.DEDUP_WINDOW)).thenReturn(true);
        when(scheduleStore.hasRecentDelivery(7L, 2L, DeliveryExecutor.DEDUP_WINDOW)).thenReturn(false);
        when(transport.send(anyLong(), anyString())).thenReturn(SendOutcome.delivered());

        DeliveryReport report = executor(30, 1500).run("Hi", ALL, 7L);

        assertThat(report).isEqualTo(new DeliveryReport(1, 1, 0));
        verify(scheduleStore, never()).enqueueDelivery(7L, 1L);
        verify(transport, never()).send(eq(1001L), anyString());
    }

    @Test
    void run_adHocBroadcastDoesNotCheckDedup() {
        when(segmentResolver.resolve(ALL)).thenReturn(recipients(1));
        when(transport.send(anyLong(), anyString())).thenReturn(SendOutcome.delivered());

        executor(30, 1500).run("Hi", ALL, null);

        verify(scheduleStore, never()).hasRecentDelivery(anyLong(), anyLong(), any());
    }

    @Test
    void run_rateLimitedThenDelivered_reusesSingleDeliveryRow() {
        when(segmentResolver.resolve(ALL)).thenReturn(recipients(1));
        when(transport.send(anyLong(), anyString()))
                .thenReturn(SendOutcome.rateLimited(5))
                .thenReturn(SendOutcome.delivered());

        DeliveryReport report = executor(30, 1500).run("Hi", ALL, 2L);

        assertThat(report).isEqualTo(new DeliveryReport(1, 1, 0));
        assertThat(sleeps).containsExactly(Duration.ofSeconds(5));
        verify(scheduleStore, times(1)).enqueueDelivery(2L, 1L);
        verify(scheduleStore).updateDelivery(1L, DeliveryStatus.SENT, null);
        verify(scheduleStore, never()).updateDelivery(anyLong(), eq(DeliveryStatus.FAILED), any());
    }

    @Test
    void run_rateLimitedOnEveryAttempt_failsWithRetryLimitExceeded() {
        when(segmentResolver.resolve(ALL)).thenReturn(recipients(1));
        when(transport.send(anyLong(), anyString())).thenReturn(SendOutcome.rateLimited(2));

        DeliveryReport report = executor(30, 1500).run("Hi", ALL, 2L);

        assertThat(report).isEqualTo(new DeliveryReport(1, 0, 1));
        verify(transport, times(DeliveryExecutor.MAX_SEND_ATTEMPTS)).send(1001L, "Hi");
        verify(scheduleStore, times(1)).enqueueDelivery(2L, 1L);
        verify(scheduleStore).updateDelivery(1L, DeliveryStatus.FAILED, DeliveryExecutor.RETRY_LIMIT_EXCEEDED);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(2));
    }

    @Test
    void run_permanentFailureUnsubscribesRecipientAndAudits() {
        when(segmentResolver.resolve(ALL)).thenReturn(recipients(2));
        when(transport.send(anyLong(), anyString()))
                .thenReturn(SendOutcome.permanentFailure("Forbidden: bot was blocked by the user"))
                .thenReturn(SendOutcome.delivered());

        DeliveryReport report = executor(30, 1500).run("Hi", ALL, null);

        assertThat(report).isEqualTo(new DeliveryReport(2, 1, 1));
        verify(scheduleStore).updateDelivery(1L, DeliveryStatus.FAILED, "Forbidden: bot was blocked by the user");
        verify(recipientStore).setSubscribed(1L, false);
        verify(recipientStore, never()).setSubscribed(eq(2L), anyBoolean());
        verify(auditRecorder).log(isNull(), eq(AuditRecorder.DELIVERY_PERMANENT_FAILURE), anyMap());
    }

    @Test
    void run_transientFailureMarksFailedWithoutUnsubscribing() {
        when(segmentResolver.resolve(ALL)).thenReturn(recipients(2));
        when(transport.send(anyLong(), anyString()))
                .thenReturn(SendOutcome.transientFailure("Bad Request: message is too long"))
                .thenReturn(SendOutcome.delivered());

        DeliveryReport report = executor(30, 1500).run("Hi", ALL, null);

        assertThat(report).isEqualTo(new DeliveryReport(2, 1, 1));
        verify(scheduleStore).updateDelivery(1L, DeliveryStatus.FAILED, "Bad Request: message is too long");
        verifyNoInteractions(auditRecorder);
        verify(recipientStore, never()).setSubscribed(anyLong(), anyBoolean());
    }

    @Test
    void run_unexpectedTransportExceptionDoesNotAbortBatch() {
        when(segmentResolver.resolve(ALL)).thenReturn(recipients(2));
        when(transport.send(anyLong(), anyString()))
                .thenThrow(new IllegalStateException("connection reset"))
                .thenReturn(SendOutcome.delivered());

        DeliveryReport report = executor(30, 1500).run("Hi", ALL, null);

        assertThat(report).isEqualTo(new DeliveryReport(2, 1, 1));
        verify(scheduleStore).updateDelivery(1L, DeliveryStatus.FAILED, "IllegalStateException: connection reset");
        verify(scheduleStore).updateDelivery(2L, DeliveryStatus.SENT, null);
    }

    @Test
    void run_unrenderableTemplateIsSentRaw() {
        when(segmentResolver.resolve(ALL)).thenReturn(recipients(1));
        when(transport.send(anyLong(), anyString())).thenReturn(SendOutcome.delivered());

        executor(30, 1500).run("Hello {first_name}", ALL, null);

        verify(transport).send(1001L, "Hello {first_name}");
    }

    @Test
    void run_missingUsernameAndKeyUseFallbacks() {
        when(segmentResolver.resolve(ALL)).thenReturn(List.of(new Recipient(4, 42, null, null, true, false, null)));
        when(transport.send(anyLong(), anyString())).thenReturn(SendOutcome.delivered());

        executor(30, 1500).run("{username}: {key}", ALL, null);

        verify(transport).send(42L, "friend #42: —");
    }

    @Test
    void run_storeFailureSkipsOnlyThatRecipient() {
        when(segmentResolver.resolve(ALL)).thenReturn(recipients(2));
        when(scheduleStore.enqueueDelivery(null, 1L)).thenThrow(new DataAccessResourceFailureException("db down"));
        when(scheduleStore.enqueueDelivery(null, 2L)).thenReturn(10L);
        when(transport.send(anyLong(), anyString())).thenReturn(SendOutcome.delivered());

        DeliveryReport report = executor(30, 1500).run("Hi", ALL, null);

        assertThat(report).isEqualTo(new DeliveryReport(1, 1, 0));
        verify(transport, never()).send(eq(1001L), anyString());
        verify(scheduleStore).updateDelivery(10L, DeliveryStatus.SENT, null);
    }

    @Test
    void run_transactionFailureSkipsOnlyThatRecipient() {
        when(segmentResolver.resolve(ALL)).thenReturn(recipients(2));
        when(scheduleStore.enqueueDelivery(null, 1L))
                .thenThrow(new CannotCreateTransactionException("Could not open JPA EntityManager for transaction"));
        when(scheduleStore.enqueueDelivery(null, 2L)).thenReturn(10L);
        when(transport.send(anyLong(), anyString())).thenReturn(SendOutcome.delivered());

        DeliveryReport report = executor(30, 1500).run("Hi", ALL, null);

        assertThat(report).isEqualTo(new DeliveryReport(1, 1, 0));
        verify(transport).send(1002L, "Hi");
        verify(scheduleStore).updateDelivery(10L, DeliveryStatus.SENT, null);
    }

    @Test
    void run_activityUpdateFailureStillCountsSentDelivery() {
        when(segmentResolver.resolve(ALL)).thenReturn(recipients(2));
        when(transport.send(anyLong(), anyString())).thenReturn(SendOutcome.delivered());
        doThrow(new DataAccessResourceFailureException("db down")).when(recipientStore).touchActivity(1L);

        DeliveryReport report = executor(30, 1500).run("Hi", ALL, null);

        assertThat(report).isEqualTo(new DeliveryReport(2, 2, 0));
        verify(scheduleStore).updateDelivery(1L, DeliveryStatus.SENT, null);
        verify(scheduleStore, never()).updateDelivery(anyLong(), eq(DeliveryStatus.FAILED), any());
        verify(recipientStore).touchActivity(2L);
    }

    @Test
    void run_stopRequestedFinishesCurrentBatchOnly() {
        when(segmentResolver.resolve(ALL)).thenReturn(recipients(3));
        when(transport.send(anyLong(), anyString())).thenReturn(SendOutcome.delivered());
        DeliveryExecutor executor = executor(2, 1500);
        executor.requestStop();

        DeliveryReport report = executor.run("Hi", ALL, null);

        assertThat(report).isEqualTo(new DeliveryReport(2, 2, 0));
        assertThat(sleeps).isEmpty();
        verify(transport, never()).send(eq(1003L), anyString());
    }
}
