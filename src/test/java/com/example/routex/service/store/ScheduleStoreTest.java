package com.example.routex.service.store;

import com.example.routex.model.BroadcastSchedule;
import com.example.routex.model.Delivery;
import com.example.routex.model.DeliveryStatus;
import com.example.routex.model.segment.Segment;
import com.example.routex.repository.DeliveryRepository;
import com.example.routex.service.segment.SegmentCodec;
import com.example.routex.support.JpaTestConfig;
import com.example.routex.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({JpaTestConfig.class, ScheduleStore.class, SegmentCodec.class})
class ScheduleStoreTest {

    @Autowired
    private ScheduleStore scheduleStore;
    @Autowired
    private DeliveryRepository deliveryRepository;
    @Autowired
    private MutableClock clock;

    @BeforeEach
    void resetClock() {
        clock.set(JpaTestConfig.NOW);
    }

    @Test
    void addSchedule_storesSpecVerbatimAndSegmentAsJson() {
        BroadcastSchedule saved = scheduleStore.addSchedule("weekly", "cron", "0 10 * * 1", "Hi {username}",
                new Segment.InactiveFor(Duration.ofDays(14)));

        BroadcastSchedule loaded = scheduleStore.getSchedule(saved.getId()).orElseThrow();
        assertThat(loaded.getTriggerSpec()).isEqualTo("0 10 * * 1");
        assertThat(loaded.getSegmentJson()).isEqualTo("{\"type\":\"inactive_for\",\"days\":14}");
        assertThat(loaded.isEnabled()).isTrue();
        assertThat(loaded.getCreatedAt()).isNotNull();
    }

    @Test
    void listSchedules_newestFirst() {
        BroadcastSchedule first = scheduleStore.addSchedule("a", "interval", "{\"hours\":1}", "A", new Segment.AllSubscribed());
        BroadcastSchedule second = scheduleStore.addSchedule("b", "interval", "{\"hours\":2}", "B", new Segment.AllSubscribed());

        assertThat(scheduleStore.listSchedules()).extracting(BroadcastSchedule::getId)
                .containsExactly(second.getId(), first.getId());
    }

    @Test
    void setEnabledAndDelete_reportMissingSchedules() {
        BroadcastSchedule saved = scheduleStore.addSchedule("a", "interval", "{\"hours\":1}", "A", new Segment.AllSubscribed());

        assertThat(scheduleStore.setEnabled(saved.getId(), false)).hasValueSatisfying(s -> assertThat(s.isEnabled()).isFalse());
        assertThat(scheduleStore.listEnabledSchedules()).isEmpty();
        assertThat(scheduleStore.setEnabled(9999L, true)).isEmpty();

        assertThat(scheduleStore.delete(saved.getId())).isTrue();
        assertThat(scheduleStore.delete(saved.getId())).isFalse();
        assertThat(scheduleStore.getSchedule(saved.getId())).isEmpty();
    }

    @Test
    void recordNextFire_storesUtcTimestampOrClearsIt() {
        BroadcastSchedule saved = scheduleStore.addSchedule("a", "interval", "{\"hours\":1}", "A", new Segment.AllSubscribed());

        scheduleStore.recordNextFire(saved.getId(), Instant.parse("2024-05-01T13:00:00Z"));
        assertThat(scheduleStore.getSchedule(saved.getId()).orElseThrow().getNextRunAt())
                .isEqualTo(LocalDateTime.parse("2024-05-01T13:00:00"));

        scheduleStore.recordNextFire(saved.getId(), null);
        assertThat(scheduleStore.getSchedule(saved.getId()).orElseThrow().getNextRunAt()).isNull();
    }

    @Test
    void updateDelivery_movesQueuedRowToTerminalState() {
        long id = scheduleStore.enqueueDelivery(1L, 10L);
        assertThat(deliveryRepository.findById(id).orElseThrow().getStatus()).isEqualTo(DeliveryStatus.QUEUED);

        scheduleStore.updateDelivery(id, DeliveryStatus.FAILED, "x".repeat(2000));

        Delivery delivery = deliveryRepository.findById(id).orElseThrow();
        assertThat(delivery.getStatus()).isEqualTo(DeliveryStatus.FAILED);
        assertThat(delivery.getErrorText()).hasSize(1024);
        assertThat(delivery.getSentAt()).isEqualTo(LocalDateTime.parse("2024-05-01T12:00:00"));
    }

    @Test
    void updateDelivery_unknownIdFails() {
        assertThatThrownBy(() -> scheduleStore.updateDelivery(424242L, DeliveryStatus.SENT, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void hasRecentDelivery_onlyWithinWindowAndForSameSchedule() {
        long id = scheduleStore.enqueueDelivery(1L, 10L);
        assertThat(scheduleStore.hasRecentDelivery(1L, 10L, Duration.ofHours(24))).isFalse();

        scheduleStore.updateDelivery(id, DeliveryStatus.SENT, null);

        assertThat(scheduleStore.hasRecentDelivery(1L, 10L, Duration.ofHours(24))).isTrue();
        assertThat(scheduleStore.hasRecentDelivery(2L, 10L, Duration.ofHours(24))).isFalse();
        assertThat(scheduleStore.hasRecentDelivery(1L, 11L, Duration.ofHours(24))).isFalse();

        clock.advance(Duration.ofHours(25));
        assertThat(scheduleStore.hasRecentDelivery(1L, 10L, Duration.ofHours(24))).isFalse();
    }

    @Test
    void enqueueDelivery_adHocBroadcastHasNoSchedule() {
        long id = scheduleStore.enqueueDelivery(null, 10L);

        assertThat(deliveryRepository.findById(id).orElseThrow().getScheduleId()).isNull();
    }

    @Test
    void recentScheduleDeliveryCounts_newestSchedulesFirst() {
        scheduleStore.updateDelivery(scheduleStore.enqueueDelivery(1L, 10L), DeliveryStatus.SENT, null);
        scheduleStore.updateDelivery(scheduleStore.enqueueDelivery(2L, 10L), DeliveryStatus.SENT, null);
        scheduleStore.updateDelivery(scheduleStore.enqueueDelivery(2L, 11L), DeliveryStatus.FAILED, "blocked");
        scheduleStore.enqueueDelivery(null, 12L);

        List<ScheduleStore.ScheduleDeliveryCounts> counts = scheduleStore.recentScheduleDeliveryCounts(5);

        assertThat(counts).containsExactly(
                new ScheduleStore.ScheduleDeliveryCounts(2L, 1, 1),
                new ScheduleStore.ScheduleDeliveryCounts(1L, 1, 0));
        assertThat(deliveryRepository.findByScheduleIdOrderByIdAsc(2L)).hasSize(2);
    }

    @Test
    void settings_putOverwritesPreviousValue() {
        assertThat(scheduleStore.getSetting("event_template:release")).isEmpty();

        scheduleStore.putSetting("event_template:release", "v1");
        scheduleStore.putSetting("event_template:release", "v2");

        assertThat(scheduleStore.getSetting("event_template:release")).contains("v2");
    }
}
