package com.example.routex.service.store;

import com.example.routex.model.AppSetting;
import com.example.routex.model.BroadcastSchedule;
import com.example.routex.model.Delivery;
import com.example.routex.model.DeliveryStatus;
import com.example.routex.model.segment.Segment;
import com.example.routex.repository.AppSettingRepository;
import com.example.routex.repository.BroadcastScheduleRepository;
import com.example.routex.repository.DeliveryRepository;
import com.example.routex.service.segment.SegmentCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * Durable schedules, deliveries and settings. Pure data access: every mutation touches a single row
 * and policy lives in the callers.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduleStore {

    private static final int MAX_ERROR_LENGTH = 1024;

    private final BroadcastScheduleRepository scheduleRepository;
    private final DeliveryRepository deliveryRepository;
    private final AppSettingRepository settingRepository;
    private final SegmentCodec segmentCodec;
    private final Clock clock;

    public record ScheduleDeliveryCounts(long scheduleId, long sent, long failed) {
    }

    // --- Schedules ---

    /**
     * Persists a new, enabled schedule. {@code spec} is stored verbatim (crontab line or interval JSON).
     */
    @Transactional
    public BroadcastSchedule addSchedule(String name, String kind, String spec, String text, Segment segment) {
        BroadcastSchedule schedule = new BroadcastSchedule(name, kind, spec, text, segmentCodec.toJson(segment));
        BroadcastSchedule saved = scheduleRepository.save(schedule);
        log.info("Stored schedule {} '{}' ({} {})", saved.getId(), name, kind, spec);
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<BroadcastSchedule> getSchedule(long id) {
        return scheduleRepository.findById(id);
    }

    @Transactional(readOnly = true)
    public List<BroadcastSchedule> listSchedules() {
        return scheduleRepository.findAllByOrderByCreatedAtDescIdDesc();
    }

    @Transactional(readOnly = true)
    public List<BroadcastSchedule> listEnabledSchedules() {
        return scheduleRepository.findAllByEnabledTrueOrderByIdAsc();
    }

    /**
     * @return the updated schedule, or empty if it does not exist.
     */
    @Transactional
    public Optional<BroadcastSchedule> setEnabled(long id, boolean enabled) {
        return scheduleRepository.findById(id).map(schedule -> {
            schedule.setEnabled(enabled);
            return scheduleRepository.save(schedule);
        });
    }

    /**
     * @return {@code false} if there was nothing to delete.
     */
    @Transactional
    public boolean delete(long id) {
        if (!scheduleRepository.existsById(id)) {
            return false;
        }
        scheduleRepository.deleteById(id);
        return true;
    }

    @Transactional
    public void recordNextFire(long id, Instant nextFire) {
        scheduleRepository.findById(id).ifPresent(schedule -> {
            schedule.setNextRunAt(nextFire == null ? null : LocalDateTime.ofInstant(nextFire, ZoneOffset.UTC));
            scheduleRepository.save(schedule);
        });
    }

    // --- Deliveries ---

    /**
     * Creates a delivery in {@code QUEUED} state.
     *
     * @param scheduleId owning schedule, or {@code null} for an ad-hoc broadcast.
     * @return the delivery id, reused by every retry of this send.
     */
    @Transactional
    public long enqueueDelivery(Long scheduleId, long recipientId) {
        return deliveryRepository.save(new Delivery(scheduleId, recipientId)).getId();
    }

    @Transactional(readOnly = true)
    public boolean hasRecentDelivery(long scheduleId, long recipientId, Duration within) {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(within);
        return deliveryRepository.existsByScheduleIdAndRecipientIdAndSentAtGreaterThanEqual(scheduleId, recipientId, cutoff);
    }

    @Transactional
    public void updateDelivery(long deliveryId, DeliveryStatus status, String error) {
        Delivery delivery = deliveryRepository.findById(deliveryId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown delivery " + deliveryId));
        delivery.setStatus(status);
        delivery.setErrorText(truncate(error));
        delivery.setSentAt(status.isTerminal() ? LocalDateTime.now(clock) : null);
        deliveryRepository.save(delivery);
    }

    @Transactional(readOnly = true)
    public List<ScheduleDeliveryCounts> recentScheduleDeliveryCounts(int limit) {
        return deliveryRepository.findRecentScheduleIds(PageRequest.of(0, limit)).stream()
                .map(id -> new ScheduleDeliveryCounts(id,
                        deliveryRepository.countByScheduleIdAndStatus(id, DeliveryStatus.SENT),
                        deliveryRepository.countByScheduleIdAndStatus(id, DeliveryStatus.FAILED)))
                .toList();
    }

    // --- Settings ---

    @Transactional(readOnly = true)
    public Optional<String> getSetting(String key) {
        return settingRepository.findById(key).map(AppSetting::getSettingValue);
    }

    @Transactional
    public void putSetting(String key, String value) {
        AppSetting setting = settingRepository.findById(key).orElseGet(() -> new AppSetting(key, null));
        setting.setSettingValue(value);
        settingRepository.save(setting);
    }

    private String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) return error;
        return error.substring(0, MAX_ERROR_LENGTH);
    }
}
