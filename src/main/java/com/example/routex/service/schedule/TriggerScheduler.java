package com.example.routex.service.schedule;

import com.example.routex.model.BroadcastSchedule;
import com.example.routex.model.segment.Segment;
import com.example.routex.service.audit.AuditRecorder;
import com.example.routex.service.delivery.DeliveryExecutor;
import com.example.routex.service.delivery.DeliveryReport;
import com.example.routex.service.segment.SegmentCodec;
import com.example.routex.service.store.ScheduleStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps one in-memory timer per enabled schedule and runs the schedule's broadcast when it fires.
 * <p>
 * A single dispatcher thread waits for the earliest timer and hands due fires to the fire executor.
 * Fires of the same schedule never overlap: while one is queued on or running in the fire executor, later
 * fires of that schedule are skipped.
 * Fires missed while the process was down are not replayed; arming always computes a future time.
 */
@Service
@Slf4j
public class TriggerScheduler {

    private static final Duration MAX_IDLE_WAIT = Duration.ofMinutes(1);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final ScheduleStore scheduleStore;
    private final DeliveryExecutor deliveryExecutor;
    private final AuditRecorder auditRecorder;
    private final SegmentCodec segmentCodec;
    private final ScheduleTriggerFactory triggerFactory;
    private final Clock clock;
    private final ExecutorService fireExecutor;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition timersChanged = lock.newCondition();
    private final TimerQueue timers = new TimerQueue();
    // Schedules with a fire queued on or running in the fire executor
    private final Set<Long> pendingFires = ConcurrentHashMap.newKeySet();

    private Thread dispatcher;
    private volatile boolean running;

    public TriggerScheduler(ScheduleStore scheduleStore,
                            DeliveryExecutor deliveryExecutor,
                            AuditRecorder auditRecorder,
                            SegmentCodec segmentCodec,
                            ScheduleTriggerFactory triggerFactory,
                            Clock clock,
                            @Qualifier("scheduleFireExecutor") ExecutorService fireExecutor) {
        this.scheduleStore = scheduleStore;
        this.deliveryExecutor = deliveryExecutor;
        this.auditRecorder = auditRecorder;
        this.segmentCodec = segmentCodec;
        this.triggerFactory = triggerFactory;
        this.clock = clock;
        this.fireExecutor = fireExecutor;
    }

    /**
     * Arms every enabled schedule and starts the dispatcher thread.
     */
    public void start() {
        lock.lock();
        try {
            if (running) {
                log.warn("TriggerScheduler already started");
                return;
            }
            running = true;
        } finally {
            lock.unlock();
        }
        reloadJobs();
        dispatcher = new Thread(this::dispatchLoop, "schedule-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();
        log.info("TriggerScheduler started with {} armed schedules", armedCount());
    }

    /**
     * Drops every in-memory timer and re-arms from the persisted enabled schedules.
     * A schedule that cannot be armed is logged and left unarmed.
     */
    public void reloadJobs() {
        lock.lock();
        try {
            timers.clear();
            timersChanged.signalAll();
        } finally {
            lock.unlock();
        }
        for (BroadcastSchedule schedule : scheduleStore.listEnabledSchedules()) {
            try {
                arm(schedule);
            } catch (RuntimeException e) {
                log.error("Cannot arm schedule {} '{}' ({} '{}'): {}", schedule.getId(), schedule.getName(),
                        schedule.getTriggerKind(), schedule.getTriggerSpec(), e.getMessage());
            }
        }
    }

    /**
     * Validates the trigger, stores the schedule and arms it.
     *
     * @throws InvalidScheduleException                                 for a malformed spec, nothing is stored
     * @throws com.example.routex.service.EngineConfigurationException for an unsupported kind, nothing is stored
     */
    public BroadcastSchedule addSchedule(String name, String kind, String spec, String text, Segment segment, Long actorId) {
        String canonicalSpec = triggerFactory.canonicalSpec(kind, spec);
        String normalizedKind = kind.trim().toLowerCase();
        BroadcastSchedule schedule = scheduleStore.addSchedule(name, normalizedKind, canonicalSpec, text, segment);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("id", schedule.getId());
        meta.put("name", name);
        meta.put("type", normalizedKind);
        meta.put("spec", canonicalSpec);
        meta.put("segment", segment.tag());
        auditRecorder.log(actorId, AuditRecorder.SCHEDULE_CREATE, meta);

        if (schedule.isEnabled()) {
            arm(schedule);
        }
        return schedule;
    }

    /**
     * Installs (or replaces) the schedule's timer and persists the computed next fire time.
     */
    public Instant arm(BroadcastSchedule schedule) {
        ScheduleTrigger trigger = triggerFactory.create(schedule.getTriggerKind(), schedule.getTriggerSpec());
        Instant now = clock.instant();
        Instant next = trigger.nextFireTime(now, now);
        lock.lock();
        try {
            if (next == null) {
                timers.cancel(schedule.getId());
            } else {
                timers.arm(schedule.getId(), next, trigger, now);
            }
            timersChanged.signalAll();
        } finally {
            lock.unlock();
        }
        if (next == null) {
            log.warn("Schedule {} has no future fire time, left unarmed", schedule.getId());
        } else {
            log.info("Armed schedule {} '{}', next fire at {}", schedule.getId(), schedule.getName(), next);
        }
        scheduleStore.recordNextFire(schedule.getId(), next);
        return next;
    }

    public boolean disarm(long scheduleId) {
        lock.lock();
        try {
            boolean wasArmed = timers.cancel(scheduleId);
            timersChanged.signalAll();
            if (wasArmed) {
                log.info("Disarmed schedule {}", scheduleId);
            }
            return wasArmed;
        } finally {
            lock.unlock();
        }
    }

    public boolean isArmed(long scheduleId) {
        lock.lock();
        try {
            return timers.isArmed(scheduleId);
        } finally {
            lock.unlock();
        }
    }

    boolean hasPendingFire(long scheduleId) {
        return pendingFires.contains(scheduleId);
    }

    private boolean isArmedWith(long scheduleId, long generation) {
        lock.lock();
        try {
            return timers.isLive(scheduleId, generation);
        } finally {
            lock.unlock();
        }
    }

    public int armedCount() {
        lock.lock();
        try {
            return timers.armedCount();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enables (and re-arms from the persisted spec) or disables (and disarms) a schedule.
     *
     * @return {@code false} if the schedule does not exist
     */
    public boolean toggle(long scheduleId, boolean enabled, Long actorId) {
        Optional<BroadcastSchedule> existing = scheduleStore.getSchedule(scheduleId);
        if (existing.isEmpty()) {
            return false;
        }
        if (enabled) {
            // Reject before persisting so a broken spec never ends up enabled
            triggerFactory.create(existing.get().getTriggerKind(), existing.get().getTriggerSpec());
        }
        Optional<BroadcastSchedule> updated = scheduleStore.setEnabled(scheduleId, enabled);
        if (updated.isEmpty()) {
            return false;
        }
        if (enabled) {
            arm(updated.get());
        } else {
            disarm(scheduleId);
            scheduleStore.recordNextFire(scheduleId, null);
        }
        auditRecorder.log(actorId, AuditRecorder.SCHEDULE_TOGGLE, Map.of("id", scheduleId, "enabled", enabled));
        return true;
    }

    /**
     * Disarms and deletes a schedule. A fire already in flight completes; no later fire happens.
     *
     * @return {@code false} if the schedule does not exist
     */
    public boolean delete(long scheduleId, Long actorId) {
        disarm(scheduleId);
        boolean deleted = scheduleStore.delete(scheduleId);
        if (deleted) {
            auditRecorder.log(actorId, AuditRecorder.SCHEDULE_DELETE, Map.of("id", scheduleId));
            log.info("Deleted schedule {}", scheduleId);
        }
        return deleted;
    }

    /**
     * Submits every timer due at {@code now} to the fire executor and re-arms each with its following fire time.
     *
     * @return number of fires submitted
     */
    public int fireDue(Instant now) {
        List<TimerQueue.TimerEntry> due;
        List<Instant> nextFires = new ArrayList<>();
        lock.lock();
        try {
            due = timers.pollDue(now);
            for (TimerQueue.TimerEntry entry : due) {
                Instant next = entry.trigger().nextFireTime(entry.anchor(), now);
                if (next == null) {
                    timers.cancel(entry.scheduleId());
                } else {
                    timers.rearm(entry, next);
                }
                nextFires.add(next);
            }
        } finally {
            lock.unlock();
        }

        int submitted = 0;
        for (int i = 0; i < due.size(); i++) {
            long scheduleId = due.get(i).scheduleId();
            long generation = due.get(i).generation();
            Instant next = nextFires.get(i);
            if (!pendingFires.add(scheduleId)) {
                log.warn("Schedule {} still has a fire queued or running, skipping this one", scheduleId);
                continue;
            }
            try {
                fireExecutor.execute(() -> fire(scheduleId, generation, next));
                submitted++;
            } catch (RejectedExecutionException e) {
                pendingFires.remove(scheduleId);
                log.warn("Fire of schedule {} rejected, executor is shutting down", scheduleId);
            }
        }
        return submitted;
    }

    /**
     * Runs one fire. {@code generation} identifies the arming that produced it; the next fire time is only
     * recorded while that arming is still live.
     */
    void fire(long scheduleId, long generation, Instant nextFire) {
        MDC.put("scheduleId", String.valueOf(scheduleId));
        try {
            Optional<BroadcastSchedule> current = scheduleStore.getSchedule(scheduleId);
            if (current.isEmpty() || !current.get().isEnabled()) {
                log.info("Schedule {} was removed or disabled before it fired, skipping", scheduleId);
                return;
            }
            BroadcastSchedule schedule = current.get();
            Segment segment = segmentCodec.parse(schedule.getSegmentJson());
            log.info("Running schedule {} '{}' for segment '{}'", scheduleId, schedule.getName(), segment.tag());
            DeliveryReport report = deliveryExecutor.run(schedule.getMessageText(), segment, scheduleId);
            log.info("Schedule {} finished: queued={}, sent={}, failed={}", scheduleId, report.queued(), report.sent(), report.failed());
            if (isArmedWith(scheduleId, generation)) {
                scheduleStore.recordNextFire(scheduleId, nextFire);
            }
        } catch (RuntimeException e) {
            log.error("Schedule {} fire failed", scheduleId, e);
        } finally {
            pendingFires.remove(scheduleId);
            MDC.remove("scheduleId");
        }
    }

    /**
     * Disarms all timers, stops the dispatcher and waits for in-flight fires to finish their current batch.
     */
    public void stop() {
        lock.lock();
        try {
            running = false;
            timers.clear();
            timersChanged.signalAll();
        } finally {
            lock.unlock();
        }
        if (dispatcher != null) {
            dispatcher.interrupt();
        }
        deliveryExecutor.requestStop();
        fireExecutor.shutdown();
        try {
            if (!fireExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Schedule fires did not finish within {}s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
                fireExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            fireExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("TriggerScheduler stopped");
    }

    private void dispatchLoop() {
        while (running) {
            try {
                awaitNextDue();
                if (running) {
                    fireDue(clock.instant());
                }
            } catch (InterruptedException e) {
                if (running) {
                    log.warn("Schedule dispatcher interrupted while running, stopping");
                }
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("Schedule dispatcher error", e);
            }
        }
    }

    private void awaitNextDue() throws InterruptedException {
        lock.lock();
        try {
            while (running) {
                Instant next = timers.nextFireTime();
                Duration wait = next == null ? MAX_IDLE_WAIT : Duration.between(clock.instant(), next);
                if (!wait.isNegative() && !wait.isZero()) {
                    if (wait.compareTo(MAX_IDLE_WAIT) > 0) {
                        wait = MAX_IDLE_WAIT;
                    }
                    timersChanged.awaitNanos(wait.toNanos());
                    continue;
                }
                if (next != null) {
                    return;
                }
            }
        } finally {
            lock.unlock();
        }
    }
}
