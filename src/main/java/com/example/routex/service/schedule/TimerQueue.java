package com.example.routex.service.schedule;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Min-heap of pending fires, at most one live entry per schedule.
 * <p>
 * Cancelled or replaced entries stay in the heap and are dropped when they surface, so cancel is O(1).
 * Not thread-safe; {@link TriggerScheduler} guards it with its own lock.
 */
class TimerQueue {

    record TimerEntry(long scheduleId, Instant fireAt, long generation, ScheduleTrigger trigger, Instant anchor) {
    }

    private final PriorityQueue<TimerEntry> heap = new PriorityQueue<>(
            Comparator.comparing(TimerEntry::fireAt).thenComparingLong(TimerEntry::scheduleId));
    // scheduleId -> generation of its live entry
    private final Map<Long, Long> armed = new HashMap<>();
    private long generationCounter;

    /**
     * Arms a schedule, replacing any entry it already had.
     */
    void arm(long scheduleId, Instant fireAt, ScheduleTrigger trigger, Instant anchor) {
        long generation = ++generationCounter;
        armed.put(scheduleId, generation);
        heap.add(new TimerEntry(scheduleId, fireAt, generation, trigger, anchor));
    }

    /**
     * Pushes the follow-up fire of an entry just returned by {@link #pollDue}, if the schedule is still armed with it.
     */
    boolean rearm(TimerEntry fired, Instant nextFireAt) {
        Long live = armed.get(fired.scheduleId());
        if (live == null || live != fired.generation()) {
            return false;
        }
        heap.add(new TimerEntry(fired.scheduleId(), nextFireAt, fired.generation(), fired.trigger(), fired.anchor()));
        return true;
    }

    boolean cancel(long scheduleId) {
        return armed.remove(scheduleId) != null;
    }

    boolean isArmed(long scheduleId) {
        return armed.containsKey(scheduleId);
    }

    boolean isLive(long scheduleId, long generation) {
        Long live = armed.get(scheduleId);
        return live != null && live == generation;
    }

    int armedCount() {
        return armed.size();
    }

    /**
     * @return the earliest live fire time, or {@code null} when nothing is armed
     */
    Instant nextFireTime() {
        dropStale();
        TimerEntry head = heap.peek();
        return head == null ? null : head.fireAt();
    }

    /**
     * Removes and returns every live entry due at or before {@code now}, earliest first.
     */
    List<TimerEntry> pollDue(Instant now) {
        List<TimerEntry> due = new ArrayList<>();
        while (true) {
            dropStale();
            TimerEntry head = heap.peek();
            if (head == null || head.fireAt().isAfter(now)) {
                return due;
            }
            due.add(heap.poll());
        }
    }

    void clear() {
        heap.clear();
        armed.clear();
    }

    private void dropStale() {
        while (!heap.isEmpty()) {
            TimerEntry head = heap.peek();
            Long live = armed.get(head.scheduleId());
            if (live != null && live == head.generation()) {
                return;
            }
            heap.poll();
        }
    }
}
