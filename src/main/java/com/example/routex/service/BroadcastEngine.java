package com.example.routex.service;

import com.example.routex.model.BroadcastSchedule;
import com.example.routex.model.segment.Segment;
import com.example.routex.service.audit.AuditRecorder;
import com.example.routex.service.delivery.DeliveryExecutor;
import com.example.routex.service.delivery.DeliveryReport;
import com.example.routex.service.delivery.TemplateRenderer;
import com.example.routex.service.delivery.TemplateRenderingException;
import com.example.routex.service.schedule.InvalidScheduleException;
import com.example.routex.service.schedule.TriggerScheduler;
import com.example.routex.service.segment.SegmentResolver;
import com.example.routex.service.store.ScheduleStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Administrative and integration entry point of the broadcast engine.
 * Started once the application is ready, torn down on context close.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BroadcastEngine {

    public static final String EVENT_TEMPLATE_KEY_PREFIX = "event_template:";
    public static final String DEFAULT_EVENT_TEMPLATE = "{greeting}! We have fresh news: {payload_message}.";
    public static final String EVENT_GREETING = "Hello";

    private final ScheduleStore scheduleStore;
    private final SegmentResolver segmentResolver;
    private final DeliveryExecutor deliveryExecutor;
    private final TriggerScheduler triggerScheduler;
    private final TemplateRenderer templateRenderer;
    private final AuditRecorder auditRecorder;
    private final ObjectMapper objectMapper;

    private final AtomicBoolean started = new AtomicBoolean(false);

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        triggerScheduler.start();
        log.info("Broadcast engine started");
    }

    @PreDestroy
    public void shutdown() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Shutting down broadcast engine...");
        triggerScheduler.stop();
    }

    /**
     * Creates and arms a schedule.
     *
     * @throws InvalidScheduleException for an empty name or text, or a malformed trigger spec
     * @throws com.example.routex.service.segment.InvalidSegmentException for a rejected segment
     * @throws EngineConfigurationException for an unsupported trigger kind
     */
    public BroadcastSchedule addSchedule(String name, String kind, String spec, String text, Segment segment, Long actorId) {
        if (!StringUtils.hasText(name)) {
            throw new InvalidScheduleException("Schedule name is required");
        }
        if (!StringUtils.hasText(text)) {
            throw new InvalidScheduleException("Schedule text is required");
        }
        if (kind == null) {
            throw new EngineConfigurationException("Schedule type is required");
        }
        segmentResolver.validate(segment);
        return triggerScheduler.addSchedule(name.trim(), kind, spec, text, segment, actorId);
    }

    public List<BroadcastSchedule> listSchedules() {
        return scheduleStore.listSchedules();
    }

    public boolean toggle(long scheduleId, boolean enabled, Long actorId) {
        return triggerScheduler.toggle(scheduleId, enabled, actorId);
    }

    public boolean delete(long scheduleId, Long actorId) {
        return triggerScheduler.delete(scheduleId, actorId);
    }

    public DeliveryReport broadcastNow(String text, Segment segment) {
        return broadcastNow(text, segment, null);
    }

    /**
     * Sends {@code text} to the segment right away. No schedule row is created and no dedup applies.
     */
    public DeliveryReport broadcastNow(String text, Segment segment, Long actorId) {
        if (!StringUtils.hasText(text)) {
            throw new InvalidScheduleException("Broadcast text is required");
        }
        segmentResolver.validate(segment);
        log.info("Broadcast now to segment '{}' requested by {}", segment.tag(), actorId);
        DeliveryReport report = deliveryExecutor.run(text, segment, null);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("segment", segment.tag());
        meta.put("queued", report.queued());
        meta.put("sent", report.sent());
        meta.put("failed", report.failed());
        auditRecorder.log(actorId, AuditRecorder.BROADCAST_NOW, meta);
        return report;
    }

    /**
     * Broadcasts the template stored for {@code eventType} (or the default one) to all subscribers.
     *
     * @throws EngineConfigurationException if the stored template cannot be rendered
     */
    public DeliveryReport onExternalEvent(String eventType, Map<String, Object> payload) {
        String template = scheduleStore.getSetting(EVENT_TEMPLATE_KEY_PREFIX + eventType).orElse(DEFAULT_EVENT_TEMPLATE);
        String text;
        try {
            text = templateRenderer.render(template, Map.of(
                    "greeting", EVENT_GREETING,
                    "payload_message", serializePayload(payload)));
        } catch (TemplateRenderingException e) {
            throw new EngineConfigurationException("Event template for '" + eventType + "' cannot be rendered: " + e.getMessage(), e);
        }

        log.info("External event '{}' received, broadcasting to {}", eventType, Segment.TAG_ALL_SUBSCRIBED);
        DeliveryReport report = deliveryExecutor.run(text, new Segment.AllSubscribed(), null);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("event_type", eventType);
        meta.put("queued", report.queued());
        meta.put("sent", report.sent());
        meta.put("failed", report.failed());
        auditRecorder.log(null, AuditRecorder.EXTERNAL_EVENT, meta);
        return report;
    }

    public void setEventTemplate(String eventType, String template, Long actorId) {
        if (!StringUtils.hasText(eventType) || !StringUtils.hasText(template)) {
            throw new InvalidScheduleException("Event type and template are required");
        }
        scheduleStore.putSetting(EVENT_TEMPLATE_KEY_PREFIX + eventType.trim(), template);
        auditRecorder.log(actorId, AuditRecorder.EVENT_TEMPLATE_SET, Map.of("event_type", eventType.trim()));
    }

    private String serializePayload(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload == null ? Map.of() : payload);
        } catch (JsonProcessingException e) {
            throw new EngineConfigurationException("Event payload is not serializable", e);
        }
    }
}
