package com.example.routex.service.audit;

import com.example.routex.model.AuditLogEntry;
import com.example.routex.repository.AuditLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class AuditRecorder {

    public static final String SCHEDULE_CREATE = "schedule_create";
    public static final String SCHEDULE_TOGGLE = "schedule_toggle";
    public static final String SCHEDULE_DELETE = "schedule_delete";
    public static final String BROADCAST_NOW = "broadcast_now";
    public static final String EXTERNAL_EVENT = "external_event";
    public static final String EVENT_TEMPLATE_SET = "event_template_set";
    public static final String DELIVERY_PERMANENT_FAILURE = "delivery_permanent_failure";
    public static final String USER_OPT_IN = "user_optin";
    public static final String USER_OPT_OUT = "user_optout";

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    /**
     * Appends an audit event. Fire-and-forget: a failure to write is logged and never reaches the
     * caller, whose operation has already happened.
     *
     * @param actorId  Telegram id of the administrator, or {@code null} for system-triggered events.
     * @param action   One of the action tags declared on this class.
     * @param metadata Structured details, stored as JSON.
     */
    public void log(Long actorId, String action, Map<String, Object> metadata) {
        try {
            auditLogRepository.save(new AuditLogEntry(actorId, action, toJson(metadata)));
        } catch (RuntimeException e) {
            log.warn("Failed to write audit event '{}' (actor {}): {}", action, actorId, e.getMessage(), e);
        }
    }

    private String toJson(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) return "{}";
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("Audit metadata is not serializable, storing its string form instead: {}", e.getMessage());
            return String.valueOf(metadata);
        }
    }
}
