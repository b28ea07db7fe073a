package com.example.routex.controller;

import com.example.routex.service.BroadcastEngine;
import com.example.routex.service.EngineConfigurationException;
import com.example.routex.service.delivery.DeliveryReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

@RestController
@Slf4j
public class EventWebhookController {

    static final String TOKEN_HEADER = "X-Admin-Token";
    static final int MAX_EVENT_TYPE_LENGTH = 100;

    private final BroadcastEngine broadcastEngine;
    private final ObjectMapper objectMapper;
    private final byte[] webhookToken;

    public EventWebhookController(BroadcastEngine broadcastEngine,
                                  ObjectMapper objectMapper,
                                  @Value("${app.webhook.token:}") String webhookToken) {
        this.broadcastEngine = broadcastEngine;
        this.objectMapper = objectMapper;
        this.webhookToken = webhookToken.getBytes(StandardCharsets.UTF_8);
        if (webhookToken.isBlank()) {
            log.warn("app.webhook.token is not set, every webhook request will be rejected");
        }
    }

    @GetMapping("/healthz")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    @PostMapping("/webhook/event")
    public ResponseEntity<Map<String, Object>> handleEvent(@RequestHeader(value = TOKEN_HEADER, required = false) String token,
                                                           @RequestBody(required = false) String rawBody) {
        if (!isAuthorized(token)) {
            log.warn("Invalid webhook token");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", "unauthorized"));
        }
        JsonNode body;
        try {
            body = rawBody == null ? null : objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            log.warn("Invalid JSON in webhook request: {}", e.getOriginalMessage());
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid JSON"));
        }
        if (body == null || !body.isObject()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid JSON"));
        }

        JsonNode eventTypeNode = body.get("event_type");
        if (eventTypeNode == null || eventTypeNode.isNull() || (eventTypeNode.isTextual() && eventTypeNode.asText().isEmpty())) {
            return ResponseEntity.badRequest().body(Map.of("error", "event_type required"));
        }
        if (!eventTypeNode.isTextual() || eventTypeNode.asText().length() > MAX_EVENT_TYPE_LENGTH) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid event_type"));
        }

        JsonNode payloadNode = body.get("payload");
        if (payloadNode != null && !payloadNode.isNull() && !payloadNode.isObject()) {
            return ResponseEntity.badRequest().body(Map.of("error", "payload must be a dictionary"));
        }
        Map<String, Object> payload = payloadNode == null || payloadNode.isNull()
                ? Map.of()
                : objectMapper.convertValue(payloadNode, new TypeReference<Map<String, Object>>() {
                });

        String eventType = eventTypeNode.asText();
        log.info("Webhook event received: type={}, payload size={}", eventType, payloadNode == null ? 0 : payloadNode.size());
        DeliveryReport report = broadcastEngine.onExternalEvent(eventType, payload);
        return ResponseEntity.ok(Map.of(
                "status", "done",
                "queued", report.queued(),
                "sent", report.sent(),
                "failed", report.failed()));
    }

    @ExceptionHandler(EngineConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleConfigurationError(EngineConfigurationException e) {
        log.error("Webhook event could not be processed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
    }

    private boolean isAuthorized(String token) {
        if (token == null || webhookToken.length == 0) {
            return false;
        }
        return MessageDigest.isEqual(webhookToken, token.getBytes(StandardCharsets.UTF_8));
    }
}
