package com.example.routex.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

@Entity
@Table(name = "schedules", indexes = {
        @Index(columnList = "enabled")
})
@Getter
@Setter
@NoArgsConstructor
@ToString(exclude = "messageText")
public class BroadcastSchedule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String name;

    // "cron" or "interval"; kept verbatim and parsed when the schedule is armed
    @Column(name = "trigger_kind", nullable = false, length = 16)
    private String triggerKind;

    // Raw crontab line, or a JSON mapping such as {"hours":2,"days":1}
    @Column(name = "trigger_spec", nullable = false, length = 255)
    private String triggerSpec;

    @Column(name = "message_text", nullable = false, columnDefinition = "TEXT")
    private String messageText;

    @Column(name = "segment_json", nullable = false, length = 2048)
    private String segmentJson;

    @Column(nullable = false)
    private boolean enabled = true;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    // Informational only, never used to detect missed fires
    private LocalDateTime nextRunAt;

    public BroadcastSchedule(String name, String triggerKind, String triggerSpec, String messageText, String segmentJson) {
        this.name = name;
        this.triggerKind = triggerKind;
        this.triggerSpec = triggerSpec;
        this.messageText = messageText;
        this.segmentJson = segmentJson;
        this.enabled = true;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now(ZoneOffset.UTC);
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now(ZoneOffset.UTC);
    }
}
