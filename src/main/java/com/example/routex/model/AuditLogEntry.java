package com.example.routex.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

// Append-only: no setters, rows are never updated.
@Entity
@Table(name = "audit_log")
@Getter
@NoArgsConstructor
public class AuditLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ts", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "actor_tg_id")
    private Long actorId;

    @Column(nullable = false, length = 64)
    private String action;

    @Column(name = "meta_json", length = 4096)
    private String metaJson;

    public AuditLogEntry(Long actorId, String action, String metaJson) {
        this.actorId = actorId;
        this.action = action;
        this.metaJson = metaJson;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now(ZoneOffset.UTC);
    }
}
