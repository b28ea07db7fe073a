package com.example.routex.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

// Column names are spelled out because administrators reference them in custom filter segments.
@Entity
@Table(name = "subscribers", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"telegram_id"})
})
@Getter
@Setter
@NoArgsConstructor
@ToString
public class Subscriber {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "telegram_id", nullable = false)
    private Long telegramId;

    @Column(name = "username")
    private String username;

    // Last VPN key issued to the user, rendered into {key} placeholders
    @Column(name = "message_key", length = 1024)
    private String messageKey;

    @Column(name = "is_subscribed", nullable = false)
    private boolean subscribed = true;

    @Column(name = "is_donor", nullable = false)
    private boolean donor = false;

    @Column(name = "last_activity_at")
    private LocalDateTime lastActivityAt;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public Subscriber(Long telegramId, String username) {
        this.telegramId = telegramId;
        this.username = username;
        this.subscribed = true;
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
