package com.example.routex.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * One tracked attempt to send one message to one recipient.
 * <p>
 * Rows are never deleted. {@code scheduleId} is a plain column rather than a relation so that the
 * history survives deletion of the schedule; {@code null} marks an ad-hoc broadcast.
 */
@Entity
@Table(name = "deliveries", indexes = {
        @Index(columnList = "schedule_id, recipient_id")
})
@Getter
@Setter
@NoArgsConstructor
@ToString
public class Delivery {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "schedule_id")
    private Long scheduleId;

    @Column(name = "recipient_id", nullable = false)
    private Long recipientId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private DeliveryStatus status = DeliveryStatus.QUEUED;

    @Column(name = "error_text", length = 1024)
    private String errorText;

    // Set when the delivery reaches a terminal state, whether sent or failed
    @Column(name = "sent_at")
    private LocalDateTime sentAt;

    public Delivery(Long scheduleId, Long recipientId) {
        this.scheduleId = scheduleId;
        this.recipientId = recipientId;
        this.status = DeliveryStatus.QUEUED;
    }
}
