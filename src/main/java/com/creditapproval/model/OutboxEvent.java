package com.creditapproval.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * TRANSACTIONAL OUTBOX
 * ====================
 *
 * Domain events (customer registered, loan approved, loan closed) are stored
 * here in the same transaction as the business change that produced them.
 * OutboxEventPublisher relays them to Kafka afterwards, so a committed loan
 * always gets its event and a rolled-back loan never does.
 */
@Entity
@Table(name = "outbox_events",
       indexes = {
           @Index(name = "idx_published", columnList = "published"),
           @Index(name = "idx_created_at", columnList = "createdAt")
       })
@Data
@NoArgsConstructor
public class OutboxEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Identifier of the business event, used for deduplication downstream.
     */
    @Column(nullable = false)
    private String eventId;

    /**
     * Type of event (e.g. "LoanApproved"); selects the payload class on publish.
     */
    @Column(nullable = false)
    private String eventType;

    @Column(nullable = false, length = 8000)
    private String payload;

    @Column(nullable = false)
    private String topic;

    @Column(nullable = false)
    private Boolean published = false;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant publishedAt;

    @Column(nullable = false)
    private Integer retryCount = 0;

    @Column(length = 2000)
    private String lastError;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (published == null) {
            published = false;
        }
        if (retryCount == null) {
            retryCount = 0;
        }
    }
}
