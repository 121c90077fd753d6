package com.creditapproval.repository;

import com.creditapproval.model.OutboxEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@DisplayName("OutboxEventRepository Tests")
class OutboxEventRepositoryTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    private OutboxEvent event(String eventId, Instant createdAt, boolean published) {
        OutboxEvent event = new OutboxEvent();
        event.setEventId(eventId);
        event.setEventType("LoanApproved");
        event.setTopic("loan.approved");
        event.setPayload("{}");
        event.setCreatedAt(createdAt);
        event.setPublished(published);
        return entityManager.persist(event);
    }

    @Test
    @DisplayName("Should return unpublished events oldest first, up to the limit")
    void shouldFindUnpublishedOldestFirst() {
        event("evt-3", Instant.parse("2026-06-15T10:00:03Z"), false);
        event("evt-1", Instant.parse("2026-06-15T10:00:01Z"), false);
        event("evt-0", Instant.parse("2026-06-15T10:00:00Z"), true);
        event("evt-2", Instant.parse("2026-06-15T10:00:02Z"), false);
        entityManager.flush();

        List<OutboxEvent> batch = outboxEventRepository.findUnpublishedEventsWithLimit(2);

        assertThat(batch).extracting(OutboxEvent::getEventId).containsExactly("evt-1", "evt-2");
        assertThat(outboxEventRepository.countByPublishedFalse()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should find unpublished events created before a threshold")
    void shouldFindStuckEvents() {
        event("old", Instant.parse("2026-06-15T09:00:00Z"), false);
        event("old-published", Instant.parse("2026-06-15T09:00:00Z"), true);
        event("recent", Instant.parse("2026-06-15T10:00:00Z"), false);
        entityManager.flush();

        List<OutboxEvent> stuck = outboxEventRepository.findByPublishedFalseAndCreatedAtBefore(
                Instant.parse("2026-06-15T09:55:00Z"));

        assertThat(stuck).extracting(OutboxEvent::getEventId).containsExactly("old");
    }
}
