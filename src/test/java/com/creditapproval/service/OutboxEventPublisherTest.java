package com.creditapproval.service;

import com.creditapproval.event.LoanApproved;
import com.creditapproval.event.LoanClosed;
import com.creditapproval.model.OutboxEvent;
import com.creditapproval.producer.EventProducer;
import com.creditapproval.repository.OutboxEventRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.SendResult;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("OutboxEventPublisher Unit Tests")
class OutboxEventPublisherTest {

    @Mock
    private OutboxEventRepository outboxEventRepository;

    @Mock
    private EventProducer eventProducer;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private OutboxEventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxEventPublisher(outboxEventRepository, eventProducer, objectMapper);
    }

    private OutboxEvent outboxRow(String eventType, Object event, String eventId) throws Exception {
        OutboxEvent row = new OutboxEvent();
        row.setId(1L);
        row.setEventId(eventId);
        row.setEventType(eventType);
        row.setTopic("topic");
        row.setPayload(objectMapper.writeValueAsString(event));
        row.setCreatedAt(Instant.parse("2026-06-15T10:00:00Z"));
        return row;
    }

    private LoanApproved loanApproved() {
        return new LoanApproved("evt-1", 42L, 5L, new BigDecimal("500000"), new BigDecimal("10"),
                new BigDecimal("12"), 24, new BigDecimal("23536.74"), 40, Instant.parse("2026-06-15T10:00:00Z"));
    }

    @Test
    @DisplayName("Should publish a pending event and mark it as published")
    @SuppressWarnings("unchecked")
    void shouldPublishPendingEvent() throws Exception {
        OutboxEvent row = outboxRow(OutboxWriter.LOAN_APPROVED, loanApproved(), "evt-1");
        when(outboxEventRepository.findUnpublishedEventsWithLimit(100)).thenReturn(List.of(row));
        when(eventProducer.publishLoanApproved(any(LoanApproved.class)))
                .thenReturn(CompletableFuture.completedFuture(mock(SendResult.class)));

        publisher.publishEvents();

        ArgumentCaptor<LoanApproved> eventCaptor = ArgumentCaptor.forClass(LoanApproved.class);
        verify(eventProducer).publishLoanApproved(eventCaptor.capture());
        assertThat(eventCaptor.getValue()).isEqualTo(loanApproved());
        assertThat(row.getPublished()).isTrue();
        assertThat(row.getPublishedAt()).isNotNull();
        verify(outboxEventRepository).save(row);
    }

    @Test
    @DisplayName("Should keep a failed event unpublished and count the retry")
    void shouldRecordPublishFailure() throws Exception {
        LoanClosed closed = new LoanClosed("evt-2", 42L, 5L, 24, 24, true, Instant.parse("2026-06-15T10:00:00Z"));
        OutboxEvent row = outboxRow(OutboxWriter.LOAN_CLOSED, closed, "evt-2");
        when(outboxEventRepository.findUnpublishedEventsWithLimit(100)).thenReturn(List.of(row));
        when(eventProducer.publishLoanClosed(any(LoanClosed.class)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publishEvents();

        assertThat(row.getPublished()).isFalse();
        assertThat(row.getRetryCount()).isEqualTo(1);
        assertThat(row.getLastError()).contains("broker down");
        verify(outboxEventRepository).save(row);
    }

    @Test
    @DisplayName("Should count an unknown event type as a failure")
    void shouldFailUnknownEventType() throws Exception {
        OutboxEvent row = outboxRow("SomethingElse", loanApproved(), "evt-3");
        when(outboxEventRepository.findUnpublishedEventsWithLimit(100)).thenReturn(List.of(row));

        publisher.publishEvents();

        assertThat(row.getPublished()).isFalse();
        assertThat(row.getRetryCount()).isEqualTo(1);
        assertThat(row.getLastError()).contains("Unknown event type");
        verifyNoInteractions(eventProducer);
    }

    @Test
    @DisplayName("Should do nothing when the outbox is empty")
    void shouldSkipEmptyOutbox() {
        when(outboxEventRepository.findUnpublishedEventsWithLimit(100)).thenReturn(List.of());

        publisher.publishEvents();

        verifyNoInteractions(eventProducer);
        verify(outboxEventRepository, never()).save(any());
    }
}
