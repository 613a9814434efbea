package com.example.changefeed.queue;

import com.example.changefeed.exception.QueueUnavailableException;
import com.example.changefeed.model.domain.EntityType;
import com.example.changefeed.model.dto.ChangeEvent;
import com.example.changefeed.model.dto.EnqueueResult;
import com.example.changefeed.model.dto.FieldChange;
import com.example.changefeed.service.history.ChangeEventValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChangeEventPublisher Tests")
class ChangeEventPublisherTest {

    @Mock
    private ChangeJobQueue queue;

    private ChangeEventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new ChangeEventPublisher(new ChangeEventValidator(), queue);
    }

    @Test
    @DisplayName("Should enqueue a well-formed event")
    void shouldEnqueueValidEvent() {
        // Given
        ChangeEvent event = event(EntityType.CAMPAIGN, "campaign-9-1", List.of(new FieldChange("name", "A", "B")));

        // When
        EnqueueResult result = publisher.enqueueChangeEvent(event);

        // Then
        assertThat(result.accepted()).isTrue();
        assertThat(result.reason()).isNull();
        verify(queue).enqueue(event);
    }

    @Test
    @DisplayName("Should reject an event without field changes")
    void shouldRejectEmptyChanges() {
        EnqueueResult result = publisher.enqueueChangeEvent(event(EntityType.CAMPAIGN, "campaign-9-1", List.of()));

        assertThat(result.accepted()).isFalse();
        assertThat(result.reason()).contains("field_changes");
        verifyNoInteractions(queue);
    }

    @Test
    @DisplayName("Should reject an event of an unknown entity type")
    void shouldRejectUnknownEntityType() {
        EnqueueResult result = publisher.enqueueChangeEvent(
                event(null, "x-1", List.of(new FieldChange("name", "A", "B"))));

        assertThat(result.accepted()).isFalse();
        assertThat(result.reason()).contains("entity_type");
        verifyNoInteractions(queue);
    }

    @Test
    @DisplayName("Should surface queue outages to the caller")
    void shouldPropagateQueueFailure() {
        ChangeEvent event = event(EntityType.CAMPAIGN, "campaign-9-1", List.of(new FieldChange("name", "A", "B")));
        doThrow(new QueueUnavailableException("broker down", null)).when(queue).enqueue(any());

        assertThatThrownBy(() -> publisher.enqueueChangeEvent(event))
                .isInstanceOf(QueueUnavailableException.class);
    }

    private static ChangeEvent event(EntityType type, String dedupKey, List<FieldChange> changes) {
        return new ChangeEvent(type, 9L, changes, 7L, Instant.parse("2024-05-01T10:00:00Z"), dedupKey, null);
    }
}
