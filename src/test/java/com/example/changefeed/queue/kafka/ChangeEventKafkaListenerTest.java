package com.example.changefeed.queue.kafka;

import com.example.changefeed.exception.PoisonedJobException;
import com.example.changefeed.exception.RetryableJobException;
import com.example.changefeed.model.domain.EntityType;
import com.example.changefeed.model.dto.ChangeEvent;
import com.example.changefeed.queue.ChangeJobHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChangeEventKafkaListener Tests")
class ChangeEventKafkaListenerTest {

    private static final String PAYLOAD = """
            {"entity_type":"invoice_line_item","entity_id":42,
             "field_changes":[{"field":"adjustments","old_value":0,"new_value":15}],
             "actor_user_id":7,"occurred_at":"2024-05-01T10:00:00Z","dedup_key":"ili-42-1"}
            """;

    @Mock
    private ChangeJobHandler handler;

    @Mock
    private Acknowledgment ack;

    private ChangeEventKafkaListener listener;

    @BeforeEach
    void setUp() {
        listener = new ChangeEventKafkaListener(handler, new ObjectMapper().findAndRegisterModules());
    }

    @Test
    @DisplayName("Should acknowledge only after the handler finished")
    void shouldAckAfterHandling() {
        // When
        listener.consume(record(PAYLOAD), ack);

        // Then
        ArgumentCaptor<ChangeEvent> captor = ArgumentCaptor.forClass(ChangeEvent.class);
        verify(handler).handle(captor.capture());
        ChangeEvent event = captor.getValue();
        assertThat(event.entityType()).isEqualTo(EntityType.INVOICE_LINE_ITEM);
        assertThat(event.entityKey()).isEqualTo("invoice_line_item-42");
        assertThat(event.fieldChanges()).hasSize(1);
        assertThat(event.dedupKey()).isEqualTo("ili-42-1");
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Should not acknowledge when the handler fails")
    void shouldNotAckOnFailure() {
        doThrow(new RetryableJobException("database unavailable")).when(handler).handle(any());

        assertThatThrownBy(() -> listener.consume(record(PAYLOAD), ack))
                .isInstanceOf(RetryableJobException.class);

        verify(ack, never()).acknowledge();
    }

    @Test
    @DisplayName("Should poison malformed and empty payloads")
    void shouldPoisonMalformedPayload() {
        assertThatThrownBy(() -> listener.consume(record("{not json"), ack))
                .isInstanceOf(PoisonedJobException.class);
        assertThatThrownBy(() -> listener.consume(record(null), ack))
                .isInstanceOf(PoisonedJobException.class);

        verifyNoInteractions(handler, ack);
    }

    private static ConsumerRecord<String, String> record(String value) {
        return new ConsumerRecord<>("change-events", 3, 17L, "invoice_line_item-42", value);
    }
}
