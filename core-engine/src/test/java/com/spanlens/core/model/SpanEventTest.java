package com.spanlens.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SpanEvent}.
 */
class SpanEventTest {

    private static final Instant OPEN = Instant.parse("2024-06-03T08:00:00Z");

    @Test
    @DisplayName("Should derive the duration from the close time")
    void shouldDeriveDuration() {
        SpanEvent event = SpanEvent.builder()
                .entityId("bridge-1")
                .openTime(OPEN)
                .closeTime(OPEN.plusSeconds(12 * 60))
                .build();

        assertThat(event.getDurationMinutes()).isEqualTo(12.0);
        assertThat(event.hasKnownDuration()).isTrue();
        assertThat(event.isOpen()).isFalse();
        assertThat(event.getEntityLabel()).isEqualTo("bridge-1");
    }

    @Test
    @DisplayName("Should leave the duration unknown while the span is open")
    void shouldLeaveDurationUnknownWhileOpen() {
        SpanEvent event = SpanEvent.builder().entityId("bridge-1").openTime(OPEN).build();

        assertThat(event.getDurationMinutes()).isNull();
        assertThat(event.hasKnownDuration()).isFalse();
        assertThat(event.isOpen()).isTrue();
        assertThat(event.isMalformed()).isFalse();
    }

    @Test
    @DisplayName("Should flag negative durations and inverted timestamps as malformed")
    void shouldFlagMalformedEvents() {
        SpanEvent negative = SpanEvent.builder().entityId("a").openTime(OPEN).durationMinutes(-3.0).build();
        SpanEvent inverted = SpanEvent.builder().entityId("a").openTime(OPEN).closeTime(OPEN.minusSeconds(60)).build();

        assertThat(negative.isMalformed()).isTrue();
        assertThat(inverted.isMalformed()).isTrue();
    }

    @Test
    @DisplayName("Should require entityId and openTime")
    void shouldRequireMandatoryFields() {
        assertThatThrownBy(() -> SpanEvent.builder().openTime(OPEN).build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("entityId");
        assertThatThrownBy(() -> SpanEvent.builder().entityId("a").build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("openTime");
    }

    @Test
    @DisplayName("Should deserialize from JSON and ignore unknown fields")
    void shouldDeserializeFromJson() throws Exception {
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        String json = "{\"entityId\":\"bridge-7\",\"entityLabel\":\"Fremont\","
                + "\"openTime\":\"2024-06-03T08:00:00Z\",\"closeTime\":\"2024-06-03T08:20:00Z\","
                + "\"latitude\":47.6475,\"longitude\":-122.3497,\"source\":\"sensor\"}";

        SpanEvent event = mapper.readValue(json, SpanEvent.class);

        assertThat(event.getEntityId()).isEqualTo("bridge-7");
        assertThat(event.getEntityLabel()).isEqualTo("Fremont");
        assertThat(event.getDurationMinutes()).isEqualTo(20.0);
        assertThat(event.getLatitude()).isEqualTo(47.6475);
    }
}
