package com.spanlens.flink;

import com.spanlens.core.model.SpanEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SpanEventDeserializationSchema}.
 */
class SpanEventDeserializationSchemaTest {

    private final SpanEventDeserializationSchema schema = new SpanEventDeserializationSchema();

    @Test
    @DisplayName("Should parse a well-formed span event")
    void shouldParseSpanEvent() throws Exception {
        String json = "{\"entityId\":\"bridge-7\",\"entityLabel\":\"Magere Brug\","
                + "\"openTime\":\"2024-06-03T08:00:00Z\",\"closeTime\":\"2024-06-03T08:12:00Z\","
                + "\"latitude\":52.3637,\"longitude\":4.9023,\"operator\":\"ignored\"}";

        SpanEvent event = schema.deserialize(bytes(json));

        assertThat(event).isNotNull();
        assertThat(event.getEntityId()).isEqualTo("bridge-7");
        assertThat(event.getEntityLabel()).isEqualTo("Magere Brug");
        assertThat(event.getOpenTime()).isEqualTo(Instant.parse("2024-06-03T08:00:00Z"));
        assertThat(event.getDurationMinutes()).isEqualTo(12.0);
    }

    @Test
    @DisplayName("Should drop unparseable payloads")
    void shouldDropGarbage() throws Exception {
        assertThat(schema.deserialize(bytes("not json"))).isNull();
        assertThat(schema.deserialize(new byte[0])).isNull();
        assertThat(schema.deserialize(null)).isNull();
    }

    @Test
    @DisplayName("Should drop events missing mandatory fields")
    void shouldDropIncompleteEvents() throws Exception {
        assertThat(schema.deserialize(bytes("{\"entityId\":\"bridge-7\"}"))).isNull();
    }

    @Test
    @DisplayName("Should drop events that close before they open")
    void shouldDropMalformedEvents() throws Exception {
        String json = "{\"entityId\":\"bridge-7\",\"openTime\":\"2024-06-03T08:00:00Z\","
                + "\"closeTime\":\"2024-06-03T07:50:00Z\"}";

        assertThat(schema.deserialize(bytes(json))).isNull();
    }

    @Test
    @DisplayName("Should never signal end of stream")
    void shouldNotEndStream() {
        assertThat(schema.isEndOfStream(null)).isFalse();
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
