package com.spanlens.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.spanlens.core.model.SpanEvent;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes into a
 * {@link SpanEvent}.
 * <p>
 * Unparseable messages and messages describing a malformed span (negative
 * duration, close before open) are logged and dropped by returning
 * {@code null}, so a single bad record cannot crash the pipeline.
 * </p>
 */
public class SpanEventDeserializationSchema implements DeserializationSchema<SpanEvent> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SpanEventDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public SpanEvent deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            SpanEvent event = objectMapper().readValue(message, SpanEvent.class);
            if (event.isMalformed()) {
                LOG.warn("Dropping malformed span event: {}", event);
                return null;
            }
            return event;
        } catch (Exception e) {
            LOG.warn("Failed to deserialize span event, skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(SpanEvent nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<SpanEvent> getProducedType() {
        return TypeInformation.of(SpanEvent.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}
