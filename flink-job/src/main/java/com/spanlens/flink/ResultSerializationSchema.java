package com.spanlens.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link SerializationSchema} that writes engine results (forecasts,
 * cascade records) as JSON bytes for the Kafka output topics. Timestamps are
 * written as ISO-8601 strings.
 *
 * @param <T> result type
 */
public class ResultSerializationSchema<T> implements SerializationSchema<T> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ResultSerializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(T result) {
        try {
            return objectMapper().writeValueAsBytes(result);
        } catch (Exception e) {
            LOG.error("Failed to serialize result {}: {}", result, e.getMessage(), e);
            return new byte[0];
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }
}
