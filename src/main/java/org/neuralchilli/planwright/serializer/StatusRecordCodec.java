package org.neuralchilli.planwright.serializer;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.neuralchilli.planwright.domain.StatusRecord;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * JSON form of the status record: {@code revision}, {@code lastUpdated},
 * {@code phases[]}, {@code plans[]} with their {@code items[]}, and a derived
 * {@code summary} block that is written but ignored on read.
 */
public class StatusRecordCodec {

    private final ObjectMapper objectMapper;

    public StatusRecordCodec() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public StatusRecord read(InputStream in) throws IOException {
        return objectMapper.readValue(in, StatusRecord.class);
    }

    public StatusRecord read(String json) throws IOException {
        return objectMapper.readValue(json, StatusRecord.class);
    }

    public void write(StatusRecord record, OutputStream out) throws IOException {
        objectMapper.writeValue(out, record);
    }

    public String write(StatusRecord record) throws IOException {
        return objectMapper.writeValueAsString(record);
    }
}
