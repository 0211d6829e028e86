package com.questrail.edgecontrol.failsafe;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON form of {@link StateBackup}.
 */
public final class BackupCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private BackupCodec() {
    }

    public static String encode(StateBackup backup) {
        try {
            return MAPPER.writeValueAsString(backup);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize backup", e);
        }
    }

    public static StateBackup decode(String json) {
        try {
            return MAPPER.readValue(json, StateBackup.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unreadable backup document", e);
        }
    }
}
