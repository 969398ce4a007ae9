package com.plainer.collab.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.plainer.collab.error.ProtocolException;

/**
 * JSON (de)serialization of frames. Thread-safe; one instance can be shared by every connection.
 */
public class JsonCodec {

    private final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public String encode(Object message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + message.getClass().getSimpleName(), e);
        }
    }

    public ClientMessage decodeClient(String json) {
        return decode(json, ClientMessage.class);
    }

    public ServerMessage decodeServer(String json) {
        return decode(json, ServerMessage.class);
    }

    private <T> T decode(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            throw new ProtocolException(ProtocolException.MALFORMED, "Empty frame");
        }
        T value;
        try {
            value = mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new ProtocolException(ProtocolException.MALFORMED,
                "Malformed frame: " + e.getOriginalMessage(), e);
        }
        if (value == null) {
            throw new ProtocolException(ProtocolException.MALFORMED, "Frame is not a JSON object");
        }
        return value;
    }
}
