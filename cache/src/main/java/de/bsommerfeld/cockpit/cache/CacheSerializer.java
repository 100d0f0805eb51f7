package de.bsommerfeld.cockpit.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * JSON codec for cached values. Timestamps are written as ISO-8601 strings so
 * rows in the durable tier stay readable with any SQLite client.
 */
public class CacheSerializer {

    private final ObjectMapper mapper;

    public CacheSerializer() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public CacheSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public byte[] serialize(String key, Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new CacheException(CacheException.Reason.SERIALIZATION, key,
                    "Cannot serialize value for '" + key + "'", e);
        }
    }

    public <T> T deserialize(String key, byte[] payload, Class<T> type) {
        return deserialize(key, payload, mapper.constructType(type));
    }

    public <T> T deserialize(String key, byte[] payload, TypeReference<T> type) {
        return deserialize(key, payload, mapper.constructType(type));
    }

    private <T> T deserialize(String key, byte[] payload, JavaType type) {
        try {
            return mapper.readValue(payload, type);
        } catch (IOException e) {
            throw new CacheException(CacheException.Reason.SERIALIZATION, key,
                    "Cannot decode '" + key + "' as " + type.toCanonical(), e);
        }
    }
}
