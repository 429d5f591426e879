package com.umitunal.cronrelay.serialization;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.umitunal.cronrelay.exception.CodecException;

import java.io.IOException;
import java.util.Map;

/**
 * JSON codec using Jackson, used for the embedded {@code data} document of stream entries.
 *
 * @param <T> the type to serialize
 */
public class JsonCodec<T> implements PayloadCodec<T> {
    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final JavaType type;

    public JsonCodec(TypeReference<T> type) {
        this(type, createDefaultMapper());
    }

    public JsonCodec(TypeReference<T> type, ObjectMapper mapper) {
        this.mapper = mapper;
        this.type = mapper.getTypeFactory().constructType(type);
    }

    /**
     * Codec for generic key-value documents.
     */
    public static JsonCodec<Map<String, Object>> forDocument() {
        return new JsonCodec<>(DOCUMENT);
    }

    @Override
    public byte[] encode(T value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new CodecException("Failed to serialize to JSON", e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        try {
            return mapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new CodecException("Failed to deserialize from JSON", e);
        }
    }

    public String encodeToString(T value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (IOException e) {
            throw new CodecException("Failed to serialize to JSON", e);
        }
    }

    public T decodeFromString(String json) {
        try {
            return mapper.readValue(json, type);
        } catch (IOException e) {
            throw new CodecException("Failed to deserialize from JSON", e);
        }
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        return mapper;
    }
}
