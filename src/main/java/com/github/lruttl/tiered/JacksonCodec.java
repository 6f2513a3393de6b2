package com.github.lruttl.tiered;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.lruttl.error.CodecException;

import java.io.IOException;
import java.util.Objects;

/**
 * 默认编解码器：JSON
 */
public final class JacksonCodec implements Codec {
    private final ObjectMapper objectMapper;

    public JacksonCodec() {
        this(new ObjectMapper());
    }

    public JacksonCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public byte[] encode(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new CodecException("failed to encode " + value.getClass().getName(), e);
        }
    }

    @Override
    public <T> T decode(byte[] data, Class<T> type) {
        try {
            return objectMapper.readValue(data, type);
        } catch (IOException e) {
            throw new CodecException("failed to decode as " + type.getName(), e);
        }
    }
}
