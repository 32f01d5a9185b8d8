package com.chartboost.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vertx.core.json.DecodeException;

import java.util.Objects;

public class JacksonMapper {

    private static final String FAILED_TO_DECODE = "Failed to decode: %s";

    private final ObjectMapper mapper;

    public JacksonMapper(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public <T> T decodeValue(String str, Class<T> clazz) throws DecodeException {
        try {
            return mapper.readValue(str, clazz);
        } catch (JsonProcessingException e) {
            throw new DecodeException(FAILED_TO_DECODE.formatted(e.getMessage()), e);
        }
    }

    public <T> T decodeValue(JsonNode node, Class<T> clazz) throws DecodeException {
        try {
            return mapper.treeToValue(node, clazz);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new DecodeException(FAILED_TO_DECODE.formatted(e.getMessage()), e);
        }
    }
}
