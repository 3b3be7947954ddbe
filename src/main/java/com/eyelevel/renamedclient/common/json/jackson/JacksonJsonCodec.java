package com.eyelevel.renamedclient.common.json.jackson;

import com.eyelevel.renamedclient.common.json.JsonCodec;
import com.eyelevel.renamedclient.exception.json.JsonCodecException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}.
 */
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonCodec implements JsonCodec {

    private static final byte[] EMPTY_OBJECT = "{}".getBytes(StandardCharsets.UTF_8);
    private static final TypeReference<Map<String, Object>> OBJECT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    @Override
    public <T> T decode(byte[] payload, Class<T> type) {
        byte[] body = payload == null || payload.length == 0 ? EMPTY_OBJECT : payload;
        log.debug("Decoding {} byte body as {}", body.length, type.getSimpleName());
        try {
            return objectMapper.readValue(body, type);
        } catch (IOException e) {
            log.error("Response body does not match {}", type.getName(), e);
            throw JsonCodecException.decoding(type, e);
        }
    }

    @Override
    public Optional<Map<String, Object>> probeObject(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(payload);
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.convertValue(node, OBJECT_TYPE));
        } catch (IOException e) {
            log.debug("Body is not JSON: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public String encodeFormValue(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Form value could not be written as JSON", e);
            throw JsonCodecException.encoding(value, e);
        }
    }
}
