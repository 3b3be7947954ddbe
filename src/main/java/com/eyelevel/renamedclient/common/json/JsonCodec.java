package com.eyelevel.renamedclient.common.json;

import java.util.Map;
import java.util.Optional;

/**
 * JSON boundary of the client. Response bodies are decoded through it, error bodies are probed through it and
 * structured form values (such as an extraction schema) are encoded through it.
 */
public interface JsonCodec {

    /**
     * Decodes a response body. An empty body decodes as an empty JSON object.
     *
     * @throws com.eyelevel.renamedclient.exception.json.JsonCodecException if the body does not fit the type.
     */
    <T> T decode(byte[] payload, Class<T> type);

    /**
     * Reads a body whose shape is not guaranteed, such as an error page served by a proxy.
     *
     * @return the top-level JSON object, or empty when the body is absent, malformed or not an object.
     */
    Optional<Map<String, Object>> probeObject(byte[] payload);

    /**
     * Encodes a value as compact JSON for use as a multipart form field.
     *
     * @throws com.eyelevel.renamedclient.exception.json.JsonCodecException if the value cannot be written.
     */
    String encodeFormValue(Object value);
}
