package com.eyelevel.renamedclient.exception.json;

import java.io.Serial;

/**
 * Raised when a payload exchanged with the renamed.to API cannot be decoded into the expected type, or a form
 * value cannot be encoded as JSON.
 */
public class JsonCodecException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 6120478537216309914L;

    public JsonCodecException(String message, Throwable cause) {
        super(message, cause);
    }

    public static JsonCodecException decoding(Class<?> targetType, Throwable cause) {
        return new JsonCodecException("Cannot decode payload as " + targetType.getSimpleName(), cause);
    }

    public static JsonCodecException encoding(Object value, Throwable cause) {
        String type = value == null ? "null" : value.getClass().getSimpleName();
        return new JsonCodecException("Cannot encode " + type + " as JSON", cause);
    }
}
