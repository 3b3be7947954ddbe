package com.eyelevel.renamedclient.dto;

import lombok.Builder;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Options for an extraction request. The schema is sent JSON-encoded in the {@code schema} form field.
 *
 * @param prompt A natural-language description of what to extract.
 * @param schema A JSON schema describing the expected output.
 */
@Builder
public record ExtractOptions(@Nullable String prompt, @Nullable Map<String, Object> schema) {

    public static ExtractOptions defaults() {
        return new ExtractOptions(null, null);
    }
}
