package com.eyelevel.renamedclient.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Structured data extracted from a document.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractResult(Map<String, Object> data, Double confidence) {

    public ExtractResult {
        data = data == null ? Map.of() : data;
    }
}
