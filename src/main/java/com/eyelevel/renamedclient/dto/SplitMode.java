package com.eyelevel.renamedclient.dto;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * How a PDF is cut into documents.
 */
@Getter
@AllArgsConstructor
public enum SplitMode {
    /**
     * Let the service detect document boundaries.
     */
    AUTO("auto"),
    /**
     * Split every {@code pagesPerSplit} pages.
     */
    PAGES("pages"),
    /**
     * Split at blank pages.
     */
    BLANK("blank");

    @JsonValue
    private final String value;
}
