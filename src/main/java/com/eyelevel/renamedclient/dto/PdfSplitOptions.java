package com.eyelevel.renamedclient.dto;

import lombok.Builder;
import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for a PDF split request.
 *
 * @param mode          The split strategy, or null for the service default.
 * @param pagesPerSplit Pages per output document in {@link SplitMode#PAGES} mode. Sent only when positive.
 */
@Builder
public record PdfSplitOptions(@Nullable SplitMode mode, @Nullable Integer pagesPerSplit) {

    public static PdfSplitOptions defaults() {
        return new PdfSplitOptions(null, null);
    }

    public Map<String, String> toFormFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        if (mode != null) {
            fields.put("mode", mode.getValue());
        }
        if (pagesPerSplit != null && pagesPerSplit > 0) {
            fields.put("pagesPerSplit", String.valueOf(pagesPerSplit));
        }
        return fields;
    }
}
