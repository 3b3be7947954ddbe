package com.eyelevel.renamedclient.dto;

import lombok.Builder;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for a rename request.
 *
 * @param template A naming template such as {@code {date}_{vendor}_{type}}, or null (or blank) for the service
 *                 default.
 */
@Builder
public record RenameOptions(@Nullable String template) {

    public static RenameOptions defaults() {
        return new RenameOptions(null);
    }

    public Map<String, String> toFormFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        if (StringUtils.hasText(template)) {
            fields.put("template", template);
        }
        return fields;
    }
}
