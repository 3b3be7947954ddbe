package com.eyelevel.renamedclient.common.apiclient.model;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

/**
 * A successful (status below 400) response from the renamed.to API, together with the number of attempts the
 * request engine needed to obtain it.
 */
@Builder
@Getter
public class ApiResponse {

    /**
     * The response body; empty when the server sent none.
     */
    private final byte[] data;

    private final int statusCode;

    /**
     * Declared content type, or null when the server omitted the header.
     */
    @Nullable
    private final MediaType contentType;

    /**
     * 1 when the first attempt succeeded.
     */
    private final int attempts;

    /**
     * Whether the body can be read as JSON. A missing content type is accepted, since some endpoints omit it.
     */
    public boolean isJsonCompatible() {
        return contentType == null || contentType.isCompatibleWith(MediaType.APPLICATION_JSON)
               || contentType.getSubtype().endsWith("+json");
    }
}
