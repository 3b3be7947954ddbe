package com.eyelevel.renamedclient.common.apiclient.model;

import com.eyelevel.renamedclient.upload.FileSource;
import lombok.Builder;
import lombok.Data;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Represents a single call to the renamed.to API.
 *
 * <p>This class encapsulates the HTTP method, the path (relative to the base URL, or an absolute URL that is used
 * unchanged), and an optional multipart payload made of one file and string form fields. It is built per call and
 * not retained once the call completes. It utilizes the Lombok annotations `@Builder` for easy construction and
 * `@Data` for automatic generation of boilerplate code.
 */
@Builder
@Data
public class ApiRequest {

    /**
     * The HTTP method for the API request (e.g., GET, POST).
     */
    private final HttpMethod method;

    /**
     * The path of the API request, or an absolute {@code http(s)://} URL.
     */
    private final String path;

    /**
     * The file to upload as the {@code file} part of a multipart body.
     *
     * <p>This field is null for requests without a body.
     */
    @Nullable
    private final FileSource file;

    /**
     * Auxiliary multipart form fields sent along with {@link #file}.
     */
    @Builder.Default
    private final Map<String, String> formFields = new LinkedHashMap<>();

    /**
     * The media type sent as {@code Accept}. JSON unless the call fetches raw content.
     */
    @Builder.Default
    private final MediaType accept = MediaType.APPLICATION_JSON;

    public boolean hasMultipartPayload() {
        return file != null;
    }
}
