package com.eyelevel.renamedclient.common.apiclient.transport;

import org.springframework.http.HttpHeaders;

/**
 * A completed HTTP exchange as seen by the transport, before any interpretation of the status code.
 *
 * @param statusCode   The HTTP status code.
 * @param reasonPhrase The reason phrase of the status, e.g. {@code Not Found}.
 * @param headers      The response headers.
 * @param body         The response body; empty, never null, when the server sent none.
 */
public record RawResponse(int statusCode, String reasonPhrase, HttpHeaders headers, byte[] body) {

    public RawResponse {
        headers = headers == null ? HttpHeaders.EMPTY : headers;
        body = body == null ? new byte[0] : body;
    }
}
