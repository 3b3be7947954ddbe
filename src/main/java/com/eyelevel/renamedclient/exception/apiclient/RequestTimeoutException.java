package com.eyelevel.renamedclient.exception.apiclient;

import org.springframework.lang.Nullable;

import java.io.Serial;

/**
 * Exception indicating that the request did not complete within the configured timeout.
 */
public class RequestTimeoutException extends ApiException {

    @Serial
    private static final long serialVersionUID = 5208467730412231170L;

    public RequestTimeoutException(String message, @Nullable Throwable cause) {
        super(ErrorKind.TIMEOUT, message, null, null, cause);
    }
}
