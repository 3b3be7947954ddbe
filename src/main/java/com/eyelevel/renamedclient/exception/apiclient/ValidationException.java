package com.eyelevel.renamedclient.exception.apiclient;

import org.springframework.lang.Nullable;

import java.io.Serial;

/**
 * Exception indicating that the request was rejected as invalid (HTTP 400 or 422).
 *
 * <p>The raw error body is kept as the exception's details so callers can inspect field-level problems.
 */
public class ValidationException extends ApiException {

    @Serial
    private static final long serialVersionUID = 3605518185752146771L;

    public ValidationException(String message, int statusCode, @Nullable Object details) {
        super(ErrorKind.VALIDATION, message, statusCode, details, null);
    }

    /**
     * Client-side validation failure, raised before any request is sent.
     *
     * @param message A descriptive message about the exception.
     * @param cause   The underlying failure.
     */
    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, null, null, cause);
    }
}
