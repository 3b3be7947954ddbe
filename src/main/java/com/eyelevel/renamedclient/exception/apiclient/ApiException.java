package com.eyelevel.renamedclient.exception.apiclient;

import lombok.Getter;
import org.springframework.lang.Nullable;

import java.io.Serial;

/**
 * Base class for every failure raised by the renamed.to client.
 *
 * <p>An instance on its own represents a generic API error (an HTTP status of 400 or above that has no more
 * specific mapping). Subclasses narrow the {@link ErrorKind}. Every exception carries the message, the HTTP
 * status code when one was received, and optional structured details such as the decoded error body.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = -2474412291057683569L;

    private final ErrorKind kind;

    @Nullable
    private final Integer statusCode;

    @Nullable
    private final transient Object details;

    /**
     * Constructs a generic API error.
     *
     * @param message    A descriptive message about the exception.
     * @param statusCode The HTTP status code associated with the exception.
     * @param details    The decoded response body, if any.
     */
    public ApiException(String message, @Nullable Integer statusCode, @Nullable Object details) {
        this(ErrorKind.API, message, statusCode, details, null);
    }

    protected ApiException(ErrorKind kind, String message, @Nullable Integer statusCode, @Nullable Object details,
                           @Nullable Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.details = details;
    }

    /**
     * @return the stable code of this error's kind, e.g. {@code RATE_LIMIT_ERROR}.
     */
    public String getCode() {
        return kind.getCode();
    }

    /**
     * @return true when the status code is a client error (4xx).
     */
    public boolean isClientError() {
        return statusCode != null && statusCode >= 400 && statusCode < 500;
    }

    @Override
    public String toString() {
        if (statusCode != null) {
            return String.format("%s (status %d): %s", getCode(), statusCode, getMessage());
        }
        return String.format("%s: %s", getCode(), getMessage());
    }
}
