package com.eyelevel.renamedclient.exception.apiclient;

import lombok.Getter;
import org.springframework.lang.Nullable;

import java.io.Serial;

/**
 * Exception indicating that too many requests were made (HTTP 429).
 *
 * <p>When the server states how long to wait, the value in seconds is exposed through {@link #getRetryAfter()}.
 */
@Getter
public class RateLimitException extends ApiException {

    @Serial
    private static final long serialVersionUID = 2207139194559112715L;

    @Nullable
    private final Integer retryAfter;

    public RateLimitException(String message, @Nullable Integer retryAfter, @Nullable Object details) {
        super(ErrorKind.RATE_LIMIT, message, 429, details, null);
        this.retryAfter = retryAfter;
    }
}
