package com.eyelevel.renamedclient.exception.apiclient;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * The closed set of failure kinds surfaced by the client. Each kind carries a stable machine-readable code
 * so calling code can branch without matching on messages.
 */
@Getter
@AllArgsConstructor
public enum ErrorKind {
    AUTHENTICATION("AUTHENTICATION_ERROR"),
    RATE_LIMIT("RATE_LIMIT_ERROR"),
    VALIDATION("VALIDATION_ERROR"),
    NETWORK("NETWORK_ERROR"),
    TIMEOUT("TIMEOUT_ERROR"),
    INSUFFICIENT_CREDITS("INSUFFICIENT_CREDITS"),
    JOB("JOB_ERROR"),
    API("API_ERROR");

    private final String code;
}
