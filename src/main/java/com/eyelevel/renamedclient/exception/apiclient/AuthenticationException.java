package com.eyelevel.renamedclient.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that the API key was missing or rejected (HTTP 401).
 */
public class AuthenticationException extends ApiException {

    @Serial
    private static final long serialVersionUID = -7102466235164203812L;

    public AuthenticationException(String message) {
        super(ErrorKind.AUTHENTICATION, message, 401, null, null);
    }
}
