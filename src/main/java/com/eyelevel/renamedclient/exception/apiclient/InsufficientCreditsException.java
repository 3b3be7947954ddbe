package com.eyelevel.renamedclient.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that the account has run out of credits (HTTP 402).
 */
public class InsufficientCreditsException extends ApiException {

    @Serial
    private static final long serialVersionUID = 2338149526704957216L;

    public InsufficientCreditsException(String message) {
        super(ErrorKind.INSUFFICIENT_CREDITS, message, 402, null, null);
    }
}
