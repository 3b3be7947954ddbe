package com.eyelevel.renamedclient.exception.apiclient;

import org.springframework.lang.Nullable;

import java.io.Serial;

/**
 * Exception indicating that the request never completed an HTTP exchange: the connection was refused, the host
 * could not be resolved, the stream was reset, or a local file could not be read.
 */
public class NetworkException extends ApiException {

    @Serial
    private static final long serialVersionUID = -1950117244930815523L;

    public static final String DEFAULT_MESSAGE = "Network request failed";

    public NetworkException(String message) {
        this(message, null);
    }

    public NetworkException(String message, @Nullable Throwable cause) {
        super(ErrorKind.NETWORK, message, null, null, cause);
    }
}
