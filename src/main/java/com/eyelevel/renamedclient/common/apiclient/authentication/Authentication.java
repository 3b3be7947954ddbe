package com.eyelevel.renamedclient.common.apiclient.authentication;

import org.springframework.http.HttpHeaders;

/**
 * Defines the contract for applying authentication to an API request.
 *
 * <p>This interface allows different authentication schemes to be applied to API requests in a consistent
 * manner.
 */
public interface Authentication {

    /**
     * Applies the authentication to the outgoing request headers.
     *
     * @param headers The mutable headers of the request about to be sent.
     */
    void applyAuthentication(HttpHeaders headers);

    /**
     * @return a representation of the credential that is safe to log.
     */
    String describe();
}
