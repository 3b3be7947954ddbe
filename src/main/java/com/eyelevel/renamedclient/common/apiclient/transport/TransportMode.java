package com.eyelevel.renamedclient.common.apiclient.transport;

/**
 * The execution mode a transport serves. Each mode owns its own connection pool.
 */
public enum TransportMode {
    BLOCKING,
    NON_BLOCKING
}
