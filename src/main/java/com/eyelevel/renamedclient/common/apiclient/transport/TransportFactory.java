package com.eyelevel.renamedclient.common.apiclient.transport;

/**
 * Creates the transport for one execution mode. Called at most once per mode and client.
 */
@FunctionalInterface
public interface TransportFactory {

    Transport create(TransportMode mode);
}
