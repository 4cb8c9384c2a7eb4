package com.example.leadintake.client;

/**
 * Performs one HTTP exchange with the downstream lead-inbox API. Implementations
 * do not retry; every non-I/O response, whatever its status, is returned.
 */
public interface InboxTransport {

    InboxResponse exchange(InboxRequest request) throws TransportException;
}
