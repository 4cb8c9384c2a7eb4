package com.example.leadintake.client;

import java.io.IOException;

/**
 * The call never produced an HTTP response: connection failure, timeout, reset.
 */
public class TransportException extends IOException {

    private final boolean timeout;

    public TransportException(String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.timeout = timeout;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
