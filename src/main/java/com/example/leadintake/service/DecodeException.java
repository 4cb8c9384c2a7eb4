package com.example.leadintake.service;

/**
 * Inbound body could not be turned into a payload object. Keeps the original
 * text for diagnosis.
 */
public class DecodeException extends Exception {

    private final String raw;

    public DecodeException(String message, String raw, Throwable cause) {
        super(message, cause);
        this.raw = raw;
    }

    public String getRaw() {
        return raw;
    }
}
