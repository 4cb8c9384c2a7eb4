package com.example.leadintake.model;

/**
 * Structural shape of an inbound payload. Every payload gets exactly one.
 */
public enum PayloadShape {
    /** {@code inbox_lead} object already using the downstream field names. */
    DIRECT,
    /** Voice-agent lead with producer-native names, wrapped or carrying envelope markers. */
    ENVELOPE_SINGLE,
    /** {@code inbox_leads} array of envelope-single items. */
    ENVELOPE_BATCH,
    /** Producer-native names at the top level, no wrapper and no envelope markers. */
    FLAT_LEGACY,
    UNKNOWN;

    public boolean isRecognized() {
        return this != UNKNOWN;
    }
}
