package com.example.leadintake.model;

import java.util.List;

/**
 * The seven semantic lead fields, with the downstream wire name and the
 * producer-native names each one is read from.
 */
public enum LeadField {
    FIRST_NAME("from_first", List.of("first_name")),
    LAST_NAME("from_last", List.of("last_name")),
    MESSAGE("from_message", List.of("message")),
    EMAIL("from_email", List.of("email")),
    PHONE("from_phone", List.of("phone_number", "phone")),
    REFERRING_URL("referring_url", List.of("referring_url")),
    SOURCE("from_source", List.of("source"));

    private final String wireName;
    private final List<String> nativeNames;

    LeadField(String wireName, List<String> nativeNames) {
        this.wireName = wireName;
        this.nativeNames = nativeNames;
    }

    public String getWireName() {
        return wireName;
    }

    public List<String> getNativeNames() {
        return nativeNames;
    }
}
