package com.example.leadintake.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable per-field default values substituted for absent or empty input.
 */
public final class FallbackPolicy {

    private final Map<LeadField, String> defaults;

    public FallbackPolicy(Map<LeadField, String> defaults) {
        EnumMap<LeadField, String> copy = new EnumMap<>(LeadField.class);
        if (defaults != null) {
            copy.putAll(defaults);
        }
        this.defaults = Collections.unmodifiableMap(copy);
    }

    public String defaultFor(LeadField field) {
        return defaults.get(field);
    }

    /**
     * Fields the policy cannot fill. Empty for a complete policy.
     */
    public List<LeadField> uncoveredFields() {
        return Arrays.stream(LeadField.values())
                .filter(field -> {
                    String value = defaults.get(field);
                    return value == null || value.isBlank();
                })
                .collect(Collectors.toList());
    }

    public boolean isComplete() {
        return uncoveredFields().isEmpty();
    }

    public Map<LeadField, String> asMap() {
        return defaults;
    }
}
