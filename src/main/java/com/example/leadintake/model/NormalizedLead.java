package com.example.leadintake.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A lead in the downstream inbox schema. The inbox token is not part of the
 * lead; the dispatch client adds it from configuration.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NormalizedLead {
    private String firstName;
    private String lastName;
    private String message;
    private String email;
    private String phone;
    private String referringUrl;
    private String source;

    public static NormalizedLead fromFields(Map<LeadField, String> values) {
        return NormalizedLead.builder()
                .firstName(values.get(LeadField.FIRST_NAME))
                .lastName(values.get(LeadField.LAST_NAME))
                .message(values.get(LeadField.MESSAGE))
                .email(values.get(LeadField.EMAIL))
                .phone(values.get(LeadField.PHONE))
                .referringUrl(values.get(LeadField.REFERRING_URL))
                .source(values.get(LeadField.SOURCE))
                .build();
    }

    public String get(LeadField field) {
        switch (field) {
            case FIRST_NAME: return firstName;
            case LAST_NAME: return lastName;
            case MESSAGE: return message;
            case EMAIL: return email;
            case PHONE: return phone;
            case REFERRING_URL: return referringUrl;
            case SOURCE: return source;
            default: throw new IllegalArgumentException("Unknown field: " + field);
        }
    }

    public Map<LeadField, String> toFieldMap() {
        Map<LeadField, String> values = new EnumMap<>(LeadField.class);
        for (LeadField field : LeadField.values()) {
            values.put(field, get(field));
        }
        return values;
    }

    /**
     * The {@code inbox_lead} object as the downstream API expects it.
     */
    public Map<String, Object> toInboxLead() {
        Map<String, Object> inboxLead = new LinkedHashMap<>();
        for (LeadField field : LeadField.values()) {
            inboxLead.put(field.getWireName(), get(field));
        }
        return inboxLead;
    }
}
