package com.example.leadintake.service;

import com.example.leadintake.model.FallbackPolicy;
import com.example.leadintake.model.LeadField;
import com.example.leadintake.model.MappedLead;
import com.example.leadintake.model.NormalizedLead;
import com.example.leadintake.model.PayloadShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts the seven lead fields with the key table of the payload's shape,
 * fills gaps from the {@link FallbackPolicy} and reports what was synthesized.
 * A lead with placeholders is preferred over a dropped lead.
 */
@Component
public class LeadFieldMapper {

    private static final Logger logger = LoggerFactory.getLogger(LeadFieldMapper.class);

    static final String RECORDING_URL = "call_recording_url";
    static final String CALL_DURATION = "call_duration";

    public MappedLead map(PayloadShape shape, Map<String, Object> payload, FallbackPolicy policy) {
        switch (shape) {
            case DIRECT:
                return extract(asMap(payload.get(PayloadClassifier.DIRECT_KEY)), payload, true, policy);
            case ENVELOPE_SINGLE:
                Object wrapped = payload.get(PayloadClassifier.DIRECT_KEY);
                if (wrapped instanceof Map) {
                    return extract(asMap(wrapped), payload, false, policy);
                }
                return extract(payload, Map.of(), false, policy);
            case FLAT_LEGACY:
                return extract(payload, Map.of(), false, policy);
            default:
                throw new IllegalArgumentException("Cannot map a payload of shape " + shape);
        }
    }

    /**
     * Maps one item of a batch envelope. The envelope root supplies fields the item lacks.
     */
    public MappedLead mapBatchItem(Map<String, Object> item, Map<String, Object> envelopeRoot, FallbackPolicy policy) {
        return extract(item, envelopeRoot, false, policy);
    }

    private MappedLead extract(Map<String, Object> primary, Map<String, Object> secondary,
                               boolean directNames, FallbackPolicy policy) {
        Map<LeadField, String> values = new EnumMap<>(LeadField.class);
        List<LeadField> applied = new ArrayList<>();

        for (LeadField field : LeadField.values()) {
            String value = lookup(field, primary, directNames);
            if (value == null) {
                value = lookup(field, secondary, directNames);
            }
            if (field == LeadField.REFERRING_URL) {
                value = normalizeUrl(value);
            }
            values.put(field, value);
        }

        if (values.get(LeadField.MESSAGE) == null) {
            String recording = firstText(RECORDING_URL, primary, secondary);
            if (recording != null) {
                String duration = firstText(CALL_DURATION, primary, secondary);
                values.put(LeadField.MESSAGE, "Voice call recorded. Duration: "
                        + (duration != null ? duration : "0") + " seconds. Recording available.");
                applied.add(LeadField.MESSAGE);
            }
        }

        List<LeadField> unsatisfied = new ArrayList<>();
        for (LeadField field : LeadField.values()) {
            if (values.get(field) != null) {
                continue;
            }
            String fallback = policy.defaultFor(field);
            if (fallback == null || fallback.isBlank()) {
                unsatisfied.add(field);
                continue;
            }
            values.put(field, fallback);
            applied.add(field);
        }
        if (!unsatisfied.isEmpty()) {
            throw new LeadValidationException(unsatisfied);
        }

        applied.sort(null);
        if (!applied.isEmpty()) {
            logger.debug("Applied fallbacks for {}", applied);
        }
        return new MappedLead(NormalizedLead.fromFields(values), applied);
    }

    private String lookup(LeadField field, Map<String, Object> source, boolean directNames) {
        if (source == null || source.isEmpty()) {
            return null;
        }
        if (directNames) {
            String value = text(source.get(field.getWireName()));
            if (value != null) {
                return value;
            }
        }
        for (String key : field.getNativeNames()) {
            String value = text(source.get(key));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private String firstText(String key, Map<String, Object> primary, Map<String, Object> secondary) {
        String value = primary == null ? null : text(primary.get(key));
        if (value == null && secondary != null) {
            value = text(secondary.get(key));
        }
        return value;
    }

    /**
     * Lead text from a JSON value. {@code false} and {@code null} mean "not captured";
     * nested objects and arrays are not lead text.
     */
    static String text(Object value) {
        if (value == null || Boolean.FALSE.equals(value)) {
            return null;
        }
        if (value instanceof Map || value instanceof List) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    static String normalizeUrl(String url) {
        if (url == null) {
            return null;
        }
        String lower = url.toLowerCase();
        if (lower.equals("vonage")) {
            return "https://vonage.com/";
        }
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return url;
        }
        if (url.contains(".") && !url.contains(" ")) {
            return "https://" + url;
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }
}
