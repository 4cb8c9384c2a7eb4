package com.example.leadintake.service;

import com.example.leadintake.model.LeadField;
import com.example.leadintake.model.PayloadShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assigns a {@link PayloadShape} by strict precedence: batch, direct, native
 * fields (wrapped or envelope-marked versus flat), unknown.
 */
@Component
public class PayloadClassifier {

    private static final Logger logger = LoggerFactory.getLogger(PayloadClassifier.class);

    public static final String BATCH_KEY = "inbox_leads";
    public static final String DIRECT_KEY = "inbox_lead";

    // metadata voice-agent envelopes carry next to the lead fields
    static final Set<String> ENVELOPE_MARKERS = Set.of(
            "call_duration", "call_recording_url", "chat_conversation_id",
            "dispute_status", "google_lead_id", "inboxable", "lead_type");

    static final Set<String> NATIVE_FIELDS;
    static final Set<String> DIRECT_FIELDS;

    static {
        Set<String> nativeFields = new LinkedHashSet<>();
        Set<String> directFields = new LinkedHashSet<>();
        for (LeadField field : LeadField.values()) {
            nativeFields.addAll(field.getNativeNames());
            directFields.add(field.getWireName());
        }
        NATIVE_FIELDS = Collections.unmodifiableSet(nativeFields);
        DIRECT_FIELDS = Collections.unmodifiableSet(directFields);
    }

    public PayloadShape classify(Map<String, Object> payload) {
        PayloadShape shape = doClassify(payload);
        logger.debug("Classified payload keys={} as {}", payload == null ? List.of() : payload.keySet(), shape);
        return shape;
    }

    private PayloadShape doClassify(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return PayloadShape.UNKNOWN;
        }
        if (payload.get(BATCH_KEY) instanceof List) {
            return PayloadShape.ENVELOPE_BATCH;
        }
        Object wrapped = payload.get(DIRECT_KEY);
        if (wrapped instanceof Map) {
            Map<?, ?> inner = (Map<?, ?>) wrapped;
            if (inner.keySet().stream().anyMatch(DIRECT_FIELDS::contains)) {
                return PayloadShape.DIRECT;
            }
            if (inner.keySet().stream().anyMatch(NATIVE_FIELDS::contains)) {
                return PayloadShape.ENVELOPE_SINGLE;
            }
        }
        boolean hasMarkers = payload.keySet().stream().anyMatch(ENVELOPE_MARKERS::contains);
        if (hasMarkers) {
            return PayloadShape.ENVELOPE_SINGLE;
        }
        if (payload.keySet().stream().anyMatch(NATIVE_FIELDS::contains)) {
            return PayloadShape.FLAT_LEGACY;
        }
        return PayloadShape.UNKNOWN;
    }

    /**
     * Items of an {@link PayloadShape#ENVELOPE_BATCH} in input order. Items that
     * are not objects are returned as-is so the caller can reject them one by one.
     */
    public List<Object> expand(Map<String, Object> payload) {
        Object items = payload.get(BATCH_KEY);
        if (!(items instanceof List)) {
            throw new IllegalArgumentException("Payload has no " + BATCH_KEY + " array");
        }
        return new ArrayList<>((List<?>) items);
    }

    /**
     * Root-level lead fields of a batch envelope, used when an item lacks one.
     */
    public Map<String, Object> envelopeRoot(Map<String, Object> payload) {
        Map<String, Object> root = new LinkedHashMap<>(payload);
        root.remove(BATCH_KEY);
        return root;
    }
}
