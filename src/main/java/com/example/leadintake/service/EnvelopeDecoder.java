package com.example.leadintake.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reverses the base64-over-JSON transport envelope some producers wrap leads in:
 * {@code {"timestamp": 1722196560, "callId": 42, "message": "<base64 of JSON>"}}.
 * Bodies that are not envelopes pass through unchanged.
 */
@Component
public class EnvelopeDecoder {

    private static final Logger logger = LoggerFactory.getLogger(EnvelopeDecoder.class);

    static final String TIMESTAMP = "timestamp";
    static final String CALL_ID = "callId";
    static final String MESSAGE = "message";
    private static final Set<String> ENVELOPE_KEYS = Set.of(TIMESTAMP, CALL_ID, "call_id", MESSAGE, "encoded_envelope");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public EnvelopeDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> decode(String raw) throws DecodeException {
        if (raw == null || raw.isBlank()) {
            throw new DecodeException("Empty body", raw, null);
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Body is not valid JSON: " + e.getOriginalMessage(), raw, e);
        }
        if (node == null || !node.isObject()) {
            throw new DecodeException("Body must be a JSON object", raw, null);
        }
        return decode(objectMapper.convertValue(node, MAP_TYPE), raw);
    }

    public Map<String, Object> decode(Map<String, Object> payload) throws DecodeException {
        return decode(payload, null);
    }

    private Map<String, Object> decode(Map<String, Object> payload, String raw) throws DecodeException {
        if (!isTransportEnvelope(payload)) {
            return payload;
        }
        String original = raw != null ? raw : String.valueOf(payload);
        String encoded = (String) (payload.get(MESSAGE) instanceof String
                ? payload.get(MESSAGE) : payload.get("encoded_envelope"));
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(WHITESPACE.matcher(encoded).replaceAll(""));
        } catch (IllegalArgumentException e) {
            throw new DecodeException("Envelope message is not valid base64", original, e);
        }
        if (bytes.length == 0) {
            throw new DecodeException("Envelope message is empty", original, null);
        }
        String json;
        try {
            json = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new DecodeException("Envelope message is not UTF-8", original, e);
        }
        JsonNode inner;
        try {
            inner = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Envelope message does not hold valid JSON", original, e);
        }
        if (inner == null || !inner.isObject()) {
            throw new DecodeException("Envelope message must hold a JSON object", original, null);
        }
        logger.debug("Decoded transport envelope callId={} timestamp={}",
                payload.getOrDefault(CALL_ID, payload.get("call_id")), payload.get(TIMESTAMP));
        return objectMapper.convertValue(inner, MAP_TYPE);
    }

    /**
     * Only envelope keys at the top level, with a string payload carrier. A lead
     * such as {@code {"first_name": "John", "message": "need help"}} is not an envelope.
     */
    public boolean isTransportEnvelope(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty() || !ENVELOPE_KEYS.containsAll(payload.keySet())) {
            return false;
        }
        return payload.get(MESSAGE) instanceof String || payload.get("encoded_envelope") instanceof String;
    }

    public Map<String, Object> encode(Map<String, Object> payload, Long callId, Long timestamp) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not JSON-serializable", e);
        }
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put(TIMESTAMP, timestamp != null ? timestamp : Instant.now().getEpochSecond());
        if (callId != null) {
            envelope.put(CALL_ID, callId);
        }
        envelope.put(MESSAGE, Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8)));
        return envelope;
    }
}
