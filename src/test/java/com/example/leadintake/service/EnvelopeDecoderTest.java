package com.example.leadintake.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeDecoderTest {

    private EnvelopeDecoder decoder;

    @BeforeEach
    void setUp() {
        decoder = new EnvelopeDecoder(new ObjectMapper());
    }

    @Test
    void testDecode_PlainJsonPassesThrough() throws Exception {
        // When
        Map<String, Object> payload = decoder.decode("{\"first_name\":\"John\",\"message\":\"need help\"}");

        // Then
        assertEquals("John", payload.get("first_name"));
        assertEquals("need help", payload.get("message"));
    }

    @Test
    void testDecode_TransportEnvelopeIsUnwrapped() throws Exception {
        // Given
        String inner = "{\"inbox_leads\":[{\"first_name\":\"Minnie\"}]}";
        String encoded = Base64.getEncoder().encodeToString(inner.getBytes(StandardCharsets.UTF_8));
        String raw = "{\"timestamp\":1722196560,\"callId\":42,\"message\":\"" + encoded + "\"}";

        // When
        Map<String, Object> payload = decoder.decode(raw);

        // Then
        assertTrue(payload.containsKey("inbox_leads"));
        assertFalse(payload.containsKey("timestamp"));
    }

    @Test
    void testDecode_EncodedEnvelopeKeyIsAccepted() throws Exception {
        // Given
        String encoded = Base64.getEncoder().encodeToString("{\"email\":\"a@b.com\"}".getBytes(StandardCharsets.UTF_8));

        // When
        Map<String, Object> payload = decoder.decode(Map.of("timestamp", 1, "encoded_envelope", encoded));

        // Then
        assertEquals(Map.of("email", "a@b.com"), payload);
    }

    @Test
    void testDecode_RoundTrip() throws Exception {
        // Given
        Map<String, Object> original = new LinkedHashMap<>();
        original.put("first_name", "Zoë");
        original.put("call_duration", 93);
        original.put("message", false);
        original.put("tags", List.of("voice", "after-hours"));
        original.put("nested", Map.of("k", "v"));

        // When
        Map<String, Object> envelope = decoder.encode(original, 7L, 1722196560L);
        Map<String, Object> decoded = decoder.decode(envelope);

        // Then
        assertEquals(7L, envelope.get("callId"));
        assertEquals(1722196560L, envelope.get("timestamp"));
        assertEquals(original, decoded);
    }

    @Test
    void testDecode_InvalidBase64CarriesRawBody() {
        // Given
        String raw = "{\"message\": \"not-valid-base64!!\"}";

        // When
        DecodeException e = assertThrows(DecodeException.class, () -> decoder.decode(raw));

        // Then
        assertEquals(raw, e.getRaw());
        assertTrue(e.getMessage().contains("base64"));
    }

    @Test
    void testDecode_NonUtf8Bytes() {
        // Given
        String encoded = Base64.getEncoder().encodeToString(new byte[]{(byte) 0xC3, (byte) 0x28, (byte) 0xFF});

        // When / Then
        DecodeException e = assertThrows(DecodeException.class,
                () -> decoder.decode("{\"message\":\"" + encoded + "\"}"));
        assertTrue(e.getMessage().contains("UTF-8"));
    }

    @Test
    void testDecode_InvalidJsonAfterDecode() {
        // Given
        String encoded = Base64.getEncoder().encodeToString("{not json".getBytes(StandardCharsets.UTF_8));

        // When / Then
        assertThrows(DecodeException.class, () -> decoder.decode("{\"message\":\"" + encoded + "\"}"));
    }

    @Test
    void testDecode_BodyThatIsNotJson() {
        DecodeException e = assertThrows(DecodeException.class, () -> decoder.decode("first_name=John"));
        assertEquals("first_name=John", e.getRaw());
    }

    @Test
    void testDecode_JsonArrayBodyIsRejected() {
        assertThrows(DecodeException.class, () -> decoder.decode("[{\"first_name\":\"John\"}]"));
    }

    @Test
    void testIsTransportEnvelope_LeadWithMessageIsNotAnEnvelope() {
        assertFalse(decoder.isTransportEnvelope(Map.of("first_name", "John", "message", "need help")));
        assertFalse(decoder.isTransportEnvelope(Map.of("message", false)));
        assertTrue(decoder.isTransportEnvelope(Map.of("timestamp", 1, "message", "e30=")));
    }
}
