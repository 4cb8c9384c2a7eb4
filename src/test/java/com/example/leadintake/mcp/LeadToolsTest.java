package com.example.leadintake.mcp;

import com.example.leadintake.model.IntakeResult;
import com.example.leadintake.model.PayloadShape;
import com.example.leadintake.service.EnvelopeDecoder;
import com.example.leadintake.service.LeadIntakePipeline;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LeadToolsTest {

    @Mock
    private LeadIntakePipeline pipeline;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private LeadTools leadTools;

    @BeforeEach
    void setUp() {
        leadTools = new LeadTools(pipeline, new EnvelopeDecoder(objectMapper));
    }

    @Test
    void testLeadSubmit_DelegatesToPipeline() {
        // Given
        Map<String, Object> payload = Map.of("first_name", "John");
        when(pipeline.handle(payload)).thenReturn(new IntakeResult(PayloadShape.FLAT_LEGACY, List.of()));

        // When
        Map<String, Object> result = leadTools.lead_submit(payload);

        // Then
        assertEquals("FLAT_LEGACY", result.get("shape"));
        assertEquals(0, result.get("totalLeads"));
        verify(pipeline).handle(payload);
    }

    @Test
    void testEnvelopeEncodeThenDecode() throws Exception {
        // Given
        Map<String, Object> payload = Map.of("first_name", "Minnie", "call_duration", 12);

        // When
        Map<String, Object> envelope = leadTools.envelope_encode(payload, 42L);
        Map<String, Object> decoded = leadTools.envelope_decode(objectMapper.writeValueAsString(envelope));

        // Then
        assertEquals(42L, envelope.get("callId"));
        assertTrue(envelope.get("message") instanceof String);
        assertEquals(true, decoded.get("ok"));
        assertEquals(payload, decoded.get("payload"));
    }

    @Test
    void testEnvelopeDecode_ReportsError() {
        // When
        Map<String, Object> result = leadTools.envelope_decode("{\"message\":\"@@@\"}");

        // Then
        assertEquals(false, result.get("ok"));
        assertNotNull(result.get("error"));
        verifyNoInteractions(pipeline);
    }
}
