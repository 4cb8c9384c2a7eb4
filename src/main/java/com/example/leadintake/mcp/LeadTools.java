package com.example.leadintake.mcp;

import com.example.leadintake.service.DecodeException;
import com.example.leadintake.service.EnvelopeDecoder;
import com.example.leadintake.service.LeadIntakePipeline;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

@Service
public class LeadTools {

    private final LeadIntakePipeline pipeline;
    private final EnvelopeDecoder decoder;

    public LeadTools(LeadIntakePipeline pipeline, EnvelopeDecoder decoder) {
        this.pipeline = pipeline;
        this.decoder = decoder;
    }

    @Tool(description = "Submit a lead payload (web form, voice agent envelope, batch or base64 transport envelope) to the lead inbox")
    public Map<String, Object> lead_submit(Map<String, Object> payload) {
        return pipeline.handle(payload).toMap();
    }

    @Tool(description = "Classify and map a lead payload without sending it; shows the applied fallbacks")
    public Map<String, Object> lead_preview(Map<String, Object> payload) {
        return pipeline.preview(payload).toMap();
    }

    @Tool(description = "Wrap a payload in a base64 transport envelope with optional callId")
    public Map<String, Object> envelope_encode(Map<String, Object> payload, Long callId) {
        return decoder.encode(payload, callId, null);
    }

    @Tool(description = "Decode a base64 transport envelope given as a JSON string")
    public Map<String, Object> envelope_decode(String envelope) {
        Map<String, Object> result = new HashMap<>();
        try {
            result.put("ok", true);
            result.put("payload", decoder.decode(envelope));
        } catch (DecodeException e) {
            result.put("ok", false);
            result.put("error", e.getMessage());
        }
        return result;
    }
}
