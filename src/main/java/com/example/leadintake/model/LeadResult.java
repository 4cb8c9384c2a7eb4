package com.example.leadintake.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Everything known about one logical lead after the pipeline ran.
 */
@Data
@AllArgsConstructor
@Builder
public class LeadResult {
    private int index;
    private PayloadShape shape;
    private NormalizedLead lead;
    @Builder.Default
    private List<LeadField> appliedFallbacks = List.of();
    // null when the lead was only previewed
    private DispatchOutcome outcome;

    /**
     * Created downstream, or mapped cleanly when only previewed.
     */
    public boolean isAccepted() {
        return outcome == null || outcome.isCreated();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("index", index);
        result.put("shape", shape.name());
        result.put("appliedFallbacks", appliedFallbacks.stream().map(Enum::name).collect(Collectors.toList()));
        if (lead != null) {
            result.put("lead", lead.toInboxLead());
        }
        if (outcome != null) {
            result.putAll(outcome.toMap());
        } else {
            result.put("outcome", "NOT_DISPATCHED");
        }
        return result;
    }
}
