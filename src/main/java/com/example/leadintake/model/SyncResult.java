package com.example.leadintake.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@AllArgsConstructor
@Builder
public class SyncResult {
    private String resource;
    private List<Map<String, Object>> records;
    private int pagesFetched;
    private boolean complete;
    // set when the run stopped on a failure; records fetched before it are kept
    private DispatchOutcome terminalOutcome;

    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("resource", resource);
        result.put("recordCount", records.size());
        result.put("pagesFetched", pagesFetched);
        result.put("complete", complete);
        if (terminalOutcome != null) {
            result.put("terminalOutcome", terminalOutcome.toMap());
        }
        result.put("records", records);
        return result;
    }
}
