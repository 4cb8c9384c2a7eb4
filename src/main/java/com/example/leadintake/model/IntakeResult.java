package com.example.leadintake.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outcome of one inbound request: one {@link LeadResult} per logical lead.
 */
public final class IntakeResult {

    private final PayloadShape shape;
    private final List<LeadResult> results;

    public IntakeResult(PayloadShape shape, List<LeadResult> results) {
        this.shape = shape;
        this.results = List.copyOf(results);
    }

    public PayloadShape getShape() { return shape; }
    public List<LeadResult> getResults() { return results; }

    public int getTotal() {
        return results.size();
    }

    public int getSuccessful() {
        return (int) results.stream().filter(LeadResult::isAccepted).count();
    }

    public int getFailed() {
        return getTotal() - getSuccessful();
    }

    public boolean isSuccess() {
        return !results.isEmpty() && getFailed() == 0;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", isSuccess());
        result.put("shape", shape.name());
        result.put("totalLeads", getTotal());
        result.put("successfulLeads", getSuccessful());
        result.put("failedLeads", getFailed());
        result.put("results", results.stream().map(LeadResult::toMap).collect(Collectors.toList()));
        return result;
    }
}
