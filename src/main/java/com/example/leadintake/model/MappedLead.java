package com.example.leadintake.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class MappedLead {
    private NormalizedLead lead;
    // fields synthesized from the fallback policy or derived values, in field order
    private List<LeadField> appliedFallbacks;
}
