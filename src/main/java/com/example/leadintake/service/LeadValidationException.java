package com.example.leadintake.service;

import com.example.leadintake.model.LeadField;

import java.util.List;

/**
 * Fields stayed empty after fallback substitution. Only a fallback policy
 * with blank defaults can cause this.
 */
public class LeadValidationException extends RuntimeException {

    private final List<LeadField> unsatisfiedFields;

    public LeadValidationException(List<LeadField> unsatisfiedFields) {
        super("No value or fallback for " + unsatisfiedFields);
        this.unsatisfiedFields = List.copyOf(unsatisfiedFields);
    }

    public List<LeadField> getUnsatisfiedFields() {
        return unsatisfiedFields;
    }
}
