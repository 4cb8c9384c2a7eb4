package com.example.leadintake.service;

import com.example.leadintake.model.LeadResult;

/**
 * Observability sink fed one record per lead. Must not block or throw into the pipeline.
 */
public interface OutcomeRecorder {

    void record(LeadResult result);
}
