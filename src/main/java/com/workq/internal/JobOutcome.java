package com.workq.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.workq.JobResults;

/**
 * What a single execution produced, before it is recorded.
 */
public record JobOutcome(boolean success, JsonNode result) {

    public static JobOutcome succeeded(JsonNode result) {
        return new JobOutcome(true, result);
    }

    public static JobOutcome failed(String error) {
        return new JobOutcome(false, JobResults.error(error));
    }
}
