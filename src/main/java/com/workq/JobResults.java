package com.workq;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Result documents written by the engine itself.
 */
public final class JobResults {

    public static final String CANCELLED_MESSAGE = "Job cancelled due to new job being created";
    public static final String UNKNOWN_TYPE_PREFIX = "Unknown job type: ";
    public static final String ABANDONED_PREFIX = "Job abandoned: ";

    private JobResults() {
    }

    public static ObjectNode error(String message) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("error", message);
        return node;
    }

    public static ObjectNode cancelled() {
        return error(CANCELLED_MESSAGE);
    }

    /**
     * Returns the {@code error} text of a result document, or {@code null} if it carries none.
     */
    public static String errorOf(JsonNode result) {
        if (result == null || !result.hasNonNull("error")) {
            return null;
        }
        return result.get("error").asText();
    }
}
