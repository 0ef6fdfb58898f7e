package com.workq.internal;

import java.util.List;

/**
 * Data of the garbage collection job. Jobs with one of these ids or tags are never deleted.
 */
public record RemoveOldJobsPayload(List<Long> excludeIds, List<String> excludeTags) {

    public RemoveOldJobsPayload {
        excludeIds = excludeIds == null ? List.of() : List.copyOf(excludeIds);
        excludeTags = excludeTags == null ? List.of() : List.copyOf(excludeTags);
    }

    public static RemoveOldJobsPayload none() {
        return new RemoveOldJobsPayload(List.of(), List.of());
    }
}
