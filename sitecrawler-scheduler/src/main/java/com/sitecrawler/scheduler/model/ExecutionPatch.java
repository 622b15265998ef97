package com.sitecrawler.scheduler.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Settlement fields for an execution. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionPatch {
    private Long sessionId;
    private Instant completedAt;
    private ExecutionStatus status;
    private String errorMessage;
    private Long pagesCrawled;
    private Long resourcesFound;
    private Long durationMs;

    public void applyTo(Execution target) {
        if (sessionId != null)
            target.setSessionId(sessionId);
        if (completedAt != null)
            target.setCompletedAt(completedAt);
        if (status != null)
            target.setStatus(status);
        if (errorMessage != null)
            target.setErrorMessage(errorMessage);
        if (pagesCrawled != null)
            target.setPagesCrawled(pagesCrawled);
        if (resourcesFound != null)
            target.setResourcesFound(resourcesFound);
        if (durationMs != null)
            target.setDurationMs(durationMs);
    }
}
