package com.williamcallahan.booru_source_resolver.types;

import lombok.Value;

/**
 * One entry in the attempt history of a resolution, kept for diagnostics.
 */
@Value
public class ResolutionAttempt {
    String strategyName;
    AttemptStatus status;
    String detail;
    Throwable cause;

    public static ResolutionAttempt accepted(String strategyName, String detail) {
        return new ResolutionAttempt(strategyName, AttemptStatus.ACCEPTED, detail, null);
    }

    public static ResolutionAttempt failed(String strategyName, AttemptStatus status, Throwable cause) {
        return new ResolutionAttempt(strategyName, status, cause.getMessage(), cause);
    }
}
