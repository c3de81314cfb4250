/**
 * Raised when every acquisition strategy for a source failed or was not applicable
 *
 * @author William Callahan
 *
 * Features:
 * - Keeps the ordered attempt history for diagnostics
 * - Attaches each attempt's cause as a suppressed exception
 */
package com.williamcallahan.booru_source_resolver.types;

import java.util.List;
import java.util.stream.Collectors;

public class ResolutionExhaustedException extends SourceResolutionException {

    private final List<ResolutionAttempt> attempts;

    public ResolutionExhaustedException(String sourceLabel, List<ResolutionAttempt> attempts) {
        super(buildMessage(sourceLabel, attempts), false);
        this.attempts = List.copyOf(attempts);
        for (ResolutionAttempt attempt : this.attempts) {
            if (attempt.getCause() != null) {
                addSuppressed(attempt.getCause());
            }
        }
    }

    public List<ResolutionAttempt> getAttempts() {
        return attempts;
    }

    private static String buildMessage(String sourceLabel, List<ResolutionAttempt> attempts) {
        String summary = attempts.stream()
            .map(attempt -> attempt.getStrategyName() + "=" + attempt.getStatus())
            .collect(Collectors.joining(", "));
        return "All strategies exhausted for " + sourceLabel + " [" + summary + "]";
    }
}
