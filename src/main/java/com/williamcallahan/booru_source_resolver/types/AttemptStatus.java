/**
 * Outcome codes for a single strategy attempt inside the resolution chain
 *
 * @author William Callahan
 */
package com.williamcallahan.booru_source_resolver.types;

public enum AttemptStatus {
    /**
     * Strategy produced a probe-validated image
     */
    ACCEPTED,

    /**
     * Strategy precondition unmet (missing metadata, platform flag, cutoff date)
     */
    NOT_APPLICABLE,

    /**
     * Image decoded but did not match the expected original
     */
    FAILURE_VALIDATION,

    /**
     * Bytes could not be read as an image
     */
    FAILURE_DECODE,

    /**
     * Network or HTTP failure after retries
     */
    FAILURE_FETCH,

    /**
     * Tile or archive integrity failure (bad chunk, missing archive entry, failed backup job)
     */
    FAILURE_INTEGRITY,

    /**
     * Any other recoverable failure
     */
    FAILURE_GENERIC
}
