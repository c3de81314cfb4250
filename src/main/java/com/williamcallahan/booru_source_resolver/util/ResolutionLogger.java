package com.williamcallahan.booru_source_resolver.util;

import org.slf4j.Logger;

/**
 * Centralized logging for strategy attempts and long-running acquisition phases.
 *
 * These logs help debug the strategy chain:
 * - direct URL
 * - API download
 * - historical locator
 * - tile reconstruction
 * - remote backup
 */
public final class ResolutionLogger {

    private static final String PREFIX = "[RESOLVER]";

    private ResolutionLogger() {
    }

    public static void logStrategyAttempt(Logger log, String strategy, String source) {
        log.info("{} [{}] ATTEMPT for {}", PREFIX, strategy, source);
    }

    public static void logStrategyAccepted(Logger log, String strategy, String source, String detail) {
        log.info("{} [{}] ACCEPTED for {}: {}", PREFIX, strategy, source, detail);
    }

    public static void logStrategyNotApplicable(Logger log, String strategy, String source, String reason) {
        log.debug("{} [{}] NOT-APPLICABLE for {}: {}", PREFIX, strategy, source, reason);
    }

    public static void logStrategyFailure(Logger log, String strategy, String source, Throwable error) {
        log.warn("{} [{}] FAILURE for {}: {}", PREFIX, strategy, source, error.getMessage());
    }

    public static void logExhausted(Logger log, String source, int attempts) {
        log.error("{} [CHAIN] EXHAUSTED: {} strategies failed for {}", PREFIX, attempts, source);
    }

    public static void logLocatorDay(Logger log, String date, int dayOffset, int candidates) {
        log.debug("{} [LOCATOR] probing {} (offset {}) with {} candidates", PREFIX, date, dayOffset, candidates);
    }

    public static void logLocatorHit(Logger log, String url, String target) {
        log.info("{} [LOCATOR] HIT: {} -> {}", PREFIX, url, target);
    }

    public static void logBackupStep(Logger log, String step, String draftPostId) {
        log.info("{} [BACKUP] {} (draft post {})", PREFIX, step, draftPostId);
    }
}
