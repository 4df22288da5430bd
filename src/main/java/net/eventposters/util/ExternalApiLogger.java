package net.eventposters.util;

import org.slf4j.Logger;

/**
 * Centralized logging for outbound calls made while rendering and publishing posters:
 * - image search (background candidates)
 * - image download (selected background bytes)
 * - icon fetches (first use only, then cached)
 * - webhook publishing
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log an external API call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String operation, String subject) {
        log.info(String.format("%s [%s] ATTEMPT: %s for '%s'", PREFIX, apiName, operation, subject));
    }

    /**
     * Log an external API call success
     */
    public static void logApiCallSuccess(Logger log, String apiName, String operation, String subject, int resultCount) {
        log.info(String.format("%s [%s] SUCCESS: %s returned %d result(s) for '%s'",
            PREFIX, apiName, operation, resultCount, subject));
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String subject, String reason) {
        log.warn(String.format("%s [%s] FAILURE: %s failed for '%s' - %s",
            PREFIX, apiName, operation, subject, reason));
    }

    /**
     * Log a call that was not made because the rate limiter denied a permit
     */
    public static void logRateLimited(Logger log, String apiName, String subject) {
        log.info(String.format("%s [%s] RATE-LIMITED: Skipping call for '%s'", PREFIX, apiName, subject));
    }

    /**
     * Log HTTP response details
     */
    public static void logHttpResponse(Logger log, int statusCode, String url, int bodySize) {
        log.debug(String.format("%s [HTTP] Response: status=%d, url=%s, bodySize=%d bytes",
            PREFIX, statusCode, url, bodySize));
    }
}
