package net.deckadvisor.util;

import org.slf4j.Logger;

/**
 * Centralized logging for card catalog traffic.
 *
 * These logs trace the catalog flow:
 * - Catalog cache (first)
 * - Scryfall exact lookup, then fuzzy lookup
 * - Scryfall search pages
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log an external API call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String operation, String query) {
        if (log.isDebugEnabled()) {
            log.debug(String.format("%s [%s] ATTEMPT: %s for query='%s'", PREFIX, apiName, operation, query));
        }
    }

    /**
     * Log an external API call success
     */
    public static void logApiCallSuccess(Logger log, String apiName, String operation, String query, int resultCount) {
        log.info(String.format("%s [%s] SUCCESS: %s returned %d result(s) for query='%s'",
            PREFIX, apiName, operation, resultCount, query));
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String query, String reason) {
        log.warn(String.format("%s [%s] FAILURE: %s failed for query='%s' - %s",
            PREFIX, apiName, operation, query, reason));
    }

    /**
     * Log a lookup that the catalog answered with "no such card"
     */
    public static void logNotFound(Logger log, String apiName, String operation, String query) {
        log.debug(String.format("%s [%s] NOT-FOUND: %s for query='%s'", PREFIX, apiName, operation, query));
    }

    /**
     * Log a request served from the catalog cache
     */
    public static void logCacheHit(Logger log, String apiName, String operation, String query) {
        if (log.isTraceEnabled()) {
            log.trace(String.format("%s [%s] CACHE-HIT: %s for query='%s'", PREFIX, apiName, operation, query));
        }
    }

    /**
     * Log the rate limiter refusing a permit
     */
    public static void logRateLimited(Logger log, String apiName, String query) {
        log.warn(String.format("%s [%s] RATE-LIMITED: no permit available for query='%s'", PREFIX, apiName, query));
    }
}
