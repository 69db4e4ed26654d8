package net.deckadvisor.catalog;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Counts catalog traffic: outbound requests by outcome, cache hits and misses, and calls per operation.
 * Hourly counters reset on the hour; totals accumulate since startup.
 */
@Component
@Slf4j
public class CatalogRequestMonitor {
    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final AtomicLong totalRequests = new AtomicLong(0);
    private final AtomicLong totalSuccessful = new AtomicLong(0);
    private final AtomicLong totalNotFound = new AtomicLong(0);
    private final AtomicLong totalFailed = new AtomicLong(0);

    private final AtomicInteger hourlyRequests = new AtomicInteger(0);
    private final AtomicInteger hourlyFailed = new AtomicInteger(0);

    private final AtomicLong cacheHits = new AtomicLong(0);
    private final AtomicLong cacheMisses = new AtomicLong(0);

    private final Map<String, AtomicInteger> operationCounts = new ConcurrentHashMap<>();

    private volatile LocalDateTime lastHourlyReset = LocalDateTime.now();

    public void recordSuccessfulRequest(String operation) {
        totalRequests.incrementAndGet();
        totalSuccessful.incrementAndGet();
        countRequest(operation);
    }

    /**
     * A request the catalog answered with "no such card". Not a failure.
     */
    public void recordNotFound(String operation) {
        totalRequests.incrementAndGet();
        totalNotFound.incrementAndGet();
        countRequest(operation);
    }

    public void recordFailedRequest(String operation, String errorMessage) {
        totalRequests.incrementAndGet();
        totalFailed.incrementAndGet();
        hourlyFailed.incrementAndGet();
        countRequest(operation);
        log.warn("Failed catalog request {}: {}", operation, errorMessage);
    }

    public void recordCacheHit() {
        cacheHits.incrementAndGet();
    }

    public void recordCacheMiss() {
        cacheMisses.incrementAndGet();
    }

    private void countRequest(String operation) {
        operationCounts.computeIfAbsent(operation, k -> new AtomicInteger(0)).incrementAndGet();
        int hourly = hourlyRequests.incrementAndGet();
        if (hourly % 500 == 0) {
            log.info("Catalog request count: {} in the current hour", hourly);
        }
    }

    /**
     * Runs at the beginning of each hour.
     */
    @Scheduled(cron = "0 0 * * * ?")
    public void resetHourlyCounters() {
        int requests = hourlyRequests.getAndSet(0);
        int failed = hourlyFailed.getAndSet(0);
        lastHourlyReset = LocalDateTime.now();
        log.info("Hourly catalog metrics reset. Previous hour: {} requests ({} failed)", requests, failed);
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    public long getTotalFailed() {
        return totalFailed.get();
    }

    public long getTotalNotFound() {
        return totalNotFound.get();
    }

    public long getCacheHits() {
        return cacheHits.get();
    }

    public int getOperationCount(String operation) {
        AtomicInteger count = operationCounts.get(operation);
        return count == null ? 0 : count.get();
    }

    /**
     * Snapshot of every counter, suitable for JSON export.
     */
    public Map<String, Object> getMetricsMap() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("total_requests", totalRequests.get());
        metrics.put("total_successful", totalSuccessful.get());
        metrics.put("total_not_found", totalNotFound.get());
        metrics.put("total_failed", totalFailed.get());
        metrics.put("hourly_requests", hourlyRequests.get());
        metrics.put("hourly_failed", hourlyFailed.get());
        metrics.put("cache_hits", cacheHits.get());
        metrics.put("cache_misses", cacheMisses.get());

        Map<String, Integer> operations = new TreeMap<>();
        operationCounts.forEach((operation, count) -> operations.put(operation, count.get()));
        metrics.put("operations", operations);
        metrics.put("last_hourly_reset", TIME_FORMATTER.format(lastHourlyReset));
        return metrics;
    }

    /**
     * Human-readable report of the same counters.
     */
    public String generateReport() {
        StringBuilder report = new StringBuilder();
        report.append(String.format("Catalog Request Monitor Report%n"));
        report.append(String.format("==============================%n"));
        report.append(String.format("Generated at: %s%n%n", TIME_FORMATTER.format(LocalDateTime.now())));
        report.append(String.format("  Hourly: %d requests (%d failed)%n", hourlyRequests.get(), hourlyFailed.get()));
        report.append(String.format("  Total: %d requests (%d successful, %d not found, %d failed)%n",
                totalRequests.get(), totalSuccessful.get(), totalNotFound.get(), totalFailed.get()));
        report.append(String.format("  Cache: %d hits, %d misses%n%n", cacheHits.get(), cacheMisses.get()));
        report.append(String.format("Operation Counts:%n"));
        new TreeMap<>(operationCounts).forEach((operation, count) ->
            report.append(String.format("  %s: %d requests%n", operation, count.get())));
        report.append(String.format("%nLast hourly reset: %s%n", TIME_FORMATTER.format(lastHourlyReset)));
        return report.toString();
    }
}
