package net.deckadvisor.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CatalogRequestMonitorTest {

    private CatalogRequestMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = new CatalogRequestMonitor();
    }

    @Test
    void should_CountRequestsByOutcome() {
        monitor.recordSuccessfulRequest("cards/search");
        monitor.recordNotFound("cards/named/exact");
        monitor.recordFailedRequest("cards/named/fuzzy", "HTTP 503");

        Map<String, Object> metrics = monitor.getMetricsMap();
        assertThat(metrics.get("total_requests")).isEqualTo(3L);
        assertThat(metrics.get("total_successful")).isEqualTo(1L);
        assertThat(metrics.get("total_not_found")).isEqualTo(1L);
        assertThat(metrics.get("total_failed")).isEqualTo(1L);
        assertThat(metrics.get("hourly_failed")).isEqualTo(1);
        assertThat(metrics.get("operations")).isEqualTo(Map.of(
            "cards/search", 1, "cards/named/exact", 1, "cards/named/fuzzy", 1));
    }

    @Test
    void should_ResetHourlyCountersOnly() {
        monitor.recordSuccessfulRequest("cards/search");
        monitor.recordCacheHit();
        monitor.recordCacheMiss();

        monitor.resetHourlyCounters();

        Map<String, Object> metrics = monitor.getMetricsMap();
        assertThat(metrics.get("hourly_requests")).isEqualTo(0);
        assertThat(metrics.get("total_requests")).isEqualTo(1L);
        assertThat(metrics.get("cache_hits")).isEqualTo(1L);
        assertThat(metrics.get("cache_misses")).isEqualTo(1L);
    }

    @Test
    void should_IncludeOperationsInReport() {
        monitor.recordSuccessfulRequest("cards/search");

        assertThat(monitor.generateReport())
            .contains("Catalog Request Monitor Report")
            .contains("cards/search: 1 requests");
    }

    @Test
    void should_CountConcurrentRequestsExactly() throws InterruptedException {
        int threads = 8;
        int perThread = 250;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                for (int i = 0; i < perThread; i++) {
                    monitor.recordSuccessfulRequest("cards/search");
                }
                done.countDown();
            });
        }

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        assertThat(monitor.getTotalRequests()).isEqualTo((long) threads * perThread);
        assertThat(monitor.getOperationCount("cards/search")).isEqualTo(threads * perThread);
    }
}
