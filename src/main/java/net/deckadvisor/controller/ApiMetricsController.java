package net.deckadvisor.controller;

import java.util.Map;
import net.deckadvisor.catalog.CatalogRequestMonitor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Exposes catalog traffic counters for operational monitoring.
 */
@RestController
@RequestMapping("/api/metrics/catalog")
public class ApiMetricsController {

    private final CatalogRequestMonitor catalogRequestMonitor;

    public ApiMetricsController(CatalogRequestMonitor catalogRequestMonitor) {
        this.catalogRequestMonitor = catalogRequestMonitor;
    }

    /**
     * @return JSON object containing all catalog metrics
     */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> getCatalogMetrics() {
        return catalogRequestMonitor.getMetricsMap();
    }

    /**
     * @return Plain text report of the same counters
     */
    @GetMapping(value = "/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public String getCatalogMetricsReport() {
        return catalogRequestMonitor.generateReport();
    }
}
