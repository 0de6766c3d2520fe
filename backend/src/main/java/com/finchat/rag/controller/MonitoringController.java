package com.finchat.rag.controller;

import com.finchat.rag.service.MetricsService;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Query analytics and health summary for the assistant core.
 */
@RestController
@RequestMapping("/monitoring")
@CrossOrigin(origins = "*")
@Slf4j
public class MonitoringController {

    private final MetricsService metricsService;

    public MonitoringController(MetricsService metricsService) {
        this.metricsService = metricsService;
    }

    /**
     * Query count, latency percentiles, intent and strategy distribution, fallback rate.
     */
    @GetMapping("/analytics/queries")
    public ResponseEntity<QueryAnalytics> getQueryAnalytics(
            @RequestParam(required = false) Integer hours) {
        int lookbackHours = hours != null ? hours : 24;  // Default: last 24 hours

        return ResponseEntity.ok(metricsService.getQueryAnalytics(lookbackHours));
    }

    @GetMapping("/health/summary")
    public ResponseEntity<HealthSummary> getHealthSummary() {
        return ResponseEntity.ok(metricsService.getHealthSummary());
    }

    // Data classes

    @Data
    public static class QueryAnalytics {
        private long totalQueries;
        private double averageLatencyMs;
        private double p50LatencyMs;
        private double p95LatencyMs;
        private double p99LatencyMs;
        private Map<String, Long> queriesByIntent;
        private Map<String, Long> queriesByStrategy;
        private Map<String, Double> averageLatencyByIntent;
        private long fallbackQueries;
        private double fallbackRate;
    }

    @Data
    public static class HealthSummary {
        private String overallStatus;
        private Map<String, String> componentStatus;
        private LocalDateTime lastCheck;
        private Map<String, Object> metrics;
    }
}
