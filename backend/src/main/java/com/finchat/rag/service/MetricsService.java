package com.finchat.rag.service;

import com.finchat.rag.client.LmStudioClient;
import com.finchat.rag.controller.MonitoringController;
import com.finchat.rag.model.ResponseStrategy;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory query metrics: which intent and strategy answered, whether a fallback was needed, latency.
 * Keeps the most recent {@value #MAX_METRICS} queries for analytics; counters cover the whole uptime.
 */
@Service
@Slf4j
public class MetricsService {

    static final int MAX_METRICS = 1000;

    private final Deque<QueryMetric> queryMetrics = new ConcurrentLinkedDeque<>();

    private final AtomicLong totalQueries = new AtomicLong(0);
    private final AtomicLong fallbackQueries = new AtomicLong(0);

    private final Clock clock;
    private final CorpusIndexHolder indexHolder;
    private final LmStudioClient lmStudioClient;

    public MetricsService(Clock clock, CorpusIndexHolder indexHolder, LmStudioClient lmStudioClient) {
        this.clock = clock;
        this.indexHolder = indexHolder;
        this.lmStudioClient = lmStudioClient;
    }

    public void recordQuery(String requestId, String intent, ResponseStrategy strategy,
                            boolean fallbackUsed, long latencyMs) {
        queryMetrics.addLast(new QueryMetric(requestId, intent, strategy, fallbackUsed, latencyMs,
                LocalDateTime.now(clock)));

        totalQueries.incrementAndGet();
        if (fallbackUsed) {
            fallbackQueries.incrementAndGet();
        }

        while (queryMetrics.size() > MAX_METRICS) {
            queryMetrics.pollFirst();
        }
        log.debug("Recorded query {}: intent={}, strategy={}, fallback={}, {}ms",
                requestId, intent, strategy, fallbackUsed, latencyMs);
    }

    /**
     * Get query analytics for the last N hours
     */
    public MonitoringController.QueryAnalytics getQueryAnalytics(int lookbackHours) {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusHours(lookbackHours);

        List<QueryMetric> recentMetrics = queryMetrics.stream()
            .filter(m -> !m.getTimestamp().isBefore(cutoff))
            .collect(Collectors.toList());

        MonitoringController.QueryAnalytics analytics = new MonitoringController.QueryAnalytics();
        analytics.setTotalQueries(recentMetrics.size());
        if (recentMetrics.isEmpty()) {
            analytics.setQueriesByIntent(Collections.emptyMap());
            analytics.setQueriesByStrategy(Collections.emptyMap());
            analytics.setAverageLatencyByIntent(Collections.emptyMap());
            return analytics;
        }

        List<Long> latencies = recentMetrics.stream()
            .map(QueryMetric::getLatencyMs)
            .sorted()
            .collect(Collectors.toList());

        analytics.setAverageLatencyMs(latencies.stream().mapToLong(Long::longValue).average().orElse(0.0));
        analytics.setP50LatencyMs(percentile(latencies, 0.50));
        analytics.setP95LatencyMs(percentile(latencies, 0.95));
        analytics.setP99LatencyMs(percentile(latencies, 0.99));

        analytics.setQueriesByIntent(recentMetrics.stream()
            .collect(Collectors.groupingBy(QueryMetric::getIntent, TreeMap::new, Collectors.counting())));
        analytics.setQueriesByStrategy(recentMetrics.stream()
            .collect(Collectors.groupingBy(m -> m.getStrategy().name(), TreeMap::new, Collectors.counting())));
        analytics.setAverageLatencyByIntent(recentMetrics.stream()
            .collect(Collectors.groupingBy(QueryMetric::getIntent, TreeMap::new,
                Collectors.averagingLong(QueryMetric::getLatencyMs))));

        long fallbacks = recentMetrics.stream().filter(QueryMetric::isFallbackUsed).count();
        analytics.setFallbackQueries(fallbacks);
        analytics.setFallbackRate((double) fallbacks / recentMetrics.size());

        return analytics;
    }

    /**
     * Get health summary
     */
    public MonitoringController.HealthSummary getHealthSummary() {
        MonitoringController.HealthSummary summary = new MonitoringController.HealthSummary();

        CorpusIndex index = indexHolder.get();
        boolean llmUp = lmStudioClient.checkHealth();

        Map<String, String> componentStatus = new LinkedHashMap<>();
        componentStatus.put("backend", "UP");
        componentStatus.put("llm_api", llmUp ? "UP" : "DOWN");
        componentStatus.put("corpus_index", index.isEmpty() ? "EMPTY"
                : (index.hasEmbeddings() ? "SEMANTIC" : "LEXICAL_ONLY"));

        summary.setComponentStatus(componentStatus);
        // answers still flow through the fallback tiers without the model
        summary.setOverallStatus(llmUp && !index.isEmpty() ? "UP" : "DEGRADED");
        summary.setLastCheck(LocalDateTime.now(clock));

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("total_queries", totalQueries.get());
        metrics.put("fallback_queries", fallbackQueries.get());
        metrics.put("fallback_rate", totalQueries.get() > 0 ?
            (double) fallbackQueries.get() / totalQueries.get() : 0.0);
        metrics.put("indexed_chunks", index.size());

        summary.setMetrics(metrics);

        return summary;
    }

    private double percentile(List<Long> values, double percentile) {
        if (values.isEmpty()) return 0.0;
        int index = (int) Math.ceil(percentile * values.size()) - 1;
        index = Math.max(0, Math.min(index, values.size() - 1));
        return values.get(index);
    }

    @Value
    private static class QueryMetric {
        String requestId;
        String intent;
        ResponseStrategy strategy;
        boolean fallbackUsed;
        long latencyMs;
        LocalDateTime timestamp;
    }
}
