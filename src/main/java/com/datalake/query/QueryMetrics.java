package com.datalake.query;

import com.datalake.domain.SourceKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics collector for the query layer.
 * Tracks query and aggregation counts, per-source load latency and failures,
 * result sizes, partition cache hit rates and catalog refreshes.
 */
@Component
public class QueryMetrics {

    @Autowired
    MeterRegistry meterRegistry;

    private Counter queriesExecuted;
    private Counter queriesFailed;
    private Counter aggregationsExecuted;
    private Counter fileSourceLoads;
    private Counter tableSourceLoads;
    private Counter sourceFailures;
    private Counter sourceTimeouts;
    private Timer queryExecutionLatency;
    private Timer fileSourceLatency;
    private Timer tableSourceLatency;
    private DistributionSummary resultSize;
    private Counter cacheHits;
    private Counter cacheMisses;
    private Counter catalogRefreshes;
    private Counter catalogRefreshFailures;

    @PostConstruct
    public void init() {
        queriesExecuted = Counter.builder("datalake.query.executed")
            .description("Total number of queries executed")
            .register(meterRegistry);

        queriesFailed = Counter.builder("datalake.query.failed")
            .description("Total number of queries that failed")
            .register(meterRegistry);

        aggregationsExecuted = Counter.builder("datalake.metrics.executed")
            .description("Total number of cross-source aggregations computed")
            .register(meterRegistry);

        fileSourceLoads = Counter.builder("datalake.source.loads")
            .description("Partition files loaded")
            .tag("kind", SourceKind.FILE.getValue())
            .register(meterRegistry);

        tableSourceLoads = Counter.builder("datalake.source.loads")
            .description("Relational table queries executed")
            .tag("kind", SourceKind.TABLE.getValue())
            .register(meterRegistry);

        sourceFailures = Counter.builder("datalake.source.failed")
            .description("Partitions or tables that could not be read")
            .register(meterRegistry);

        sourceTimeouts = Counter.builder("datalake.source.timedout")
            .description("Partitions or tables whose load timed out")
            .register(meterRegistry);

        // Timers with histogram support for percentile calculation
        queryExecutionLatency = Timer.builder("datalake.query.execution.latency")
            .description("Latency of overall query execution")
            .publishPercentiles(0.5, 0.95, 0.99)
            .publishPercentileHistogram()
            .minimumExpectedValue(Duration.ofMillis(1))
            .maximumExpectedValue(Duration.ofSeconds(35))
            .register(meterRegistry);

        fileSourceLatency = Timer.builder("datalake.source.latency")
            .description("Latency of reading one partition file")
            .tag("kind", SourceKind.FILE.getValue())
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);

        tableSourceLatency = Timer.builder("datalake.source.latency")
            .description("Latency of one relational table query")
            .tag("kind", SourceKind.TABLE.getValue())
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);

        resultSize = DistributionSummary.builder("datalake.query.result.size")
            .description("Distribution of filtered result sizes before pagination")
            .baseUnit("records")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);

        // Cache metrics
        cacheHits = Counter.builder("datalake.partition.cache.hits")
            .description("Partition reads served from the cache")
            .register(meterRegistry);

        cacheMisses = Counter.builder("datalake.partition.cache.misses")
            .description("Partition reads that went to storage")
            .register(meterRegistry);

        catalogRefreshes = Counter.builder("datalake.catalog.refreshes")
            .description("Completed catalog refreshes")
            .register(meterRegistry);

        catalogRefreshFailures = Counter.builder("datalake.catalog.relational.unavailable")
            .description("Catalog refreshes that fell back to file collections only")
            .register(meterRegistry);
    }

    public void recordQueryExecuted(Duration latency, long size) {
        queriesExecuted.increment();
        queryExecutionLatency.record(latency);
        resultSize.record(size);
    }

    public void recordQueryFailed() {
        queriesFailed.increment();
    }

    public void recordAggregationExecuted() {
        aggregationsExecuted.increment();
    }

    public void recordSourceLoad(SourceKind kind, Duration latency) {
        if (kind == SourceKind.FILE) {
            fileSourceLoads.increment();
            fileSourceLatency.record(latency);
        } else {
            tableSourceLoads.increment();
            tableSourceLatency.record(latency);
        }
    }

    public void recordSourceFailure(boolean timedOut) {
        sourceFailures.increment();
        if (timedOut) {
            sourceTimeouts.increment();
        }
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    public void recordCatalogRefresh(boolean relationalAvailable) {
        catalogRefreshes.increment();
        if (!relationalAvailable) {
            catalogRefreshFailures.increment();
        }
    }

    /**
     * Calculate cache hit rate as a percentage
     * @return cache hit rate (0-100) or 0 if no cache operations
     */
    public double getCacheHitRate() {
        double hits = cacheHits.count();
        double total = hits + cacheMisses.count();
        if (total == 0) {
            return 0.0;
        }
        return (hits / total) * 100.0;
    }

    // Getter methods for testing
    public Counter getQueriesExecuted() {
        return queriesExecuted;
    }

    public Counter getQueriesFailed() {
        return queriesFailed;
    }

    public Counter getAggregationsExecuted() {
        return aggregationsExecuted;
    }

    public Counter getFileSourceLoads() {
        return fileSourceLoads;
    }

    public Counter getTableSourceLoads() {
        return tableSourceLoads;
    }

    public Counter getSourceFailures() {
        return sourceFailures;
    }

    public Counter getSourceTimeouts() {
        return sourceTimeouts;
    }

    public Timer getQueryExecutionLatency() {
        return queryExecutionLatency;
    }

    public Timer getFileSourceLatency() {
        return fileSourceLatency;
    }

    public Timer getTableSourceLatency() {
        return tableSourceLatency;
    }

    public DistributionSummary getResultSize() {
        return resultSize;
    }

    public Counter getCacheHits() {
        return cacheHits;
    }

    public Counter getCacheMisses() {
        return cacheMisses;
    }

    public Counter getCatalogRefreshes() {
        return catalogRefreshes;
    }

    public Counter getCatalogRefreshFailures() {
        return catalogRefreshFailures;
    }
}
