package com.datalake.query;

import com.datalake.catalog.CatalogSnapshot;
import com.datalake.domain.CollectionInfo;
import com.datalake.domain.RecordBatch;
import com.datalake.domain.SourceFailure;
import com.datalake.domain.SourceKind;
import com.datalake.domain.SourceRef;
import com.datalake.domain.TableSchema;
import com.datalake.domain.Values;
import com.datalake.normalization.TimestampNormalizer;
import com.datalake.query.filter.FilterSpec;
import com.datalake.query.filter.InMemoryFilterTranslator;
import com.datalake.query.filter.SqlFilterTranslator;
import com.datalake.query.filter.SqlQuery;
import com.datalake.storage.file.PartitionHandle;
import com.datalake.storage.file.PartitionSource;
import com.datalake.storage.table.TableSource;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * QueryExecutor resolves a source against a catalog snapshot, loads it, normalizes
 * timestamps, applies the filter and sorts the result.
 *
 * File collections are read partition by partition in parallel and filtered in
 * memory after the merge; table queries push the filter down as parameterized SQL.
 *
 * Timeout behavior:
 * - every partition read and table query has its own timeout
 * - a timed-out or unreadable partition is skipped and reported on the outcome
 * - only a collection whose partitions all failed fails the query
 *
 * Parsed partitions are cached by path, size and modification time. Partition files
 * are immutable once written, so a changed file simply misses the cache.
 */
@Service
public class QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(QueryExecutor.class);

    private final PartitionSource partitionSource;
    private final TableSource tableSource;
    private final InMemoryFilterTranslator inMemoryTranslator;
    private final SqlFilterTranslator sqlTranslator;
    private final TimestampNormalizer normalizer;
    private final QueryMetrics metrics;
    private final Duration sourceTimeout;
    private final int maxConcurrentLoads;

    private final Cache<PartitionHandle, RecordBatch> partitionCache;

    public QueryExecutor(
            PartitionSource partitionSource,
            TableSource tableSource,
            InMemoryFilterTranslator inMemoryTranslator,
            SqlFilterTranslator sqlTranslator,
            TimestampNormalizer normalizer,
            QueryMetrics metrics,
            @Value("${datalake.query.source-timeout:30s}") Duration sourceTimeout,
            @Value("${datalake.query.max-concurrent-loads:8}") int maxConcurrentLoads,
            @Value("${datalake.query.cache-max-size:256}") long cacheMaxSize) {
        this.partitionSource = partitionSource;
        this.tableSource = tableSource;
        this.inMemoryTranslator = inMemoryTranslator;
        this.sqlTranslator = sqlTranslator;
        this.normalizer = normalizer;
        this.metrics = metrics;
        this.sourceTimeout = sourceTimeout;
        this.maxConcurrentLoads = Math.max(1, maxConcurrentLoads);

        this.partitionCache = Caffeine.newBuilder()
            .maximumSize(cacheMaxSize)
            .recordStats()
            .build();

        log.info("QueryExecutor initialized (sourceTimeout={}ms, maxConcurrentLoads={}, cacheMaxSize={})",
            sourceTimeout.toMillis(), this.maxConcurrentLoads, cacheMaxSize);
    }

    /**
     * Run one query against one source.
     *
     * @param snapshot catalog snapshot captured at the start of the request
     * @param ref      source identifier
     * @param spec     filter, may be null for no filtering
     * @param sort     sort order, null for event time descending
     * @return the filtered and sorted records; errors with {@link SourceNotFoundException},
     *         {@link NoReadableSourceException} or {@link BackendUnavailableException}
     */
    public Mono<QueryOutcome> execute(CatalogSnapshot snapshot, SourceRef ref, FilterSpec spec, SortField sort) {
        Optional<CollectionInfo> resolved = snapshot.resolve(ref);
        if (resolved.isEmpty()) {
            log.debug("Source {} not found in catalog version {}", ref, snapshot.getVersion());
            return Mono.error(ref == null
                ? new SourceNotFoundException(null)
                : new SourceNotFoundException(ref.getKind().orElse(null), ref.getName()));
        }

        CollectionInfo source = resolved.get();
        FilterSpec filters = spec == null ? FilterSpec.empty() : spec;
        SortField order = sort == null ? SortField.DEFAULT : sort;
        long startTime = System.nanoTime();
        log.debug("Executing query on {} with {} sorted by {}", source.getQualifiedName(), filters, order);

        Mono<QueryOutcome> outcome;
        if (source.getKind() == SourceKind.FILE) {
            outcome = loadCollection(source).flatMap(load -> {
                if (!load.isReadable()) {
                    return Mono.error(new NoReadableSourceException(
                        "No partition of collection " + source.getName() + " could be read", load.getFailures()));
                }
                RecordBatch filtered = load.getBatch().filter(inMemoryTranslator.compile(filters));
                return Mono.just(new QueryOutcome(source, filtered, load.getFailures()));
            });
        } else {
            outcome = queryTable(source, filters)
                .onErrorMap(error -> !(error instanceof DatalakeQueryException),
                    error -> new BackendUnavailableException(
                        "Relational query failed: " + describe(error), source.getName(), error))
                .map(batch -> new QueryOutcome(source, batch, List.of()));
        }

        return outcome
            .map(result -> new QueryOutcome(result.getSource(), sort(result.getBatch(), order), result.getFailures()))
            .doOnSuccess(result -> {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - startTime);
                metrics.recordQueryExecuted(elapsed, result.getBatch().size());
                if (result.isPartial()) {
                    log.warn("Query on {} completed with {} skipped partitions in {}ms",
                        source.getQualifiedName(), result.getFailures().size(), elapsed.toMillis());
                } else {
                    log.debug("Query on {} completed in {}ms with {} records",
                        source.getQualifiedName(), elapsed.toMillis(), result.getBatch().size());
                }
            })
            .doOnError(error -> {
                metrics.recordQueryFailed();
                log.error("Query on {} failed: {}", source.getQualifiedName(), error.getMessage());
            });
    }

    /**
     * Load every source of the snapshot, one task per collection or table, and merge
     * the results under the union schema. Per-source failures are collected, never thrown.
     */
    public Mono<MergedLoad> loadAll(CatalogSnapshot snapshot) {
        List<CollectionInfo> sources = snapshot.getCollections();
        if (sources.isEmpty()) {
            return Mono.just(new MergedLoad(RecordBatch.empty(), 0, 0, List.of()));
        }

        long startTime = System.nanoTime();
        return Flux.fromIterable(sources)
            .parallel(Math.min(sources.size(), maxConcurrentLoads))
            .runOn(Schedulers.boundedElastic())
            .flatMap(source -> source.getKind() == SourceKind.FILE ? loadCollection(source) : loadTable(source))
            .sequential()
            .collectList()
            .map(loads -> {
                // Completion order is arbitrary; merge in catalog order
                loads.sort(Comparator.comparing(SourceLoad::getSource, CollectionInfo.ORDER));
                List<RecordBatch> batches = new ArrayList<>();
                List<SourceFailure> failures = new ArrayList<>();
                int readable = 0;
                for (SourceLoad load : loads) {
                    batches.add(load.getBatch());
                    failures.addAll(load.getFailures());
                    if (load.isReadable()) {
                        readable++;
                    }
                }
                failures.sort(SourceFailure.ORDER);
                MergedLoad merged = new MergedLoad(RecordBatch.merge(batches), sources.size(), readable, failures);
                log.info("Loaded {} of {} sources ({} records, {} failures) in {}ms",
                    readable, sources.size(), merged.getBatch().size(), failures.size(),
                    Duration.ofNanos(System.nanoTime() - startTime).toMillis());
                return merged;
            });
    }

    /**
     * Drop every cached partition
     */
    public void invalidateCache() {
        partitionCache.invalidateAll();
        log.info("Partition cache invalidated");
    }

    long cachedPartitionCount() {
        partitionCache.cleanUp();
        return partitionCache.estimatedSize();
    }

    private Mono<SourceLoad> loadCollection(CollectionInfo source) {
        return Mono.fromCallable(() -> partitionSource.listPartitions(source.getName()))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(sourceTimeout)
            .flatMap(partitions -> readPartitions(source, partitions))
            .onErrorResume(error -> !(error instanceof DatalakeQueryException), error -> {
                boolean timedOut = error instanceof TimeoutException;
                log.warn("Could not list partitions of collection {}: {}", source.getName(), describe(error));
                metrics.recordSourceFailure(timedOut);
                return Mono.just(SourceLoad.failed(source,
                    new SourceFailure(SourceKind.FILE, source.getName(), null, describe(error), timedOut)));
            });
    }

    private Mono<SourceLoad> readPartitions(CollectionInfo source, List<PartitionHandle> partitions) {
        if (partitions.isEmpty()) {
            return Mono.just(new SourceLoad(source, RecordBatch.empty(), List.of(), true));
        }
        return Flux.fromIterable(partitions)
            .parallel(Math.min(partitions.size(), maxConcurrentLoads))
            .runOn(Schedulers.boundedElastic())
            .flatMap(this::readPartition)
            .sequential()
            .collectList()
            .map(reads -> {
                reads.sort(Comparator.comparing(read -> read.handle.getLocation()));
                List<RecordBatch> batches = new ArrayList<>();
                List<SourceFailure> failures = new ArrayList<>();
                for (PartitionRead read : reads) {
                    if (read.failure == null) {
                        batches.add(read.batch);
                    } else {
                        failures.add(read.failure);
                    }
                }
                failures.sort(SourceFailure.ORDER);
                return new SourceLoad(source, RecordBatch.merge(batches), failures, !batches.isEmpty());
            });
    }

    private Mono<PartitionRead> readPartition(PartitionHandle handle) {
        RecordBatch cached = partitionCache.getIfPresent(handle);
        if (cached != null) {
            metrics.recordCacheHit();
            return Mono.just(PartitionRead.ok(handle, cached));
        }
        metrics.recordCacheMiss();

        long startTime = System.nanoTime();
        return Mono.fromCallable(() -> {
                RecordBatch raw = partitionSource.readPartition(handle);
                return normalizer.normalize(raw == null ? RecordBatch.empty() : raw);
            })
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(sourceTimeout)
            .doOnNext(batch -> {
                partitionCache.put(handle, batch);
                metrics.recordSourceLoad(SourceKind.FILE, Duration.ofNanos(System.nanoTime() - startTime));
                log.debug("Partition {} loaded with {} records", handle, batch.size());
            })
            .map(batch -> PartitionRead.ok(handle, batch))
            .onErrorResume(TimeoutException.class, error -> {
                log.warn("Partition {} timed out after {}ms - skipping", handle, sourceTimeout.toMillis());
                metrics.recordSourceFailure(true);
                return Mono.just(PartitionRead.failed(handle, new SourceFailure(SourceKind.FILE,
                    handle.getCollection(), handle.getFileName(), "timed out", true)));
            })
            .onErrorResume(error -> {
                log.warn("Partition {} could not be read - skipping: {}", handle, describe(error));
                metrics.recordSourceFailure(false);
                return Mono.just(PartitionRead.failed(handle, new SourceFailure(SourceKind.FILE,
                    handle.getCollection(), handle.getFileName(), describe(error), false)));
            });
    }

    private Mono<RecordBatch> queryTable(CollectionInfo source, FilterSpec filters) {
        long startTime = System.nanoTime();
        return Mono.fromCallable(() -> {
                TableSchema schema = tableSource.describe(source.getName());
                SqlQuery query = sqlTranslator.translate(schema, filters);
                RecordBatch raw = tableSource.runQuery(query);
                return normalizer.normalize(raw == null ? RecordBatch.empty() : raw);
            })
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(sourceTimeout)
            .doOnNext(batch -> metrics.recordSourceLoad(SourceKind.TABLE,
                Duration.ofNanos(System.nanoTime() - startTime)))
            .doOnError(error -> {
                if (!(error instanceof DatalakeQueryException)) {
                    metrics.recordSourceFailure(error instanceof TimeoutException);
                }
            });
    }

    private Mono<SourceLoad> loadTable(CollectionInfo source) {
        return queryTable(source, FilterSpec.empty())
            .map(batch -> new SourceLoad(source, batch, List.of(), true))
            .onErrorResume(error -> {
                boolean timedOut = error instanceof TimeoutException;
                log.warn("Table {} could not be read - skipping: {}", source.getName(), describe(error));
                return Mono.just(SourceLoad.failed(source,
                    new SourceFailure(SourceKind.TABLE, source.getName(), null, describe(error), timedOut)));
            });
    }

    /**
     * Stable sort on one field, nulls last in both directions
     */
    static RecordBatch sort(RecordBatch batch, SortField order) {
        if (batch.size() < 2) {
            return batch;
        }
        String field = order.getField();
        boolean ascending = order.isAscending();
        List<Map<String, Object>> records = new ArrayList<>(batch.getRecords());
        records.sort((left, right) -> {
            Object a = left.get(field);
            Object b = right.get(field);
            if (a == null || b == null) {
                return a == null ? (b == null ? 0 : 1) : -1;
            }
            int result = Values.compare(a, b);
            return ascending ? result : -result;
        });
        return batch.withOrder(records);
    }

    private String describe(Throwable error) {
        if (error instanceof TimeoutException) {
            return "timed out after " + sourceTimeout.toMillis() + "ms";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static final class PartitionRead {
        private final PartitionHandle handle;
        private final RecordBatch batch;
        private final SourceFailure failure;

        private PartitionRead(PartitionHandle handle, RecordBatch batch, SourceFailure failure) {
            this.handle = handle;
            this.batch = batch;
            this.failure = failure;
        }

        static PartitionRead ok(PartitionHandle handle, RecordBatch batch) {
            return new PartitionRead(handle, batch, null);
        }

        static PartitionRead failed(PartitionHandle handle, SourceFailure failure) {
            return new PartitionRead(handle, null, failure);
        }
    }
}
