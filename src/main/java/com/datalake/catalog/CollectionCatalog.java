package com.datalake.catalog;

import com.datalake.domain.CollectionInfo;
import com.datalake.domain.RecordBatch;
import com.datalake.domain.SourceKind;
import com.datalake.domain.SourceRef;
import com.datalake.domain.TransactionFields;
import com.datalake.domain.Values;
import com.datalake.query.DatalakeQueryException;
import com.datalake.query.QueryExecutor;
import com.datalake.query.QueryMetrics;
import com.datalake.query.QueryOutcome;
import com.datalake.query.QueryTimeoutException;
import com.datalake.query.filter.FilterSpec;
import com.datalake.storage.file.PartitionSource;
import com.datalake.storage.table.TableSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Enumerates the file collections and relational tables of the data lake.
 *
 * Refresh is explicit and runs once when the application is ready. Each refresh
 * publishes a new immutable {@link CatalogSnapshot}; requests capture the current
 * one at their start, so a concurrent refresh never changes an in-flight request.
 *
 * When the relational store cannot be reached the snapshot holds file collections
 * only and is flagged as such.
 */
@Component
public class CollectionCatalog {

    private static final Logger log = LoggerFactory.getLogger(CollectionCatalog.class);

    static final String FALLBACK_VOCABULARY_RESOURCE = "/filter-vocabulary-fallback.json";
    static final int MAX_CATEGORICAL_VALUES = 50;
    static final int MAX_SAMPLE_RECORDS = 10_000;

    static final List<String> CATEGORICAL_FIELDS = List.of(
        TransactionFields.TRANSACTION_TYPE,
        TransactionFields.STATUS,
        TransactionFields.PAYMENT_METHOD,
        TransactionFields.PRODUCT_CATEGORY,
        TransactionFields.CURRENCY,
        TransactionFields.LOCATION_COUNTRY,
        TransactionFields.LOCATION_CITY,
        TransactionFields.DEVICE_OS);

    static final List<String> NUMERIC_FIELDS = List.of(
        TransactionFields.AMOUNT_USD,
        TransactionFields.CUSTOMER_RATING,
        TransactionFields.QUANTITY,
        TransactionFields.TAX_AMOUNT);

    private final PartitionSource partitionSource;
    private final TableSource tableSource;
    private final QueryExecutor queryExecutor;
    private final QueryMetrics metrics;
    private final Clock clock;
    private final boolean relationalEnabled;
    private final String canonicalCollection;
    private final Duration samplingTimeout;

    private final AtomicReference<CatalogSnapshot> current = new AtomicReference<>();
    private final AtomicLong versions = new AtomicLong();
    private final Cache<Long, FilterVocabulary> vocabularyCache;
    private final FilterVocabulary fallbackVocabulary;

    public CollectionCatalog(
            PartitionSource partitionSource,
            TableSource tableSource,
            QueryExecutor queryExecutor,
            QueryMetrics metrics,
            Clock clock,
            @Value("${datalake.storage.relational.enabled:true}") boolean relationalEnabled,
            @Value("${datalake.catalog.canonical-collection:TRANSACTIONS_CLEANED}") String canonicalCollection,
            @Value("${datalake.query.request-timeout:35s}") Duration samplingTimeout) {
        this.partitionSource = partitionSource;
        this.tableSource = tableSource;
        this.queryExecutor = queryExecutor;
        this.metrics = metrics;
        this.clock = clock;
        this.relationalEnabled = relationalEnabled;
        this.canonicalCollection = canonicalCollection;
        this.samplingTimeout = samplingTimeout;
        this.vocabularyCache = Caffeine.newBuilder()
            .maximumSize(4)
            .build();
        this.fallbackVocabulary = loadFallbackVocabulary(new ObjectMapper());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        CatalogSnapshot snapshot = refresh();
        log.info("Initial catalog: {} file collections, {} tables (relational available: {})",
            snapshot.getCollections(SourceKind.FILE).size(),
            snapshot.getCollections(SourceKind.TABLE).size(),
            snapshot.isRelationalAvailable());
    }

    /**
     * Re-scan both backends and publish a new snapshot
     */
    public synchronized CatalogSnapshot refresh() {
        long startTime = System.currentTimeMillis();
        List<CollectionInfo> collections = new ArrayList<>(listFileCollections());

        boolean relationalAvailable = false;
        if (relationalEnabled) {
            try {
                collections.addAll(listTableCollections());
                relationalAvailable = true;
            } catch (RuntimeException e) {
                log.error("Relational store unavailable, catalog degraded to file collections: {}", e.getMessage());
            }
        } else {
            log.debug("Relational store disabled, cataloging file collections only");
        }

        CatalogSnapshot snapshot = new CatalogSnapshot(versions.incrementAndGet(), clock.instant(),
            relationalAvailable, collections);
        current.set(snapshot);
        metrics.recordCatalogRefresh(relationalAvailable || !relationalEnabled);
        log.info("Catalog refreshed to version {} with {} sources in {}ms",
            snapshot.getVersion(), snapshot.getCollections().size(), System.currentTimeMillis() - startTime);
        return snapshot;
    }

    /**
     * Current snapshot, refreshing once if none was taken yet
     */
    public CatalogSnapshot snapshot() {
        CatalogSnapshot snapshot = current.get();
        return snapshot != null ? snapshot : refresh();
    }

    /**
     * All sources of the current snapshot, sorted by kind then name
     */
    public List<CollectionInfo> listCollections() {
        return snapshot().getCollections();
    }

    public FilterVocabulary filterVocabulary() {
        return filterVocabulary(snapshot());
    }

    /**
     * Filter options sampled from the canonical collection, or the static fallback
     * when it is missing or unreadable. Computed once per snapshot.
     */
    public FilterVocabulary filterVocabulary(CatalogSnapshot snapshot) {
        return vocabularyCache.get(snapshot.getVersion(), version -> sampleVocabulary(snapshot));
    }

    public FilterVocabulary getFallbackVocabulary() {
        return fallbackVocabulary;
    }

    private List<CollectionInfo> listFileCollections() {
        List<CollectionInfo> collections = new ArrayList<>();
        List<String> names;
        try {
            names = partitionSource.listCollections();
        } catch (IOException e) {
            log.error("Could not list file collections: {}", e.getMessage(), e);
            return collections;
        }
        for (String name : names) {
            try {
                collections.add(new CollectionInfo(name, SourceKind.FILE, partitionSource.listPartitions(name).size()));
            } catch (IOException e) {
                log.warn("Skipping file collection {}: {}", name, e.getMessage());
            }
        }
        return collections;
    }

    private List<CollectionInfo> listTableCollections() {
        List<CollectionInfo> collections = new ArrayList<>();
        for (String table : tableSource.listTables()) {
            try {
                collections.add(new CollectionInfo(table, SourceKind.TABLE, tableSource.countRows(table)));
            } catch (DatalakeQueryException e) {
                log.warn("Skipping table {}: {}", table, e.getMessage());
            }
        }
        return collections;
    }

    private FilterVocabulary sampleVocabulary(CatalogSnapshot snapshot) {
        Optional<SourceRef> ref = SourceRef.parse(canonicalCollection);
        if (ref.isEmpty() || snapshot.resolve(ref.get()).isEmpty()) {
            log.info("Canonical collection {} not cataloged, using fallback filter vocabulary", canonicalCollection);
            return fallbackVocabulary;
        }
        String source = snapshot.resolve(ref.get()).get().getQualifiedName();
        try {
            QueryOutcome outcome = queryExecutor.execute(snapshot, ref.get(), FilterSpec.empty(), null)
                .timeout(samplingTimeout)
                .onErrorMap(TimeoutException.class,
                    e -> new QueryTimeoutException("Filter vocabulary sampling", samplingTimeout, e))
                .block();
            if (outcome == null || outcome.getBatch().isEmpty()) {
                log.info("Canonical collection {} is empty, using fallback filter vocabulary", source);
                return fallbackVocabulary;
            }
            return buildVocabulary(outcome.getBatch(), source);
        } catch (DatalakeQueryException e) {
            log.warn("Canonical collection {} unreadable, using fallback filter vocabulary: {}",
                source, e.getMessage());
            return fallbackVocabulary;
        }
    }

    /**
     * Distinct sorted values of categorical fields and ranges of numeric fields,
     * over the first records of the batch. Fields the batch lacks are left out.
     */
    static FilterVocabulary buildVocabulary(RecordBatch batch, String source) {
        List<Map<String, Object>> sample = batch.getRecords()
            .subList(0, Math.min(batch.size(), MAX_SAMPLE_RECORDS));

        Map<String, List<String>> categorical = new LinkedHashMap<>();
        for (String field : CATEGORICAL_FIELDS) {
            if (!batch.getSchema().contains(field)) {
                continue;
            }
            TreeSet<String> values = new TreeSet<>();
            for (Map<String, Object> record : sample) {
                Object value = record.get(field);
                if (value != null) {
                    values.add(Values.asKey(value));
                }
            }
            List<String> limited = new ArrayList<>(values);
            categorical.put(field, List.copyOf(limited.subList(0, Math.min(limited.size(), MAX_CATEGORICAL_VALUES))));
        }

        Map<String, FilterVocabulary.NumericRange> numeric = new LinkedHashMap<>();
        for (String field : NUMERIC_FIELDS) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (Map<String, Object> record : sample) {
                Optional<Double> value = Values.asDouble(record.get(field));
                if (value.isPresent()) {
                    min = Math.min(min, value.get());
                    max = Math.max(max, value.get());
                }
            }
            if (min <= max) {
                numeric.put(field, new FilterVocabulary.NumericRange(min, max));
            }
        }
        return new FilterVocabulary(categorical, numeric, source, false);
    }

    private static FilterVocabulary loadFallbackVocabulary(ObjectMapper objectMapper) {
        try (InputStream in = CollectionCatalog.class.getResourceAsStream(FALLBACK_VOCABULARY_RESOURCE)) {
            if (in == null) {
                log.warn("Fallback filter vocabulary {} not on classpath", FALLBACK_VOCABULARY_RESOURCE);
                return new FilterVocabulary(Map.of(), Map.of(), null, true);
            }
            return objectMapper.readValue(in, FilterVocabulary.class).asFallback();
        } catch (IOException e) {
            throw new UncheckedIOException("Unreadable fallback filter vocabulary " + FALLBACK_VOCABULARY_RESOURCE, e);
        }
    }
}
