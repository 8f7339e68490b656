package com.datalake.service;

import com.datalake.catalog.CatalogSnapshot;
import com.datalake.catalog.CollectionCatalog;
import com.datalake.catalog.FilterVocabulary;
import com.datalake.domain.PageResult;
import com.datalake.domain.SourceRef;
import com.datalake.metrics.MetricsEngine;
import com.datalake.metrics.ProductRanking;
import com.datalake.metrics.UserSpend;
import com.datalake.metrics.WindowedSpend;
import com.datalake.query.PageRequest;
import com.datalake.query.Paginator;
import com.datalake.query.QueryExecutor;
import com.datalake.query.QueryTimeoutException;
import com.datalake.query.SortField;
import com.datalake.query.SourceNotFoundException;
import com.datalake.query.filter.FilterSpec;
import com.datalake.query.filter.FilterSpecParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Entry point of the query layer for the API in front of it.
 *
 * Every request captures one catalog snapshot at its start and runs under the
 * request timeout. Callers get either a well-formed result or a single
 * {@link com.datalake.query.DatalakeQueryException}.
 */
@Service
public class TransactionQueryService {

    private static final Logger log = LoggerFactory.getLogger(TransactionQueryService.class);

    public static final String PAGE_PARAMETER = "page";
    public static final String PAGE_SIZE_PARAMETER = "page_size";
    public static final String SORT_PARAMETER = "sort";

    private final CollectionCatalog catalog;
    private final QueryExecutor queryExecutor;
    private final FilterSpecParser filterSpecParser;
    private final Paginator paginator;
    private final MetricsEngine metricsEngine;
    private final Duration requestTimeout;

    public TransactionQueryService(
            CollectionCatalog catalog,
            QueryExecutor queryExecutor,
            FilterSpecParser filterSpecParser,
            Paginator paginator,
            MetricsEngine metricsEngine,
            @Value("${datalake.query.request-timeout:35s}") Duration requestTimeout) {
        this.catalog = catalog;
        this.queryExecutor = queryExecutor;
        this.filterSpecParser = filterSpecParser;
        this.paginator = paginator;
        this.metricsEngine = metricsEngine;
        this.requestTimeout = requestTimeout;
    }

    public CatalogSnapshot listSources() {
        return catalog.snapshot();
    }

    public FilterVocabulary filterVocabulary() {
        return catalog.filterVocabulary();
    }

    public CatalogSnapshot refreshCatalog() {
        return catalog.refresh();
    }

    /**
     * Query with raw request parameters: filters plus {@code page}, {@code page_size}
     * and {@code sort} ({@code FIELD} ascending, {@code -FIELD} descending).
     */
    public Mono<PageResult> query(String source, Map<String, String> parameters) {
        Map<String, String> params = parameters == null ? Map.of() : parameters;
        PageRequest page;
        try {
            page = paginator.request(params.get(PAGE_PARAMETER), params.get(PAGE_SIZE_PARAMETER));
        } catch (RuntimeException e) {
            return Mono.error(e);
        }
        return query(source, filterSpecParser.parse(params), page, SortField.parse(params.get(SORT_PARAMETER)));
    }

    public Mono<PageResult> query(String source, Map<String, String> filters, PageRequest page) {
        return query(source, filterSpecParser.parse(filters), page, null);
    }

    public Mono<PageResult> query(String source, FilterSpec filterSpec, PageRequest page) {
        return query(source, filterSpec, page, null);
    }

    /**
     * Filter, sort and paginate one source.
     *
     * @param sort null for event time descending
     */
    public Mono<PageResult> query(String source, FilterSpec filterSpec, PageRequest page, SortField sort) {
        Optional<SourceRef> ref = SourceRef.parse(source);
        if (ref.isEmpty()) {
            return Mono.error(new SourceNotFoundException(source));
        }
        CatalogSnapshot snapshot = catalog.snapshot();
        log.debug("Query {} page {} against catalog version {}", ref.get(), page, snapshot.getVersion());

        return withDeadline("Query on " + source, queryExecutor.execute(snapshot, ref.get(), filterSpec, sort)
            .map(outcome -> {
                PageResult result = paginator.paginate(outcome.getBatch().getRecords(), page);
                result.setSource(outcome.getSource().getQualifiedName());
                result.setPartialResults(outcome.isPartial());
                result.setFailedSources(outcome.getFailures());
                return result;
            }));
    }

    public Mono<WindowedSpend> recentSpend(int windowMinutes) {
        return withDeadline("Recent spend", metricsEngine.recentSpend(catalog.snapshot(), windowMinutes));
    }

    public Mono<List<UserSpend>> userSpend() {
        return withDeadline("User spend", metricsEngine.userSpend(catalog.snapshot()));
    }

    public Mono<List<ProductRanking>> topProducts() {
        return withDeadline("Top products", metricsEngine.topProducts(catalog.snapshot()));
    }

    public Mono<List<ProductRanking>> topProducts(int k) {
        return withDeadline("Top products", metricsEngine.topProducts(catalog.snapshot(), k));
    }

    private <T> Mono<T> withDeadline(String operation, Mono<T> request) {
        return request
            .timeout(requestTimeout)
            .onErrorMap(TimeoutException.class, e -> {
                log.error("{} exceeded the request timeout of {}ms", operation, requestTimeout.toMillis());
                return new QueryTimeoutException(operation, requestTimeout, e);
            });
    }
}
