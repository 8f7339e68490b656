package com.datalake.service;

import com.datalake.catalog.CatalogSnapshot;
import com.datalake.catalog.CollectionCatalog;
import com.datalake.catalog.FilterVocabulary;
import com.datalake.domain.PageResult;
import com.datalake.metrics.MetricsEngine;
import com.datalake.metrics.ProductRanking;
import com.datalake.metrics.UserSpend;
import com.datalake.normalization.TimestampNormalizer;
import com.datalake.query.Paginator;
import com.datalake.query.QueryExecutor;
import com.datalake.query.QueryMetrics;
import com.datalake.query.QueryMetricsFixtures;
import com.datalake.query.QueryValidationException;
import com.datalake.query.SourceNotFoundException;
import com.datalake.query.filter.FilterSpecParser;
import com.datalake.query.filter.InMemoryFilterTranslator;
import com.datalake.query.filter.SqlFilterTranslator;
import com.datalake.storage.file.ParquetFixtures;
import com.datalake.storage.file.ParquetPartitionSource;
import com.datalake.storage.table.TableSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.datalake.storage.file.ParquetFixtures.transaction;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * End-to-end tests over Parquet partitions written to a temporary data lake,
 * with the relational store disabled
 */
@DisplayName("TransactionQueryService Tests")
class TransactionQueryServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 12, 0);
    private static final String COLLECTION = "TRANSACTIONS_CLEANED";

    @TempDir
    Path root;

    private TableSource tableSource;
    private TransactionQueryService service;

    @BeforeEach
    void setUp() throws Exception {
        ParquetFixtures.writeBatch(root, COLLECTION, 1, List.of(
            transaction("t1", NOW.minusMinutes(2), "u1", "P1", 10.0, "purchase", 5L, 4L),
            transaction("t2", NOW.minusHours(1), "u2", "P2", 7.0, "purchase", 9L, null)));
        ParquetFixtures.writeBatch(root, COLLECTION, 2, List.of(
            transaction("t3", NOW.minusMinutes(1), "u1", "P3", 5.0, "refund", 1L, 2L),
            transaction("t4", NOW.minusMinutes(10), "u3", "P3", 20.0, "payment", 1L, 5L)));
        ParquetFixtures.writeCorruptBatch(root, COLLECTION, 3);

        QueryMetrics metrics = QueryMetricsFixtures.withSimpleRegistry();
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        Duration timeout = Duration.ofSeconds(30);

        ParquetPartitionSource partitionSource = new ParquetPartitionSource(root.toString());
        tableSource = mock(TableSource.class);
        QueryExecutor executor = new QueryExecutor(partitionSource, tableSource, new InMemoryFilterTranslator(),
            new SqlFilterTranslator(), new TimestampNormalizer(), metrics, timeout, 4, 64);
        CollectionCatalog catalog = new CollectionCatalog(partitionSource, tableSource, executor, metrics, clock,
            false, COLLECTION, timeout);
        service = new TransactionQueryService(catalog, executor, new FilterSpecParser(), new Paginator(10, 10),
            new MetricsEngine(executor, metrics, clock), timeout);
    }

    private static Map<String, String> params(String... pairs) {
        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            params.put(pairs[i], pairs[i + 1]);
        }
        return params;
    }

    @Test
    @DisplayName("Should list file collections with partition counts")
    void shouldListSources() {
        CatalogSnapshot snapshot = service.listSources();

        assertThat(snapshot.isRelationalAvailable()).isFalse();
        assertThat(snapshot.getCollections()).singleElement().satisfies(info -> {
            assertThat(info.getQualifiedName()).isEqualTo("file:" + COLLECTION);
            assertThat(info.getItemCount()).isEqualTo(3);
        });
        verifyNoInteractions(tableSource);
    }

    @Test
    @DisplayName("Should skip a malformed partition and still return the other partitions' records")
    void shouldSkipMalformedPartition() {
        StepVerifier.create(service.query(COLLECTION, params("transaction_type", "purchase,payment")))
            .assertNext(result -> {
                assertThat(result.getSource()).isEqualTo("file:" + COLLECTION);
                assertThat(result.getItems()).extracting(item -> item.get("TRANSACTION_ID"))
                    .containsExactly("t1", "t4", "t2");
                assertThat(result.isPartialResults()).isTrue();
                assertThat(result.getFailedSources()).singleElement().satisfies(failure ->
                    assertThat(failure.getItem()).isEqualTo(COLLECTION + "_batch_3_20240501_120000.parquet"));
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("Should never match a null rating")
    void shouldExcludeNullRatings() {
        StepVerifier.create(service.query(COLLECTION, params("rating_gt", "3")))
            .assertNext(result -> assertThat(result.getItems()).extracting(item -> item.get("TRANSACTION_ID"))
                .containsExactly("t1", "t4"))
            .verifyComplete();
    }

    @Test
    @DisplayName("Should sort by the requested field")
    void shouldSortByRequestedField() {
        StepVerifier.create(service.query("file:" + COLLECTION, params("sort", "AMOUNT_USD")))
            .assertNext(result -> assertThat(result.getItems()).extracting(item -> item.get("TRANSACTION_ID"))
                .containsExactly("t3", "t2", "t1", "t4"))
            .verifyComplete();
    }

    @Test
    @DisplayName("Should return an empty page past the end")
    void shouldReturnEmptyPagePastTheEnd() {
        StepVerifier.create(service.query(COLLECTION, params("page", "5", "page_size", "2")))
            .assertNext(result -> {
                assertThat(result.getItems()).isEmpty();
                assertThat(result.getTotalCount()).isEqualTo(4);
                assertThat(result.getTotalPages()).isEqualTo(2);
                assertThat(result.getPageSize()).isEqualTo(2);
                assertThat(result.getOffset()).isEqualTo(8);
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("Should produce byte-identical results for repeated queries")
    void shouldBeIdempotent() throws Exception {
        ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        Map<String, String> request = params("transaction_type", "purchase", "page_size", "1");

        PageResult first = service.query(COLLECTION, request).block();
        PageResult second = service.query(COLLECTION, request).block();

        assertThat(mapper.writeValueAsString(second)).isEqualTo(mapper.writeValueAsString(first));
        assertThat(mapper.writeValueAsString(first)).contains("\"next_page\":2").contains("\"previous_page\":null");
    }

    @Test
    @DisplayName("Should reject unknown sources and invalid pages")
    void shouldRejectInvalidRequests() {
        StepVerifier.create(service.query("MISSING", params()))
            .expectError(SourceNotFoundException.class)
            .verify();
        StepVerifier.create(service.query("", params()))
            .expectError(SourceNotFoundException.class)
            .verify();
        StepVerifier.create(service.query(COLLECTION, params("page", "0")))
            .expectError(QueryValidationException.class)
            .verify();
    }

    @Test
    @DisplayName("Should compute the aggregates across sources")
    void shouldComputeAggregates() {
        StepVerifier.create(service.topProducts(3))
            .assertNext(ranking -> assertThat(ranking).extracting(ProductRanking::getProductId)
                .containsExactly("P2", "P1"))
            .verifyComplete();

        StepVerifier.create(service.recentSpend(5))
            .assertNext(spend -> {
                assertThat(spend.getTotal()).isEqualByComparingTo("10.00");
                assertThat(spend.getCount()).isEqualTo(1);
            })
            .verifyComplete();

        StepVerifier.create(service.userSpend())
            .assertNext(users -> assertThat(users).extracting(UserSpend::getUserId)
                .containsExactly("u3", "u1", "u2"))
            .verifyComplete();
    }

    @Test
    @DisplayName("Should sample the filter vocabulary from the canonical collection")
    void shouldSampleFilterVocabulary() {
        FilterVocabulary vocabulary = service.filterVocabulary();

        assertThat(vocabulary.isFallback()).isFalse();
        assertThat(vocabulary.getCategorical().get("TRANSACTION_TYPE"))
            .containsExactly("payment", "purchase", "refund");
        assertThat(vocabulary.getNumeric().get("AMOUNT_USD").getMax()).isEqualTo(20.0);
    }
}
