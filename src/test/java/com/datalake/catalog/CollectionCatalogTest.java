package com.datalake.catalog;

import com.datalake.domain.CollectionInfo;
import com.datalake.domain.RecordBatch;
import com.datalake.domain.SourceKind;
import com.datalake.query.NoReadableSourceException;
import com.datalake.query.QueryExecutor;
import com.datalake.query.QueryMetrics;
import com.datalake.query.QueryMetricsFixtures;
import com.datalake.query.QueryOutcome;
import com.datalake.storage.file.PartitionHandle;
import com.datalake.storage.file.PartitionSource;
import com.datalake.storage.table.TableSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CollectionCatalog Tests")
class CollectionCatalogTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private PartitionSource partitionSource;

    @Mock
    private TableSource tableSource;

    @Mock
    private QueryExecutor queryExecutor;

    private QueryMetrics metrics;

    @BeforeEach
    void setUp() {
        metrics = QueryMetricsFixtures.withSimpleRegistry();
    }

    private CollectionCatalog catalog(boolean relationalEnabled) {
        return new CollectionCatalog(partitionSource, tableSource, queryExecutor, metrics,
            Clock.fixed(NOW, ZoneOffset.UTC), relationalEnabled, "TRANSACTIONS_CLEANED", Duration.ofSeconds(5));
    }

    private static PartitionHandle partition(String collection, int n) {
        return new PartitionHandle(collection, "/lake/" + collection + "/" + collection + "_batch_" + n + ".parquet", 1, 1);
    }

    private void givenFileCollections() throws IOException {
        when(partitionSource.listCollections()).thenReturn(List.of("TEST_TOPIC_TRANSACTIONS", "TRANSACTIONS_CLEANED"));
        when(partitionSource.listPartitions("TEST_TOPIC_TRANSACTIONS")).thenReturn(List.of(partition("TEST_TOPIC_TRANSACTIONS", 1)));
        when(partitionSource.listPartitions("TRANSACTIONS_CLEANED")).thenReturn(
            List.of(partition("TRANSACTIONS_CLEANED", 1), partition("TRANSACTIONS_CLEANED", 2)));
    }

    @Test
    @DisplayName("Should catalog file collections by partition count and tables by row count")
    void shouldRefreshBothBackends() throws IOException {
        givenFileCollections();
        when(tableSource.listTables()).thenReturn(List.of("sql_transactions"));
        when(tableSource.countRows("sql_transactions")).thenReturn(1234L);

        CatalogSnapshot snapshot = catalog(true).refresh();

        assertThat(snapshot.getVersion()).isEqualTo(1L);
        assertThat(snapshot.getRefreshedAt()).isEqualTo(NOW);
        assertThat(snapshot.isRelationalAvailable()).isTrue();
        assertThat(snapshot.getCollections()).containsExactly(
            new CollectionInfo("TEST_TOPIC_TRANSACTIONS", SourceKind.FILE, 1),
            new CollectionInfo("TRANSACTIONS_CLEANED", SourceKind.FILE, 2),
            new CollectionInfo("sql_transactions", SourceKind.TABLE, 1234));
        assertThat(snapshot.getCollections().get(1).getItemCount()).isEqualTo(2);
        assertThat(snapshot.getCollections().get(2).getItemCount()).isEqualTo(1234);
    }

    @Test
    @DisplayName("Should degrade to file collections when the relational store is down")
    void shouldDegradeWhenRelationalStoreDown() throws IOException {
        givenFileCollections();
        when(tableSource.listTables()).thenThrow(new DataAccessResourceFailureException("connection refused"));

        CatalogSnapshot snapshot = catalog(true).refresh();

        assertThat(snapshot.isRelationalAvailable()).isFalse();
        assertThat(snapshot.getCollections()).extracting(CollectionInfo::getKind).containsOnly(SourceKind.FILE);
        assertThat(snapshot.getCollections()).hasSize(2);
        assertThat(metrics.getCatalogRefreshFailures().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should not touch the relational store when it is disabled")
    void shouldSkipDisabledRelationalStore() throws IOException {
        givenFileCollections();

        CatalogSnapshot snapshot = catalog(false).refresh();

        assertThat(snapshot.getCollections()).hasSize(2);
        assertThat(metrics.getCatalogRefreshFailures().count()).isZero();
        verifyNoInteractions(tableSource);
    }

    @Test
    @DisplayName("Should publish a new snapshot version on every refresh")
    void shouldVersionSnapshots() throws IOException {
        when(partitionSource.listCollections()).thenReturn(List.of());
        CollectionCatalog catalog = catalog(false);

        CatalogSnapshot first = catalog.snapshot();
        CatalogSnapshot cached = catalog.snapshot();
        CatalogSnapshot second = catalog.refresh();

        assertThat(cached).isSameAs(first);
        assertThat(second.getVersion()).isEqualTo(first.getVersion() + 1);
        assertThat(catalog.listCollections()).isEmpty();
    }

    @Test
    @DisplayName("Should keep the catalog when the data lake root cannot be listed")
    void shouldSurviveFileListingFailure() throws IOException {
        when(partitionSource.listCollections()).thenThrow(new IOException("permission denied"));
        when(tableSource.listTables()).thenReturn(List.of());

        CatalogSnapshot snapshot = catalog(true).refresh();

        assertThat(snapshot.getCollections()).isEmpty();
        assertThat(snapshot.isRelationalAvailable()).isTrue();
    }

    @Test
    @DisplayName("Should sample the vocabulary from the canonical collection once per snapshot")
    void shouldBuildVocabularyFromCanonicalCollection() throws IOException {
        givenFileCollections();
        CollectionCatalog catalog = catalog(false);
        CatalogSnapshot snapshot = catalog.refresh();
        RecordBatch sample = RecordBatch.of(List.of(
            row("purchase", "completed", 10.0, 5L),
            row("refund", "pending", 250.5, null),
            row("purchase", null, null, 2L)));
        CollectionInfo canonical = snapshot.getCollections().get(1);
        when(queryExecutor.execute(any(), any(), any(), any()))
            .thenReturn(Mono.just(new QueryOutcome(canonical, sample, List.of())));

        FilterVocabulary vocabulary = catalog.filterVocabulary(snapshot);
        FilterVocabulary again = catalog.filterVocabulary();

        assertThat(vocabulary.isFallback()).isFalse();
        assertThat(vocabulary.getSource()).isEqualTo("file:TRANSACTIONS_CLEANED");
        assertThat(vocabulary.getCategorical().get("TRANSACTION_TYPE")).containsExactly("purchase", "refund");
        assertThat(vocabulary.getCategorical().get("STATUS")).containsExactly("completed", "pending");
        assertThat(vocabulary.getCategorical()).doesNotContainKey("DEVICE_OS");
        assertThat(vocabulary.getNumeric().get("AMOUNT_USD")).isEqualTo(new FilterVocabulary.NumericRange(10.0, 250.5));
        assertThat(vocabulary.getNumeric().get("CUSTOMER_RATING")).isEqualTo(new FilterVocabulary.NumericRange(2.0, 5.0));
        assertThat(again).isSameAs(vocabulary);
        verify(queryExecutor, times(1)).execute(any(), any(), any(), any());
    }

    @Test
    @DisplayName("Should fall back to the static vocabulary when the canonical collection is missing")
    void shouldFallBackWhenCanonicalMissing() throws IOException {
        when(partitionSource.listCollections()).thenReturn(List.of());
        CollectionCatalog catalog = catalog(false);

        FilterVocabulary vocabulary = catalog.filterVocabulary();

        assertThat(vocabulary.isFallback()).isTrue();
        assertThat(vocabulary.getSource()).isNull();
        assertThat(vocabulary.getCategorical().get("TRANSACTION_TYPE")).contains("purchase", "payment");
        assertThat(vocabulary.getNumeric()).containsKey("AMOUNT_USD");
        verifyNoInteractions(queryExecutor);
    }

    @Test
    @DisplayName("Should fall back to the static vocabulary when the canonical collection is unreadable")
    void shouldFallBackWhenCanonicalUnreadable() throws IOException {
        givenFileCollections();
        CollectionCatalog catalog = catalog(false);
        when(queryExecutor.execute(any(), any(), any(), any()))
            .thenReturn(Mono.error(new NoReadableSourceException("nothing readable", List.of())));

        FilterVocabulary vocabulary = catalog.filterVocabulary();

        assertThat(vocabulary.isFallback()).isTrue();
        assertThat(vocabulary).isSameAs(catalog.getFallbackVocabulary());
    }

    @Test
    @DisplayName("Should cap categorical values per field")
    void shouldCapCategoricalValues() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 80; i++) {
            rows.add(row(String.format("type_%03d", i), "completed", (double) i, 1L));
        }

        FilterVocabulary vocabulary = CollectionCatalog.buildVocabulary(RecordBatch.of(rows), "file:TX");

        assertThat(vocabulary.getCategorical().get("TRANSACTION_TYPE"))
            .hasSize(CollectionCatalog.MAX_CATEGORICAL_VALUES)
            .startsWith("type_000", "type_001");
        assertThat(vocabulary.getNumeric().get("AMOUNT_USD")).isEqualTo(new FilterVocabulary.NumericRange(0.0, 79.0));
    }

    private static Map<String, Object> row(String type, String status, Double amount, Long rating) {
        Map<String, Object> row = new HashMap<>();
        row.put("TRANSACTION_TYPE", type);
        row.put("STATUS", status);
        row.put("AMOUNT_USD", amount);
        row.put("CUSTOMER_RATING", rating);
        return row;
    }
}
