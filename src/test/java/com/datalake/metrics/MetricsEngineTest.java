package com.datalake.metrics;

import com.datalake.catalog.CatalogSnapshot;
import com.datalake.domain.RecordBatch;
import com.datalake.domain.SourceFailure;
import com.datalake.domain.SourceKind;
import com.datalake.query.MergedLoad;
import com.datalake.query.NoReadableSourceException;
import com.datalake.query.QueryExecutor;
import com.datalake.query.QueryMetrics;
import com.datalake.query.QueryMetricsFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MetricsEngine Tests")
class MetricsEngineTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 12, 0);

    @Mock
    private QueryExecutor queryExecutor;

    private QueryMetrics metrics;
    private MetricsEngine engine;
    private final CatalogSnapshot snapshot = CatalogSnapshot.empty();

    @BeforeEach
    void setUp() {
        metrics = QueryMetricsFixtures.withSimpleRegistry();
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        engine = new MetricsEngine(queryExecutor, metrics, clock);
    }

    private void givenRecords(List<Map<String, Object>> records) {
        when(queryExecutor.loadAll(any())).thenReturn(
            Mono.just(new MergedLoad(RecordBatch.of(records), 1, 1, List.of())));
    }

    private static Map<String, Object> record(Object... pairs) {
        Map<String, Object> record = new HashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            record.put((String) pairs[i], pairs[i + 1]);
        }
        return record;
    }

    // ========== Top products ==========

    @Test
    @DisplayName("Should rank purchased products by quantity and skip other types")
    void shouldRankTopProductsByQuantity() {
        givenRecords(List.of(
            record("PRODUCT_ID", "P1", "TRANSACTION_TYPE", "purchase", "QUANTITY", 5L),
            record("PRODUCT_ID", "P2", "TRANSACTION_TYPE", "purchase", "QUANTITY", 9L),
            record("PRODUCT_ID", "P3", "TRANSACTION_TYPE", "purchase", "QUANTITY", 1L),
            record("PRODUCT_ID", "P4", "TRANSACTION_TYPE", "sale", "QUANTITY", 100L)));

        StepVerifier.create(engine.topProducts(snapshot, 3))
            .assertNext(ranking -> {
                assertThat(ranking).extracting(ProductRanking::getProductId).containsExactly("P2", "P1", "P3");
                assertThat(ranking).extracting(ProductRanking::getValue)
                    .containsExactly(new BigDecimal("9"), new BigDecimal("5"), new BigDecimal("1"));
                assertThat(ranking).extracting(ProductRanking::getRank).containsExactly(1, 2, 3);
                assertThat(ranking.get(0).getMetric()).isEqualTo(RankingMetric.QUANTITY);
            })
            .verifyComplete();

        assertThat(metrics.getAggregationsExecuted().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should break ranking ties by product id and clamp k to one")
    void shouldBreakTiesByProductId() {
        givenRecords(List.of(
            record("PRODUCT_ID", "P9", "TRANSACTION_TYPE", "purchase", "QUANTITY", 2L),
            record("PRODUCT_ID", "P1", "TRANSACTION_TYPE", "purchase", "QUANTITY", 2L)));

        StepVerifier.create(engine.topProducts(snapshot, 0))
            .assertNext(ranking -> assertThat(ranking).extracting(ProductRanking::getProductId).containsExactly("P1"))
            .verifyComplete();
    }

    @Test
    @DisplayName("Should rank by amount when there is no quantity field")
    void shouldRankByAmountWithoutQuantity() {
        givenRecords(List.of(
            record("PRODUCT_ID", "P1", "TRANSACTION_TYPE", "purchase", "AMOUNT_USD", 10.005),
            record("PRODUCT_ID", "P2", "TRANSACTION_TYPE", "purchase", "AMOUNT_USD", 4.0),
            record("PRODUCT_ID", "P2", "TRANSACTION_TYPE", "purchase", "AMOUNT_USD", 3.0)));

        StepVerifier.create(engine.topProducts(snapshot))
            .assertNext(ranking -> {
                assertThat(ranking.get(0).getMetric()).isEqualTo(RankingMetric.AMOUNT);
                assertThat(ranking.get(0).getProductId()).isEqualTo("P1");
                assertThat(ranking.get(0).getValue()).isEqualByComparingTo("10.01");
                assertThat(ranking.get(1).getValue()).isEqualByComparingTo("7.00");
                assertThat(ranking.get(1).getPurchaseCount()).isEqualTo(2);
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("Should count purchases when neither quantity nor amount exist")
    void shouldRankByPurchaseCount() {
        givenRecords(List.of(
            record("PRODUCT_ID", "P1", "TRANSACTION_TYPE", "purchase"),
            record("PRODUCT_ID", "P2", "TRANSACTION_TYPE", "purchase"),
            record("PRODUCT_ID", "P2", "TRANSACTION_TYPE", "purchase")));

        StepVerifier.create(engine.topProducts(snapshot, 5))
            .assertNext(ranking -> {
                assertThat(ranking).extracting(ProductRanking::getProductId).containsExactly("P2", "P1");
                assertThat(ranking.get(0).getMetric()).isEqualTo(RankingMetric.PURCHASE_COUNT);
                assertThat(ranking.get(0).getValue()).isEqualByComparingTo("2");
            })
            .verifyComplete();
    }

    // ========== Windowed spend ==========

    @Test
    @DisplayName("Should sum spend inside the window only")
    void shouldComputeRecentSpend() {
        givenRecords(List.of(
            record("TIMESTAMP", NOW.minusMinutes(10), "TRANSACTION_TYPE", "purchase", "AMOUNT_USD", 50.0),
            record("TIMESTAMP", NOW.minusMinutes(1), "TRANSACTION_TYPE", "payment", "AMOUNT_USD", 20.0)));

        StepVerifier.create(engine.recentSpend(snapshot, 5))
            .assertNext(spend -> {
                assertThat(spend.getTotal()).isEqualByComparingTo("20.00");
                assertThat(spend.getTotal().scale()).isEqualTo(2);
                assertThat(spend.getCount()).isEqualTo(1);
                assertThat(spend.getWindowEnd()).isEqualTo(NOW);
                assertThat(spend.getWindowStart()).isEqualTo(NOW.minusMinutes(5));
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("Should include window bounds, count null amounts and skip other types")
    void shouldHandleWindowEdges() {
        givenRecords(List.of(
            record("TIMESTAMP", NOW.minusMinutes(5), "TRANSACTION_TYPE", "purchase", "AMOUNT_USD", 1.10),
            record("TIMESTAMP", NOW, "TRANSACTION_TYPE", "payment", "AMOUNT_USD", 2.20),
            record("TIMESTAMP", NOW.minusMinutes(2), "TRANSACTION_TYPE", "purchase", "AMOUNT_USD", null),
            record("TIMESTAMP", NOW.minusMinutes(2), "TRANSACTION_TYPE", "refund", "AMOUNT_USD", 99.0),
            record("TIMESTAMP", null, "TRANSACTION_TYPE", "purchase", "AMOUNT_USD", 99.0),
            record("TIMESTAMP", NOW.plusMinutes(1), "TRANSACTION_TYPE", "purchase", "AMOUNT_USD", 99.0)));

        StepVerifier.create(engine.recentSpend(snapshot, 5))
            .assertNext(spend -> {
                assertThat(spend.getTotal()).isEqualByComparingTo("3.30");
                assertThat(spend.getCount()).isEqualTo(3);
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("Should treat a window below one minute as one minute")
    void shouldClampWindow() {
        givenRecords(List.of());

        StepVerifier.create(engine.recentSpend(snapshot, -5))
            .assertNext(spend -> {
                assertThat(spend.getWindowMinutes()).isEqualTo(1);
                assertThat(spend.getTotal()).isEqualByComparingTo("0");
                assertThat(spend.getCount()).isZero();
            })
            .verifyComplete();
    }

    // ========== User spend ==========

    @Test
    @DisplayName("Should group spend per user and transaction type")
    void shouldComputeUserSpend() {
        givenRecords(List.of(
            record("USER_ID", "u1", "TRANSACTION_TYPE", "purchase", "AMOUNT_USD", 10.0),
            record("USER_ID", "u1", "TRANSACTION_TYPE", "refund", "AMOUNT_USD", 5.0),
            record("USER_ID", "u2", "TRANSACTION_TYPE", "purchase", "AMOUNT_USD", 7.0),
            record("USER_ID", null, "TRANSACTION_TYPE", "purchase", "AMOUNT_USD", 70.0),
            record("USER_ID", "u3", "TRANSACTION_TYPE", "purchase", "AMOUNT_USD", "n/a")));

        StepVerifier.create(engine.userSpend(snapshot))
            .assertNext(users -> {
                assertThat(users).extracting(UserSpend::getUserId).containsExactly("u1", "u2");
                UserSpend u1 = users.get(0);
                assertThat(u1.getTotal()).isEqualByComparingTo("15");
                assertThat(u1.getBreakdown()).extracting(SpendBreakdown::getTransactionType)
                    .containsExactly("purchase", "refund");
                assertThat(users.get(1).getTotal()).isEqualByComparingTo("7");
                assertThat(users.get(1).getBreakdown()).hasSize(1);
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("Should order users with equal totals by user id")
    void shouldBreakUserTiesById() {
        givenRecords(List.of(
            record("USER_ID", "zoe", "TRANSACTION_TYPE", "purchase", "AMOUNT_USD", 3.0),
            record("USER_ID", "amy", "TRANSACTION_TYPE", "payment", "AMOUNT_USD", 1.0),
            record("USER_ID", "amy", "TRANSACTION_TYPE", "purchase", "AMOUNT_USD", 2.0)));

        StepVerifier.create(engine.userSpend(snapshot))
            .assertNext(users -> {
                assertThat(users).extracting(UserSpend::getUserId).containsExactly("amy", "zoe");
                assertThat(users.get(0).getBreakdown()).extracting(SpendBreakdown::getTransactionType)
                    .containsExactly("purchase", "payment");
            })
            .verifyComplete();
    }

    // ========== Failure policy ==========

    @Test
    @DisplayName("Should fail only when no source could be read")
    void shouldFailWhenNothingReadable() {
        SourceFailure failure = new SourceFailure(SourceKind.FILE, "TX", null, "permission denied", false);
        when(queryExecutor.loadAll(any())).thenReturn(
            Mono.just(new MergedLoad(RecordBatch.empty(), 1, 0, List.of(failure))));

        StepVerifier.create(engine.userSpend(snapshot))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(NoReadableSourceException.class);
                assertThat(((NoReadableSourceException) error).getFailures()).containsExactly(failure);
            })
            .verify();
    }

    @Test
    @DisplayName("Should aggregate over the readable sources of a partial load")
    void shouldAggregatePartialLoads() {
        SourceFailure failure = new SourceFailure(SourceKind.TABLE, "sql_tx", null, "down", false);
        RecordBatch batch = RecordBatch.of(List.of(
            record("PRODUCT_ID", "P1", "TRANSACTION_TYPE", "purchase", "QUANTITY", 2L)));
        when(queryExecutor.loadAll(any())).thenReturn(Mono.just(new MergedLoad(batch, 2, 1, List.of(failure))));

        StepVerifier.create(engine.topProducts(snapshot))
            .assertNext(ranking -> assertThat(ranking).hasSize(1))
            .verifyComplete();
    }

    @Test
    void testEmptyCatalog_ShouldYieldEmptyAggregates() {
        when(queryExecutor.loadAll(any())).thenReturn(
            Mono.just(new MergedLoad(RecordBatch.empty(), 0, 0, List.of())));

        StepVerifier.create(engine.userSpend(snapshot))
            .assertNext(users -> assertThat(users).isEmpty())
            .verifyComplete();
    }
}
