package com.datalake.metrics;

import com.datalake.catalog.CatalogSnapshot;
import com.datalake.domain.RecordBatch;
import com.datalake.domain.Values;
import com.datalake.query.MergedLoad;
import com.datalake.query.NoReadableSourceException;
import com.datalake.query.QueryExecutor;
import com.datalake.query.QueryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.datalake.domain.TransactionFields.AMOUNT_USD;
import static com.datalake.domain.TransactionFields.PRODUCT_ID;
import static com.datalake.domain.TransactionFields.QUANTITY;
import static com.datalake.domain.TransactionFields.TIMESTAMP;
import static com.datalake.domain.TransactionFields.TRANSACTION_TYPE;
import static com.datalake.domain.TransactionFields.TYPE_PAYMENT;
import static com.datalake.domain.TransactionFields.TYPE_PURCHASE;
import static com.datalake.domain.TransactionFields.USER_ID;

/**
 * Cross-source aggregates over every cataloged source.
 *
 * Every computation loads all sources through {@link QueryExecutor#loadAll}, which
 * merges them under the union schema and normalizes timestamps, then aggregates
 * the merged batch. Money is summed as {@link BigDecimal} and rounded half-up to
 * two decimals. Rankings order by the aggregate descending, ties by key ascending.
 */
@Service
public class MetricsEngine {

    private static final Logger log = LoggerFactory.getLogger(MetricsEngine.class);

    static final int DEFAULT_TOP_K = 10;
    private static final int MONEY_SCALE = 2;
    private static final Set<String> SPEND_TYPES = Set.of(TYPE_PURCHASE, TYPE_PAYMENT);

    private final QueryExecutor queryExecutor;
    private final QueryMetrics metrics;
    private final Clock clock;

    public MetricsEngine(QueryExecutor queryExecutor, QueryMetrics metrics, Clock clock) {
        this.queryExecutor = queryExecutor;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Total purchase and payment amount with event time in {@code [now - window, now]}.
     * Null amounts count but add nothing. A window below one minute is one minute.
     */
    public Mono<WindowedSpend> recentSpend(CatalogSnapshot snapshot, int windowMinutes) {
        int minutes = Math.max(1, windowMinutes);
        LocalDateTime windowEnd = LocalDateTime.now(clock);
        LocalDateTime windowStart = windowEnd.minusMinutes(minutes);

        return loadMerged(snapshot).map(batch -> {
            BigDecimal total = BigDecimal.ZERO;
            long count = 0;
            for (Map<String, Object> record : batch.getRecords()) {
                if (!SPEND_TYPES.contains(Values.asKey(record.get(TRANSACTION_TYPE)))) {
                    continue;
                }
                Object time = record.get(TIMESTAMP);
                if (!(time instanceof LocalDateTime)) {
                    continue;
                }
                LocalDateTime timestamp = (LocalDateTime) time;
                if (timestamp.isBefore(windowStart) || timestamp.isAfter(windowEnd)) {
                    continue;
                }
                total = total.add(Values.asDecimal(record.get(AMOUNT_USD)).orElse(BigDecimal.ZERO));
                count++;
            }
            WindowedSpend spend = new WindowedSpend(money(total), count, windowStart, windowEnd, minutes);
            log.debug("Recent spend over {} minutes: {}", minutes, spend);
            return spend;
        });
    }

    /**
     * Spend per user and transaction type, rolled up per user.
     * Records without a user, a type or a numeric amount are left out.
     */
    public Mono<List<UserSpend>> userSpend(CatalogSnapshot snapshot) {
        return loadMerged(snapshot).map(batch -> {
            Map<String, Map<String, Accumulator>> groups = new LinkedHashMap<>();
            for (Map<String, Object> record : batch.getRecords()) {
                String user = Values.asKey(record.get(USER_ID));
                String type = Values.asKey(record.get(TRANSACTION_TYPE));
                Optional<BigDecimal> amount = Values.asDecimal(record.get(AMOUNT_USD));
                if (user == null || type == null || amount.isEmpty()) {
                    continue;
                }
                groups.computeIfAbsent(user, key -> new LinkedHashMap<>())
                    .computeIfAbsent(type, key -> new Accumulator())
                    .add(amount.get());
            }

            List<UserSpend> result = new ArrayList<>(groups.size());
            for (Map.Entry<String, Map<String, Accumulator>> user : groups.entrySet()) {
                List<SpendBreakdown> breakdown = new ArrayList<>();
                BigDecimal total = BigDecimal.ZERO;
                for (Map.Entry<String, Accumulator> type : user.getValue().entrySet()) {
                    BigDecimal amount = money(type.getValue().sum);
                    breakdown.add(new SpendBreakdown(type.getKey(), amount, type.getValue().count));
                    total = total.add(amount);
                }
                breakdown.sort(Comparator.comparing(SpendBreakdown::getAmount).reversed()
                    .thenComparing(SpendBreakdown::getTransactionType));
                result.add(new UserSpend(user.getKey(), total, breakdown));
            }
            result.sort(Comparator.comparing(UserSpend::getTotal).reversed()
                .thenComparing(UserSpend::getUserId));
            log.debug("User spend computed for {} users", result.size());
            return result;
        });
    }

    public Mono<List<ProductRanking>> topProducts(CatalogSnapshot snapshot) {
        return topProducts(snapshot, DEFAULT_TOP_K);
    }

    /**
     * The k best-selling products among purchases. Ranks by summed quantity when the
     * merged data has a quantity field, else by summed amount, else by purchase count.
     * A k below one is one.
     */
    public Mono<List<ProductRanking>> topProducts(CatalogSnapshot snapshot, int k) {
        int limit = Math.max(1, k);
        return loadMerged(snapshot).map(batch -> {
            RankingMetric metric = batch.getSchema().contains(QUANTITY) ? RankingMetric.QUANTITY
                : batch.getSchema().contains(AMOUNT_USD) ? RankingMetric.AMOUNT
                : RankingMetric.PURCHASE_COUNT;

            Map<String, Accumulator> products = new LinkedHashMap<>();
            for (Map<String, Object> record : batch.getRecords()) {
                if (!TYPE_PURCHASE.equals(Values.asKey(record.get(TRANSACTION_TYPE)))) {
                    continue;
                }
                String product = Values.asKey(record.get(PRODUCT_ID));
                if (product == null) {
                    continue;
                }
                Accumulator accumulator = products.computeIfAbsent(product, key -> new Accumulator());
                switch (metric) {
                    case QUANTITY:
                        accumulator.add(Values.asDecimal(record.get(QUANTITY)).orElse(BigDecimal.ZERO));
                        break;
                    case AMOUNT:
                        accumulator.add(Values.asDecimal(record.get(AMOUNT_USD)).orElse(BigDecimal.ZERO));
                        break;
                    default:
                        accumulator.add(BigDecimal.ONE);
                        break;
                }
            }

            List<Map.Entry<String, Accumulator>> ranked = new ArrayList<>(products.entrySet());
            ranked.sort((left, right) -> {
                int byValue = right.getValue().sum.compareTo(left.getValue().sum);
                return byValue != 0 ? byValue : left.getKey().compareTo(right.getKey());
            });

            List<ProductRanking> result = new ArrayList<>(Math.min(limit, ranked.size()));
            for (int i = 0; i < ranked.size() && i < limit; i++) {
                Map.Entry<String, Accumulator> entry = ranked.get(i);
                BigDecimal value = metric == RankingMetric.AMOUNT ? money(entry.getValue().sum)
                    : plain(entry.getValue().sum);
                result.add(new ProductRanking(i + 1, entry.getKey(), metric, value, entry.getValue().count));
            }
            log.debug("Top {} products by {}: {}", limit, metric.getValue(), result);
            return result;
        });
    }

    private Mono<RecordBatch> loadMerged(CatalogSnapshot snapshot) {
        return queryExecutor.loadAll(snapshot)
            .flatMap(load -> {
                metrics.recordAggregationExecuted();
                if (load.isUnreadable()) {
                    return Mono.error(new NoReadableSourceException(
                        "None of the " + load.getSourceCount() + " sources could be read", load.getFailures()));
                }
                logPartial(load);
                return Mono.just(load.getBatch());
            });
    }

    private void logPartial(MergedLoad load) {
        if (!load.getFailures().isEmpty()) {
            log.warn("Aggregating over {} of {} sources, {} failures: {}",
                load.getReadableCount(), load.getSourceCount(), load.getFailures().size(), load.getFailures());
        }
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Drop trailing fractional zeros without switching to exponent form
     */
    private static BigDecimal plain(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    private static final class Accumulator {
        private BigDecimal sum = BigDecimal.ZERO;
        private long count;

        void add(BigDecimal value) {
            sum = sum.add(value);
            count++;
        }
    }
}
