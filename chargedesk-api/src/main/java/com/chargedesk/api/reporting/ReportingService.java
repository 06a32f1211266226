package com.chargedesk.api.reporting;

import com.chargedesk.api.casefile.CustomerStatsReconciler;
import com.chargedesk.api.casefile.CustomerStatsReconciler.CustomerDrift;
import com.chargedesk.api.schema.StoreInspector;
import com.chargedesk.core.domain.CardTransaction;
import com.chargedesk.core.domain.CardTransaction.RiskLevel;
import com.chargedesk.core.domain.Chargeback.CaseCategory;
import com.chargedesk.core.domain.Chargeback.Outcome;
import com.chargedesk.core.domain.Chargeback.Status;
import com.chargedesk.core.domain.CodedEnum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only views over the chargeback store.
 *
 * Every listing has a total order, so two reads of an unchanged store return the same
 * rows in the same order. An empty store yields zero counts and empty listings.
 */
@Service
@Transactional(readOnly = true)
public class ReportingService {

    private static final Logger log = LoggerFactory.getLogger(ReportingService.class);

    private static final String TRANSACTION_STATS_SQL = """
            SELECT COUNT(*) AS tx_count,
                   COUNT(DISTINCT customer_id) AS customers,
                   COUNT(DISTINCT merchant_id) AS merchants,
                   COALESCE(SUM(amount), 0) AS total_amount,
                   COALESCE(AVG(amount), 0) AS average_amount,
                   COALESCE(MIN(amount), 0) AS min_amount,
                   COALESCE(MAX(amount), 0) AS max_amount
            FROM transactions
            """;

    private static final String CHARGEBACK_LISTING_SQL = """
            SELECT cb.chargeback_id, cb.transaction_id,
                   c.customer_id, c.name AS customer_name, c.email AS customer_email, m.merchant_name,
                   t.amount, t.currency, t.payment_method, t.transaction_date, t.risk_level, t.fraud_score,
                   cb.chargeback_amount, cb.status, cb.outcome, cb.case_category, cb.reason_code,
                   cb.issuing_bank, cb.analyst_id, cb.dispute_date, cb.response_deadline
            FROM chargebacks cb
            JOIN transactions t ON t.transaction_id = cb.transaction_id
            JOIN customers c ON c.customer_id = t.customer_id
            JOIN merchants m ON m.merchant_id = t.merchant_id
            ORDER BY cb.dispute_date DESC, cb.chargeback_id ASC
            """;

    private static final String EVENT_TYPES_SQL = """
            SELECT event_type, COUNT(*) AS event_count
            FROM case_events
            GROUP BY event_type
            ORDER BY event_count DESC, event_type ASC
            """;

    private static final String RISK_LEVELS_SQL = """
            SELECT risk_level, COUNT(*) AS tx_count, AVG(fraud_score) AS average_score, SUM(amount) AS total_amount
            FROM transactions
            WHERE risk_level IS NOT NULL
            GROUP BY risk_level
            ORDER BY average_score DESC, risk_level ASC
            """;

    private static final String CATEGORIES_SQL = """
            SELECT cb.case_category, COUNT(*) AS case_count, AVG(t.fraud_score) AS average_score,
                   SUM(cb.chargeback_amount) AS disputed_amount
            FROM chargebacks cb
            JOIN transactions t ON t.transaction_id = cb.transaction_id
            WHERE cb.case_category IS NOT NULL
            GROUP BY cb.case_category
            ORDER BY average_score DESC, cb.case_category ASC
            """;

    private static final String CASE_QUEUE_SQL = """
            SELECT chargeback_id, status, case_category, chargeback_amount, analyst_id,
                   dispute_date, response_deadline
            FROM chargebacks
            ORDER BY CASE status WHEN 'open' THEN 0 WHEN 'under_review' THEN 0 WHEN 'lost' THEN 1 ELSE 2 END,
                     dispute_date DESC, chargeback_id ASC
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final StoreInspector storeInspector;
    private final CustomerStatsReconciler reconciler;
    private final int recentLimit;

    public ReportingService(NamedParameterJdbcTemplate jdbcTemplate, StoreInspector storeInspector,
                            CustomerStatsReconciler reconciler,
                            @Value("${chargedesk.report.recent-limit:10}") int recentLimit) {
        this.jdbcTemplate = jdbcTemplate;
        this.storeInspector = storeInspector;
        this.reconciler = reconciler;
        this.recentLimit = recentLimit;
    }

    /**
     * Every section of the store overview in one read.
     */
    public StoreOverview overview() {
        storeInspector.requireInitialized();
        log.debug("Building store overview");
        return new StoreOverview(
                tableCounts(),
                transactionStatistics(),
                chargebackStatistics(),
                customers(),
                merchants(),
                recentTransactions(recentLimit),
                chargebackListing(),
                caseQueue(),
                eventTypeFrequencies(),
                recentEvents(recentLimit),
                riskLevelStatistics(),
                categoryStatistics(),
                reconciler.findDrift());
    }

    public Map<String, Long> tableCounts() {
        return storeInspector.rowCounts();
    }

    public TransactionStatistics transactionStatistics() {
        storeInspector.requireInitialized();
        return jdbcTemplate.queryForObject(TRANSACTION_STATS_SQL, Map.of(), (rs, rowNum) -> new TransactionStatistics(
                rs.getLong("tx_count"),
                rs.getLong("customers"),
                rs.getLong("merchants"),
                money(rs.getBigDecimal("total_amount")),
                money(rs.getBigDecimal("average_amount")),
                money(rs.getBigDecimal("min_amount")),
                money(rs.getBigDecimal("max_amount"))));
    }

    /**
     * Totals per status; every status is present, with zero when no case carries it.
     */
    public ChargebackStatistics chargebackStatistics() {
        storeInspector.requireInitialized();
        Map<Status, Long> byStatus = new EnumMap<>(Status.class);
        for (Status status : Status.values()) {
            byStatus.put(status, 0L);
        }
        jdbcTemplate.query("SELECT status, COUNT(*) AS case_count FROM chargebacks GROUP BY status", Map.of(),
                (RowCallbackHandler) rs -> byStatus.put(
                        CodedEnum.fromCode(Status.class, rs.getString("status")), rs.getLong("case_count")));
        BigDecimal disputed = jdbcTemplate.queryForObject(
                "SELECT COALESCE(SUM(chargeback_amount), 0) FROM chargebacks", Map.of(), BigDecimal.class);
        long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
        return new ChargebackStatistics(total, byStatus, money(disputed));
    }

    /**
     * Chargebacks with their transaction, customer and merchant context, newest dispute first.
     */
    public List<ChargebackListing> chargebackListing() {
        storeInspector.requireInitialized();
        return jdbcTemplate.query(CHARGEBACK_LISTING_SQL, Map.of(), (rs, rowNum) -> new ChargebackListing(
                rs.getString("chargeback_id"),
                rs.getString("transaction_id"),
                rs.getString("customer_id"),
                rs.getString("customer_name"),
                rs.getString("customer_email"),
                rs.getString("merchant_name"),
                rs.getBigDecimal("amount"),
                rs.getString("currency"),
                rs.getString("payment_method"),
                instant(rs, "transaction_date"),
                coded(RiskLevel.class, rs.getString("risk_level")),
                rs.getBigDecimal("fraud_score"),
                rs.getBigDecimal("chargeback_amount"),
                CodedEnum.fromCode(Status.class, rs.getString("status")),
                coded(Outcome.class, rs.getString("outcome")),
                coded(CaseCategory.class, rs.getString("case_category")),
                rs.getString("reason_code"),
                rs.getString("issuing_bank"),
                rs.getString("analyst_id"),
                instant(rs, "dispute_date"),
                instant(rs, "response_deadline")));
    }

    public List<EventTypeFrequency> eventTypeFrequencies() {
        storeInspector.requireInitialized();
        return jdbcTemplate.query(EVENT_TYPES_SQL, Map.of(),
                (rs, rowNum) -> new EventTypeFrequency(rs.getString("event_type"), rs.getLong("event_count")));
    }

    public List<RiskLevelStatistics> riskLevelStatistics() {
        storeInspector.requireInitialized();
        return jdbcTemplate.query(RISK_LEVELS_SQL, Map.of(), (rs, rowNum) -> new RiskLevelStatistics(
                CodedEnum.fromCode(RiskLevel.class, rs.getString("risk_level")),
                rs.getLong("tx_count"),
                money(rs.getBigDecimal("average_score")),
                money(rs.getBigDecimal("total_amount"))));
    }

    public List<CustomerSummary> customers() {
        storeInspector.requireInitialized();
        return jdbcTemplate.query(
                "SELECT customer_id, name, email, region, total_chargebacks, total_refunds FROM customers ORDER BY customer_id",
                Map.of(), (rs, rowNum) -> new CustomerSummary(
                        rs.getString("customer_id"),
                        rs.getString("name"),
                        rs.getString("email"),
                        rs.getString("region"),
                        rs.getInt("total_chargebacks"),
                        rs.getBigDecimal("total_refunds")));
    }

    public List<MerchantSummary> merchants() {
        storeInspector.requireInitialized();
        return jdbcTemplate.query(
                "SELECT merchant_id, merchant_name, acquiring_bank, win_rate FROM merchants ORDER BY merchant_id",
                Map.of(), (rs, rowNum) -> new MerchantSummary(
                        rs.getString("merchant_id"),
                        rs.getString("merchant_name"),
                        rs.getString("acquiring_bank"),
                        rs.getBigDecimal("win_rate")));
    }

    public List<TransactionSummary> recentTransactions(int limit) {
        storeInspector.requireInitialized();
        return jdbcTemplate.query("""
                        SELECT transaction_id, customer_id, merchant_id, amount, status, risk_level, fraud_score,
                               transaction_date
                        FROM transactions
                        ORDER BY transaction_date DESC, transaction_id ASC
                        LIMIT :limit
                        """,
                limit(limit), (rs, rowNum) -> new TransactionSummary(
                        rs.getString("transaction_id"),
                        rs.getString("customer_id"),
                        rs.getString("merchant_id"),
                        rs.getBigDecimal("amount"),
                        CodedEnum.fromCode(CardTransaction.Status.class, rs.getString("status")),
                        coded(RiskLevel.class, rs.getString("risk_level")),
                        rs.getBigDecimal("fraud_score"),
                        instant(rs, "transaction_date")));
    }

    public List<EventSummary> recentEvents(int limit) {
        storeInspector.requireInitialized();
        return jdbcTemplate.query("""
                        SELECT event_id, chargeback_id, event_type, event_date, description
                        FROM case_events
                        ORDER BY event_date DESC, event_id DESC
                        LIMIT :limit
                        """,
                limit(limit), (rs, rowNum) -> new EventSummary(
                        rs.getLong("event_id"),
                        rs.getString("chargeback_id"),
                        rs.getString("event_type"),
                        instant(rs, "event_date"),
                        rs.getString("description")));
    }

    /**
     * Triage order: unresolved cases first, then lost, then won; newest dispute first within each.
     */
    public List<QueuedCase> caseQueue() {
        storeInspector.requireInitialized();
        return jdbcTemplate.query(CASE_QUEUE_SQL, Map.of(), (rs, rowNum) -> new QueuedCase(
                rs.getString("chargeback_id"),
                CodedEnum.fromCode(Status.class, rs.getString("status")),
                coded(CaseCategory.class, rs.getString("case_category")),
                rs.getBigDecimal("chargeback_amount"),
                rs.getString("analyst_id"),
                instant(rs, "dispute_date"),
                instant(rs, "response_deadline")));
    }

    public List<CategoryStatistics> categoryStatistics() {
        storeInspector.requireInitialized();
        return jdbcTemplate.query(CATEGORIES_SQL, Map.of(), (rs, rowNum) -> new CategoryStatistics(
                CodedEnum.fromCode(CaseCategory.class, rs.getString("case_category")),
                rs.getLong("case_count"),
                money(rs.getBigDecimal("average_score")),
                money(rs.getBigDecimal("disputed_amount"))));
    }

    private static MapSqlParameterSource limit(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Listing limit must be positive, was " + limit);
        }
        return new MapSqlParameterSource("limit", limit);
    }

    private static BigDecimal money(BigDecimal value) {
        return value == null ? BigDecimal.ZERO.setScale(2) : value.setScale(2, RoundingMode.HALF_UP);
    }

    private static <E extends Enum<E> & CodedEnum> E coded(Class<E> type, String code) {
        return code == null ? null : CodedEnum.fromCode(type, code);
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    public record TransactionStatistics(long count, long distinctCustomers, long distinctMerchants,
                                        BigDecimal totalAmount, BigDecimal averageAmount,
                                        BigDecimal minAmount, BigDecimal maxAmount) {}

    public record ChargebackStatistics(long total, Map<Status, Long> byStatus, BigDecimal disputedAmount) {
        public ChargebackStatistics {
            byStatus = Collections.unmodifiableMap(new EnumMap<>(byStatus));
        }

        public long count(Status status) {
            return byStatus.getOrDefault(status, 0L);
        }
    }

    public record ChargebackListing(String chargebackId, String transactionId,
                                    String customerId, String customerName, String customerEmail,
                                    String merchantName, BigDecimal amount, String currency, String paymentMethod,
                                    Instant transactionDate, RiskLevel riskLevel, BigDecimal fraudScore,
                                    BigDecimal chargebackAmount, Status status, Outcome outcome,
                                    CaseCategory category, String reasonCode, String issuingBank, String analystId,
                                    Instant disputeDate, Instant responseDeadline) {}

    public record EventTypeFrequency(String eventType, long count) {}

    public record RiskLevelStatistics(RiskLevel riskLevel, long count, BigDecimal averageFraudScore,
                                      BigDecimal totalAmount) {}

    public record CustomerSummary(String customerId, String name, String email, String region,
                                  int totalChargebacks, BigDecimal totalRefunds) {}

    public record MerchantSummary(String merchantId, String name, String acquiringBank, BigDecimal winRate) {}

    public record TransactionSummary(String transactionId, String customerId, String merchantId, BigDecimal amount,
                                     CardTransaction.Status status, RiskLevel riskLevel, BigDecimal fraudScore,
                                     Instant transactionDate) {}

    public record EventSummary(long eventId, String chargebackId, String eventType, Instant eventDate,
                               String description) {}

    public record QueuedCase(String chargebackId, Status status, CaseCategory category, BigDecimal chargebackAmount,
                             String analystId, Instant disputeDate, Instant responseDeadline) {}

    public record CategoryStatistics(CaseCategory category, long count, BigDecimal averageFraudScore,
                                     BigDecimal disputedAmount) {}

    public record StoreOverview(
            Map<String, Long> tableCounts,
            TransactionStatistics transactionStatistics,
            ChargebackStatistics chargebackStatistics,
            List<CustomerSummary> customers,
            List<MerchantSummary> merchants,
            List<TransactionSummary> recentTransactions,
            List<ChargebackListing> chargebacks,
            List<QueuedCase> caseQueue,
            List<EventTypeFrequency> eventTypes,
            List<EventSummary> recentEvents,
            List<RiskLevelStatistics> riskLevels,
            List<CategoryStatistics> categories,
            List<CustomerDrift> customerDrift) {}
}
