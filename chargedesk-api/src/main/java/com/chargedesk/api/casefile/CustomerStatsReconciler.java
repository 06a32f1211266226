package com.chargedesk.api.casefile;

import com.chargedesk.api.schema.StoreInspector;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Recomputes the cached per-customer dispute totals from the chargeback/transaction join.
 *
 * {@code total_chargebacks} counts every chargeback filed against the customer's
 * transactions; {@code total_refunds} sums the amounts of those closed {@code lost}.
 * The totals are only ever written here, in one set-based statement.
 */
@Service
public class CustomerStatsReconciler {

    private static final Logger log = LoggerFactory.getLogger(CustomerStatsReconciler.class);

    private static final String RECONCILE_SQL = """
            UPDATE customers c SET
                total_chargebacks = (
                    SELECT COUNT(*)
                    FROM chargebacks cb
                    JOIN transactions t ON t.transaction_id = cb.transaction_id
                    WHERE t.customer_id = c.customer_id),
                total_refunds = (
                    SELECT COALESCE(SUM(cb.chargeback_amount), 0)
                    FROM chargebacks cb
                    JOIN transactions t ON t.transaction_id = cb.transaction_id
                    WHERE t.customer_id = c.customer_id AND cb.outcome = :refundedOutcome)
            """;

    private static final String DRIFT_SQL = """
            SELECT c.customer_id,
                   c.total_chargebacks AS stored_chargebacks,
                   COALESCE(actual.chargebacks, 0) AS actual_chargebacks,
                   c.total_refunds AS stored_refunds,
                   COALESCE(actual.refunds, 0) AS actual_refunds
            FROM customers c
            LEFT JOIN (
                SELECT t.customer_id,
                       COUNT(*) AS chargebacks,
                       SUM(CASE WHEN cb.outcome = :refundedOutcome THEN cb.chargeback_amount ELSE 0 END) AS refunds
                FROM chargebacks cb
                JOIN transactions t ON t.transaction_id = cb.transaction_id
                GROUP BY t.customer_id) actual ON actual.customer_id = c.customer_id
            WHERE c.total_chargebacks <> COALESCE(actual.chargebacks, 0)
               OR c.total_refunds <> COALESCE(actual.refunds, 0)
            ORDER BY c.customer_id
            """;

    private static final String REFUNDED_OUTCOME = "lost";

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final StoreInspector storeInspector;

    @PersistenceContext
    private EntityManager entityManager;

    public CustomerStatsReconciler(NamedParameterJdbcTemplate jdbcTemplate, StoreInspector storeInspector) {
        this.jdbcTemplate = jdbcTemplate;
        this.storeInspector = storeInspector;
    }

    /**
     * @return number of customer rows rewritten
     */
    @Transactional
    public int reconcile() {
        storeInspector.requireInitialized();
        // pending entity writes must reach the tables the statement reads
        entityManager.flush();
        int updated = jdbcTemplate.update(RECONCILE_SQL, params());
        // loaded customers now hold stale totals
        entityManager.clear();
        log.info("Reconciled dispute totals for {} customer(s)", updated);
        return updated;
    }

    /**
     * Customers whose stored totals disagree with the join. Empty after every reconcile.
     */
    @Transactional(readOnly = true)
    public List<CustomerDrift> findDrift() {
        storeInspector.requireInitialized();
        List<CustomerDrift> drift = jdbcTemplate.query(DRIFT_SQL, params(), (rs, rowNum) -> new CustomerDrift(
                rs.getString("customer_id"),
                rs.getInt("stored_chargebacks"),
                rs.getInt("actual_chargebacks"),
                rs.getBigDecimal("stored_refunds"),
                rs.getBigDecimal("actual_refunds")));
        if (!drift.isEmpty()) {
            log.warn("Customer dispute totals drifted for {}", drift.stream().map(CustomerDrift::customerId).toList());
        }
        return drift;
    }

    private static MapSqlParameterSource params() {
        return new MapSqlParameterSource("refundedOutcome", REFUNDED_OUTCOME);
    }

    public record CustomerDrift(String customerId, int storedChargebacks, int actualChargebacks,
                                BigDecimal storedRefunds, BigDecimal actualRefunds) {}
}
