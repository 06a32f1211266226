package com.chargedesk.api.generator;

import com.chargedesk.api.casefile.CustomerStatsReconciler;
import com.chargedesk.api.config.TestStoreConfiguration;
import com.chargedesk.api.schema.SchemaInitializer;
import com.chargedesk.api.schema.StoreInspector;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.spring.JqwikSpringSupport;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Store-wide properties of generated data, checked for arbitrary seeds.
 * Not transactional: every try regenerates the whole store.
 */
@JqwikSpringSupport
@SpringBootTest
@Import(TestStoreConfiguration.class)
@ActiveProfiles("test")
class CaseRecordGeneratorPropertyTest {

    @Autowired
    private SchemaInitializer schemaInitializer;
    @Autowired
    private StoreInspector storeInspector;
    @Autowired
    private CaseRecordGenerator generator;
    @Autowired
    private CustomerStatsReconciler reconciler;
    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Property(tries = 5)
    @Label("Every transaction references an existing customer and merchant")
    void noOrphanTransactions(@ForAll long seed) {
        generate(seed);

        assertThat(count("""
                SELECT COUNT(*) FROM transactions t
                LEFT JOIN customers c ON c.customer_id = t.customer_id
                LEFT JOIN merchants m ON m.merchant_id = t.merchant_id
                WHERE c.customer_id IS NULL OR m.merchant_id IS NULL""")).isZero();
        assertThat(count("""
                SELECT COUNT(*) FROM chargebacks cb
                LEFT JOIN transactions t ON t.transaction_id = cb.transaction_id
                WHERE t.transaction_id IS NULL""")).isZero();
    }

    @Property(tries = 5)
    @Label("A transaction carries at most one chargeback and is marked disputed exactly when it does")
    void oneChargebackPerDisputedTransaction(@ForAll long seed) {
        generate(seed);

        assertThat(count("""
                SELECT COUNT(*) FROM (
                    SELECT transaction_id FROM chargebacks GROUP BY transaction_id HAVING COUNT(*) > 1) dup""")).isZero();
        assertThat(count("SELECT COUNT(*) FROM transactions WHERE status = 'disputed'"))
                .isEqualTo(count("SELECT COUNT(*) FROM chargebacks"));
        assertThat(count("""
                SELECT COUNT(*) FROM transactions t JOIN chargebacks cb ON cb.transaction_id = t.transaction_id
                WHERE t.status <> 'disputed'""")).isZero();
    }

    @Property(tries = 5)
    @Label("Closed cases carry an outcome matching their status, open cases carry neither")
    void outcomesArePairedWithClosingTime(@ForAll long seed) {
        generate(seed);

        assertThat(count("""
                SELECT COUNT(*) FROM chargebacks
                WHERE (outcome IS NULL) <> (closed_at IS NULL)
                   OR (outcome IS NOT NULL AND outcome <> status)
                   OR (outcome IS NULL AND status IN ('won', 'lost'))""")).isZero();
        assertThat(count("SELECT COUNT(*) FROM chargebacks WHERE closed_at < opened_at")).isZero();
    }

    @Property(tries = 5)
    @Label("Every case has at least one event and no event predates its dispute")
    void everyCaseHasATrail(@ForAll long seed) {
        generate(seed);

        assertThat(count("""
                SELECT COUNT(*) FROM chargebacks cb
                WHERE NOT EXISTS (SELECT 1 FROM case_events e WHERE e.chargeback_id = cb.chargeback_id)""")).isZero();
        assertThat(count("""
                SELECT COUNT(*) FROM case_events e JOIN chargebacks cb ON cb.chargeback_id = e.chargeback_id
                WHERE e.event_date < cb.dispute_date""")).isZero();
    }

    @Property(tries = 5)
    @Label("True-fraud scores stay at least 50 points above not-guilty scores")
    void fraudScoresSeparateTheCategories(@ForAll long seed) {
        generate(seed);

        BigDecimal lowestTrueFraud = jdbcTemplate.queryForObject("""
                SELECT MIN(t.fraud_score) FROM transactions t JOIN chargebacks cb ON cb.transaction_id = t.transaction_id
                WHERE cb.case_category = 'true_fraud'""", BigDecimal.class);
        BigDecimal highestNotGuilty = jdbcTemplate.queryForObject("""
                SELECT MAX(t.fraud_score) FROM transactions t JOIN chargebacks cb ON cb.transaction_id = t.transaction_id
                WHERE cb.case_category = 'not_guilty'""", BigDecimal.class);

        assertThat(lowestTrueFraud.subtract(highestNotGuilty)).isGreaterThanOrEqualTo(new BigDecimal("50"));
    }

    @Property(tries = 5)
    @Label("Customer totals agree with the chargebacks on file after generation")
    void customerTotalsAreReconciled(@ForAll long seed) {
        generate(seed);

        assertThat(reconciler.findDrift()).isEmpty();
    }

    private void generate(long seed) {
        if (!storeInspector.isInitialized()) {
            schemaInitializer.initialize(true);
        }
        generator.generate(seed);
    }

    private long count(String sql) {
        Long count = jdbcTemplate.queryForObject(sql, Long.class);
        return count == null ? 0 : count;
    }
}
