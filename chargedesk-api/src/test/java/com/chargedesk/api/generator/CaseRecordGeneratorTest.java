package com.chargedesk.api.generator;

import com.chargedesk.api.casefile.CaseFileService;
import com.chargedesk.api.casefile.CaseFileService.CaseConstraintViolationException;
import com.chargedesk.api.casefile.CaseFileService.TrailEntry;
import com.chargedesk.api.casefile.CustomerStatsReconciler;
import com.chargedesk.api.config.TestStoreConfiguration;
import com.chargedesk.api.schema.SchemaInitializer;
import com.chargedesk.api.schema.StoreInspector;
import com.chargedesk.api.schema.StoreInspector.StoreNotInitializedException;
import com.chargedesk.core.domain.CardTransaction.RiskLevel;
import com.chargedesk.core.domain.Chargeback;
import com.chargedesk.core.domain.Chargeback.CaseCategory;
import com.chargedesk.core.domain.Chargeback.Outcome;
import com.chargedesk.core.domain.Chargeback.Status;
import com.chargedesk.core.evidence.FraudIndicators;
import com.chargedesk.core.evidence.RefundAction;
import com.chargedesk.core.evidence.SupportContact;
import com.chargedesk.core.evidence.VelocitySnapshot;
import com.chargedesk.core.repository.ChargebackRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Import(TestStoreConfiguration.class)
@ActiveProfiles("test")
class CaseRecordGeneratorTest {

    private static final String EVENT_TRAIL_SQL =
            "SELECT chargeback_id, event_type, event_date, event_data FROM case_events ORDER BY event_id";
    private static final String TRANSACTIONS_SQL =
            "SELECT transaction_id, customer_id, merchant_id, amount, transaction_date, fraud_score FROM transactions ORDER BY transaction_id";

    @Autowired
    private SchemaInitializer schemaInitializer;
    @Autowired
    private CaseRecordGenerator generator;
    @Autowired
    private CaseFileService caseFileService;
    @Autowired
    private CustomerStatsReconciler reconciler;
    @Autowired
    private EvidenceTemplates templates;
    @Autowired
    private StoreInspector storeInspector;
    @Autowired
    private ChargebackRepository chargebackRepository;
    @Autowired
    private JdbcTemplate jdbcTemplate;
    @Autowired
    private TransactionTemplate transactionTemplate;
    @Autowired
    private Clock clock;

    @BeforeEach
    void freshStore() {
        schemaInitializer.initialize(true);
    }

    @Test
    void writesTheReferenceDataSet() {
        GenerationSummary summary = generator.generate();

        assertThat(summary.seed()).isEqualTo(20260115L);
        assertThat(summary.merchants()).isEqualTo(4);
        assertThat(summary.customers()).isEqualTo(7);
        assertThat(summary.chargebacks()).isEqualTo(23);
        assertThat(summary.transactions()).isBetween(7 * 5 + 23, 7 * 10 + 23);
        assertThat(summary.chargebacksByCategory()).containsOnly(
                Map.entry(CaseCategory.TRUE_FRAUD, 5),
                Map.entry(CaseCategory.FRIENDLY_FRAUD, 8),
                Map.entry(CaseCategory.MERCHANT_ERROR, 5),
                Map.entry(CaseCategory.NOT_GUILTY, 5));
        assertThat(summary.authoredTrails()).isEqualTo(23);
        assertThat(summary.fallbackTrails()).isZero();

        Map<String, Long> counts = storeInspector.rowCounts();
        assertThat(counts).containsEntry("merchants", 4L)
                .containsEntry("customers", 7L)
                .containsEntry("transactions", (long) summary.transactions())
                .containsEntry("chargebacks", 23L)
                .containsEntry("case_events", summary.events());
        assertThat(reconciler.findDrift()).isEmpty();
    }

    @Test
    void sameSeedProducesTheSameStore() {
        generator.generate(42L);
        List<Map<String, Object>> transactions = jdbcTemplate.queryForList(TRANSACTIONS_SQL);
        List<Map<String, Object>> events = jdbcTemplate.queryForList(EVENT_TRAIL_SQL);

        generator.generate(42L);

        assertThat(jdbcTemplate.queryForList(TRANSACTIONS_SQL)).isEqualTo(transactions);
        assertThat(jdbcTemplate.queryForList(EVENT_TRAIL_SQL)).isEqualTo(events);
    }

    @Test
    void regenerationReplacesRatherThanAppends() {
        GenerationSummary first = generator.generate(1L);
        GenerationSummary second = generator.generate(2L);

        assertThat(storeInspector.rowCounts())
                .containsEntry("chargebacks", 23L)
                .containsEntry("transactions", (long) second.transactions());
        assertThat(first.chargebacks()).isEqualTo(second.chargebacks());
    }

    @Test
    void caseStatusesAndDatesFollowTheScenarios() {
        generator.generate(7L);

        for (CaseScenario scenario : CaseScenarioCatalog.defaultScenarios()) {
            Chargeback chargeback = chargebackRepository.findById(scenario.chargebackId()).orElseThrow();
            assertThat(chargeback.getCaseCategory()).isEqualTo(scenario.category());
            assertThat(chargeback.getResponseDeadline())
                    .isEqualTo(chargeback.getDisputeDate().plus(Duration.ofDays(30)));
            assertThat(chargeback.getOpenedAt()).isAfterOrEqualTo(chargeback.getDisputeDate());
            if (scenario.isClosed()) {
                assertThat(chargeback.getOutcome()).isEqualTo(scenario.outcome());
                assertThat(chargeback.getStatus()).isEqualTo(scenario.outcome().toStatus());
                assertThat(chargeback.getClosedAt()).isAfterOrEqualTo(chargeback.getOpenedAt());
            } else {
                assertThat(chargeback.getStatus()).isEqualTo(Status.OPEN);
                assertThat(chargeback.getOutcome()).isNull();
                assertThat(chargeback.getClosedAt()).isNull();
            }

            List<TrailEntry> trail = caseFileService.caseTrail(scenario.chargebackId());
            assertThat(trail).isNotEmpty();
            assertThat(trail).allSatisfy(entry -> assertThat(entry.eventDate())
                    .isBetween(chargeback.getDisputeDate(),
                            chargeback.getClosedAt() != null ? chargeback.getClosedAt() : clock.instant()));
        }
    }

    @Test
    void trueFraudTrailsCarryFailedChecksAndVelocity() {
        generator.generate(11L);

        for (Chargeback chargeback : chargebackRepository.findByCaseCategory(CaseCategory.TRUE_FRAUD)) {
            List<TrailEntry> trail = caseFileService.caseTrail(chargeback.getChargebackId());
            assertThat(trail).extracting(TrailEntry::eventType).contains("fraud_indicators", "velocity_check");
            assertThat(trail).extracting(TrailEntry::payload)
                    .filteredOn(FraudIndicators.class::isInstance)
                    .allSatisfy(payload -> assertThat(((FraudIndicators) payload).verificationFailed()).isTrue());
            assertThat(trail).extracting(TrailEntry::payload)
                    .filteredOn(VelocitySnapshot.class::isInstance)
                    .allSatisfy(payload -> assertThat(((VelocitySnapshot) payload).cardsLast24h()).isGreaterThan(1));
        }
        for (Chargeback chargeback : chargebackRepository.findByCaseCategory(CaseCategory.NOT_GUILTY)) {
            assertThat(caseFileService.caseTrail(chargeback.getChargebackId()))
                    .extracting(TrailEntry::eventType)
                    .containsAnyOf("delivery_evidence", "subscription_evidence", "usage_analytics",
                            "return_policy_evidence");
        }
    }

    @Test
    void scenarioWithoutAuthoredTrailGetsTheCategoryFallback() {
        CaseScenario unscripted = CaseScenario.builder("cb_900", CaseCategory.MERCHANT_ERROR)
                .party("cust_001", "merch_001")
                .payment("59.00", "visa", "1111", "AUTH90000")
                .verification("Y", "Y", true)
                .session("192.168.1.150", "DEV900000")
                .risk("4.0", RiskLevel.LOW, false, VelocitySnapshot.of(1, 1, 2))
                .transactionDaysAgo(20, 15)
                .dispute("12.6.1", "duplicate_processing", "Chase Bank", "analyst_002")
                .disputeDaysAgo(12, 10)
                .openedDaysAgo(10, 9)
                .closed(Outcome.LOST, 6, 5)
                .build();
        CaseRecordGenerator custom = customGenerator(List.of(unscripted));

        GenerationSummary summary = custom.generate(5L);

        assertThat(templates.hasAuthoredTrail("cb_900")).isFalse();
        assertThat(summary.fallbackTrails()).isEqualTo(1);
        assertThat(summary.authoredTrails()).isZero();
        List<TrailEntry> trail = caseFileService.caseTrail("cb_900");
        assertThat(trail).extracting(TrailEntry::eventType).containsExactly("support_ticket", "refund");
        assertThat(trail.get(0).payload()).isInstanceOf(SupportContact.class);
        assertThat(trail.get(1).payload()).isInstanceOfSatisfying(RefundAction.class,
                refund -> assertThat(refund.refundAmount()).isEqualByComparingTo("59.00"));
        assertThat(trail.get(1).description()).isEqualTo("Merchant processed refund.");
    }

    @Test
    void failedRunLeavesThePreviousStoreInPlace() {
        GenerationSummary before = generator.generate(3L);
        CaseScenario broken = CaseScenario.builder("cb_901", CaseCategory.FRIENDLY_FRAUD)
                .party("cust_404", "merch_001")
                .payment("20.00", "visa", "2222", "AUTH90001")
                .verification("Y", "Y", false)
                .session("192.168.1.151", "DEV900001")
                .risk("15.0", RiskLevel.LOW, false, VelocitySnapshot.of(1, 1, 1))
                .transactionDaysAgo(20, 15)
                .dispute("13.1", "item_not_received", "Chase Bank", "analyst_001")
                .disputeDaysAgo(12, 10)
                .openedDaysAgo(10, 9)
                .build();
        CaseRecordGenerator custom = customGenerator(List.of(broken));

        assertThatThrownBy(() -> transactionTemplate.executeWithoutResult(status -> custom.generate(9L)))
                .isInstanceOf(CaseConstraintViolationException.class);

        assertThat(storeInspector.rowCounts())
                .containsEntry("chargebacks", 23L)
                .containsEntry("transactions", (long) before.transactions())
                .containsEntry("case_events", before.events());
    }

    @Test
    void refusesToRunAgainstAnUninitializedStore() {
        jdbcTemplate.execute("DROP ALL OBJECTS");

        assertThatThrownBy(() -> generator.generate(1L)).isInstanceOf(StoreNotInitializedException.class);
    }

    private CaseRecordGenerator customGenerator(List<CaseScenario> scenarios) {
        var catalog = new CaseScenarioCatalog(CaseScenarioCatalog.defaultMerchants(),
                CaseScenarioCatalog.defaultCustomers(), scenarios);
        return new CaseRecordGenerator(caseFileService, reconciler, catalog, templates, jdbcTemplate,
                storeInspector, clock, null, 1, 2);
    }
}
