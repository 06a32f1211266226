package com.chargedesk.api.casefile;

import com.chargedesk.api.casefile.CaseFileService.CaseConstraintViolationException;
import com.chargedesk.api.casefile.CaseFileService.ChargebackNotFoundException;
import com.chargedesk.api.casefile.CaseFileService.TrailEntry;
import com.chargedesk.api.config.TestStoreConfiguration;
import com.chargedesk.api.schema.SchemaInitializer;
import com.chargedesk.api.schema.StoreInspector;
import com.chargedesk.core.domain.CardTransaction;
import com.chargedesk.core.domain.Chargeback;
import com.chargedesk.core.domain.Chargeback.CaseCategory;
import com.chargedesk.core.domain.Chargeback.IllegalCaseTransitionException;
import com.chargedesk.core.domain.Chargeback.Outcome;
import com.chargedesk.core.domain.Chargeback.Status;
import com.chargedesk.core.domain.Customer;
import com.chargedesk.core.domain.Merchant;
import com.chargedesk.core.evidence.OpaquePayload;
import com.chargedesk.core.evidence.RefundAction;
import com.chargedesk.core.evidence.SupportContact;
import com.chargedesk.core.evidence.VelocitySnapshot;
import com.chargedesk.core.repository.CardTransactionRepository;
import com.chargedesk.core.repository.ChargebackRepository;
import org.hibernate.exception.ConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Import(TestStoreConfiguration.class)
@ActiveProfiles("test")
class CaseFileServiceTest {

    private static final Instant DISPUTED = Instant.parse("2026-01-05T09:00:00Z");

    @Autowired
    private SchemaInitializer schemaInitializer;
    @Autowired
    private CaseFileService caseFileService;
    @Autowired
    private StoreInspector storeInspector;
    @Autowired
    private CardTransactionRepository transactionRepository;
    @Autowired
    private ChargebackRepository chargebackRepository;
    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void freshStore() {
        schemaInitializer.initialize(true);
        caseFileService.registerCustomer(
                Customer.register("cust_001", "Sarah Johnson", "sarah.j@email.com", "US", DISPUTED.minus(Duration.ofDays(400))));
        caseFileService.registerMerchant(
                Merchant.register("merch_001", "TechStore Pro", "Chase Bank", new BigDecimal("72.50"), DISPUTED.minus(Duration.ofDays(500))));
    }

    @Test
    void filingMarksTheTransactionDisputed() {
        caseFileService.recordTransaction(transaction("txn_0001", "cust_001").build());
        Chargeback filed = caseFileService.fileChargeback(chargeback("cb_001", "txn_0001").build());

        assertThat(filed.getStatus()).isEqualTo(Status.OPEN);
        assertThat(filed.getOpenedAt()).isEqualTo(DISPUTED);
        assertThat(transactionRepository.findById("txn_0001")).get()
                .extracting(CardTransaction::getStatus).isEqualTo(CardTransaction.Status.DISPUTED);
        assertThat(chargebackRepository.findByTransactionId("txn_0001")).get()
                .extracting(Chargeback::getCaseCategory).isEqualTo(CaseCategory.FRIENDLY_FRAUD);
    }

    @Test
    void transactionForUnknownCustomerIsRejectedAndNothingIsWritten() {
        assertThatThrownBy(() -> caseFileService.recordTransaction(transaction("txn_0001", "cust_404").build()))
                .isInstanceOfSatisfying(CaseConstraintViolationException.class, e -> {
                    assertThat(e.getEntityType()).isEqualTo("transaction");
                    assertThat(e.getEntityId()).isEqualTo("txn_0001");
                    assertThat(e.getConstraint()).isEqualTo("fk_transactions_customer");
                });

        assertThat(storeInspector.rowCounts()).containsEntry("transactions", 0L);
    }

    @Test
    void storeRejectsOrphanRowsWrittenAroundTheService() {
        assertThatThrownBy(() -> jdbcTemplate.update("""
                INSERT INTO transactions (transaction_id, customer_id, merchant_id, amount)
                VALUES ('txn_raw', 'cust_404', 'merch_001', 10.00)
                """))
                .isInstanceOf(DataIntegrityViolationException.class);

        assertThat(storeInspector.rowCounts()).containsEntry("transactions", 0L);
    }

    @Test
    void duplicateIdsAreReportedWithTheirKeyConstraint() {
        assertThatThrownBy(() -> caseFileService.registerCustomer(
                Customer.register("cust_001", "Someone Else", null, null, DISPUTED)))
                .isInstanceOfSatisfying(CaseConstraintViolationException.class,
                        e -> assertThat(e.getConstraint()).isEqualTo("pk_customers"));

        caseFileService.recordTransaction(transaction("txn_0001", "cust_001").build());
        assertThatThrownBy(() -> caseFileService.recordTransaction(transaction("txn_0001", "cust_001").build()))
                .isInstanceOfSatisfying(CaseConstraintViolationException.class,
                        e -> assertThat(e.getConstraint()).isEqualTo("pk_transactions"));
    }

    @Test
    void aTransactionCarriesAtMostOneChargeback() {
        caseFileService.recordTransaction(transaction("txn_0001", "cust_001").build());
        caseFileService.fileChargeback(chargeback("cb_001", "txn_0001").build());

        assertThatThrownBy(() -> caseFileService.fileChargeback(chargeback("cb_002", "txn_0001").build()))
                .isInstanceOfSatisfying(CaseConstraintViolationException.class,
                        e -> assertThat(e.getConstraint()).isEqualTo("uq_chargebacks_transaction"));
        assertThatThrownBy(() -> caseFileService.fileChargeback(chargeback("cb_003", "txn_9999").build()))
                .isInstanceOfSatisfying(CaseConstraintViolationException.class,
                        e -> assertThat(e.getConstraint()).isEqualTo("fk_chargebacks_transaction"));
        assertThat(storeInspector.rowCounts()).containsEntry("chargebacks", 1L);
    }

    @Test
    void closingSetsStatusOutcomeAndClosingTimeTogether() {
        caseFileService.recordTransaction(transaction("txn_0001", "cust_001").build());
        caseFileService.fileChargeback(chargeback("cb_001", "txn_0001").build());
        caseFileService.startReview("cb_001");

        Instant closedAt = DISPUTED.plus(Duration.ofDays(6));
        Chargeback closed = caseFileService.closeChargeback("cb_001", Outcome.WON, closedAt);

        assertThat(closed.getStatus()).isEqualTo(Status.WON);
        assertThat(closed.getOutcome()).isEqualTo(Outcome.WON);
        assertThat(closed.getClosedAt()).isEqualTo(closedAt);
        assertThatThrownBy(() -> caseFileService.closeChargeback("cb_001", Outcome.LOST, closedAt))
                .isInstanceOfSatisfying(IllegalCaseTransitionException.class, e -> {
                    assertThat(e.getFrom()).isEqualTo(Status.WON);
                    assertThat(e.getTo()).isEqualTo(Status.LOST);
                });
        assertThatThrownBy(() -> caseFileService.closeChargeback("cb_404", Outcome.WON, closedAt))
                .isInstanceOf(ChargebackNotFoundException.class);
    }

    @Test
    void storeRejectsAnOutcomeWithoutClosingTime() {
        caseFileService.recordTransaction(transaction("txn_0001", "cust_001").build());
        caseFileService.fileChargeback(chargeback("cb_001", "txn_0001").build());

        assertThatThrownBy(() -> jdbcTemplate.update(
                "UPDATE chargebacks SET status = 'won', outcome = 'won' WHERE chargeback_id = 'cb_001'"))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void trailIsOrderedByDateThenInsertionAndDecodesPayloads() {
        caseFileService.recordTransaction(transaction("txn_0001", "cust_001").build());
        caseFileService.fileChargeback(chargeback("cb_001", "txn_0001").build());

        Instant later = DISPUTED.plus(Duration.ofDays(2));
        caseFileService.appendEvent("cb_001", "refund", later,
                RefundAction.offered(later, new BigDecimal("100.00"), "declined", null), "Refund offered.");
        caseFileService.appendEvent("cb_001", "support_ticket", DISPUTED,
                SupportContact.ticket("TKT00001", DISPUTED, "email", "Never arrived"), "Customer contacted support.");
        Map<String, Object> note = new LinkedHashMap<>();
        note.put("author", "analyst_001");
        note.put("text", "Escalated");
        caseFileService.appendEvent("cb_001", "analyst_note", later, new OpaquePayload(note), "Analyst note.");

        List<TrailEntry> trail = caseFileService.caseTrail("cb_001");

        assertThat(trail).extracting(TrailEntry::eventType)
                .containsExactly("support_ticket", "refund", "analyst_note");
        assertThat(trail.get(0).payload()).isInstanceOfSatisfying(SupportContact.class,
                ticket -> assertThat(ticket.ticketId()).isEqualTo("TKT00001"));
        assertThat(trail.get(1).payload()).isInstanceOfSatisfying(RefundAction.class,
                refund -> assertThat(refund.refundAmount()).isEqualByComparingTo("100.00"));
        assertThat(trail.get(2).payload()).isInstanceOfSatisfying(OpaquePayload.class,
                opaque -> assertThat(opaque.fields()).containsExactly(
                        Map.entry("author", "analyst_001"), Map.entry("text", "Escalated")));
    }

    @Test
    void eventsNeedAnExistingChargebackAndAMatchingPayloadShape() {
        assertThatThrownBy(() -> caseFileService.appendEvent("cb_404", "support_ticket", DISPUTED,
                SupportContact.ticket("TKT00001", DISPUTED, "email", "Hello"), null))
                .isInstanceOfSatisfying(CaseConstraintViolationException.class,
                        e -> assertThat(e.getConstraint()).isEqualTo("fk_case_events_chargeback"));

        caseFileService.recordTransaction(transaction("txn_0001", "cust_001").build());
        caseFileService.fileChargeback(chargeback("cb_001", "txn_0001").build());
        assertThatThrownBy(() -> caseFileService.appendEvent("cb_001", "velocity_check", DISPUTED,
                SupportContact.ticket("TKT00001", DISPUTED, "email", "Hello"), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> caseFileService.caseTrail("cb_404"))
                .isInstanceOf(ChargebackNotFoundException.class);
        assertThat(storeInspector.rowCounts()).containsEntry("case_events", 0L);
    }

    @Test
    void knownEventTypeRefusesAnUntypedPayload() {
        caseFileService.recordTransaction(transaction("txn_0001", "cust_001").build());
        caseFileService.fileChargeback(chargeback("cb_001", "txn_0001").build());
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("cards_last_24h", 3);
        fields.put("ip_country", "RU");

        assertThatThrownBy(() -> caseFileService.appendEvent("cb_001", "velocity_check", DISPUTED,
                new OpaquePayload(fields), "Velocity check."))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("velocity_check");

        assertThat(caseFileService.caseTrail("cb_001")).isEmpty();
        caseFileService.appendEvent("cb_001", "velocity_note", DISPUTED, new OpaquePayload(fields), "Velocity note.");
        assertThat(caseFileService.caseTrail("cb_001")).singleElement()
                .extracting(TrailEntry::payload).isEqualTo(new OpaquePayload(fields));
    }

    @Test
    void storeRaisedViolationsAreNamedAfterTheirConstraint() {
        var raised = new DataIntegrityViolationException("insert failed", new ConstraintViolationException(
                "check failed", new SQLException("check failed"),
                "PUBLIC.\"CK_CHARGEBACKS_AMOUNT: (CHARGEBACK_AMOUNT > 0)\""));

        CaseConstraintViolationException translated =
                CaseConstraintViolationException.from("chargeback", "cb_001", "pk_chargebacks", raised);

        assertThat(translated.getConstraint()).isEqualTo("ck_chargebacks_amount");
        assertThat(translated.getCause()).isSameAs(raised);
        assertThat(CaseConstraintViolationException.from("chargeback", "cb_001", "pk_chargebacks",
                new DataIntegrityViolationException("opaque")).getConstraint()).isEqualTo("pk_chargebacks");
    }

    private static CardTransaction.Builder transaction(String transactionId, String customerId) {
        return CardTransaction.builder(transactionId, customerId, "merch_001")
                .amount(new BigDecimal("100.00"))
                .paymentMethod("visa")
                .cardLast4("4521")
                .transactionDate(DISPUTED.minus(Duration.ofDays(10)))
                .avsCheck("Y")
                .cvvCheck("Y")
                .fraudScore(new BigDecimal("12.0"))
                .riskLevel(CardTransaction.RiskLevel.LOW)
                .velocityData(VelocitySnapshot.of(0, 1, 2));
    }

    private static Chargeback.Builder chargeback(String chargebackId, String transactionId) {
        return Chargeback.open(chargebackId, transactionId)
                .disputeDate(DISPUTED)
                .reasonCode("13.1")
                .disputeType("item_not_received")
                .issuingBank("Chase Bank")
                .chargebackAmount(new BigDecimal("100.00"))
                .caseCategory(CaseCategory.FRIENDLY_FRAUD);
    }
}
