package com.chargedesk.api.casefile;

import com.chargedesk.api.casefile.CustomerStatsReconciler.CustomerDrift;
import com.chargedesk.api.config.TestStoreConfiguration;
import com.chargedesk.api.schema.SchemaInitializer;
import com.chargedesk.core.domain.CardTransaction;
import com.chargedesk.core.domain.Chargeback;
import com.chargedesk.core.domain.Chargeback.Outcome;
import com.chargedesk.core.domain.Customer;
import com.chargedesk.core.domain.Merchant;
import com.chargedesk.core.repository.CustomerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@Import(TestStoreConfiguration.class)
@ActiveProfiles("test")
class CustomerStatsReconcilerTest {

    private static final Instant BASE = Instant.parse("2025-12-01T10:00:00Z");

    @Autowired
    private SchemaInitializer schemaInitializer;
    @Autowired
    private CaseFileService caseFileService;
    @Autowired
    private CustomerStatsReconciler reconciler;
    @Autowired
    private CustomerRepository customerRepository;
    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void twoDisputesForOneCustomer() {
        schemaInitializer.initialize(true);
        caseFileService.registerCustomer(Customer.register("cust_001", "Sarah Johnson", null, "US", BASE));
        caseFileService.registerCustomer(Customer.register("cust_002", "Michael Chen", null, "US", BASE));
        caseFileService.registerMerchant(Merchant.register("merch_001", "TechStore Pro", "Chase Bank", null, BASE));

        dispute("txn_0001", "cb_001", "100.00");
        dispute("txn_0002", "cb_002", "80.00");
        caseFileService.closeChargeback("cb_002", Outcome.LOST, BASE.plus(Duration.ofDays(9)));
    }

    @Test
    void ordinaryWritesLeaveTotalsUntouchedUntilReconciled() {
        assertThat(customerRepository.findById("cust_001")).get()
                .extracting(Customer::getTotalChargebacks).isEqualTo(0);
        assertThat(reconciler.findDrift()).extracting(CustomerDrift::customerId).containsExactly("cust_001");

        int updated = reconciler.reconcile();

        assertThat(updated).isEqualTo(2);
        assertThat(reconciler.findDrift()).isEmpty();
        Customer customer = customerRepository.findById("cust_001").orElseThrow();
        assertThat(customer.getTotalChargebacks()).isEqualTo(2);
        assertThat(customer.getTotalRefunds()).isEqualByComparingTo("80.00");
        Customer untouched = customerRepository.findById("cust_002").orElseThrow();
        assertThat(untouched.getTotalChargebacks()).isZero();
        assertThat(untouched.getTotalRefunds()).isEqualByComparingTo("0");
    }

    @Test
    void tamperedTotalsShowUpAsDriftAndAreRecomputed() {
        reconciler.reconcile();
        jdbcTemplate.update("UPDATE customers SET total_chargebacks = 5, total_refunds = 1.00 WHERE customer_id = 'cust_002'");

        assertThat(reconciler.findDrift()).singleElement().satisfies(drift -> {
            assertThat(drift.customerId()).isEqualTo("cust_002");
            assertThat(drift.storedChargebacks()).isEqualTo(5);
            assertThat(drift.actualChargebacks()).isZero();
            assertThat(drift.storedRefunds()).isEqualByComparingTo("1.00");
            assertThat(drift.actualRefunds()).isEqualByComparingTo("0");
        });

        reconciler.reconcile();
        assertThat(reconciler.findDrift()).isEmpty();
    }

    private void dispute(String transactionId, String chargebackId, String amount) {
        caseFileService.recordTransaction(CardTransaction.builder(transactionId, "cust_001", "merch_001")
                .amount(new BigDecimal(amount))
                .transactionDate(BASE)
                .build());
        caseFileService.fileChargeback(Chargeback.open(chargebackId, transactionId)
                .disputeDate(BASE.plus(Duration.ofDays(3)))
                .chargebackAmount(new BigDecimal(amount))
                .build());
    }
}
