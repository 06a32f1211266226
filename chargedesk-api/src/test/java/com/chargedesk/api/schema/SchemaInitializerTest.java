package com.chargedesk.api.schema;

import com.chargedesk.api.casefile.CaseFileService;
import com.chargedesk.api.config.TestStoreConfiguration;
import com.chargedesk.api.schema.SchemaInitializer.StoreOverwriteException;
import com.chargedesk.api.schema.StoreInspector.StoreNotInitializedException;
import com.chargedesk.core.domain.Customer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Store creation and the overwrite guard. Not transactional: schema migration opens its own driver connection.
 */
@SpringBootTest
@Import(TestStoreConfiguration.class)
@ActiveProfiles("test")
class SchemaInitializerTest {

    @Autowired
    private SchemaInitializer schemaInitializer;
    @Autowired
    private StoreInspector storeInspector;
    @Autowired
    private CaseFileService caseFileService;
    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void dropStore() {
        jdbcTemplate.execute("DROP ALL OBJECTS");
    }

    @Test
    void initializesEmptyStoreWithAllTablesAndIndexes() {
        InitializationReport report = schemaInitializer.initialize(false);

        assertThat(report.rowCounts()).containsExactly(
                entry("customers", 0L),
                entry("merchants", 0L),
                entry("transactions", 0L),
                entry("chargebacks", 0L),
                entry("case_events", 0L));
        assertThat(report.totalRows()).isZero();
        assertThat(report.schemaVersion()).isEqualTo("1");
        assertThat(report.indexNames()).containsExactly(
                "idx_case_events_chargeback",
                "idx_case_events_date",
                "idx_case_events_type",
                "idx_chargebacks_category",
                "idx_chargebacks_opened",
                "idx_chargebacks_outcome",
                "idx_chargebacks_status",
                "idx_chargebacks_transaction",
                "idx_transactions_customer",
                "idx_transactions_date",
                "idx_transactions_merchant",
                "idx_transactions_risk_level",
                "idx_transactions_status");
        assertThat(storeInspector.isInitialized()).isTrue();
    }

    @Test
    void refusesToOverwriteWithoutConfirmationAndKeepsData() {
        schemaInitializer.initialize(false);
        caseFileService.registerCustomer(
                Customer.register("cust_001", "Sarah Johnson", "sarah.j@email.com", "US", Instant.now()));

        assertThatThrownBy(() -> schemaInitializer.initialize(false))
                .isInstanceOfSatisfying(StoreOverwriteException.class, e -> assertThat(e.getExistingTables())
                        .containsExactlyElementsOf(StoreInspector.TABLES));

        assertThat(storeInspector.rowCounts()).containsEntry("customers", 1L);
    }

    @Test
    void confirmedOverwriteLeavesAnEmptyStore() {
        schemaInitializer.initialize(false);
        caseFileService.registerCustomer(
                Customer.register("cust_001", "Sarah Johnson", null, null, Instant.now()));

        InitializationReport report = schemaInitializer.initialize(true);

        assertThat(report.totalRows()).isZero();
        assertThat(storeInspector.rowCounts()).containsEntry("customers", 0L);
    }

    @Test
    void partialStoreIsTreatedAsExisting() {
        jdbcTemplate.execute("CREATE TABLE customers (customer_id VARCHAR(50) PRIMARY KEY)");

        assertThat(storeInspector.isInitialized()).isFalse();
        assertThatThrownBy(() -> schemaInitializer.initialize(false))
                .isInstanceOf(StoreOverwriteException.class)
                .hasMessageContaining("customers");
    }

    @Test
    void operationsOnUninitializedStoreNameTheMissingTables() {
        assertThatThrownBy(storeInspector::requireInitialized)
                .isInstanceOfSatisfying(StoreNotInitializedException.class, e -> assertThat(e.getMissingTables())
                        .containsExactlyElementsOf(StoreInspector.TABLES));

        assertThatThrownBy(() -> caseFileService.registerCustomer(
                Customer.register("cust_001", "Sarah Johnson", null, null, Instant.now())))
                .isInstanceOf(StoreNotInitializedException.class);
    }
}
