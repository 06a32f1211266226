package com.chargedesk.api.schema;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Creates the chargeback store: drops whatever the schema holds and applies the
 * migrations from {@code db/migration}.
 *
 * Destructive. A store that already holds case tables is only overwritten when the
 * caller confirms it. Migration opens its own driver connection to the configured
 * URL and never borrows from the connection pool, so it works with a single-connection
 * pool. Must run outside any open transaction.
 */
@Service
public class SchemaInitializer {

    private static final Logger log = LoggerFactory.getLogger(SchemaInitializer.class);

    private static final String MIGRATION_LOCATION = "classpath:db/migration";

    private final DataSourceProperties dataSourceProperties;
    private final StoreInspector inspector;

    public SchemaInitializer(DataSourceProperties dataSourceProperties, StoreInspector inspector) {
        this.dataSourceProperties = dataSourceProperties;
        this.inspector = inspector;
    }

    /**
     * @param confirmOverwrite whether existing case tables may be dropped
     * @throws StoreOverwriteException if case tables exist and overwrite was not confirmed
     */
    public InitializationReport initialize(boolean confirmOverwrite) {
        List<String> existing = inspector.existingTables();
        if (!existing.isEmpty()) {
            if (!confirmOverwrite) {
                throw new StoreOverwriteException(existing);
            }
            log.warn("Overwriting chargeback store; dropping tables {}", existing);
        }

        Flyway flyway = Flyway.configure()
                .dataSource(dataSourceProperties.determineUrl(),
                        dataSourceProperties.determineUsername(),
                        dataSourceProperties.determinePassword())
                .locations(MIGRATION_LOCATION)
                .cleanDisabled(false)
                .load();
        flyway.clean();
        MigrateResult result = flyway.migrate();
        log.info("Applied {} migration(s) to the chargeback store", result.migrationsExecuted);

        MigrationInfo current = flyway.info().current();
        String version = current == null ? "none" : current.getVersion().getVersion();
        var report = new InitializationReport(inspector.rowCounts(), inspector.indexNames(), version);
        log.info("Chargeback store initialized at schema version {} with {} indexes",
                version, report.indexNames().size());
        return report;
    }

    public static class StoreOverwriteException extends RuntimeException {
        private final List<String> existingTables;

        public StoreOverwriteException(List<String> existingTables) {
            super("Chargeback store already contains tables " + existingTables
                    + "; initialization would drop them. Confirm the overwrite to proceed.");
            this.existingTables = List.copyOf(existingTables);
        }

        public List<String> getExistingTables() { return existingTables; }
    }
}
