package com.chargedesk.api.schema;

import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads the store's catalog: which case tables exist, their secondary indexes and row counts.
 */
@Component
public class StoreInspector {

    /** Case tables in schema order, parents first. */
    public static final List<String> TABLES =
            List.of("customers", "merchants", "transactions", "chargebacks", "case_events");

    private static final String INDEX_PREFIX = "idx_";

    private final JdbcTemplate jdbcTemplate;

    public StoreInspector(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public boolean isInitialized() {
        return existingTables().size() == TABLES.size();
    }

    /**
     * Case tables present in the store, in schema order.
     */
    public List<String> existingTables() {
        Set<String> present = jdbcTemplate.execute((ConnectionCallback<Set<String>>) connection -> {
            Set<String> names = new TreeSet<>();
            DatabaseMetaData metaData = connection.getMetaData();
            try (ResultSet tables = metaData.getTables(connection.getCatalog(), connection.getSchema(), "%", null)) {
                while (tables.next()) {
                    names.add(tables.getString("TABLE_NAME").toLowerCase(Locale.ROOT));
                }
            }
            return names;
        });
        return TABLES.stream().filter(present::contains).toList();
    }

    /**
     * Names of the secondary indexes declared on the case tables, sorted.
     * Indexes the database creates implicitly for keys and constraints are excluded.
     */
    public List<String> indexNames() {
        List<String> existing = existingTables();
        Set<String> indexes = jdbcTemplate.execute((ConnectionCallback<Set<String>>) connection -> {
            Set<String> names = new TreeSet<>();
            DatabaseMetaData metaData = connection.getMetaData();
            for (String table : existing) {
                collectIndexNames(metaData, connection.getCatalog(), connection.getSchema(), table, names);
            }
            return names;
        });
        return new ArrayList<>(indexes);
    }

    private static void collectIndexNames(DatabaseMetaData metaData, String catalog, String schema,
                                          String table, Set<String> names) throws SQLException {
        // unquoted identifiers are folded to upper case by H2
        for (String candidate : List.of(table.toUpperCase(Locale.ROOT), table)) {
            try (ResultSet indexes = metaData.getIndexInfo(catalog, schema, candidate, false, false)) {
                while (indexes.next()) {
                    String name = indexes.getString("INDEX_NAME");
                    if (name != null && name.toLowerCase(Locale.ROOT).startsWith(INDEX_PREFIX)) {
                        names.add(name.toLowerCase(Locale.ROOT));
                    }
                }
            }
        }
    }

    /**
     * Row count per case table, in schema order.
     *
     * @throws StoreNotInitializedException if any case table is missing
     */
    public Map<String, Long> rowCounts() {
        requireInitialized();
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String table : TABLES) {
            Long rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
            counts.put(table, rows == null ? 0L : rows);
        }
        return counts;
    }

    /**
     * @throws StoreNotInitializedException naming the missing tables
     */
    public void requireInitialized() {
        List<String> existing = existingTables();
        if (existing.size() != TABLES.size()) {
            List<String> missing = TABLES.stream().filter(table -> !existing.contains(table)).toList();
            throw new StoreNotInitializedException(missing);
        }
    }

    public static class StoreNotInitializedException extends RuntimeException {
        private final List<String> missingTables;

        public StoreNotInitializedException(List<String> missingTables) {
            super("Chargeback store is not initialized; missing tables " + missingTables + ". Run 'init' first.");
            this.missingTables = List.copyOf(missingTables);
        }

        public List<String> getMissingTables() { return missingTables; }
    }
}
