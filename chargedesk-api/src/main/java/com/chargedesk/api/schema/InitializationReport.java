package com.chargedesk.api.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State of the store right after initialization.
 *
 * @param rowCounts rows per case table, in schema order
 * @param indexNames secondary index names, sorted
 * @param schemaVersion applied migration version
 */
public record InitializationReport(Map<String, Long> rowCounts, List<String> indexNames, String schemaVersion) {

    public InitializationReport {
        rowCounts = Collections.unmodifiableMap(new LinkedHashMap<>(rowCounts));
        indexNames = List.copyOf(indexNames);
    }

    public long totalRows() {
        return rowCounts.values().stream().mapToLong(Long::longValue).sum();
    }
}
