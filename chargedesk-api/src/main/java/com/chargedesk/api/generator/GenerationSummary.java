package com.chargedesk.api.generator;

import com.chargedesk.core.domain.Chargeback.CaseCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * What one generation run wrote.
 */
public record GenerationSummary(
        long seed,
        int merchants,
        int customers,
        int transactions,
        int chargebacks,
        long events,
        Map<CaseCategory, Integer> chargebacksByCategory,
        int authoredTrails,
        int fallbackTrails) {

    public GenerationSummary {
        var copy = new EnumMap<CaseCategory, Integer>(CaseCategory.class);
        copy.putAll(chargebacksByCategory);
        chargebacksByCategory = Collections.unmodifiableMap(copy);
    }

    public int chargebacksIn(CaseCategory category) {
        return chargebacksByCategory.getOrDefault(category, 0);
    }
}
