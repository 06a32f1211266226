package com.chargedesk.api.generator;

import com.chargedesk.core.domain.CardTransaction.RiskLevel;
import com.chargedesk.core.domain.Chargeback.CaseCategory;
import com.chargedesk.core.evidence.CaseEventType;
import com.chargedesk.core.evidence.FraudIndicators;
import com.chargedesk.core.evidence.VelocitySnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EvidenceTemplatesTest {

    private static final Instant NOW = Instant.parse("2026-01-15T12:00:00Z");

    private final EvidenceTemplates templates = new EvidenceTemplates();

    @Test
    void everyCatalogScenarioHasAnAuthoredTrail() {
        for (CaseScenario scenario : CaseScenarioCatalog.defaultScenarios()) {
            assertThat(templates.hasAuthoredTrail(scenario.chargebackId()))
                    .as(scenario.chargebackId()).isTrue();
        }
    }

    @Test
    void authoredPayloadsMatchTheirEventTypes() {
        for (CaseScenario scenario : CaseScenarioCatalog.defaultScenarios()) {
            List<EvidenceItem> trail = templates.trailFor(scenario, timeline(scenario.isClosed()));

            assertThat(trail).as(scenario.chargebackId()).isNotEmpty().allSatisfy(item -> {
                assertThat(CaseEventType.fromTag(item.eventType())).isPresent();
                assertThat(CaseEventType.accepts(item.eventType(), item.payload())).isTrue();
                assertThat(item.description()).isNotBlank();
            });
            assertThat(trail.get(0).eventType()).isEqualTo("support_ticket");
        }
    }

    @Test
    void catalogKeepsTrueFraudScoresWellAboveNotGuilty() {
        List<CaseScenario> scenarios = CaseScenarioCatalog.defaultScenarios();
        double lowestTrueFraud = scenarios.stream().filter(s -> s.category() == CaseCategory.TRUE_FRAUD)
                .mapToDouble(s -> s.fraudScore().doubleValue()).min().orElseThrow();
        double highestNotGuilty = scenarios.stream().filter(s -> s.category() == CaseCategory.NOT_GUILTY)
                .mapToDouble(s -> s.fraudScore().doubleValue()).max().orElseThrow();

        assertThat(lowestTrueFraud - highestNotGuilty).isGreaterThanOrEqualTo(50.0);
        assertThat(scenarios).extracting(CaseScenario::chargebackId).doesNotHaveDuplicates();
    }

    @ParameterizedTest
    @EnumSource(CaseCategory.class)
    void unscriptedCaseFallsBackToContactThenResolution(CaseCategory category) {
        CaseScenario scenario = unscripted(category);

        List<EvidenceItem> trail = templates.trailFor(scenario, timeline(false));

        assertThat(templates.hasAuthoredTrail(scenario.chargebackId())).isFalse();
        assertThat(trail).hasSize(2);
        assertThat(trail.get(0).eventType()).isEqualTo("support_ticket");
        assertThat(trail).allSatisfy(item ->
                assertThat(CaseEventType.accepts(item.eventType(), item.payload())).isTrue());
        if (category == CaseCategory.TRUE_FRAUD) {
            assertThat(trail.get(1).payload()).isInstanceOfSatisfying(FraudIndicators.class,
                    indicators -> assertThat(indicators.verificationFailed()).isTrue());
        } else {
            assertThat(trail.get(1).eventType()).isEqualTo("refund");
        }
    }

    private static CaseScenario unscripted(CaseCategory category) {
        boolean fraud = category == CaseCategory.TRUE_FRAUD;
        return CaseScenario.builder("cb_950", category)
                .party("cust_001", "merch_001")
                .payment("120.00", "visa", "4242", "AUTH95000")
                .verification(fraud ? "N" : "Y", fraud ? "N" : "Y", !fraud)
                .session("192.168.1.180", "DEV950000")
                .risk(fraud ? "91.0" : "12.0", fraud ? RiskLevel.CRITICAL : RiskLevel.LOW, fraud,
                        fraud ? VelocitySnapshot.of(5, 3, 9) : VelocitySnapshot.of(1, 1, 1))
                .transactionDaysAgo(30, 25)
                .dispute("10.4", "fraud", "Chase Bank", "analyst_001")
                .disputeDaysAgo(20, 18)
                .openedDaysAgo(17, 16)
                .build();
    }

    private static CaseTimeline timeline(boolean closed) {
        Instant transactionDate = NOW.minus(Duration.ofDays(30));
        Instant disputeDate = NOW.minus(Duration.ofDays(20));
        Instant openedAt = NOW.minus(Duration.ofDays(18));
        return new CaseTimeline("txn_0001", transactionDate, disputeDate, openedAt,
                closed ? NOW.minus(Duration.ofDays(5)) : null, NOW);
    }
}
