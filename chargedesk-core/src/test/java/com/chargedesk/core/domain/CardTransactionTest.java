package com.chargedesk.core.domain;

import com.chargedesk.core.domain.CardTransaction.RiskLevel;
import com.chargedesk.core.domain.CardTransaction.Status;
import com.chargedesk.core.evidence.VelocitySnapshot;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CardTransactionTest {

    private static final Instant AUTHORIZED = Instant.parse("2026-01-10T14:30:00Z");

    @Test
    void newTransactionIsCompletedAndCanBeDisputedOnce() {
        CardTransaction transaction = valid().build();

        assertThat(transaction.getStatus()).isEqualTo(Status.COMPLETED);
        assertThat(transaction.getCurrency()).isEqualTo("USD");

        transaction.markDisputed();
        assertThat(transaction.isDisputed()).isTrue();
        assertThatThrownBy(transaction::markDisputed).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsNonPositiveAmount() {
        assertThatThrownBy(() -> valid().amount(BigDecimal.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
    }

    @Test
    void rejectsMalformedCardSuffix() {
        assertThatThrownBy(() -> valid().cardLast4("12a4").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> valid().cardLast4("12345").build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsFraudScoreOutsidePercentRange() {
        assertThatThrownBy(() -> valid().fraudScore(new BigDecimal("100.01")).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> valid().fraudScore(new BigDecimal("-0.01")).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(valid().fraudScore(new BigDecimal("100.00")).build().getFraudScore())
                .isEqualByComparingTo("100");
    }

    @Test
    void normalisesCurrencyCode() {
        assertThat(valid().currency("eur").build().getCurrency()).isEqualTo("EUR");
        assertThatThrownBy(() -> valid().currency("EURO").build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void riskLevelCodesAreLowercase() {
        assertThat(new CardTransaction.RiskLevelConverter().convertToDatabaseColumn(RiskLevel.CRITICAL))
                .isEqualTo("critical");
        assertThat(new CardTransaction.RiskLevelConverter().convertToEntityAttribute("medium"))
                .isEqualTo(RiskLevel.MEDIUM);
        assertThatThrownBy(() -> new CardTransaction.StatusConverter().convertToEntityAttribute("refunded"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("refunded");
    }

    private static CardTransaction.Builder valid() {
        return CardTransaction.builder("txn_0001", "cust_001", "merch_001")
                .amount(new BigDecimal("100.00"))
                .paymentMethod("visa")
                .cardLast4("4521")
                .transactionDate(AUTHORIZED)
                .fraudScore(new BigDecimal("12.50"))
                .riskLevel(RiskLevel.LOW)
                .velocityData(VelocitySnapshot.of(0, 1, 2));
    }
}
