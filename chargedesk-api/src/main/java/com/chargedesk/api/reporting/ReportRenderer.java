package com.chargedesk.api.reporting;

import com.chargedesk.api.casefile.CustomerStatsReconciler.CustomerDrift;
import com.chargedesk.api.reporting.ReportingService.CategoryStatistics;
import com.chargedesk.api.reporting.ReportingService.ChargebackListing;
import com.chargedesk.api.reporting.ReportingService.ChargebackStatistics;
import com.chargedesk.api.reporting.ReportingService.CustomerSummary;
import com.chargedesk.api.reporting.ReportingService.EventSummary;
import com.chargedesk.api.reporting.ReportingService.EventTypeFrequency;
import com.chargedesk.api.reporting.ReportingService.MerchantSummary;
import com.chargedesk.api.reporting.ReportingService.QueuedCase;
import com.chargedesk.api.reporting.ReportingService.RiskLevelStatistics;
import com.chargedesk.api.reporting.ReportingService.StoreOverview;
import com.chargedesk.api.reporting.ReportingService.TransactionStatistics;
import com.chargedesk.api.reporting.ReportingService.TransactionSummary;
import com.chargedesk.core.domain.Chargeback.Status;
import com.chargedesk.core.domain.CodedEnum;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link StoreOverview} as plain text: one titled section per view, tables in a
 * fixed-width grid, and "No ... found." for an empty listing.
 */
@Component
public class ReportRenderer {

    private static final String RULE = "=".repeat(80);
    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    public String render(StoreOverview overview) {
        StringBuilder out = new StringBuilder();
        out.append(RULE).append('\n').append("CHARGEBACK STORE OVERVIEW").append('\n').append(RULE).append('\n');

        out.append("\nTable counts:\n");
        for (Map.Entry<String, Long> entry : overview.tableCounts().entrySet()) {
            out.append(String.format(Locale.ROOT, "   %-20s %6d rows%n", entry.getKey(), entry.getValue()));
        }

        section(out, "CUSTOMERS");
        TextTable customers = new TextTable("ID", "Name", "Email", "Region", "Total CBs", "Total Refunds");
        for (CustomerSummary c : overview.customers()) {
            customers.row(c.customerId(), c.name(), c.email(), c.region(), c.totalChargebacks(), money(c.totalRefunds()));
        }
        table(out, customers, "customers");
        for (CustomerDrift drift : overview.customerDrift()) {
            out.append(String.format(Locale.ROOT, "   ! %s totals out of date: %d chargebacks stored, %d on file%n",
                    drift.customerId(), drift.storedChargebacks(), drift.actualChargebacks()));
        }

        section(out, "MERCHANTS");
        TextTable merchants = new TextTable("ID", "Name", "Acquiring Bank", "Win Rate %");
        for (MerchantSummary m : overview.merchants()) {
            merchants.row(m.merchantId(), m.name(), m.acquiringBank(), m.winRate());
        }
        table(out, merchants, "merchants");

        section(out, "TRANSACTIONS");
        TransactionStatistics tx = overview.transactionStatistics();
        out.append("   Total Transactions: ").append(tx.count()).append('\n')
                .append("   Unique Customers: ").append(tx.distinctCustomers()).append('\n')
                .append("   Unique Merchants: ").append(tx.distinctMerchants()).append('\n')
                .append("   Total Amount: ").append(money(tx.totalAmount())).append('\n')
                .append("   Average Amount: ").append(money(tx.averageAmount())).append('\n')
                .append("   Min Amount: ").append(money(tx.minAmount())).append('\n')
                .append("   Max Amount: ").append(money(tx.maxAmount())).append('\n');
        out.append("\n   Recent transactions:\n");
        TextTable recent = new TextTable("Transaction ID", "Customer", "Merchant", "Amount", "Date", "Status",
                "Risk Level", "Fraud Score");
        for (TransactionSummary t : overview.recentTransactions()) {
            recent.row(t.transactionId(), t.customerId(), t.merchantId(), money(t.amount()),
                    timestamp(t.transactionDate()), code(t.status()), code(t.riskLevel()), t.fraudScore());
        }
        table(out, recent, "transactions");

        section(out, "CHARGEBACKS");
        ChargebackStatistics cb = overview.chargebackStatistics();
        out.append("   Total Chargebacks: ").append(cb.total()).append('\n')
                .append("   Open: ").append(cb.count(Status.OPEN)).append('\n')
                .append("   Under Review: ").append(cb.count(Status.UNDER_REVIEW)).append('\n')
                .append("   Won: ").append(cb.count(Status.WON)).append('\n')
                .append("   Lost: ").append(cb.count(Status.LOST)).append('\n')
                .append("   Total Amount: ").append(money(cb.disputedAmount())).append('\n');
        out.append("\n   All chargebacks:\n");
        TextTable chargebacks = new TextTable("Chargeback ID", "Transaction ID", "Dispute Date", "Reason Code",
                "Category", "CB Amount", "Status", "Outcome", "Tx Amount", "Currency", "Payment", "Risk Level",
                "Customer", "Email", "Merchant", "Issuing Bank", "Analyst", "Response Due");
        for (ChargebackListing c : overview.chargebacks()) {
            chargebacks.row(c.chargebackId(), c.transactionId(), timestamp(c.disputeDate()), c.reasonCode(),
                    code(c.category()), money(c.chargebackAmount()), code(c.status()), code(c.outcome()),
                    money(c.amount()), c.currency(), c.paymentMethod(), code(c.riskLevel()), c.customerName(),
                    c.customerEmail(), c.merchantName(), c.issuingBank(), c.analystId(),
                    timestamp(c.responseDeadline()));
        }
        table(out, chargebacks, "chargebacks");

        out.append("\n   Case queue:\n");
        TextTable queue = new TextTable("Chargeback ID", "Status", "Category", "CB Amount", "Analyst",
                "Dispute Date", "Response Due");
        for (QueuedCase q : overview.caseQueue()) {
            queue.row(q.chargebackId(), code(q.status()), code(q.category()), money(q.chargebackAmount()),
                    q.analystId(), timestamp(q.disputeDate()), timestamp(q.responseDeadline()));
        }
        table(out, queue, "open cases");

        section(out, "CASE EVENTS");
        TextTable eventTypes = new TextTable("Event Type", "Count");
        for (EventTypeFrequency e : overview.eventTypes()) {
            eventTypes.row(e.eventType(), e.count());
        }
        table(out, eventTypes, "case events");
        out.append("\n   Recent events:\n");
        TextTable events = new TextTable("Event ID", "Chargeback ID", "Type", "Date", "Description");
        for (EventSummary e : overview.recentEvents()) {
            events.row(e.eventId(), e.chargebackId(), e.eventType(), timestamp(e.eventDate()),
                    abbreviate(e.description(), 60));
        }
        table(out, events, "case events");

        section(out, "RISK ANALYSIS");
        TextTable risk = new TextTable("Risk Level", "Count", "Avg Fraud Score", "Total Amount");
        for (RiskLevelStatistics r : overview.riskLevels()) {
            risk.row(code(r.riskLevel()), r.count(), r.averageFraudScore(), money(r.totalAmount()));
        }
        table(out, risk, "risk assessments");
        out.append("\n   By case category:\n");
        TextTable categories = new TextTable("Category", "Cases", "Avg Fraud Score", "Disputed Amount");
        for (CategoryStatistics c : overview.categories()) {
            categories.row(code(c.category()), c.count(), c.averageFraudScore(), money(c.disputedAmount()));
        }
        table(out, categories, "categorized cases");

        out.append('\n').append(RULE).append('\n');
        return out.toString();
    }

    private static void section(StringBuilder out, String title) {
        out.append('\n').append(RULE).append('\n').append(title).append('\n').append(RULE).append('\n');
    }

    private static void table(StringBuilder out, TextTable table, String subject) {
        if (table.isEmpty()) {
            out.append("   No ").append(subject).append(" found.\n");
        } else {
            out.append(table.render());
        }
    }

    private static String money(BigDecimal amount) {
        if (amount == null) {
            return "";
        }
        DecimalFormat format = new DecimalFormat("$#,##0.00", DecimalFormatSymbols.getInstance(Locale.US));
        return format.format(amount);
    }

    private static String timestamp(Instant instant) {
        return instant == null ? "" : TIMESTAMP.format(instant);
    }

    private static String code(CodedEnum value) {
        return value == null ? "" : value.code();
    }

    private static String abbreviate(String text, int max) {
        if (text == null || text.length() <= max) {
            return text;
        }
        return text.substring(0, max - 3) + "...";
    }
}
