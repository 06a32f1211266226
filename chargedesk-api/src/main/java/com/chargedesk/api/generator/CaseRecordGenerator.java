package com.chargedesk.api.generator;

import com.chargedesk.api.casefile.CaseFileService;
import com.chargedesk.api.casefile.CustomerStatsReconciler;
import com.chargedesk.api.generator.CaseScenarioCatalog.CustomerProfile;
import com.chargedesk.api.generator.CaseScenarioCatalog.MerchantProfile;
import com.chargedesk.api.schema.StoreInspector;
import com.chargedesk.core.domain.CardTransaction;
import com.chargedesk.core.domain.CardTransaction.RiskLevel;
import com.chargedesk.core.domain.Chargeback;
import com.chargedesk.core.domain.Chargeback.CaseCategory;
import com.chargedesk.core.domain.Customer;
import com.chargedesk.core.domain.Merchant;
import com.chargedesk.core.evidence.VelocitySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Replaces the store's contents with a coherent synthetic data set: reference parties,
 * low-risk background traffic and one disputed transaction per catalog scenario, each
 * with its evidentiary trail.
 *
 * A run is one transaction. Any failure rolls the store back to what it held before.
 */
@Service
public class CaseRecordGenerator {

    private static final Logger log = LoggerFactory.getLogger(CaseRecordGenerator.class);

    // children first
    private static final List<String> CLEAR_ORDER =
            List.of("case_events", "chargebacks", "transactions", "customers", "merchants");

    private static final List<String> PAYMENT_METHODS = List.of("visa", "mastercard", "amex", "discover");
    private static final List<String> VERIFICATION_CODES = List.of("Y", "Y", "Y", "Z");
    private static final Duration RESPONSE_WINDOW = Duration.ofDays(30);

    private final CaseFileService caseFileService;
    private final CustomerStatsReconciler reconciler;
    private final CaseScenarioCatalog catalog;
    private final EvidenceTemplates templates;
    private final JdbcTemplate jdbcTemplate;
    private final StoreInspector storeInspector;
    private final Clock clock;
    private final Long configuredSeed;
    private final int minBackgroundTransactions;
    private final int maxBackgroundTransactions;

    public CaseRecordGenerator(
            CaseFileService caseFileService,
            CustomerStatsReconciler reconciler,
            CaseScenarioCatalog catalog,
            EvidenceTemplates templates,
            JdbcTemplate jdbcTemplate,
            StoreInspector storeInspector,
            Clock clock,
            @Value("${chargedesk.generator.seed:#{null}}") Long configuredSeed,
            @Value("${chargedesk.generator.background-transactions.min:5}") int minBackgroundTransactions,
            @Value("${chargedesk.generator.background-transactions.max:10}") int maxBackgroundTransactions) {
        if (minBackgroundTransactions < 0 || maxBackgroundTransactions < minBackgroundTransactions) {
            throw new IllegalArgumentException("Invalid background transaction range "
                    + minBackgroundTransactions + ".." + maxBackgroundTransactions);
        }
        this.caseFileService = caseFileService;
        this.reconciler = reconciler;
        this.catalog = catalog;
        this.templates = templates;
        this.jdbcTemplate = jdbcTemplate;
        this.storeInspector = storeInspector;
        this.clock = clock;
        this.configuredSeed = configuredSeed;
        this.minBackgroundTransactions = minBackgroundTransactions;
        this.maxBackgroundTransactions = maxBackgroundTransactions;
    }

    /**
     * Generates with the configured seed, or a random one when none is configured.
     */
    @Transactional
    public GenerationSummary generate() {
        long seed = configuredSeed != null ? configuredSeed : ThreadLocalRandom.current().nextLong();
        return generate(seed);
    }

    @Transactional
    public GenerationSummary generate(long seed) {
        storeInspector.requireInitialized();
        log.info("Generating case records with seed {}", seed);
        clearStore();

        RandomDates random = new RandomDates(seed, clock);
        Run run = new Run(random);

        for (MerchantProfile profile : catalog.merchants()) {
            caseFileService.registerMerchant(Merchant.register(profile.merchantId(), profile.name(),
                    profile.acquiringBank(), profile.winRate(), random.daysAgo(730, 1)));
        }
        for (CustomerProfile profile : catalog.customers()) {
            caseFileService.registerCustomer(Customer.register(profile.customerId(), profile.name(),
                    profile.email(), profile.region(), random.daysAgo(730, 1)));
        }
        for (CustomerProfile profile : catalog.customers()) {
            int count = random.between(minBackgroundTransactions, maxBackgroundTransactions);
            for (int i = 0; i < count; i++) {
                caseFileService.recordTransaction(backgroundTransaction(run, profile.customerId()));
            }
        }
        log.debug("Wrote {} background transaction(s)", run.transactions);

        for (CaseScenario scenario : catalog.scenarios()) {
            writeCase(run, scenario);
        }

        reconciler.reconcile();

        GenerationSummary summary = new GenerationSummary(seed, catalog.merchants().size(),
                catalog.customers().size(), run.transactions, catalog.scenarios().size(), run.events,
                run.byCategory, run.authored, run.fallback);
        log.info("Generated {} merchant(s), {} customer(s), {} transaction(s), {} chargeback(s), {} event(s)",
                summary.merchants(), summary.customers(), summary.transactions(), summary.chargebacks(),
                summary.events());
        if (summary.fallbackTrails() > 0) {
            log.info("{} case(s) received a generic evidence trail", summary.fallbackTrails());
        }
        return summary;
    }

    private void clearStore() {
        for (String table : CLEAR_ORDER) {
            int removed = jdbcTemplate.update("DELETE FROM " + table);
            log.debug("Cleared {} row(s) from {}", removed, table);
        }
    }

    private CardTransaction backgroundTransaction(Run run, String customerId) {
        RandomDates random = run.random;
        MerchantProfile merchant = random.pick(catalog.merchants());
        Instant date = random.daysAgo(180, 10);
        return CardTransaction.builder(run.nextTransactionId(), customerId, merchant.merchantId())
                .amount(random.decimal(25, 850))
                .paymentMethod(random.pick(PAYMENT_METHODS))
                .cardLast4(String.format("%04d", random.between(0, 9999)))
                .transactionDate(date)
                .avsCheck(random.pick(VERIFICATION_CODES))
                .cvvCheck(random.pick(VERIFICATION_CODES))
                .threeDsUsed(random.flip())
                .authCode(String.format("AUTH%05d", random.between(10000, 99999)))
                .ipAddress("192.168." + random.between(1, 254) + "." + random.between(1, 254))
                .deviceFingerprint(String.format("DEV%06d", random.between(100000, 999999)))
                .fraudScore(random.decimal(5, 25))
                .riskLevel(RiskLevel.LOW)
                .velocityFlag(false)
                .velocityData(VelocitySnapshot.of(0, 1, random.between(1, 3)))
                .riskAssessedAt(date)
                .build();
    }

    private void writeCase(Run run, CaseScenario scenario) {
        RandomDates random = run.random;
        String transactionId = run.nextTransactionId();
        Instant transactionDate = random.daysAgo(scenario.transactionWindow());
        Instant disputeDate = latest(transactionDate, random.daysAgo(scenario.disputeWindow()));
        Instant openedAt = latest(disputeDate, random.daysAgo(scenario.openedWindow()));
        Instant closedAt = scenario.isClosed() ? latest(openedAt, random.daysAgo(scenario.closedWindow())) : null;

        caseFileService.recordTransaction(CardTransaction.builder(transactionId, scenario.customerId(), scenario.merchantId())
                .amount(scenario.amount())
                .paymentMethod(scenario.paymentMethod())
                .cardLast4(scenario.cardLast4())
                .transactionDate(transactionDate)
                .avsCheck(scenario.avsCheck())
                .cvvCheck(scenario.cvvCheck())
                .threeDsUsed(scenario.threeDsUsed())
                .authCode(scenario.authCode())
                .ipAddress(scenario.ipAddress())
                .deviceFingerprint(scenario.deviceFingerprint())
                .fraudScore(scenario.fraudScore())
                .riskLevel(scenario.riskLevel())
                .velocityFlag(scenario.velocityFlag())
                .velocityData(scenario.velocity())
                .riskAssessedAt(transactionDate)
                .build());

        caseFileService.fileChargeback(Chargeback.open(scenario.chargebackId(), transactionId)
                .disputeDate(disputeDate)
                .reasonCode(scenario.reasonCode())
                .disputeType(scenario.disputeType())
                .issuingBank(scenario.issuingBank())
                .chargebackAmount(scenario.chargebackAmount())
                .analystId(scenario.analystId())
                .openedAt(openedAt)
                .caseCategory(scenario.category())
                .responseDeadline(disputeDate.plus(RESPONSE_WINDOW))
                .notes(scenario.notes())
                .build());
        if (closedAt != null) {
            caseFileService.closeChargeback(scenario.chargebackId(), scenario.outcome(), closedAt);
        }

        CaseTimeline timeline = new CaseTimeline(transactionId, transactionDate, disputeDate, openedAt, closedAt,
                random.now());
        List<EvidenceItem> trail = templates.trailFor(scenario, timeline);
        if (templates.hasAuthoredTrail(scenario.chargebackId())) {
            run.authored++;
        } else {
            run.fallback++;
        }

        // spread evenly from the dispute date to the end of the case window
        Instant start = timeline.disputeDate();
        long span = Duration.between(start, latest(start, timeline.trailEnd())).getSeconds();
        for (int i = 0; i < trail.size(); i++) {
            EvidenceItem item = trail.get(i);
            Instant eventDate = start.plusSeconds(span * i / trail.size()).truncatedTo(ChronoUnit.SECONDS);
            caseFileService.appendEvent(scenario.chargebackId(), item.eventType(), eventDate, item.payload(),
                    item.description());
            run.events++;
        }
        run.byCategory.merge(scenario.category(), 1, Integer::sum);
        log.debug("Wrote case {} ({}) with {} event(s)", scenario.chargebackId(), scenario.category().code(),
                trail.size());
    }

    private static Instant latest(Instant floor, Instant candidate) {
        return candidate.isBefore(floor) ? floor : candidate;
    }

    /** Mutable counters of one generation run. */
    private static final class Run {
        private final RandomDates random;
        private final Map<CaseCategory, Integer> byCategory = new EnumMap<>(CaseCategory.class);
        private int transactions;
        private long events;
        private int authored;
        private int fallback;

        Run(RandomDates random) {
            this.random = random;
        }

        String nextTransactionId() {
            transactions++;
            return String.format("txn_%04d", transactions);
        }
    }
}
