package com.chargedesk.api.generator;

import com.chargedesk.core.domain.CardTransaction.RiskLevel;
import com.chargedesk.core.evidence.VelocitySnapshot;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

import static com.chargedesk.core.domain.Chargeback.CaseCategory.FRIENDLY_FRAUD;
import static com.chargedesk.core.domain.Chargeback.CaseCategory.MERCHANT_ERROR;
import static com.chargedesk.core.domain.Chargeback.CaseCategory.NOT_GUILTY;
import static com.chargedesk.core.domain.Chargeback.CaseCategory.TRUE_FRAUD;
import static com.chargedesk.core.domain.Chargeback.Outcome.LOST;
import static com.chargedesk.core.domain.Chargeback.Outcome.WON;

/**
 * Reference parties and dispute scenarios written by the case record generator.
 *
 * Scores are chosen per category: true fraud at 85 or above, friendly fraud 10 to 20,
 * merchant error at most 10, not guilty at most 15.
 */
@Component
public class CaseScenarioCatalog {

    public record MerchantProfile(String merchantId, String name, String acquiringBank, BigDecimal winRate) {}

    public record CustomerProfile(String customerId, String name, String email, String region) {}

    private final List<MerchantProfile> merchants;
    private final List<CustomerProfile> customers;
    private final List<CaseScenario> scenarios;

    public CaseScenarioCatalog() {
        this(defaultMerchants(), defaultCustomers(), defaultScenarios());
    }

    public CaseScenarioCatalog(List<MerchantProfile> merchants, List<CustomerProfile> customers,
                               List<CaseScenario> scenarios) {
        this.merchants = List.copyOf(merchants);
        this.customers = List.copyOf(customers);
        this.scenarios = List.copyOf(scenarios);
    }

    public List<MerchantProfile> merchants() { return merchants; }
    public List<CustomerProfile> customers() { return customers; }
    public List<CaseScenario> scenarios() { return scenarios; }

    public static List<MerchantProfile> defaultMerchants() {
        return List.of(
                new MerchantProfile("merch_001", "TechStore Pro", "Chase Bank", new BigDecimal("72.50")),
                new MerchantProfile("merch_002", "FashionHub", "Bank of America", new BigDecimal("68.30")),
                new MerchantProfile("merch_003", "Electronics Plus", "Wells Fargo", new BigDecimal("75.10")),
                new MerchantProfile("merch_004", "Home Essentials", "Citi Bank", new BigDecimal("70.80")));
    }

    public static List<CustomerProfile> defaultCustomers() {
        return List.of(
                new CustomerProfile("cust_001", "Sarah Johnson", "sarah.j@email.com", "US"),
                new CustomerProfile("cust_002", "Michael Chen", "m.chen@email.com", "US"),
                new CustomerProfile("cust_003", "Emma Williams", "emma.w@email.com", "US"),
                new CustomerProfile("cust_004", "David Rodriguez", "d.rodriguez@email.com", "US"),
                new CustomerProfile("cust_005", "Lisa Anderson", "lisa.a@email.com", "US"),
                new CustomerProfile("cust_006", "James Taylor", "j.taylor@email.com", "US"),
                new CustomerProfile("cust_007", "Maria Garcia", "maria.g@email.com", "US"));
    }

    public static List<CaseScenario> defaultScenarios() {
        return List.of(
                // true fraud: compromised credentials, failed verification, anomalous origin
                CaseScenario.builder("cb_001", TRUE_FRAUD)
                        .party("cust_001", "merch_001")
                        .payment("1249.99", "visa", "4521", "AUTH12345")
                        .verification("N", "N", false)
                        .session("185.220.101.45", "DEV999001")
                        .risk("95.5", RiskLevel.HIGH, true, VelocitySnapshot.of(8, 0, 12))
                        .transactionDaysAgo(30, 25)
                        .dispute("4855", "fraud", "Chase Bank", "analyst_001")
                        .disputeDaysAgo(25, 20)
                        .openedDaysAgo(20, 18)
                        .notes("Cardholder reports card stolen. Transaction from unusual location. "
                                + "Multiple high-value transactions in 24h.")
                        .build(),
                CaseScenario.builder("cb_002", TRUE_FRAUD)
                        .party("cust_002", "merch_002")
                        .payment("899.50", "mastercard", "5432", "AUTH67890")
                        .verification("Z", "N", false)
                        .session("203.0.113.22", "DEV999002")
                        .risk("88.2", RiskLevel.HIGH, true, VelocitySnapshot.of(5, 0, 7))
                        .transactionDaysAgo(28, 23)
                        .dispute("4853", "fraud", "Bank of America", "analyst_002")
                        .disputeDaysAgo(23, 18)
                        .openedDaysAgo(18, 16)
                        .notes("Account takeover suspected. Login from new device and location. "
                                + "Customer denies all transactions.")
                        .build(),
                CaseScenario.builder("cb_014", TRUE_FRAUD)
                        .party("cust_003", "merch_002")
                        .payment("675.50", "visa", "1234", "AUTH45678")
                        .verification("N", "N", false)
                        .session("198.51.100.10", "DEV999003")
                        .risk("92.3", RiskLevel.HIGH, true, VelocitySnapshot.of(6, 0, 9))
                        .transactionDaysAgo(42, 38)
                        .dispute("4855", "fraud", "Wells Fargo", "analyst_014")
                        .disputeDaysAgo(38, 33)
                        .openedDaysAgo(33, 31)
                        .notes("Card skimming detected. Transaction from compromised terminal. "
                                + "Multiple unauthorized transactions from same card.")
                        .build(),
                CaseScenario.builder("cb_015", TRUE_FRAUD)
                        .party("cust_001", "merch_004")
                        .payment("1125.00", "visa", "4521", "AUTH56789")
                        .verification("N", "N", false)
                        .session("172.217.12.46", "DEV999004")
                        .risk("89.7", RiskLevel.HIGH, true, VelocitySnapshot.of(4, 0, 6))
                        .transactionDaysAgo(50, 45)
                        .dispute("4855", "fraud", "Chase Bank", "analyst_015")
                        .disputeDaysAgo(45, 40)
                        .openedDaysAgo(40, 38)
                        .notes("Card Not Present (CNP) fraud. Card details stolen. Transaction from unusual location. "
                                + "Customer reported card lost.")
                        .build(),
                CaseScenario.builder("cb_016", TRUE_FRAUD)
                        .party("cust_007", "merch_001")
                        .payment("825.75", "mastercard", "7890", "AUTH67891")
                        .verification("Z", "N", false)
                        .session("104.248.90.2", "DEV999005")
                        .risk("91.2", RiskLevel.HIGH, true, VelocitySnapshot.of(7, 0, 11))
                        .transactionDaysAgo(55, 50)
                        .dispute("4853", "fraud", "Wells Fargo", "analyst_016")
                        .disputeDaysAgo(50, 45)
                        .openedDaysAgo(45, 43)
                        .notes("Synthetic identity fraud suspected. Account opened recently with minimal history. "
                                + "High-value transaction from new device.")
                        .build(),

                // friendly fraud: authorized purchase disputed in bad faith
                CaseScenario.builder("cb_003", FRIENDLY_FRAUD)
                        .party("cust_003", "merch_001")
                        .payment("299.99", "visa", "1234", "AUTH11111")
                        .verification("Y", "Y", true)
                        .session("192.168.1.100", "DEV123456")
                        .risk("15.0", RiskLevel.LOW, false, VelocitySnapshot.of(1, 5, 2))
                        .transactionDaysAgo(45, 40)
                        .dispute("4855", "service_not_provided", "Wells Fargo", "analyst_003")
                        .disputeDaysAgo(35, 30)
                        .openedDaysAgo(30, 28)
                        .notes("Customer claims item never received. Tracking shows delivered. "
                                + "Customer has history of similar claims.")
                        .build(),
                CaseScenario.builder("cb_004", FRIENDLY_FRAUD)
                        .party("cust_004", "merch_003")
                        .payment("549.99", "amex", "5678", "AUTH22222")
                        .verification("Y", "Y", true)
                        .session("192.168.1.101", "DEV123457")
                        .risk("12.5", RiskLevel.LOW, false, VelocitySnapshot.of(1, 8, 3))
                        .transactionDaysAgo(60, 55)
                        .dispute("4855", "service_not_provided", "Citi Bank", "analyst_004")
                        .disputeDaysAgo(50, 45)
                        .openedDaysAgo(45, 43)
                        .notes("Customer claims product defective. Merchant provided refund but customer "
                                + "filed chargeback anyway.")
                        .build(),
                CaseScenario.builder("cb_005", FRIENDLY_FRAUD)
                        .party("cust_005", "merch_002")
                        .payment("79.99", "visa", "9012", "AUTH33333")
                        .verification("Y", "Y", true)
                        .session("192.168.1.102", "DEV123458")
                        .risk("10.0", RiskLevel.LOW, false, VelocitySnapshot.of(1, 12, 1))
                        .transactionDaysAgo(90, 85)
                        .dispute("4855", "service_not_provided", "Chase Bank", "analyst_005")
                        .disputeDaysAgo(80, 75)
                        .openedDaysAgo(75, 73)
                        .notes("Customer cancelled subscription but was charged. Claims cancellation before billing cycle.")
                        .build(),
                CaseScenario.builder("cb_006", FRIENDLY_FRAUD)
                        .party("cust_006", "merch_004")
                        .payment("199.99", "mastercard", "3456", "AUTH44444")
                        .verification("Y", "Y", true)
                        .session("192.168.1.103", "DEV123459")
                        .risk("18.0", RiskLevel.LOW, false, VelocitySnapshot.of(1, 6, 4))
                        .transactionDaysAgo(40, 35)
                        .dispute("4855", "fraud", "Bank of America", "analyst_006")
                        .disputeDaysAgo(30, 25)
                        .openedDaysAgo(25, 23)
                        .notes("Customer claims unauthorized transaction. Same IP, device, and shipping address. "
                                + "Likely family member.")
                        .build(),
                CaseScenario.builder("cb_017", FRIENDLY_FRAUD)
                        .party("cust_003", "merch_003")
                        .payment("425.99", "visa", "1234", "AUTH78901")
                        .verification("Y", "Y", true)
                        .session("192.168.1.100", "DEV123456")
                        .risk("14.5", RiskLevel.LOW, false, VelocitySnapshot.of(1, 5, 2))
                        .transactionDaysAgo(120, 115)
                        .dispute("4855", "service_not_provided", "Wells Fargo", "analyst_017")
                        .disputeDaysAgo(110, 105)
                        .openedDaysAgo(105, 103)
                        .closed(WON, 90, 88)
                        .notes("Customer claims item never received. Tracking shows delivered. Customer has 3 previous "
                                + "'item not received' claims. Chargeback reversed in favor of merchant.")
                        .build(),
                CaseScenario.builder("cb_018", FRIENDLY_FRAUD)
                        .party("cust_005", "merch_001")
                        .payment("99.99", "visa", "9012", "AUTH89012")
                        .verification("Y", "Y", true)
                        .session("192.168.1.102", "DEV123458")
                        .risk("11.0", RiskLevel.LOW, false, VelocitySnapshot.of(1, 12, 1))
                        .transactionDaysAgo(180, 175)
                        .dispute("4855", "service_not_provided", "Chase Bank", "analyst_018")
                        .disputeDaysAgo(170, 165)
                        .openedDaysAgo(165, 163)
                        .closed(WON, 150, 148)
                        .notes("Customer claims subscription cancelled but was charged. Previous subscription dispute "
                                + "history. Merchant provided evidence, chargeback reversed.")
                        .build(),
                CaseScenario.builder("cb_019", FRIENDLY_FRAUD)
                        .party("cust_004", "merch_004")
                        .payment("375.50", "amex", "5678", "AUTH90123")
                        .verification("Y", "Y", true)
                        .session("192.168.1.101", "DEV123457")
                        .risk("13.0", RiskLevel.LOW, false, VelocitySnapshot.of(1, 8, 3))
                        .transactionDaysAgo(200, 195)
                        .dispute("4855", "service_not_provided", "Citi Bank", "analyst_019")
                        .disputeDaysAgo(190, 185)
                        .openedDaysAgo(185, 183)
                        .closed(WON, 170, 168)
                        .notes("Customer claims product defective. Merchant provided refund but customer filed "
                                + "chargeback. Pattern of quality disputes. Chargeback reversed.")
                        .build(),
                CaseScenario.builder("cb_020", FRIENDLY_FRAUD)
                        .party("cust_006", "merch_002")
                        .payment("275.25", "mastercard", "3456", "AUTH01234")
                        .verification("Y", "Y", true)
                        .session("192.168.1.103", "DEV123459")
                        .risk("16.5", RiskLevel.LOW, false, VelocitySnapshot.of(1, 6, 4))
                        .transactionDaysAgo(150, 145)
                        .dispute("4855", "fraud", "Bank of America", "analyst_020")
                        .disputeDaysAgo(140, 135)
                        .openedDaysAgo(135, 133)
                        .closed(WON, 120, 118)
                        .notes("Customer claims unauthorized. Same IP, device, and shipping address as previous orders. "
                                + "Likely family member. Previous similar claim. Chargeback reversed.")
                        .build(),

                // merchant error: the filer wins because the merchant was at fault
                CaseScenario.builder("cb_007", MERCHANT_ERROR)
                        .party("cust_001", "merch_003")
                        .payment("149.99", "visa", "4521", "AUTH66666")
                        .verification("Y", "Y", true)
                        .session("192.168.1.100", "DEV123456")
                        .risk("5.0", RiskLevel.LOW, false, VelocitySnapshot.of(1, 5, 2))
                        .transactionDaysAgo(20, 18)
                        .dispute("4837", "duplicate", "Chase Bank", "analyst_007")
                        .disputeDaysAgo(15, 12)
                        .openedDaysAgo(12, 10)
                        .notes("Customer charged twice for same purchase. Merchant confirmed duplicate. Refund processed.")
                        .build(),
                CaseScenario.builder("cb_008", MERCHANT_ERROR)
                        .party("cust_002", "merch_002")
                        .payment("249.99", "mastercard", "5432", "AUTH77777")
                        .verification("Y", "Y", true)
                        .session("192.168.1.101", "DEV123457")
                        .risk("8.0", RiskLevel.LOW, false, VelocitySnapshot.of(1, 8, 3))
                        .transactionDaysAgo(25, 22)
                        .dispute("4837", "duplicate", "Bank of America", "analyst_008")
                        .disputeDaysAgo(18, 15)
                        .openedDaysAgo(15, 13)
                        // only the overcharge above the advertised 99.99 is disputed
                        .chargebackAmount("150.00")
                        .notes("Customer ordered for $99.99 but charged $249.99. Merchant pricing error. "
                                + "Partial refund issued.")
                        .build(),
                CaseScenario.builder("cb_021", MERCHANT_ERROR)
                        .party("cust_001", "merch_002")
                        .payment("189.99", "visa", "4521", "AUTH12346")
                        .verification("Y", "Y", true)
                        .session("192.168.1.100", "DEV123456")
                        .risk("6.0", RiskLevel.LOW, false, VelocitySnapshot.of(1, 5, 2))
                        .transactionDaysAgo(100, 95)
                        .dispute("4837", "duplicate", "Chase Bank", "analyst_021")
                        .disputeDaysAgo(90, 85)
                        .openedDaysAgo(85, 83)
                        .closed(LOST, 75, 73)
                        .notes("Payment processing error caused duplicate authorization. Merchant confirmed error. "
                                + "Refund processed. Chargeback upheld in favor of customer.")
                        .build(),
                CaseScenario.builder("cb_022", MERCHANT_ERROR)
                        .party("cust_002", "merch_003")
                        .payment("319.99", "mastercard", "5432", "AUTH23457")
                        .verification("Y", "Y", true)
                        .session("192.168.1.101", "DEV123457")
                        .risk("7.5", RiskLevel.LOW, false, VelocitySnapshot.of(1, 8, 3))
                        .transactionDaysAgo(130, 125)
                        .dispute("4837", "duplicate", "Bank of America", "analyst_022")
                        .disputeDaysAgo(120, 115)
                        .openedDaysAgo(115, 113)
                        .closed(LOST, 105, 103)
                        .notes("Customer returned item and refund was authorized but not processed due to system error. "
                                + "Merchant acknowledged and processed refund. Chargeback upheld in favor of customer.")
                        .build(),
                CaseScenario.builder("cb_023", MERCHANT_ERROR)
                        .party("cust_007", "merch_004")
                        .payment("225.00", "visa", "7890", "AUTH34568")
                        .verification("Y", "Y", true)
                        .session("192.168.1.104", "DEV123460")
                        .risk("9.0", RiskLevel.LOW, false, VelocitySnapshot.of(1, 10, 2))
                        .transactionDaysAgo(75, 70)
                        .dispute("4837", "duplicate", "Wells Fargo", "analyst_023")
                        .disputeDaysAgo(65, 60)
                        .openedDaysAgo(60, 58)
                        .closed(LOST, 50, 48)
                        .notes("Authorization hold from cancelled order not released. Merchant confirmed error and "
                                + "released hold. Customer charged twice. Chargeback upheld in favor of customer.")
                        .build(),

                // not guilty: the claim is contradicted by the merchant's evidence
                CaseScenario.builder("cb_009", NOT_GUILTY)
                        .party("cust_003", "merch_001")
                        .payment("179.99", "visa", "1234", "AUTH88888")
                        .verification("Y", "Y", true)
                        .session("192.168.1.100", "DEV123456")
                        .risk("12.0", RiskLevel.LOW, false, VelocitySnapshot.of(1, 5, 2))
                        .transactionDaysAgo(70, 65)
                        .dispute("4855", "fraud", "Wells Fargo", "analyst_009")
                        .disputeDaysAgo(60, 55)
                        .openedDaysAgo(55, 53)
                        .closed(WON, 40, 38)
                        .notes("Customer claimed unauthorized. Merchant provided proof: same IP, device, shipping address, "
                                + "email confirmation. Chargeback reversed.")
                        .build(),
                CaseScenario.builder("cb_010", NOT_GUILTY)
                        .party("cust_004", "merch_002")
                        .payment("49.99", "amex", "5678", "AUTH99999")
                        .verification("Y", "Y", true)
                        .session("192.168.1.101", "DEV123457")
                        .risk("10.0", RiskLevel.LOW, false, VelocitySnapshot.of(1, 8, 3))
                        .transactionDaysAgo(85, 80)
                        .dispute("4855", "service_not_provided", "Citi Bank", "analyst_010")
                        .disputeDaysAgo(75, 70)
                        .openedDaysAgo(70, 68)
                        .closed(WON, 55, 53)
                        .notes("Customer claimed unauthorized subscription. Merchant provided signed TOS, agreement, "
                                + "6 months usage logs. Chargeback reversed.")
                        .build(),
                CaseScenario.builder("cb_011", NOT_GUILTY)
                        .party("cust_005", "merch_003")
                        .payment("89.99", "visa", "9012", "AUTH10101")
                        .verification("Y", "Y", true)
                        .session("192.168.1.102", "DEV123458")
                        .risk("8.0", RiskLevel.LOW, false, VelocitySnapshot.of(1, 12, 1))
                        .transactionDaysAgo(50, 45)
                        .dispute("4855", "service_not_provided", "Chase Bank", "analyst_011")
                        .disputeDaysAgo(40, 35)
                        .openedDaysAgo(35, 33)
                        .closed(WON, 20, 18)
                        .notes("Customer claimed digital product not received. Merchant provided delivery confirmation, "
                                + "download logs, IP match, usage analytics. Chargeback reversed.")
                        .build(),
                CaseScenario.builder("cb_012", NOT_GUILTY)
                        .party("cust_006", "merch_004")
                        .payment("299.99", "mastercard", "3456", "AUTH20202")
                        .verification("Y", "Y", true)
                        .session("192.168.1.103", "DEV123459")
                        .risk("15.0", RiskLevel.LOW, false, VelocitySnapshot.of(1, 6, 4))
                        .transactionDaysAgo(65, 60)
                        .dispute("4855", "service_not_provided", "Bank of America", "analyst_012")
                        .disputeDaysAgo(55, 50)
                        .openedDaysAgo(50, 48)
                        .closed(WON, 35, 33)
                        .notes("Customer claimed defective. Merchant provided return policy, photos of used item, "
                                + "expired return window (45 vs 30 days). Chargeback reversed.")
                        .build(),
                CaseScenario.builder("cb_013", NOT_GUILTY)
                        .party("cust_007", "merch_001")
                        .payment("399.99", "visa", "7890", "AUTH30303")
                        .verification("Y", "Y", true)
                        .session("192.168.1.104", "DEV123460")
                        .risk("11.0", RiskLevel.LOW, false, VelocitySnapshot.of(1, 10, 2))
                        .transactionDaysAgo(55, 50)
                        .dispute("4855", "service_not_provided", "Wells Fargo", "analyst_013")
                        .disputeDaysAgo(45, 40)
                        .openedDaysAgo(40, 38)
                        .closed(WON, 25, 23)
                        .notes("Customer claimed not received. Merchant provided delivery confirmation, signature, "
                                + "GPS tracking. Chargeback reversed.")
                        .build());
    }
}
