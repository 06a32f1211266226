package com.chargedesk.api.generator;

import com.chargedesk.core.domain.Chargeback.CaseCategory;
import com.chargedesk.core.evidence.DeliveryEvidence;
import com.chargedesk.core.evidence.FraudIndicators;
import com.chargedesk.core.evidence.LoginActivity;
import com.chargedesk.core.evidence.MerchantInvestigation;
import com.chargedesk.core.evidence.PriorDisputeHistory;
import com.chargedesk.core.evidence.ProductEvidence;
import com.chargedesk.core.evidence.RefundAction;
import com.chargedesk.core.evidence.SubscriptionEvidence;
import com.chargedesk.core.evidence.SupportContact;
import com.chargedesk.core.evidence.SystemFix;
import com.chargedesk.core.evidence.TransactionAnalysis;
import com.chargedesk.core.evidence.UsageEvidence;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.chargedesk.core.evidence.CaseEventType.DELIVERY_EVIDENCE;
import static com.chargedesk.core.evidence.CaseEventType.FRAUD_INDICATORS;
import static com.chargedesk.core.evidence.CaseEventType.LOGIN;
import static com.chargedesk.core.evidence.CaseEventType.LOGIN_ANALYSIS;
import static com.chargedesk.core.evidence.CaseEventType.MERCHANT_INVESTIGATION;
import static com.chargedesk.core.evidence.CaseEventType.PREVIOUS_DISPUTE;
import static com.chargedesk.core.evidence.CaseEventType.PRODUCT_EVIDENCE;
import static com.chargedesk.core.evidence.CaseEventType.REFUND;
import static com.chargedesk.core.evidence.CaseEventType.RETURN_POLICY_EVIDENCE;
import static com.chargedesk.core.evidence.CaseEventType.SHIPPING_EVIDENCE;
import static com.chargedesk.core.evidence.CaseEventType.SUBSCRIPTION_EVIDENCE;
import static com.chargedesk.core.evidence.CaseEventType.SUPPORT_TICKET;
import static com.chargedesk.core.evidence.CaseEventType.SYSTEM_FIX;
import static com.chargedesk.core.evidence.CaseEventType.TRANSACTION_ANALYSIS;
import static com.chargedesk.core.evidence.CaseEventType.TRANSACTION_EVIDENCE;
import static com.chargedesk.core.evidence.CaseEventType.USAGE_ANALYTICS;
import static com.chargedesk.core.evidence.CaseEventType.VELOCITY_CHECK;

/**
 * Evidentiary trails for generated cases, in the order the events are appended.
 *
 * Cases with an authored trail get it; any other case gets a two-event trail for its
 * category: the first contact followed by the resolving action. Facts that also live on
 * the transaction (verification codes, device, velocity counts) are taken from the scenario.
 */
@Component
public class EvidenceTemplates {

    @FunctionalInterface
    interface Template {
        List<EvidenceItem> trail(CaseScenario scenario, CaseTimeline timeline);
    }

    private static final Map<String, Template> AUTHORED = new HashMap<>();

    static {
        AUTHORED.put("cb_001", (s, t) -> List.of(
                EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket("TKT12345", t.disputeDate(), "phone",
                                "Card stolen, reported immediately to bank").withCardCancelled(),
                        "Customer reported card stolen. Immediate card cancellation requested. Police report filed."),
                EvidenceItem.of(TRANSACTION_ANALYSIS, TransactionAnalysis.anomalous(s.ipAddress(), s.deviceFingerprint(),
                                "Russia", "Moscow", "San Francisco, CA", 5900),
                        "Transaction originated from Russia (IP: 185.220.101.45), 5900 miles from customer's location. "
                                + "Multiple cards used in 24h."),
                EvidenceItem.of(FRAUD_INDICATORS, failedChecks(s, "high_risk", "unusual_behavior"),
                        "Strong fraud indicators: AVS/CVV failed, no 3DS, new device, high-risk IP address."),
                EvidenceItem.of(VELOCITY_CHECK, s.velocity().withAmountLast24h(new BigDecimal("8750.50")),
                        "High velocity detected: 8 different cards used in 24h, $8,750.50 in transactions, "
                                + "12 transactions in 7 days."),
                EvidenceItem.of(PREVIOUS_DISPUTE, PriorDisputeHistory.firstDispute("good"),
                        "Customer has 0 previous disputes. First-time fraud claim. Account in good standing for 3.4 years.")));

        AUTHORED.put("cb_002", (s, t) -> List.of(
                EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket("TKT12346", t.disputeDate(), "email",
                                "Received email about password change. Did not authorize. Account locked.").withAccountLocked(),
                        "Customer reported unauthorized account access. Account locked after suspicious login attempts."),
                EvidenceItem.of(LOGIN_ANALYSIS, new LoginActivity("Ukraine", s.ipAddress(), s.deviceFingerprint(),
                                "Windows 10 - new device", false, true, null,
                                List.of("password_change", "email_change", "purchase")),
                        "Account login from Ukraine (IP: 203.0.113.22) at 2:15 AM. New device, password and email changed, "
                                + "then purchase made."),
                EvidenceItem.of(FRAUD_INDICATORS, failedChecks(s, "medium_risk", "account_takeover"),
                        "Account takeover indicators: Partial AVS match, CVV failed, no 3DS, new device, "
                                + "suspicious session activity."),
                EvidenceItem.of(VELOCITY_CHECK, s.velocity().withAmountLast24h(new BigDecimal("3200.00")),
                        "Multiple unauthorized transactions: 5 cards in 24h, $3,200 total, all from different IP addresses."),
                EvidenceItem.of(PREVIOUS_DISPUTE, PriorDisputeHistory.firstDispute("good"),
                        "No previous disputes. First security incident. Customer maintains account security practices.")));

        AUTHORED.put("cb_003", (s, t) -> List.of(
                EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket("TKT12347", t.disputeDate(), "chat",
                                "Ordered item, never received. Tracking shows delivered but not at my address."),
                        "Customer contacted support claiming item never received. Tracking shows delivered."),
                EvidenceItem.of(SHIPPING_EVIDENCE, DeliveryEvidence.shipped("1Z999AA10123456784", "UPS",
                                t.afterTransaction(4), "123 Main St, San Francisco, CA 94102", "E. Williams",
                                "37.7749,-122.4194", "PHOTO-DEL-2024-001"),
                        "Delivery confirmed: Tracking shows delivered to customer address on date. "
                                + "Signature captured: 'E. Williams'. GPS coordinates match."),
                EvidenceItem.of(LOGIN, new LoginActivity("San Francisco, CA", s.ipAddress(), s.deviceFingerprint(),
                                "iPhone 14 Pro - known device", true, true, null, null),
                        "Customer logged in from usual location (San Francisco). Same device and IP as transaction. "
                                + "Device fingerprint matches historical data."),
                EvidenceItem.of(REFUND, RefundAction.offered(t.afterDispute(2), s.amount(), "declined",
                                "Customer declined refund, filed chargeback instead"),
                        "Merchant offered full refund ($299.99) but customer declined. "
                                + "Customer filed chargeback instead of accepting refund."),
                EvidenceItem.of(PREVIOUS_DISPUTE, new PriorDisputeHistory(3, 2, "item_not_received", "repeat_offender", null),
                        "Customer has 3 previous disputes, 2 for 'item not received'. Pattern of similar claims. "
                                + "All previous cases lost by customer.")));

        AUTHORED.put("cb_004", (s, t) -> List.of(
                EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket("TKT12348", t.disputeDate(), "email",
                                "Product received but defective. Doesn't work as described.")
                                .withOrder("ELEC-12345", s.amount()),
                        "Customer contacted support claiming product defective. Return requested."),
                EvidenceItem.of(REFUND, RefundAction.processed(t.afterDispute(2), s.amount(), "REF-2024-001"),
                        "Merchant processed full refund ($549.99) on date. Customer received refund confirmation "
                                + "but filed chargeback anyway."),
                EvidenceItem.of(PRODUCT_EVIDENCE, new ProductEvidence("ELEC-12345", 30, 12, false, "unopened", null, true),
                        "Product return processed within 30-day window. Return shipping label provided. "
                                + "Customer received refund but still filed chargeback."),
                EvidenceItem.of(LOGIN, LoginActivity.knownDevice("Los Angeles, CA", s.ipAddress(), s.deviceFingerprint(), "daily"),
                        "Customer logged in from usual location. Same device and IP as transaction. Regular account activity."),
                EvidenceItem.of(PREVIOUS_DISPUTE, new PriorDisputeHistory(1, 1, "quality_issue", null, null),
                        "Customer has 1 previous dispute for quality issue. Previously received refund after chargeback.")));

        AUTHORED.put("cb_005", (s, t) -> List.of(
                EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket("TKT12349", t.disputeDate(), "email",
                                "Cancelled subscription but was charged anyway. Should not have been billed."),
                        "Customer claims subscription cancelled before billing cycle but was charged anyway."),
                EvidenceItem.of(SUBSCRIPTION_EVIDENCE, new SubscriptionEvidence("SUB-78901", t.beforeTransaction(90),
                                "monthly", t.beforeTransaction(2), t.afterTransaction(3), t.transactionDate(),
                                "TOS-2024-001", "7-day notice required"),
                        "Subscription records show cancellation on date (3 days after billing). Customer claims cancellation "
                                + "before billing. 7-day notice policy applies."),
                EvidenceItem.of(LOGIN, LoginActivity.knownDevice("Chicago, IL", s.ipAddress(), s.deviceFingerprint(), "weekly"),
                        "Customer logged in from usual location. Account shows active service usage in last 30 days "
                                + "after claimed cancellation."),
                EvidenceItem.of(REFUND, RefundAction.offered(t.afterDispute(2), s.amount(), "pending", "pending"),
                        "Merchant offered prorated refund. Waiting for customer response."),
                EvidenceItem.of(PREVIOUS_DISPUTE, PriorDisputeHistory.firstDispute("new_customer"),
                        "No previous disputes. Customer is new subscriber. This is first billing cycle dispute.")));

        AUTHORED.put("cb_006", (s, t) -> List.of(
                EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket("TKT12350", t.disputeDate(), "phone",
                                "Did not authorize this transaction. Don't recognize this purchase."),
                        "Customer claims unauthorized transaction. Does not recognize purchase."),
                EvidenceItem.of(TRANSACTION_ANALYSIS, TransactionAnalysis.consistent(s.ipAddress(), s.deviceFingerprint(), 4),
                        "Transaction analysis: Same IP (192.168.1.103), device (DEV123459), shipping address, "
                                + "and email as 4 previous orders."),
                EvidenceItem.of(LOGIN, LoginActivity.knownDevice("Boston, MA", s.ipAddress(), s.deviceFingerprint(), "weekly"),
                        "Customer logged in from same location (Boston). Same device and IP as transaction. "
                                + "Regular account activity."),
                EvidenceItem.of(FRAUD_INDICATORS, passedChecks(s),
                        "All fraud checks passed: AVS match, CVV match, 3DS used, known device, low risk IP. "
                                + "Fraud score: 18.0."),
                EvidenceItem.of(PREVIOUS_DISPUTE, new PriorDisputeHistory(2, 1, "unauthorized_family", null, null),
                        "Customer has 2 previous disputes. Pattern suggests family member usage. "
                                + "Previous 'unauthorized' claim resolved in favor of merchant.")));

        AUTHORED.put("cb_007", (s, t) -> List.of(
                EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket("TKT12351", t.disputeDate(), "chat",
                                "Charged twice for same order.").withOrder("ORD-12345", s.amount()),
                        "Customer reported duplicate charge for same order. Two identical transactions detected."),
                EvidenceItem.of(MERCHANT_INVESTIGATION, new MerchantInvestigation("ORD-12345", true, "system_duplicate",
                                "payment_gateway_timeout_retry", s.amount(), s.amount(),
                                List.of(t.transactionId(), t.transactionId() + "_DUPLICATE")),
                        "Merchant investigation: Confirmed duplicate charge. Same order #ORD-12345 charged twice within "
                                + "45 seconds. System error due to payment gateway timeout retry."),
                EvidenceItem.of(REFUND, RefundAction.processed(t.afterDispute(1), s.amount(), "REF-2024-002"),
                        "Merchant confirmed error and processed immediate refund ($149.99). "
                                + "Refund confirmation sent to customer."),
                EvidenceItem.of(LOGIN, LoginActivity.knownDevice("San Francisco, CA", s.ipAddress(), null, null),
                        "Customer logged in from usual location. Same IP as transaction."),
                EvidenceItem.of(SYSTEM_FIX, new SystemFix(true, t.afterDispute(3),
                                "Payment gateway retry logic updated to prevent duplicate charges",
                                "Added duplicate transaction detection"),
                        "System fix implemented: Payment gateway retry logic updated. Duplicate transaction detection added.")));

        AUTHORED.put("cb_008", (s, t) -> List.of(
                EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket("TKT12352", t.disputeDate(), "email",
                                "Ordered item for $99.99 but charged $249.99. Price on website was $99.99.")
                                .withOrder("ORD-12346", s.amount()),
                        "Customer reported wrong amount charged. Expected $99.99, charged $249.99."),
                EvidenceItem.of(MERCHANT_INVESTIGATION, new MerchantInvestigation("ORD-12346", true, "database_price_mismatch",
                                "price_sync_issue", s.amount(), new BigDecimal("99.99"), null),
                        "Merchant investigation: Confirmed pricing error. Product SKU PROD-56789 shows $99.99 on website "
                                + "but database had old price $249.99. Price sync issue."),
                EvidenceItem.of(REFUND, RefundAction.processed(t.afterDispute(1), s.chargebackAmount(), "REF-2024-003"),
                        "Merchant processed partial refund ($150.00 difference). Customer charged correct amount of $99.99."),
                EvidenceItem.of(LOGIN, LoginActivity.knownDevice("New York, NY", s.ipAddress(), s.deviceFingerprint(), null),
                        "Customer logged in from usual location."),
                EvidenceItem.of(SYSTEM_FIX, new SystemFix(true, t.afterDispute(3),
                                "Price database sync corrected", "Added automated price validation"),
                        "System fix: Price database sync corrected. Added automated price validation to prevent "
                                + "future mismatches.")));

        AUTHORED.put("cb_009", (s, t) -> List.of(
                EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket("TKT12353", t.disputeDate(), "chargeback",
                                "Unauthorized transaction"),
                        "Customer filed chargeback claiming unauthorized transaction. Chargeback received for investigation."),
                EvidenceItem.of(TRANSACTION_EVIDENCE, TransactionAnalysis.consistent(s.ipAddress(), s.deviceFingerprint(), 6),
                        "Transaction evidence: Same IP, device, shipping address, and email as customer. "
                                + "Order confirmation email sent and opened by customer."),
                EvidenceItem.of(LOGIN, LoginActivity.knownDevice("San Francisco, CA", s.ipAddress(), s.deviceFingerprint(), "daily"),
                        "Customer logged in from usual location 1 hour before transaction. Same device and IP. "
                                + "Device fingerprint matches account history."),
                EvidenceItem.of(DELIVERY_EVIDENCE, DeliveryEvidence.shipped("1Z999AA10123456785", "UPS",
                                t.afterTransaction(3), "123 Main St, San Francisco, CA 94102", "E. Williams",
                                "37.7749,-122.4194", "PHOTO-DEL-2024-002"),
                        "Delivery confirmed: Item delivered to customer address. Signature captured: 'E. Williams'. "
                                + "GPS coordinates match shipping address."),
                EvidenceItem.of(PREVIOUS_DISPUTE, new PriorDisputeHistory(1, 1, "unauthorized_claim", "chargeback_abuse", null),
                        "Customer has 1 previous dispute for 'unauthorized' transaction. Previous case lost by customer. "
                                + "Pattern of chargeback abuse.")));

        AUTHORED.put("cb_010", (s, t) -> List.of(
                EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket("TKT12354", t.disputeDate(), "chargeback",
                                "Unauthorized subscription charge"),
                        "Customer filed chargeback claiming unauthorized subscription. Chargeback received for investigation."),
                EvidenceItem.of(SUBSCRIPTION_EVIDENCE, new SubscriptionEvidence("SUB-78902", t.beforeTransaction(240),
                                "monthly", null, null, t.transactionDate(), "TOS-2024-002", "cancel anytime before renewal"),
                        "Subscription evidence: Active subscription for 8 months. TOS signed and accepted. "
                                + "Customer logged in 2 days before billing. 180 usage sessions in last 30 days."),
                EvidenceItem.of(LOGIN, LoginActivity.knownDevice("Los Angeles, CA", s.ipAddress(), s.deviceFingerprint(), "daily"),
                        "Customer logged in from usual location. Same device and IP as subscription signup. "
                                + "Active daily usage. Last login 2 days before billing."),
                EvidenceItem.of(REFUND, RefundAction.evidenceSubmitted(t.afterDispute(5)),
                        "Merchant provided comprehensive evidence package: Signed TOS, 6 months usage logs, IP match, "
                                + "device match. Chargeback response submitted."),
                EvidenceItem.of(PREVIOUS_DISPUTE, PriorDisputeHistory.firstDispute("long_term_subscriber"),
                        "No previous disputes. Long-term subscriber with consistent billing history. "
                                + "8 months of successful payments.")));

        AUTHORED.put("cb_011", (s, t) -> List.of(
                EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket("TKT12355", t.disputeDate(), "chargeback",
                                "Digital product not received"),
                        "Customer filed chargeback claiming digital product not received. Chargeback received for investigation."),
                EvidenceItem.of(DELIVERY_EVIDENCE, DeliveryEvidence.downloaded(t.transactionDate(), s.ipAddress(), 3),
                        "Digital delivery confirmed: License key sent via email. Email opened by customer. "
                                + "Download link accessed 3 times from customer IP (192.168.1.102)."),
                EvidenceItem.of(USAGE_ANALYTICS, new UsageEvidence(true, t.afterTransaction(1), s.ipAddress(), 12,
                                t.disputeDate().minus(Duration.ofDays(5)), 45,
                                List.of("export", "templates", "cloud_sync")),
                        "Product usage analytics: License activated and used 12 times. 45 hours of usage. "
                                + "Last usage 5 days before chargeback. Multiple features accessed."),
                EvidenceItem.of(LOGIN, LoginActivity.knownDevice("Chicago, IL", s.ipAddress(), s.deviceFingerprint(), "weekly"),
                        "Customer logged in from usual location. Same IP used for download, activation, and usage. "
                                + "Device fingerprint matches."),
                EvidenceItem.of(PREVIOUS_DISPUTE, PriorDisputeHistory.firstDispute("good"),
                        "No previous disputes. Customer has 5 previous digital purchases, all successfully delivered "
                                + "and activated.")));

        AUTHORED.put("cb_012", (s, t) -> List.of(
                EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket("TKT12356", t.disputeDate(), "chargeback",
                                "Defective product"),
                        "Customer filed chargeback claiming defective product. Chargeback received for investigation."),
                EvidenceItem.of(RETURN_POLICY_EVIDENCE, new ProductEvidence(null, 30, 45, true, null,
                                "https://homeessentials.example/returns", true),
                        "Return policy: 30-day return window. Purchase made 45 days ago. Return window expired 15 days "
                                + "before chargeback. Customer acknowledged policy at purchase."),
                EvidenceItem.of(PRODUCT_EVIDENCE, new ProductEvidence("HOME-44821", 30, 45, true, "used", null, null),
                        "Product evidence: Item received new, returned used. Photos show significant wear. "
                                + "No defect photos provided. Warranty claim not filed."),
                EvidenceItem.of(REFUND, RefundAction.evidenceSubmitted(t.afterDispute(5)),
                        "Merchant provided evidence package: Return policy, photos of used item, policy acknowledgment. "
                                + "Chargeback response submitted."),
                EvidenceItem.of(PREVIOUS_DISPUTE, new PriorDisputeHistory(2, 2, "return_policy_violation", null, null),
                        "Customer has 2 previous disputes. Pattern of return policy violations. "
                                + "All previous cases lost by customer.")));

        AUTHORED.put("cb_013", (s, t) -> List.of(
                EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket("TKT12357", t.disputeDate(), "chargeback",
                                "Item never received"),
                        "Customer filed chargeback claiming item never received. Chargeback received for investigation."),
                EvidenceItem.of(DELIVERY_EVIDENCE, DeliveryEvidence.shipped("1Z999AA10123456786", "UPS",
                                t.afterTransaction(3), "456 Pine St, Seattle, WA 98101", "M. Garcia",
                                "47.6062,-122.3321", "PHOTO-DEL-2024-003"),
                        "Delivery confirmed: Item delivered to customer address. Signature captured: 'M. Garcia'. "
                                + "GPS coordinates match shipping address. Photo evidence available."),
                EvidenceItem.of(LOGIN, LoginActivity.knownDevice("Seattle, WA", s.ipAddress(), s.deviceFingerprint(), "weekly"),
                        "Customer logged in from usual location (Seattle) 1 day after delivery. "
                                + "Same device and IP as transaction."),
                EvidenceItem.of(REFUND, RefundAction.evidenceSubmitted(t.afterDispute(5)),
                        "Merchant provided comprehensive evidence: Delivery confirmation, signature proof, GPS tracking, "
                                + "delivery photo. Chargeback response submitted."),
                EvidenceItem.of(PREVIOUS_DISPUTE, new PriorDisputeHistory(1, 1, "item_not_received", null, null),
                        "Customer has 1 previous dispute for 'item not received'. Previous case lost by customer. "
                                + "Delivery was confirmed in previous case.")));

        AUTHORED.put("cb_014", (s, t) -> List.of(
                EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket("TKT12358", t.disputeDate(), "phone",
                                "Card was skimmed at a terminal").withCardCancelled(),
                        "Customer reported card skimming. Card cancelled. Compromised terminal identified."),
                EvidenceItem.of(TRANSACTION_ANALYSIS, TransactionAnalysis.anomalous(s.ipAddress(), s.deviceFingerprint(),
                                "USA", "Los Angeles", "San Francisco, CA", 380),
                        "Transaction from compromised terminal in Los Angeles. Terminal flagged for skimming. "
                                + "6 cards used in 24h from same terminal."),
                EvidenceItem.of(FRAUD_INDICATORS, failedChecks(s, "high_risk", "skimming"),
                        "Strong fraud indicators: AVS/CVV failed, no 3DS, new device, compromised terminal. "
                                + "Skimming pattern detected."),
                EvidenceItem.of(VELOCITY_CHECK, s.velocity().withAmountLast24h(new BigDecimal("4850.75")),
                        "High velocity detected: 6 different cards from same terminal in 24h, $4,850.75 in transactions, "
                                + "9 transactions in 7 days."),
                EvidenceItem.of(PREVIOUS_DISPUTE, new PriorDisputeHistory(2, 1, "fraud", "good", null),
                        "Customer has 2 previous disputes (1 fraud). First skimming incident. Account in good standing.")));

        AUTHORED.put("cb_015", (s, t) -> List.of(
                EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket("TKT12359", t.disputeDate(), "phone",
                                "Card lost, did not make this purchase").withCardCancelled(),
                        "Customer reported card lost. Card cancelled. Card issuer notified immediately."),
                EvidenceItem.of(TRANSACTION_ANALYSIS, TransactionAnalysis.anomalous(s.ipAddress(), s.deviceFingerprint(),
                                "Brazil", "Sao Paulo", "San Francisco, CA", 6500),
                        "Card Not Present (CNP) transaction from Brazil (IP: 172.217.12.46), 6500 miles from customer "
                                + "location. Card details stolen."),
                EvidenceItem.of(FRAUD_INDICATORS, failedChecks(s, "high_risk", "card_not_present"),
                        "Strong CNP fraud indicators: AVS/CVV failed, no 3DS, new device, high-risk IP. "
                                + "Stolen card details pattern."),
                EvidenceItem.of(VELOCITY_CHECK, s.velocity().withAmountLast24h(new BigDecimal("4250.00")),
                        "High velocity detected: 4 cards in 24h, $4,250.00 in transactions, 6 transactions in 7 days "
                                + "from different IPs."),
                EvidenceItem.of(PREVIOUS_DISPUTE, new PriorDisputeHistory(1, 1, "fraud", "good", "cb_001"),
                        "Customer has 1 previous fraud dispute (cb_001). First card loss incident. "
                                + "Account in good standing for 3.4 years.")));

        AUTHORED.put("cb_016", (s, t) -> List.of(
                EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket("TKT12360", t.disputeDate(), "email",
                                "Account opened in my name without consent"),
                        "Customer reported synthetic identity fraud. Account opened fraudulently. Identity theft report filed."),
                EvidenceItem.of(TRANSACTION_ANALYSIS, TransactionAnalysis.anomalous(s.ipAddress(), s.deviceFingerprint(),
                                "Nigeria", "Lagos", "Seattle, WA", 7700),
                        "Transaction from Nigeria (IP: 104.248.90.2). Account created 5 days ago with minimal history. "
                                + "Synthetic identity pattern."),
                EvidenceItem.of(FRAUD_INDICATORS, failedChecks(s, "high_risk", "synthetic_identity"),
                        "Synthetic fraud indicators: Partial AVS match, CVV failed, no 3DS, new device, new account, "
                                + "high-risk IP."),
                EvidenceItem.of(VELOCITY_CHECK, s.velocity().withAmountLast24h(new BigDecimal("6250.25")),
                        "High velocity detected: 7 cards in 24h, $6,250.25 in transactions, 11 transactions in 7 days "
                                + "from new account."),
                EvidenceItem.of(PREVIOUS_DISPUTE, new PriorDisputeHistory(1, 0, null, "flagged", "cb_013"),
                        "Customer has 1 previous dispute (not_guilty case). Account identified as synthetic identity. "
                                + "First identity theft report.")));

        AUTHORED.put("cb_017", (s, t) -> List.of(
                EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket("TKT12361", t.disputeDate(), "chat",
                                "Item never arrived"),
                        "Customer contacted support claiming item never received. Tracking shows delivered. "
                                + "Customer has 3 previous 'item not received' claims."),
                EvidenceItem.of(SHIPPING_EVIDENCE, DeliveryEvidence.shipped("1Z999AA10123456787", "UPS",
                                t.afterTransaction(4), "123 Main St, San Francisco, CA 94102", "E. Williams",
                                "37.7749,-122.4194", "PHOTO-DEL-2024-004"),
                        "Delivery confirmed: Tracking shows delivered to customer address. Signature captured: 'E. Williams'. "
                                + "GPS coordinates match."),
                EvidenceItem.of(LOGIN, LoginActivity.knownDevice("San Francisco, CA", s.ipAddress(), s.deviceFingerprint(), "daily"),
                        "Customer logged in from usual location (San Francisco). Same device and IP as transaction. "
                                + "Regular account activity."),
                EvidenceItem.of(PREVIOUS_DISPUTE, new PriorDisputeHistory(4, 3, "item_not_received", "repeat_offender", "cb_003"),
                        "Customer has 4 previous disputes, 3 for 'item not received'. All previous cases lost by customer. "
                                + "High-risk repeat offender pattern.")));

        AUTHORED.put("cb_018", (s, t) -> List.of(
                EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket("TKT12362", t.disputeDate(), "email",
                                "Cancelled before renewal but was charged"),
                        "Customer claims subscription cancelled before billing cycle but was charged anyway. "
                                + "Previous subscription dispute history."),
                EvidenceItem.of(SUBSCRIPTION_EVIDENCE, new SubscriptionEvidence("SUB-78903", t.beforeTransaction(120),
                                "monthly", t.beforeTransaction(2), t.afterTransaction(3), t.transactionDate(),
                                "TOS-2024-003", "7-day notice required"),
                        "Subscription records show cancellation 3 days after billing. Customer claims cancellation before "
                                + "billing. Previous subscription dispute (cb_005)."),
                EvidenceItem.of(LOGIN, LoginActivity.knownDevice("Chicago, IL", s.ipAddress(), s.deviceFingerprint(), "weekly"),
                        "Customer logged in from usual location. Account shows active service usage in last 30 days "
                                + "after claimed cancellation."),
                EvidenceItem.of(PREVIOUS_DISPUTE, new PriorDisputeHistory(2, 2, "subscription_renewal", null, "cb_005"),
                        "Customer has 2 previous disputes, both for subscription renewal. "
                                + "Pattern of subscription chargeback abuse.")));

        AUTHORED.put("cb_019", (s, t) -> List.of(
                EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket("TKT12363", t.disputeDate(), "email",
                                "Product defective, want a return").withOrder("HOME-55190", s.amount()),
                        "Customer contacted support claiming product defective. Return requested. "
                                + "Previous quality dispute (cb_004)."),
                EvidenceItem.of(REFUND, RefundAction.processed(t.afterDispute(2), s.amount(), "REF-2024-004"),
                        "Merchant processed full refund ($375.50). Customer received refund confirmation "
                                + "but filed chargeback anyway."),
                EvidenceItem.of(PRODUCT_EVIDENCE, new ProductEvidence("HOME-55190", 30, 14, false, "returned", null, true),
                        "Product return processed within 30-day window. Customer received refund but still filed "
                                + "chargeback. Matches pattern from cb_004."),
                EvidenceItem.of(PREVIOUS_DISPUTE, new PriorDisputeHistory(2, 2, "quality_issue", null, "cb_004"),
                        "Customer has 2 previous disputes, both for quality issues. Previously received refund after "
                                + "chargeback. Repeat pattern detected.")));

        AUTHORED.put("cb_020", (s, t) -> List.of(
                EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket("TKT12364", t.disputeDate(), "phone",
                                "Don't recognize this purchase"),
                        "Customer claims unauthorized transaction. Does not recognize purchase. Previous similar claim (cb_006)."),
                EvidenceItem.of(TRANSACTION_ANALYSIS, TransactionAnalysis.consistent(s.ipAddress(), s.deviceFingerprint(), 6),
                        "Transaction analysis: Same IP (192.168.1.103), device (DEV123459), shipping address, "
                                + "and email as 6 previous orders."),
                EvidenceItem.of(LOGIN, LoginActivity.knownDevice("Boston, MA", s.ipAddress(), s.deviceFingerprint(), "weekly"),
                        "Customer logged in from same location (Boston). Same device and IP as transaction. "
                                + "Regular account activity."),
                EvidenceItem.of(PREVIOUS_DISPUTE, new PriorDisputeHistory(3, 2, "unauthorized_family", null, "cb_006"),
                        "Customer has 3 previous disputes, 2 for 'unauthorized' (including cb_006). "
                                + "Strong pattern suggests family member usage.")));

        AUTHORED.put("cb_021", (s, t) -> List.of(
                EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket("TKT12365", t.disputeDate(), "chat",
                                "Charged twice after a payment error").withOrder("ORD-12401", s.amount()),
                        "Customer reported duplicate charge due to payment processing error. Two identical transactions detected."),
                EvidenceItem.of(MERCHANT_INVESTIGATION, new MerchantInvestigation("ORD-12401", true, "system_duplicate",
                                "payment_gateway_timeout_retry", s.amount(), s.amount(),
                                List.of(t.transactionId(), t.transactionId() + "_DUPLICATE")),
                        "Merchant investigation: Confirmed duplicate charge. Same order charged twice within 30 seconds. "
                                + "Payment gateway timeout retry error."),
                EvidenceItem.of(REFUND, RefundAction.processed(t.afterDispute(1), s.amount(), "REF-2024-005"),
                        "Merchant confirmed error and processed immediate refund ($189.99). Refund confirmation sent to customer."),
                EvidenceItem.of(PREVIOUS_DISPUTE, new PriorDisputeHistory(2, 1, "merchant_error", "good", "cb_007"),
                        "Customer has 2 previous disputes (1 merchant error - cb_007). Good customer relationship. "
                                + "Merchant errors acknowledged and resolved.")));

        AUTHORED.put("cb_022", (s, t) -> List.of(
                EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket("TKT12366", t.disputeDate(), "email",
                                "Returned the item two weeks ago, refund still pending").withOrder("ORD-12455", s.amount()),
                        "Customer reported refund authorized but not processed. Return completed 2 weeks ago. Refund still pending."),
                EvidenceItem.of(MERCHANT_INVESTIGATION, new MerchantInvestigation("ORD-12455", true, "refund_not_processed",
                                "refund_system_bug", s.amount(), BigDecimal.ZERO.setScale(2), null),
                        "Merchant investigation: Confirmed refund authorization but processing failed due to system bug. "
                                + "Refund system error identified."),
                EvidenceItem.of(REFUND, RefundAction.processed(t.afterDispute(3), s.amount(), "REF-2024-006"),
                        "Merchant acknowledged error and processed refund ($319.99) with 14-day delay. Apology sent to customer."),
                EvidenceItem.of(PREVIOUS_DISPUTE, new PriorDisputeHistory(2, 1, "merchant_error", "good", "cb_008"),
                        "Customer has 2 previous disputes (1 merchant error - cb_008). Good customer relationship. "
                                + "Merchant errors acknowledged.")));

        AUTHORED.put("cb_023", (s, t) -> List.of(
                EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket("TKT12367", t.disputeDate(), "phone",
                                "Charged for an order I cancelled").withOrder("ORD-12502", s.amount()),
                        "Customer reported authorization hold not released after order cancellation. Charged for cancelled order."),
                EvidenceItem.of(MERCHANT_INVESTIGATION, new MerchantInvestigation("ORD-12502", true, "authorization_hold_not_released",
                                "payment_processor_bug", s.amount(), BigDecimal.ZERO.setScale(2), null),
                        "Merchant investigation: Confirmed authorization hold not released due to payment processor bug. "
                                + "System error identified."),
                EvidenceItem.of(REFUND, RefundAction.processed(t.afterDispute(1), s.amount(), "REF-2024-007"),
                        "Merchant confirmed error, released authorization hold, and processed refund ($225.00). "
                                + "Refund confirmation sent to customer."),
                EvidenceItem.of(SYSTEM_FIX, new SystemFix(true, t.afterDispute(3),
                                "Payment processor authorization hold release logic fixed",
                                "Added automated hold release for cancelled orders"),
                        "System fix implemented: Payment processor authorization hold release logic corrected. "
                                + "Automated hold release added for cancelled orders."),
                EvidenceItem.of(PREVIOUS_DISPUTE, new PriorDisputeHistory(2, 0, "merchant_error", "good", "cb_013"),
                        "Customer has 2 previous disputes (1 not_guilty - cb_013). Good customer relationship. "
                                + "First merchant error case.")));
    }

    public boolean hasAuthoredTrail(String chargebackId) {
        return AUTHORED.containsKey(chargebackId);
    }

    /**
     * Events for the case, never empty.
     */
    public List<EvidenceItem> trailFor(CaseScenario scenario, CaseTimeline timeline) {
        Template authored = AUTHORED.get(scenario.chargebackId());
        if (authored != null) {
            return authored.trail(scenario, timeline);
        }
        return fallbackTrail(scenario, timeline);
    }

    List<EvidenceItem> fallbackTrail(CaseScenario scenario, CaseTimeline timeline) {
        String ticket = "TKT-" + scenario.chargebackId();
        CaseCategory category = scenario.category();
        return switch (category) {
            case TRUE_FRAUD -> List.of(
                    EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket(ticket, timeline.disputeDate(), "phone",
                            "Did not make this purchase"), "Customer reported fraud."),
                    EvidenceItem.of(FRAUD_INDICATORS, failedChecks(scenario, "high_risk", "unusual_behavior"),
                            "Fraud checks failed at authorization."));
            case FRIENDLY_FRAUD -> List.of(
                    EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket(ticket, timeline.disputeDate(), "email",
                            "Disputing this charge"), "Customer contacted support."),
                    EvidenceItem.of(REFUND, RefundAction.offered(timeline.afterDispute(1), scenario.chargebackAmount(),
                            "pending", null), "Merchant offered refund."));
            case MERCHANT_ERROR -> List.of(
                    EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket(ticket, timeline.disputeDate(), "email",
                            "Charged incorrectly"), "Customer reported error."),
                    EvidenceItem.of(REFUND, RefundAction.processed(timeline.afterDispute(1), scenario.chargebackAmount(),
                            null), "Merchant processed refund."));
            case NOT_GUILTY -> List.of(
                    EvidenceItem.of(SUPPORT_TICKET, SupportContact.ticket(ticket, timeline.disputeDate(), "chargeback",
                            "Chargeback notice"), "Chargeback received."),
                    EvidenceItem.of(REFUND, RefundAction.evidenceSubmitted(timeline.afterDispute(1)),
                            "Evidence package submitted."));
        };
    }

    private static FraudIndicators failedChecks(CaseScenario s, String ipReputation, String pattern) {
        return new FraudIndicators(s.avsCheck(), s.cvvCheck(), s.threeDsUsed(), s.deviceFingerprint(), false,
                ipReputation, pattern, s.fraudScore());
    }

    private static FraudIndicators passedChecks(CaseScenario s) {
        return new FraudIndicators(s.avsCheck(), s.cvvCheck(), s.threeDsUsed(), s.deviceFingerprint(), true,
                "low_risk", "consistent_with_history", s.fraudScore());
    }
}
