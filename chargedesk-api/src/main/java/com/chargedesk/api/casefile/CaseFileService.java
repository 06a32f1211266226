package com.chargedesk.api.casefile;

import com.chargedesk.api.schema.StoreInspector;
import com.chargedesk.core.domain.CardTransaction;
import com.chargedesk.core.domain.CaseEvent;
import com.chargedesk.core.domain.Chargeback;
import com.chargedesk.core.domain.Chargeback.Outcome;
import com.chargedesk.core.domain.Customer;
import com.chargedesk.core.domain.Merchant;
import com.chargedesk.core.evidence.CasePayload;
import com.chargedesk.core.evidence.CasePayloadCodec;
import com.chargedesk.core.repository.CardTransactionRepository;
import com.chargedesk.core.repository.CaseEventRepository;
import com.chargedesk.core.repository.ChargebackRepository;
import com.chargedesk.core.repository.CustomerRepository;
import com.chargedesk.core.repository.MerchantRepository;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Write interface of the chargeback store.
 *
 * Every write checks the parent rows and uniqueness rules itself and reports a
 * violation with the entity id and the name of the schema constraint it would break.
 * Violations the store raises on its own are translated the same way. Each call runs
 * in its own transaction unless the caller already holds one.
 */
@Service
public class CaseFileService {

    private static final Logger log = LoggerFactory.getLogger(CaseFileService.class);

    private final CustomerRepository customerRepository;
    private final MerchantRepository merchantRepository;
    private final CardTransactionRepository transactionRepository;
    private final ChargebackRepository chargebackRepository;
    private final CaseEventRepository caseEventRepository;
    private final CasePayloadCodec payloadCodec;
    private final StoreInspector storeInspector;

    public CaseFileService(
            CustomerRepository customerRepository,
            MerchantRepository merchantRepository,
            CardTransactionRepository transactionRepository,
            ChargebackRepository chargebackRepository,
            CaseEventRepository caseEventRepository,
            CasePayloadCodec payloadCodec,
            StoreInspector storeInspector) {
        this.customerRepository = customerRepository;
        this.merchantRepository = merchantRepository;
        this.transactionRepository = transactionRepository;
        this.chargebackRepository = chargebackRepository;
        this.caseEventRepository = caseEventRepository;
        this.payloadCodec = payloadCodec;
        this.storeInspector = storeInspector;
    }

    @Transactional
    public Customer registerCustomer(Customer customer) {
        storeInspector.requireInitialized();
        if (customerRepository.existsById(customer.getCustomerId())) {
            throw new CaseConstraintViolationException("customer", customer.getCustomerId(), "pk_customers");
        }
        return insert("customer", customer.getCustomerId(), "pk_customers",
                () -> customerRepository.saveAndFlush(customer));
    }

    @Transactional
    public Merchant registerMerchant(Merchant merchant) {
        storeInspector.requireInitialized();
        if (merchantRepository.existsById(merchant.getMerchantId())) {
            throw new CaseConstraintViolationException("merchant", merchant.getMerchantId(), "pk_merchants");
        }
        return insert("merchant", merchant.getMerchantId(), "pk_merchants",
                () -> merchantRepository.saveAndFlush(merchant));
    }

    /**
     * Inserts a transaction in status {@code completed}.
     *
     * @throws CaseConstraintViolationException if the customer or merchant does not exist,
     *         or the transaction id is taken
     */
    @Transactional
    public CardTransaction recordTransaction(CardTransaction transaction) {
        storeInspector.requireInitialized();
        String id = transaction.getTransactionId();
        if (!customerRepository.existsById(transaction.getCustomerId())) {
            throw new CaseConstraintViolationException("transaction", id, "fk_transactions_customer");
        }
        if (!merchantRepository.existsById(transaction.getMerchantId())) {
            throw new CaseConstraintViolationException("transaction", id, "fk_transactions_merchant");
        }
        if (transactionRepository.existsById(id)) {
            throw new CaseConstraintViolationException("transaction", id, "pk_transactions");
        }
        return insert("transaction", id, "pk_transactions", () -> transactionRepository.saveAndFlush(transaction));
    }

    /**
     * Files an open chargeback and marks its transaction disputed in the same transaction.
     *
     * @throws CaseConstraintViolationException if the transaction does not exist, already
     *         carries a chargeback, or the chargeback id is taken
     */
    @Transactional
    public Chargeback fileChargeback(Chargeback chargeback) {
        storeInspector.requireInitialized();
        String id = chargeback.getChargebackId();
        CardTransaction transaction = transactionRepository.findById(chargeback.getTransactionId())
                .orElseThrow(() -> new CaseConstraintViolationException("chargeback", id, "fk_chargebacks_transaction"));
        if (chargebackRepository.existsByTransactionId(transaction.getTransactionId()) || transaction.isDisputed()) {
            throw new CaseConstraintViolationException("chargeback", id, "uq_chargebacks_transaction");
        }
        if (chargebackRepository.existsById(id)) {
            throw new CaseConstraintViolationException("chargeback", id, "pk_chargebacks");
        }

        Chargeback filed = insert("chargeback", id, "pk_chargebacks", () -> chargebackRepository.saveAndFlush(chargeback));
        transaction.markDisputed();
        transactionRepository.saveAndFlush(transaction);
        log.debug("Filed chargeback {} against transaction {}", id, transaction.getTransactionId());
        return filed;
    }

    @Transactional
    public Chargeback startReview(String chargebackId) {
        storeInspector.requireInitialized();
        Chargeback chargeback = findChargeback(chargebackId);
        chargeback.startReview();
        return chargebackRepository.saveAndFlush(chargeback);
    }

    /**
     * Closes a case with the given outcome. Status, outcome and closing time change together.
     *
     * @throws ChargebackNotFoundException if no such chargeback exists
     * @throws Chargeback.IllegalCaseTransitionException if the case is already closed
     */
    @Transactional
    public Chargeback closeChargeback(String chargebackId, Outcome outcome, Instant closedAt) {
        storeInspector.requireInitialized();
        Chargeback chargeback = findChargeback(chargebackId);
        chargeback.close(outcome, closedAt);
        Chargeback closed = insert("chargeback", chargebackId, "ck_chargebacks_outcome_pairing",
                () -> chargebackRepository.saveAndFlush(chargeback));
        log.debug("Closed chargeback {} as {}", chargebackId, outcome.code());
        return closed;
    }

    /**
     * Appends an entry to a case's evidentiary trail.
     *
     * @throws CaseConstraintViolationException if the chargeback does not exist
     * @throws IllegalArgumentException if the payload shape does not belong to the event type
     */
    @Transactional
    public CaseEvent appendEvent(String chargebackId, String eventType, Instant eventDate,
                                 CasePayload payload, String description) {
        storeInspector.requireInitialized();
        if (!chargebackRepository.existsById(chargebackId)) {
            throw new CaseConstraintViolationException("case_event", chargebackId, "fk_case_events_chargeback");
        }
        CaseEvent event = CaseEvent.record(chargebackId, eventType, eventDate,
                payloadCodec.encode(eventType, payload), description);
        return insert("case_event", chargebackId, "fk_case_events_chargeback", () -> caseEventRepository.save(event));
    }

    /**
     * The case's events ordered by event date, then insertion order, with payloads decoded.
     */
    @Transactional(readOnly = true)
    public List<TrailEntry> caseTrail(String chargebackId) {
        storeInspector.requireInitialized();
        if (!chargebackRepository.existsById(chargebackId)) {
            throw new ChargebackNotFoundException(chargebackId);
        }
        return caseEventRepository.findByChargebackIdOrderByEventDateAscIdAsc(chargebackId).stream()
                .map(event -> new TrailEntry(
                        event.getId(),
                        event.getEventType(),
                        event.getEventDate(),
                        payloadCodec.decode(event.getEventType(), event.getEventData()),
                        event.getDescription()))
                .toList();
    }

    private Chargeback findChargeback(String chargebackId) {
        return chargebackRepository.findById(chargebackId)
                .orElseThrow(() -> new ChargebackNotFoundException(chargebackId));
    }

    private static <T> T insert(String entityType, String entityId, String fallbackConstraint, Supplier<T> write) {
        try {
            return write.get();
        } catch (DataIntegrityViolationException e) {
            throw CaseConstraintViolationException.from(entityType, entityId, fallbackConstraint, e);
        }
    }

    public record TrailEntry(Long eventId, String eventType, Instant eventDate, CasePayload payload, String description) {}

    /**
     * Write rejected by a schema constraint.
     */
    public static class CaseConstraintViolationException extends RuntimeException {
        private final String entityType;
        private final String entityId;
        private final String constraint;

        public CaseConstraintViolationException(String entityType, String entityId, String constraint) {
            this(entityType, entityId, constraint, null);
        }

        public CaseConstraintViolationException(String entityType, String entityId, String constraint, Throwable cause) {
            super("Rejected " + entityType + " " + entityId + ": violates " + constraint, cause);
            this.entityType = entityType;
            this.entityId = entityId;
            this.constraint = constraint;
        }

        static CaseConstraintViolationException from(String entityType, String entityId, String fallbackConstraint,
                                                     DataIntegrityViolationException e) {
            String constraint = fallbackConstraint;
            for (Throwable cause = e; cause != null; cause = cause.getCause()) {
                if (cause instanceof ConstraintViolationException violation && violation.getConstraintName() != null) {
                    constraint = normalize(violation.getConstraintName());
                    break;
                }
            }
            return new CaseConstraintViolationException(entityType, entityId, constraint, e);
        }

        // H2 reports e.g. "FK_TRANSACTIONS_CUSTOMER: PUBLIC.TRANSACTIONS FOREIGN KEY(...)"
        private static String normalize(String reported) {
            String name = reported.trim().toLowerCase(Locale.ROOT);
            int end = name.length();
            for (char stop : new char[] {':', ' ', '('}) {
                int at = name.indexOf(stop);
                if (at > 0 && at < end) {
                    end = at;
                }
            }
            name = name.substring(0, end);
            return name.substring(name.lastIndexOf('.') + 1).replace("\"", "");
        }

        public String getEntityType() { return entityType; }
        public String getEntityId() { return entityId; }
        public String getConstraint() { return constraint; }
    }

    public static class ChargebackNotFoundException extends RuntimeException {
        private final String chargebackId;

        public ChargebackNotFoundException(String chargebackId) {
            super("Chargeback not found: " + chargebackId);
            this.chargebackId = chargebackId;
        }

        public String getChargebackId() { return chargebackId; }
    }
}
