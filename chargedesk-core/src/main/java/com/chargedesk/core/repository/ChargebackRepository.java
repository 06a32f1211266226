package com.chargedesk.core.repository;

import com.chargedesk.core.domain.Chargeback;
import com.chargedesk.core.domain.Chargeback.CaseCategory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ChargebackRepository extends JpaRepository<Chargeback, String> {

    Optional<Chargeback> findByTransactionId(String transactionId);

    boolean existsByTransactionId(String transactionId);

    List<Chargeback> findByCaseCategory(CaseCategory caseCategory);
}
