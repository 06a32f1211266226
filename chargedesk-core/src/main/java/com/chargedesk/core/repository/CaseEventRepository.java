package com.chargedesk.core.repository;

import com.chargedesk.core.domain.CaseEvent;
import org.springframework.data.repository.Repository;

import java.util.List;

/**
 * Append-only access to case events: no update or delete is exposed.
 */
@org.springframework.stereotype.Repository
public interface CaseEventRepository extends Repository<CaseEvent, Long> {

    CaseEvent save(CaseEvent event);

    List<CaseEvent> findByChargebackIdOrderByEventDateAscIdAsc(String chargebackId);
}
