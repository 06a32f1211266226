package com.chargedesk.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import org.hibernate.annotations.Immutable;

/**
 * Entry of a chargeback's evidentiary trail. Never updated or deleted once written.
 *
 * {@code eventData} holds the JSON form of the payload; decode it with
 * {@link com.chargedesk.core.evidence.CasePayloadCodec} using {@code eventType} as the tag.
 */
@Entity
@Immutable
@Table(name = "case_events", indexes = {
    @Index(name = "idx_case_events_chargeback", columnList = "chargeback_id"),
    @Index(name = "idx_case_events_type", columnList = "event_type"),
    @Index(name = "idx_case_events_date", columnList = "event_date")
})
public class CaseEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "event_id")
    private Long id;

    @NotNull
    @Column(name = "chargeback_id", length = 50, nullable = false)
    private String chargebackId;

    @NotNull
    @Column(name = "event_type", length = 50, nullable = false)
    private String eventType;

    @NotNull
    @Column(name = "event_date", nullable = false)
    private Instant eventDate;

    @Column(name = "event_data")
    private String eventData;

    @Column
    private String description;

    protected CaseEvent() {}

    public static CaseEvent record(String chargebackId, String eventType, Instant eventDate,
                                   String eventData, String description) {
        if (chargebackId == null || chargebackId.isBlank()) {
            throw new IllegalArgumentException("Case event requires a chargeback");
        }
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("Event type is required");
        }
        if (eventDate == null) {
            throw new IllegalArgumentException("Event date is required");
        }
        var event = new CaseEvent();
        event.chargebackId = chargebackId;
        event.eventType = eventType;
        event.eventDate = eventDate;
        event.eventData = eventData;
        event.description = description;
        return event;
    }

    public Long getId() { return id; }
    public String getChargebackId() { return chargebackId; }
    public String getEventType() { return eventType; }
    public Instant getEventDate() { return eventDate; }
    public String getEventData() { return eventData; }
    public String getDescription() { return description; }
}
