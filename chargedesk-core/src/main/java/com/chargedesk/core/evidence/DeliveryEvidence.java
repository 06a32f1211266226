package com.chargedesk.core.evidence;

import java.time.Instant;

/**
 * Carrier or digital delivery proof. Physical shipments fill the tracking fields,
 * digital goods fill the download fields.
 */
public record DeliveryEvidence(
        String trackingNumber,
        String carrier,
        Instant deliveredDate,
        String deliveryAddress,
        String signatureName,
        String gpsCoordinates,
        String deliveryPhoto,
        String downloadIp,
        Integer downloadCount) implements CasePayload {

    public static DeliveryEvidence shipped(String trackingNumber, String carrier, Instant deliveredDate,
                                           String address, String signatureName, String gps, String photo) {
        return new DeliveryEvidence(trackingNumber, carrier, deliveredDate, address, signatureName, gps, photo, null, null);
    }

    public static DeliveryEvidence downloaded(Instant deliveredDate, String downloadIp, int downloadCount) {
        return new DeliveryEvidence(null, "email", deliveredDate, null, null, null, null, downloadIp, downloadCount);
    }
}
