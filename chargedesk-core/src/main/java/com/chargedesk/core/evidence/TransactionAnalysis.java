package com.chargedesk.core.evidence;

/**
 * Comparison of the disputed transaction against the customer's usual location,
 * device and addresses.
 */
public record TransactionAnalysis(
        String ipAddress,
        String deviceFingerprint,
        String locationCountry,
        String locationCity,
        String customerLocation,
        Integer distanceMiles,
        Boolean unusualLocation,
        Boolean addressMatch,
        Boolean deviceMatch,
        Boolean ipMatch,
        Integer historicalOrders) implements CasePayload {

    public static TransactionAnalysis anomalous(String ipAddress, String deviceFingerprint, String country,
                                                String city, String customerLocation, int distanceMiles) {
        return new TransactionAnalysis(ipAddress, deviceFingerprint, country, city, customerLocation,
                distanceMiles, true, false, false, false, null);
    }

    public static TransactionAnalysis consistent(String ipAddress, String deviceFingerprint, int historicalOrders) {
        return new TransactionAnalysis(ipAddress, deviceFingerprint, null, null, null,
                null, false, true, true, true, historicalOrders);
    }
}
