package com.chargedesk.core.evidence;

import java.util.List;

public record LoginActivity(
        String loginLocation,
        String loginIp,
        String deviceFingerprint,
        String loginDevice,
        Boolean deviceKnown,
        Boolean sameIpAsTransaction,
        String loginFrequency,
        List<String> actionsTaken) implements CasePayload {

    public LoginActivity {
        actionsTaken = actionsTaken == null ? null : List.copyOf(actionsTaken);
    }

    public static LoginActivity knownDevice(String location, String ip, String deviceFingerprint, String frequency) {
        return new LoginActivity(location, ip, deviceFingerprint, null, true, true, frequency, null);
    }
}
