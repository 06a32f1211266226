package com.chargedesk.core.evidence;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload of an event whose type tag has no typed shape. Keeps the decoded fields
 * in document order.
 */
public record OpaquePayload(Map<String, Object> fields) implements CasePayload {

    public OpaquePayload {
        fields = fields == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static OpaquePayload empty() {
        return new OpaquePayload(Map.of());
    }

    public Object get(String key) {
        return fields.get(key);
    }
}
