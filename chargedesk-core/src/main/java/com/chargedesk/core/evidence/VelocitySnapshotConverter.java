package com.chargedesk.core.evidence;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores a {@link VelocitySnapshot} in {@code transactions.velocity_data} as JSON.
 */
@Converter
public class VelocitySnapshotConverter implements AttributeConverter<VelocitySnapshot, String> {

    private final CasePayloadCodec codec = new CasePayloadCodec();

    @Override
    public String convertToDatabaseColumn(VelocitySnapshot attribute) {
        return codec.encode(CaseEventType.VELOCITY_CHECK.tag(), attribute);
    }

    @Override
    public VelocitySnapshot convertToEntityAttribute(String dbData) {
        return codec.decodeVelocity(dbData);
    }
}
