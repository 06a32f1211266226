package com.chargedesk.core.evidence;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.LinkedHashMap;

/**
 * JSON codec for case payloads.
 *
 * Documents use snake_case keys and ISO-8601 timestamps. Decoding picks the record
 * registered for the tag in {@link CaseEventType}; unknown keys are ignored, unknown
 * tags decode to an {@link OpaquePayload}.
 */
public class CasePayloadCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> FIELD_BAG = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public CasePayloadCodec() {
        this(defaultMapper());
    }

    public CasePayloadCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper defaultMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * Encodes a payload to be stored under {@code tag}.
     *
     * @throws IllegalArgumentException if the payload's shape does not belong to the tag
     */
    public String encode(String tag, CasePayload payload) {
        if (payload == null) {
            return null;
        }
        if (!CaseEventType.accepts(tag, payload)) {
            throw new IllegalArgumentException(
                    payload.getClass().getSimpleName() + " cannot be stored under event type '" + tag + "'");
        }
        try {
            if (payload instanceof OpaquePayload opaque) {
                return mapper.writeValueAsString(opaque.fields());
            }
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new PayloadFormatException(tag, e);
        }
    }

    /**
     * Decodes a stored document. A missing document decodes to an empty opaque payload.
     *
     * @throws PayloadFormatException if the document is not valid JSON for the tag's shape
     */
    public CasePayload decode(String tag, String json) {
        if (json == null || json.isBlank()) {
            return OpaquePayload.empty();
        }
        try {
            var type = CaseEventType.fromTag(tag);
            if (type.isPresent()) {
                return mapper.readValue(json, type.get().payloadType());
            }
            return new OpaquePayload(mapper.readValue(json, FIELD_BAG));
        } catch (JsonProcessingException e) {
            throw new PayloadFormatException(tag, e);
        }
    }

    public VelocitySnapshot decodeVelocity(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        return (VelocitySnapshot) decode(CaseEventType.VELOCITY_CHECK.tag(), json);
    }

    public static class PayloadFormatException extends RuntimeException {
        private final String tag;

        public PayloadFormatException(String tag, Throwable cause) {
            super("Malformed payload for event type '" + tag + "': " + cause.getMessage(), cause);
            this.tag = tag;
        }

        public String getTag() { return tag; }
    }
}
