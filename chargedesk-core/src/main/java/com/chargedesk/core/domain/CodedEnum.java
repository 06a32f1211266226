package com.chargedesk.core.domain;

import java.util.Arrays;

/**
 * Enum persisted by a short lowercase code rather than its constant name.
 */
public interface CodedEnum {

    String code();

    /**
     * Resolves a code to its constant.
     *
     * @throws IllegalArgumentException if no constant of {@code type} carries the code
     */
    static <E extends Enum<E> & CodedEnum> E fromCode(Class<E> type, String code) {
        return Arrays.stream(type.getEnumConstants())
                .filter(constant -> constant.code().equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown " + type.getSimpleName() + " code: " + code));
    }
}
