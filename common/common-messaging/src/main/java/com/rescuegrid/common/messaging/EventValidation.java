package com.rescuegrid.common.messaging;

import java.util.UUID;

/** 수신 이벤트 필드 검증 헬퍼. 실패 시 {@link MalformedEventException} */
public final class EventValidation {

    private EventValidation() {
    }

    public static UUID requireUuid(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new MalformedEventException("Missing " + field);
        }
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            throw new MalformedEventException("Invalid " + field + ": " + value, e);
        }
    }

    public static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new MalformedEventException("Missing " + field);
        }
        return value;
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
