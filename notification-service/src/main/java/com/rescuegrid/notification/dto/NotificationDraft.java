package com.rescuegrid.notification.dto;

import java.util.Map;

/**
 * 알림 생성 요청.
 *
 * @param dedupKey 이벤트 기반 알림이면 eventType:referenceId, 수동 생성이면 null
 */
public record NotificationDraft(
        String title,
        String message,
        String category,
        String type,
        String severity,
        String recipientType,
        String recipientId,
        String referenceType,
        String referenceId,
        Map<String, String> metadata,
        String dedupKey
) {
    public static final String RECIPIENT_USER = "User";
    public static final String RECIPIENT_SYSTEM = "System";
    public static final String ALL_RECIPIENTS = "all";
}
