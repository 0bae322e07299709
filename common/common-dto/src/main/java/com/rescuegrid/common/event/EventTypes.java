package com.rescuegrid.common.event;

import java.util.Set;

/**
 * 이벤트 타입 태그 (Event Type Tags)
 *
 * <p>메시지 본문의 {@code eventType} 필드와 전송 계층의 {@code EventType} 속성에 동일하게 실린다.
 * 소비자는 자신이 허용한 태그 집합에 없는 메시지를 malformed로 간주하고 폐기한다.</p>
 *
 * <pre>
 *   Incident Service  ── IncidentCreated / IncidentUpdated ──▶ Dispatch, Notification
 *   Dispatch Service  ── Dispatch* ──────────────────────────▶ Incident, Notification
 *   (any)             ── NotificationEmailRequested ─────────▶ Notification
 * </pre>
 */
public final class EventTypes {

    public static final String INCIDENT_CREATED = "IncidentCreated";
    public static final String INCIDENT_UPDATED = "IncidentUpdated";

    public static final String DISPATCH_ORDER_CREATED = "DispatchOrderCreated";
    public static final String DISPATCH_ASSIGNMENT_CREATED = "DispatchAssignmentCreated";
    public static final String DISPATCH_ASSIGNMENT_COMPLETED = "DispatchAssignmentCompleted";
    public static final String DISPATCH_ORDER_COMPLETED = "DispatchOrderCompleted";

    public static final String NOTIFICATION_EMAIL_REQUESTED = "NotificationEmailRequested";

    /** dispatch-events-topic 으로 발행되는 모든 타입 */
    public static final Set<String> DISPATCH_EVENTS = Set.of(
            DISPATCH_ORDER_CREATED,
            DISPATCH_ASSIGNMENT_CREATED,
            DISPATCH_ASSIGNMENT_COMPLETED,
            DISPATCH_ORDER_COMPLETED);

    private EventTypes() {
    }
}
