package com.rescuegrid.common.event;

/**
 * 기본 채널(토픽) 이름.
 *
 * <p>각 서비스의 application.yml에서 {@code rescuegrid.topics.*}로 덮어쓸 수 있다.
 * 큐 이름은 소비하는 서비스가 소유하므로 여기에 두지 않는다.</p>
 */
public final class Topics {

    public static final String INCIDENT_CREATED = "incident-created-topic";
    public static final String INCIDENT_UPDATED = "incident-updated-topic";
    public static final String DISPATCH_EVENTS = "dispatch-events-topic";
    public static final String NOTIFICATION_EMAIL = "notification-email-topic";

    private Topics() {
    }
}
