package com.rescuegrid.notification.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 알림(Notification) 엔티티.
 *
 * <h3>핵심 필드 설명</h3>
 * <ul>
 *   <li>{@code category / type} - 발생 영역(Incident, Dispatch)과 종류(Created, Update, UnitAssigned ...)</li>
 *   <li>{@code recipientType / recipientId} - User + 사용자 UUID, 또는 System + "all"</li>
 *   <li>{@code referenceType / referenceId} - 알림이 가리키는 대상 (Incident, DispatchOrder, DispatchAssignment)</li>
 *   <li>{@code dedupKey} - 이벤트 기반 알림의 중복 방지 키 (eventType:referenceId), unique</li>
 * </ul>
 *
 * <p>같은 dedupKey로는 한 번만 저장된다. 재전달된 이벤트가 같은 알림을 두 번 만들지 않는다.</p>
 */
@Entity
@Table(name = "notifications", indexes = {
        @Index(name = "idx_notification_recipient", columnList = "recipientId, createdAt")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Notification {

    @Id
    private UUID id;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false, length = 2000)
    private String message;

    @Column(nullable = false, length = 50)
    private String category;

    @Column(nullable = false, length = 50)
    private String type;

    @Column(length = 20)
    private String severity;

    @Column(nullable = false, length = 20)
    private String recipientType;

    @Column(nullable = false)
    private String recipientId;

    @Column(length = 50)
    private String referenceType;

    private String referenceId;

    @Convert(converter = MetadataConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, String> metadata = new LinkedHashMap<>();

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime readAt;

    @Column(unique = true)
    private String dedupKey;

    @Builder
    public Notification(String title, String message, String category, String type, String severity,
                        String recipientType, String recipientId, String referenceType, String referenceId,
                        Map<String, String> metadata, String dedupKey) {
        this.id = UUID.randomUUID();
        this.title = title;
        this.message = message;
        this.category = category;
        this.type = type;
        this.severity = severity;
        this.recipientType = recipientType;
        this.recipientId = recipientId;
        this.referenceType = referenceType;
        this.referenceId = referenceId;
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        this.dedupKey = dedupKey;
        this.read = false;
        this.createdAt = LocalDateTime.now();
    }

    /** 이미 읽은 알림이면 readAt을 바꾸지 않는다 */
    public void markAsRead() {
        if (read) {
            return;
        }
        this.read = true;
        this.readAt = LocalDateTime.now();
    }
}
