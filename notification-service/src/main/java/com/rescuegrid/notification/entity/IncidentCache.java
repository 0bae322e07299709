package com.rescuegrid.notification.entity;

import com.rescuegrid.common.event.IncidentEventData;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * 사건 캐시 (notification-service 쪽 projection).
 *
 * <p>IncidentUpdated로 알림을 만들 때 "무엇이 바뀌었는가"를 판단하는 기준값과
 * 출동 알림 문구에 쓸 공개 코드를 보관한다. 소비자만 쓰기를 한다.</p>
 *
 * <p>{@link #apply(IncidentEventData, Instant)}는 비어 있지 않고 실제로 다른 값만 반영하고
 * 바뀐 항목의 설명을 돌려준다. 같은 업데이트가 다시 오면 빈 목록.</p>
 * <p>마지막으로 반영한 이벤트 시각보다 늦지 않은 업데이트는 {@link #isNewerThanApplied(Instant)}로 걸러낸다.</p>
 */
@Entity
@Table(name = "incident_cache")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class IncidentCache {

    @Id
    private UUID incidentId;

    private String incidentCode;
    private String title;
    private String severity;

    @Column(nullable = false)
    private String status;

    private Double latitude;
    private Double longitude;

    private UUID createdByUserId;

    @Column(nullable = false)
    private LocalDateTime lastUpdatedAt;

    private Instant lastEventAt;

    @Builder
    public IncidentCache(UUID incidentId, String incidentCode, String title, String severity, String status,
                         Double latitude, Double longitude, UUID createdByUserId, Instant lastEventAt) {
        this.incidentId = incidentId;
        this.incidentCode = incidentCode;
        this.title = title;
        this.severity = severity;
        this.status = hasText(status) ? status.trim() : "CREATED";
        this.latitude = latitude;
        this.longitude = longitude;
        this.createdByUserId = createdByUserId;
        this.lastEventAt = lastEventAt;
        this.lastUpdatedAt = LocalDateTime.now();
    }

    /** timestamp가 없는 이벤트는 받아들인다 */
    public boolean isNewerThanApplied(Instant eventTimestamp) {
        return eventTimestamp == null || lastEventAt == null || eventTimestamp.isAfter(lastEventAt);
    }

    /**
     * 업데이트 반영.
     *
     * @return 바뀐 항목 설명 (순서: status, severity, title, location)
     */
    public List<String> apply(IncidentEventData data, Instant eventTimestamp) {
        List<String> changes = new ArrayList<>();
        if (differs(status, data.status())) {
            this.status = data.status().trim();
            changes.add("status changed to " + status);
        }
        if (differs(severity, data.severity())) {
            this.severity = data.severity().trim();
            changes.add("severity changed to " + severity);
        }
        if (differs(title, data.title())) {
            this.title = data.title().trim();
            changes.add("title changed to \"" + title + "\"");
        }
        if (data.hasLocation()
                && (!Objects.equals(latitude, data.latitude()) || !Objects.equals(longitude, data.longitude()))) {
            this.latitude = data.latitude();
            this.longitude = data.longitude();
            changes.add("location changed to " + latitude + ", " + longitude);
        }
        if (hasText(data.incidentId())) {
            this.incidentCode = data.incidentId().trim();
        }
        if (eventTimestamp != null) {
            this.lastEventAt = eventTimestamp;
        }
        this.lastUpdatedAt = LocalDateTime.now();
        return changes;
    }

    /** 알림 문구에 쓸 사건 표기. 공개 코드가 없으면 UUID */
    public String displayCode() {
        return hasText(incidentCode) ? incidentCode : incidentId.toString();
    }

    private static boolean differs(String cached, String incoming) {
        if (!hasText(incoming)) {
            return false;
        }
        return cached == null
                || !cached.trim().toLowerCase(Locale.ROOT).equals(incoming.trim().toLowerCase(Locale.ROOT));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
