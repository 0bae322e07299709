package com.rescuegrid.dispatch.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * 사건 projection (Incident Projection) - Incident Service 사건의 로컬 캐시.
 *
 * <p>권위 있는 데이터가 아니다. IncidentCreated에서 생성되고, IncidentUpdated에서
 * 비어 있지 않은 값만 필드 단위로 덮어쓴다. 소비자는 이 행을 삭제하지 않는다.</p>
 *
 * <h3>값 비교 규칙</h3>
 * <ul>
 *   <li>들어온 값이 null/공백이면 "값 없음" → 변경 아님, 덮어쓰지 않음</li>
 *   <li>문자열은 trim 후 대소문자 무시 비교</li>
 *   <li>좌표는 위도/경도 모두 null·0이 아닐 때만 유효</li>
 *   <li>캐시 값이 null이고 들어온 값이 있으면 변경</li>
 * </ul>
 * <p>{@code sync*} 메서드는 값이 실제로 바뀌었을 때만 true를 반환한다.
 * 호출자는 이 결과로만 메모/알림 문구를 만든다 (재전달된 동일 업데이트 → 부수효과 없음).</p>
 *
 * <h3>이벤트 순서</h3>
 * <p>마지막으로 반영한 사건 이벤트의 timestamp를 {@code lastEventAt}에 둔다.
 * 그보다 늦지 않은 업데이트(재전달, 순서 뒤바뀜)는 {@link #isNewerThanApplied(Instant)}가 false.</p>
 */
@Entity
@Table(name = "incidents")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class IncidentProjection {

    @Id
    private UUID id;                    // 사건 UUID (Incident Service의 PK)

    private String incidentCode;        // 공개 코드 (INC-...)
    private String title;
    private String type;
    private String severity;

    @Column(nullable = false)
    private String status;

    private Double latitude;
    private Double longitude;

    private LocalDateTime reportedAt;

    @Column(nullable = false)
    private LocalDateTime lastSyncedAt;

    private UUID createdByUserId;       // 신고자 (출동 이벤트의 알림 수신자)

    private Instant lastEventAt;        // 마지막으로 반영한 사건 이벤트의 발행 시각

    @Builder
    public IncidentProjection(UUID id, String incidentCode, String title, String type, String severity,
                              String status, Double latitude, Double longitude,
                              LocalDateTime reportedAt, UUID createdByUserId, Instant lastEventAt) {
        this.id = id;
        this.incidentCode = incidentCode;
        this.title = title;
        this.type = type;
        this.severity = severity;
        this.status = hasText(status) ? status.trim() : "CREATED";
        this.latitude = latitude;
        this.longitude = longitude;
        this.reportedAt = reportedAt;
        this.createdByUserId = createdByUserId;
        this.lastEventAt = lastEventAt;
        this.lastSyncedAt = LocalDateTime.now();
    }

    /** timestamp가 없는 이벤트는 순서를 알 수 없으므로 받아들인다 */
    public boolean isNewerThanApplied(Instant eventTimestamp) {
        return eventTimestamp == null || lastEventAt == null || eventTimestamp.isAfter(lastEventAt);
    }

    public boolean syncStatus(String incoming) {
        if (!hasText(incoming) || sameText(status, incoming)) {
            return false;
        }
        this.status = incoming.trim();
        return true;
    }

    public boolean syncSeverity(String incoming) {
        if (!hasText(incoming) || sameText(severity, incoming)) {
            return false;
        }
        this.severity = incoming.trim();
        return true;
    }

    public boolean syncTitle(String incoming) {
        if (!hasText(incoming) || sameText(title, incoming)) {
            return false;
        }
        this.title = incoming.trim();
        return true;
    }

    public boolean syncType(String incoming) {
        if (!hasText(incoming) || sameText(type, incoming)) {
            return false;
        }
        this.type = incoming.trim();
        return true;
    }

    public boolean syncIncidentCode(String incoming) {
        if (!hasText(incoming) || sameText(incidentCode, incoming)) {
            return false;
        }
        this.incidentCode = incoming.trim();
        return true;
    }

    public boolean syncLocation(Double incomingLatitude, Double incomingLongitude) {
        if (incomingLatitude == null || incomingLongitude == null
                || incomingLatitude == 0 || incomingLongitude == 0) {
            return false;
        }
        if (Objects.equals(latitude, incomingLatitude) && Objects.equals(longitude, incomingLongitude)) {
            return false;
        }
        this.latitude = incomingLatitude;
        this.longitude = incomingLongitude;
        return true;
    }

    /** 신고자는 처음 알게 된 값을 유지하고 비어 있을 때만 채운다 */
    public void fillCreatedByUserId(UUID incoming) {
        if (this.createdByUserId == null && incoming != null) {
            this.createdByUserId = incoming;
        }
    }

    public void markSynced(Instant eventTimestamp) {
        this.lastSyncedAt = LocalDateTime.now();
        if (eventTimestamp != null) {
            this.lastEventAt = eventTimestamp;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean sameText(String cached, String incoming) {
        return cached != null
                && cached.trim().toLowerCase(Locale.ROOT).equals(incoming.trim().toLowerCase(Locale.ROOT));
    }
}
