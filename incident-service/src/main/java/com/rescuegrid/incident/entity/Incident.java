package com.rescuegrid.incident.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.UUID;

/**
 * 사건(Incident) 엔티티 - 사건 정보의 원본(authoritative) 저장소.
 *
 * <h3>핵심 필드 설명</h3>
 * <ul>
 *   <li>{@code id} - 서비스 간 참조에 쓰는 UUID</li>
 *   <li>{@code incidentCode} - 사람이 읽는 공개 코드 (INC-yyyyMMdd-XXXXXX), unique</li>
 *   <li>{@code status} - 운영자 수정 또는 출동 이벤트로 변경 ({@link IncidentStatus})</li>
 *   <li>{@code createdByUserId} - 신고자. 출동 알림의 수신자가 된다</li>
 * </ul>
 */
@Entity
@Table(name = "incidents", indexes = {
        @Index(name = "idx_incident_status", columnList = "status"),
        @Index(name = "idx_incident_reported_at", columnList = "reportedAt")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Incident {

    @Id
    private UUID id;

    @Version
    private Long version;

    @Column(nullable = false, unique = true, length = 32)
    private String incidentCode;

    @Column(nullable = false)
    private String title;

    @Column(length = 2000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private IncidentType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Severity severity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private IncidentStatus status;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    private String reporterName;
    private String reporterContact;

    @Column(nullable = false)
    private LocalDateTime reportedAt;   // UTC

    private LocalDateTime resolvedAt;   // UTC, RESOLVED 진입 시각

    @Column(length = 2000)
    private String resolutionNotes;

    private UUID createdByUserId;

    @Builder
    public Incident(String incidentCode, String title, String description, IncidentType type, Severity severity,
                    Double latitude, Double longitude, String reporterName, String reporterContact,
                    UUID createdByUserId) {
        this.id = UUID.randomUUID();
        this.incidentCode = incidentCode;
        this.title = title;
        this.description = description;
        this.type = type != null ? type : IncidentType.OTHER;
        this.severity = severity != null ? severity : Severity.MEDIUM;
        this.status = IncidentStatus.CREATED;
        this.latitude = latitude;
        this.longitude = longitude;
        this.reporterName = reporterName;
        this.reporterContact = reporterContact;
        this.createdByUserId = createdByUserId;
        this.reportedAt = LocalDateTime.now(ZoneOffset.UTC);
    }

    /**
     * 운영자 수정. null/공백 값은 "변경 없음".
     *
     * @return 실제로 바뀐 필드가 하나라도 있으면 true
     */
    public boolean update(String title, String description, IncidentType type, Severity severity,
                          IncidentStatus status, Double latitude, Double longitude, String resolutionNotes) {
        boolean changed = false;
        if (hasText(title) && !title.trim().equals(this.title)) {
            this.title = title.trim();
            changed = true;
        }
        if (hasText(description) && !description.trim().equals(this.description)) {
            this.description = description.trim();
            changed = true;
        }
        if (type != null && type != this.type) {
            this.type = type;
            changed = true;
        }
        if (severity != null && severity != this.severity) {
            this.severity = severity;
            changed = true;
        }
        if (status != null && status != this.status) {
            changeStatus(status);
            changed = true;
        }
        if (latitude != null && longitude != null
                && (!Objects.equals(latitude, this.latitude) || !Objects.equals(longitude, this.longitude))) {
            this.latitude = latitude;
            this.longitude = longitude;
            changed = true;
        }
        if (hasText(resolutionNotes) && !resolutionNotes.trim().equals(this.resolutionNotes)) {
            this.resolutionNotes = resolutionNotes.trim();
            changed = true;
        }
        return changed;
    }

    /**
     * 출동 진행에 따른 상태 상향. 현재 상태보다 뒤에 있을 때만 적용.
     *
     * @return 상태가 바뀌었으면 true
     */
    public boolean upgradeStatus(IncidentStatus target) {
        if (!target.isAfter(status)) {
            return false;
        }
        changeStatus(target);
        return true;
    }

    private void changeStatus(IncidentStatus status) {
        this.status = status;
        if (status == IncidentStatus.RESOLVED && resolvedAt == null) {
            this.resolvedAt = LocalDateTime.now(ZoneOffset.UTC);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
