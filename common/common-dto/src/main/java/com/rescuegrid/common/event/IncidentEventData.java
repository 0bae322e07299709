package com.rescuegrid.common.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 사건(Incident) 이벤트 페이로드 - IncidentCreated / IncidentUpdated 공용.
 *
 * <p>{@code id}는 사건의 UUID, {@code incidentId}는 사람이 읽는 공개 코드(INC-...).
 * IncidentUpdated에서는 일부 필드만 채워질 수 있다.
 * 빈 문자열, null, 좌표 0은 "값 없음"으로 취급한다 ({@link #hasLocation()}).</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IncidentEventData(
        @JsonProperty("id") String id,                     // 사건 UUID (projection PK)
        @JsonProperty("incidentId") String incidentId,     // 공개 코드 (INC-yyyyMMdd-XXXXXX)
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("type") String type,                 // 사건 분류 (FIRE, MEDICAL ...)
        @JsonProperty("severity") String severity,
        @JsonProperty("status") String status,
        @JsonProperty("latitude") Double latitude,
        @JsonProperty("longitude") Double longitude,
        @JsonProperty("reportedAt") String reportedAt,     // ISO-8601
        @JsonProperty("createdByUserId") String createdByUserId
) {
    /** 위도/경도 둘 다 유효한 값(null 아님, 0 아님)일 때만 위치가 있다고 본다 */
    public boolean hasLocation() {
        return latitude != null && longitude != null && latitude != 0 && longitude != 0;
    }
}
