package com.rescuegrid.common.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * 도메인 이벤트 공통 포맷 (Domain Event)
 *
 * <p>모든 서비스가 같은 모양으로 발행하고 소비한다.</p>
 * <pre>
 *   {
 *     "eventType": "DispatchAssignmentCreated",
 *     "timestamp": "2026-01-22T10:15:30Z",
 *     "data": { ... 이벤트별 필드, 식별자는 모두 문자열 ... }
 *   }
 * </pre>
 *
 * <p>필드명은 {@code @JsonProperty}로 고정한다. 클래스/필드 리네이밍이 와이어 포맷을 바꾸지 않도록.</p>
 *
 * @param <T> data 페이로드 타입 (IncidentEventData, DispatchEventData, EmailRequestedData)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DomainEvent<T>(
        @JsonProperty("eventType") String eventType,   // 이벤트 타입 태그 (EventTypes)
        @JsonProperty("timestamp") Instant timestamp,  // 발행 시각 (ISO-8601, UTC)
        @JsonProperty("data") T data                   // 이벤트별 페이로드
) {
    /** 현재 시각으로 타임스탬프를 채우는 편의 팩토리 */
    public static <T> DomainEvent<T> of(String eventType, T data) {
        return new DomainEvent<>(eventType, Instant.now(), data);
    }
}
