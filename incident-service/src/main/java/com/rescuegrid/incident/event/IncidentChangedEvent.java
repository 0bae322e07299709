package com.rescuegrid.incident.event;

import com.rescuegrid.common.event.IncidentEventData;

import java.time.Instant;

/**
 * IncidentService → {@link IncidentEventPublisher}. 커밋 후 외부 토픽으로 나간다.
 *
 * <p>{@code occurredAt}은 상태 변경 트랜잭션 안에서 잡은 시각이며 발행 이벤트의 timestamp가 된다.
 * 소비자는 이 값으로 같은 사건의 오래된 업데이트를 걸러낸다.</p>
 */
public record IncidentChangedEvent(
        String eventType,       // IncidentCreated | IncidentUpdated
        IncidentEventData data,
        Instant occurredAt
) {
}
