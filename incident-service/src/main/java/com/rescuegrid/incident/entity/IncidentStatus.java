package com.rescuegrid.incident.entity;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 사건 상태.
 *
 * <pre>
 * CREATED → ACKNOWLEDGED → IN_PROGRESS → RESOLVED → CLOSED
 *           (지령 생성)      (첫 배정)      (지령 완료)
 * </pre>
 *
 * <p>출동 이벤트에 의한 자동 전이는 {@link #isAfter}로 앞으로만 진행한다.
 * 이벤트 순서가 뒤바뀌어 도착해도 상태가 되돌아가지 않는다.</p>
 */
@Getter
@RequiredArgsConstructor
public enum IncidentStatus {
    CREATED(0),
    ACKNOWLEDGED(1),
    IN_PROGRESS(2),
    RESOLVED(3),
    CLOSED(4);

    private final int rank;

    public boolean isAfter(IncidentStatus other) {
        return this.rank > other.rank;
    }
}
