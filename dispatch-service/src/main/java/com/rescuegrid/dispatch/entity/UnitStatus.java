package com.rescuegrid.dispatch.entity;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 유닛 상태.
 *
 * <p>AVAILABLE/UNAVAILABLE 외의 값은 활성 배정의 상태에서 파생된다 ({@link AssignmentStatus#toUnitStatus()}).</p>
 */
@Getter
@RequiredArgsConstructor
public enum UnitStatus {
    AVAILABLE(1),
    ASSIGNED(2),
    EN_ROUTE(3),
    ON_SITE(4),
    UNAVAILABLE(5);

    private final int code;
}
