package com.rescuegrid.dispatch.entity;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

/**
 * 배정 상태 머신 (Assignment State Machine)
 *
 * <h3>허용 전이표</h3>
 * <pre>
 *   ASSIGNED  → EN_ROUTE, CANCELLED, REPLACED
 *   EN_ROUTE  → ON_SITE, CANCELLED
 *   ON_SITE   → COMPLETED, CANCELLED
 *   COMPLETED / CANCELLED / REPLACED → (종료 상태, 전이 없음)
 * </pre>
 *
 * <p>{@code code}는 이벤트의 {@code assignmentStatus} 필드에 실리는 숫자 코드
 * (DispatchAssignmentCreated = "1", DispatchAssignmentCompleted = "4").</p>
 */
@Getter
@RequiredArgsConstructor
public enum AssignmentStatus {
    ASSIGNED(1),
    EN_ROUTE(2),
    ON_SITE(3),
    COMPLETED(4),
    CANCELLED(5),
    REPLACED(6);

    private final int code;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == REPLACED;
    }

    public boolean canTransitionTo(AssignmentStatus next) {
        return allowedNext().contains(next);
    }

    public Set<AssignmentStatus> allowedNext() {
        return switch (this) {
            case ASSIGNED -> EnumSet.of(EN_ROUTE, CANCELLED, REPLACED);
            case EN_ROUTE -> EnumSet.of(ON_SITE, CANCELLED);
            case ON_SITE -> EnumSet.of(COMPLETED, CANCELLED);
            case COMPLETED, CANCELLED, REPLACED -> EnumSet.noneOf(AssignmentStatus.class);
        };
    }

    /** 배정 상태 → 유닛 상태. 종료 상태면 유닛은 다시 AVAILABLE */
    public UnitStatus toUnitStatus() {
        return switch (this) {
            case ASSIGNED -> UnitStatus.ASSIGNED;
            case EN_ROUTE -> UnitStatus.EN_ROUTE;
            case ON_SITE -> UnitStatus.ON_SITE;
            case COMPLETED, CANCELLED, REPLACED -> UnitStatus.AVAILABLE;
        };
    }

    /** 이벤트 와이어 코드 ("1" ~ "6") */
    public String wireCode() {
        return String.valueOf(code);
    }
}
