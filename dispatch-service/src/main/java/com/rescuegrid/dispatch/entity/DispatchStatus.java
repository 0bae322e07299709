package com.rescuegrid.dispatch.entity;

/**
 * 출동 지령 상태 - 앞으로만 진행한다.
 *
 * <pre>
 * CREATED → IN_PROGRESS → COMPLETED
 *    └──────────┴────────→ CANCELLED
 * </pre>
 */
public enum DispatchStatus {
    CREATED,      // 지령 생성, 배정 없음
    IN_PROGRESS,  // 첫 배정 이후
    COMPLETED,    // 모든 배정이 종료 상태
    CANCELLED;    // 지령 취소

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
