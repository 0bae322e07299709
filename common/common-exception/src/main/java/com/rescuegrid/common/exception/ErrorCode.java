package com.rescuegrid.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 에러 코드 열거형 (Error Code Enum)
 *
 * <p>세 서비스(incident, dispatch, notification)가 공유하는 에러 코드 정의.
 * 각 코드는 {@link ErrorType} 범주와 기본 메시지를 가진다.</p>
 *
 * <h3>에러 코드 분류</h3>
 * <ul>
 *   <li><b>Common</b>: 입력값 오류, 저장소 오류, 내부 오류</li>
 *   <li><b>Dispatch</b>: 유닛/출동 지령/배정 라이프사이클 오류</li>
 *   <li><b>Incident / Notification</b>: 각 서비스 고유 오류</li>
 * </ul>
 *
 * <p>HTTP 상태 코드 매핑은 명령 인터페이스 계층의 몫이므로 여기서는 범주만 보관한다.</p>
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ── Common (공통 에러) ──
    INVALID_INPUT(ErrorType.VALIDATION, "Invalid input value"),
    DATABASE_ERROR(ErrorType.DATABASE, "Database operation failed"),
    INTERNAL_SERVER_ERROR(ErrorType.INTERNAL, "Unexpected internal error"),

    // ── Dispatch: Unit ──
    UNIT_NOT_FOUND(ErrorType.NOT_FOUND, "Unit not found"),
    DUPLICATE_UNIT_CODE(ErrorType.DUPLICATE, "Unit code already exists"),
    // 유닛 상태가 AVAILABLE이 아님 (UNAVAILABLE 등)
    UNIT_UNAVAILABLE(ErrorType.INVALID_STATE, "Unit is not available"),
    // ★ 다른 출동 지령에 활성 배정이 이미 존재
    UNIT_BUSY(ErrorType.UNIT_BUSY, "Unit already has an active assignment"),

    // ── Dispatch: Order / Assignment ──
    DISPATCH_ORDER_NOT_FOUND(ErrorType.NOT_FOUND, "Dispatch order not found"),
    DUPLICATE_DISPATCH_ORDER(ErrorType.DUPLICATE, "Dispatch order already exists for this incident"),
    DISPATCH_ORDER_NOT_ACTIVE(ErrorType.INVALID_STATE, "Dispatch order is completed or cancelled"),
    ASSIGNMENT_NOT_FOUND(ErrorType.NOT_FOUND, "Dispatch assignment not found"),
    DUPLICATE_ASSIGNMENT(ErrorType.DUPLICATE, "Unit is already assigned to this dispatch order"),
    INVALID_ASSIGNMENT_TRANSITION(ErrorType.INVALID_TRANSITION, "Invalid assignment status transition"),

    // ── Incident ──
    INCIDENT_NOT_FOUND(ErrorType.NOT_FOUND, "Incident not found"),

    // ── Notification ──
    NOTIFICATION_NOT_FOUND(ErrorType.NOT_FOUND, "Notification not found");

    private final ErrorType type;      // 에러 범주
    private final String message;      // 기본 에러 메시지
}
