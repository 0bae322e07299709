package com.rescuegrid.common.exception;

/**
 * 에러 분류 (Error Taxonomy)
 *
 * <p>ErrorCode를 상위 범주로 묶는다. 명령 인터페이스(HTTP 등 외부 계층)는
 * 이 값만 보고 응답 형식을 결정하면 된다.</p>
 *
 * <ul>
 *   <li>{@link #VALIDATION} - 입력 형식/범위 오류, 재시도해도 결과가 같음</li>
 *   <li>{@link #NOT_FOUND} - 참조한 엔티티가 없음</li>
 *   <li>{@link #DUPLICATE} - 유니크 제약 위반 (유닛 코드, 사건당 1개 출동 지령)</li>
 *   <li>{@link #INVALID_STATE} - 현재 라이프사이클 상태에서 허용되지 않는 작업</li>
 *   <li>{@link #INVALID_TRANSITION} - 배정 상태 전이표에 없는 전이</li>
 *   <li>{@link #UNIT_BUSY} - 유닛이 이미 다른 곳에 활성 배정됨</li>
 *   <li>{@link #DATABASE} - 저장소 계층 실패</li>
 *   <li>{@link #INTERNAL} - 분류되지 않은 오류</li>
 * </ul>
 */
public enum ErrorType {
    VALIDATION,
    NOT_FOUND,
    DUPLICATE,
    INVALID_STATE,
    INVALID_TRANSITION,
    UNIT_BUSY,
    DATABASE,
    INTERNAL
}
