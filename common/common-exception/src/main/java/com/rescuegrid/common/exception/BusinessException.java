package com.rescuegrid.common.exception;

import lombok.Getter;

/**
 * 비즈니스 예외 (Business Exception)
 *
 * <p>도메인 규칙 위반 시 발생하는 unchecked 예외.
 * ErrorCode와 결합하여 에러 범주({@link ErrorType})와 메시지를 함께 전달.</p>
 *
 * <h3>사용 예시</h3>
 * <pre>
 *   // 유닛을 찾을 수 없는 경우
 *   throw new BusinessException(ErrorCode.UNIT_NOT_FOUND);
 *
 *   // 상세 메시지가 필요한 경우
 *   throw new BusinessException(ErrorCode.INVALID_ASSIGNMENT_TRANSITION, "ASSIGNED -> ON_SITE");
 * </pre>
 */
@Getter
public class BusinessException extends RuntimeException {

    /** 에러 코드 (범주 + 메시지) */
    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    /** 원인 예외를 보존해야 하는 경우 (저장소 오류 변환 등) */
    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorType getErrorType() {
        return errorCode.getType();
    }
}
