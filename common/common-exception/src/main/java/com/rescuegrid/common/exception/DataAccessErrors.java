package com.rescuegrid.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

/**
 * 저수준 예외 → BusinessException 변환기.
 *
 * <p>라이프사이클 엔진은 BusinessException만 밖으로 던진다.
 * 이미 분류된 예외는 그대로 통과시키고, Spring의 {@link DataAccessException} 계층은
 * {@link ErrorCode#DATABASE_ERROR}로, 나머지는 {@link ErrorCode#INTERNAL_SERVER_ERROR}로 감싼다.</p>
 */
@Slf4j
public final class DataAccessErrors {

    private DataAccessErrors() {
    }

    public static BusinessException translate(Throwable e) {
        if (e instanceof BusinessException businessException) {
            return businessException;
        }
        if (e instanceof DataAccessException) {
            log.error("Data access failure: {}", e.getMessage(), e);
            return new BusinessException(ErrorCode.DATABASE_ERROR,
                    ErrorCode.DATABASE_ERROR.getMessage() + ": " + rootMessage(e), e);
        }
        log.error("Unclassified failure: {}", e.getMessage(), e);
        return new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR,
                ErrorCode.INTERNAL_SERVER_ERROR.getMessage(), e);
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
