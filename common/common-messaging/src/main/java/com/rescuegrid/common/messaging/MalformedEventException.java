package com.rescuegrid.common.messaging;

/**
 * 역직렬화/검증에 실패한 메시지.
 *
 * <p>재시도해도 결과가 같으므로 소비자 루프는 이 예외를 받으면 메시지를 삭제하고 넘어간다.</p>
 */
public class MalformedEventException extends RuntimeException {

    public MalformedEventException(String message) {
        super(message);
    }

    public MalformedEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
