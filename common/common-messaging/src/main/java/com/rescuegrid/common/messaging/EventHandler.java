package com.rescuegrid.common.messaging;

import com.rescuegrid.common.event.DomainEvent;

/**
 * 이벤트별 로컬 효과 (projection 갱신, 라이프사이클 호출, 알림 생성).
 *
 * <p>{@link MalformedEventException}을 던지면 메시지는 폐기된다 (식별자 형식 오류 등).
 * 그 밖의 예외는 메시지를 큐에 남겨 재전달시킨다.
 * 같은 이벤트가 여러 번 와도 최종 상태가 같아야 한다 (idempotent).</p>
 *
 * @param <T> 페이로드 타입
 */
@FunctionalInterface
public interface EventHandler<T> {

    void handle(DomainEvent<T> event, ConsumerContext context) throws Exception;
}
