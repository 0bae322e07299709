package com.rescuegrid.common.messaging;

import java.time.Instant;

/**
 * 수신 배치 단위 컨텍스트.
 *
 * <p>receive 1회로 받은 메시지 묶음마다 한 번 생성되어 같은 배치의 모든 핸들러 호출에 전달된다.
 * 핸들러는 전역 상태 대신 이 값으로 로그 상관관계를 잡는다.</p>
 *
 * @param consumerName 구독 이름 (dispatch-incident-created 등)
 * @param queueRef     수신한 큐 참조
 * @param batchId      배치 식별자
 * @param receivedAt   배치 수신 시각
 * @param batchSize    배치 메시지 수
 */
public record ConsumerContext(
        String consumerName,
        String queueRef,
        String batchId,
        Instant receivedAt,
        int batchSize
) {
}
