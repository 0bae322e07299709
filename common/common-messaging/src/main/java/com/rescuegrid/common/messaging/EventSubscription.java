package com.rescuegrid.common.messaging;

import java.util.Set;

/**
 * 소비자 루프 1개의 정의: 어느 토픽을 어느 큐로 받아 어떤 효과를 적용하는가.
 *
 * @param name          로그/스레드 이름
 * @param topicName     구독할 토픽
 * @param queueName     이 서비스 소유의 큐
 * @param payloadType   {@code DomainEvent.data} 타입
 * @param acceptedTypes 허용 eventType 집합 (그 외는 malformed)
 * @param handler       이벤트 효과
 */
public record EventSubscription<T>(
        String name,
        String topicName,
        String queueName,
        Class<T> payloadType,
        Set<String> acceptedTypes,
        EventHandler<T> handler
) {
}
