package com.rescuegrid.common.messaging;

import com.rescuegrid.common.event.DomainEvent;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Map;

/**
 * 이벤트 발행자 (Best-effort Event Publisher)
 *
 * <h3>발행 흐름</h3>
 * <ol>
 *   <li>토픽 이름으로 기존 채널 조회, 없으면 생성 (create-if-absent)</li>
 *   <li>{@code {eventType, timestamp, data}} 직렬화</li>
 *   <li>{@code EventType} 속성을 붙여 1회 발행</li>
 * </ol>
 *
 * <h3>★ 실패 정책</h3>
 * <p>발행 실패는 로그만 남기고 삼킨다. 호출자의 트랜잭션은 이미 커밋된 뒤이며 롤백되지 않는다.
 * 유실된 이벤트는 같은 최종 상태를 다시 만드는 후속 이벤트나 수동 재동기화로만 회복된다.
 * 서비스별 발행 리스너가 {@code @TransactionalEventListener(AFTER_COMMIT)} + {@code @Async}로 이 클래스를 호출한다.</p>
 *
 * <h3>★ Circuit Breaker</h3>
 * <p>발행 1회를 {@code eventPublisher} Circuit Breaker로 감싼다. 전송 계층 장애가 이어지면 OPEN 상태가 되어
 * Redis 타임아웃을 기다리지 않고 바로 false를 반환한다. 재시도는 하지 않는다.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class EventPublisher {

    public static final String EVENT_TYPE_ATTRIBUTE = "EventType";

    private final ChannelClient channelClient;
    private final EventCodec eventCodec;
    private final CircuitBreaker circuitBreaker;

    /**
     * @return 발행 성공 여부 (실패해도 예외를 던지지 않는다)
     */
    public boolean publish(String topicName, String eventType, Object data) {
        return publish(topicName, eventType, data, Instant.now());
    }

    /**
     * 발행 시각을 호출자가 정한다. 상태 변경 트랜잭션 안에서 잡은 시각을 넘기면
     * 소비자가 같은 집계의 이벤트 순서를 timestamp로 판단할 수 있다.
     */
    public boolean publish(String topicName, String eventType, Object data, Instant timestamp) {
        try {
            String messageId = circuitBreaker.executeSupplier(
                    () -> publishOnce(topicName, new DomainEvent<>(eventType, timestamp, data)));
            log.info("Published {} to {}: messageId={}", eventType, topicName, messageId);
            return true;
        } catch (CallNotPermittedException e) {
            log.error("Skipped {} to {}: circuit breaker '{}' is {}",
                    eventType, topicName, circuitBreaker.getName(), circuitBreaker.getState());
            return false;
        } catch (RuntimeException e) {
            log.error("Failed to publish {} to {}: {}", eventType, topicName, e.getMessage(), e);
            return false;
        }
    }

    private String publishOnce(String topicName, DomainEvent<?> event) {
        String topicRef = channelClient.findTopic(topicName)
                .orElseGet(() -> {
                    log.warn("Topic '{}' not found. Creating it.", topicName);
                    return channelClient.createTopic(topicName);
                });

        String message = eventCodec.encode(event);
        return channelClient.publish(topicRef, message, Map.of(EVENT_TYPE_ATTRIBUTE, event.eventType()));
    }
}
