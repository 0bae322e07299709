package com.rescuegrid.common.messaging;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 토픽/큐 전송 계층 포트 (Channel Client)
 *
 * <p>발행자는 토픽에 메시지를 넣고, 각 소비 서비스는 자기 큐를 토픽에 구독시켜 fan-out을 받는다.
 * 구현체는 두 가지다.</p>
 * <ul>
 *   <li>{@link RedisStreamChannelClient} - 토픽 = Redis Stream, 큐 = Consumer Group</li>
 *   <li>{@link InMemoryChannelClient} - 단일 JVM 로컬 실행/테스트용</li>
 * </ul>
 *
 * <h3>수신 의미론 (at-least-once)</h3>
 * <ul>
 *   <li>receive로 받은 메시지는 visibility timeout 동안 다른 수신자에게 보이지 않는다</li>
 *   <li>delete(ack)하지 않으면 timeout 후 재전달되며 receiveCount가 증가한다</li>
 *   <li>receiveCount가 maxReceiveCount에 도달하면 DLQ로 이동한다</li>
 * </ul>
 */
public interface ChannelClient {

    /** 토픽 이름으로 기존 채널 참조를 찾는다 */
    Optional<String> findTopic(String topicName);

    /** 토픽을 생성한다. 이미 있으면 기존 참조를 반환 (idempotent) */
    String createTopic(String topicName);

    /**
     * 토픽에 메시지를 1회 발행한다. 재시도하지 않는다.
     *
     * @param topicRef   {@link #findTopic}/{@link #createTopic}이 돌려준 참조
     * @param message    직렬화된 이벤트 JSON
     * @param attributes 라우팅 메타데이터 (EventType 등)
     * @return 전송 계층이 부여한 메시지 ID
     */
    String publish(String topicRef, String message, Map<String, String> attributes);

    /**
     * 큐를 토픽에 구독시키고 큐 참조를 반환한다.
     *
     * @throws ChannelNotFoundException 토픽이 아직 없을 때 (서비스 간 cold-start 경합)
     */
    String resolveQueue(String queueName, String topicName);

    /** 최대 maxMessages개를 long-poll로 받는다. 메시지가 있으면 즉시 반환 */
    List<ReceivedMessage> receive(String queueRef, int maxMessages, Duration waitTime);

    /** 처리 완료(ack). 삭제된 메시지는 재전달되지 않는다 */
    void delete(String queueRef, String receiptHandle);
}
