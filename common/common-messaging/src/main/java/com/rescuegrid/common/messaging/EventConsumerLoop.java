package com.rescuegrid.common.messaging;

import com.fasterxml.jackson.databind.JavaType;
import com.rescuegrid.common.event.DomainEvent;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * 이벤트 소비자 루프 (Event Consumer Loop)
 *
 * <p>구독({@link EventSubscription}) 1개당 전용 스레드 1개. Spring 컨텍스트 시작/종료에 맞춰
 * {@link SmartLifecycle}로 기동/정지한다.</p>
 *
 * <h3>반복 1회의 처리 흐름</h3>
 * <pre>
 *   receive(최대 N개, long-poll)
 *     └─ 메시지마다
 *          ├─ 봉투/이벤트 파싱 + 검증 실패  → delete (재시도해도 실패하므로 폐기)
 *          ├─ 효과 적용 성공               → delete (ack)
 *          └─ 효과 적용 중 예외            → 삭제하지 않음 → visibility timeout 후 재전달 → 한도 초과 시 DLQ
 * </pre>
 *
 * <h3>초기화</h3>
 * <p>토픽이 아직 없으면 ({@link ChannelNotFoundException}) initRetryDelay 간격으로 무한 재시도한다.
 * 서비스들이 동시에 기동될 때 흔히 생기는 경합이다.</p>
 *
 * <h3>종료</h3>
 * <p>{@link #stop()}은 플래그를 내리고 워커 스레드를 interrupt한다.
 * 루프는 매 receive 전과 메시지 사이마다 플래그를 확인한다.</p>
 *
 * @param <T> 이벤트 페이로드 타입
 */
@Slf4j
public class EventConsumerLoop<T> implements SmartLifecycle {

    enum Outcome {
        ACKNOWLEDGED,
        DISCARDED,
        RETAINED
    }

    private final EventSubscription<T> subscription;
    private final ChannelClient channelClient;
    private final EventCodec eventCodec;
    private final MessagingProperties properties;
    private final JavaType eventJavaType;

    private volatile boolean running;
    private volatile boolean stopping;
    private volatile String queueRef;
    private Thread worker;

    public EventConsumerLoop(EventSubscription<T> subscription, ChannelClient channelClient,
                             EventCodec eventCodec, MessagingProperties properties) {
        this.subscription = subscription;
        this.channelClient = channelClient;
        this.eventCodec = eventCodec;
        this.properties = properties;
        this.eventJavaType = eventCodec.eventTypeOf(subscription.payloadType());
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        stopping = false;
        worker = new Thread(this::run, "consumer-" + subscription.name());
        worker.start();
        log.info("Consumer started: {} ({} -> {})",
                subscription.name(), subscription.topicName(), subscription.queueName());
    }

    @Override
    public void stop() {
        Thread current;
        synchronized (this) {
            if (!running) {
                return;
            }
            stopping = true;
            running = false;
            current = worker;
        }
        current.interrupt();
        try {
            current.join(properties.getConsumer().getShutdownTimeout().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Consumer stopped: {}", subscription.name());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.getConsumer().isEnabled();
    }

    private void run() {
        if (!initialize()) {
            return;
        }
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                pollOnce();
            } catch (RuntimeException e) {
                if (!running) {
                    break;
                }
                log.error("Error receiving from {}: {}", subscription.queueName(), e.getMessage(), e);
                sleep(properties.getConsumer().getErrorBackoff());
            }
        }
    }

    /** 토픽/큐가 준비될 때까지 재시도. 종료 요청 시 false */
    boolean initialize() {
        while (running) {
            if (tryInitialize()) {
                return true;
            }
            sleep(properties.getConsumer().getInitRetryDelay());
        }
        return false;
    }

    /** 초기화 1회 시도 */
    public boolean tryInitialize() {
        try {
            if (properties.isAutoCreateTopics()) {
                channelClient.createTopic(subscription.topicName());
            }
            queueRef = channelClient.resolveQueue(subscription.queueName(), subscription.topicName());
            log.info("Consumer initialized: queue={}, topic={}", subscription.queueName(), subscription.topicName());
            return true;
        } catch (ChannelNotFoundException e) {
            log.warn("Channel for {} not ready ({}). Retrying in {}",
                    subscription.name(), e.getMessage(), properties.getConsumer().getInitRetryDelay());
        } catch (RuntimeException e) {
            log.error("Failed to initialize consumer {}. Retrying in {}",
                    subscription.name(), properties.getConsumer().getInitRetryDelay(), e);
        }
        return false;
    }

    /**
     * receive 1회 + 받은 메시지 처리.
     *
     * @return 이번 배치에서 ack된 메시지 수
     */
    public int pollOnce() {
        if (queueRef == null) {
            throw new IllegalStateException("Consumer not initialized: " + subscription.name());
        }

        MessagingProperties.Consumer settings = properties.getConsumer();
        List<ReceivedMessage> messages = channelClient.receive(queueRef, settings.getMaxMessages(), settings.getWaitTime());
        if (messages.isEmpty()) {
            return 0;
        }

        ConsumerContext context = new ConsumerContext(subscription.name(), queueRef,
                UUID.randomUUID().toString(), Instant.now(), messages.size());

        int acknowledged = 0;
        for (ReceivedMessage message : messages) {
            if (stopping) {
                break;  // 남은 메시지는 visibility timeout 후 재전달된다
            }
            if (process(message, context) == Outcome.ACKNOWLEDGED) {
                acknowledged++;
            }
        }
        return acknowledged;
    }

    Outcome process(ReceivedMessage message, ConsumerContext context) {
        MDC.put("consumer", subscription.name());
        MDC.put("messageId", message.messageId());
        try {
            DomainEvent<T> event;
            try {
                event = eventCodec.decode(message.body(), eventJavaType, subscription.acceptedTypes());
            } catch (MalformedEventException e) {
                log.warn("Discarding malformed message: messageId={}, reason={}", message.messageId(), e.getMessage());
                deleteMessage(message);
                return Outcome.DISCARDED;
            }

            MDC.put("eventType", event.eventType());
            try {
                subscription.handler().handle(event, context);
            } catch (MalformedEventException e) {
                log.warn("Discarding invalid {}: messageId={}, reason={}",
                        event.eventType(), message.messageId(), e.getMessage());
                deleteMessage(message);
                return Outcome.DISCARDED;
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                // 삭제하지 않음: 전송 계층이 재전달/DLQ 처리
                log.error("Failed to process message: messageId={}, receiveCount={}, body={}",
                        message.messageId(), message.receiveCount(), message.body(), e);
                return Outcome.RETAINED;
            }

            deleteMessage(message);
            log.debug("Processed {}: messageId={}", event.eventType(), message.messageId());
            return Outcome.ACKNOWLEDGED;
        } finally {
            MDC.remove("consumer");
            MDC.remove("messageId");
            MDC.remove("eventType");
        }
    }

    private void deleteMessage(ReceivedMessage message) {
        try {
            channelClient.delete(queueRef, message.receiptHandle());
        } catch (RuntimeException e) {
            // 삭제 실패 시 메시지는 재전달된다. 효과는 idempotent하게 다시 적용됨
            log.error("Failed to delete message: messageId={}, queue={}", message.messageId(), queueRef, e);
        }
    }

    private void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }

    public EventSubscription<T> getSubscription() {
        return subscription;
    }
}
