package com.rescuegrid.dispatch.event;

import com.rescuegrid.common.event.Topics;
import com.rescuegrid.common.messaging.EventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 출동 이벤트 발행 리스너.
 *
 * <h3>★ 커밋 후 fire-and-forget</h3>
 * <pre>
 *   DispatchService (@Transactional)
 *     └─ publishEvent(DispatchLifecycleEvent)   ← 트랜잭션 안에서는 등록만
 *   COMMIT
 *     └─ on() @TransactionalEventListener(AFTER_COMMIT)
 *          └─ @Async("eventPublishExecutor") → EventPublisher.publish()  (실패 시 로그만)
 * </pre>
 * <p>롤백되면 이벤트는 나가지 않는다. 발행이 실패해도 이미 커밋된 상태 변경은 그대로다.</p>
 */
@Slf4j
@Component
public class DispatchEventPublisher {

    private final EventPublisher eventPublisher;
    private final String dispatchTopic;

    public DispatchEventPublisher(EventPublisher eventPublisher,
                                  @Value("${rescuegrid.topics.dispatch-events:" + Topics.DISPATCH_EVENTS + "}")
                                  String dispatchTopic) {
        this.eventPublisher = eventPublisher;
        this.dispatchTopic = dispatchTopic;
    }

    @Async("eventPublishExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void on(DispatchLifecycleEvent event) {
        log.debug("Publishing {} for order {}", event.eventType(), event.data().dispatchOrderId());
        eventPublisher.publish(dispatchTopic, event.eventType(), event.data());
    }
}
