package com.rescuegrid.incident.event;

import com.rescuegrid.common.event.EventTypes;
import com.rescuegrid.common.event.Topics;
import com.rescuegrid.common.messaging.EventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 사건 이벤트 발행 리스너.
 *
 * <p>IncidentCreated는 incident-created-topic, IncidentUpdated는 incident-updated-topic으로 나간다.
 * 커밋 후 비동기, 1회 시도, 실패 시 로그만 남긴다.</p>
 */
@Slf4j
@Component
public class IncidentEventPublisher {

    private final EventPublisher eventPublisher;
    private final String createdTopic;
    private final String updatedTopic;

    public IncidentEventPublisher(EventPublisher eventPublisher,
                                  @Value("${rescuegrid.topics.incident-created:" + Topics.INCIDENT_CREATED + "}")
                                  String createdTopic,
                                  @Value("${rescuegrid.topics.incident-updated:" + Topics.INCIDENT_UPDATED + "}")
                                  String updatedTopic) {
        this.eventPublisher = eventPublisher;
        this.createdTopic = createdTopic;
        this.updatedTopic = updatedTopic;
    }

    @Async("eventPublishExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void on(IncidentChangedEvent event) {
        String topic = EventTypes.INCIDENT_CREATED.equals(event.eventType()) ? createdTopic : updatedTopic;
        log.debug("Publishing {} for incident {}", event.eventType(), event.data().id());
        eventPublisher.publish(topic, event.eventType(), event.data(), event.occurredAt());
    }
}
