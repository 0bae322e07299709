package com.rescuegrid.dispatch.config;

import com.rescuegrid.common.event.EventTypes;
import com.rescuegrid.common.event.IncidentEventData;
import com.rescuegrid.common.event.Topics;
import com.rescuegrid.common.messaging.EventConsumerLoop;
import com.rescuegrid.common.messaging.EventConsumerLoopFactory;
import com.rescuegrid.common.messaging.EventSubscription;
import com.rescuegrid.dispatch.event.IncidentEventHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

/**
 * dispatch-service 소비자 루프 구성.
 *
 * <pre>
 *   incident-created-topic ──▶ dispatch-incident-created-queue ──▶ IncidentEventHandler.onIncidentCreated
 *   incident-updated-topic ──▶ dispatch-incident-updated-queue ──▶ IncidentEventHandler.onIncidentUpdated
 * </pre>
 */
@Configuration
public class DispatchConsumerConfig {

    @Bean
    public EventConsumerLoop<IncidentEventData> incidentCreatedConsumer(
            EventConsumerLoopFactory factory,
            IncidentEventHandler handler,
            @Value("${rescuegrid.topics.incident-created:" + Topics.INCIDENT_CREATED + "}") String topic,
            @Value("${rescuegrid.queues.incident-created:dispatch-incident-created-queue}") String queue) {
        return factory.create(new EventSubscription<>("dispatch-incident-created", topic, queue,
                IncidentEventData.class, Set.of(EventTypes.INCIDENT_CREATED), handler::onIncidentCreated));
    }

    @Bean
    public EventConsumerLoop<IncidentEventData> incidentUpdatedConsumer(
            EventConsumerLoopFactory factory,
            IncidentEventHandler handler,
            @Value("${rescuegrid.topics.incident-updated:" + Topics.INCIDENT_UPDATED + "}") String topic,
            @Value("${rescuegrid.queues.incident-updated:dispatch-incident-updated-queue}") String queue) {
        return factory.create(new EventSubscription<>("dispatch-incident-updated", topic, queue,
                IncidentEventData.class, Set.of(EventTypes.INCIDENT_UPDATED), handler::onIncidentUpdated));
    }
}
