package com.rescuegrid.notification.config;

import com.rescuegrid.common.event.DispatchEventData;
import com.rescuegrid.common.event.EmailRequestedData;
import com.rescuegrid.common.event.EventTypes;
import com.rescuegrid.common.event.IncidentEventData;
import com.rescuegrid.common.event.Topics;
import com.rescuegrid.common.messaging.EventConsumerLoop;
import com.rescuegrid.common.messaging.EventConsumerLoopFactory;
import com.rescuegrid.common.messaging.EventSubscription;
import com.rescuegrid.notification.event.DispatchNotificationHandler;
import com.rescuegrid.notification.event.EmailRequestHandler;
import com.rescuegrid.notification.event.IncidentNotificationHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

/**
 * notification-service 소비자 루프 구성.
 *
 * <pre>
 *   incident-created-topic   ──▶ notification-incident-created-queue ──▶ IncidentNotificationHandler.onIncidentCreated
 *   incident-updated-topic   ──▶ notification-incident-updated-queue ──▶ IncidentNotificationHandler.onIncidentUpdated
 *   dispatch-events-topic    ──▶ notification-dispatch-queue         ──▶ DispatchNotificationHandler.onDispatchEvent
 *   notification-email-topic ──▶ notification-email-queue            ──▶ EmailRequestHandler.onEmailRequested
 * </pre>
 */
@Configuration
public class NotificationConsumerConfig {

    @Bean
    public EventConsumerLoop<IncidentEventData> incidentCreatedNotificationConsumer(
            EventConsumerLoopFactory factory,
            IncidentNotificationHandler handler,
            @Value("${rescuegrid.topics.incident-created:" + Topics.INCIDENT_CREATED + "}") String topic,
            @Value("${rescuegrid.queues.incident-created:notification-incident-created-queue}") String queue) {
        return factory.create(new EventSubscription<>("notification-incident-created", topic, queue,
                IncidentEventData.class, Set.of(EventTypes.INCIDENT_CREATED), handler::onIncidentCreated));
    }

    @Bean
    public EventConsumerLoop<IncidentEventData> incidentUpdatedNotificationConsumer(
            EventConsumerLoopFactory factory,
            IncidentNotificationHandler handler,
            @Value("${rescuegrid.topics.incident-updated:" + Topics.INCIDENT_UPDATED + "}") String topic,
            @Value("${rescuegrid.queues.incident-updated:notification-incident-updated-queue}") String queue) {
        return factory.create(new EventSubscription<>("notification-incident-updated", topic, queue,
                IncidentEventData.class, Set.of(EventTypes.INCIDENT_UPDATED), handler::onIncidentUpdated));
    }

    @Bean
    public EventConsumerLoop<DispatchEventData> dispatchNotificationConsumer(
            EventConsumerLoopFactory factory,
            DispatchNotificationHandler handler,
            @Value("${rescuegrid.topics.dispatch-events:" + Topics.DISPATCH_EVENTS + "}") String topic,
            @Value("${rescuegrid.queues.dispatch-events:notification-dispatch-queue}") String queue) {
        return factory.create(new EventSubscription<>("notification-dispatch", topic, queue,
                DispatchEventData.class, EventTypes.DISPATCH_EVENTS, handler::onDispatchEvent));
    }

    @Bean
    public EventConsumerLoop<EmailRequestedData> emailRequestConsumer(
            EventConsumerLoopFactory factory,
            EmailRequestHandler handler,
            @Value("${rescuegrid.topics.notification-email:" + Topics.NOTIFICATION_EMAIL + "}") String topic,
            @Value("${rescuegrid.queues.notification-email:notification-email-queue}") String queue) {
        return factory.create(new EventSubscription<>("notification-email", topic, queue,
                EmailRequestedData.class, Set.of(EventTypes.NOTIFICATION_EMAIL_REQUESTED), handler::onEmailRequested));
    }
}
