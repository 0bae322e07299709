package com.rescuegrid.incident.config;

import com.rescuegrid.common.event.DispatchEventData;
import com.rescuegrid.common.event.EventTypes;
import com.rescuegrid.common.event.Topics;
import com.rescuegrid.common.messaging.EventConsumerLoop;
import com.rescuegrid.common.messaging.EventConsumerLoopFactory;
import com.rescuegrid.common.messaging.EventSubscription;
import com.rescuegrid.incident.event.DispatchEventHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** dispatch-events-topic ──▶ incident-dispatch-queue ──▶ DispatchEventHandler */
@Configuration
public class IncidentConsumerConfig {

    @Bean
    public EventConsumerLoop<DispatchEventData> dispatchEventConsumer(
            EventConsumerLoopFactory factory,
            DispatchEventHandler handler,
            @Value("${rescuegrid.topics.dispatch-events:" + Topics.DISPATCH_EVENTS + "}") String topic,
            @Value("${rescuegrid.queues.dispatch-events:incident-dispatch-queue}") String queue) {
        return factory.create(new EventSubscription<>("incident-dispatch", topic, queue,
                DispatchEventData.class, EventTypes.DISPATCH_EVENTS, handler::onDispatchEvent));
    }
}
