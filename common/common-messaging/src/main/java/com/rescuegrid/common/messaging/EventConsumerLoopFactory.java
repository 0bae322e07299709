package com.rescuegrid.common.messaging;

import lombok.RequiredArgsConstructor;

/**
 * 소비자 루프 팩토리.
 *
 * <pre>
 *   &#64;Bean
 *   public EventConsumerLoop&lt;IncidentEventData&gt; incidentCreatedConsumer(EventConsumerLoopFactory factory, ...) {
 *       return factory.create(new EventSubscription&lt;&gt;("dispatch-incident-created", topic, queue,
 *               IncidentEventData.class, Set.of(EventTypes.INCIDENT_CREATED), handler::onCreated));
 *   }
 * </pre>
 */
@RequiredArgsConstructor
public class EventConsumerLoopFactory {

    private final ChannelClient channelClient;
    private final EventCodec eventCodec;
    private final MessagingProperties properties;

    public <T> EventConsumerLoop<T> create(EventSubscription<T> subscription) {
        return new EventConsumerLoop<>(subscription, channelClient, eventCodec, properties);
    }
}
