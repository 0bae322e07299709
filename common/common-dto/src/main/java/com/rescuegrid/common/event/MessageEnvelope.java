package com.rescuegrid.common.event;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 전송 계층 봉투 (Transport Envelope)
 *
 * <p>토픽 → 큐 fan-out 시 원본 이벤트 JSON은 {@code message} 문자열로 한 번 더 감싸진다.</p>
 * <pre>
 *   { "type": "Notification", "message": "{\"eventType\":...}", "topicArn": "topic:dispatch-events-topic" }
 * </pre>
 *
 * <p>대문자로 시작하는 필드명(Type, Message, TopicArn)도 받아들인다.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageEnvelope(
        @JsonProperty("type") @JsonAlias("Type") String type,
        @JsonProperty("message") @JsonAlias("Message") String message,  // JSON 인코딩된 DomainEvent
        @JsonProperty("topicArn") @JsonAlias("TopicArn") String topicArn
) {
    public static final String NOTIFICATION_TYPE = "Notification";

    public static MessageEnvelope wrap(String topicRef, String message) {
        return new MessageEnvelope(NOTIFICATION_TYPE, message, topicRef);
    }
}
