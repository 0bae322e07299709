package com.rescuegrid.common.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rescuegrid.common.event.DomainEvent;
import com.rescuegrid.common.event.MessageEnvelope;
import lombok.RequiredArgsConstructor;

import java.util.Set;

/**
 * 이벤트 직렬화/역직렬화기.
 *
 * <h3>수신 메시지 해석 순서</h3>
 * <ol>
 *   <li>봉투(MessageEnvelope) 파싱 → message 필드 추출</li>
 *   <li>message를 {@code DomainEvent<T>}로 파싱</li>
 *   <li>eventType이 허용 집합에 있는지, data가 있는지 확인</li>
 * </ol>
 * <p>어느 단계든 실패하면 {@link MalformedEventException}. 재시도 대상이 아니다.</p>
 */
@RequiredArgsConstructor
public class EventCodec {

    private final ObjectMapper objectMapper;

    public String encode(DomainEvent<?> event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event: " + event.eventType(), e);
        }
    }

    /** 토픽 → 큐 fan-out 시 전송 계층이 씌우는 봉투 */
    public String envelope(String topicRef, String message) {
        try {
            return objectMapper.writeValueAsString(MessageEnvelope.wrap(topicRef, message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to wrap message for " + topicRef, e);
        }
    }

    public JavaType eventTypeOf(Class<?> payloadType) {
        return objectMapper.getTypeFactory().constructParametricType(DomainEvent.class, payloadType);
    }

    public <T> DomainEvent<T> decode(String body, JavaType eventJavaType, Set<String> acceptedTypes) {
        if (body == null || body.isBlank()) {
            throw new MalformedEventException("Empty message body");
        }

        MessageEnvelope envelope;
        try {
            envelope = objectMapper.readValue(body, MessageEnvelope.class);
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("Unreadable envelope: " + e.getOriginalMessage(), e);
        }
        if (envelope.message() == null || envelope.message().isBlank()) {
            throw new MalformedEventException("Envelope has no message");
        }

        DomainEvent<T> event;
        try {
            event = objectMapper.readValue(envelope.message(), eventJavaType);
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("Unreadable event: " + e.getOriginalMessage(), e);
        }

        if (event == null || event.eventType() == null || event.eventType().isBlank()) {
            throw new MalformedEventException("Event has no eventType");
        }
        if (!acceptedTypes.contains(event.eventType())) {
            throw new MalformedEventException("Unexpected eventType: " + event.eventType());
        }
        if (event.data() == null) {
            throw new MalformedEventException("Event has no data: " + event.eventType());
        }
        return event;
    }
}
