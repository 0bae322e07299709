package com.rescuegrid.common.messaging;

/**
 * 큐에서 수신한 메시지 1건.
 *
 * @param messageId     전송 계층 메시지 ID (로그/재처리 추적용)
 * @param receiptHandle delete(ack)에 사용하는 핸들
 * @param body          봉투(MessageEnvelope) JSON
 * @param receiveCount  이번 수신을 포함한 누적 수신 횟수
 */
public record ReceivedMessage(
        String messageId,
        String receiptHandle,
        String body,
        long receiveCount
) {
}
