package com.rescuegrid.notification.service;

/**
 * 이메일 발송 경계. 실제 SMTP 연동은 이 인터페이스의 구현으로 교체한다.
 *
 * <p>예외를 던지면 요청 메시지는 큐에 남아 재전달된다.</p>
 */
public interface EmailSender {

    void send(String to, String subject, String body);
}
