package com.rescuegrid.notification.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** 기본 구현: 발송 대신 로그만 남긴다 */
@Slf4j
@Component
public class LoggingEmailSender implements EmailSender {

    @Override
    public void send(String to, String subject, String body) {
        log.info("Email to {}: subject='{}', body={} chars", to, subject, body.length());
    }
}
