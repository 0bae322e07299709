package com.rescuegrid.notification.event;

import com.rescuegrid.common.event.DomainEvent;
import com.rescuegrid.common.event.EmailRequestedData;
import com.rescuegrid.common.messaging.ConsumerContext;
import com.rescuegrid.common.messaging.EventValidation;
import com.rescuegrid.notification.service.EmailSender;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * NotificationEmailRequested → 수신자별 이메일 발송.
 *
 * <p>빈 수신자는 건너뛴다. 발송 중 예외가 나면 메시지 전체가 재전달되므로
 * 앞서 성공한 수신자에게 같은 메일이 다시 갈 수 있다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmailRequestHandler {

    private final EmailSender emailSender;

    public void onEmailRequested(DomainEvent<EmailRequestedData> event, ConsumerContext context) {
        EmailRequestedData data = event.data();
        List<String> recipients = data.recipients() != null ? data.recipients() : List.of();
        log.info("Processing email request for {} recipient(s) [batch={}]", recipients.size(), context.batchId());

        String subject = data.subject() != null ? data.subject() : "";
        String body = data.body() != null ? data.body() : "";
        int sent = 0;
        for (String to : recipients) {
            if (!EventValidation.hasText(to)) {
                continue;
            }
            emailSender.send(to.trim(), subject, body);
            sent++;
        }
        log.info("Email request handled: sent={}", sent);
    }
}
