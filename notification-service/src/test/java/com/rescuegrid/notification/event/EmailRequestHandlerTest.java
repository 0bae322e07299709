package com.rescuegrid.notification.event;

import com.rescuegrid.common.event.DomainEvent;
import com.rescuegrid.common.event.EmailRequestedData;
import com.rescuegrid.common.event.EventTypes;
import com.rescuegrid.common.messaging.ConsumerContext;
import com.rescuegrid.notification.service.EmailSender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class EmailRequestHandlerTest {

    @Mock
    private EmailSender emailSender;

    @InjectMocks
    private EmailRequestHandler handler;

    private final ConsumerContext context =
            new ConsumerContext("notification-email", "queue", "batch-1", Instant.now(), 1);

    @Test
    @DisplayName("빈 수신자는 건너뛰고 나머지에게 발송")
    void onEmailRequested_SkipsBlankRecipients() {
        handler.onEmailRequested(event(new EmailRequestedData("Alert", "Body",
                Arrays.asList("a@example.com", " ", null, "b@example.com "))), context);

        verify(emailSender).send("a@example.com", "Alert", "Body");
        verify(emailSender).send("b@example.com", "Alert", "Body");
        verify(emailSender, times(2)).send(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("제목/본문이 없으면 빈 문자열, 수신자 목록이 없으면 아무것도 안 함")
    void onEmailRequested_NullFields() {
        handler.onEmailRequested(event(new EmailRequestedData(null, null, List.of("a@example.com"))), context);
        verify(emailSender).send("a@example.com", "", "");

        handler.onEmailRequested(event(new EmailRequestedData("s", "b", null)), context);
        verify(emailSender, times(1)).send(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("발송 실패는 전파되어 메시지가 재전달된다")
    void onEmailRequested_SenderFailure_Propagates() {
        willThrow(new IllegalStateException("smtp down")).given(emailSender).send(anyString(), anyString(), anyString());

        assertThatThrownBy(() -> handler.onEmailRequested(
                event(new EmailRequestedData("s", "b", List.of("a@example.com"))), context))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("수신자가 모두 비어 있으면 발송하지 않는다")
    void onEmailRequested_AllBlank() {
        handler.onEmailRequested(event(new EmailRequestedData("s", "b", List.of("", "  "))), context);

        verifyNoInteractions(emailSender);
    }

    private static DomainEvent<EmailRequestedData> event(EmailRequestedData data) {
        return DomainEvent.of(EventTypes.NOTIFICATION_EMAIL_REQUESTED, data);
    }
}
