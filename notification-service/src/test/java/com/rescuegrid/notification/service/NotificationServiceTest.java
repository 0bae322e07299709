package com.rescuegrid.notification.service;

import com.rescuegrid.common.exception.BusinessException;
import com.rescuegrid.common.exception.ErrorCode;
import com.rescuegrid.notification.dto.NotificationDraft;
import com.rescuegrid.notification.entity.Notification;
import com.rescuegrid.notification.repository.NotificationRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock
    private NotificationRepository notificationRepository;

    @InjectMocks
    private NotificationService notificationService;

    @Test
    @DisplayName("알림 생성 - 안 읽음 상태로 저장")
    void createNotification_Success() {
        // Given
        given(notificationRepository.existsByDedupKey("DispatchOrderCreated:o-1")).willReturn(false);

        // When
        Optional<Notification> created = notificationService.createNotification(draft("DispatchOrderCreated:o-1"));

        // Then
        assertThat(created).isPresent();
        assertThat(created.get().isRead()).isFalse();
        assertThat(created.get().getMetadata()).containsEntry("EventType", "DispatchOrderCreated");
        verify(notificationRepository).saveAndFlush(created.get());
    }

    @Test
    @DisplayName("같은 dedupKey가 이미 있으면 저장하지 않는다")
    void createNotification_DuplicateKey_Skipped() {
        // Given
        given(notificationRepository.existsByDedupKey("DispatchOrderCreated:o-1")).willReturn(true);

        // When
        Optional<Notification> created = notificationService.createNotification(draft("DispatchOrderCreated:o-1"));

        // Then
        assertThat(created).isEmpty();
        verify(notificationRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("referenceType과 referenceId는 함께 있거나 함께 없어야 한다")
    void createNotification_HalfReference_InvalidInput() {
        NotificationDraft draft = new NotificationDraft("t", "m", "Incident", "Created", null,
                "User", "u-1", "Incident", null, Map.of(), null);

        assertThatThrownBy(() -> notificationService.createNotification(draft))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_INPUT));
    }

    @Test
    @DisplayName("제목이 비어 있으면 INVALID_INPUT")
    void createNotification_BlankTitle_InvalidInput() {
        NotificationDraft draft = new NotificationDraft(" ", "m", "Incident", "Created", null,
                "User", "u-1", null, null, null, null);

        assertThatThrownBy(() -> notificationService.createNotification(draft))
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_INPUT));
    }

    @Test
    @DisplayName("읽음 처리 - 두 번 호출해도 readAt 유지")
    void markAsRead_Idempotent() {
        // Given
        Notification notification = Notification.builder()
                .title("t").message("m").category("Incident").type("Created")
                .recipientType("User").recipientId("u-1").build();
        given(notificationRepository.findById(notification.getId())).willReturn(Optional.of(notification));

        // When
        notificationService.markAsRead(notification.getId());
        LocalDateTime firstReadAt = notification.getReadAt();
        notificationService.markAsRead(notification.getId());

        // Then
        assertThat(notification.isRead()).isTrue();
        assertThat(notification.getReadAt()).isEqualTo(firstReadAt);
    }

    @Test
    @DisplayName("없는 알림 삭제는 NOTIFICATION_NOT_FOUND")
    void deleteNotification_NotFound() {
        UUID unknown = UUID.randomUUID();
        given(notificationRepository.findById(unknown)).willReturn(Optional.empty());

        assertThatThrownBy(() -> notificationService.deleteNotification(unknown))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.NOTIFICATION_NOT_FOUND));
    }

    private static NotificationDraft draft(String dedupKey) {
        return new NotificationDraft("Dispatch Order Created", "A dispatch order has been created.",
                "Dispatch", "OrderCreated", "HIGH", "User", "u-1", "DispatchOrder", "o-1",
                Map.of("EventType", "DispatchOrderCreated"), dedupKey);
    }
}
