package com.rescuegrid.notification.event;

import com.rescuegrid.common.event.DomainEvent;
import com.rescuegrid.common.event.EventTypes;
import com.rescuegrid.common.event.IncidentEventData;
import com.rescuegrid.common.exception.BusinessException;
import com.rescuegrid.common.exception.ErrorCode;
import com.rescuegrid.common.messaging.ConsumerContext;
import com.rescuegrid.common.messaging.MalformedEventException;
import com.rescuegrid.notification.dto.NotificationDraft;
import com.rescuegrid.notification.entity.IncidentCache;
import com.rescuegrid.notification.repository.IncidentCacheRepository;
import com.rescuegrid.notification.service.NotificationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class IncidentNotificationHandlerTest {

    @Mock
    private IncidentCacheRepository incidentCacheRepository;
    @Mock
    private NotificationService notificationService;

    @InjectMocks
    private IncidentNotificationHandler handler;

    private final UUID incidentId = UUID.randomUUID();
    private final UUID reporterId = UUID.randomUUID();
    private final ConsumerContext context =
            new ConsumerContext("notification-incident-created", "queue", "batch-1", Instant.now(), 1);

    @Test
    @DisplayName("IncidentCreated - 캐시 저장 + 신고자에게 접수 알림")
    void onIncidentCreated_WithReporter_NotifiesReporter() {
        // Given
        given(incidentCacheRepository.existsById(incidentId)).willReturn(false);

        // When
        handler.onIncidentCreated(event(EventTypes.INCIDENT_CREATED, created(reporterId.toString())), context);

        // Then
        ArgumentCaptor<IncidentCache> cached = ArgumentCaptor.forClass(IncidentCache.class);
        verify(incidentCacheRepository).save(cached.capture());
        assertThat(cached.getValue().getLastEventAt()).isNotNull();
        NotificationDraft draft = capturedDraft();
        assertThat(draft.title()).isEqualTo("Incident Reported: Apartment fire");
        assertThat(draft.recipientType()).isEqualTo(NotificationDraft.RECIPIENT_USER);
        assertThat(draft.recipientId()).isEqualTo(reporterId.toString());
        assertThat(draft.referenceId()).isEqualTo(incidentId.toString());
        assertThat(draft.dedupKey()).isEqualTo("IncidentCreated:" + incidentId);
        assertThat(draft.metadata()).containsEntry("IncidentId", "INC-20260122-A1B2C3");
    }

    @Test
    @DisplayName("IncidentCreated 재전달 - 캐시는 그대로, 알림은 dedupKey로 걸러진다")
    void onIncidentCreated_Redelivered_CacheUntouched() {
        // Given
        given(incidentCacheRepository.existsById(incidentId)).willReturn(true);

        // When
        handler.onIncidentCreated(event(EventTypes.INCIDENT_CREATED, created(reporterId.toString())), context);

        // Then
        verify(incidentCacheRepository, never()).save(any());
        assertThat(capturedDraft().dedupKey()).isEqualTo("IncidentCreated:" + incidentId);
    }

    @Test
    @DisplayName("신고자가 없으면 캐시만 저장하고 알림 없음")
    void onIncidentCreated_NoReporter_CacheOnly() {
        // Given
        given(incidentCacheRepository.existsById(incidentId)).willReturn(false);

        // When
        handler.onIncidentCreated(event(EventTypes.INCIDENT_CREATED, created(null)), context);

        // Then
        verify(incidentCacheRepository).save(any(IncidentCache.class));
        verifyNoInteractions(notificationService);
    }

    @Test
    @DisplayName("id 형식 오류는 MalformedEventException")
    void onIncidentCreated_InvalidId_Malformed() {
        IncidentEventData data = new IncidentEventData("not-a-uuid", null, "t", null, null, null, null,
                null, null, null, null);

        assertThatThrownBy(() -> handler.onIncidentCreated(event(EventTypes.INCIDENT_CREATED, data), context))
                .isInstanceOf(MalformedEventException.class);
    }

    @Test
    @DisplayName("접수 알림 검증 실패(VALIDATION)는 MalformedEventException으로 바꿔 메시지를 버리게 한다")
    void onIncidentCreated_InvalidNotification_Malformed() {
        // Given
        given(incidentCacheRepository.existsById(incidentId)).willReturn(false);
        given(notificationService.createNotification(any(NotificationDraft.class)))
                .willThrow(new BusinessException(ErrorCode.INVALID_INPUT, "Metadata keys must not be blank"));

        // When & Then
        assertThatThrownBy(() -> handler.onIncidentCreated(
                event(EventTypes.INCIDENT_CREATED, created(reporterId.toString())), context))
                .isInstanceOf(MalformedEventException.class)
                .hasMessageContaining("Metadata keys must not be blank");
    }

    @Test
    @DisplayName("IncidentUpdated - 바뀐 항목으로 전체 대상 알림")
    void onIncidentUpdated_Changed_NotifiesAll() {
        // Given
        given(incidentCacheRepository.findById(incidentId)).willReturn(Optional.of(cache()));
        DomainEvent<IncidentEventData> event = event(EventTypes.INCIDENT_UPDATED, update("IN_PROGRESS", "CRITICAL"));

        // When
        handler.onIncidentUpdated(event, context);

        // Then
        NotificationDraft draft = capturedDraft();
        assertThat(draft.title()).isEqualTo("Incident Updated: Apartment fire");
        assertThat(draft.message()).isEqualTo("The incident INC-20260122-A1B2C3 has been updated: "
                + "status changed to IN_PROGRESS; severity changed to CRITICAL.");
        assertThat(draft.recipientId()).isEqualTo(NotificationDraft.ALL_RECIPIENTS);
        assertThat(draft.dedupKey()).isEqualTo("IncidentUpdated:" + incidentId + ":" + event.timestamp());
    }

    @Test
    @DisplayName("IncidentUpdated - 더 최신 업데이트를 반영한 뒤 도착한 오래된 업데이트는 알림 없음, 캐시 유지")
    void onIncidentUpdated_OlderAfterNewer_Ignored() {
        // Given
        IncidentCache cache = cache();
        given(incidentCacheRepository.findById(incidentId)).willReturn(Optional.of(cache));
        DomainEvent<IncidentEventData> newer = new DomainEvent<>(EventTypes.INCIDENT_UPDATED,
                Instant.parse("2026-01-22T10:05:00Z"), update("IN_PROGRESS", null));
        DomainEvent<IncidentEventData> older = new DomainEvent<>(EventTypes.INCIDENT_UPDATED,
                Instant.parse("2026-01-22T10:00:00Z"), update("ACKNOWLEDGED", null));

        // When
        handler.onIncidentUpdated(newer, context);
        handler.onIncidentUpdated(older, context);

        // Then
        NotificationDraft draft = capturedDraft();
        assertThat(draft.message()).contains("status changed to IN_PROGRESS");
        assertThat(cache.getStatus()).isEqualTo("IN_PROGRESS");
    }

    @Test
    @DisplayName("IncidentUpdated - 캐시와 같은 값뿐이면 알림 없음")
    void onIncidentUpdated_NoChange_NoNotification() {
        // Given
        given(incidentCacheRepository.findById(incidentId)).willReturn(Optional.of(cache()));

        // When
        handler.onIncidentUpdated(event(EventTypes.INCIDENT_UPDATED, update("created", "HIGH")), context);

        // Then
        verifyNoInteractions(notificationService);
    }

    @Test
    @DisplayName("IncidentUpdated - 모르는 사건은 무시")
    void onIncidentUpdated_UnknownIncident_Ignored() {
        // Given
        given(incidentCacheRepository.findById(incidentId)).willReturn(Optional.empty());

        // When
        handler.onIncidentUpdated(event(EventTypes.INCIDENT_UPDATED, update("RESOLVED", null)), context);

        // Then
        verifyNoInteractions(notificationService);
    }

    private NotificationDraft capturedDraft() {
        ArgumentCaptor<NotificationDraft> captor = ArgumentCaptor.forClass(NotificationDraft.class);
        verify(notificationService).createNotification(captor.capture());
        return captor.getValue();
    }

    private IncidentCache cache() {
        return IncidentCache.builder()
                .incidentId(incidentId)
                .incidentCode("INC-20260122-A1B2C3")
                .title("Apartment fire")
                .severity("HIGH")
                .status("CREATED")
                .createdByUserId(reporterId)
                .build();
    }

    private IncidentEventData created(String createdBy) {
        return new IncidentEventData(incidentId.toString(), "INC-20260122-A1B2C3", "Apartment fire",
                "Smoke from 3rd floor", "FIRE", "HIGH", "CREATED", 41.3275, 19.8187,
                "2026-01-22T10:15:30Z", createdBy);
    }

    private IncidentEventData update(String status, String severity) {
        return new IncidentEventData(incidentId.toString(), null, null, null, null, severity, status,
                null, null, null, null);
    }

    private static DomainEvent<IncidentEventData> event(String eventType, IncidentEventData data) {
        return DomainEvent.of(eventType, data);
    }
}
