package com.rescuegrid.dispatch.event;

import com.rescuegrid.common.event.DomainEvent;
import com.rescuegrid.common.event.EventTypes;
import com.rescuegrid.common.event.IncidentEventData;
import com.rescuegrid.common.messaging.ConsumerContext;
import com.rescuegrid.common.messaging.MalformedEventException;
import com.rescuegrid.dispatch.entity.DispatchOrder;
import com.rescuegrid.dispatch.entity.IncidentProjection;
import com.rescuegrid.dispatch.repository.DispatchOrderRepository;
import com.rescuegrid.dispatch.repository.IncidentProjectionRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class IncidentEventHandlerTest {

    @Mock
    private IncidentProjectionRepository incidentProjectionRepository;
    @Mock
    private DispatchOrderRepository dispatchOrderRepository;

    @InjectMocks
    private IncidentEventHandler handler;

    private final UUID incidentId = UUID.randomUUID();
    private final UUID reporterId = UUID.randomUUID();
    private final ConsumerContext context =
            new ConsumerContext("dispatch-incident-updated", "queue", "batch-1", Instant.now(), 1);

    @Test
    @DisplayName("IncidentCreated - projection이 없으면 저장")
    void onIncidentCreated_Inserts() {
        // Given
        given(incidentProjectionRepository.existsById(incidentId)).willReturn(false);

        // When
        handler.onIncidentCreated(event(EventTypes.INCIDENT_CREATED,
                data("Apartment fire", "FIRE", "HIGH", "CREATED", 41.3275, 19.8187)), context);

        // Then
        ArgumentCaptor<IncidentProjection> captor = ArgumentCaptor.forClass(IncidentProjection.class);
        verify(incidentProjectionRepository).save(captor.capture());
        IncidentProjection saved = captor.getValue();
        assertThat(saved.getId()).isEqualTo(incidentId);
        assertThat(saved.getIncidentCode()).isEqualTo("INC-20260122-A1B2C3");
        assertThat(saved.getStatus()).isEqualTo("CREATED");
        assertThat(saved.getLatitude()).isEqualTo(41.3275);
        assertThat(saved.getCreatedByUserId()).isEqualTo(reporterId);
        assertThat(saved.getLastEventAt()).isNotNull();
    }

    @Test
    @DisplayName("IncidentCreated 재전달 - 이미 있으면 no-op")
    void onIncidentCreated_AlreadyCached_NoOp() {
        // Given
        given(incidentProjectionRepository.existsById(incidentId)).willReturn(true);

        // When
        handler.onIncidentCreated(event(EventTypes.INCIDENT_CREATED,
                data("Apartment fire", "FIRE", "HIGH", "CREATED", null, null)), context);

        // Then
        verify(incidentProjectionRepository, never()).save(any());
    }

    @Test
    @DisplayName("id가 UUID가 아니면 MalformedEventException (메시지 폐기 대상)")
    void onIncidentCreated_InvalidId_Malformed() {
        IncidentEventData bad = new IncidentEventData("not-a-uuid", null, "t", null, null, null, null,
                null, null, null, null);

        assertThatThrownBy(() -> handler.onIncidentCreated(event(EventTypes.INCIDENT_CREATED, bad), context))
                .isInstanceOf(MalformedEventException.class);
    }

    @Test
    @DisplayName("IncidentUpdated가 Created보다 먼저 오면 경고만 남기고 no-op")
    void onIncidentUpdated_UnknownIncident_NoOp() {
        // Given
        given(incidentProjectionRepository.findById(incidentId)).willReturn(Optional.empty());

        // When
        handler.onIncidentUpdated(event(EventTypes.INCIDENT_UPDATED,
                data(null, null, null, "RESOLVED", null, null)), context);

        // Then
        verify(incidentProjectionRepository, never()).save(any());
        verify(dispatchOrderRepository, never()).findByIncidentIdWithLock(any());
    }

    @Test
    @DisplayName("바뀐 필드만 메모로 - 상태(+검토 안내), 위치, 심각도, 제목 순")
    void onIncidentUpdated_ChangedFields_AppendNotes() {
        // Given
        IncidentProjection cached = cached();
        DispatchOrder order = DispatchOrder.builder().incidentId(incidentId).build();
        given(incidentProjectionRepository.findById(incidentId)).willReturn(Optional.of(cached));
        given(dispatchOrderRepository.findByIncidentIdWithLock(incidentId)).willReturn(Optional.of(order));

        // When
        handler.onIncidentUpdated(event(EventTypes.INCIDENT_UPDATED,
                data("Warehouse fire", "FIRE", "CRITICAL", "RESOLVED", 41.5, 19.5)), context);

        // Then
        assertThat(order.getNotes()).containsExactly(
                "Incident status updated to: RESOLVED",
                "Incident has been resolved. Dispatch order may need review.",
                "Incident location updated: Lat 41.5, Long 19.5",
                "Incident severity updated to: CRITICAL",
                "Incident title updated to: Warehouse fire");
        assertThat(cached.getStatus()).isEqualTo("RESOLVED");
        assertThat(cached.getSeverity()).isEqualTo("CRITICAL");
    }

    @Test
    @DisplayName("같은 업데이트 재전달 - 두 번째에는 메모가 생기지 않는다")
    void onIncidentUpdated_Redelivered_NoDuplicateNotes() {
        // Given
        IncidentProjection cached = cached();
        DispatchOrder order = DispatchOrder.builder().incidentId(incidentId).build();
        given(incidentProjectionRepository.findById(incidentId)).willReturn(Optional.of(cached));
        given(dispatchOrderRepository.findByIncidentIdWithLock(incidentId)).willReturn(Optional.of(order));
        DomainEvent<IncidentEventData> update = event(EventTypes.INCIDENT_UPDATED,
                data(null, null, "MEDIUM", null, null, null));

        // When
        handler.onIncidentUpdated(update, context);
        handler.onIncidentUpdated(update, context);

        // Then
        assertThat(order.getNotes()).containsExactly("Incident severity updated to: MEDIUM");
        verify(dispatchOrderRepository, times(1)).findByIncidentIdWithLock(incidentId);
    }

    @Test
    @DisplayName("오래된 업데이트가 나중에 도착하면 무시 - 최신 상태 유지, 메모 추가 없음")
    void onIncidentUpdated_OlderAfterNewer_Ignored() {
        // Given
        IncidentProjection cached = cached();
        DispatchOrder order = DispatchOrder.builder().incidentId(incidentId).build();
        given(incidentProjectionRepository.findById(incidentId)).willReturn(Optional.of(cached));
        given(dispatchOrderRepository.findByIncidentIdWithLock(incidentId)).willReturn(Optional.of(order));

        // When
        handler.onIncidentUpdated(statusUpdateAt("2026-01-22T10:05:00Z", "IN_PROGRESS"), context);
        handler.onIncidentUpdated(statusUpdateAt("2026-01-22T10:00:00Z", "ACKNOWLEDGED"), context);

        // Then
        assertThat(cached.getStatus()).isEqualTo("IN_PROGRESS");
        assertThat(cached.getLastEventAt()).isEqualTo(Instant.parse("2026-01-22T10:05:00Z"));
        assertThat(order.getNotes()).containsExactly("Incident status updated to: IN_PROGRESS");
    }

    @Test
    @DisplayName("업데이트가 순서대로 도착하면 둘 다 반영")
    void onIncidentUpdated_InOrder_BothApplied() {
        // Given
        IncidentProjection cached = cached();
        DispatchOrder order = DispatchOrder.builder().incidentId(incidentId).build();
        given(incidentProjectionRepository.findById(incidentId)).willReturn(Optional.of(cached));
        given(dispatchOrderRepository.findByIncidentIdWithLock(incidentId)).willReturn(Optional.of(order));

        // When
        handler.onIncidentUpdated(statusUpdateAt("2026-01-22T10:00:00Z", "ACKNOWLEDGED"), context);
        handler.onIncidentUpdated(statusUpdateAt("2026-01-22T10:05:00Z", "IN_PROGRESS"), context);

        // Then
        assertThat(cached.getStatus()).isEqualTo("IN_PROGRESS");
        assertThat(order.getNotes()).containsExactly(
                "Incident status updated to: ACKNOWLEDGED",
                "Incident status updated to: IN_PROGRESS");
    }

    @Test
    @DisplayName("대소문자/공백만 다른 값, 빈 값, 0 좌표는 변경이 아니다")
    void onIncidentUpdated_EquivalentOrEmptyValues_NoChange() {
        // Given
        IncidentProjection cached = cached();
        given(incidentProjectionRepository.findById(incidentId)).willReturn(Optional.of(cached));

        // When
        handler.onIncidentUpdated(event(EventTypes.INCIDENT_UPDATED,
                data(" apartment FIRE ", "", "high", "created", 0.0, 0.0)), context);

        // Then
        verify(dispatchOrderRepository, never()).findByIncidentIdWithLock(any());
        assertThat(cached.getTitle()).isEqualTo("Apartment fire");
        assertThat(cached.getLatitude()).isEqualTo(41.3275);
    }

    @Test
    @DisplayName("캐시 값이 null이고 새 값이 오면 변경으로 본다")
    void onIncidentUpdated_NullCachedValue_IsChange() {
        // Given
        IncidentProjection cached = IncidentProjection.builder().id(incidentId).status("CREATED").build();
        DispatchOrder order = DispatchOrder.builder().incidentId(incidentId).build();
        given(incidentProjectionRepository.findById(incidentId)).willReturn(Optional.of(cached));
        given(dispatchOrderRepository.findByIncidentIdWithLock(incidentId)).willReturn(Optional.of(order));

        // When
        handler.onIncidentUpdated(event(EventTypes.INCIDENT_UPDATED,
                data("Gas leak", null, null, null, null, null)), context);

        // Then
        assertThat(order.getNotes()).containsExactly("Incident title updated to: Gas leak");
    }

    @Test
    @DisplayName("종료된 지령에는 메모를 추가하지 않는다 (projection은 갱신)")
    void onIncidentUpdated_TerminalOrder_Skipped() {
        // Given
        IncidentProjection cached = cached();
        DispatchOrder order = DispatchOrder.builder().incidentId(incidentId).notes(List.of("kept")).build();
        order.cancel();
        given(incidentProjectionRepository.findById(incidentId)).willReturn(Optional.of(cached));
        given(dispatchOrderRepository.findByIncidentIdWithLock(incidentId)).willReturn(Optional.of(order));

        // When
        handler.onIncidentUpdated(event(EventTypes.INCIDENT_UPDATED,
                data(null, null, null, "CLOSED", null, null)), context);

        // Then
        assertThat(order.getNotes()).containsExactly("kept");
        assertThat(cached.getStatus()).isEqualTo("CLOSED");
    }

    private IncidentProjection cached() {
        return IncidentProjection.builder()
                .id(incidentId)
                .incidentCode("INC-20260122-A1B2C3")
                .title("Apartment fire")
                .type("FIRE")
                .severity("HIGH")
                .status("CREATED")
                .latitude(41.3275)
                .longitude(19.8187)
                .createdByUserId(reporterId)
                .build();
    }

    private IncidentEventData data(String title, String type, String severity, String status,
                                   Double latitude, Double longitude) {
        return new IncidentEventData(incidentId.toString(), "INC-20260122-A1B2C3", title, null, type,
                severity, status, latitude, longitude, "2026-01-22T10:15:30Z", reporterId.toString());
    }

    private DomainEvent<IncidentEventData> statusUpdateAt(String timestamp, String status) {
        return new DomainEvent<>(EventTypes.INCIDENT_UPDATED, Instant.parse(timestamp),
                data(null, null, null, status, null, null));
    }

    private static DomainEvent<IncidentEventData> event(String eventType, IncidentEventData data) {
        return DomainEvent.of(eventType, data);
    }
}
