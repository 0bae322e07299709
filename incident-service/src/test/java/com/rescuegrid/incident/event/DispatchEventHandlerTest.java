package com.rescuegrid.incident.event;

import com.rescuegrid.common.event.DispatchEventData;
import com.rescuegrid.common.event.DomainEvent;
import com.rescuegrid.common.event.EventTypes;
import com.rescuegrid.common.exception.BusinessException;
import com.rescuegrid.common.exception.ErrorCode;
import com.rescuegrid.common.messaging.ConsumerContext;
import com.rescuegrid.common.messaging.MalformedEventException;
import com.rescuegrid.incident.entity.IncidentStatus;
import com.rescuegrid.incident.service.IncidentService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class DispatchEventHandlerTest {

    @Mock
    private IncidentService incidentService;

    @InjectMocks
    private DispatchEventHandler handler;

    private final UUID incidentId = UUID.randomUUID();
    private final ConsumerContext context =
            new ConsumerContext("incident-dispatch", "queue", "batch-1", Instant.now(), 1);

    @Test
    @DisplayName("이벤트 타입별 목표 상태")
    void targetStatus_Mapping() {
        assertThat(DispatchEventHandler.targetStatus(EventTypes.DISPATCH_ORDER_CREATED))
                .isEqualTo(IncidentStatus.ACKNOWLEDGED);
        assertThat(DispatchEventHandler.targetStatus(EventTypes.DISPATCH_ASSIGNMENT_CREATED))
                .isEqualTo(IncidentStatus.IN_PROGRESS);
        assertThat(DispatchEventHandler.targetStatus(EventTypes.DISPATCH_ORDER_COMPLETED))
                .isEqualTo(IncidentStatus.RESOLVED);
        assertThat(DispatchEventHandler.targetStatus(EventTypes.DISPATCH_ASSIGNMENT_COMPLETED)).isNull();
    }

    @Test
    @DisplayName("DispatchAssignmentCreated → IN_PROGRESS 상향 요청")
    void onDispatchEvent_AssignmentCreated() throws Exception {
        handler.onDispatchEvent(event(EventTypes.DISPATCH_ASSIGNMENT_CREATED, incidentId.toString()), context);

        verify(incidentService).applyDispatchProgress(incidentId, IncidentStatus.IN_PROGRESS);
    }

    @Test
    @DisplayName("DispatchAssignmentCompleted는 사건 상태를 건드리지 않는다")
    void onDispatchEvent_AssignmentCompleted_NoOp() throws Exception {
        handler.onDispatchEvent(event(EventTypes.DISPATCH_ASSIGNMENT_COMPLETED, incidentId.toString()), context);

        verifyNoInteractions(incidentService);
    }

    @Test
    @DisplayName("incidentId 형식 오류는 MalformedEventException")
    void onDispatchEvent_InvalidIncidentId_Malformed() {
        assertThatThrownBy(() -> handler.onDispatchEvent(event(EventTypes.DISPATCH_ORDER_CREATED, "abc"), context))
                .isInstanceOf(MalformedEventException.class);
        verifyNoInteractions(incidentService);
    }

    @Test
    @DisplayName("없는 사건은 경고 후 ack (재시도해도 소용없음)")
    void onDispatchEvent_UnknownIncident_Swallowed() {
        given(incidentService.applyDispatchProgress(any(), any()))
                .willThrow(new BusinessException(ErrorCode.INCIDENT_NOT_FOUND));

        assertThatCode(() -> handler.onDispatchEvent(
                event(EventTypes.DISPATCH_ORDER_COMPLETED, incidentId.toString()), context))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("저장소 오류는 전파되어 메시지가 재전달된다")
    void onDispatchEvent_DatabaseError_Propagates() {
        given(incidentService.applyDispatchProgress(any(), any()))
                .willThrow(new BusinessException(ErrorCode.DATABASE_ERROR));

        assertThatThrownBy(() -> handler.onDispatchEvent(
                event(EventTypes.DISPATCH_ORDER_CREATED, incidentId.toString()), context))
                .isInstanceOf(BusinessException.class);
    }

    private static DomainEvent<DispatchEventData> event(String eventType, String incidentId) {
        return DomainEvent.of(eventType, DispatchEventData.forOrder(UUID.randomUUID().toString(), incidentId, null));
    }
}
