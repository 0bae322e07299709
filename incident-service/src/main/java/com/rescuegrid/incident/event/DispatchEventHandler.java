package com.rescuegrid.incident.event;

import com.rescuegrid.common.event.DispatchEventData;
import com.rescuegrid.common.event.DomainEvent;
import com.rescuegrid.common.event.EventTypes;
import com.rescuegrid.common.exception.BusinessException;
import com.rescuegrid.common.exception.ErrorCode;
import com.rescuegrid.common.messaging.ConsumerContext;
import com.rescuegrid.common.messaging.EventValidation;
import com.rescuegrid.incident.entity.IncidentStatus;
import com.rescuegrid.incident.service.IncidentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * 출동 이벤트 → 사건 상태 상향.
 *
 * <table>
 *   <tr><th>eventType</th><th>목표 상태</th></tr>
 *   <tr><td>DispatchOrderCreated</td><td>ACKNOWLEDGED</td></tr>
 *   <tr><td>DispatchAssignmentCreated</td><td>IN_PROGRESS</td></tr>
 *   <tr><td>DispatchOrderCompleted</td><td>RESOLVED</td></tr>
 *   <tr><td>DispatchAssignmentCompleted</td><td>(변화 없음)</td></tr>
 * </table>
 *
 * <p>상향은 앞으로만 진행하므로 순서가 뒤바뀌거나 재전달되어도 최종 상태는 같다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DispatchEventHandler {

    private final IncidentService incidentService;

    public void onDispatchEvent(DomainEvent<DispatchEventData> event, ConsumerContext context) {
        UUID incidentId = EventValidation.requireUuid(event.data().incidentId(), "incidentId");

        IncidentStatus target = targetStatus(event.eventType());
        if (target == null) {
            log.debug("{} does not change incident status (incident {})", event.eventType(), incidentId);
            return;
        }

        try {
            incidentService.applyDispatchProgress(incidentId, target);
        } catch (BusinessException e) {
            if (e.getErrorCode() != ErrorCode.INCIDENT_NOT_FOUND) {
                throw e;
            }
            // 재시도해도 생기지 않는다
            log.warn("{} references unknown incident {}, ignoring", event.eventType(), incidentId);
        }
    }

    static IncidentStatus targetStatus(String eventType) {
        return switch (eventType) {
            case EventTypes.DISPATCH_ORDER_CREATED -> IncidentStatus.ACKNOWLEDGED;
            case EventTypes.DISPATCH_ASSIGNMENT_CREATED -> IncidentStatus.IN_PROGRESS;
            case EventTypes.DISPATCH_ORDER_COMPLETED -> IncidentStatus.RESOLVED;
            default -> null;
        };
    }
}
