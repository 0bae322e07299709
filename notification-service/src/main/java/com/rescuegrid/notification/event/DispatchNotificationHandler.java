package com.rescuegrid.notification.event;

import com.rescuegrid.common.event.DispatchEventData;
import com.rescuegrid.common.event.DomainEvent;
import com.rescuegrid.common.event.EventTypes;
import com.rescuegrid.common.exception.BusinessException;
import com.rescuegrid.common.exception.ErrorType;
import com.rescuegrid.common.messaging.ConsumerContext;
import com.rescuegrid.common.messaging.EventValidation;
import com.rescuegrid.common.messaging.MalformedEventException;
import com.rescuegrid.notification.dto.NotificationDraft;
import com.rescuegrid.notification.entity.IncidentCache;
import com.rescuegrid.notification.repository.IncidentCacheRepository;
import com.rescuegrid.notification.service.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 출동 이벤트 → 신고자 알림.
 *
 * <table>
 *   <tr><th>eventType</th><th>조건</th><th>알림</th></tr>
 *   <tr><td>DispatchOrderCreated</td><td>-</td><td>Dispatch Order Created</td></tr>
 *   <tr><td>DispatchAssignmentCreated</td><td>assignmentStatus = "1"</td><td>Unit Assigned</td></tr>
 *   <tr><td>DispatchAssignmentCompleted</td><td>assignmentStatus = "4"</td><td>Unit Completed</td></tr>
 *   <tr><td>DispatchOrderCompleted</td><td colspan="2">알림 없음 (마지막 배정 완료 알림과 중복)</td></tr>
 * </table>
 *
 * <p>dedupKey = eventType:referenceId (지령 또는 배정 UUID).</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DispatchNotificationHandler {

    static final String CATEGORY = "Dispatch";

    private final IncidentCacheRepository incidentCacheRepository;
    private final NotificationService notificationService;

    @Transactional
    public void onDispatchEvent(DomainEvent<DispatchEventData> event, ConsumerContext context) {
        DispatchEventData data = event.data();
        String eventType = event.eventType();
        UUID incidentId = EventValidation.requireUuid(data.incidentId(), "incidentId");

        if (!EventValidation.hasText(data.createdByUserId())) {
            log.info("{} for incident {} has no recipient, skipping", eventType, incidentId);
            return;
        }
        UUID recipientId = EventValidation.requireUuid(data.createdByUserId(), "createdByUserId");

        if (EventTypes.DISPATCH_ORDER_COMPLETED.equals(eventType)) {
            log.info("Skipping DispatchOrderCompleted notification for incident {} to avoid duplicates", incidentId);
            return;
        }
        if (EventTypes.DISPATCH_ASSIGNMENT_CREATED.equals(eventType) && !"1".equals(data.assignmentStatus())) {
            log.info("Skipping DispatchAssignmentCreated because status != 1 (status={})", data.assignmentStatus());
            return;
        }
        if (EventTypes.DISPATCH_ASSIGNMENT_COMPLETED.equals(eventType) && !"4".equals(data.assignmentStatus())) {
            log.info("Skipping DispatchAssignmentCompleted because status != 4 (status={})", data.assignmentStatus());
            return;
        }

        Optional<IncidentCache> cache = incidentCacheRepository.findById(incidentId);
        String incident = cache.map(IncidentCache::displayCode).orElse(incidentId.toString());
        String severity = cache.map(IncidentCache::getSeverity).orElse(null);
        Template template = templateFor(eventType, data, incident);

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("IncidentId", incidentId.toString());
        if (EventValidation.hasText(data.dispatchOrderId())) {
            metadata.put("DispatchOrderId", data.dispatchOrderId());
        }
        if (EventValidation.hasText(data.dispatchAssignmentId())) {
            metadata.put("DispatchAssignmentId", data.dispatchAssignmentId());
        }
        metadata.put("EventType", eventType);

        createNotification(new NotificationDraft(
                template.title(),
                template.message(),
                CATEGORY,
                template.type(),
                severity,
                NotificationDraft.RECIPIENT_USER,
                recipientId.toString(),
                template.referenceType(),
                template.referenceId().toString(),
                metadata,
                eventType + ":" + template.referenceId()));

        log.info("Processed {}: incident={}, order={}, assignment={}",
                eventType, incidentId, data.dispatchOrderId(), data.dispatchAssignmentId());
    }

    /** 알림 검증 실패(VALIDATION)는 재전달해도 같으므로 메시지를 버리도록 MalformedEventException으로 바꾼다 */
    private void createNotification(NotificationDraft draft) {
        try {
            notificationService.createNotification(draft);
        } catch (BusinessException e) {
            if (e.getErrorType() != ErrorType.VALIDATION) {
                throw e;
            }
            throw new MalformedEventException("Event produced an invalid notification: " + e.getMessage(), e);
        }
    }

    private static Template templateFor(String eventType, DispatchEventData data, String incident) {
        return switch (eventType) {
            case EventTypes.DISPATCH_ORDER_CREATED -> new Template(
                    "Dispatch Order Created",
                    "A dispatch order has been created for incident " + incident
                            + ". Response units will be assigned shortly.",
                    "OrderCreated",
                    "DispatchOrder",
                    EventValidation.requireUuid(data.dispatchOrderId(), "dispatchOrderId"));
            case EventTypes.DISPATCH_ASSIGNMENT_CREATED -> new Template(
                    "Unit Assigned",
                    "A response unit has been assigned to incident " + incident + ".",
                    "UnitAssigned",
                    "DispatchAssignment",
                    EventValidation.requireUuid(data.dispatchAssignmentId(), "dispatchAssignmentId"));
            case EventTypes.DISPATCH_ASSIGNMENT_COMPLETED -> new Template(
                    "Unit Completed",
                    "A response unit has completed its assignment for incident " + incident + ".",
                    "UnitCompleted",
                    "DispatchAssignment",
                    EventValidation.requireUuid(data.dispatchAssignmentId(), "dispatchAssignmentId"));
            default -> throw new IllegalArgumentException("Unsupported dispatch event: " + eventType);
        };
    }

    private record Template(String title, String message, String type, String referenceType, UUID referenceId) {
    }
}
