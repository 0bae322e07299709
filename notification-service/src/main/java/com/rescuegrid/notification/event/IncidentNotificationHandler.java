package com.rescuegrid.notification.event;

import com.rescuegrid.common.event.DomainEvent;
import com.rescuegrid.common.event.EventTypes;
import com.rescuegrid.common.event.IncidentEventData;
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
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 사건 이벤트 → 알림.
 *
 * <h3>IncidentCreated</h3>
 * <p>캐시 행이 없으면 INSERT. 신고자(createdByUserId)가 있으면 신고자에게 접수 알림.
 * dedupKey = IncidentCreated:{id}</p>
 *
 * <h3>IncidentUpdated</h3>
 * <p>캐시 대비 실제로 바뀐 항목(status, severity, title, location)이 있을 때만 전체 대상 알림.
 * 캐시에 없는 사건은 경고 후 무시한다. 이미 반영한 업데이트보다 오래된 이벤트도 무시한다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IncidentNotificationHandler {

    static final String CATEGORY = "Incident";
    static final String REFERENCE_TYPE = "Incident";

    private final IncidentCacheRepository incidentCacheRepository;
    private final NotificationService notificationService;

    @Transactional
    public void onIncidentCreated(DomainEvent<IncidentEventData> event, ConsumerContext context) {
        IncidentEventData data = event.data();
        UUID incidentId = EventValidation.requireUuid(data.id(), "id");
        UUID reporterId = optionalUuid(data.createdByUserId());

        if (!incidentCacheRepository.existsById(incidentId)) {
            incidentCacheRepository.save(IncidentCache.builder()
                    .incidentId(incidentId)
                    .incidentCode(data.incidentId())
                    .title(data.title())
                    .severity(data.severity())
                    .status(data.status())
                    .latitude(data.hasLocation() ? data.latitude() : null)
                    .longitude(data.hasLocation() ? data.longitude() : null)
                    .createdByUserId(reporterId)
                    .lastEventAt(event.timestamp())
                    .build());
        }

        if (reporterId == null) {
            log.info("Incident {} has no reporter, no notification", incidentId);
            return;
        }

        String code = EventValidation.hasText(data.incidentId()) ? data.incidentId().trim() : incidentId.toString();
        String title = EventValidation.hasText(data.title()) ? data.title().trim() : code;

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("IncidentId", code);
        metadata.put("EventType", EventTypes.INCIDENT_CREATED);
        if (data.hasLocation()) {
            metadata.put("Latitude", String.valueOf(data.latitude()));
            metadata.put("Longitude", String.valueOf(data.longitude()));
        }

        createNotification(new NotificationDraft(
                "Incident Reported: " + title,
                "Your incident " + code + " has been received. Status: " + orUnknown(data.status())
                        + ", severity: " + orUnknown(data.severity()) + ".",
                CATEGORY,
                "Created",
                trimmed(data.severity()),
                NotificationDraft.RECIPIENT_USER,
                reporterId.toString(),
                REFERENCE_TYPE,
                incidentId.toString(),
                metadata,
                EventTypes.INCIDENT_CREATED + ":" + incidentId));
    }

    @Transactional
    public void onIncidentUpdated(DomainEvent<IncidentEventData> event, ConsumerContext context) {
        IncidentEventData data = event.data();
        UUID incidentId = EventValidation.requireUuid(data.id(), "id");

        Optional<IncidentCache> cached = incidentCacheRepository.findById(incidentId);
        if (cached.isEmpty()) {
            log.warn("IncidentUpdated for unknown incident {}, ignoring", incidentId);
            return;
        }

        IncidentCache cache = cached.get();
        if (!cache.isNewerThanApplied(event.timestamp())) {
            log.info("Stale IncidentUpdated for incident {} (event {}, applied {}), ignoring",
                    incidentId, event.timestamp(), cache.getLastEventAt());
            return;
        }
        List<String> changes = cache.apply(data, event.timestamp());
        if (changes.isEmpty()) {
            log.info("No relevant changes for incident {}", incidentId);
            return;
        }

        String code = cache.displayCode();
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("IncidentId", code);
        metadata.put("EventType", EventTypes.INCIDENT_UPDATED);

        // 같은 사건의 서로 다른 업데이트는 발행 시각으로 구분한다
        String dedupKey = event.timestamp() != null
                ? EventTypes.INCIDENT_UPDATED + ":" + incidentId + ":" + event.timestamp()
                : null;

        createNotification(new NotificationDraft(
                "Incident Updated: " + (cache.getTitle() != null ? cache.getTitle() : code),
                "The incident " + code + " has been updated: " + String.join("; ", changes) + ".",
                CATEGORY,
                "Update",
                cache.getSeverity(),
                NotificationDraft.RECIPIENT_SYSTEM,
                NotificationDraft.ALL_RECIPIENTS,
                REFERENCE_TYPE,
                incidentId.toString(),
                metadata,
                dedupKey));
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

    private static UUID optionalUuid(String value) {
        if (!EventValidation.hasText(value)) {
            return null;
        }
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring invalid createdByUserId: {}", value);
            return null;
        }
    }

    private static String trimmed(String value) {
        return EventValidation.hasText(value) ? value.trim() : null;
    }

    private static String orUnknown(String value) {
        return EventValidation.hasText(value) ? value.trim() : "UNKNOWN";
    }
}
