package com.rescuegrid.dispatch.event;

import com.rescuegrid.common.event.DomainEvent;
import com.rescuegrid.common.event.IncidentEventData;
import com.rescuegrid.common.messaging.ConsumerContext;
import com.rescuegrid.common.messaging.EventValidation;
import com.rescuegrid.dispatch.entity.DispatchOrder;
import com.rescuegrid.dispatch.entity.IncidentProjection;
import com.rescuegrid.dispatch.repository.DispatchOrderRepository;
import com.rescuegrid.dispatch.repository.IncidentProjectionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * 사건 이벤트 소비 효과 (dispatch-service 쪽).
 *
 * <h3>IncidentCreated</h3>
 * <p>projection 행이 없을 때만 INSERT. 재전달되면 no-op.</p>
 *
 * <h3>IncidentUpdated</h3>
 * <ol>
 *   <li>projection이 없으면 경고 로그 후 no-op (Created보다 먼저 도착한 경우)</li>
 *   <li>이미 반영한 이벤트보다 timestamp가 늦지 않으면 no-op (오래된 업데이트가 최신 상태를 덮지 않도록)</li>
 *   <li>비어 있지 않은 필드만 덮어쓰고, 실제로 바뀐 필드만 기록</li>
 *   <li>바뀐 필드로 메모 문구를 만들어 활성 출동 지령에 추가. 지령이 없거나 종료 상태면 건너뜀</li>
 * </ol>
 * <p>같은 업데이트가 다시 와도 바뀐 필드가 없으므로 메모가 중복되지 않는다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IncidentEventHandler {

    private final IncidentProjectionRepository incidentProjectionRepository;
    private final DispatchOrderRepository dispatchOrderRepository;

    @Transactional
    public void onIncidentCreated(DomainEvent<IncidentEventData> event, ConsumerContext context) {
        IncidentEventData data = event.data();
        UUID incidentId = EventValidation.requireUuid(data.id(), "id");

        if (incidentProjectionRepository.existsById(incidentId)) {
            log.info("Incident {} already cached, skipping", incidentId);
            return;
        }

        IncidentProjection projection = IncidentProjection.builder()
                .id(incidentId)
                .incidentCode(data.incidentId())
                .title(data.title())
                .type(data.type())
                .severity(data.severity())
                .status(data.status())
                .latitude(data.hasLocation() ? data.latitude() : null)
                .longitude(data.hasLocation() ? data.longitude() : null)
                .reportedAt(parseReportedAt(data.reportedAt()))
                .createdByUserId(optionalUuid(data.createdByUserId()))
                .lastEventAt(event.timestamp())
                .build();
        incidentProjectionRepository.save(projection);

        log.info("Cached incident {} ({}) [batch={}]", incidentId, data.title(), context.batchId());
    }

    @Transactional
    public void onIncidentUpdated(DomainEvent<IncidentEventData> event, ConsumerContext context) {
        IncidentEventData data = event.data();
        UUID incidentId = EventValidation.requireUuid(data.id(), "id");

        Optional<IncidentProjection> cached = incidentProjectionRepository.findById(incidentId);
        if (cached.isEmpty()) {
            log.warn("IncidentUpdated for unknown incident {}, ignoring", incidentId);
            return;
        }

        IncidentProjection projection = cached.get();
        if (!projection.isNewerThanApplied(event.timestamp())) {
            log.info("Stale IncidentUpdated for incident {} (event {}, applied {}), ignoring",
                    incidentId, event.timestamp(), projection.getLastEventAt());
            return;
        }
        List<String> notes = new ArrayList<>();

        if (projection.syncStatus(data.status())) {
            String status = data.status().trim();
            notes.add("Incident status updated to: " + status);
            if (status.equalsIgnoreCase("RESOLVED") || status.equalsIgnoreCase("CLOSED")) {
                notes.add("Incident has been " + status.toLowerCase(Locale.ROOT)
                        + ". Dispatch order may need review.");
            }
        }
        if (projection.syncLocation(data.latitude(), data.longitude())) {
            notes.add("Incident location updated: Lat " + data.latitude() + ", Long " + data.longitude());
        }
        if (projection.syncSeverity(data.severity())) {
            notes.add("Incident severity updated to: " + data.severity().trim());
        }
        if (projection.syncTitle(data.title())) {
            notes.add("Incident title updated to: " + data.title().trim());
        }
        // 메모 대상은 아니지만 projection은 최신으로 유지
        projection.syncType(data.type());
        projection.syncIncidentCode(data.incidentId());
        projection.fillCreatedByUserId(optionalUuid(data.createdByUserId()));
        projection.markSynced(event.timestamp());

        if (notes.isEmpty()) {
            log.info("No relevant changes for incident {}", incidentId);
            return;
        }

        // 배정 전이와 같은 지령 락으로 직렬화
        Optional<DispatchOrder> order = dispatchOrderRepository.findByIncidentIdWithLock(incidentId);
        if (order.isEmpty()) {
            log.info("No dispatch order for incident {}, skipping {} note(s)", incidentId, notes.size());
            return;
        }
        if (order.get().isTerminal()) {
            log.info("Dispatch order {} is {}, skipping notes", order.get().getId(), order.get().getStatus());
            return;
        }

        order.get().appendNotes(notes);
        log.info("Appended {} note(s) to dispatch order {} for incident {}",
                notes.size(), order.get().getId(), incidentId);
    }

    /** 선택 필드. 형식이 틀리면 버리고 계속 진행 */
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

    private static LocalDateTime parseReportedAt(String value) {
        if (!EventValidation.hasText(value)) {
            return LocalDateTime.now(ZoneOffset.UTC);
        }
        try {
            return OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException e) {
            log.warn("Unparseable reportedAt '{}', using current time", value);
            return LocalDateTime.now(ZoneOffset.UTC);
        }
    }
}
