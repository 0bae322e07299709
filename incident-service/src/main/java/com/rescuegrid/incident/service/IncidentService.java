package com.rescuegrid.incident.service;

import com.rescuegrid.common.event.EventTypes;
import com.rescuegrid.common.event.IncidentEventData;
import com.rescuegrid.common.exception.BusinessException;
import com.rescuegrid.common.exception.DataAccessErrors;
import com.rescuegrid.common.exception.ErrorCode;
import com.rescuegrid.incident.dto.CreateIncidentRequest;
import com.rescuegrid.incident.dto.UpdateIncidentRequest;
import com.rescuegrid.incident.entity.Incident;
import com.rescuegrid.incident.entity.IncidentStatus;
import com.rescuegrid.incident.event.IncidentChangedEvent;
import com.rescuegrid.incident.repository.IncidentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

/**
 * 사건 접수/수정 서비스.
 *
 * <h3>이벤트</h3>
 * <ul>
 *   <li>접수 → IncidentCreated</li>
 *   <li>수정(실제 변경이 있을 때만) → IncidentUpdated</li>
 *   <li>출동 진행에 따른 상태 상향 → IncidentUpdated</li>
 *   <li>삭제 → 없음</li>
 * </ul>
 * <p>이벤트는 커밋 후 {@code IncidentEventPublisher}가 비동기로 발행한다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class IncidentService {

    private static final int CODE_ATTEMPTS = 3;

    private final IncidentRepository incidentRepository;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public Incident createIncident(CreateIncidentRequest request) {
        if (request.title() == null || request.title().isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Title is required");
        }
        if (request.description() == null || request.description().isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Description is required");
        }
        if (request.latitude() == null || request.longitude() == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Latitude and longitude are required");
        }
        try {
            Incident incident = Incident.builder()
                    .incidentCode(uniqueCode())
                    .title(request.title().trim())
                    .description(request.description().trim())
                    .type(request.type())
                    .severity(request.severity())
                    .latitude(request.latitude())
                    .longitude(request.longitude())
                    .reporterName(request.reporterName())
                    .reporterContact(request.reporterContact())
                    .createdByUserId(request.createdByUserId())
                    .build();
            incidentRepository.saveAndFlush(incident);

            log.info("Incident created: id={}, code={}, type={}, severity={}",
                    incident.getId(), incident.getIncidentCode(), incident.getType(), incident.getSeverity());

            eventPublisher.publishEvent(new IncidentChangedEvent(EventTypes.INCIDENT_CREATED, toEventData(incident), Instant.now()));
            return incident;
        } catch (RuntimeException e) {
            throw DataAccessErrors.translate(e);
        }
    }

    @Transactional
    public Incident updateIncident(UUID incidentId, UpdateIncidentRequest request) {
        try {
            Incident incident = incidentRepository.findById(incidentId)
                    .orElseThrow(() -> new BusinessException(ErrorCode.INCIDENT_NOT_FOUND));

            boolean changed = incident.update(request.title(), request.description(), request.type(),
                    request.severity(), request.status(), request.latitude(), request.longitude(),
                    request.resolutionNotes());
            if (!changed) {
                log.debug("Incident {} update carried no changes", incidentId);
                return incident;
            }
            incidentRepository.flush();

            log.info("Incident updated: id={}, status={}", incidentId, incident.getStatus());
            eventPublisher.publishEvent(new IncidentChangedEvent(EventTypes.INCIDENT_UPDATED, toEventData(incident), Instant.now()));
            return incident;
        } catch (RuntimeException e) {
            throw DataAccessErrors.translate(e);
        }
    }

    /**
     * 출동 진행 반영. 앞으로만 진행하며 되돌리는 전이는 무시한다.
     *
     * @return 상태가 바뀌었으면 true
     */
    @Transactional
    public boolean applyDispatchProgress(UUID incidentId, IncidentStatus target) {
        try {
            Incident incident = incidentRepository.findById(incidentId)
                    .orElseThrow(() -> new BusinessException(ErrorCode.INCIDENT_NOT_FOUND));

            IncidentStatus previous = incident.getStatus();
            if (!incident.upgradeStatus(target)) {
                log.info("Incident {} already {} - ignoring upgrade to {}", incidentId, previous, target);
                return false;
            }
            incidentRepository.flush();

            log.info("Incident {} status {} -> {} from dispatch progress", incidentId, previous, target);
            eventPublisher.publishEvent(new IncidentChangedEvent(EventTypes.INCIDENT_UPDATED, toEventData(incident), Instant.now()));
            return true;
        } catch (RuntimeException e) {
            throw DataAccessErrors.translate(e);
        }
    }

    /**
     * 사건 삭제. 삭제는 이벤트를 내지 않으므로 다른 서비스의 사본(projection)은 남는다.
     *
     * @return 삭제된 사건
     */
    @Transactional
    public Incident deleteIncident(UUID incidentId) {
        try {
            Incident incident = incidentRepository.findById(incidentId)
                    .orElseThrow(() -> new BusinessException(ErrorCode.INCIDENT_NOT_FOUND));
            incidentRepository.delete(incident);
            incidentRepository.flush();

            log.info("Incident deleted: id={}, code={}", incidentId, incident.getIncidentCode());
            return incident;
        } catch (RuntimeException e) {
            throw DataAccessErrors.translate(e);
        }
    }

    public Incident getIncident(UUID incidentId) {
        return incidentRepository.findById(incidentId)
                .orElseThrow(() -> new BusinessException(ErrorCode.INCIDENT_NOT_FOUND));
    }

    public Incident getIncidentByCode(String incidentCode) {
        return incidentRepository.findByIncidentCode(incidentCode)
                .orElseThrow(() -> new BusinessException(ErrorCode.INCIDENT_NOT_FOUND));
    }

    /** 최신 접수순. status가 null이면 전체 */
    public List<Incident> getIncidents(IncidentStatus status) {
        return status == null
                ? incidentRepository.findAllByOrderByReportedAtDesc()
                : incidentRepository.findByStatusOrderByReportedAtDesc(status);
    }

    private String uniqueCode() {
        for (int attempt = 0; attempt < CODE_ATTEMPTS; attempt++) {
            String code = IncidentCodes.next();
            if (!incidentRepository.existsByIncidentCode(code)) {
                return code;
            }
        }
        throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Could not allocate a unique incident code");
    }

    static IncidentEventData toEventData(Incident incident) {
        return new IncidentEventData(
                incident.getId().toString(),
                incident.getIncidentCode(),
                incident.getTitle(),
                incident.getDescription(),
                incident.getType().name(),
                incident.getSeverity().name(),
                incident.getStatus().name(),
                incident.getLatitude(),
                incident.getLongitude(),
                incident.getReportedAt().atOffset(ZoneOffset.UTC).toString(),
                incident.getCreatedByUserId() != null ? incident.getCreatedByUserId().toString() : null);
    }
}
