package com.rescuegrid.dispatch.service;

import com.rescuegrid.common.exception.BusinessException;
import com.rescuegrid.common.exception.DataAccessErrors;
import com.rescuegrid.common.exception.ErrorCode;
import com.rescuegrid.dispatch.entity.Unit;
import com.rescuegrid.dispatch.entity.UnitStatus;
import com.rescuegrid.dispatch.entity.UnitType;
import com.rescuegrid.dispatch.repository.DispatchAssignmentRepository;
import com.rescuegrid.dispatch.repository.UnitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * 유닛 관리 서비스.
 *
 * <p>ASSIGNED / EN_ROUTE / ON_SITE는 배정 상태에서만 파생되므로 여기서 직접 설정할 수 없다.
 * 운영자가 바꿀 수 있는 것은 AVAILABLE ↔ UNAVAILABLE 토글과 위치뿐이다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class UnitService {

    private final UnitRepository unitRepository;
    private final DispatchAssignmentRepository assignmentRepository;

    @Transactional
    public Unit createUnit(String code, UnitType type, Double latitude, Double longitude) {
        if (code == null || code.isBlank() || type == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "code and type are required");
        }
        String normalizedCode = code.trim();
        try {
            if (unitRepository.existsByCode(normalizedCode)) {
                throw new BusinessException(ErrorCode.DUPLICATE_UNIT_CODE,
                        "Unit code already exists: " + normalizedCode);
            }

            Unit unit = Unit.builder()
                    .code(normalizedCode)
                    .type(type)
                    .latitude(latitude)
                    .longitude(longitude)
                    .build();
            unitRepository.saveAndFlush(unit);

            log.info("Unit created: id={}, code={}, type={}", unit.getId(), normalizedCode, type);
            return unit;
        } catch (DataIntegrityViolationException e) {
            throw new BusinessException(ErrorCode.DUPLICATE_UNIT_CODE,
                    "Unit code already exists: " + normalizedCode, e);
        } catch (RuntimeException e) {
            throw DataAccessErrors.translate(e);
        }
    }

    public Unit getUnit(UUID unitId) {
        return unitRepository.findById(unitId)
                .orElseThrow(() -> new BusinessException(ErrorCode.UNIT_NOT_FOUND));
    }

    /** code 오름차순. 필터가 null이면 무시 */
    public List<Unit> getUnits(UnitType type, UnitStatus status) {
        return unitRepository.search(type, status);
    }

    /**
     * 유닛 상태/위치 변경.
     *
     * @param status AVAILABLE 또는 UNAVAILABLE만 허용 (null이면 상태 유지)
     * @throws BusinessException UNIT_BUSY - 활성 배정이 있는 유닛의 상태를 바꾸려 할 때
     */
    @Transactional
    public Unit updateUnit(UUID unitId, UnitStatus status, Double latitude, Double longitude) {
        if (status != null && status != UnitStatus.AVAILABLE && status != UnitStatus.UNAVAILABLE) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Unit status can only be set to AVAILABLE or UNAVAILABLE (requested: " + status + ")");
        }
        try {
            Unit unit = unitRepository.findByIdWithLock(unitId)
                    .orElseThrow(() -> new BusinessException(ErrorCode.UNIT_NOT_FOUND));

            if (status != null && status != unit.getStatus()) {
                if (assignmentRepository.existsActiveByUnitId(unitId)) {
                    throw new BusinessException(ErrorCode.UNIT_BUSY,
                            "Unit " + unit.getCode() + " has an active assignment");
                }
                log.info("Unit {} status {} -> {}", unit.getCode(), unit.getStatus(), status);
                unit.changeStatus(status);
            }
            if (latitude != null && longitude != null) {
                unit.updateLocation(latitude, longitude);
            }
            unitRepository.flush();
            return unit;
        } catch (RuntimeException e) {
            throw DataAccessErrors.translate(e);
        }
    }
}
