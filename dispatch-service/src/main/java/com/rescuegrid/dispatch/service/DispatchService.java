package com.rescuegrid.dispatch.service;

import com.rescuegrid.common.event.DispatchEventData;
import com.rescuegrid.common.event.EventTypes;
import com.rescuegrid.common.exception.BusinessException;
import com.rescuegrid.common.exception.DataAccessErrors;
import com.rescuegrid.common.exception.ErrorCode;
import com.rescuegrid.dispatch.entity.AssignmentStatus;
import com.rescuegrid.dispatch.entity.DispatchAssignment;
import com.rescuegrid.dispatch.entity.DispatchOrder;
import com.rescuegrid.dispatch.entity.DispatchStatus;
import com.rescuegrid.dispatch.entity.IncidentProjection;
import com.rescuegrid.dispatch.entity.Unit;
import com.rescuegrid.dispatch.event.DispatchLifecycleEvent;
import com.rescuegrid.dispatch.repository.DispatchAssignmentRepository;
import com.rescuegrid.dispatch.repository.DispatchOrderRepository;
import com.rescuegrid.dispatch.repository.IncidentProjectionRepository;
import com.rescuegrid.dispatch.repository.UnitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * 출동 라이프사이클 엔진 (Dispatch Lifecycle Engine)
 *
 * <p>출동 지령 생성, 유닛 배정, 배정 상태 전이, 지령 완료를 검증하고 적용한다.
 * 각 명령은 하나의 트랜잭션이며, 실패는 모두 {@link BusinessException}으로 나간다.</p>
 *
 * <h3>배정 생성 검증 순서</h3>
 * <ol>
 *   <li>지령 존재 (DISPATCH_ORDER_NOT_FOUND) / 종료 상태 아님 (DISPATCH_ORDER_NOT_ACTIVE) - ★ 지령 행 락</li>
 *   <li>유닛 존재 (UNIT_NOT_FOUND) - ★ 여기서 유닛 행에 PESSIMISTIC_WRITE 락</li>
 *   <li>같은 지령에 이미 활성 배정 (DUPLICATE_ASSIGNMENT)</li>
 *   <li>다른 지령에 활성 배정 (UNIT_BUSY)</li>
 *   <li>유닛 상태 AVAILABLE (UNIT_UNAVAILABLE)</li>
 * </ol>
 *
 * <h3>★ 동시성</h3>
 * <p>활성 배정 확인과 배정 INSERT는 유닛 행 락을 쥔 같은 트랜잭션 안에서 일어난다.
 * 같은 유닛에 대한 두 요청이 겹치면 뒤의 요청은 락을 기다렸다가 먼저 커밋된 배정을 보고 UNIT_BUSY가 된다.
 * 락 획득 실패나 버전 충돌도 UNIT_BUSY로 변환한다.</p>
 * <p>지령을 바꾸는 명령(배정 생성/전이, 메모, 취소)은 지령 행 락을 먼저, 유닛 행 락을 나중에 잡는다.
 * 락 순서가 항상 같으므로 교착이 없고, 지령 완료 판단은 같은 지령의 다른 전이가 커밋된 뒤에 이루어진다.</p>
 *
 * <h3>이벤트</h3>
 * <p>상태 변경과 함께 {@link DispatchLifecycleEvent}를 등록하고, 커밋 후 비동기로 발행된다.
 * 발행 실패는 이 트랜잭션에 영향을 주지 않는다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DispatchService {

    private final DispatchOrderRepository dispatchOrderRepository;
    private final DispatchAssignmentRepository assignmentRepository;
    private final UnitRepository unitRepository;
    private final IncidentProjectionRepository incidentProjectionRepository;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * 출동 지령 생성. 사건당 1개.
     *
     * @param incidentId 사건 UUID
     * @param notes      초기 메모 (null 가능)
     */
    @Transactional
    public DispatchOrder createOrder(UUID incidentId, List<String> notes) {
        if (incidentId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "incidentId is required");
        }
        try {
            if (dispatchOrderRepository.existsByIncidentId(incidentId)) {
                throw new BusinessException(ErrorCode.DUPLICATE_DISPATCH_ORDER);
            }

            DispatchOrder order = DispatchOrder.builder()
                    .incidentId(incidentId)
                    .notes(nonBlank(notes))
                    .build();
            // unique(incident_id) 위반을 여기서 드러내기 위해 즉시 flush
            dispatchOrderRepository.saveAndFlush(order);

            log.info("Dispatch order created: orderId={}, incidentId={}", order.getId(), incidentId);

            eventPublisher.publishEvent(new DispatchLifecycleEvent(EventTypes.DISPATCH_ORDER_CREATED,
                    DispatchEventData.forOrder(order.getId().toString(), incidentId.toString(),
                            creatorOf(incidentId))));
            return order;
        } catch (DataIntegrityViolationException e) {
            // 동시 생성 경합: 다른 트랜잭션이 먼저 같은 사건의 지령을 넣음
            throw new BusinessException(ErrorCode.DUPLICATE_DISPATCH_ORDER, ErrorCode.DUPLICATE_DISPATCH_ORDER.getMessage(), e);
        } catch (RuntimeException e) {
            throw DataAccessErrors.translate(e);
        }
    }

    /**
     * 유닛을 지령에 배정한다.
     *
     * <p>성공 시: 배정 ASSIGNED, 유닛 ASSIGNED, 지령이 CREATED였다면 IN_PROGRESS.</p>
     */
    @Transactional
    public DispatchAssignment createAssignment(UUID orderId, UUID unitId) {
        if (orderId == null || unitId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "orderId and unitId are required");
        }
        try {
            DispatchOrder order = dispatchOrderRepository.findByIdWithLock(orderId)
                    .orElseThrow(() -> new BusinessException(ErrorCode.DISPATCH_ORDER_NOT_FOUND));
            if (order.isTerminal()) {
                throw new BusinessException(ErrorCode.DISPATCH_ORDER_NOT_ACTIVE,
                        "Cannot assign units to a " + order.getStatus() + " dispatch order");
            }

            // ★ SELECT ... FOR UPDATE: 같은 유닛에 대한 배정 요청을 직렬화
            Unit unit = unitRepository.findByIdWithLock(unitId)
                    .orElseThrow(() -> new BusinessException(ErrorCode.UNIT_NOT_FOUND));

            if (assignmentRepository.existsActiveByUnitIdAndOrderId(unitId, orderId)) {
                throw new BusinessException(ErrorCode.DUPLICATE_ASSIGNMENT);
            }
            if (assignmentRepository.existsActiveByUnitId(unitId)) {
                throw new BusinessException(ErrorCode.UNIT_BUSY);
            }
            if (!unit.isAvailable()) {
                throw new BusinessException(ErrorCode.UNIT_UNAVAILABLE,
                        "Unit must be AVAILABLE to be assigned (current: " + unit.getStatus() + ")");
            }

            DispatchAssignment assignment = DispatchAssignment.builder()
                    .dispatchOrder(order)
                    .unit(unit)
                    .build();
            order.addAssignment(assignment);
            unit.changeStatus(AssignmentStatus.ASSIGNED.toUnitStatus());
            order.markInProgress();
            assignmentRepository.saveAndFlush(assignment);

            log.info("Unit assigned: unit={}, orderId={}, assignmentId={}",
                    unit.getCode(), orderId, assignment.getId());

            eventPublisher.publishEvent(new DispatchLifecycleEvent(EventTypes.DISPATCH_ASSIGNMENT_CREATED,
                    DispatchEventData.forAssignment(assignment.getId().toString(), orderId.toString(),
                            order.getIncidentId().toString(), creatorOf(order.getIncidentId()),
                            AssignmentStatus.ASSIGNED.wireCode())));
            return assignment;
        } catch (ConcurrencyFailureException e) {
            log.warn("Concurrent assignment rejected: unitId={}, orderId={}", unitId, orderId);
            throw new BusinessException(ErrorCode.UNIT_BUSY, ErrorCode.UNIT_BUSY.getMessage(), e);
        } catch (RuntimeException e) {
            throw DataAccessErrors.translate(e);
        }
    }

    /**
     * 배정 상태 전이.
     *
     * <p>유닛 상태를 배정 상태에서 파생시키고, 지령의 모든 배정이 종료되면 지령을 COMPLETED로 만든다.
     * COMPLETED 전이 시 DispatchAssignmentCompleted, 지령 완료 시 DispatchOrderCompleted 발행.</p>
     */
    @Transactional
    public DispatchAssignment transitionAssignment(UUID assignmentId, AssignmentStatus newStatus) {
        if (assignmentId == null || newStatus == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "assignmentId and status are required");
        }
        try {
            UUID orderId = assignmentRepository.findOrderIdById(assignmentId)
                    .orElseThrow(() -> new BusinessException(ErrorCode.ASSIGNMENT_NOT_FOUND));
            // 지령 락을 잡은 뒤에 배정을 읽어야 같은 지령의 동시 전이 결과가 보인다
            DispatchOrder order = dispatchOrderRepository.findByIdWithLock(orderId)
                    .orElseThrow(() -> new BusinessException(ErrorCode.DISPATCH_ORDER_NOT_FOUND));
            DispatchAssignment assignment = assignmentRepository.findById(assignmentId)
                    .orElseThrow(() -> new BusinessException(ErrorCode.ASSIGNMENT_NOT_FOUND));
            if (order.isTerminal()) {
                throw new BusinessException(ErrorCode.DISPATCH_ORDER_NOT_ACTIVE,
                        "Cannot update assignment when dispatch order is " + order.getStatus());
            }

            AssignmentStatus current = assignment.getStatus();
            if (!current.canTransitionTo(newStatus)) {
                throw new BusinessException(ErrorCode.INVALID_ASSIGNMENT_TRANSITION,
                        "Cannot transition assignment from " + current + " to " + newStatus
                                + " (allowed: " + current.allowedNext() + ")");
            }

            Unit unit = unitRepository.findByIdWithLock(assignment.getUnit().getId())
                    .orElseThrow(() -> new BusinessException(ErrorCode.UNIT_NOT_FOUND));

            assignment.changeStatus(newStatus);
            unit.changeStatus(newStatus.toUnitStatus());
            boolean orderCompleted = order.completeIfAllAssignmentsTerminal();
            assignmentRepository.flush();

            log.info("Assignment {} transitioned {} -> {} (unit {} now {})",
                    assignmentId, current, newStatus, unit.getCode(), unit.getStatus());

            String incidentId = order.getIncidentId().toString();
            String creator = creatorOf(order.getIncidentId());
            if (newStatus == AssignmentStatus.COMPLETED) {
                eventPublisher.publishEvent(new DispatchLifecycleEvent(EventTypes.DISPATCH_ASSIGNMENT_COMPLETED,
                        DispatchEventData.forAssignment(assignmentId.toString(), order.getId().toString(),
                                incidentId, creator, AssignmentStatus.COMPLETED.wireCode())));
            }
            if (orderCompleted) {
                log.info("Dispatch order completed: orderId={}", order.getId());
                eventPublisher.publishEvent(new DispatchLifecycleEvent(EventTypes.DISPATCH_ORDER_COMPLETED,
                        DispatchEventData.forOrder(order.getId().toString(), incidentId, creator)));
            }
            return assignment;
        } catch (ConcurrencyFailureException e) {
            log.warn("Concurrent update on assignment {}: {}", assignmentId, e.getMessage());
            throw new BusinessException(ErrorCode.UNIT_BUSY, ErrorCode.UNIT_BUSY.getMessage(), e);
        } catch (RuntimeException e) {
            throw DataAccessErrors.translate(e);
        }
    }

    /**
     * 메모 추가 (append-only). 공백 항목은 무시한다.
     * COMPLETED/CANCELLED 지령에는 DISPATCH_ORDER_NOT_ACTIVE.
     */
    @Transactional
    public DispatchOrder appendOrderNotes(UUID orderId, List<String> notes) {
        try {
            DispatchOrder order = dispatchOrderRepository.findByIdWithLock(orderId)
                    .orElseThrow(() -> new BusinessException(ErrorCode.DISPATCH_ORDER_NOT_FOUND));
            if (order.isTerminal()) {
                throw new BusinessException(ErrorCode.DISPATCH_ORDER_NOT_ACTIVE,
                        "Cannot add notes to a " + order.getStatus() + " dispatch order");
            }

            List<String> additions = nonBlank(notes);
            if (!additions.isEmpty()) {
                order.appendNotes(additions);
                dispatchOrderRepository.flush();
                log.info("Appended {} note(s) to dispatch order {}", additions.size(), orderId);
            }
            return order;
        } catch (RuntimeException e) {
            throw DataAccessErrors.translate(e);
        }
    }

    /**
     * 지령 취소. 활성 배정은 CANCELLED, 해당 유닛은 AVAILABLE로 돌아간다.
     * 취소된 지령은 이후 배정이 모두 종료되어도 COMPLETED가 되지 않는다.
     */
    @Transactional
    public DispatchOrder cancelOrder(UUID orderId) {
        try {
            DispatchOrder order = dispatchOrderRepository.findByIdWithLock(orderId)
                    .orElseThrow(() -> new BusinessException(ErrorCode.DISPATCH_ORDER_NOT_FOUND));
            if (order.isTerminal()) {
                throw new BusinessException(ErrorCode.DISPATCH_ORDER_NOT_ACTIVE,
                        "Dispatch order is already " + order.getStatus());
            }

            for (DispatchAssignment assignment : order.getAssignments()) {
                if (!assignment.isTerminal()) {
                    Unit unit = unitRepository.findByIdWithLock(assignment.getUnit().getId())
                            .orElseThrow(() -> new BusinessException(ErrorCode.UNIT_NOT_FOUND));
                    assignment.changeStatus(AssignmentStatus.CANCELLED);
                    unit.changeStatus(AssignmentStatus.CANCELLED.toUnitStatus());
                }
            }
            order.cancel();
            dispatchOrderRepository.flush();

            log.info("Dispatch order cancelled: orderId={}", orderId);
            return order;
        } catch (ConcurrencyFailureException e) {
            throw new BusinessException(ErrorCode.UNIT_BUSY, ErrorCode.UNIT_BUSY.getMessage(), e);
        } catch (RuntimeException e) {
            throw DataAccessErrors.translate(e);
        }
    }

    public DispatchOrder getOrder(UUID orderId) {
        return dispatchOrderRepository.findById(orderId)
                .orElseThrow(() -> new BusinessException(ErrorCode.DISPATCH_ORDER_NOT_FOUND));
    }

    public DispatchOrder getOrderByIncident(UUID incidentId) {
        return dispatchOrderRepository.findByIncidentId(incidentId)
                .orElseThrow(() -> new BusinessException(ErrorCode.DISPATCH_ORDER_NOT_FOUND));
    }

    /** 최신순. status가 null이면 전체 */
    public List<DispatchOrder> getOrders(DispatchStatus status) {
        return status == null
                ? dispatchOrderRepository.findAllByOrderByCreatedAtDesc()
                : dispatchOrderRepository.findByStatusOrderByCreatedAtDesc(status);
    }

    public DispatchAssignment getAssignment(UUID assignmentId) {
        return assignmentRepository.findById(assignmentId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ASSIGNMENT_NOT_FOUND));
    }

    public List<DispatchAssignment> getAssignments(UUID orderId) {
        return assignmentRepository.findByDispatchOrderIdOrderByAssignedAtAsc(orderId);
    }

    /** 사건 projection에서 신고자 ID 조회. 모르면 null */
    private String creatorOf(UUID incidentId) {
        return incidentProjectionRepository.findById(incidentId)
                .map(IncidentProjection::getCreatedByUserId)
                .map(UUID::toString)
                .orElse(null);
    }

    private static List<String> nonBlank(List<String> notes) {
        if (notes == null) {
            return List.of();
        }
        return notes.stream()
                .filter(note -> note != null && !note.isBlank())
                .map(String::trim)
                .toList();
    }
}
