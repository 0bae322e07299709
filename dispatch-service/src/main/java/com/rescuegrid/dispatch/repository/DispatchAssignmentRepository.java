package com.rescuegrid.dispatch.repository;

import com.rescuegrid.dispatch.entity.DispatchAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 배정 레포지토리.
 *
 * <p>"활성(active)" = 종료 상태(COMPLETED, CANCELLED, REPLACED)가 아닌 배정.</p>
 */
public interface DispatchAssignmentRepository extends JpaRepository<DispatchAssignment, UUID> {

    @Query("SELECT CASE WHEN COUNT(a) > 0 THEN true ELSE false END FROM DispatchAssignment a " +
            "WHERE a.unit.id = :unitId " +
            "AND a.status NOT IN (com.rescuegrid.dispatch.entity.AssignmentStatus.COMPLETED, " +
            "com.rescuegrid.dispatch.entity.AssignmentStatus.CANCELLED, " +
            "com.rescuegrid.dispatch.entity.AssignmentStatus.REPLACED)")
    boolean existsActiveByUnitId(@Param("unitId") UUID unitId);

    @Query("SELECT CASE WHEN COUNT(a) > 0 THEN true ELSE false END FROM DispatchAssignment a " +
            "WHERE a.unit.id = :unitId AND a.dispatchOrder.id = :orderId " +
            "AND a.status NOT IN (com.rescuegrid.dispatch.entity.AssignmentStatus.COMPLETED, " +
            "com.rescuegrid.dispatch.entity.AssignmentStatus.CANCELLED, " +
            "com.rescuegrid.dispatch.entity.AssignmentStatus.REPLACED)")
    boolean existsActiveByUnitIdAndOrderId(@Param("unitId") UUID unitId, @Param("orderId") UUID orderId);

    /** 배정 엔티티를 영속성 컨텍스트에 올리지 않고 지령 ID만 조회 (지령 락을 먼저 잡기 위해) */
    @Query("SELECT a.dispatchOrder.id FROM DispatchAssignment a WHERE a.id = :id")
    Optional<UUID> findOrderIdById(@Param("id") UUID assignmentId);

    List<DispatchAssignment> findByDispatchOrderIdOrderByAssignedAtAsc(UUID dispatchOrderId);
}
