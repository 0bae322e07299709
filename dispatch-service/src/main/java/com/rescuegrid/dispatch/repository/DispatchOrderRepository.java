package com.rescuegrid.dispatch.repository;

import com.rescuegrid.dispatch.entity.DispatchOrder;
import com.rescuegrid.dispatch.entity.DispatchStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DispatchOrderRepository extends JpaRepository<DispatchOrder, UUID> {

    /** 1사건 = 1지령이므로 Optional */
    Optional<DispatchOrder> findByIncidentId(UUID incidentId);

    boolean existsByIncidentId(UUID incidentId);

    /**
     * ★ 지령 단위 직렬화: SELECT ... FOR UPDATE.
     * 배정 생성/전이, 메모 추가, 취소는 모두 이 락을 먼저 잡고(유닛 락보다 먼저) 진행한다.
     * 같은 지령의 두 배정이 동시에 종료되어도 뒤의 트랜잭션이 앞의 커밋을 보고 완료 여부를 판단한다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM DispatchOrder o WHERE o.id = :id")
    Optional<DispatchOrder> findByIdWithLock(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM DispatchOrder o WHERE o.incidentId = :incidentId")
    Optional<DispatchOrder> findByIncidentIdWithLock(@Param("incidentId") UUID incidentId);

    List<DispatchOrder> findAllByOrderByCreatedAtDesc();

    List<DispatchOrder> findByStatusOrderByCreatedAtDesc(DispatchStatus status);
}
