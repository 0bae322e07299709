package com.rescuegrid.dispatch.repository;

import com.rescuegrid.dispatch.entity.Unit;
import com.rescuegrid.dispatch.entity.UnitStatus;
import com.rescuegrid.dispatch.entity.UnitType;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface UnitRepository extends JpaRepository<Unit, UUID> {

    boolean existsByCode(String code);

    /**
     * ★ 배정 독점의 핵심: SELECT ... FOR UPDATE.
     * 같은 유닛에 대한 동시 배정 요청은 이 행 락에서 직렬화되고,
     * 뒤에 온 트랜잭션은 앞 트랜잭션이 커밋한 배정을 보고 UNIT_BUSY로 거절된다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM Unit u WHERE u.id = :id")
    Optional<Unit> findByIdWithLock(@Param("id") UUID id);

    /** type/status 필터는 null이면 무시 */
    @Query("SELECT u FROM Unit u " +
            "WHERE (:type IS NULL OR u.type = :type) " +
            "AND (:status IS NULL OR u.status = :status) " +
            "ORDER BY u.code ASC")
    List<Unit> search(@Param("type") UnitType type, @Param("status") UnitStatus status);
}
