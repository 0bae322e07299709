package com.rescuegrid.dispatch.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 배정(DispatchAssignment) 엔티티 - 유닛 1개를 출동 지령 1개에 묶는다.
 *
 * <p>불변식: 유닛당 비종료(non-terminal) 배정은 전체 지령을 통틀어 최대 1개.
 * 상태 전이 규칙은 {@link AssignmentStatus} 참고.</p>
 */
@Entity
@Table(name = "dispatch_assignments", indexes = {
        @Index(name = "idx_assignment_unit_status", columnList = "unit_id, status")  // 활성 배정 조회
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DispatchAssignment {

    @Id
    private UUID id;

    @Version
    private Long version;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "dispatch_order_id", nullable = false)
    private DispatchOrder dispatchOrder;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "unit_id", nullable = false)
    private Unit unit;

    @Column(nullable = false)
    private LocalDateTime assignedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AssignmentStatus status;

    @Builder
    public DispatchAssignment(DispatchOrder dispatchOrder, Unit unit) {
        this.id = UUID.randomUUID();
        this.dispatchOrder = dispatchOrder;
        this.unit = unit;
        this.assignedAt = LocalDateTime.now();
        this.status = AssignmentStatus.ASSIGNED;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** 전이 가능 여부는 호출자(DispatchService)가 먼저 검증한다 */
    public void changeStatus(AssignmentStatus status) {
        this.status = status;
    }
}
