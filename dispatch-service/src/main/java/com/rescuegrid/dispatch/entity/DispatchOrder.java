package com.rescuegrid.dispatch.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * 출동 지령(DispatchOrder) 엔티티 - 사건 1건에 대한 작업 단위.
 *
 * <h3>핵심 필드 설명</h3>
 * <ul>
 *   <li>{@code incidentId} - 사건 UUID (unique 제약조건으로 1사건 = 1지령 보장)</li>
 *   <li>{@code status} - CREATED → IN_PROGRESS → COMPLETED (또는 CANCELLED), 앞으로만 진행</li>
 *   <li>{@code notes} - append-only 메모 목록. 별도 테이블이 아닌 JSON 배열 컬럼에 저장</li>
 *   <li>{@code assignments} - 이 지령에 묶인 배정들</li>
 * </ul>
 */
@Entity
@Table(name = "dispatch_orders", indexes = {
        @Index(name = "idx_dispatch_order_status", columnList = "status")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DispatchOrder {

    @Id
    private UUID id;

    @Version
    private Long version;

    @Column(nullable = false, unique = true)  // 1사건 = 1지령
    private UUID incidentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DispatchStatus status;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime completedAt;

    @Convert(converter = NotesConverter.class)
    @Column(name = "notes", columnDefinition = "text")
    private List<String> notes = new ArrayList<>();

    @OneToMany(mappedBy = "dispatchOrder", cascade = CascadeType.ALL)
    @OrderBy("assignedAt ASC")
    private List<DispatchAssignment> assignments = new ArrayList<>();

    @Builder
    public DispatchOrder(UUID incidentId, List<String> notes) {
        this.id = UUID.randomUUID();
        this.incidentId = incidentId;
        this.status = DispatchStatus.CREATED;
        this.createdAt = LocalDateTime.now();
        this.notes = notes != null ? new ArrayList<>(notes) : new ArrayList<>();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public List<String> getNotes() {
        return notes != null ? Collections.unmodifiableList(notes) : List.of();
    }

    /**
     * 메모 추가 (append-only). 기존 항목은 순서대로 유지된다.
     * 새 리스트로 교체해야 JSON 컬럼 변경이 dirty checking에 잡힌다.
     */
    public void appendNotes(List<String> newNotes) {
        List<String> updated = new ArrayList<>(notes != null ? notes : List.of());
        updated.addAll(newNotes);
        this.notes = updated;
    }

    public void addAssignment(DispatchAssignment assignment) {
        assignments.add(assignment);
    }

    /** 첫 배정 시 CREATED → IN_PROGRESS. 그 외 상태에서는 변화 없음 */
    public void markInProgress() {
        if (status == DispatchStatus.CREATED) {
            this.status = DispatchStatus.IN_PROGRESS;
        }
    }

    /**
     * 배정이 1개 이상이고 모두 종료 상태이면 COMPLETED로 전이하고 완료 시각을 기록한다.
     * CANCELLED 지령은 건드리지 않는다.
     *
     * @return 이번 호출로 COMPLETED가 되었으면 true
     */
    public boolean completeIfAllAssignmentsTerminal() {
        if (status == DispatchStatus.CANCELLED || status == DispatchStatus.COMPLETED) {
            return false;
        }
        if (assignments.isEmpty() || !assignments.stream().allMatch(DispatchAssignment::isTerminal)) {
            return false;
        }
        this.status = DispatchStatus.COMPLETED;
        this.completedAt = LocalDateTime.now();
        return true;
    }

    public void cancel() {
        this.status = DispatchStatus.CANCELLED;
        this.completedAt = LocalDateTime.now();
    }
}
