package com.rescuegrid.dispatch.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * 유닛(Unit) 엔티티 - 출동 가능한 자원 (구급차, 소방차, 경찰 등).
 *
 * <h3>핵심 필드 설명</h3>
 * <ul>
 *   <li>{@code code} - 사람이 읽는 호출 부호 (AMB-01, FIRE-03). unique</li>
 *   <li>{@code status} - 활성 배정에서 파생. 한 유닛은 동시에 최대 1개의 활성 배정만 가진다</li>
 *   <li>{@code version} - Optimistic Lock (@Version)</li>
 * </ul>
 *
 * <h3>★ 배정 독점 보장</h3>
 * <p>배정 생성 시 {@code UnitRepository.findByIdWithLock()}으로 이 행에 SELECT ... FOR UPDATE를 걸고,
 * 같은 트랜잭션 안에서 활성 배정 존재 여부를 확인한 뒤 배정을 INSERT한다.
 * 같은 유닛에 대한 동시 요청은 행 락에서 직렬화되어 하나만 성공한다.</p>
 */
@Entity
@Table(name = "units", indexes = {
        @Index(name = "idx_unit_status", columnList = "status")  // 상태별 조회
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)  // JPA 프록시 생성용
public class Unit {

    @Id
    private UUID id;

    @Version
    private Long version;

    @Column(nullable = false, unique = true, length = 32)
    private String code;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UnitType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UnitStatus status;

    private Double latitude;   // 마지막 위치 (선택)
    private Double longitude;

    @Builder
    public Unit(String code, UnitType type, Double latitude, Double longitude) {
        this.id = UUID.randomUUID();
        this.code = code;
        this.type = type;
        this.latitude = latitude;
        this.longitude = longitude;
        this.status = UnitStatus.AVAILABLE;  // 초기 상태: 출동 가능
    }

    public boolean isAvailable() {
        return status == UnitStatus.AVAILABLE;
    }

    public void changeStatus(UnitStatus status) {
        this.status = status;
    }

    public void updateLocation(Double latitude, Double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
    }
}
